package ca.gc.cra.flowstart.infrastructure.json;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class JsonSupportTest {

  @Test
  void jacksonIsDetectedOnClasspath() {
    assertTrue(JsonSupport.isAvailable());
  }

  @Test
  void missingGeneratorIsReportedUnavailable() {
    assertFalse(JsonSupport.isLoadable("com.example.missing.JsonFactory", getClass().getClassLoader()));
  }
}
