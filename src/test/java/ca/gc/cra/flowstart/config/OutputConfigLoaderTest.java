package ca.gc.cra.flowstart.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class OutputConfigLoaderTest {

  @TempDir Path tempDir;

  @Test
  void loadTypesOutputsAndTheirOptions() throws IOException {
    Path yaml = tempDir.resolve("flowstart.yaml");
    Files.writeString(yaml, """
        default-log-dir: /srv/logs
        logging:
          verbose: yes
        engine:
          mode: ips
        outputs:
          - eve-log:
              enabled: yes
              filetype: regular
              filename: eve.json
              types:
                - alert
                - flow_start:
                    enabled: no
          - flow_start-json-log:
              filetype: kafka
              kafka:
                bootstrap-servers: broker:9092
                topic: flows
          - fast-log
        """);

    OutputsConfig config = OutputConfigLoader.load(yaml);

    assertEquals(Path.of("/srv/logs"), config.defaultLogDir());
    assertEquals(EngineMode.IPS, config.engineMode());
    assertTrue(config.verboseLogging());
    assertEquals(3, config.outputs().size());

    OutputConfig eve = config.outputs().get(0);
    assertEquals("eve-log", eve.name());
    assertTrue(eve.enabled());
    assertEquals("eve.json", eve.get("filename"));
    assertEquals(List.of("alert", "flow_start"), eve.types().stream().map(OutputConfig::name).toList());
    assertFalse(eve.types().get(1).enabled());

    OutputConfig standalone = config.outputs().get(1);
    assertEquals("broker:9092", standalone.get("kafka.bootstrap-servers"));
    SinkConfig sink = SinkConfig.from(standalone);
    assertEquals(SinkType.KAFKA, sink.type());
    assertEquals("flows", sink.kafkaTopic());

    assertEquals("fast-log", config.outputs().get(2).name());
  }

  @Test
  void emptyDocumentYieldsDefaults() {
    OutputsConfig config = OutputConfigLoader.parse("");

    assertEquals(OutputsConfig.DEFAULT_LOG_DIR, config.defaultLogDir());
    assertEquals(EngineMode.IDS, config.engineMode());
    assertTrue(config.outputs().isEmpty());
    assertFalse(config.verboseLogging());
  }

  @Test
  void outputsMustBeAList() {
    assertThrows(IllegalArgumentException.class, () -> OutputConfigLoader.parse("""
        outputs:
          eve-log:
            filename: eve.json
        """));
  }

  @Test
  void outputEntriesNeedExactlyOneKey() {
    assertThrows(IllegalArgumentException.class, () -> OutputConfigLoader.parse("""
        outputs:
          - eve-log: {}
            flow_start-json-log: {}
        """));
  }

  @Test
  void listsOutsideTypesAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> OutputConfigLoader.parse("""
        outputs:
          - flow_start-json-log:
              filename: [a, b]
        """));
  }

  @Test
  void malformedYamlIsWrapped() {
    assertThrows(IllegalArgumentException.class, () -> OutputConfigLoader.parse("outputs: [unclosed"));
  }

  @Test
  void unknownEngineModeIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> OutputConfigLoader.parse("""
        engine:
          mode: turbo
        """));
  }

  @Test
  void missingFileFails() {
    assertThrows(IOException.class, () -> OutputConfigLoader.load(tempDir.resolve("absent.yaml")));
  }
}
