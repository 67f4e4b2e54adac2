package ca.gc.cra.flowstart.domain.event;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class EventRecordTest {

  @Test
  void keepsInsertionOrderAndReplacesInPlace() {
    EventRecord record = new EventRecord().put("b", 1L).put("a", "x").put("b", 2L);

    assertEquals(List.of("b", "a"), List.copyOf(record.fields().keySet()));
    assertEquals(2L, record.get("b"));
  }

  @Test
  void clearEmptiesNestedRecords() {
    EventRecord nested = new EventRecord().put("syn", true);
    EventRecord record = new EventRecord().put("tcp", nested);

    record.clear();

    assertTrue(record.isEmpty());
    assertTrue(nested.isEmpty());
  }

  @Test
  void rejectsNullValues() {
    EventRecord record = new EventRecord();
    assertThrows(NullPointerException.class, () -> record.put("a", (String) null));
    assertThrows(UnsupportedOperationException.class, () -> record.fields().clear());
  }
}
