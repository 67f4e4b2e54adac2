package ca.gc.cra.flowstart.domain.event;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Ephemeral, ordered JSON event under construction.
 * <p>Built fresh for each triggering packet and cleared once written. Not thread-safe; a record never
 * leaves the worker thread that built it.</p>
 *
 * <p>Values are restricted to {@link String}, {@link Long}, {@link Boolean} and
 * nested {@code EventRecord}s.</p>
 *
 * @since 0.1.0
 */
public final class EventRecord {
  private final Map<String, Object> fields = new LinkedHashMap<>();

  /**
   * Sets a string field, replacing any prior value while keeping its position.
   *
   * @param name field name
   * @param value field value; {@code null} is rejected
   * @return this record
   */
  public EventRecord put(String name, String value) {
    return putValue(name, Objects.requireNonNull(value, "value"));
  }

  /**
   * Sets an integral field.
   *
   * @param name field name
   * @param value field value
   * @return this record
   */
  public EventRecord put(String name, long value) {
    return putValue(name, value);
  }

  /**
   * Sets a boolean field.
   *
   * @param name field name
   * @param value field value
   * @return this record
   */
  public EventRecord put(String name, boolean value) {
    return putValue(name, value);
  }

  /**
   * Sets a nested object field.
   *
   * @param name field name
   * @param value nested record
   * @return this record
   */
  public EventRecord put(String name, EventRecord value) {
    return putValue(name, Objects.requireNonNull(value, "value"));
  }

  private EventRecord putValue(String name, Object value) {
    fields.put(Objects.requireNonNull(name, "name"), value);
    return this;
  }

  /**
   * Returns the value of a field.
   *
   * @param name field name
   * @return value or {@code null} when absent
   */
  public Object get(String name) {
    return fields.get(name);
  }

  /**
   * Returns an unmodifiable, insertion-ordered view of the fields.
   *
   * @return field view
   */
  public Map<String, Object> fields() {
    return Collections.unmodifiableMap(fields);
  }

  /** @return {@code true} when no field is set */
  public boolean isEmpty() {
    return fields.isEmpty();
  }

  /**
   * Drops all fields, recursively clearing nested records.
   */
  public void clear() {
    for (Object value : fields.values()) {
      if (value instanceof EventRecord nested) {
        nested.clear();
      }
    }
    fields.clear();
  }

  @Override
  public String toString() {
    return "EventRecord" + fields;
  }
}
