package ca.gc.cra.flowstart.infrastructure.json;

import ca.gc.cra.flowstart.application.port.EventRecordWriter;
import ca.gc.cra.flowstart.application.port.LogSink;
import ca.gc.cra.flowstart.domain.event.EventRecord;
import ca.gc.cra.flowstart.infrastructure.buffer.MemBuffer;
import com.fasterxml.jackson.core.JsonEncoding;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.json.JsonWriteFeature;
import java.io.IOException;
import java.util.Map;

/**
 * Serializes event records as compact, ASCII-escaped JSON into the caller's scratch buffer, then hands
 * the buffer to the sink in a single write. Stream sinks get a trailing newline.
 * <p>Thread-safe: the {@link JsonFactory} is shared, generators are per call.</p>
 */
public final class JsonRecordWriter implements EventRecordWriter {
  private final JsonFactory jsonFactory;

  /**
   * Creates a writer with the default JSON factory settings.
   */
  public JsonRecordWriter() {
    this.jsonFactory = JsonFactory.builder()
        .enable(JsonWriteFeature.ESCAPE_NON_ASCII)
        .build();
  }

  @Override
  public void write(EventRecord record, MemBuffer buffer, LogSink sink) throws IOException {
    try (JsonGenerator gen = jsonFactory.createGenerator(buffer.asOutputStream(), JsonEncoding.UTF8)) {
      writeObject(gen, record);
    }
    if (sink.newlineDelimited()) {
      buffer.write((byte) '\n');
    }
    sink.write(buffer.array(), 0, buffer.length());
  }

  private static void writeObject(JsonGenerator gen, EventRecord record) throws IOException {
    gen.writeStartObject();
    for (Map.Entry<String, Object> field : record.fields().entrySet()) {
      gen.writeFieldName(field.getKey());
      Object value = field.getValue();
      if (value instanceof String text) {
        gen.writeString(text);
      } else if (value instanceof Long number) {
        gen.writeNumber(number);
      } else if (value instanceof Boolean flag) {
        gen.writeBoolean(flag);
      } else if (value instanceof EventRecord nested) {
        writeObject(gen, nested);
      } else {
        throw new IOException("Unsupported value type for field " + field.getKey() + ": " + value);
      }
    }
    gen.writeEndObject();
  }
}
