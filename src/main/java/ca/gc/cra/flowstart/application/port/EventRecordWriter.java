package ca.gc.cra.flowstart.application.port;

import ca.gc.cra.flowstart.domain.event.EventRecord;
import ca.gc.cra.flowstart.infrastructure.buffer.MemBuffer;
import java.io.IOException;

/**
 * <strong>What:</strong> Serializes an event record through a scratch buffer into a sink.
 * <p><strong>Role:</strong> Implemented by the JSON writer; shared by all output modules.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be stateless or thread-safe; the buffer is owned by
 * the calling worker.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface EventRecordWriter {
  /**
   * Appends the serialized record to {@code buffer} and hands the buffered bytes to {@code sink}.
   *
   * @param record record to serialize
   * @param buffer caller-owned scratch buffer; callers reset it beforehand
   * @param sink destination
   * @throws IOException if serialization or the sink write fails
   */
  void write(EventRecord record, MemBuffer buffer, LogSink sink) throws IOException;
}
