package ca.gc.cra.flowstart.application.port;

import java.io.IOException;

/**
 * <strong>What:</strong> Append-only byte sink receiving serialized event records.
 * <p><strong>Why:</strong> Keeps output modules independent of the transport (file, unix socket, Kafka).</p>
 * <p><strong>Role:</strong> Outbound port shared by every worker thread of one or more output modules.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Persist or transmit one record per {@link #write(byte[], int, int)} call.</li>
 *   <li>Serialize concurrent writers internally; callers never lock around a sink.</li>
 *   <li>Release the underlying resource on {@link #close()}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent writes.</p>
 * <p><strong>Performance:</strong> Writes are synchronous; keep critical sections to the copy into the
 * transport.</p>
 * <p><strong>Observability:</strong> Implementations log open/close outcomes; write failures surface as
 * {@link IOException}.</p>
 *
 * @since 0.1.0
 */
public interface LogSink extends AutoCloseable {
  /**
   * Writes a single record. The slice must not be retained after the call returns.
   *
   * @param buffer source array
   * @param offset first byte of the record
   * @param length record length in bytes
   * @throws IOException if the transport rejects the write
   */
  void write(byte[] buffer, int offset, int length) throws IOException;

  /**
   * Indicates whether records must be terminated with a newline before being handed to
   * {@link #write(byte[], int, int)}.
   *
   * @return {@code true} for stream transports (files, sockets)
   */
  default boolean newlineDelimited() {
    return true;
  }

  /**
   * Reopens the underlying resource, typically after external log rotation.
   *
   * @throws IOException if the resource cannot be reopened
   */
  default void reopen() throws IOException {}

  /**
   * Returns a short description used in logs (path, socket or topic).
   *
   * @return sink description
   */
  String describe();

  /**
   * Closes the sink. Called once by the owning context.
   *
   * @throws IOException if pending data cannot be flushed
   */
  @Override
  void close() throws IOException;
}
