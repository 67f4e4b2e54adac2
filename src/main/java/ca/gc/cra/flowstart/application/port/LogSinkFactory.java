package ca.gc.cra.flowstart.application.port;

import ca.gc.cra.flowstart.application.output.OutputInitException;
import ca.gc.cra.flowstart.config.SinkConfig;

/**
 * <strong>What:</strong> Opens sinks from typed sink options.
 * <p><strong>Role:</strong> Used by owning output contexts at startup; never on the packet path.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface LogSinkFactory {
  /**
   * Opens a new sink.
   *
   * @param config sink options
   * @param defaultFilename filename used when the options name none
   * @return open sink owned by the caller
   * @throws OutputInitException if the sink cannot be created or opened
   */
  LogSink open(SinkConfig config, String defaultFilename) throws OutputInitException;
}
