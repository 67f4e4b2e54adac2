package ca.gc.cra.flowstart.application.output;

import ca.gc.cra.flowstart.application.port.LogSink;
import ca.gc.cra.flowstart.application.port.LogSinkFactory;
import ca.gc.cra.flowstart.config.OutputConfig;
import ca.gc.cra.flowstart.config.SinkConfig;
import java.io.IOException;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parent multiplexing JSON output ({@code eve-log}). Owns one sink that every sub-module borrows.
 * <p>Closed by the host after all of its sub-module contexts.</p>
 *
 * @since 0.1.0
 */
public final class JsonOutputContext implements AutoCloseable {
  /** Configuration name of the parent output. */
  public static final String CONF_NAME = "eve-log";
  /** Default filename of the parent output. */
  public static final String DEFAULT_FILENAME = "eve.json";

  private static final Logger log = LoggerFactory.getLogger(JsonOutputContext.class);

  private final String name;
  private final LogSink sink;
  private final AtomicBoolean closed = new AtomicBoolean();

  /**
   * Wraps an already opened sink.
   *
   * @param name output name
   * @param sink sink owned by this context
   */
  public JsonOutputContext(String name, LogSink sink) {
    this.name = Objects.requireNonNull(name, "name");
    this.sink = Objects.requireNonNull(sink, "sink");
  }

  /**
   * Opens the parent output described by {@code conf}.
   *
   * @param conf {@code eve-log} section
   * @param sinks sink factory
   * @return parent context owning a new sink
   * @throws OutputInitException if the sink options are invalid or the sink cannot be opened
   */
  public static JsonOutputContext open(OutputConfig conf, LogSinkFactory sinks) throws OutputInitException {
    Objects.requireNonNull(conf, "conf");
    Objects.requireNonNull(sinks, "sinks");
    SinkConfig sinkConfig;
    try {
      sinkConfig = SinkConfig.from(conf);
    } catch (IllegalArgumentException ex) {
      throw new OutputInitException("Invalid sink options for " + conf.name(), ex);
    }
    LogSink sink = sinks.open(sinkConfig, DEFAULT_FILENAME);
    log.info("{} output writing to {}", conf.name(), sink.describe());
    return new JsonOutputContext(conf.name(), sink);
  }

  /** @return output name */
  public String name() {
    return name;
  }

  /** @return sink shared with sub-modules */
  public LogSink sink() {
    return sink;
  }

  /**
   * Reopens the shared sink after external log rotation; a closed context is skipped.
   *
   * @throws IOException if the sink cannot be reopened
   */
  public void reopen() throws IOException {
    if (!closed.get()) {
      log.debug("Reopening {} sink {}", name, sink.describe());
      sink.reopen();
    }
  }

  /**
   * Closes the shared sink once.
   *
   * @throws IOException if the sink fails to close
   */
  @Override
  public void close() throws IOException {
    if (closed.compareAndSet(false, true)) {
      log.debug("Closing {} sink {}", name, sink.describe());
      sink.close();
    }
  }
}
