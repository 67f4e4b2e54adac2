package ca.gc.cra.flowstart.application.output;

import ca.gc.cra.flowstart.application.port.LogSink;
import java.io.IOException;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Per-module output context holding the sink every worker writes to.
 * <p><strong>Why:</strong> Standalone and nested deployments differ only in who owns the sink; one type with
 * an ownership tag keeps construction and teardown on a single code path.</p>
 * <p><strong>Role:</strong> Created once at startup by a context factory, handed to each worker's thread
 * init, closed once at shutdown by the host.</p>
 * <p><strong>Thread-safety:</strong> Immutable after construction apart from the closed flag; concurrent
 * reads of {@link #sink()} need no synchronization.</p>
 *
 * @since 0.1.0
 */
public final class ModuleContext implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(ModuleContext.class);

  private final String moduleName;
  private final LogSink sink;
  private final SinkOwnership ownership;
  private final AtomicBoolean closed = new AtomicBoolean();

  private ModuleContext(String moduleName, LogSink sink, SinkOwnership ownership) {
    this.moduleName = Objects.requireNonNull(moduleName, "moduleName");
    this.sink = Objects.requireNonNull(sink, "sink");
    this.ownership = Objects.requireNonNull(ownership, "ownership");
  }

  /**
   * Creates a context that owns {@code sink} and closes it on {@link #close()}.
   *
   * @param moduleName module name used in logs
   * @param sink sink opened for this module
   * @return owning context
   */
  public static ModuleContext owning(String moduleName, LogSink sink) {
    return new ModuleContext(moduleName, sink, SinkOwnership.OWNED);
  }

  /**
   * Creates a context that writes to a sink owned elsewhere and never closes it.
   *
   * @param moduleName module name used in logs
   * @param sink sink owned by a parent output
   * @return borrowing context
   */
  public static ModuleContext borrowing(String moduleName, LogSink sink) {
    return new ModuleContext(moduleName, sink, SinkOwnership.BORROWED);
  }

  /** @return module name */
  public String moduleName() {
    return moduleName;
  }

  /** @return sink shared by all workers of this module */
  public LogSink sink() {
    return sink;
  }

  /** @return ownership mode fixed at construction */
  public SinkOwnership ownership() {
    return ownership;
  }

  /** @return {@code true} once {@link #close()} has run */
  public boolean isClosed() {
    return closed.get();
  }

  /**
   * Reopens the sink after external log rotation. Borrowing contexts leave it to the parent, and closed
   * contexts are skipped.
   *
   * @throws IOException if reopening an owned sink fails
   */
  public void reopen() throws IOException {
    if (ownership == SinkOwnership.OWNED && !closed.get()) {
      log.debug("Reopening {} sink {}", moduleName, sink.describe());
      sink.reopen();
    }
  }

  /**
   * Releases the context. Owning contexts close their sink; borrowing contexts leave it to the parent.
   * Repeated calls are ignored.
   *
   * @throws IOException if closing an owned sink fails
   */
  @Override
  public void close() throws IOException {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    if (ownership == SinkOwnership.OWNED) {
      log.debug("Closing {} sink {}", moduleName, sink.describe());
      sink.close();
    } else {
      log.debug("Cleaning up sub-module context {}", moduleName);
    }
  }

  @Override
  public String toString() {
    return "ModuleContext{" + moduleName + ", " + ownership + ", " + sink.describe() + '}';
  }
}
