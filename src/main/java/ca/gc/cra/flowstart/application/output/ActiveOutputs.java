package ca.gc.cra.flowstart.application.output;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Outputs activated from configuration.
 * <p>{@link #close()} tears down module contexts first (in reverse activation order) and parent outputs
 * last, so a borrowed sink is always closed after every module that writes to it.</p>
 *
 * @since 0.1.0
 */
public final class ActiveOutputs implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(ActiveOutputs.class);

  private final List<ActiveModule<?>> modules;
  private final List<JsonOutputContext> parents;

  ActiveOutputs(List<ActiveModule<?>> modules, List<JsonOutputContext> parents) {
    this.modules = List.copyOf(modules);
    this.parents = List.copyOf(parents);
  }

  /** @return activated modules in activation order */
  public List<ActiveModule<?>> modules() {
    return modules;
  }

  /** @return activated parent outputs */
  public List<JsonOutputContext> parents() {
    return parents;
  }

  /**
   * Reopens every owned sink once, typically after external log rotation. Parent sinks are reopened
   * through the parent only, never through the sub-modules borrowing them. All sinks are attempted even if
   * one fails.
   *
   * @throws IOException the first reopen failure, with later failures suppressed
   */
  public void reopen() throws IOException {
    IOException failure = null;
    for (JsonOutputContext parent : parents) {
      failure = collect(failure, parent.name(), parent::reopen);
    }
    for (ActiveModule<?> module : modules) {
      failure = collect(failure, module.name(), module.context()::reopen);
    }
    if (failure != null) {
      throw failure;
    }
    log.info("Reopened sinks of {} parent output(s) and {} module(s)", parents.size(), modules.size());
  }

  private static IOException collect(IOException failure, String name, Reopenable action) {
    try {
      action.reopen();
      return failure;
    } catch (IOException ex) {
      log.warn("Failed to reopen output {}", name, ex);
      if (failure == null) {
        return ex;
      }
      failure.addSuppressed(ex);
      return failure;
    }
  }

  @FunctionalInterface
  private interface Reopenable {
    void reopen() throws IOException;
  }

  /**
   * Closes every context once; all contexts are attempted even if one fails.
   *
   * @throws IOException the first close failure, with later failures suppressed
   */
  @Override
  public void close() throws IOException {
    List<AutoCloseable> order = new ArrayList<>(modules.size() + parents.size());
    for (int i = modules.size() - 1; i >= 0; i--) {
      order.add(modules.get(i).context());
    }
    for (int i = parents.size() - 1; i >= 0; i--) {
      order.add(parents.get(i));
    }
    closeAll(order);
  }

  static void closeAll(List<? extends AutoCloseable> resources) throws IOException {
    IOException failure = null;
    for (AutoCloseable resource : resources) {
      try {
        resource.close();
      } catch (Exception ex) {
        log.warn("Failed to close output {}", resource, ex);
        IOException wrapped = ex instanceof IOException io ? io : new IOException(ex);
        if (failure == null) {
          failure = wrapped;
        } else {
          failure.addSuppressed(wrapped);
        }
      }
    }
    if (failure != null) {
      throw failure;
    }
  }
}
