package ca.gc.cra.flowstart.application.flowstart;

import ca.gc.cra.flowstart.application.output.ModuleContext;
import ca.gc.cra.flowstart.infrastructure.buffer.MemBuffer;
import java.util.Objects;

/**
 * Per-worker state of the flow-start logger: a reusable scratch buffer and the module context.
 * <p>Confined to one worker thread for its whole life; never shared, never locked. The context reference
 * is non-owning.</p>
 *
 * @since 0.1.0
 */
public final class FlowStartLogThread {
  /** Initial scratch buffer capacity in bytes. */
  public static final int OUTPUT_BUFFER_SIZE = 65535;

  private ModuleContext context;
  private MemBuffer buffer;

  private FlowStartLogThread(ModuleContext context, MemBuffer buffer) {
    this.context = context;
    this.buffer = buffer;
  }

  /**
   * Creates thread state for a worker.
   *
   * @param context module context; {@code null} is a wiring error
   * @return new thread state
   * @throws NullPointerException if {@code context} is {@code null}
   */
  static FlowStartLogThread create(ModuleContext context) {
    Objects.requireNonNull(context, "Error getting context for flow_start log thread: context is null");
    return new FlowStartLogThread(context, new MemBuffer(OUTPUT_BUFFER_SIZE));
  }

  /** @return module context this worker writes through */
  public ModuleContext context() {
    ensureOpen();
    return context;
  }

  /** @return scratch buffer reused for every emission */
  public MemBuffer buffer() {
    ensureOpen();
    return buffer;
  }

  /** @return {@code true} once {@link #release()} has run */
  public boolean isReleased() {
    return buffer == null;
  }

  void release() {
    buffer = null;
    context = null;
  }

  private void ensureOpen() {
    if (buffer == null) {
      throw new IllegalStateException("flow_start log thread state already released");
    }
  }
}
