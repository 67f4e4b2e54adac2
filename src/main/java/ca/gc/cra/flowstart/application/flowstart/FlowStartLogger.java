package ca.gc.cra.flowstart.application.flowstart;

import ca.gc.cra.flowstart.application.output.ModuleContext;
import ca.gc.cra.flowstart.application.output.PacketLogger;
import ca.gc.cra.flowstart.domain.packet.PacketView;
import java.io.IOException;
import java.util.Objects;

/**
 * Packet logger emitting one {@code flow_start} event per new flow.
 * <p>Shared by the standalone and the {@code eve-log} sub-module registrations; only the context differs.</p>
 *
 * @since 0.1.0
 */
public final class FlowStartLogger implements PacketLogger<FlowStartLogThread> {
  private final FlowStartCondition condition;
  private final FlowStartRecordFormatter formatter;

  /**
   * Creates the logger.
   *
   * @param condition first-packet predicate
   * @param formatter record formatter
   */
  public FlowStartLogger(FlowStartCondition condition, FlowStartRecordFormatter formatter) {
    this.condition = Objects.requireNonNull(condition, "condition");
    this.formatter = Objects.requireNonNull(formatter, "formatter");
  }

  @Override
  public boolean condition(PacketView packet) {
    return condition.test(packet);
  }

  @Override
  public void log(FlowStartLogThread thread, PacketView packet) throws IOException {
    formatter.format(thread, packet);
  }

  @Override
  public FlowStartLogThread threadInit(ModuleContext context) {
    return FlowStartLogThread.create(context);
  }

  @Override
  public void threadDeinit(FlowStartLogThread thread) {
    if (thread == null) {
      return;
    }
    thread.release();
  }
}
