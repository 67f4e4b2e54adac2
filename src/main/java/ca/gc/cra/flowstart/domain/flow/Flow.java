package ca.gc.cra.flowstart.domain.flow;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Mutable flow with per-direction packet counters, updated by the host flow tracker.
 * <p>Counters only ever increase. Output modules see the flow through {@link FlowView}.</p>
 *
 * @since 0.1.0
 */
public final class Flow implements FlowView {
  private final long flowId;
  private final AtomicLong toDestination = new AtomicLong();
  private final AtomicLong toSource = new AtomicLong();

  /**
   * Creates a flow with zeroed counters.
   *
   * @param flowId identifier emitted as {@code flow_id}
   */
  public Flow(long flowId) {
    this.flowId = flowId;
  }

  /**
   * Counts one packet in the given direction.
   *
   * @param toServer {@code true} when the packet travels towards the destination
   */
  public void countPacket(boolean toServer) {
    if (toServer) {
      toDestination.incrementAndGet();
    } else {
      toSource.incrementAndGet();
    }
  }

  @Override
  public long flowId() {
    return flowId;
  }

  @Override
  public long toDestinationPacketCount() {
    return toDestination.get();
  }

  @Override
  public long toSourcePacketCount() {
    return toSource.get();
  }

  @Override
  public String toString() {
    return "Flow{id=" + flowId + ", toDst=" + toDestination.get() + ", toSrc=" + toSource.get() + '}';
  }
}
