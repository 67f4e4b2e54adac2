package ca.gc.cra.flowstart.application.flowstart;

import ca.gc.cra.flowstart.application.port.EngineModePort;
import ca.gc.cra.flowstart.domain.flow.FlowView;
import ca.gc.cra.flowstart.domain.packet.PacketView;
import java.util.Objects;

/**
 * <strong>What:</strong> Decides whether a packet is the first packet of its flow.
 * <p><strong>Role:</strong> Hot-path predicate evaluated for every packet before any formatting work.</p>
 * <p><strong>Rules:</strong> false outside inline mode, false for pseudo packets, false without a flow;
 * otherwise true exactly when the flow's two direction counters sum to one.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from the injected engine mode; safe for concurrent use.</p>
 * <p><strong>Performance:</strong> A handful of field reads and one addition; never allocates.</p>
 *
 * @implNote A flow whose first packet were counted in both directions at once would never reach a sum of
 *     one. Correct accounting upstream rules that out.
 * @since 0.1.0
 */
public final class FlowStartCondition {
  private final EngineModePort engineMode;

  /**
   * Creates a condition bound to the engine mode.
   *
   * @param engineMode engine mode capability
   */
  public FlowStartCondition(EngineModePort engineMode) {
    this.engineMode = Objects.requireNonNull(engineMode, "engineMode");
  }

  /**
   * Evaluates the packet.
   *
   * @param packet packet under inspection
   * @return {@code true} if the packet starts its flow and should be logged
   */
  public boolean test(PacketView packet) {
    if (!engineMode.inline()) {
      return false;
    }
    if (packet.pseudo()) {
      return false;
    }
    FlowView flow = packet.flow();
    if (flow == null) {
      return false;
    }
    return flow.toDestinationPacketCount() + flow.toSourcePacketCount() == 1;
  }
}
