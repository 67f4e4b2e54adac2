package ca.gc.cra.flowstart.domain.packet;

import ca.gc.cra.flowstart.domain.flow.FlowView;
import ca.gc.cra.flowstart.domain.net.FiveTuple;

/**
 * <strong>What:</strong> Read-only view of a packet delivered to output modules.
 * <p><strong>Why:</strong> Decouples loggers from the host's packet representation.</p>
 * <p><strong>Role:</strong> Domain port implemented by the host pipeline.</p>
 * <p><strong>Thread-safety:</strong> A packet is only handed to one worker thread at a time and must not
 * change while output modules run.</p>
 * <p><strong>Performance:</strong> Accessors are evaluated on every packet; implementations should not
 * allocate.</p>
 *
 * @since 0.1.0
 */
public interface PacketView {
  /**
   * Returns the flow owning this packet.
   *
   * @return flow view or {@code null} when the packet is not associated with a flow
   */
  FlowView flow();

  /**
   * Indicates whether the packet was synthesized by the pipeline (for example to signal a flow
   * timeout) rather than read from the wire.
   *
   * @return {@code true} for pseudo packets
   */
  boolean pseudo();

  /**
   * Returns the OS index of the interface the packet arrived on when the capture method reports it.
   *
   * @return interface index, or {@code 0} when unknown
   */
  int ingressInterfaceIndex();

  /**
   * Returns the packet's endpoint identity.
   *
   * @return five-tuple; never {@code null}
   */
  FiveTuple tuple();

  /**
   * Returns the capture timestamp.
   *
   * @return microseconds since epoch
   */
  long timestampMicros();

  /**
   * Returns the name of the capture device the packet was read from.
   *
   * @return device name or {@code null} when not recorded
   */
  String captureInterface();

  /**
   * Returns the outer VLAN id.
   *
   * @return VLAN id, or {@code 0} when untagged
   */
  int vlanId();
}
