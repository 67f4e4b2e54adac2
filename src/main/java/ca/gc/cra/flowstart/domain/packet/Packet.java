package ca.gc.cra.flowstart.domain.packet;

import ca.gc.cra.flowstart.domain.flow.FlowView;
import ca.gc.cra.flowstart.domain.net.FiveTuple;
import java.util.Objects;

/**
 * Immutable packet handed to output modules.
 *
 * @param tuple endpoint identity; must not be {@code null}
 * @param timestampMicros capture timestamp in microseconds since epoch
 * @param flow owning flow; {@code null} when untracked
 * @param pseudo {@code true} for packets synthesized by the pipeline
 * @param ingressInterfaceIndex OS interface index; {@code 0} when unknown
 * @param captureInterface capture device name; may be {@code null}
 * @param vlanId outer VLAN id; {@code 0} when untagged
 * @since 0.1.0
 */
public record Packet(
    FiveTuple tuple,
    long timestampMicros,
    FlowView flow,
    boolean pseudo,
    int ingressInterfaceIndex,
    String captureInterface,
    int vlanId) implements PacketView {

  /**
   * Validates required components.
   */
  public Packet {
    Objects.requireNonNull(tuple, "tuple");
    if (ingressInterfaceIndex < 0) {
      throw new IllegalArgumentException("ingressInterfaceIndex must not be negative");
    }
  }

  /**
   * Creates a wire packet without interface or VLAN metadata.
   *
   * @param tuple endpoint identity
   * @param timestampMicros capture timestamp in microseconds
   * @param flow owning flow; may be {@code null}
   * @return packet instance
   */
  public static Packet of(FiveTuple tuple, long timestampMicros, FlowView flow) {
    return new Packet(tuple, timestampMicros, flow, false, 0, null, 0);
  }

  /**
   * Returns a copy flagged as a pseudo packet.
   *
   * @return pseudo copy of this packet
   */
  public Packet asPseudo() {
    return new Packet(tuple, timestampMicros, flow, true, ingressInterfaceIndex, captureInterface, vlanId);
  }

  /**
   * Returns a copy carrying the given ingress interface index.
   *
   * @param index OS interface index
   * @return packet copy
   */
  public Packet withIngressInterface(int index) {
    return new Packet(tuple, timestampMicros, flow, pseudo, index, captureInterface, vlanId);
  }

  /**
   * Returns a copy carrying capture device and VLAN metadata.
   *
   * @param device capture device name
   * @param vlan outer VLAN id
   * @return packet copy
   */
  public Packet withCaptureMetadata(String device, int vlan) {
    return new Packet(tuple, timestampMicros, flow, pseudo, ingressInterfaceIndex, device, vlan);
  }
}
