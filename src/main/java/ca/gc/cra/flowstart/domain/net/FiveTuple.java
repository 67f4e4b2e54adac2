package ca.gc.cra.flowstart.domain.net;

import java.util.Objects;

/**
 * <strong>What:</strong> Immutable five-tuple carried by a packet (source/destination address and port plus
 * transport protocol).
 * <p><strong>Why:</strong> Gives event headers the endpoint identity of the packet that triggered them.</p>
 * <p><strong>Role:</strong> Domain value object read by header builders; never used as a flow table key here.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe for concurrent sharing.</p>
 *
 * @since 0.1.0
 */
public final class FiveTuple {
  private final String srcIp;
  private final int srcPort;
  private final String dstIp;
  private final int dstPort;
  private final String protocol;

  /**
   * Creates a five-tuple descriptor.
   *
   * @param srcIp source address in textual form; must not be {@code null}
   * @param srcPort source port (0 for port-less protocols)
   * @param dstIp destination address in textual form; must not be {@code null}
   * @param dstPort destination port (0 for port-less protocols)
   * @param protocol transport protocol label; defaults to {@code "TCP"} when {@code null}
   */
  public FiveTuple(String srcIp, int srcPort, String dstIp, int dstPort, String protocol) {
    this.srcIp = Objects.requireNonNull(srcIp, "srcIp");
    this.srcPort = srcPort;
    this.dstIp = Objects.requireNonNull(dstIp, "dstIp");
    this.dstPort = dstPort;
    this.protocol = protocol == null ? "TCP" : protocol;
  }

  /** @return source address */
  public String srcIp() { return srcIp; }

  /** @return source port */
  public int srcPort() { return srcPort; }

  /** @return destination address */
  public String dstIp() { return dstIp; }

  /** @return destination port */
  public int dstPort() { return dstPort; }

  /**
   * Returns the transport protocol label as emitted in the {@code proto} field.
   *
   * @return protocol label such as {@code "TCP"} or {@code "UDP"}
   */
  public String protocol() { return protocol; }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof FiveTuple that)) {
      return false;
    }
    return srcPort == that.srcPort
        && dstPort == that.dstPort
        && srcIp.equals(that.srcIp)
        && dstIp.equals(that.dstIp)
        && protocol.equals(that.protocol);
  }

  @Override
  public int hashCode() {
    return Objects.hash(srcIp, srcPort, dstIp, dstPort, protocol);
  }

  @Override
  public String toString() {
    return protocol + " " + srcIp + ":" + srcPort + " -> " + dstIp + ":" + dstPort;
  }
}
