package ca.gc.cra.flowstart.domain.flow;

/**
 * <strong>What:</strong> Read-only view of a bidirectional flow maintained by the host flow tracker.
 * <p><strong>Why:</strong> Output modules only read flow counters; they never mutate flow state.</p>
 * <p><strong>Role:</strong> Domain port implemented by the host's flow representation.</p>
 * <p><strong>Thread-safety:</strong> Implementations must allow reads from the worker thread currently
 * processing a packet of the flow.</p>
 * <p><strong>Performance:</strong> Accessors are expected to be plain field reads; they run on every packet.</p>
 *
 * @since 0.1.0
 */
public interface FlowView {
  /**
   * Returns the identifier emitted as {@code flow_id} in event headers.
   *
   * @return flow identifier, stable for the lifetime of the flow
   */
  long flowId();

  /**
   * Returns the number of packets counted in the to-destination direction.
   *
   * @return monotonically increasing packet count
   */
  long toDestinationPacketCount();

  /**
   * Returns the number of packets counted in the to-source direction.
   *
   * @return monotonically increasing packet count
   */
  long toSourcePacketCount();
}
