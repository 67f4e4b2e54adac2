package ca.gc.cra.flowstart.application.port;

import ca.gc.cra.flowstart.domain.event.EventRecord;
import ca.gc.cra.flowstart.domain.packet.PacketView;
import java.util.Optional;

/**
 * <strong>What:</strong> Builds the standard event header (timestamp, flow id, endpoints, event type).
 * <p><strong>Why:</strong> Every JSON event type shares the same header layout.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent use by worker threads.</p>
 * <p><strong>Performance:</strong> Called once per emitted event, never per packet.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface EventHeaderBuilder {
  /**
   * Creates a new record populated with the standard header fields.
   *
   * @param packet triggering packet
   * @param eventType value of the {@code event_type} field
   * @return populated record, or empty when the header could not be built
   */
  Optional<EventRecord> build(PacketView packet, String eventType);
}
