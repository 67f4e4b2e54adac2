package ca.gc.cra.flowstart.domain.event;

/**
 * Event type tags written to the {@code event_type} header field.
 *
 * @since 0.1.0
 */
public final class EventTypes {
  /** Emitted for the first packet of a flow. */
  public static final String FLOW_START = "flow_start";

  private EventTypes() {}
}
