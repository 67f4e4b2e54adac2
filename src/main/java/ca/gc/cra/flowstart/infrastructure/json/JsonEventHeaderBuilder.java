package ca.gc.cra.flowstart.infrastructure.json;

import ca.gc.cra.flowstart.application.port.EventHeaderBuilder;
import ca.gc.cra.flowstart.domain.event.EventRecord;
import ca.gc.cra.flowstart.domain.flow.FlowView;
import ca.gc.cra.flowstart.domain.net.FiveTuple;
import ca.gc.cra.flowstart.domain.packet.PacketView;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the standard JSON event header shared by all event types.
 * <p>Field order: {@code timestamp}, {@code flow_id}, {@code in_iface}, {@code event_type}, {@code vlan},
 * {@code src_ip}, {@code src_port}, {@code dest_ip}, {@code dest_port}, {@code proto}. Optional fields are
 * omitted when the packet does not carry them.</p>
 * <p>Thread-safe; the formatter is immutable.</p>
 */
public final class JsonEventHeaderBuilder implements EventHeaderBuilder {
  private static final Logger log = LoggerFactory.getLogger(JsonEventHeaderBuilder.class);
  private static final String TIMESTAMP_PATTERN = "yyyy-MM-dd'T'HH:mm:ss.SSSSSSZ";
  private static final long MICROS_PER_SECOND = 1_000_000L;

  private final DateTimeFormatter timestamps;

  /**
   * Creates a builder formatting timestamps in UTC.
   */
  public JsonEventHeaderBuilder() {
    this(ZoneOffset.UTC);
  }

  /**
   * Creates a builder formatting timestamps in the given zone.
   *
   * @param zone zone used for the {@code timestamp} field
   */
  public JsonEventHeaderBuilder(ZoneId zone) {
    this.timestamps = DateTimeFormatter.ofPattern(TIMESTAMP_PATTERN).withZone(Objects.requireNonNull(zone, "zone"));
  }

  @Override
  public Optional<EventRecord> build(PacketView packet, String eventType) {
    Objects.requireNonNull(eventType, "eventType");
    if (packet == null) {
      return Optional.empty();
    }
    FiveTuple tuple = packet.tuple();
    if (tuple == null) {
      log.debug("Packet carries no addresses; {} header not built", eventType);
      return Optional.empty();
    }
    try {
      EventRecord record = new EventRecord();
      record.put("timestamp", formatTimestamp(packet.timestampMicros()));
      FlowView flow = packet.flow();
      if (flow != null) {
        record.put("flow_id", flow.flowId());
      }
      String device = packet.captureInterface();
      if (device != null && !device.isEmpty()) {
        record.put("in_iface", device);
      }
      record.put("event_type", eventType);
      if (packet.vlanId() != 0) {
        record.put("vlan", packet.vlanId());
      }
      record.put("src_ip", tuple.srcIp());
      record.put("src_port", tuple.srcPort());
      record.put("dest_ip", tuple.dstIp());
      record.put("dest_port", tuple.dstPort());
      record.put("proto", tuple.protocol());
      return Optional.of(record);
    } catch (DateTimeException ex) {
      log.debug("Unable to build {} header", eventType, ex);
      return Optional.empty();
    }
  }

  String formatTimestamp(long timestampMicros) {
    long seconds = Math.floorDiv(timestampMicros, MICROS_PER_SECOND);
    long micros = Math.floorMod(timestampMicros, MICROS_PER_SECOND);
    return timestamps.format(Instant.ofEpochSecond(seconds, micros * 1_000L));
  }
}
