package ca.gc.cra.flowstart.application.flowstart;

import ca.gc.cra.flowstart.application.port.EventHeaderBuilder;
import ca.gc.cra.flowstart.application.port.EventRecordWriter;
import ca.gc.cra.flowstart.application.port.InterfaceNameResolver;
import ca.gc.cra.flowstart.application.port.MetricsPort;
import ca.gc.cra.flowstart.domain.event.EventRecord;
import ca.gc.cra.flowstart.domain.event.EventTypes;
import ca.gc.cra.flowstart.domain.packet.PacketView;
import ca.gc.cra.flowstart.infrastructure.buffer.MemBuffer;
import java.io.IOException;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds and writes the {@code flow_start} event for a triggering packet.
 * <p>A header that cannot be built drops the event: the call still returns normally, the drop is counted
 * under {@code flowstart.event.dropped} and logged at debug level. Sink failures propagate.</p>
 *
 * @since 0.1.0
 */
public final class FlowStartRecordFormatter {
  /** Field carrying the resolved ingress interface name. */
  public static final String IN_DEV_FIELD = "in_dev";

  static final String METRIC_EMITTED = "flowstart.event.emitted";
  static final String METRIC_DROPPED = "flowstart.event.dropped";
  static final String METRIC_BYTES = "flowstart.event.bytes";

  private static final Logger log = LoggerFactory.getLogger(FlowStartRecordFormatter.class);

  private final EventHeaderBuilder headers;
  private final InterfaceNameResolver interfaces;
  private final EventRecordWriter writer;
  private final MetricsPort metrics;

  /**
   * Creates a formatter.
   *
   * @param headers standard header builder
   * @param interfaces interface index lookup; {@link InterfaceNameResolver#NONE} when unsupported
   * @param writer record serializer
   * @param metrics metrics sink; falls back to {@link MetricsPort#NO_OP} when {@code null}
   */
  public FlowStartRecordFormatter(
      EventHeaderBuilder headers,
      InterfaceNameResolver interfaces,
      EventRecordWriter writer,
      MetricsPort metrics) {
    this.headers = Objects.requireNonNull(headers, "headers");
    this.interfaces = Objects.requireNonNull(interfaces, "interfaces");
    this.writer = Objects.requireNonNull(writer, "writer");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  /**
   * Formats and writes the event for {@code packet}.
   *
   * @param thread calling worker's state
   * @param packet triggering packet
   * @throws IOException if the sink write fails
   */
  public void format(FlowStartLogThread thread, PacketView packet) throws IOException {
    Optional<EventRecord> header = headers.build(packet, EventTypes.FLOW_START);
    if (header.isEmpty()) {
      metrics.increment(METRIC_DROPPED);
      log.debug("Dropping flow_start event for {}: header unavailable", packet.tuple());
      return;
    }
    EventRecord record = header.get();
    try {
      addIngressDevice(record, packet);
      MemBuffer buffer = thread.buffer();
      buffer.reset();
      writer.write(record, buffer, thread.context().sink());
      metrics.increment(METRIC_EMITTED);
      metrics.observe(METRIC_BYTES, buffer.length());
    } finally {
      record.clear();
    }
  }

  private void addIngressDevice(EventRecord record, PacketView packet) {
    int index = packet.ingressInterfaceIndex();
    if (index == 0 || !interfaces.available()) {
      return;
    }
    interfaces.nameOf(index).ifPresent(name -> record.put(IN_DEV_FIELD, name));
  }
}
