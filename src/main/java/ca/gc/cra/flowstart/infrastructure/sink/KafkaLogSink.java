package ca.gc.cra.flowstart.infrastructure.sink;

import ca.gc.cra.flowstart.application.port.LogSink;
import java.io.IOException;
import java.time.Duration;
import java.util.Arrays;
import java.util.Objects;
import java.util.Properties;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Kafka sink publishing one message per record, without newline framing.
 * <p>Thread-safe through the underlying {@link Producer}. Sends are asynchronous; broker-side failures are
 * logged from the send callback, local failures surface as {@link IOException}.</p>
 */
public final class KafkaLogSink implements LogSink {
  private static final Logger log = LoggerFactory.getLogger(KafkaLogSink.class);

  private final Producer<String, byte[]> producer;
  private final String topic;

  KafkaLogSink(Producer<String, byte[]> producer, String topic) {
    this.producer = Objects.requireNonNull(producer, "producer");
    this.topic = sanitizeTopic(topic);
  }

  /**
   * Creates a sink backed by a new {@link KafkaProducer}. The topic is validated before the producer is
   * created.
   *
   * @param bootstrapServers comma-separated bootstrap servers; must not be blank
   * @param topic destination topic; must not be blank
   * @return open sink
   * @throws IllegalArgumentException if either argument is blank
   */
  public static KafkaLogSink connect(String bootstrapServers, String topic) {
    String validTopic = sanitizeTopic(topic);
    return new KafkaLogSink(createProducer(bootstrapServers), validTopic);
  }

  @Override
  public void write(byte[] buffer, int offset, int length) throws IOException {
    byte[] payload = Arrays.copyOfRange(buffer, offset, offset + length);
    try {
      producer.send(new ProducerRecord<>(topic, payload), (metadata, ex) -> {
        if (ex != null) {
          log.warn("Kafka publish to {} failed", topic, ex);
        }
      });
    } catch (KafkaException ex) {
      throw new IOException("Kafka send to " + topic + " failed", ex);
    }
  }

  @Override
  public boolean newlineDelimited() {
    return false;
  }

  @Override
  public String describe() {
    return "kafka:" + topic;
  }

  @Override
  public void close() {
    try {
      producer.flush();
    } catch (KafkaException ex) {
      log.warn("Kafka producer flush failed during shutdown", ex);
    } finally {
      producer.close(Duration.ofSeconds(5));
    }
  }

  private static String sanitizeTopic(String topic) {
    if (topic == null || topic.isBlank()) {
      throw new IllegalArgumentException("topic must not be blank");
    }
    return topic.trim();
  }

  private static Producer<String, byte[]> createProducer(String bootstrapServers) {
    if (bootstrapServers == null || bootstrapServers.isBlank()) {
      throw new IllegalArgumentException("bootstrapServers must not be blank");
    }
    Properties props = new Properties();
    props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers.trim());
    props.put(ProducerConfig.ACKS_CONFIG, "1");
    props.put(ProducerConfig.LINGER_MS_CONFIG, 5);
    props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
    props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, ByteArraySerializer.class.getName());
    return new KafkaProducer<>(props);
  }
}
