package ca.gc.cra.dnstap.infrastructure.publish;

import ca.gc.cra.dnstap.application.port.EventPublisher;
import ca.gc.cra.dnstap.application.port.MetricsPort;
import ca.gc.cra.dnstap.domain.event.DnsEvent;
import ca.gc.cra.dnstap.domain.event.DnsEventFields;
import ca.gc.cra.dnstap.validation.Strings;
import java.io.IOException;
import java.time.Duration;
import java.util.Objects;
import java.util.Properties;
import java.util.function.Consumer;
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
 * Kafka publisher that sends each {@link DnsEvent} as a JSON value to the topic named by the publish tag.
 * <p>Instances are thread-safe when the supplied producer is thread-safe (the default {@link KafkaProducer} is).
 * The record key is the event's {@code identity} field when non-empty so events from one sensor share a
 * partition.</p>
 *
 * @implNote Sends are asynchronous. Synchronous producer errors surface from {@link #post} as
 *     {@link IOException}. Failures reported later through the send callback are counted under
 *     {@code publish.kafka.failed} and handed to the caller's delivery-failure consumer as an {@link IOException}.
 *     Invoke {@link #close()} to flush before shutdown.
 * @since 0.1.0
 */
public final class KafkaEventPublisher implements EventPublisher {
  private static final Logger log = LoggerFactory.getLogger(KafkaEventPublisher.class);

  private final Producer<String, byte[]> producer;
  private final EventJsonEncoder encoder;
  private final MetricsPort metrics;

  /**
   * Creates a publisher backed by a new {@link KafkaProducer}.
   *
   * @param bootstrapServers comma-separated Kafka bootstrap servers
   * @param metrics metrics sink for asynchronous failures
   */
  public KafkaEventPublisher(String bootstrapServers, MetricsPort metrics) {
    this(createProducer(bootstrapServers), new EventJsonEncoder(), metrics);
  }

  KafkaEventPublisher(Producer<String, byte[]> producer, EventJsonEncoder encoder, MetricsPort metrics) {
    this.producer = Objects.requireNonNull(producer, "producer");
    this.encoder = Objects.requireNonNull(encoder, "encoder");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  @Override
  public void post(String tag, DnsEvent event) throws IOException {
    post(tag, event, failure -> log.warn("{}", failure.getMessage(), failure.getCause()));
  }

  @Override
  public void post(String tag, DnsEvent event, Consumer<IOException> deliveryFailure) throws IOException {
    String topic = Strings.sanitizeTag("tag", tag);
    Objects.requireNonNull(event, "event");
    Objects.requireNonNull(deliveryFailure, "deliveryFailure");
    String key = event.getString(DnsEventFields.IDENTITY).filter(s -> !s.isEmpty()).orElse(null);
    ProducerRecord<String, byte[]> record = new ProducerRecord<>(topic, key, encoder.encode(event));
    try {
      producer.send(record, (metadata, exception) -> {
        if (exception != null) {
          metrics.increment("publish.kafka.failed");
          deliveryFailure.accept(new IOException("Kafka delivery to topic " + topic + " failed", exception));
        }
      });
    } catch (KafkaException ex) {
      throw new IOException("Kafka rejected event for topic " + topic, ex);
    }
  }

  /**
   * Flushes pending records and closes the producer.
   *
   * @implNote Waits up to five seconds for in-flight sends to complete.
   */
  @Override
  public void close() {
    producer.flush();
    producer.close(Duration.ofSeconds(5));
  }

  private static Producer<String, byte[]> createProducer(String bootstrapServers) {
    String trimmed = Strings.requireNonBlank("bootstrapServers", bootstrapServers);
    Properties props = new Properties();
    props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, trimmed);
    props.put(ProducerConfig.ACKS_CONFIG, "all");
    props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true);
    props.put(ProducerConfig.LINGER_MS_CONFIG, 5);
    props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
    props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, ByteArraySerializer.class.getName());
    return new KafkaProducer<>(props);
  }
}
