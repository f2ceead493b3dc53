package ca.gc.cra.dnstap.application.port;

import ca.gc.cra.dnstap.domain.event.DnsEvent;
import java.io.IOException;
import java.util.function.Consumer;

/**
 * <strong>What:</strong> Output port that delivers finished DNS events to a log-aggregation sink.
 * <p><strong>Why:</strong> Keeps the translator independent of Kafka, Fluentd, or file delivery.</p>
 * <p><strong>Role:</strong> Domain port implemented by publisher adapters.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Serialize and send one event under a tag (Kafka topic, Fluentd tag, file stem).</li>
 *   <li>Own connection lifecycle, buffering, and any retry policy.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations must accept concurrent {@link #post} calls from handler
 * workers.</p>
 *
 * @implNote Extends {@link AutoCloseable} so callers can flush buffered events on shutdown.
 * @since 0.1.0
 */
public interface EventPublisher extends AutoCloseable {
  /**
   * Publishes an event.
   *
   * @param tag routing tag; must be non-blank
   * @param event event to publish; must not be {@code null}
   * @throws IOException if the sink rejects the event or cannot be reached
   */
  void post(String tag, DnsEvent event) throws IOException;

  /**
   * Publishes an event and reports a delivery failure detected after this call returns.
   * <p>Synchronous sinks fail from this call and never invoke {@code deliveryFailure}; asynchronous sinks invoke it
   * at most once, possibly from another thread.</p>
   *
   * @param tag routing tag; must be non-blank
   * @param event event to publish; must not be {@code null}
   * @param deliveryFailure receives a late delivery failure
   * @throws IOException if the sink rejects the event or cannot be reached
   */
  default void post(String tag, DnsEvent event, Consumer<IOException> deliveryFailure) throws IOException {
    post(tag, event);
  }

  /**
   * Flushes buffered events and releases resources.
   *
   * @throws IOException if shutdown fails
   */
  @Override
  default void close() throws IOException {}
}
