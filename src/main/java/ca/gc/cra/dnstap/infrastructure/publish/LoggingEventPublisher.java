package ca.gc.cra.dnstap.infrastructure.publish;

import ca.gc.cra.dnstap.application.port.EventPublisher;
import ca.gc.cra.dnstap.domain.event.DnsEvent;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes each event as a JSON line through the {@code dnstap.events} logger at INFO.
 * <p>Useful when the log shipper already tails process output. Thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class LoggingEventPublisher implements EventPublisher {
  static final String LOGGER_NAME = "dnstap.events";

  private final Logger eventLog;
  private final EventJsonEncoder encoder = new EventJsonEncoder();

  public LoggingEventPublisher() {
    this(LoggerFactory.getLogger(LOGGER_NAME));
  }

  LoggingEventPublisher(Logger eventLog) {
    this.eventLog = Objects.requireNonNull(eventLog, "eventLog");
  }

  @Override
  public void post(String tag, DnsEvent event) {
    Objects.requireNonNull(event, "event");
    if (eventLog.isInfoEnabled()) {
      eventLog.info("{} {}", tag, encoder.encodeToString(event));
    }
  }
}
