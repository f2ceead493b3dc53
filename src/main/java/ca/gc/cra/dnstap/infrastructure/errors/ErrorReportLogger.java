package ca.gc.cra.dnstap.infrastructure.errors;

import ca.gc.cra.dnstap.application.error.RecordHandlingException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drains a {@link BoundedErrorSink} on a daemon thread and writes each report to the log.
 *
 * <p>Publish failures are logged at WARN and malformed payloads at DEBUG. {@link #close()} stops the thread and
 * logs whatever is still queued.</p>
 *
 * @since 0.1.0
 */
public final class ErrorReportLogger implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(ErrorReportLogger.class);
  private static final Duration POLL_INTERVAL = Duration.ofMillis(100);

  private final BoundedErrorSink sink;
  private final Thread thread;
  private volatile boolean running = true;

  /**
   * Starts draining {@code sink}.
   *
   * @param sink sink to drain
   */
  public ErrorReportLogger(BoundedErrorSink sink) {
    this.sink = Objects.requireNonNull(sink, "sink");
    this.thread = new Thread(this::drainLoop, "dnstap-error-log");
    this.thread.setDaemon(true);
    this.thread.start();
  }

  private void drainLoop() {
    while (running) {
      try {
        Optional<RecordHandlingException> next = sink.poll(POLL_INTERVAL);
        next.ifPresent(ErrorReportLogger::write);
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        return;
      }
    }
  }

  static void write(RecordHandlingException error) {
    String type = error.messageType().map(Enum::name).orElse("UNKNOWN");
    switch (error.kind()) {
      case PUBLISH_FAILED -> log.warn("{} (type {})", error.getMessage(), type, error.getCause());
      case MALFORMED_PAYLOAD -> log.debug("Dropped {} record on tag {}: {}",
          type, error.tag().orElse("-"), error.getMessage());
    }
  }

  @Override
  public void close() throws InterruptedException {
    running = false;
    thread.interrupt();
    thread.join(POLL_INTERVAL.toMillis() * 10);
    List<RecordHandlingException> remaining = new ArrayList<>();
    sink.drainTo(remaining);
    remaining.forEach(ErrorReportLogger::write);
    if (sink.dropped() > 0) {
      log.warn("{} error reports were dropped because the error queue was full", sink.dropped());
    }
  }
}
