package ca.gc.cra.dnstap.application.port;

import ca.gc.cra.dnstap.application.error.RecordHandlingException;

/**
 * <strong>What:</strong> Receives non-fatal per-record failures from the event handler.
 * <p><strong>Why:</strong> Separates diagnosis of bad payloads and failed posts from the record hot path.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent {@link #report} calls.</p>
 * <p><strong>Performance:</strong> {@link #report} must not block; implementations drop reports they cannot
 * accept rather than stall the caller.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface ErrorSink {
  /**
   * Offers a failure for later consumption.
   *
   * @param error failure description; must not be {@code null}
   * @return {@code true} when accepted, {@code false} when dropped
   */
  boolean report(RecordHandlingException error);

  /** Sink that discards every report. */
  ErrorSink NO_OP = error -> false;
}
