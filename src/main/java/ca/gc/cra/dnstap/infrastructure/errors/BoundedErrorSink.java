package ca.gc.cra.dnstap.infrastructure.errors;

import ca.gc.cra.dnstap.application.error.RecordHandlingException;
import ca.gc.cra.dnstap.application.port.ErrorSink;
import ca.gc.cra.dnstap.application.port.MetricsPort;
import ca.gc.cra.dnstap.validation.Numbers;
import java.time.Duration;
import java.util.Collection;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.LongAdder;

/**
 * <strong>What:</strong> {@link ErrorSink} backed by a fixed-capacity queue that drops reports when full.
 * <p><strong>Why:</strong> A slow or absent consumer must never stall record handling; losing diagnostics under
 * overload is preferred to losing throughput.</p>
 * <p><strong>Role:</strong> Infrastructure adapter shared by all handler workers; drained by
 * {@link ErrorReportLogger} or by an embedding caller.</p>
 * <p><strong>Thread-safety:</strong> Safe for any number of producers and consumers.</p>
 * <p><strong>Observability:</strong> Emits {@code errors.reported} and {@code errors.dropped}.</p>
 *
 * @since 0.1.0
 */
public final class BoundedErrorSink implements ErrorSink {
  private final BlockingQueue<RecordHandlingException> queue;
  private final int capacity;
  private final LongAdder dropped = new LongAdder();
  private final MetricsPort metrics;

  public BoundedErrorSink(int capacity) {
    this(capacity, MetricsPort.NO_OP);
  }

  /**
   * Creates a sink.
   *
   * @param capacity maximum queued reports, at least one
   * @param metrics metrics sink
   */
  public BoundedErrorSink(int capacity, MetricsPort metrics) {
    this.capacity = (int) Numbers.requireRange("errorQueueCapacity", capacity, 1, Integer.MAX_VALUE);
    this.queue = new ArrayBlockingQueue<>(capacity);
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  @Override
  public boolean report(RecordHandlingException error) {
    Objects.requireNonNull(error, "error");
    if (queue.offer(error)) {
      metrics.increment("errors.reported");
      return true;
    }
    dropped.increment();
    metrics.increment("errors.dropped");
    return false;
  }

  /**
   * Waits up to {@code timeout} for the next report.
   *
   * @param timeout maximum wait
   * @return next report, or empty on timeout
   * @throws InterruptedException if interrupted while waiting
   */
  public Optional<RecordHandlingException> poll(Duration timeout) throws InterruptedException {
    return Optional.ofNullable(queue.poll(timeout.toNanos(), TimeUnit.NANOSECONDS));
  }

  /**
   * Moves every queued report into {@code target} without waiting.
   *
   * @param target destination collection
   * @return number of reports moved
   */
  public int drainTo(Collection<? super RecordHandlingException> target) {
    return queue.drainTo(target);
  }

  public int size() {
    return queue.size();
  }

  public int capacity() {
    return capacity;
  }

  /**
   * Returns how many reports were discarded because the queue was full.
   *
   * @return dropped report count since construction
   */
  public long dropped() {
    return dropped.sum();
  }
}
