package ca.gc.cra.dnstap.application.pipeline;

import ca.gc.cra.dnstap.application.handler.DnstapEventHandler;
import ca.gc.cra.dnstap.application.port.DnstapRecordSource;
import ca.gc.cra.dnstap.application.port.ErrorSink;
import ca.gc.cra.dnstap.application.port.EventPublisher;
import ca.gc.cra.dnstap.application.port.MetricsPort;
import ca.gc.cra.dnstap.domain.dnstap.DnstapRecord;
import ca.gc.cra.dnstap.infrastructure.exec.ExecutorFactories;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.LongAdder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Drains a {@link DnstapRecordSource} and hands each record to {@link DnstapEventHandler} on a fixed worker pool.
 *
 * <p>The pool queue is bounded; once it fills, records are handled on the polling thread, which slows the source
 * instead of dropping records. {@link #run()} returns after the source is exhausted (or the thread is interrupted)
 * and every dispatched record has been handled. Instances are not reusable; invoke {@link #run()} at most once.</p>
 *
 * <p>The publisher and error sink are owned by the caller and are not closed here; the record source is.</p>
 *
 * @since 0.1.0
 */
public final class DnstapProcessingUseCase {
  private static final Logger log = LoggerFactory.getLogger(DnstapProcessingUseCase.class);
  private static final Duration WORKER_SHUTDOWN_TIMEOUT = Duration.ofSeconds(30);
  private static final int QUEUE_PER_WORKER = 64;

  private final DnstapRecordSource source;
  private final DnstapEventHandler handler;
  private final EventPublisher publisher;
  private final ErrorSink errors;
  private final MetricsPort metrics;
  private final int workers;
  private final LongAdder dispatched = new LongAdder();
  private final LongAdder completed = new LongAdder();
  private Thread pollingThread;
  private volatile boolean stopRequested;
  private boolean used;

  /**
   * Creates the pipeline.
   *
   * @param source record source; started and closed by {@link #run()}
   * @param handler record translator
   * @param publisher event destination shared by all workers
   * @param errors sink for non-fatal per-record failures
   * @param metrics metrics sink
   * @param workers number of handler threads, at least one
   */
  public DnstapProcessingUseCase(
      DnstapRecordSource source,
      DnstapEventHandler handler,
      EventPublisher publisher,
      ErrorSink errors,
      MetricsPort metrics,
      int workers) {
    this.source = Objects.requireNonNull(source, "source");
    this.handler = Objects.requireNonNull(handler, "handler");
    this.publisher = Objects.requireNonNull(publisher, "publisher");
    this.errors = Objects.requireNonNull(errors, "errors");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    if (workers <= 0) {
      throw new IllegalArgumentException("workers must be positive");
    }
    this.workers = workers;
  }

  /**
   * Runs the pipeline to completion.
   *
   * @throws Exception if the source fails to start, poll, or close
   * @throws IllegalStateException if invoked more than once
   */
  public void run() throws Exception {
    synchronized (this) {
      if (used) {
        throw new IllegalStateException("Processing pipeline already ran");
      }
      used = true;
      pollingThread = Thread.currentThread();
    }
    MDC.put("pipeline", "dnstap");
    ExecutorService executor = ExecutorFactories.newHandlerPool(
        workers,
        workers * QUEUE_PER_WORKER,
        "dnstap-handler",
        (thread, ex) -> log.error("Uncaught failure on {}", thread.getName(), ex));
    Exception primaryFailure = null;
    boolean started = false;
    try {
      source.start();
      started = true;
      log.info("Processing pipeline started with {} handler workers", workers);
      while (!stopRequested && !Thread.currentThread().isInterrupted()) {
        Optional<DnstapRecord> next;
        try {
          next = source.poll();
        } catch (InterruptedException ie) {
          Thread.currentThread().interrupt();
          break;
        }
        if (next.isEmpty()) {
          if (source.isExhausted()) {
            break;
          }
          continue;
        }
        DnstapRecord record = next.get();
        dispatched.increment();
        metrics.increment("pipeline.records.dispatched");
        executor.execute(() -> handleOne(record));
      }
    } catch (Exception ex) {
      primaryFailure = ex;
    } finally {
      endPolling();
      shutdown(executor);
      if (started) {
        try {
          source.close();
        } catch (Exception closeFailure) {
          log.error("Failed to close record source", closeFailure);
          if (primaryFailure == null) {
            primaryFailure = closeFailure;
          }
        }
      }
      MDC.remove("pipeline");
    }
    if (primaryFailure != null) {
      throw primaryFailure;
    }
    log.info("Processing pipeline completed; dispatched {} records, handled {}", dispatched(), completed());
  }

  /**
   * Stops polling the source. {@link #run()} still waits for every dispatched record before it returns.
   * Has no effect once polling has ended.
   */
  public synchronized void stop() {
    stopRequested = true;
    if (pollingThread != null) {
      pollingThread.interrupt();
    }
  }

  // The interrupt from stop() only ends polling; clear it so the worker drain is not cut short.
  private synchronized void endPolling() {
    pollingThread = null;
    if (stopRequested && Thread.interrupted()) {
      log.info("Processing pipeline stopped; draining {} dispatched records", dispatched() - completed());
    }
  }

  public long dispatched() {
    return dispatched.sum();
  }

  public long completed() {
    return completed.sum();
  }

  private void handleOne(DnstapRecord record) {
    try {
      handler.handle(publisher, record, errors);
    } finally {
      completed.increment();
      metrics.increment("pipeline.records.completed");
    }
  }

  private void shutdown(ExecutorService executor) {
    executor.shutdown();
    try {
      if (!executor.awaitTermination(WORKER_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
        log.warn("Handler workers active after {} ms; forcing shutdown", WORKER_SHUTDOWN_TIMEOUT.toMillis());
        executor.shutdownNow();
      }
    } catch (InterruptedException ie) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }
}
