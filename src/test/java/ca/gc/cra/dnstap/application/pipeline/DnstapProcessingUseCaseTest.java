package ca.gc.cra.dnstap.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.dnstap.application.handler.DnstapEventHandler;
import ca.gc.cra.dnstap.application.port.DnstapRecordSource;
import ca.gc.cra.dnstap.application.port.ErrorSink;
import ca.gc.cra.dnstap.application.port.EventPublisher;
import ca.gc.cra.dnstap.application.port.MetricsPort;
import ca.gc.cra.dnstap.domain.anon.AddressMasker;
import ca.gc.cra.dnstap.domain.dnstap.DnstapRecord;
import ca.gc.cra.dnstap.domain.dnstap.MessageType;
import ca.gc.cra.dnstap.infrastructure.dns.DnsjavaMessageParser;
import ca.gc.cra.dnstap.infrastructure.errors.BoundedErrorSink;
import ca.gc.cra.dnstap.infrastructure.source.IterableRecordSource;
import ca.gc.cra.dnstap.testutil.DnsWireFixtures;
import ca.gc.cra.dnstap.testutil.RecordingMetrics;
import ca.gc.cra.dnstap.domain.event.DnsEvent;
import ca.gc.cra.dnstap.testutil.RecordingPublisher;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;
import org.slf4j.event.Level;

class DnstapProcessingUseCaseTest {

  private static DnstapEventHandler handler(MetricsPort metrics) {
    return new DnstapEventHandler(
        new DnsjavaMessageParser(), new AddressMasker(24, 48), "dnstap.full", Level.DEBUG, metrics);
  }

  private static List<DnstapRecord> queries(int count) throws IOException {
    List<DnstapRecord> records = new ArrayList<>();
    for (int i = 0; i < count; i++) {
      records.add(DnstapRecord.builder(MessageType.CLIENT_QUERY)
          .queryAddress(new byte[] {10, 0, 0, (byte) i})
          .queryPort(1024 + i)
          .queryMessage(DnsWireFixtures.query("host" + i + ".example.com."))
          .build());
    }
    return records;
  }

  @Test
  void handlesEveryRecordBeforeReturning() throws Exception {
    RecordingPublisher publisher = new RecordingPublisher();
    RecordingMetrics metrics = new RecordingMetrics();
    DnstapProcessingUseCase useCase = new DnstapProcessingUseCase(
        new IterableRecordSource(queries(500)), handler(metrics), publisher, ErrorSink.NO_OP, metrics, 4);

    useCase.run();

    assertEquals(500, publisher.posts().size());
    assertEquals(500, useCase.dispatched());
    assertEquals(500, useCase.completed());
    assertEquals(500, metrics.count("pipeline.records.dispatched"));
    assertEquals(500, metrics.count("pipeline.records.completed"));
    Set<Object> ports = publisher.posts().stream()
        .map(post -> post.event().get("query_port").orElseThrow())
        .collect(Collectors.toSet());
    assertEquals(500, ports.size());
  }

  @Test
  void malformedRecordsReachErrorSinkWithoutStoppingPipeline() throws Exception {
    List<DnstapRecord> records = new ArrayList<>(queries(3));
    records.add(DnstapRecord.builder(MessageType.AUTH_QUERY).queryMessage(new byte[] {1, 2}).build());
    RecordingPublisher publisher = new RecordingPublisher();
    BoundedErrorSink errors = new BoundedErrorSink(16);
    DnstapProcessingUseCase useCase = new DnstapProcessingUseCase(
        new IterableRecordSource(records), handler(MetricsPort.NO_OP), publisher, errors, MetricsPort.NO_OP, 2);

    useCase.run();

    assertEquals(3, publisher.posts().size());
    assertEquals(1, errors.size());
  }

  @Test
  void closesSourceAndRethrowsPollFailure() {
    IllegalStateException failure = new IllegalStateException("transport lost");
    FailingSource source = new FailingSource(failure);
    DnstapProcessingUseCase useCase = new DnstapProcessingUseCase(
        source, handler(MetricsPort.NO_OP), new RecordingPublisher(), ErrorSink.NO_OP, MetricsPort.NO_OP, 1);

    Exception thrown = assertThrows(Exception.class, useCase::run);
    assertSame(failure, thrown);
    assertTrue(source.closed);
  }

  @Test
  void stopEndsPollingButFinishesDispatchedRecords() throws Exception {
    OpenEndedSource source = new OpenEndedSource();
    source.records.addAll(queries(20));
    CountDownLatch release = new CountDownLatch(1);
    RecordingPublisher recorded = new RecordingPublisher();
    EventPublisher gated = (tag, event) -> awaitThenPost(release, recorded, tag, event);
    DnstapProcessingUseCase useCase = new DnstapProcessingUseCase(
        source, handler(MetricsPort.NO_OP), gated, ErrorSink.NO_OP, MetricsPort.NO_OP, 2);
    AtomicReference<Exception> failure = new AtomicReference<>();
    Thread runner = new Thread(() -> {
      try {
        useCase.run();
      } catch (Exception ex) {
        failure.set(ex);
      }
    }, "pipeline-runner");

    runner.start();
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
    while (useCase.dispatched() < 20 && System.nanoTime() < deadline) {
      Thread.sleep(5);
    }
    assertEquals(20, useCase.dispatched());
    assertEquals(0, useCase.completed());

    useCase.stop();
    runner.join(200);
    assertTrue(runner.isAlive());
    release.countDown();
    runner.join(TimeUnit.SECONDS.toMillis(10));

    assertFalse(runner.isAlive());
    assertNull(failure.get());
    assertEquals(20, useCase.completed());
    assertEquals(20, recorded.posts().size());
    assertTrue(source.closed);
  }

  @Test
  void runsOnlyOnce() throws Exception {
    DnstapProcessingUseCase useCase = new DnstapProcessingUseCase(
        IterableRecordSource.of(), handler(MetricsPort.NO_OP), new RecordingPublisher(),
        ErrorSink.NO_OP, MetricsPort.NO_OP, 1);
    useCase.run();

    assertThrows(IllegalStateException.class, useCase::run);
  }

  @Test
  void rejectsNonPositiveWorkers() {
    assertThrows(IllegalArgumentException.class, () -> new DnstapProcessingUseCase(
        IterableRecordSource.of(), handler(MetricsPort.NO_OP), new RecordingPublisher(),
        ErrorSink.NO_OP, MetricsPort.NO_OP, 0));
  }

  private static void awaitThenPost(
      CountDownLatch release, RecordingPublisher target, String tag, DnsEvent event) throws IOException {
    try {
      release.await();
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new IOException("interrupted before post", ex);
    }
    target.post(tag, event);
  }

  private static final class OpenEndedSource implements DnstapRecordSource {
    private final BlockingQueue<DnstapRecord> records = new LinkedBlockingQueue<>();
    private volatile boolean closed;

    @Override
    public void start() {}

    @Override
    public Optional<DnstapRecord> poll() throws InterruptedException {
      return Optional.ofNullable(records.poll(50, TimeUnit.MILLISECONDS));
    }

    @Override
    public void close() {
      closed = true;
    }
  }

  private static final class FailingSource implements DnstapRecordSource {
    private final RuntimeException failure;
    private boolean closed;

    private FailingSource(RuntimeException failure) {
      this.failure = failure;
    }

    @Override
    public void start() {}

    @Override
    public Optional<DnstapRecord> poll() {
      throw failure;
    }

    @Override
    public void close() {
      closed = true;
    }
  }
}
