package ca.gc.cra.dnstap.infrastructure.errors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.dnstap.application.error.MalformedPayloadException;
import ca.gc.cra.dnstap.application.error.PublishFailedException;
import ca.gc.cra.dnstap.application.error.RecordHandlingException;
import ca.gc.cra.dnstap.domain.dnstap.MessageType;
import ca.gc.cra.dnstap.testutil.RecordingMetrics;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class BoundedErrorSinkTest {

  @Test
  void dropsReportsWhenFullWithoutBlocking() {
    RecordingMetrics metrics = new RecordingMetrics();
    BoundedErrorSink sink = new BoundedErrorSink(2, metrics);

    assertTrue(sink.report(new MalformedPayloadException("one")));
    assertTrue(sink.report(new MalformedPayloadException("two")));
    assertFalse(sink.report(new MalformedPayloadException("three")));

    assertEquals(2, sink.size());
    assertEquals(1, sink.dropped());
    assertEquals(2, metrics.count("errors.reported"));
    assertEquals(1, metrics.count("errors.dropped"));
  }

  @Test
  void drainsInArrivalOrder() {
    BoundedErrorSink sink = new BoundedErrorSink(4);
    RecordHandlingException first = new MalformedPayloadException("first");
    RecordHandlingException second =
        new PublishFailedException("dnstap.full", MessageType.CLIENT_QUERY, new IOException("down"));
    sink.report(first);
    sink.report(second);

    List<RecordHandlingException> drained = new ArrayList<>();
    assertEquals(2, sink.drainTo(drained));
    assertSame(first, drained.get(0));
    assertSame(second, drained.get(1));
    assertEquals(0, sink.size());
  }

  @Test
  void pollTimesOutWhenEmpty() throws Exception {
    BoundedErrorSink sink = new BoundedErrorSink(1);
    assertTrue(sink.poll(Duration.ofMillis(10)).isEmpty());
  }

  @Test
  void rejectsNonPositiveCapacity() {
    assertThrows(IllegalArgumentException.class, () -> new BoundedErrorSink(0));
  }
}
