package ca.gc.cra.dnstap.application.handler;

import ca.gc.cra.dnstap.application.error.MalformedPayloadException;
import ca.gc.cra.dnstap.application.error.PublishFailedException;
import ca.gc.cra.dnstap.application.port.DnsMessageParser;
import ca.gc.cra.dnstap.application.port.ErrorSink;
import ca.gc.cra.dnstap.application.port.EventPublisher;
import ca.gc.cra.dnstap.application.port.MetricsPort;
import ca.gc.cra.dnstap.domain.anon.AddressMasker;
import ca.gc.cra.dnstap.domain.anon.DomainLabels;
import ca.gc.cra.dnstap.domain.dns.ParsedDnsMessage;
import ca.gc.cra.dnstap.domain.dnstap.DnstapRecord;
import ca.gc.cra.dnstap.domain.dnstap.MessageType;
import ca.gc.cra.dnstap.domain.event.DnsEvent;
import ca.gc.cra.dnstap.domain.event.DnsEventFields;
import ca.gc.cra.dnstap.validation.Strings;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;

/**
 * <strong>What:</strong> Translates one dnstap record into one anonymized {@link DnsEvent} and publishes it.
 * <p><strong>Why:</strong> Concentrates field semantics and privacy policy in a single place; record sources,
 * publishers, and error consumers stay free of DNS knowledge.</p>
 * <p><strong>Role:</strong> Application service invoked once per record by the processing pipeline.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Pick the wire payload for the record's class and decode it; drop the record when decoding fails.</li>
 *   <li>Emit query-side or response-side timing, masked address, and port.</li>
 *   <li>Emit record metadata, header flags, first-question fields, and domain suffix labels.</li>
 *   <li>Post the event under the configured tag and report failures to the error sink.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable; safe to invoke concurrently provided the publisher and error sink
 * are.</p>
 * <p><strong>Observability:</strong> Emits {@code handler.records}, {@code handler.events.published},
 * {@code handler.payload.malformed}, {@code handler.publish.failed}, and {@code handler.latencyNanos}.</p>
 *
 * @implNote Malformed payloads are reported only when the threshold is {@link Level#DEBUG} or more verbose;
 *     publish failures only when it is {@link Level#WARN} or more verbose. Both are always counted. A delivery
 *     failure that an asynchronous publisher detects after {@code post} returned is counted and reported the
 *     same way.
 * @since 0.1.0
 */
public final class DnstapEventHandler {
  private static final Logger log = LoggerFactory.getLogger(DnstapEventHandler.class);
  private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ISO_INSTANT;

  private final DnsMessageParser parser;
  private final AddressMasker masker;
  private final String tag;
  private final Level reportThreshold;
  private final MetricsPort metrics;

  /**
   * Creates a handler without metrics.
   *
   * @param parser DNS wire parser
   * @param masker address masker built from the configured prefix lengths
   * @param tag publish tag
   * @param reportThreshold most verbose level at which failures are still reported
   */
  public DnstapEventHandler(DnsMessageParser parser, AddressMasker masker, String tag, Level reportThreshold) {
    this(parser, masker, tag, reportThreshold, MetricsPort.NO_OP);
  }

  /**
   * Creates a handler.
   *
   * @param parser DNS wire parser
   * @param masker address masker built from the configured prefix lengths
   * @param tag publish tag; must be non-blank
   * @param reportThreshold most verbose level at which failures are still reported
   * @param metrics metrics sink
   */
  public DnstapEventHandler(
      DnsMessageParser parser, AddressMasker masker, String tag, Level reportThreshold, MetricsPort metrics) {
    this.parser = Objects.requireNonNull(parser, "parser");
    this.masker = Objects.requireNonNull(masker, "masker");
    this.tag = Strings.sanitizeTag("tag", tag);
    this.reportThreshold = Objects.requireNonNull(reportThreshold, "reportThreshold");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  public String tag() {
    return tag;
  }

  public Level reportThreshold() {
    return reportThreshold;
  }

  /**
   * Translates and publishes one record. Never throws for malformed payloads or publisher failures.
   *
   * @param publisher destination for the built event
   * @param record decoded dnstap record
   * @param errors sink for non-fatal failures
   */
  public void handle(EventPublisher publisher, DnstapRecord record, ErrorSink errors) {
    Objects.requireNonNull(publisher, "publisher");
    Objects.requireNonNull(record, "record");
    Objects.requireNonNull(errors, "errors");
    long start = System.nanoTime();
    metrics.increment("handler.records");
    MessageType type = record.type();

    ParsedDnsMessage message;
    try {
      message = parser.parse(selectPayload(record));
    } catch (MalformedPayloadException ex) {
      metrics.increment("handler.payload.malformed");
      if (log.isTraceEnabled()) {
        log.trace("Dropping {} record: {}", type, ex.getMessage());
      }
      if (isReportable(Level.DEBUG)) {
        errors.report(ex.withContext(tag, type));
      }
      return;
    }

    DnsEvent event = toEvent(record, message);
    try {
      publisher.post(tag, event, failure -> publishFailed(type, failure, errors));
      metrics.increment("handler.events.published");
    } catch (IOException | RuntimeException ex) {
      publishFailed(type, ex, errors);
    } finally {
      metrics.observe("handler.latencyNanos", System.nanoTime() - start);
    }
  }

  /**
   * Builds the event for a record and its decoded payload without publishing it.
   *
   * @param record decoded dnstap record
   * @param message decoded DNS payload of that record
   * @return immutable event
   */
  DnsEvent toEvent(DnstapRecord record, ParsedDnsMessage message) {
    DnsEvent.Builder event = DnsEvent.builder();
    switch (record.type().messageClass()) {
      case QUERY -> {
        event.put(DnsEventFields.TIMESTAMP, timestamp(record.queryTimeSec(), record.queryTimeNsec()));
        event.put(DnsEventFields.IDENTITY, text(record.identity()));
        masker.mask(record.queryAddress()).ifPresent(a -> event.put(DnsEventFields.QUERY_ADDRESS, a));
        event.put(DnsEventFields.QUERY_PORT, record.queryPort());
      }
      case RESPONSE -> {
        event.put(DnsEventFields.TIMESTAMP, timestamp(record.responseTimeSec(), record.responseTimeNsec()));
        event.put(DnsEventFields.IDENTITY, text(record.identity()));
        masker.mask(record.responseAddress()).ifPresent(a -> event.put(DnsEventFields.RESPONSE_ADDRESS, a));
        event.put(DnsEventFields.RESPONSE_PORT, record.responsePort());
        parser.decodeName(record.queryZone()).ifPresent(z -> event.put(DnsEventFields.RESPONSE_ZONE, z));
      }
    }

    event.put(DnsEventFields.TYPE, record.type().name());
    record.socketFamily().ifPresent(f -> event.put(DnsEventFields.SOCKET_FAMILY, f.name()));
    record.socketProtocol().ifPresent(p -> event.put(DnsEventFields.SOCKET_PROTOCOL, p.wireName()));
    event.put(DnsEventFields.VERSION, text(record.version()));
    event.put(DnsEventFields.EXTRA, text(record.extra()));

    event.put(DnsEventFields.QNAME, message.qname());
    event.put(DnsEventFields.QCLASS, message.qclass());
    event.put(DnsEventFields.QTYPE, message.qtype());
    event.put(DnsEventFields.RCODE, message.rcode());
    ParsedDnsMessage.HeaderFlags flags = message.flags();
    event.put(DnsEventFields.AA, flags.authoritative());
    event.put(DnsEventFields.TC, flags.truncated());
    event.put(DnsEventFields.RD, flags.recursionDesired());
    event.put(DnsEventFields.RA, flags.recursionAvailable());
    event.put(DnsEventFields.AD, flags.authenticatedData());
    event.put(DnsEventFields.CD, flags.checkingDisabled());

    for (Map.Entry<String, String> label : DomainLabels.decompose(message.qname()).entrySet()) {
      event.put(label.getKey(), label.getValue());
    }
    return event.build();
  }

  // The record's own leg decides which payload is decoded; the other leg is used only when that one is empty.
  private static byte[] selectPayload(DnstapRecord record) {
    return switch (record.type().messageClass()) {
      case QUERY -> record.hasQueryMessage() ? record.queryMessage() : record.responseMessage();
      case RESPONSE -> record.hasResponseMessage() ? record.responseMessage() : record.queryMessage();
    };
  }

  // Also invoked from publisher callback threads for failures detected after post returned.
  private void publishFailed(MessageType type, Exception cause, ErrorSink errors) {
    metrics.increment("handler.publish.failed");
    if (isReportable(Level.WARN)) {
      errors.report(new PublishFailedException(tag, type, cause));
    }
  }

  private boolean isReportable(Level level) {
    return reportThreshold.toInt() <= level.toInt();
  }

  private static String timestamp(long seconds, int nanos) {
    return TIMESTAMP_FORMAT.format(Instant.ofEpochSecond(seconds, nanos));
  }

  private static String text(byte[] value) {
    return new String(value, StandardCharsets.UTF_8);
  }
}
