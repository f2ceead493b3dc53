package ca.gc.cra.dnstap.config;

import ca.gc.cra.dnstap.application.handler.DnstapEventHandler;
import ca.gc.cra.dnstap.application.pipeline.DnstapProcessingUseCase;
import ca.gc.cra.dnstap.application.port.DnsMessageParser;
import ca.gc.cra.dnstap.application.port.DnstapRecordSource;
import ca.gc.cra.dnstap.application.port.EventPublisher;
import ca.gc.cra.dnstap.application.port.MetricsPort;
import ca.gc.cra.dnstap.domain.anon.AddressMasker;
import ca.gc.cra.dnstap.infrastructure.dns.DnsjavaMessageParser;
import ca.gc.cra.dnstap.infrastructure.errors.BoundedErrorSink;
import ca.gc.cra.dnstap.infrastructure.errors.ErrorReportLogger;
import ca.gc.cra.dnstap.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.dnstap.infrastructure.publish.FileEventPublisher;
import ca.gc.cra.dnstap.infrastructure.publish.FluentdHttpEventPublisher;
import ca.gc.cra.dnstap.infrastructure.publish.KafkaEventPublisher;
import ca.gc.cra.dnstap.infrastructure.publish.LoggingEventPublisher;
import ca.gc.cra.dnstap.logging.LoggingConfigurator;
import java.util.Objects;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Wires the event handler, publisher, error sink, and metrics from an {@link OutputConfig}.
 * <p><strong>Why:</strong> Keeps adapter selection in one place so the handler and pipeline only see ports.</p>
 * <p><strong>Role:</strong> Adapter composition root; owns every resource it creates.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Build the dnsjava parser and the address masker from the configured prefixes.</li>
 *   <li>Select the publisher for the configured {@link PublisherMode}.</li>
 *   <li>Start the bounded error sink and its logger, aligning the logger level with the reporting threshold.</li>
 *   <li>Create processing pipelines for record sources.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Construct and close on one thread; built components are thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);

  private final OutputConfig config;
  private final MetricsPort metrics;
  private final EventPublisher publisher;
  private final BoundedErrorSink errorSink;
  private final ErrorReportLogger errorLogger;
  private final DnstapEventHandler handler;

  /**
   * Builds all components, exporting metrics as configured.
   *
   * @param config validated configuration
   */
  public CompositionRoot(OutputConfig config) {
    this(config, new OpenTelemetryMetricsAdapter(config.metricsExporter()));
  }

  /**
   * Builds all components with an explicit metrics adapter.
   *
   * @param config validated configuration
   * @param metrics metrics sink shared by every component
   */
  public CompositionRoot(OutputConfig config, MetricsPort metrics) {
    this(config, metrics, m -> createPublisher(config, m));
  }

  CompositionRoot(
      OutputConfig config, MetricsPort metrics, Function<MetricsPort, EventPublisher> publisherFactory) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    LoggingConfigurator.applyLevel(ErrorReportLogger.class.getName(), config.errorLevel());
    DnsMessageParser parser = new DnsjavaMessageParser();
    AddressMasker masker = new AddressMasker(config.ipv4Mask(), config.ipv6Mask());
    this.handler = new DnstapEventHandler(parser, masker, config.tag(), config.errorLevel(), metrics);
    this.publisher = Objects.requireNonNull(publisherFactory.apply(metrics), "publisher");
    this.errorSink = new BoundedErrorSink(config.errorQueueCapacity(), metrics);
    this.errorLogger = new ErrorReportLogger(errorSink);
    log.info("Composed dnstap pipeline: {}", config);
  }

  static EventPublisher createPublisher(OutputConfig config, MetricsPort metrics) {
    return switch (config.publisher()) {
      case KAFKA -> new KafkaEventPublisher(config.kafkaBootstrap().orElseThrow(), metrics);
      case FLUENTD -> new FluentdHttpEventPublisher(config.fluentdEndpoint().orElseThrow(), config.fluentdTimeout());
      case FILE -> new FileEventPublisher(config.outputDirectory().orElseThrow());
      case LOG -> new LoggingEventPublisher();
    };
  }

  /**
   * Creates a pipeline that feeds {@code source} through the shared handler and publisher.
   *
   * @param source record source; closed by the pipeline when it finishes
   * @return new single-use pipeline
   */
  public DnstapProcessingUseCase newUseCase(DnstapRecordSource source) {
    return new DnstapProcessingUseCase(source, handler, publisher, errorSink, metrics, config.workers());
  }

  public OutputConfig config() {
    return config;
  }

  public DnstapEventHandler handler() {
    return handler;
  }

  public EventPublisher publisher() {
    return publisher;
  }

  public BoundedErrorSink errorSink() {
    return errorSink;
  }

  public MetricsPort metrics() {
    return metrics;
  }

  /**
   * Closes the publisher, drains the error sink, and shuts down metrics export.
   *
   * @throws Exception the first failure encountered; later failures are attached as suppressed
   */
  @Override
  public void close() throws Exception {
    Exception failure = null;
    try {
      publisher.close();
    } catch (Exception ex) {
      failure = ex;
    }
    try {
      errorLogger.close();
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      failure = addSuppressed(failure, ex);
    }
    if (metrics instanceof OpenTelemetryMetricsAdapter otel) {
      otel.close();
    }
    if (failure != null) {
      throw failure;
    }
  }

  private static Exception addSuppressed(Exception first, Exception next) {
    if (first == null) {
      return next;
    }
    first.addSuppressed(next);
    return first;
  }
}
