package ca.gc.cra.dnstap.infrastructure.metrics;

import ca.gc.cra.dnstap.application.port.MetricsPort;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Metrics adapter that forwards handler, publisher, and pipeline counters and histograms to OpenTelemetry.
 *
 * <p>Instruments are created lazily per key and cached. Each data point carries the original dotted key under
 * the {@code dnstap.metric.key} attribute so renamed instruments remain traceable.</p>
 *
 * @since 0.1.0
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryMetricsAdapter.class);
  private static final AttributeKey<String> METRIC_KEY_ATTRIBUTE = AttributeKey.stringKey("dnstap.metric.key");
  private static final String FALLBACK_METRIC_NAME = "dnstap.metric";

  private final MetricsDelegate delegate;
  private final OpenTelemetryBootstrap.BootstrapResult bootstrap;

  /**
   * Creates an adapter wired to the environment-configured OpenTelemetry exporter.
   */
  public OpenTelemetryMetricsAdapter() {
    this(OpenTelemetryBootstrap.initialize(null));
  }

  /**
   * Creates an adapter whose exporter is chosen by configuration.
   *
   * @param exporter {@code otlp} or {@code none}; {@code null} or blank defers to system properties and environment
   */
  public OpenTelemetryMetricsAdapter(String exporter) {
    this(OpenTelemetryBootstrap.initialize(exporter));
  }

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.BootstrapResult bootstrap) {
    this.bootstrap = Objects.requireNonNull(bootstrap, "bootstrap");
    if (bootstrap.isNoop()) {
      log.info("OpenTelemetry metrics adapter running in noop mode");
      this.delegate = NoopDelegate.INSTANCE;
    } else {
      this.delegate = new OtelDelegate(bootstrap.meter());
    }
  }

  @Override
  public void increment(String key) {
    delegate.increment(key);
  }

  @Override
  public void observe(String key, long value) {
    delegate.observe(key, value);
  }

  boolean isNoop() {
    return bootstrap.isNoop();
  }

  void forceFlush() {
    bootstrap.forceFlush();
  }

  /** Flushes and shuts down the underlying meter provider, if any. */
  @Override
  public void close() {
    bootstrap.close();
  }

  private interface MetricsDelegate {
    void increment(String key);

    void observe(String key, long value);
  }

  private static final class NoopDelegate implements MetricsDelegate {
    private static final NoopDelegate INSTANCE = new NoopDelegate();

    @Override
    public void increment(String key) {
      // no-op
    }

    @Override
    public void observe(String key, long value) {
      // no-op
    }
  }

  private static final class OtelDelegate implements MetricsDelegate {
    private final Meter meter;
    private final ConcurrentMap<String, CounterInstrument> counters = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, HistogramInstrument> histograms = new ConcurrentHashMap<>();

    private OtelDelegate(Meter meter) {
      this.meter = Objects.requireNonNull(meter, "meter");
    }

    @Override
    public void increment(String key) {
      CounterInstrument instrument =
          counters.computeIfAbsent(Objects.requireNonNull(key, "key"), this::createCounter);
      instrument.counter().add(1, instrument.attributes());
    }

    @Override
    public void observe(String key, long value) {
      HistogramInstrument instrument =
          histograms.computeIfAbsent(Objects.requireNonNull(key, "key"), this::createHistogram);
      instrument.histogram().record(value, instrument.attributes());
    }

    private CounterInstrument createCounter(String key) {
      String name = sanitizeName(key);
      LongCounter counter = meter
          .counterBuilder(name)
          .setUnit("1")
          .setDescription("dnstap counter for " + key)
          .build();
      if (!name.equals(key)) {
        log.debug("Sanitized counter name '{}' -> '{}'", key, name);
      }
      return new CounterInstrument(counter, Attributes.of(METRIC_KEY_ATTRIBUTE, key));
    }

    private HistogramInstrument createHistogram(String key) {
      String name = sanitizeName(key);
      LongHistogram histogram = meter
          .histogramBuilder(name)
          .ofLongs()
          .setDescription("dnstap observation for " + key)
          .build();
      if (!name.equals(key)) {
        log.debug("Sanitized histogram name '{}' -> '{}'", key, name);
      }
      return new HistogramInstrument(histogram, Attributes.of(METRIC_KEY_ATTRIBUTE, key));
    }
  }

  // Instrument names must start with a letter and contain only [a-z0-9._-].
  static String sanitizeName(String key) {
    if (key == null || key.isBlank()) {
      return FALLBACK_METRIC_NAME;
    }
    String lower = key.trim().toLowerCase(Locale.ROOT);
    StringBuilder result = new StringBuilder(lower.length() + 1);
    if (!Character.isLetter(lower.charAt(0))) {
      result.append('m');
    }
    for (int i = 0; i < lower.length(); i++) {
      char c = lower.charAt(i);
      result.append(Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.' ? c : '_');
    }
    return result.toString();
  }

  private record CounterInstrument(LongCounter counter, Attributes attributes) {}

  private record HistogramInstrument(LongHistogram histogram, Attributes attributes) {}
}
