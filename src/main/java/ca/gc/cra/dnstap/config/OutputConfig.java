package ca.gc.cra.dnstap.config;

import ca.gc.cra.dnstap.validation.Net;
import ca.gc.cra.dnstap.validation.Numbers;
import ca.gc.cra.dnstap.validation.Strings;
import java.io.IOException;
import java.net.URI;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;

/**
 * <strong>What:</strong> Settings for translating dnstap records and delivering the resulting events.
 * <p><strong>Why:</strong> Collects the anonymization prefixes, publish tag, reporting threshold, and publisher
 * wiring into one validated value so composition never sees raw strings.</p>
 * <p><strong>Role:</strong> Adapter configuration aggregate consumed by {@link CompositionRoot}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Parse and range-check every key, defaulting absent keys from {@link ConfigDefaults}.</li>
 *   <li>Require the publisher-specific destination for the selected {@link PublisherMode}.</li>
 *   <li>Merge defaults, YAML, and overrides in that order of increasing precedence.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable once constructed.</p>
 *
 * @implNote Configuration errors surface as {@link IllegalArgumentException} naming the offending key.
 * @since 0.1.0
 */
public final class OutputConfig {
  private static final Logger log = LoggerFactory.getLogger(OutputConfig.class);

  private final int ipv4Mask;
  private final int ipv6Mask;
  private final String tag;
  private final Level errorLevel;
  private final PublisherMode publisher;
  private final Optional<String> kafkaBootstrap;
  private final Optional<URI> fluentdEndpoint;
  private final Duration fluentdTimeout;
  private final Optional<Path> outputDirectory;
  private final int workers;
  private final int errorQueueCapacity;
  private final String metricsExporter;

  private OutputConfig(Map<String, String> values) {
    this.ipv4Mask = Numbers.parseIntInRange("ipv4Mask", values.get("ipv4Mask"), 0, 32);
    this.ipv6Mask = Numbers.parseIntInRange("ipv6Mask", values.get("ipv6Mask"), 0, 128);
    this.tag = Strings.sanitizeTag("tag", values.get("tag"));
    this.errorLevel = toLevel(values.get("errorLevel"));
    this.publisher = PublisherMode.fromString(values.get("publisher"));
    this.kafkaBootstrap = optional(values.get("kafkaBootstrap")).map(Net::validateHostPortList);
    this.fluentdEndpoint =
        optional(values.get("fluentdEndpoint")).map(raw -> Net.validateHttpEndpoint("fluentdEndpoint", raw));
    this.fluentdTimeout = Duration.ofMillis(
        Numbers.parseIntInRange("fluentdTimeoutMs", values.get("fluentdTimeoutMs"), 1, 600_000));
    this.outputDirectory = optional(values.get("out")).map(OutputConfig::toPath);
    this.workers = Numbers.parseIntInRange("workers", values.get("workers"), 1, 256);
    this.errorQueueCapacity =
        Numbers.parseIntInRange("errorQueueCapacity", values.get("errorQueueCapacity"), 1, 1_000_000);
    this.metricsExporter = optional(values.get("metricsExporter")).orElse("otlp").toLowerCase(Locale.ROOT);

    switch (publisher) {
      case KAFKA -> requirePresent(kafkaBootstrap, "kafkaBootstrap", publisher);
      case FLUENTD -> requirePresent(fluentdEndpoint, "fluentdEndpoint", publisher);
      case FILE -> requirePresent(outputDirectory, "out", publisher);
      case LOG -> { }
    }
  }

  /**
   * Returns the configuration built from defaults alone.
   *
   * @return default configuration (LOG publisher)
   */
  public static OutputConfig defaults() {
    return new OutputConfig(ConfigDefaults.asFlatMap());
  }

  /**
   * Builds a configuration from flat key/value pairs. Absent keys take their defaults.
   *
   * @param values configuration entries; {@code null} values are treated as absent
   * @return validated configuration
   * @throws IllegalArgumentException if any value is malformed or a required destination is missing
   */
  public static OutputConfig fromMap(Map<String, String> values) {
    Objects.requireNonNull(values, "values");
    Map<String, String> merged = new LinkedHashMap<>(ConfigDefaults.asFlatMap());
    values.forEach((key, value) -> {
      if (key == null || value == null) {
        return;
      }
      if (!merged.containsKey(key)) {
        log.warn("Ignoring unknown configuration key: {}", key);
        return;
      }
      merged.put(key, value);
    });
    return new OutputConfig(merged);
  }

  /**
   * Loads a configuration with precedence overrides &gt; YAML &gt; defaults.
   *
   * @param path YAML file; a missing file contributes nothing
   * @param overrides highest-precedence entries, typically from the embedding process
   * @return validated configuration
   * @throws IOException if the YAML file exists but cannot be read
   * @throws IllegalArgumentException if the merged values are invalid
   */
  public static OutputConfig load(Path path, Map<String, String> overrides) throws IOException {
    Objects.requireNonNull(path, "path");
    Map<String, String> yaml = YamlConfigLoader.load(path).orElseGet(() -> {
      log.info("Configuration file {} not found; using defaults and overrides", path);
      return Map.of();
    });
    Map<String, String> merged = new LinkedHashMap<>(yaml);
    if (overrides != null) {
      overrides.forEach((key, value) -> {
        if (key == null || value == null) {
          return;
        }
        if (yaml.containsKey(key)) {
          log.warn("Override replaces YAML value for key: {}", key);
        }
        merged.put(key, value);
      });
    }
    return fromMap(merged);
  }

  /**
   * Parses a level name. {@code WARNING} is accepted as an alias of {@code WARN}.
   *
   * @param raw level name, case-insensitive
   * @return SLF4J level
   * @throws IllegalArgumentException if the name is not a level
   */
  static Level toLevel(String raw) {
    String normalized = Strings.requireNonBlank("errorLevel", raw).toUpperCase(Locale.ROOT);
    if (normalized.equals("WARNING")) {
      return Level.WARN;
    }
    try {
      return Level.valueOf(normalized);
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException(
          "errorLevel must be one of ERROR, WARN, INFO, DEBUG, TRACE (was " + raw + ")", ex);
    }
  }

  public int ipv4Mask() {
    return ipv4Mask;
  }

  public int ipv6Mask() {
    return ipv6Mask;
  }

  public String tag() {
    return tag;
  }

  public Level errorLevel() {
    return errorLevel;
  }

  public PublisherMode publisher() {
    return publisher;
  }

  public Optional<String> kafkaBootstrap() {
    return kafkaBootstrap;
  }

  public Optional<URI> fluentdEndpoint() {
    return fluentdEndpoint;
  }

  public Duration fluentdTimeout() {
    return fluentdTimeout;
  }

  public Optional<Path> outputDirectory() {
    return outputDirectory;
  }

  public int workers() {
    return workers;
  }

  public int errorQueueCapacity() {
    return errorQueueCapacity;
  }

  public String metricsExporter() {
    return metricsExporter;
  }

  @Override
  public String toString() {
    return "OutputConfig{publisher=" + publisher
        + ", tag=" + tag
        + ", ipv4Mask=" + ipv4Mask
        + ", ipv6Mask=" + ipv6Mask
        + ", errorLevel=" + errorLevel
        + ", workers=" + workers + '}';
  }

  private static Optional<String> optional(String value) {
    return Optional.ofNullable(value).map(String::trim).filter(s -> !s.isEmpty());
  }

  private static Path toPath(String raw) {
    try {
      return Path.of(raw);
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException("out must be a valid path (was " + raw + ")", ex);
    }
  }

  private static void requirePresent(Optional<?> value, String key, PublisherMode mode) {
    if (value.isEmpty()) {
      throw new IllegalArgumentException(key + " is required when publisher is " + mode);
    }
  }
}
