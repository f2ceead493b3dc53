package ca.gc.cra.dnstap.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Supplies the flattened default configuration map.
 *
 * <p>The defaults remain the single source of truth for optional YAML keys and override maps.</p>
 */
public final class ConfigDefaults {
  static final int DEFAULT_IPV4_MASK = 24;
  static final int DEFAULT_IPV6_MASK = 48;
  static final String DEFAULT_TAG = "dnstap.full";
  static final String DEFAULT_ERROR_LEVEL = "WARN";
  static final int DEFAULT_FLUENTD_TIMEOUT_MS = 5000;
  static final int DEFAULT_WORKERS = 4;
  static final int DEFAULT_ERROR_QUEUE_CAPACITY = 1024;

  private static final Map<String, String> DEFAULTS = buildDefaults();

  private ConfigDefaults() {}

  /**
   * Returns every configuration key with its default value.
   *
   * @return unmodifiable, insertion-ordered map of default key/value pairs as strings
   */
  public static Map<String, String> asFlatMap() {
    return DEFAULTS;
  }

  private static Map<String, String> buildDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("ipv4Mask", Integer.toString(DEFAULT_IPV4_MASK));
    map.put("ipv6Mask", Integer.toString(DEFAULT_IPV6_MASK));
    map.put("tag", DEFAULT_TAG);
    map.put("errorLevel", DEFAULT_ERROR_LEVEL);
    map.put("publisher", PublisherMode.LOG.name());
    map.put("kafkaBootstrap", "");
    map.put("fluentdEndpoint", "");
    map.put("fluentdTimeoutMs", Integer.toString(DEFAULT_FLUENTD_TIMEOUT_MS));
    map.put("out", "");
    map.put("workers", Integer.toString(DEFAULT_WORKERS));
    map.put("errorQueueCapacity", Integer.toString(DEFAULT_ERROR_QUEUE_CAPACITY));
    map.put("metricsExporter", "otlp");
    return Collections.unmodifiableMap(map);
  }
}
