package ca.gc.cra.dnstap.config;

import java.util.Locale;

/**
 * Destination kinds supported for translated DNS events.
 *
 * @since 0.1.0
 */
public enum PublisherMode {
  /** Kafka topic named after the tag. */
  KAFKA,
  /** Fluentd {@code in_http} endpoint; the tag becomes the last path segment. */
  FLUENTD,
  /** Newline-delimited JSON files, one per tag. */
  FILE,
  /** SLF4J logger {@code dnstap.events}. */
  LOG;

  /**
   * Parses a case-insensitive publisher name.
   *
   * @param raw configured value
   * @return matching mode
   * @throws IllegalArgumentException if the value names no mode
   */
  public static PublisherMode fromString(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("publisher must not be blank");
    }
    try {
      return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException(
          "publisher must be one of KAFKA, FLUENTD, FILE, LOG (was " + raw + ")", ex);
    }
  }
}
