package ca.gc.cra.dnstap.domain.event;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Flat, anonymized log event derived from one dnstap record.
 * <p><strong>Why:</strong> Publishers need an ordered field map of scalars that serializes identically to JSON,
 * Kafka, or Fluentd.</p>
 * <p><strong>Role:</strong> Domain value object produced by the event handler and consumed by publishers.</p>
 * <p><strong>Thread-safety:</strong> Immutable once built; safe to share across publisher threads.</p>
 *
 * @implNote Values are restricted to {@link String}, {@link Integer}, {@link Long}, and {@link Boolean}.
 * @since 0.1.0
 */
public final class DnsEvent {
  private final Map<String, Object> fields;

  private DnsEvent(Map<String, Object> fields) {
    this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
  }

  /**
   * Creates an empty builder.
   *
   * @return new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns the fields in emission order.
   *
   * @return unmodifiable insertion-ordered view
   */
  public Map<String, Object> fields() {
    return fields;
  }

  /**
   * Looks up a single field.
   *
   * @param name field name
   * @return value when present
   */
  public Optional<Object> get(String name) {
    return Optional.ofNullable(fields.get(name));
  }

  /**
   * Looks up a string field.
   *
   * @param name field name
   * @return string value, or empty when absent or not a string
   */
  public Optional<String> getString(String name) {
    Object value = fields.get(name);
    return value instanceof String s ? Optional.of(s) : Optional.empty();
  }

  public boolean contains(String name) {
    return fields.containsKey(name);
  }

  public int size() {
    return fields.size();
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof DnsEvent other && fields.equals(other.fields);
  }

  @Override
  public int hashCode() {
    return fields.hashCode();
  }

  @Override
  public String toString() {
    return "DnsEvent" + fields;
  }

  /**
   * Insertion-ordered builder. Later puts of the same name replace the value but keep the original position.
   * Not thread-safe.
   */
  public static final class Builder {
    private final Map<String, Object> fields = new LinkedHashMap<>();

    private Builder() {}

    public Builder put(String name, String value) {
      return putScalar(name, value);
    }

    public Builder put(String name, int value) {
      return putScalar(name, value);
    }

    public Builder put(String name, long value) {
      return putScalar(name, value);
    }

    public Builder put(String name, boolean value) {
      return putScalar(name, value);
    }

    private Builder putScalar(String name, Object value) {
      Objects.requireNonNull(name, "name");
      fields.put(name, Objects.requireNonNull(value, name));
      return this;
    }

    public DnsEvent build() {
      return new DnsEvent(fields);
    }
  }
}
