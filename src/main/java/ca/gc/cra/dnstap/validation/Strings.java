package ca.gc.cra.dnstap.validation;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Validation utilities for strings supplied through configuration.
 * <p><strong>Why:</strong> Publish tags double as Kafka topic names and Fluentd URL path segments, so they are
 * held to the character set both accept.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent access.</p>
 * <p><strong>Observability:</strong> No metrics or logs; validation failures raise {@link IllegalArgumentException}.</p>
 *
 * @implNote Control characters are detected via {@link Character#isISOControl(char)}.
 * @since 0.1.0
 * @see Numbers
 */
public final class Strings {
  private static final Pattern TAG_PATTERN = Pattern.compile("^([A-Za-z0-9._-]+)$");
  private static final int MAX_TAG_LENGTH = 249;

  private Strings() {
    // Utility
  }

  /**
   * Ensures a candidate string is non-null, non-blank, and control-character free.
   *
   * @param name logical parameter name for diagnostics; if {@code null} defaults to {@code "value"}
   * @param value candidate text; must not be {@code null}
   * @return trimmed input
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the trimmed value is blank or contains ISO control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    if (containsControl(raw)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    return trimmed;
  }

  /**
   * Validates a publish tag.
   *
   * @param name logical parameter name for diagnostics
   * @param tag candidate tag; must not be {@code null}
   * @return trimmed tag matching {@code [A-Za-z0-9._-]+}
   * @throws IllegalArgumentException if the tag is blank, too long, or uses unsupported characters
   */
  public static String sanitizeTag(String name, String tag) {
    String sanitized = requireNonBlank(name, tag);
    if (sanitized.length() > MAX_TAG_LENGTH) {
      throw new IllegalArgumentException(message(name, "length must be <= " + MAX_TAG_LENGTH));
    }
    if (!TAG_PATTERN.matcher(sanitized).matches()) {
      throw new IllegalArgumentException(message(name,
          "must only contain letters, digits, dot, underscore, or hyphen"));
    }
    return sanitized;
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
