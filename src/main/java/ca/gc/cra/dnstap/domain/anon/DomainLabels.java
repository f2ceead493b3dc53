package ca.gc.cra.dnstap.domain.anon;

import ca.gc.cra.dnstap.domain.event.DnsEventFields;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Derives the hierarchical suffix fields {@code tld}, {@code 2ld}, {@code 3ld}, and {@code 4ld} from a query name.
 *
 * <p>Depth {@code d} (2 through 5) counts labels including the root. When the name has at least {@code d - 1}
 * non-root labels the field holds its last {@code d - 1} labels; otherwise it holds the whole name. For
 * {@code www.example.com.} that yields {@code com}, {@code example.com}, {@code www.example.com}, and
 * {@code www.example.com}.</p>
 *
 * <p>Stateless and thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class DomainLabels {
  private static final List<Depth> DEPTHS = List.of(
      new Depth(2, DnsEventFields.TLD),
      new Depth(3, DnsEventFields.SLD),
      new Depth(4, DnsEventFields.THIRD_LD),
      new Depth(5, DnsEventFields.FOURTH_LD));

  private DomainLabels() {}

  /**
   * Returns the fixed depth table.
   *
   * @return unmodifiable depth to field-name mapping in ascending depth order
   */
  public static Map<Integer, String> fieldNames() {
    Map<Integer, String> names = new LinkedHashMap<>();
    for (Depth depth : DEPTHS) {
      names.put(depth.depth(), depth.fieldName());
    }
    return Collections.unmodifiableMap(names);
  }

  /**
   * Computes every suffix field for a name.
   *
   * @param name query name, absolute or relative; must not be {@code null}
   * @return insertion-ordered field name to value map ({@code tld} first)
   */
  public static Map<String, String> decompose(String name) {
    Objects.requireNonNull(name, "name");
    String relative = relative(name);
    String[] labels = split(relative);
    Map<String, String> out = new LinkedHashMap<>();
    for (Depth depth : DEPTHS) {
      out.put(depth.fieldName(), suffix(labels, depth.depth(), relative));
    }
    return out;
  }

  /**
   * Computes a single suffix value.
   *
   * @param name query name, absolute or relative; must not be {@code null}
   * @param depth label depth including the root label, 2 to 5
   * @return suffix of {@code depth - 1} labels, or the whole relative name when it is too short
   */
  static String suffix(String name, int depth) {
    Objects.requireNonNull(name, "name");
    if (depth < 2) {
      throw new IllegalArgumentException("depth must be at least 2 (was " + depth + ")");
    }
    String relative = relative(name);
    return suffix(split(relative), depth, relative);
  }

  private static String suffix(String[] labels, int depth, String fallback) {
    int take = depth - 1;
    if (labels.length < take) {
      return fallback;
    }
    return String.join(".", Arrays.copyOfRange(labels, labels.length - take, labels.length));
  }

  private static String relative(String name) {
    if (name.length() > 1 && name.endsWith(".")) {
      return name.substring(0, name.length() - 1);
    }
    return name;
  }

  private static String[] split(String relative) {
    if (relative.isEmpty() || relative.equals(".")) {
      return new String[0];
    }
    return relative.split("\\.", -1);
  }

  private record Depth(int depth, String fieldName) {}
}
