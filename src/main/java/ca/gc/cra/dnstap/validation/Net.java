package ca.gc.cra.dnstap.validation;

import com.google.common.net.InetAddresses;
import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Network endpoint validation for publisher configuration: Kafka bootstrap lists and Fluentd HTTP endpoints.
 */
public final class Net {
  private static final int MAX_HOSTNAME_LENGTH = 253;
  private static final int MAX_LABEL_LENGTH = 63;

  private Net() {
    // Utility
  }

  /**
   * Validates a comma-separated {@code host:port} list such as a Kafka bootstrap string.
   *
   * @param value candidate list; IPv6 literals must be bracketed
   * @return normalized list joined with commas and no whitespace
   * @throws IllegalArgumentException if any entry is malformed
   */
  public static String validateHostPortList(String value) {
    String sanitized = Strings.requireNonBlank("hostPortList", value);
    List<String> normalized = new ArrayList<>();
    for (String entry : sanitized.split(",")) {
      String trimmed = entry.trim();
      if (trimmed.isEmpty()) {
        throw new IllegalArgumentException("host:port list must not contain empty entries");
      }
      normalized.add(validateHostPort(trimmed));
    }
    return String.join(",", normalized);
  }

  /** Validates a single host:port string supporting hostnames, IPv4, and bracketed IPv6 literals. */
  public static String validateHostPort(String value) {
    String sanitized = Strings.requireNonBlank("host:port", value);
    String host;
    String portPart;
    if (sanitized.startsWith("[")) {
      int idx = sanitized.indexOf(']');
      if (idx < 0 || idx + 2 > sanitized.length() || sanitized.charAt(idx + 1) != ':') {
        throw new IllegalArgumentException("host:port must use [IPv6]:PORT format (was " + sanitized + ")");
      }
      host = sanitized.substring(1, idx);
      portPart = sanitized.substring(idx + 2);
      requireIpv6Literal(host);
      host = '[' + host + ']';
    } else {
      int lastColon = sanitized.lastIndexOf(':');
      if (lastColon <= 0 || lastColon == sanitized.length() - 1) {
        throw new IllegalArgumentException("host:port must use HOST:PORT format (was " + sanitized + ")");
      }
      host = sanitized.substring(0, lastColon);
      portPart = sanitized.substring(lastColon + 1);
      if (host.indexOf(':') >= 0) {
        throw new IllegalArgumentException("IPv6 host must be wrapped in [ ]");
      }
      if (!InetAddresses.isInetAddress(host)) {
        validateHostname(host);
      }
    }
    int port = Numbers.parseIntInRange("port", portPart, 1, 65535);
    return host + ':' + port;
  }

  /**
   * Validates an absolute HTTP or HTTPS endpoint.
   *
   * @param name logical parameter name for diagnostics
   * @param raw candidate URI text
   * @return parsed URI with any trailing slash removed from the path
   * @throws IllegalArgumentException if the URI is malformed, not http(s), or lacks a host
   */
  public static URI validateHttpEndpoint(String name, String raw) {
    String trimmed = Strings.requireNonBlank(name, raw);
    URI uri;
    try {
      uri = new URI(trimmed);
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException(name + " must be a valid URI", ex);
    }
    String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
    if (!scheme.equals("http") && !scheme.equals("https")) {
      throw new IllegalArgumentException(name + " must use http or https scheme");
    }
    if (uri.getHost() == null || uri.getHost().isBlank()) {
      throw new IllegalArgumentException(name + " must include a host");
    }
    if (trimmed.endsWith("/")) {
      return URI.create(trimmed.substring(0, trimmed.length() - 1));
    }
    return uri;
  }

  private static void validateHostname(String host) {
    if (host.isEmpty() || host.length() > MAX_HOSTNAME_LENGTH) {
      throw new IllegalArgumentException(
          "invalid hostname length: " + host.length() + " (must be 1.." + MAX_HOSTNAME_LENGTH + ')');
    }
    for (String label : host.split("\\.", -1)) {
      if (label.isEmpty() || label.length() > MAX_LABEL_LENGTH) {
        throw new IllegalArgumentException("invalid hostname label in " + host);
      }
      if (!isAsciiAlnum(label.charAt(0)) || !isAsciiAlnum(label.charAt(label.length() - 1))) {
        throw new IllegalArgumentException("invalid hostname: labels must start/end with alphanumeric");
      }
      for (int i = 1; i < label.length() - 1; i++) {
        char c = label.charAt(i);
        if (!isAsciiAlnum(c) && c != '-') {
          throw new IllegalArgumentException("invalid hostname: illegal character '" + c + '\'');
        }
      }
    }
  }

  private static void requireIpv6Literal(String host) {
    if (!InetAddresses.isInetAddress(host)) {
      throw new IllegalArgumentException("invalid IPv6 literal: " + host);
    }
    InetAddress address = InetAddresses.forString(host);
    if (!(address instanceof Inet6Address)) {
      throw new IllegalArgumentException("invalid IPv6 literal: " + host);
    }
  }

  private static boolean isAsciiAlnum(char c) {
    return (c >= 'a' && c <= 'z')
        || (c >= 'A' && c <= 'Z')
        || (c >= '0' && c <= '9');
  }
}
