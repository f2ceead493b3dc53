package ca.gc.cra.dnstap.domain.dnstap;

import java.util.Optional;

/**
 * Network family of the socket a DNS message was observed on.
 *
 * @since 0.1.0
 */
public enum SocketFamily {
  /** IPv4. */
  INET(1),
  /** IPv6. */
  INET6(2);

  private final int code;

  SocketFamily(int code) {
    this.code = code;
  }

  /**
   * Returns the dnstap schema value.
   *
   * @return protobuf enum number
   */
  public int code() {
    return code;
  }

  /**
   * Maps a dnstap schema value to a family.
   *
   * @param code protobuf enum number
   * @return matching family or empty when unknown
   */
  public static Optional<SocketFamily> fromCode(int code) {
    for (SocketFamily family : values()) {
      if (family.code == code) {
        return Optional.of(family);
      }
    }
    return Optional.empty();
  }
}
