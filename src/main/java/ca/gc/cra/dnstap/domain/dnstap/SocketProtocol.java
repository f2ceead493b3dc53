package ca.gc.cra.dnstap.domain.dnstap;

import java.util.Optional;

/**
 * Transport protocol of the socket a DNS message was observed on.
 *
 * <p>{@link #wireName()} is the spelling used by the dnstap schema and is what appears in published events.</p>
 *
 * @since 0.1.0
 */
public enum SocketProtocol {
  UDP(1, "UDP"),
  TCP(2, "TCP"),
  DOT(3, "DOT"),
  DOH(4, "DOH"),
  DNSCRYPT_UDP(5, "DNSCryptUDP"),
  DNSCRYPT_TCP(6, "DNSCryptTCP"),
  DOQ(7, "DOQ");

  private final int code;
  private final String wireName;

  SocketProtocol(int code, String wireName) {
    this.code = code;
    this.wireName = wireName;
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
   * Returns the schema spelling of this protocol.
   *
   * @return schema name such as {@code DNSCryptUDP}
   */
  public String wireName() {
    return wireName;
  }

  /**
   * Maps a dnstap schema value to a protocol.
   *
   * @param code protobuf enum number
   * @return matching protocol or empty when unknown
   */
  public static Optional<SocketProtocol> fromCode(int code) {
    for (SocketProtocol protocol : values()) {
      if (protocol.code == code) {
        return Optional.of(protocol);
      }
    }
    return Optional.empty();
  }
}
