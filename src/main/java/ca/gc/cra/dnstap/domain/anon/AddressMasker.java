package ca.gc.cra.dnstap.domain.anon;

import ca.gc.cra.dnstap.validation.Numbers;
import com.google.common.net.InetAddresses;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Optional;

/**
 * <strong>What:</strong> Truncates IP addresses to a configured network prefix before they leave the process.
 * <p><strong>Why:</strong> Published DNS telemetry must never carry a full client or server address.</p>
 * <p><strong>Role:</strong> Domain service used by the event handler for {@code query_address} and
 * {@code response_address}.</p>
 * <p><strong>Thread-safety:</strong> Immutable; the two masks are computed once at construction.</p>
 * <p><strong>Performance:</strong> One array copy and one formatting pass per address.</p>
 *
 * @implNote The mask is selected by address length alone (4 bytes IPv4, 16 bytes IPv6), independent of the
 *     record's socket family. A 16-byte IPv4-mapped address is formatted in dotted-quad form.
 * @since 0.1.0
 */
public final class AddressMasker {
  private static final int IPV4_BYTES = 4;
  private static final int IPV6_BYTES = 16;

  private final int ipv4PrefixLength;
  private final int ipv6PrefixLength;
  private final byte[] ipv4Mask;
  private final byte[] ipv6Mask;

  /**
   * Builds the IPv4 and IPv6 masks.
   *
   * @param ipv4PrefixLength retained IPv4 prefix bits, 0 to 32
   * @param ipv6PrefixLength retained IPv6 prefix bits, 0 to 128
   * @throws IllegalArgumentException if a prefix length is out of range
   */
  public AddressMasker(int ipv4PrefixLength, int ipv6PrefixLength) {
    this.ipv4PrefixLength = (int) Numbers.requireRange("ipv4Mask", ipv4PrefixLength, 0, 32);
    this.ipv6PrefixLength = (int) Numbers.requireRange("ipv6Mask", ipv6PrefixLength, 0, 128);
    this.ipv4Mask = prefixMask(ipv4PrefixLength, IPV4_BYTES);
    this.ipv6Mask = prefixMask(ipv6PrefixLength, IPV6_BYTES);
  }

  public int ipv4PrefixLength() {
    return ipv4PrefixLength;
  }

  public int ipv6PrefixLength() {
    return ipv6PrefixLength;
  }

  /**
   * Masks a raw address and renders the surviving network prefix.
   *
   * @param address raw address bytes in network order; may be {@code null}
   * @return canonical text of the masked address, or empty when the input is neither 4 nor 16 bytes
   */
  public Optional<String> mask(byte[] address) {
    if (address == null) {
      return Optional.empty();
    }
    byte[] mask = switch (address.length) {
      case IPV4_BYTES -> ipv4Mask;
      case IPV6_BYTES -> ipv6Mask;
      default -> null;
    };
    if (mask == null) {
      return Optional.empty();
    }
    byte[] masked = new byte[address.length];
    for (int i = 0; i < masked.length; i++) {
      masked[i] = (byte) (address[i] & mask[i]);
    }
    try {
      return Optional.of(InetAddresses.toAddrString(InetAddress.getByAddress(masked)));
    } catch (UnknownHostException ex) {
      // getByAddress only rejects illegal lengths, excluded above.
      throw new IllegalStateException("Unexpected address length " + masked.length, ex);
    }
  }

  private static byte[] prefixMask(int prefixLength, int byteLength) {
    byte[] mask = new byte[byteLength];
    int remaining = prefixLength;
    for (int i = 0; i < byteLength && remaining > 0; i++) {
      int bits = Math.min(8, remaining);
      mask[i] = (byte) (0xFF << (8 - bits));
      remaining -= bits;
    }
    return mask;
  }
}
