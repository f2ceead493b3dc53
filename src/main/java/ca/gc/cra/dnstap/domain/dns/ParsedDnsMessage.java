package ca.gc.cra.dnstap.domain.dns;

import java.util.Objects;

/**
 * Header and first-question view of a decoded DNS wire message.
 *
 * <p>Only the parts the event translator publishes are retained; the record is discarded once the event is
 * built.</p>
 *
 * @param qname first question name, fully qualified with a trailing dot
 * @param qclass first question class mnemonic (e.g. {@code IN})
 * @param qtype first question type mnemonic (e.g. {@code AAAA})
 * @param rcode response code mnemonic including extended EDNS bits (e.g. {@code NXDOMAIN})
 * @param flags header flag bits
 * @since 0.1.0
 */
public record ParsedDnsMessage(String qname, String qclass, String qtype, String rcode, HeaderFlags flags) {

  public ParsedDnsMessage {
    Objects.requireNonNull(qname, "qname");
    Objects.requireNonNull(qclass, "qclass");
    Objects.requireNonNull(qtype, "qtype");
    Objects.requireNonNull(rcode, "rcode");
    Objects.requireNonNull(flags, "flags");
  }

  /**
   * The six boolean header bits published with every event.
   *
   * @param authoritative AA
   * @param truncated TC
   * @param recursionDesired RD
   * @param recursionAvailable RA
   * @param authenticatedData AD
   * @param checkingDisabled CD
   */
  public record HeaderFlags(
      boolean authoritative,
      boolean truncated,
      boolean recursionDesired,
      boolean recursionAvailable,
      boolean authenticatedData,
      boolean checkingDisabled) {}
}
