package ca.gc.cra.dnstap.application.port;

import ca.gc.cra.dnstap.application.error.MalformedPayloadException;
import ca.gc.cra.dnstap.domain.dns.ParsedDnsMessage;
import java.util.Optional;

/**
 * Decodes a DNS wire-format message into the header and first-question fields the translator publishes.
 *
 * <p>Implementations are stateless and thread-safe.</p>
 *
 * @since 0.1.0
 */
public interface DnsMessageParser {
  /**
   * Parses a wire-format DNS message.
   *
   * @param wire raw message bytes; may be empty
   * @return parsed header and first question
   * @throws MalformedPayloadException if the bytes are empty, malformed, or carry no question
   */
  ParsedDnsMessage parse(byte[] wire) throws MalformedPayloadException;

  /**
   * Decodes a standalone wire-format domain name, such as a dnstap query zone.
   *
   * @param wire uncompressed wire name; may be empty
   * @return absolute presentation form, or empty when the bytes are absent or invalid
   */
  Optional<String> decodeName(byte[] wire);
}
