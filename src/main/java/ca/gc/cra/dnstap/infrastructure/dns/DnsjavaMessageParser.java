package ca.gc.cra.dnstap.infrastructure.dns;

import ca.gc.cra.dnstap.application.error.MalformedPayloadException;
import ca.gc.cra.dnstap.application.port.DnsMessageParser;
import ca.gc.cra.dnstap.domain.dns.ParsedDnsMessage;
import java.io.IOException;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.xbill.DNS.DClass;
import org.xbill.DNS.Flags;
import org.xbill.DNS.Header;
import org.xbill.DNS.Message;
import org.xbill.DNS.Name;
import org.xbill.DNS.Rcode;
import org.xbill.DNS.Record;
import org.xbill.DNS.Type;
import org.xbill.DNS.WireParseException;

/**
 * {@link DnsMessageParser} backed by dnsjava's wire decoder.
 *
 * <p>Mnemonics come from dnsjava's tables, so unassigned codes render as {@code TYPE65280},
 * {@code CLASS4660}, or {@code RESERVED3841}. The response code includes any extended bits carried in an OPT
 * record.</p>
 *
 * @since 0.1.0
 */
public final class DnsjavaMessageParser implements DnsMessageParser {
  private static final Logger log = LoggerFactory.getLogger(DnsjavaMessageParser.class);

  @Override
  public ParsedDnsMessage parse(byte[] wire) throws MalformedPayloadException {
    if (wire == null || wire.length == 0) {
      throw new MalformedPayloadException("DNS payload is empty");
    }
    Message message;
    try {
      message = new Message(wire);
    } catch (WireParseException ex) {
      throw new MalformedPayloadException("can't parse DNS message: " + ex.getMessage(), ex);
    } catch (IOException | IllegalArgumentException ex) {
      throw new MalformedPayloadException("can't read DNS message: " + ex.getMessage(), ex);
    }

    Record question = message.getQuestion();
    if (question == null) {
      throw new MalformedPayloadException("DNS question section is empty");
    }
    Header header = message.getHeader();
    ParsedDnsMessage.HeaderFlags flags = new ParsedDnsMessage.HeaderFlags(
        header.getFlag(Flags.AA),
        header.getFlag(Flags.TC),
        header.getFlag(Flags.RD),
        header.getFlag(Flags.RA),
        header.getFlag(Flags.AD),
        header.getFlag(Flags.CD));
    return new ParsedDnsMessage(
        question.getName().toString(),
        DClass.string(question.getDClass()),
        Type.string(question.getType()),
        Rcode.string(message.getRcode()),
        flags);
  }

  @Override
  public Optional<String> decodeName(byte[] wire) {
    if (wire == null || wire.length == 0) {
      return Optional.empty();
    }
    try {
      return Optional.of(new Name(wire).toString());
    } catch (IOException ex) {
      log.debug("Ignoring undecodable zone name: {}", ex.getMessage());
      return Optional.empty();
    }
  }
}
