package ca.gc.cra.dnstap.testutil;

import java.io.IOException;
import org.xbill.DNS.DClass;
import org.xbill.DNS.Flags;
import org.xbill.DNS.Message;
import org.xbill.DNS.Name;
import org.xbill.DNS.Record;
import org.xbill.DNS.Section;
import org.xbill.DNS.Type;

/** Builds DNS wire messages with dnsjava for handler and parser tests. */
public final class DnsWireFixtures {
  private DnsWireFixtures() {}

  /** Recursive A query for {@code name}. */
  public static byte[] query(String name) throws IOException {
    return query(name, Type.A);
  }

  public static byte[] query(String name, int type) throws IOException {
    Message message = Message.newQuery(Record.newRecord(Name.fromString(name), type, DClass.IN));
    return message.toWire();
  }

  /** Authoritative response to an A query for {@code name} with the given rcode. */
  public static byte[] response(String name, int rcode) throws IOException {
    Message message = new Message(4242);
    message.getHeader().setFlag(Flags.QR);
    message.getHeader().setFlag(Flags.AA);
    message.getHeader().setFlag(Flags.RD);
    message.getHeader().setRcode(rcode);
    message.addRecord(Record.newRecord(Name.fromString(name), Type.A, DClass.IN), Section.QUESTION);
    return message.toWire();
  }

  /** Header-only message: valid wire, no question. */
  public static byte[] withoutQuestion() {
    return new Message(7).toWire();
  }

  /** Uncompressed wire form of a domain name. */
  public static byte[] name(String name) throws IOException {
    return Name.fromString(name).toWire();
  }
}
