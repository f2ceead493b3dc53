package ca.gc.cra.dnstap.domain.event;

/**
 * Field names of published DNS events, in the order the translator emits them.
 *
 * @since 0.1.0
 */
public final class DnsEventFields {
  public static final String TIMESTAMP = "@timestamp";
  public static final String IDENTITY = "identity";
  public static final String QUERY_ADDRESS = "query_address";
  public static final String QUERY_PORT = "query_port";
  public static final String RESPONSE_ADDRESS = "response_address";
  public static final String RESPONSE_PORT = "response_port";
  public static final String RESPONSE_ZONE = "response_zone";
  public static final String TYPE = "type";
  public static final String SOCKET_FAMILY = "socket_family";
  public static final String SOCKET_PROTOCOL = "socket_protocol";
  public static final String VERSION = "version";
  public static final String EXTRA = "extra";
  public static final String QNAME = "qname";
  public static final String QCLASS = "qclass";
  public static final String QTYPE = "qtype";
  public static final String RCODE = "rcode";
  public static final String AA = "aa";
  public static final String TC = "tc";
  public static final String RD = "rd";
  public static final String RA = "ra";
  public static final String AD = "ad";
  public static final String CD = "cd";
  public static final String TLD = "tld";
  public static final String SLD = "2ld";
  public static final String THIRD_LD = "3ld";
  public static final String FOURTH_LD = "4ld";

  private DnsEventFields() {}
}
