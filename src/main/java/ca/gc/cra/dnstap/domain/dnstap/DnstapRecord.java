package ca.gc.cra.dnstap.domain.dnstap;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> One decoded dnstap transaction: a single observed DNS query or response together with
 * its transport metadata and the raw DNS wire message.
 * <p><strong>Why:</strong> Gives the translator a typed, read-only view of a frame after the transport layer has
 * decoded the dnstap envelope.</p>
 * <p><strong>Role:</strong> Domain value object handed from record sources to the event handler.</p>
 * <p><strong>Thread-safety:</strong> Immutable; byte arrays are copied on the way in and on the way out.</p>
 * <p><strong>Performance:</strong> Accessors for byte fields allocate a copy; the handler reads each once.</p>
 *
 * @implNote Absent byte fields are represented as empty arrays and absent enums as {@link Optional#empty()},
 *     matching the protobuf convention of unset optional fields.
 * @since 0.1.0
 */
public final class DnstapRecord {
  private static final byte[] EMPTY = new byte[0];

  private final MessageType type;
  private final byte[] identity;
  private final byte[] version;
  private final byte[] extra;
  private final SocketFamily socketFamily;
  private final SocketProtocol socketProtocol;
  private final long queryTimeSec;
  private final int queryTimeNsec;
  private final byte[] queryAddress;
  private final int queryPort;
  private final long responseTimeSec;
  private final int responseTimeNsec;
  private final byte[] responseAddress;
  private final int responsePort;
  private final byte[] queryZone;
  private final byte[] queryMessage;
  private final byte[] responseMessage;

  private DnstapRecord(Builder builder) {
    this.type = Objects.requireNonNull(builder.type, "type");
    this.identity = copy(builder.identity);
    this.version = copy(builder.version);
    this.extra = copy(builder.extra);
    this.socketFamily = builder.socketFamily;
    this.socketProtocol = builder.socketProtocol;
    this.queryTimeSec = builder.queryTimeSec;
    this.queryTimeNsec = requireNanos("queryTimeNsec", builder.queryTimeNsec);
    this.queryAddress = copy(builder.queryAddress);
    this.queryPort = requirePort("queryPort", builder.queryPort);
    this.responseTimeSec = builder.responseTimeSec;
    this.responseTimeNsec = requireNanos("responseTimeNsec", builder.responseTimeNsec);
    this.responseAddress = copy(builder.responseAddress);
    this.responsePort = requirePort("responsePort", builder.responsePort);
    this.queryZone = copy(builder.queryZone);
    this.queryMessage = copy(builder.queryMessage);
    this.responseMessage = copy(builder.responseMessage);
  }

  /**
   * Starts a builder for a record of the given type.
   *
   * @param type message type; must not be {@code null}
   * @return new builder
   */
  public static Builder builder(MessageType type) {
    return new Builder().type(type);
  }

  public MessageType type() {
    return type;
  }

  public byte[] identity() {
    return identity.clone();
  }

  public byte[] version() {
    return version.clone();
  }

  public byte[] extra() {
    return extra.clone();
  }

  public Optional<SocketFamily> socketFamily() {
    return Optional.ofNullable(socketFamily);
  }

  public Optional<SocketProtocol> socketProtocol() {
    return Optional.ofNullable(socketProtocol);
  }

  public long queryTimeSec() {
    return queryTimeSec;
  }

  public int queryTimeNsec() {
    return queryTimeNsec;
  }

  public byte[] queryAddress() {
    return queryAddress.clone();
  }

  public int queryPort() {
    return queryPort;
  }

  public long responseTimeSec() {
    return responseTimeSec;
  }

  public int responseTimeNsec() {
    return responseTimeNsec;
  }

  public byte[] responseAddress() {
    return responseAddress.clone();
  }

  public int responsePort() {
    return responsePort;
  }

  public byte[] queryZone() {
    return queryZone.clone();
  }

  public byte[] queryMessage() {
    return queryMessage.clone();
  }

  public byte[] responseMessage() {
    return responseMessage.clone();
  }

  /**
   * Reports whether the query-side wire message carries any bytes.
   *
   * @return {@code true} when a query payload is present
   */
  public boolean hasQueryMessage() {
    return queryMessage.length > 0;
  }

  /**
   * Reports whether the response-side wire message carries any bytes.
   *
   * @return {@code true} when a response payload is present
   */
  public boolean hasResponseMessage() {
    return responseMessage.length > 0;
  }

  @Override
  public String toString() {
    return "DnstapRecord{type=" + type
        + ", queryMessage=" + queryMessage.length + "B"
        + ", responseMessage=" + responseMessage.length + "B}";
  }

  private static byte[] copy(byte[] value) {
    return value == null || value.length == 0 ? EMPTY : Arrays.copyOf(value, value.length);
  }

  private static int requirePort(String name, int port) {
    if (port < 0 || port > 65535) {
      throw new IllegalArgumentException(name + " must be between 0 and 65535 (was " + port + ")");
    }
    return port;
  }

  private static int requireNanos(String name, int nanos) {
    if (nanos < 0 || nanos > 999_999_999) {
      throw new IllegalArgumentException(name + " must be between 0 and 999999999 (was " + nanos + ")");
    }
    return nanos;
  }

  /**
   * Mutable builder for {@link DnstapRecord}. Not thread-safe.
   */
  public static final class Builder {
    private MessageType type;
    private byte[] identity;
    private byte[] version;
    private byte[] extra;
    private SocketFamily socketFamily;
    private SocketProtocol socketProtocol;
    private long queryTimeSec;
    private int queryTimeNsec;
    private byte[] queryAddress;
    private int queryPort;
    private long responseTimeSec;
    private int responseTimeNsec;
    private byte[] responseAddress;
    private int responsePort;
    private byte[] queryZone;
    private byte[] queryMessage;
    private byte[] responseMessage;

    private Builder() {}

    public Builder type(MessageType type) {
      this.type = type;
      return this;
    }

    public Builder identity(byte[] identity) {
      this.identity = identity;
      return this;
    }

    public Builder version(byte[] version) {
      this.version = version;
      return this;
    }

    public Builder extra(byte[] extra) {
      this.extra = extra;
      return this;
    }

    public Builder socketFamily(SocketFamily socketFamily) {
      this.socketFamily = socketFamily;
      return this;
    }

    public Builder socketProtocol(SocketProtocol socketProtocol) {
      this.socketProtocol = socketProtocol;
      return this;
    }

    public Builder queryTime(long seconds, int nanos) {
      this.queryTimeSec = seconds;
      this.queryTimeNsec = nanos;
      return this;
    }

    public Builder queryAddress(byte[] queryAddress) {
      this.queryAddress = queryAddress;
      return this;
    }

    public Builder queryPort(int queryPort) {
      this.queryPort = queryPort;
      return this;
    }

    public Builder responseTime(long seconds, int nanos) {
      this.responseTimeSec = seconds;
      this.responseTimeNsec = nanos;
      return this;
    }

    public Builder responseAddress(byte[] responseAddress) {
      this.responseAddress = responseAddress;
      return this;
    }

    public Builder responsePort(int responsePort) {
      this.responsePort = responsePort;
      return this;
    }

    public Builder queryZone(byte[] queryZone) {
      this.queryZone = queryZone;
      return this;
    }

    public Builder queryMessage(byte[] queryMessage) {
      this.queryMessage = queryMessage;
      return this;
    }

    public Builder responseMessage(byte[] responseMessage) {
      this.responseMessage = responseMessage;
      return this;
    }

    /**
     * Builds the immutable record.
     *
     * @return record snapshot of the builder state
     * @throws NullPointerException if no type was set
     * @throws IllegalArgumentException if a port or nanosecond field is out of range
     */
    public DnstapRecord build() {
      return new DnstapRecord(this);
    }
  }
}
