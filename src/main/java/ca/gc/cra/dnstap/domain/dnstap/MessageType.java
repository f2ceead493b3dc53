package ca.gc.cra.dnstap.domain.dnstap;

import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> The twelve dnstap message types, each a pairing of {@link DnstapRole} and
 * {@link MessageClass}.
 * <p><strong>Why:</strong> Classification into query and response legs drives which clock, address, and port the
 * translator reads from a record.</p>
 * <p><strong>Role:</strong> Domain value carried by {@link DnstapRecord}.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @implNote {@link #code()} mirrors the numeric values of the dnstap protobuf schema so frame decoders can map
 *     wire values with {@link #fromCode(int)}.
 * @since 0.1.0
 */
public enum MessageType {
  AUTH_QUERY(1, DnstapRole.AUTH, MessageClass.QUERY),
  AUTH_RESPONSE(2, DnstapRole.AUTH, MessageClass.RESPONSE),
  RESOLVER_QUERY(3, DnstapRole.RESOLVER, MessageClass.QUERY),
  RESOLVER_RESPONSE(4, DnstapRole.RESOLVER, MessageClass.RESPONSE),
  CLIENT_QUERY(5, DnstapRole.CLIENT, MessageClass.QUERY),
  CLIENT_RESPONSE(6, DnstapRole.CLIENT, MessageClass.RESPONSE),
  FORWARDER_QUERY(7, DnstapRole.FORWARDER, MessageClass.QUERY),
  FORWARDER_RESPONSE(8, DnstapRole.FORWARDER, MessageClass.RESPONSE),
  STUB_QUERY(9, DnstapRole.STUB, MessageClass.QUERY),
  STUB_RESPONSE(10, DnstapRole.STUB, MessageClass.RESPONSE),
  TOOL_QUERY(11, DnstapRole.TOOL, MessageClass.QUERY),
  TOOL_RESPONSE(12, DnstapRole.TOOL, MessageClass.RESPONSE);

  private final int code;
  private final DnstapRole role;
  private final MessageClass messageClass;

  MessageType(int code, DnstapRole role, MessageClass messageClass) {
    this.code = code;
    this.role = role;
    this.messageClass = messageClass;
  }

  /**
   * Returns the dnstap schema value for this type.
   *
   * @return protobuf enum number
   */
  public int code() {
    return code;
  }

  /**
   * Returns the software role that observed the message.
   *
   * @return observing role
   */
  public DnstapRole role() {
    return role;
  }

  /**
   * Returns whether this type describes a query or a response.
   *
   * @return message class
   */
  public MessageClass messageClass() {
    return messageClass;
  }

  /**
   * Resolves a type from its role and class.
   *
   * @param role observing role; must not be {@code null}
   * @param messageClass query or response; must not be {@code null}
   * @return matching message type
   */
  static MessageType of(DnstapRole role, MessageClass messageClass) {
    Objects.requireNonNull(role, "role");
    Objects.requireNonNull(messageClass, "messageClass");
    for (MessageType type : values()) {
      if (type.role == role && type.messageClass == messageClass) {
        return type;
      }
    }
    throw new IllegalStateException("No message type for " + role + "/" + messageClass);
  }

  /**
   * Maps a dnstap schema value to a type.
   *
   * @param code protobuf enum number
   * @return matching type, or empty when the value is outside the twelve known types
   */
  public static Optional<MessageType> fromCode(int code) {
    for (MessageType type : values()) {
      if (type.code == code) {
        return Optional.of(type);
      }
    }
    return Optional.empty();
  }
}
