package ca.gc.cra.dnstap.application.error;

import ca.gc.cra.dnstap.domain.dnstap.MessageType;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Non-fatal failure encountered while translating or publishing one dnstap record.
 * <p><strong>Why:</strong> Carries enough context (kind, publish tag, record type) for an error consumer to
 * diagnose the failure without access to the record itself.</p>
 * <p><strong>Role:</strong> Value delivered to {@link ca.gc.cra.dnstap.application.port.ErrorSink}.</p>
 * <p><strong>Thread-safety:</strong> Immutable after construction.</p>
 *
 * @since 0.1.0
 * @see MalformedPayloadException
 * @see PublishFailedException
 */
public abstract class RecordHandlingException extends Exception {
  private static final long serialVersionUID = 1L;

  /** Category of record failure. */
  public enum Kind {
    /** The embedded DNS wire message could not be decoded. */
    MALFORMED_PAYLOAD,
    /** The built event could not be handed to the publisher. */
    PUBLISH_FAILED
  }

  private final Kind kind;
  private final String tag;
  private final MessageType messageType;

  protected RecordHandlingException(
      Kind kind, String tag, MessageType messageType, String message, Throwable cause) {
    super(message, cause);
    this.kind = Objects.requireNonNull(kind, "kind");
    this.tag = tag;
    this.messageType = messageType;
  }

  public Kind kind() {
    return kind;
  }

  /**
   * Returns the publish tag in effect when the failure occurred.
   *
   * @return tag, or empty when the failure happened before a tag was known
   */
  public Optional<String> tag() {
    return Optional.ofNullable(tag);
  }

  /**
   * Returns the type of the record that failed.
   *
   * @return record type, or empty when unknown
   */
  public Optional<MessageType> messageType() {
    return Optional.ofNullable(messageType);
  }
}
