package ca.gc.cra.dnstap.application.error;

import ca.gc.cra.dnstap.domain.dnstap.MessageType;

/**
 * Thrown when a record's DNS wire payload is empty, truncated, or lacks a question entry.
 *
 * @since 0.1.0
 */
public final class MalformedPayloadException extends RecordHandlingException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception with a descriptive message.
   *
   * @param message human-readable reason
   */
  public MalformedPayloadException(String message) {
    this(message, null);
  }

  /**
   * Creates an exception with a message and the decoder's cause.
   *
   * @param message human-readable reason
   * @param cause underlying wire decoding failure; may be {@code null}
   */
  public MalformedPayloadException(String message, Throwable cause) {
    super(Kind.MALFORMED_PAYLOAD, null, null, message, cause);
  }

  private MalformedPayloadException(String tag, MessageType type, MalformedPayloadException origin) {
    super(Kind.MALFORMED_PAYLOAD, tag, type, origin.getMessage(), origin.getCause());
  }

  /**
   * Returns a copy of this exception annotated with the handler's context.
   *
   * @param tag publish tag
   * @param type record type
   * @return annotated exception
   */
  public MalformedPayloadException withContext(String tag, MessageType type) {
    return new MalformedPayloadException(tag, type, this);
  }
}
