package ca.gc.cra.dnstap.application.error;

import ca.gc.cra.dnstap.domain.dnstap.MessageType;

/**
 * Thrown when a built event could not be posted to the publisher.
 *
 * @since 0.1.0
 */
public final class PublishFailedException extends RecordHandlingException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception for a failed post.
   *
   * @param tag publish tag
   * @param type type of the record whose event failed
   * @param cause publisher failure
   */
  public PublishFailedException(String tag, MessageType type, Throwable cause) {
    super(Kind.PUBLISH_FAILED, tag, type, "failed to post event, tag: " + tag, cause);
  }
}
