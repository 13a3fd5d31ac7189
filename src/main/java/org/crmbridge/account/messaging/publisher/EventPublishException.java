package org.crmbridge.account.messaging.publisher;

/** Failure to hand an event to the event channel. */
public class EventPublishException extends RuntimeException {

  private final PublishErrorKind kind;

  public EventPublishException(PublishErrorKind kind, String message) {
    super(message);
    this.kind = kind;
  }

  public EventPublishException(PublishErrorKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  public PublishErrorKind getKind() {
    return kind;
  }
}
