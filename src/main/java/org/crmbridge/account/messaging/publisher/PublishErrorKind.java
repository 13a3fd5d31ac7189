package org.crmbridge.account.messaging.publisher;

/** Failure categories reported by an {@link EventPublisher}. */
public enum PublishErrorKind {
  /** Transport failure or no acknowledgment within the publish timeout. */
  CHANNEL_UNAVAILABLE,

  /** The binder refused the message. */
  REJECTED,
}
