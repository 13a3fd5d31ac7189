package org.crmbridge.account.messaging.publisher;

import org.crmbridge.account.domain.AccountEvent;

/** Boundary to the asynchronous event channel. Delivery is at-least-once. */
public interface EventPublisher {

  /**
   * Publish one event.
   *
   * @param destination Name of the destination on the event channel
   * @param event The event to deliver
   * @throws EventPublishException when the channel is unavailable or the broker rejects the event
   */
  void publish(String destination, AccountEvent event);
}
