package org.crmbridge.account.messaging.publisher;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.cloud.stream.function.StreamBridge;
import org.springframework.lang.Nullable;
import org.springframework.messaging.Message;
import org.springframework.messaging.MessageHeaders;
import org.springframework.messaging.support.MessageBuilder;
import org.springframework.stereotype.Component;
import org.springframework.util.MimeTypeUtils;

import org.crmbridge.account.config.AccountServiceProperties;
import org.crmbridge.account.domain.AccountEvent;
import org.crmbridge.account.http.CorrelationIdFilter;

/**
 * Publishes account events through Spring Cloud Stream.
 *
 * <p>Encapsulates Spring Cloud Stream message publishing, keeping the pipeline decoupled from
 * messaging infrastructure. The send runs on {@code eventPublishExecutor} so it can be bounded by
 * {@code account-service.events.publish-timeout-seconds}.
 */
@Component
public class StreamBridgeEventPublisher implements EventPublisher {

  private static final Logger log = LoggerFactory.getLogger(StreamBridgeEventPublisher.class);

  /** Message header carrying the HTTP correlation ID of the originating request. */
  public static final String CORRELATION_ID_HEADER = "correlationId";

  private final StreamBridge streamBridge;
  private final Executor executor;
  private final Duration timeout;

  public StreamBridgeEventPublisher(
      StreamBridge streamBridge,
      @Qualifier("eventPublishExecutor") Executor executor,
      AccountServiceProperties properties) {
    this.streamBridge = streamBridge;
    this.executor = executor;
    this.timeout = Duration.ofSeconds(properties.getEvents().getPublishTimeoutSeconds());
  }

  @Override
  public void publish(String destination, AccountEvent event) {
    var messageBuilder =
        MessageBuilder.withPayload(event)
            .setHeader(MessageHeaders.CONTENT_TYPE, MimeTypeUtils.APPLICATION_JSON_VALUE);
    var correlationId = MDC.get(CorrelationIdFilter.CORRELATION_ID_MDC_KEY);
    if (correlationId != null) {
      messageBuilder.setHeader(CORRELATION_ID_HEADER, correlationId);
    }
    var message = messageBuilder.build();
    var mdcContext = MDC.getCopyOfContextMap();

    boolean sent;
    try {
      sent =
          CompletableFuture.supplyAsync(
                  () -> sendWithMdc(destination, message, mdcContext), executor)
              .get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      log.warn("Publishing {} event to {} timed out", event.status(), destination);
      throw new EventPublishException(
          PublishErrorKind.CHANNEL_UNAVAILABLE,
          "Event channel did not acknowledge within " + timeout.toSeconds() + " seconds",
          e);
    } catch (ExecutionException e) {
      var cause = e.getCause() != null ? e.getCause() : e;
      log.warn(
          "Publishing {} event to {} failed: {}", event.status(), destination, cause.getMessage());
      throw new EventPublishException(
          PublishErrorKind.CHANNEL_UNAVAILABLE,
          "Failed to publish event to " + destination + ": " + cause.getMessage(),
          cause);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new EventPublishException(
          PublishErrorKind.CHANNEL_UNAVAILABLE, "Interrupted while publishing event", e);
    }

    if (!sent) {
      log.warn("Event channel rejected {} event for destination {}", event.status(), destination);
      throw new EventPublishException(
          PublishErrorKind.REJECTED, "Event channel rejected event for destination " + destination);
    }

    log.info(
        "Published {} event to {}: accountId={}", event.status(), destination, event.accountId());
  }

  private boolean sendWithMdc(
      String destination, Message<AccountEvent> message, @Nullable Map<String, String> mdcContext) {
    if (mdcContext != null) {
      MDC.setContextMap(mdcContext);
    }
    try {
      return streamBridge.send(destination, message);
    } finally {
      MDC.clear();
    }
  }
}
