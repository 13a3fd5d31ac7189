package org.crmbridge.account.service;

import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import com.fasterxml.jackson.databind.JsonNode;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import org.crmbridge.account.client.RecordClient;
import org.crmbridge.account.client.RecordClientErrorKind;
import org.crmbridge.account.client.RecordClientException;
import org.crmbridge.account.config.AccountServiceProperties;
import org.crmbridge.account.domain.AccountEvent;
import org.crmbridge.account.domain.AccountRecord;
import org.crmbridge.account.domain.AccountRequest;
import org.crmbridge.account.domain.CreateOutcome;
import org.crmbridge.account.messaging.publisher.EventPublishException;
import org.crmbridge.account.messaging.publisher.EventPublisher;
import org.crmbridge.account.messaging.publisher.PublishErrorKind;
import org.crmbridge.account.service.dto.PipelineResponse;

/**
 * Orchestrates one account-creation request from inbound payload to caller response.
 *
 * <p><b>Stages:</b>
 *
 * <ol>
 *   <li>Validate the payload ({@link RequestValidator})
 *   <li>Create the record ({@link RecordClient})
 *   <li>Build the event ({@link AccountEventBuilder})
 *   <li>Publish the event ({@link EventPublisher})
 * </ol>
 *
 * <p><b>Responses:</b>
 *
 * <ul>
 *   <li>Validation failure: 400, nothing created or published
 *   <li>Record system rejects input: FAILED event published, 400
 *   <li>Record system fails otherwise: FAILED event published, 500
 *   <li>Record created, publish fails: 500 although the record exists
 *   <li>Record created, event published: 200
 * </ul>
 *
 * <p>Each stage failure is converted to a response where it happens; nothing is retried here. When
 * record creation fails, a publish failure is logged and the create failure is still what the
 * caller sees.
 */
@Service
public class AccountCreationPipeline {

  private static final Logger log = LoggerFactory.getLogger(AccountCreationPipeline.class);

  static final String METRIC_DURATION = "account.creation.duration";
  static final String METRIC_REQUESTS = "account.creation.requests";

  private final RequestValidator requestValidator;
  private final RecordClient recordClient;
  private final AccountEventBuilder eventBuilder;
  private final EventPublisher eventPublisher;
  private final MeterRegistry meterRegistry;
  private final String destination;

  public AccountCreationPipeline(
      RequestValidator requestValidator,
      RecordClient recordClient,
      AccountEventBuilder eventBuilder,
      EventPublisher eventPublisher,
      MeterRegistry meterRegistry,
      AccountServiceProperties properties) {
    this.requestValidator = requestValidator;
    this.recordClient = recordClient;
    this.eventBuilder = eventBuilder;
    this.eventPublisher = eventPublisher;
    this.meterRegistry = meterRegistry;
    this.destination = properties.getEvents().getDestination();
  }

  /**
   * Run the pipeline for one inbound request.
   *
   * @param rawBody The request body as parsed JSON, may be null
   * @param queryAccountName The {@code accountName} query parameter used to label the event
   * @param idempotencyKey The caller's Idempotency-Key header, may be null
   * @return the response for the caller, never null
   */
  public PipelineResponse execute(
      @Nullable JsonNode rawBody,
      @Nullable String queryAccountName,
      @Nullable String idempotencyKey) {
    var sample = Timer.start(meterRegistry);

    AccountRequest request;
    try {
      request = requestValidator.validate(rawBody);
    } catch (AccountValidationException e) {
      log.warn("Rejected account request ({}): {}", e.getKind(), e.getMessage());
      return respond(PipelineStage.RECEIVED, PipelineResponse.badRequest(e.getMessage()), sample);
    }
    transition(PipelineStage.RECEIVED, PipelineStage.VALIDATED);

    CreateOutcome outcome;
    try {
      outcome = recordClient.createAccount(AccountRecord.from(request), idempotencyKey);
    } catch (RecordClientException e) {
      return handleRecordFailure(e, request, queryAccountName, sample);
    } catch (RuntimeException e) {
      log.error("Record client failed unexpectedly for account {}", request.accountName(), e);
      return handleRecordFailure(
          new RecordClientException(RecordClientErrorKind.UNEXPECTED, describe(e), e),
          request,
          queryAccountName,
          sample);
    }
    transition(PipelineStage.VALIDATED, PipelineStage.RECORD_CREATED);

    var event = eventBuilder.build(outcome, request, queryAccountName);
    transition(PipelineStage.RECORD_CREATED, PipelineStage.EVENT_BUILT);

    try {
      publish(event);
    } catch (EventPublishException e) {
      log.error(
          "Account {} was created but its event could not be published ({}): {}",
          outcome.recordId(),
          e.getKind(),
          e.getMessage());
      transition(PipelineStage.EVENT_BUILT, PipelineStage.PUBLISH_FAILED);
      return respond(
          PipelineStage.PUBLISH_FAILED, PipelineResponse.internalError(e.getMessage()), sample);
    }
    transition(PipelineStage.EVENT_BUILT, PipelineStage.PUBLISHED);

    return respond(PipelineStage.PUBLISHED, PipelineResponse.created(outcome.recordId()), sample);
  }

  private PipelineResponse handleRecordFailure(
      RecordClientException failure,
      AccountRequest request,
      @Nullable String queryAccountName,
      Timer.Sample sample) {
    var description = describe(failure);
    log.warn(
        "Salesforce account creation failed for {} ({}): {}",
        request.accountName(),
        failure.getKind(),
        description);
    transition(PipelineStage.VALIDATED, PipelineStage.RECORD_FAILED);

    var event = eventBuilder.build(CreateOutcome.failed(description), request, queryAccountName);
    transition(PipelineStage.RECORD_FAILED, PipelineStage.EVENT_BUILT);

    try {
      publish(event);
      transition(PipelineStage.EVENT_BUILT, PipelineStage.PUBLISHED);
    } catch (EventPublishException e) {
      log.error("FAILED event could not be published ({}): {}", e.getKind(), e.getMessage());
      transition(PipelineStage.EVENT_BUILT, PipelineStage.PUBLISH_FAILED);
    }

    var response =
        failure.getKind() == RecordClientErrorKind.INVALID_INPUT
            ? PipelineResponse.badRequest(description)
            : PipelineResponse.internalError(description);
    return respond(PipelineStage.RECORD_FAILED, response, sample);
  }

  private void publish(AccountEvent event) {
    try {
      eventPublisher.publish(destination, event);
    } catch (EventPublishException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new EventPublishException(PublishErrorKind.CHANNEL_UNAVAILABLE, describe(e), e);
    }
  }

  private PipelineResponse respond(
      PipelineStage terminalStage, PipelineResponse response, Timer.Sample sample) {
    var status = String.valueOf(response.statusCode());
    var stage = terminalStage.name().toLowerCase(Locale.ROOT);

    sample.stop(
        Timer.builder(METRIC_DURATION)
            .tag("status", status)
            .tag("stage", stage)
            .register(meterRegistry));
    meterRegistry.counter(METRIC_REQUESTS, "status", status, "stage", stage).increment();

    transition(terminalStage, PipelineStage.RESPONDED);
    log.info("Account creation responded with HTTP {} after {}", status, terminalStage);
    return response;
  }

  private static void transition(PipelineStage from, PipelineStage to) {
    log.debug("Account creation pipeline: {} -> {}", from, to);
  }

  private static String describe(Exception e) {
    return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
  }
}
