package org.crmbridge.account.client.salesforce;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import reactor.core.Exceptions;
import reactor.core.publisher.Mono;

import org.crmbridge.account.client.RecordClient;
import org.crmbridge.account.client.RecordClientErrorKind;
import org.crmbridge.account.client.RecordClientException;
import org.crmbridge.account.client.salesforce.response.SalesforceCreateResponse;
import org.crmbridge.account.client.salesforce.response.SalesforceErrorResponse;
import org.crmbridge.account.config.AccountServiceProperties;
import org.crmbridge.account.domain.AccountRecord;
import org.crmbridge.account.domain.CreateOutcome;

/**
 * Creates Account sObjects through the Salesforce REST API.
 *
 * <p>HTTP 400 responses are reported as {@link RecordClientErrorKind#INVALID_INPUT}; every other
 * failure, including timeouts and authentication errors, as {@link
 * RecordClientErrorKind#UNEXPECTED}.
 */
@Component
public class SalesforceRecordClient implements RecordClient {

  private static final Logger log = LoggerFactory.getLogger(SalesforceRecordClient.class);

  private static final String USER_AGENT = "AccountServiceClient/1.0";

  private static final TypeReference<List<SalesforceErrorResponse>> ERROR_LIST =
      new TypeReference<>() {};

  private static final int MAX_ERROR_BODY_LENGTH = 500;

  private final WebClient webClient;
  private final ObjectMapper objectMapper;
  private final String accountPath;
  private final Duration timeout;

  public SalesforceRecordClient(
      WebClient.Builder webClientBuilder,
      AccountServiceProperties properties,
      ObjectMapper objectMapper) {
    var salesforceConfig = properties.getSalesforce();

    // properties have @Validated but double checking
    if (salesforceConfig.getAccessToken() == null || salesforceConfig.getAccessToken().isBlank()) {
      throw new IllegalArgumentException("Salesforce access token must be configured");
    }

    this.webClient =
        webClientBuilder
            .baseUrl(salesforceConfig.getBaseUrl())
            .defaultHeader("User-Agent", USER_AGENT)
            .defaultHeaders(headers -> headers.setBearerAuth(salesforceConfig.getAccessToken()))
            .build();
    this.objectMapper = objectMapper;
    this.accountPath = salesforceConfig.buildAccountPath();
    this.timeout = Duration.ofSeconds(salesforceConfig.getTimeoutSeconds());

    log.info("SalesforceRecordClient initialized with base URL: {}", salesforceConfig.getBaseUrl());
  }

  @Override
  public CreateOutcome createAccount(AccountRecord record, @Nullable String idempotencyKey) {
    log.info("Creating Salesforce account: {}", record.name());

    try {
      var response =
          webClient
              .post()
              .uri(accountPath)
              .headers(
                  headers -> {
                    if (idempotencyKey != null && !idempotencyKey.isBlank()) {
                      headers.set(RecordClient.IDEMPOTENCY_KEY_HEADER, idempotencyKey);
                    }
                  })
              .contentType(MediaType.APPLICATION_JSON)
              .accept(MediaType.APPLICATION_JSON)
              .bodyValue(record)
              .retrieve()
              .onStatus(HttpStatusCode::isError, this::handleErrorResponse)
              .bodyToMono(SalesforceCreateResponse.class)
              .timeout(timeout)
              .block();

      if (response == null) {
        throw new RecordClientException(
            RecordClientErrorKind.UNEXPECTED, "Received empty response from Salesforce");
      }

      if (!response.success() || response.id() == null || response.id().isBlank()) {
        var description = describe(response.errors());
        log.warn("Salesforce did not create account {}: {}", record.name(), description);
        throw new RecordClientException(RecordClientErrorKind.INVALID_INPUT, description);
      }

      log.info("Created Salesforce account {} with id {}", record.name(), response.id());
      return CreateOutcome.created(response.id());
    } catch (RecordClientException rce) {
      throw rce;
    } catch (Exception e) {
      var cause = Exceptions.unwrap(e);
      if (cause instanceof TimeoutException) {
        log.warn(
            "Salesforce create timed out after {}s for account {}",
            timeout.toSeconds(),
            record.name());
        throw new RecordClientException(
            RecordClientErrorKind.UNEXPECTED,
            "Salesforce did not respond within " + timeout.toSeconds() + " seconds",
            cause);
      }

      log.warn(
          "Unexpected error creating Salesforce account {}: {}",
          record.name(),
          cause.getMessage(),
          cause);
      throw new RecordClientException(
          RecordClientErrorKind.UNEXPECTED,
          "Failed to create Salesforce account: " + cause.getMessage(),
          cause);
    }
  }

  private Mono<? extends Throwable> handleErrorResponse(ClientResponse response) {
    return response
        .bodyToMono(String.class)
        .defaultIfEmpty("No response body")
        .map(body -> parseErrorAndCreateException(response.statusCode(), body));
  }

  private RecordClientException parseErrorAndCreateException(
      HttpStatusCode statusCode, String body) {
    var description = parseErrorDescription(body);

    log.warn("Salesforce API error: HTTP {} - {}", statusCode, description);

    if (statusCode.value() == HttpStatus.BAD_REQUEST.value()) {
      return new RecordClientException(RecordClientErrorKind.INVALID_INPUT, description);
    }

    return new RecordClientException(
        RecordClientErrorKind.UNEXPECTED,
        "Salesforce API error: HTTP " + statusCode.value() + " - " + description);
  }

  private String parseErrorDescription(String body) {
    try {
      var errors = objectMapper.readValue(body, ERROR_LIST);
      var description = describe(errors);
      if (!description.isBlank()) {
        return description;
      }
    } catch (JsonProcessingException e) {
      // Not the standard error array, keep the raw body
      log.debug("Could not parse Salesforce error response as JSON: {}", e.getMessage());
    }

    return body.length() > MAX_ERROR_BODY_LENGTH
        ? body.substring(0, MAX_ERROR_BODY_LENGTH) + "... (truncated)"
        : body;
  }

  private static String describe(@Nullable List<SalesforceErrorResponse> errors) {
    if (errors == null || errors.isEmpty()) {
      return "Salesforce rejected the account without an error description";
    }

    return errors.stream()
        .filter(Objects::nonNull)
        .map(SalesforceErrorResponse::message)
        .filter(message -> message != null && !message.isBlank())
        .collect(Collectors.joining("; "));
  }
}
