package org.crmbridge.account.api;

import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlPathEqualTo;
import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.crmbridge.account.base.AbstractControllerTest;
import org.crmbridge.account.client.RecordClient;
import org.crmbridge.account.fixture.SalesforceApiStubs;
import org.crmbridge.account.fixture.TestConstants;
import org.crmbridge.account.http.CorrelationIdFilter;

/**
 * Integration tests for {@link AccountController}.
 *
 * <p>HTTP layer → pipeline → Salesforce client (WireMock) → event channel (test binder).
 *
 * <p><b>Test Coverage:</b>
 *
 * <ul>
 *   <li>Success: 200 body and SUCCESS event
 *   <li>Validation errors: 400, no Salesforce call, no event
 *   <li>Salesforce errors: 400/500 and FAILED event
 *   <li>Unreadable bodies and correlation ID propagation
 * </ul>
 */
class AccountControllerTest extends AbstractControllerTest {

  private static final String ACCOUNTS_PATH = "/v1/accounts";

  private static final String UUID_PATTERN =
      "[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}";

  @Autowired private ObjectMapper objectMapper;

  // ===========================================================================================
  // A. Success
  // ===========================================================================================

  @Test
  void shouldCreateAccountAndPublishSuccessEvent() throws Exception {
    // Setup
    SalesforceApiStubs.stubCreated(wireMockServer, TestConstants.RECORD_ID);

    // Execute
    performPost(ACCOUNTS_PATH + "?accountName=Acme", TestConstants.VALID_REQUEST_JSON)
        .andExpect(status().isOk())
        .andExpect(content().contentType(MediaType.APPLICATION_JSON))
        .andExpect(
            content()
                .json(
                    """
                    {
                      "message": "Account created and event published successfully",
                      "accountId": "001xx",
                      "success": true
                    }
                    """,
                    true));

    // Verify event
    var event = receiveEvent();
    assertThat(event.get("eventType").asText()).isEqualTo("ACCOUNT_CREATED");
    assertThat(event.get("status").asText()).isEqualTo("SUCCESS");
    assertThat(event.get("accountId").asText()).isEqualTo(TestConstants.RECORD_ID);
    assertThat(event.get("accountName").asText()).isEqualTo("Acme");
    assertThat(event.get("source").asText()).isEqualTo(TestConstants.EVENT_SOURCE);
    assertThat(event.get("timestamp").asText()).isNotBlank();
    assertThat(event.size()).isEqualTo(6);
  }

  @Test
  void shouldLabelEventWithNotAvailableWhenQueryNameMissing() throws Exception {
    SalesforceApiStubs.stubCreated(wireMockServer, TestConstants.RECORD_ID);

    performPost(ACCOUNTS_PATH, TestConstants.VALID_REQUEST_JSON).andExpect(status().isOk());

    var event = receiveEvent();
    assertThat(event.get("accountName").asText()).isEqualTo("N/A");
    assertThat(event.get("accountId").asText()).isEqualTo(TestConstants.RECORD_ID);
  }

  // ===========================================================================================
  // B. Validation Errors
  // ===========================================================================================

  @Test
  void shouldRejectEmptyAccountNameWithoutCallingSalesforce() throws Exception {
    performPost(ACCOUNTS_PATH, "{\"accountName\": \"\"}")
        .andExpect(status().isBadRequest())
        .andExpect(
            content()
                .json(
                    """
                    {
                      "error": "Invalid Salesforce input",
                      "details": "accountName required"
                    }
                    """,
                    true));

    verifySalesforceCalls(0);
    assertThat(outputDestination.receive(500, TestConstants.EVENT_DESTINATION)).isNull();
  }

  @Test
  void shouldRejectMalformedJson() throws Exception {
    performPost(ACCOUNTS_PATH, "{\"accountName\": ")
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("Invalid Salesforce input"))
        .andExpect(jsonPath("$.details").value("Malformed JSON request body"));

    verifySalesforceCalls(0);
  }

  @Test
  void shouldRejectUnsupportedContentType() throws Exception {
    mockMvc
        .perform(
            post(ACCOUNTS_PATH)
                .contentType(MediaType.TEXT_PLAIN)
                .content(TestConstants.VALID_REQUEST_JSON))
        .andExpect(status().isBadRequest())
        .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
        .andExpect(jsonPath("$.error").value("Invalid Salesforce input"))
        .andExpect(jsonPath("$.details").value("Content-Type must be application/json"));

    verifySalesforceCalls(0);
  }

  @Test
  void shouldAnswerWithJsonWhenCallerDoesNotAcceptJson() throws Exception {
    mockMvc
        .perform(
            post(ACCOUNTS_PATH)
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_XML)
                .content(TestConstants.VALID_REQUEST_JSON))
        .andExpect(status().isBadRequest())
        .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
        .andExpect(jsonPath("$.error").value("Invalid Salesforce input"))
        .andExpect(jsonPath("$.details").value("Accept must allow application/json"));

    verifySalesforceCalls(0);
    assertThat(outputDestination.receive(500, TestConstants.EVENT_DESTINATION)).isNull();
  }

  @Test
  void shouldRejectMissingBody() throws Exception {
    mockMvc
        .perform(post(ACCOUNTS_PATH).contentType(MediaType.APPLICATION_JSON))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.details").value("accountName required"));
  }

  // ===========================================================================================
  // C. Salesforce Errors
  // ===========================================================================================

  @Test
  void shouldReturnBadRequestAndPublishFailedEventWhenSalesforceRejectsInput() throws Exception {
    SalesforceApiStubs.stubInvalidInput(
        wireMockServer,
        "INVALID_OR_NULL_FOR_RESTRICTED_PICKLIST",
        "Industry: bad value for restricted picklist field: Tech");

    performPost(ACCOUNTS_PATH + "?accountName=Acme", TestConstants.VALID_REQUEST_JSON)
        .andExpect(status().isBadRequest())
        .andExpect(
            content()
                .json(
                    """
                    {
                      "error": "Invalid Salesforce input",
                      "details": "Industry: bad value for restricted picklist field: Tech"
                    }
                    """,
                    true));

    var event = receiveEvent();
    assertThat(event.get("status").asText()).isEqualTo("FAILED");
    assertThat(event.get("accountId").asText()).isEqualTo("N/A");
    assertThat(event.get("accountName").asText()).isEqualTo("Acme");
  }

  @Test
  void shouldReturnInternalErrorAndPublishFailedEventWhenSalesforceUnavailable() throws Exception {
    SalesforceApiStubs.stubServerError(wireMockServer);

    performPost(ACCOUNTS_PATH, TestConstants.VALID_REQUEST_JSON)
        .andExpect(status().isInternalServerError())
        .andExpect(
            content()
                .json(
                    """
                    {
                      "error": "Unhandled error: Salesforce API error: HTTP 500 - Internal Server Error"
                    }
                    """,
                    true));

    assertThat(receiveEvent().get("status").asText()).isEqualTo("FAILED");
  }

  // ===========================================================================================
  // D. Correlation and Idempotency
  // ===========================================================================================

  @Test
  void shouldEchoCorrelationIdAndAttachItToEvent() throws Exception {
    SalesforceApiStubs.stubCreated(wireMockServer, TestConstants.RECORD_ID);

    mockMvc
        .perform(
            post(ACCOUNTS_PATH)
                .contentType(MediaType.APPLICATION_JSON)
                .header(CorrelationIdFilter.CORRELATION_ID_HEADER, "corr-42")
                .content(TestConstants.VALID_REQUEST_JSON))
        .andExpect(status().isOk())
        .andExpect(header().string(CorrelationIdFilter.CORRELATION_ID_HEADER, "corr-42"));

    var message = outputDestination.receive(2000, TestConstants.EVENT_DESTINATION);
    assertThat(message).isNotNull();
    assertThat(message.getHeaders().get("correlationId")).isEqualTo("corr-42");
  }

  @Test
  void shouldGenerateCorrelationIdWhenHeaderAbsent() throws Exception {
    SalesforceApiStubs.stubCreated(wireMockServer, TestConstants.RECORD_ID);

    var result =
        performPost(ACCOUNTS_PATH, TestConstants.VALID_REQUEST_JSON)
            .andExpect(status().isOk())
            .andReturn();

    var correlationId =
        result.getResponse().getHeader(CorrelationIdFilter.CORRELATION_ID_HEADER);
    assertThat(correlationId).matches(UUID_PATTERN);

    var message = outputDestination.receive(2000, TestConstants.EVENT_DESTINATION);
    assertThat(message).isNotNull();
    assertThat(message.getHeaders().get("correlationId")).isEqualTo(correlationId);
  }

  @Test
  void shouldReplaceUnsafeCorrelationId() throws Exception {
    SalesforceApiStubs.stubCreated(wireMockServer, TestConstants.RECORD_ID);

    var result =
        mockMvc
            .perform(
                post(ACCOUNTS_PATH)
                    .contentType(MediaType.APPLICATION_JSON)
                    .header(CorrelationIdFilter.CORRELATION_ID_HEADER, "abc\nFAKE LOG LINE")
                    .content(TestConstants.VALID_REQUEST_JSON))
            .andExpect(status().isOk())
            .andReturn();

    assertThat(result.getResponse().getHeader(CorrelationIdFilter.CORRELATION_ID_HEADER))
        .matches(UUID_PATTERN);
    receiveEvent();
  }

  @Test
  void shouldLabelEventWithFirstAccountNameWhenRepeated() throws Exception {
    SalesforceApiStubs.stubCreated(wireMockServer, TestConstants.RECORD_ID);

    performPost(
            ACCOUNTS_PATH + "?accountName=Acme&accountName=Globex",
            TestConstants.VALID_REQUEST_JSON)
        .andExpect(status().isOk());

    assertThat(receiveEvent().get("accountName").asText()).isEqualTo("Acme");
  }

  @Test
  void shouldCreateOneRecordForRepeatedIdempotencyKey() throws Exception {
    SalesforceApiStubs.stubCreated(wireMockServer, TestConstants.RECORD_ID);

    for (int i = 0; i < 2; i++) {
      mockMvc
          .perform(
              post(ACCOUNTS_PATH)
                  .contentType(MediaType.APPLICATION_JSON)
                  .header(RecordClient.IDEMPOTENCY_KEY_HEADER, "controller-test-key")
                  .content(TestConstants.VALID_REQUEST_JSON))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.accountId").value(TestConstants.RECORD_ID));
      receiveEvent();
    }

    verifySalesforceCalls(1);
  }

  private void verifySalesforceCalls(int count) {
    wireMockServer.verify(
        count, postRequestedFor(urlPathEqualTo(TestConstants.SALESFORCE_ACCOUNT_PATH)));
  }

  private JsonNode receiveEvent() throws Exception {
    var message = outputDestination.receive(2000, TestConstants.EVENT_DESTINATION);
    assertThat(message).as("published event").isNotNull();
    return objectMapper.readTree(message.getPayload());
  }
}
