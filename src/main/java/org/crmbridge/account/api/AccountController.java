package org.crmbridge.account.api;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.lang.Nullable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.fasterxml.jackson.databind.JsonNode;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;

import org.crmbridge.account.client.RecordClient;
import org.crmbridge.account.service.AccountCreationPipeline;
import org.crmbridge.account.service.dto.AccountCreationResponse;

@Tag(name = "Account Handler", description = "Create Salesforce accounts")
@RestController
@RequestMapping(path = "/v1/accounts")
public class AccountController {

  private static final Logger log = LoggerFactory.getLogger(AccountController.class);

  private final AccountCreationPipeline accountCreationPipeline;

  public AccountController(AccountCreationPipeline accountCreationPipeline) {
    this.accountCreationPipeline = accountCreationPipeline;
  }

  @Operation(
      summary = "Create an account",
      description =
          "Creates a Prospect account in Salesforce and publishes an ACCOUNT_CREATED event for "
              + "the attempt. The event is published for failed creates as well.")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            description = "Account created and event published",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = AccountCreationResponse.class),
                    examples =
                        @ExampleObject(
                            value =
                                """
                    {
                      "message": "Account created and event published successfully",
                      "accountId": "001xx000003DGb2",
                      "success": true
                    }
                    """))),
        @ApiResponse(
            responseCode = "400",
            description = "Request or Salesforce input invalid",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = AccountCreationResponse.class),
                    examples =
                        @ExampleObject(
                            value =
                                """
                    {
                      "error": "Invalid Salesforce input",
                      "details": "accountName required"
                    }
                    """))),
        @ApiResponse(
            responseCode = "500",
            description = "Salesforce or event channel failure",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = AccountCreationResponse.class),
                    examples =
                        @ExampleObject(
                            value =
                                """
                    {
                      "error": "Unhandled error: Salesforce did not respond within 10 seconds"
                    }
                    """)))
      })
  @PostMapping(produces = "application/json", consumes = "application/json")
  public ResponseEntity<AccountCreationResponse> create(
      @RequestBody(required = false) @Nullable JsonNode body,
      @Parameter(
              description =
                  "Display name used to label the published event. Only the first value is used")
          @RequestParam(name = "accountName", required = false)
          @Nullable
          List<String> accountNames,
      @Parameter(description = "Key that makes retries of the same request create one account")
          @RequestHeader(name = RecordClient.IDEMPOTENCY_KEY_HEADER, required = false)
          @Nullable
          String idempotencyKey) {
    var accountName =
        accountNames == null || accountNames.isEmpty() ? null : accountNames.get(0);
    log.info("Received account creation request (event label: {})", accountName);

    var response = accountCreationPipeline.execute(body, accountName, idempotencyKey);
    return ResponseEntity.status(response.statusCode()).body(response.body());
  }
}
