package org.crmbridge.account.service.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import io.swagger.v3.oas.annotations.media.Schema;

/**
 * Body returned to the caller of the account-creation endpoint.
 *
 * <p>Only three shapes exist: success ({@code message, accountId, success}), caller error ({@code
 * error, details}) and internal error ({@code error}). Use the factory methods.
 */
@Schema(description = "Account creation result")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AccountCreationResponse(
    @Schema(
            description = "Success message",
            example = "Account created and event published successfully")
        String message,
    @Schema(description = "Error summary", example = "Invalid Salesforce input") String error,
    @Schema(description = "Salesforce record id of the new account", example = "001xx000003DGb2")
        String accountId,
    @Schema(description = "Present and true on success", example = "true") Boolean success,
    @Schema(description = "Error details for caller errors", example = "accountName required")
        String details) {

  public static final String SUCCESS_MESSAGE = "Account created and event published successfully";

  public static final String INVALID_INPUT_ERROR = "Invalid Salesforce input";

  public static final String UNHANDLED_ERROR_PREFIX = "Unhandled error: ";

  public static AccountCreationResponse created(String accountId) {
    return new AccountCreationResponse(SUCCESS_MESSAGE, null, accountId, true, null);
  }

  public static AccountCreationResponse invalidInput(String details) {
    return new AccountCreationResponse(null, INVALID_INPUT_ERROR, null, null, details);
  }

  public static AccountCreationResponse unhandled(String description) {
    return new AccountCreationResponse(
        null, UNHANDLED_ERROR_PREFIX + description, null, null, null);
  }
}
