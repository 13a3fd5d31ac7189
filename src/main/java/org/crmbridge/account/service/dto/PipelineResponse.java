package org.crmbridge.account.service.dto;

/**
 * Terminal artifact of one pipeline execution: HTTP status plus body.
 *
 * @param statusCode 200, 400 or 500
 * @param body The response body
 */
public record PipelineResponse(int statusCode, AccountCreationResponse body) {

  public static PipelineResponse created(String accountId) {
    return new PipelineResponse(200, AccountCreationResponse.created(accountId));
  }

  public static PipelineResponse badRequest(String details) {
    return new PipelineResponse(400, AccountCreationResponse.invalidInput(details));
  }

  public static PipelineResponse internalError(String description) {
    return new PipelineResponse(500, AccountCreationResponse.unhandled(description));
  }
}
