package org.crmbridge.account.api;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotAcceptableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import org.crmbridge.account.service.dto.AccountCreationResponse;

/** Maps request-parsing failures that happen before the pipeline runs. */
@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<AccountCreationResponse> handleUnreadableBody(
      HttpMessageNotReadableException e) {
    log.warn("Rejected unreadable request body: {}", e.getMostSpecificCause().getMessage());
    return ResponseEntity.badRequest()
        .body(AccountCreationResponse.invalidInput("Malformed JSON request body"));
  }

  @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
  public ResponseEntity<AccountCreationResponse> handleUnsupportedMediaType(
      HttpMediaTypeNotSupportedException e) {
    log.warn("Rejected request with content type {}", e.getContentType());
    return ResponseEntity.badRequest()
        .body(AccountCreationResponse.invalidInput("Content-Type must be application/json"));
  }

  /** The body is written as JSON whatever the caller accepts. */
  @ExceptionHandler(HttpMediaTypeNotAcceptableException.class)
  public ResponseEntity<AccountCreationResponse> handleNotAcceptable(
      HttpMediaTypeNotAcceptableException e) {
    log.warn("Rejected request that does not accept JSON: {}", e.getMessage());
    return ResponseEntity.badRequest()
        .contentType(MediaType.APPLICATION_JSON)
        .body(AccountCreationResponse.invalidInput("Accept must allow application/json"));
  }
}
