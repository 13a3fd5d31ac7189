package org.crmbridge.account.service;

import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.databind.JsonNode;

import org.crmbridge.account.domain.AccountRequest;

/**
 * Normalizes and validates inbound account-creation payloads.
 *
 * <p>Only {@code accountName} is required. Scalar values are taken as text and trimmed, blank
 * optional fields become absent and unknown fields are ignored.
 */
@Component
public class RequestValidator {

  static final String ACCOUNT_NAME = "accountName";
  static final String PHONE = "phone";
  static final String CITY = "city";
  static final String INDUSTRY = "industry";

  /**
   * Validate a raw JSON request body.
   *
   * @param raw The request body, may be null when the caller sent none
   * @return the validated request
   * @throws AccountValidationException if accountName is missing or a field has the wrong shape
   */
  public AccountRequest validate(@Nullable JsonNode raw) {
    if (raw == null || raw.isNull() || raw.isMissingNode()) {
      throw missing(ACCOUNT_NAME);
    }

    if (!raw.isObject()) {
      throw new AccountValidationException(
          ValidationErrorKind.MALFORMED_FIELD, "request body must be a JSON object");
    }

    var accountName = textField(raw, ACCOUNT_NAME);
    if (accountName == null) {
      throw missing(ACCOUNT_NAME);
    }

    return new AccountRequest(
        accountName, textField(raw, PHONE), textField(raw, CITY), textField(raw, INDUSTRY));
  }

  @Nullable
  private String textField(JsonNode body, String field) {
    var node = body.get(field);
    if (node == null || node.isNull()) {
      return null;
    }

    if (node.isContainerNode()) {
      throw new AccountValidationException(
          ValidationErrorKind.MALFORMED_FIELD, field + " must be a scalar value");
    }

    var value = node.asText().trim();
    return value.isEmpty() ? null : value;
  }

  private AccountValidationException missing(String field) {
    return new AccountValidationException(ValidationErrorKind.MISSING_FIELD, field + " required");
  }
}
