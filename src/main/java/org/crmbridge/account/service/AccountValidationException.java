package org.crmbridge.account.service;

/** Thrown by {@link RequestValidator} when an inbound payload cannot be accepted. */
public class AccountValidationException extends RuntimeException {

  private final ValidationErrorKind kind;

  public AccountValidationException(ValidationErrorKind kind, String message) {
    super(message);
    this.kind = kind;
  }

  public ValidationErrorKind getKind() {
    return kind;
  }
}
