package org.crmbridge.account.domain;

import org.springframework.lang.Nullable;

/**
 * Result of a create-record attempt.
 *
 * <p>{@code recordId} is present if and only if {@code success} is true.
 */
public record CreateOutcome(
    boolean success, @Nullable String recordId, @Nullable String errorDescription) {

  public CreateOutcome {
    if (success && (recordId == null || recordId.isBlank())) {
      throw new IllegalArgumentException("Successful outcome requires a record id");
    }
    if (!success && recordId != null) {
      throw new IllegalArgumentException("Failed outcome must not carry a record id");
    }
  }

  public static CreateOutcome created(String recordId) {
    return new CreateOutcome(true, recordId, null);
  }

  public static CreateOutcome failed(String errorDescription) {
    return new CreateOutcome(false, null, errorDescription);
  }
}
