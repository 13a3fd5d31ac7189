package org.crmbridge.account.domain;

/**
 * Integration event announcing an account-creation attempt.
 *
 * <p>Published for successful and failed attempts alike so subscribers see every attempt.
 *
 * @param eventType Always {@value #ACCOUNT_CREATED}
 * @param accountId The Salesforce record id, or {@value #NOT_AVAILABLE}
 * @param accountName The display name from the request query string, or {@value #NOT_AVAILABLE}
 * @param timestamp ISO-8601 instant at which the event was built
 * @param status SUCCESS when the record was created
 * @param source Identifier of the publishing service
 */
public record AccountEvent(
    String eventType,
    String accountId,
    String accountName,
    String timestamp,
    EventStatus status,
    String source) {

  public static final String ACCOUNT_CREATED = "ACCOUNT_CREATED";

  public static final String NOT_AVAILABLE = "N/A";
}
