package org.crmbridge.account.client;

import org.springframework.lang.Nullable;

import org.crmbridge.account.domain.AccountRecord;
import org.crmbridge.account.domain.CreateOutcome;

/** Boundary to the external system of record for business accounts. */
public interface RecordClient {

  /** HTTP header carrying the idempotency key, inbound from callers and outbound to Salesforce. */
  String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

  /**
   * Create one account record. Implementations make at most one remote call per invocation and
   * never retry.
   *
   * @param record The account to create
   * @param idempotencyKey Caller-supplied key identifying retries of the same request, may be null
   * @return successful outcome carrying the new record id
   * @throws RecordClientException with kind INVALID_INPUT when the record system rejects the input,
   *     UNEXPECTED for any other failure including timeouts
   */
  CreateOutcome createAccount(AccountRecord record, @Nullable String idempotencyKey);
}
