package org.crmbridge.account.client;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;

import org.crmbridge.account.domain.AccountRecord;
import org.crmbridge.account.domain.CreateOutcome;

/**
 * {@link RecordClient} decorator that creates at most one record per idempotency key.
 *
 * <p>For a given key:
 *
 * <ul>
 *   <li>The first caller runs the delegate; concurrent callers wait for it and share its result
 *   <li>A successful outcome is replayed until {@code ttl} has elapsed since completion
 *   <li>A failed call releases the key so a later retry runs the delegate again
 *   <li>Reusing the key for a different record is rejected as invalid input
 * </ul>
 *
 * <p>Requests without a key go straight to the delegate. State is held in memory, so the guarantee
 * holds per service instance.
 */
public class IdempotentRecordClient implements RecordClient {

  private static final Logger log = LoggerFactory.getLogger(IdempotentRecordClient.class);

  private final RecordClient delegate;
  private final Duration ttl;
  private final Duration waitTimeout;
  private final Clock clock;
  private final ConcurrentMap<String, Entry> entries = new ConcurrentHashMap<>();

  public IdempotentRecordClient(
      RecordClient delegate, Duration ttl, Duration waitTimeout, Clock clock) {
    this.delegate = delegate;
    this.ttl = ttl;
    this.waitTimeout = waitTimeout;
    this.clock = clock;
  }

  @Override
  public CreateOutcome createAccount(AccountRecord record, @Nullable String idempotencyKey) {
    if (idempotencyKey == null || idempotencyKey.isBlank()) {
      return delegate.createAccount(record, null);
    }

    evictExpired();

    var candidate = new Entry(record);
    var existing = entries.putIfAbsent(idempotencyKey, candidate);
    if (existing == null) {
      return execute(idempotencyKey, candidate);
    }

    if (!existing.record.equals(record)) {
      log.warn("Idempotency-Key {} was reused with a different account record", idempotencyKey);
      throw new RecordClientException(
          RecordClientErrorKind.INVALID_INPUT,
          "Idempotency-Key was reused with a different request");
    }

    log.info("Reusing create outcome for Idempotency-Key {}", idempotencyKey);
    return await(idempotencyKey, existing);
  }

  private CreateOutcome execute(String idempotencyKey, Entry entry) {
    try {
      var outcome = delegate.createAccount(entry.record, idempotencyKey);
      entry.completedAt = clock.instant();
      entry.result.complete(outcome);
      return outcome;
    } catch (Throwable t) {
      entries.remove(idempotencyKey, entry);
      entry.result.completeExceptionally(t);
      throw t;
    }
  }

  private CreateOutcome await(String idempotencyKey, Entry entry) {
    try {
      return entry.result.get(waitTimeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      throw new RecordClientException(
          RecordClientErrorKind.UNEXPECTED,
          "Timed out waiting for in-flight request with Idempotency-Key " + idempotencyKey,
          e);
    } catch (ExecutionException e) {
      if (e.getCause() instanceof RecordClientException recordClientException) {
        throw recordClientException;
      }
      throw new RecordClientException(
          RecordClientErrorKind.UNEXPECTED, String.valueOf(e.getCause().getMessage()), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new RecordClientException(
          RecordClientErrorKind.UNEXPECTED, "Interrupted while waiting for record creation", e);
    }
  }

  private void evictExpired() {
    var cutoff = clock.instant().minus(ttl);
    entries.values().removeIf(entry -> entry.isCompletedBefore(cutoff));
  }

  int size() {
    return entries.size();
  }

  private static final class Entry {
    private final AccountRecord record;
    private final CompletableFuture<CreateOutcome> result = new CompletableFuture<>();
    private volatile Instant completedAt;

    private Entry(AccountRecord record) {
      this.record = record;
    }

    private boolean isCompletedBefore(Instant cutoff) {
      var completed = completedAt;
      return completed != null && completed.isBefore(cutoff);
    }
  }
}
