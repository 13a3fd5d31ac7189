package org.crmbridge.account.service;

import java.time.Clock;
import java.time.format.DateTimeFormatter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import org.crmbridge.account.config.AccountServiceProperties;
import org.crmbridge.account.domain.AccountEvent;
import org.crmbridge.account.domain.AccountRequest;
import org.crmbridge.account.domain.CreateOutcome;
import org.crmbridge.account.domain.EventStatus;

/**
 * Derives the outbound {@link AccountEvent} from a create outcome.
 *
 * <p>Never throws. The event name comes from the caller's {@code accountName} query parameter, not
 * from the request body.
 */
@Component
public class AccountEventBuilder {

  private static final Logger log = LoggerFactory.getLogger(AccountEventBuilder.class);

  private final Clock clock;
  private final String source;

  public AccountEventBuilder(Clock clock, AccountServiceProperties properties) {
    this.clock = clock;
    this.source = properties.getEvents().getSource();
  }

  /**
   * Build the event for one creation attempt.
   *
   * @param outcome The create outcome, successful or not
   * @param request The validated request
   * @param queryAccountName The display name passed as query parameter, may be null
   * @return the event to publish
   */
  public AccountEvent build(
      CreateOutcome outcome, AccountRequest request, @Nullable String queryAccountName) {
    var accountId = outcome.success() ? outcome.recordId() : AccountEvent.NOT_AVAILABLE;
    var accountName =
        queryAccountName == null || queryAccountName.isBlank()
            ? AccountEvent.NOT_AVAILABLE
            : queryAccountName;
    var status = outcome.success() ? EventStatus.SUCCESS : EventStatus.FAILED;

    log.debug(
        "Building {} event for requested account '{}' (accountId={}, accountName={})",
        status,
        request.accountName(),
        accountId,
        accountName);

    return new AccountEvent(
        AccountEvent.ACCOUNT_CREATED,
        accountId,
        accountName,
        DateTimeFormatter.ISO_INSTANT.format(clock.instant()),
        status,
        source);
  }
}
