package org.crmbridge.account.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Component
public class AccountServiceStartupConfig {

  private static final Logger log = LoggerFactory.getLogger(AccountServiceStartupConfig.class);

  private final AccountServiceProperties properties;

  public AccountServiceStartupConfig(AccountServiceProperties properties) {
    this.properties = properties;
  }

  @EventListener(ApplicationReadyEvent.class)
  public void onStartup() {
    var salesforce = properties.getSalesforce();
    var events = properties.getEvents();
    var idempotency = properties.getIdempotency();

    log.info(
        "Account Service Configuration: salesforce.baseUrl={} salesforce.apiVersion={} "
            + "salesforce.accessToken={} salesforce.timeoutSeconds={} events.destination={} "
            + "events.source={} events.publishTimeoutSeconds={} idempotency.ttlMinutes={} "
            + "idempotency.waitTimeoutSeconds={}",
        salesforce.getBaseUrl(),
        salesforce.getApiVersion(),
        mask(salesforce.getAccessToken()),
        salesforce.getTimeoutSeconds(),
        events.getDestination(),
        events.getSource(),
        events.getPublishTimeoutSeconds(),
        idempotency.getTtlMinutes(),
        idempotency.getWaitTimeoutSeconds());
  }

  static String mask(String secret) {
    if (secret == null || secret.length() <= 4) {
      return "****";
    }
    return "****" + secret.substring(secret.length() - 4);
  }
}
