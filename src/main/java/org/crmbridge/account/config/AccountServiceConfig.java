package org.crmbridge.account.config;

import java.time.Clock;
import java.time.Duration;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import org.crmbridge.account.client.IdempotentRecordClient;
import org.crmbridge.account.client.RecordClient;
import org.crmbridge.account.client.salesforce.SalesforceRecordClient;

/**
 * Main configuration class for the Account Service.
 *
 * <p>Note: ObjectMapper is auto-configured by Spring Boot using spring.jackson.* properties in
 * application.yml.
 */
@Configuration
@EnableConfigurationProperties(AccountServiceProperties.class)
public class AccountServiceConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  /**
   * Record client used by the pipeline: Salesforce behind the idempotency-key guard.
   *
   * @param salesforceRecordClient The Salesforce adapter
   * @param properties Service configuration
   * @param clock Clock used to expire completed keys
   * @return idempotent RecordClient
   */
  @Bean
  @Primary
  public RecordClient recordClient(
      SalesforceRecordClient salesforceRecordClient,
      AccountServiceProperties properties,
      Clock clock) {
    var idempotency = properties.getIdempotency();
    return new IdempotentRecordClient(
        salesforceRecordClient,
        Duration.ofMinutes(idempotency.getTtlMinutes()),
        Duration.ofSeconds(idempotency.getWaitTimeoutSeconds()),
        clock);
  }

  /** Threads that run broker sends so a publish can be abandoned after its timeout. */
  @Bean
  public ThreadPoolTaskExecutor eventPublishExecutor() {
    var executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(4);
    executor.setMaxPoolSize(16);
    executor.setQueueCapacity(100);
    executor.setThreadNamePrefix("event-publish-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(10);
    return executor;
  }
}
