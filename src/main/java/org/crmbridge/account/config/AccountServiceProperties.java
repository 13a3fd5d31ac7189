package org.crmbridge.account.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "account-service")
@Validated
public class AccountServiceProperties {

  @Valid private Salesforce salesforce = new Salesforce();
  @Valid private Events events = new Events();
  @Valid private Idempotency idempotency = new Idempotency();

  public Salesforce getSalesforce() {
    return salesforce;
  }

  public void setSalesforce(Salesforce salesforce) {
    this.salesforce = salesforce;
  }

  public Events getEvents() {
    return events;
  }

  public void setEvents(Events events) {
    this.events = events;
  }

  public Idempotency getIdempotency() {
    return idempotency;
  }

  public void setIdempotency(Idempotency idempotency) {
    this.idempotency = idempotency;
  }

  public static class Salesforce {
    /** Salesforce instance URL, e.g. https://example.my.salesforce.com. */
    @NotBlank(message = "Salesforce base URL must be configured")
    private String baseUrl;

    /** REST API version segment. */
    @NotBlank private String apiVersion = "v59.0";

    /** Bearer token for the REST API - should be set via environment variable. */
    @NotBlank(message = "Salesforce access token must be configured")
    private String accessToken;

    /** Timeout in seconds for a single create call. */
    @Min(1)
    @Max(120)
    private int timeoutSeconds = 10;

    public String getBaseUrl() {
      return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
      this.baseUrl = baseUrl;
    }

    public String getApiVersion() {
      return apiVersion;
    }

    public void setApiVersion(String apiVersion) {
      this.apiVersion = apiVersion;
    }

    public String getAccessToken() {
      return accessToken;
    }

    public void setAccessToken(String accessToken) {
      this.accessToken = accessToken;
    }

    public int getTimeoutSeconds() {
      return timeoutSeconds;
    }

    public void setTimeoutSeconds(int timeoutSeconds) {
      this.timeoutSeconds = timeoutSeconds;
    }

    /** Path of the Account sObject create resource. */
    public String buildAccountPath() {
      return "/services/data/" + apiVersion + "/sobjects/Account";
    }
  }

  public static class Events {
    /** Destination (exchange/topic) account events are published to. */
    @NotBlank private String destination = "account-events";

    /** Value of the {@code source} field on every published event. */
    @NotBlank private String source = "salesforce-account-api";

    /** Timeout in seconds for a single publish. */
    @Min(1)
    @Max(60)
    private int publishTimeoutSeconds = 5;

    public String getDestination() {
      return destination;
    }

    public void setDestination(String destination) {
      this.destination = destination;
    }

    public String getSource() {
      return source;
    }

    public void setSource(String source) {
      this.source = source;
    }

    public int getPublishTimeoutSeconds() {
      return publishTimeoutSeconds;
    }

    public void setPublishTimeoutSeconds(int publishTimeoutSeconds) {
      this.publishTimeoutSeconds = publishTimeoutSeconds;
    }
  }

  public static class Idempotency {
    /** How long a completed create outcome is reused for the same key. */
    @Min(1)
    private long ttlMinutes = 60;

    /** How long a duplicate request waits for the in-flight create with the same key. */
    @Min(1)
    @Max(120)
    private int waitTimeoutSeconds = 15;

    public long getTtlMinutes() {
      return ttlMinutes;
    }

    public void setTtlMinutes(long ttlMinutes) {
      this.ttlMinutes = ttlMinutes;
    }

    public int getWaitTimeoutSeconds() {
      return waitTimeoutSeconds;
    }

    public void setWaitTimeoutSeconds(int waitTimeoutSeconds) {
      this.waitTimeoutSeconds = waitTimeoutSeconds;
    }
  }
}
