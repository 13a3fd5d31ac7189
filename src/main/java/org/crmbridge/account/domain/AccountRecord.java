package org.crmbridge.account.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Canonical Salesforce Account sObject sent to the record system.
 *
 * <p>JSON property names are the Salesforce field API names.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AccountRecord(
    @JsonProperty("Name") String name,
    @JsonProperty("Phone") String phone,
    @JsonProperty("BillingCity") String billingCity,
    @JsonProperty("Industry") String industry,
    @JsonProperty("Type") String type) {

  /** Account type assigned to every account created through this service. */
  public static final String PROSPECT = "Prospect";

  /**
   * Maps a validated request onto the record system's field layout.
   *
   * @param request The validated request
   * @return AccountRecord with type {@value #PROSPECT}
   */
  public static AccountRecord from(AccountRequest request) {
    return new AccountRecord(
        request.accountName(), request.phone(), request.city(), request.industry(), PROSPECT);
  }
}
