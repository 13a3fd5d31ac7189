package org.crmbridge.account.client.salesforce.response;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/** Body of a successful sObject create call. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SalesforceCreateResponse(
    String id, boolean success, List<SalesforceErrorResponse> errors) {}
