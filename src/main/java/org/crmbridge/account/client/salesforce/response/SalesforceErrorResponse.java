package org.crmbridge.account.client.salesforce.response;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * One entry of a Salesforce REST error array, e.g. {@code [{"message": "Required fields are
 * missing: [Name]", "errorCode": "REQUIRED_FIELD_MISSING", "fields": ["Name"]}]}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SalesforceErrorResponse(String message, String errorCode, List<String> fields) {}
