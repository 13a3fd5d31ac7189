package org.crmbridge.account.domain;

import org.springframework.lang.Nullable;

/**
 * Validated account-creation request.
 *
 * <p>Produced only by {@link org.crmbridge.account.service.RequestValidator}. Optional fields are
 * {@code null} when the caller omitted them or sent a blank value.
 *
 * @param accountName The account name, never blank
 * @param phone The phone number
 * @param city The billing city
 * @param industry The industry
 */
public record AccountRequest(
    String accountName, @Nullable String phone, @Nullable String city, @Nullable String industry) {}
