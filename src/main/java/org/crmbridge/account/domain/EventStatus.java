package org.crmbridge.account.domain;

/** Outcome carried by an {@link AccountEvent}. */
public enum EventStatus {
  SUCCESS,
  FAILED
}
