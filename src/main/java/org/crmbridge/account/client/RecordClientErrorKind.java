package org.crmbridge.account.client;

/** Failure categories reported by a {@link RecordClient}. */
public enum RecordClientErrorKind {
  /** The record system rejected the input; attributable to the caller. */
  INVALID_INPUT,

  /** Timeout, authentication, transport or any unclassified failure. */
  UNEXPECTED,
}
