package org.crmbridge.account.service;

/** Reasons an inbound account request is rejected. */
public enum ValidationErrorKind {
  /** A required field is absent, null or blank. */
  MISSING_FIELD,

  /** A field or the body itself has the wrong JSON shape. */
  MALFORMED_FIELD,
}
