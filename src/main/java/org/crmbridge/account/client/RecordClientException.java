package org.crmbridge.account.client;

/** Failure of a create-record call. The message is the record system's error description. */
public class RecordClientException extends RuntimeException {

  private final RecordClientErrorKind kind;

  public RecordClientException(RecordClientErrorKind kind, String description) {
    super(description);
    this.kind = kind;
  }

  public RecordClientException(RecordClientErrorKind kind, String description, Throwable cause) {
    super(description, cause);
    this.kind = kind;
  }

  public RecordClientErrorKind getKind() {
    return kind;
  }
}
