package com.codeheadsystems.pqsession.server.store;

import com.codeheadsystems.pqsession.common.ErrorKind;

/**
 * Why a session did or did not verify.
 */
public enum VerificationReason {
  VALID(null),
  EXPIRED(ErrorKind.SESSION_EXPIRED),
  INVALIDATED(ErrorKind.SESSION_INVALIDATED),
  NOT_FOUND(ErrorKind.SESSION_NOT_FOUND);

  private final ErrorKind errorKind;

  VerificationReason(ErrorKind errorKind) {
    this.errorKind = errorKind;
  }

  /**
   * The error a caller should report, or {@code null} for {@link #VALID}.
   *
   * @return the error kind
   */
  public ErrorKind errorKind() {
    return errorKind;
  }
}
