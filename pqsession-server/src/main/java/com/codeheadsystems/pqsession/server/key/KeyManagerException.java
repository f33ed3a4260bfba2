package com.codeheadsystems.pqsession.server.key;

import com.codeheadsystems.pqsession.common.ErrorKind;

/**
 * A key management operation was rejected. Existing key state is unchanged when this is thrown.
 */
public class KeyManagerException extends RuntimeException {

  private final ErrorKind errorKind;

  public KeyManagerException(ErrorKind errorKind, String message) {
    super(message);
    this.errorKind = errorKind;
  }

  public KeyManagerException(ErrorKind errorKind, String message, Throwable cause) {
    super(message, cause);
    this.errorKind = errorKind;
  }

  public ErrorKind errorKind() {
    return errorKind;
  }
}
