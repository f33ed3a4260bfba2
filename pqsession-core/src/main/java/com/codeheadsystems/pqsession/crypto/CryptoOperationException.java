package com.codeheadsystems.pqsession.crypto;

/**
 * Raised when a primitive rejects its input, e.g. a malformed key encoding or a ciphertext of the
 * wrong length.
 */
public class CryptoOperationException extends RuntimeException {

  public CryptoOperationException(String message) {
    super(message);
  }

  public CryptoOperationException(String message, Throwable cause) {
    super(message, cause);
  }
}
