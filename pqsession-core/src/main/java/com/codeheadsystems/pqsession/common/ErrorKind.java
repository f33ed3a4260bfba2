package com.codeheadsystems.pqsession.common;

/**
 * Error taxonomy shared by the key manager, handshake coordinator and session store.
 * Each kind carries the HTTP status the JAX-RS layer reports for it.
 */
public enum ErrorKind {

  // ── Handshake ──
  ALGORITHM_NEGOTIATION_FAILED(400),
  PROTOCOL_ORDER_VIOLATION(409),
  HANDSHAKE_NOT_FOUND(404),
  TRANSCRIPT_INTEGRITY_FAILURE(401),
  HANDSHAKE_CAPACITY_EXCEEDED(503),

  // ── Session ──
  SESSION_NOT_FOUND(404),
  SESSION_EXPIRED(410),
  SESSION_INVALIDATED(410),
  STORAGE_BACKEND_UNAVAILABLE(503),

  // ── Key management ──
  UNSUPPORTED_ALGORITHM(400),
  INVALID_PASSPHRASE(401),
  CORRUPT_BACKUP(400),
  KEY_NOT_AVAILABLE(503),

  INVALID_REQUEST(400);

  private final int httpStatus;

  ErrorKind(int httpStatus) {
    this.httpStatus = httpStatus;
  }

  public int httpStatus() {
    return httpStatus;
  }
}
