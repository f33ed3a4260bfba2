package com.codeheadsystems.pqsession.server.handshake;

/**
 * Server-side handshake states. {@code FINISHED}, {@code FAILED} and {@code TIMEOUT} are terminal.
 */
public enum HandshakePhase {
  INIT,
  HELLO_RECEIVED,
  KEY_EXCHANGED,
  FINISHED,
  FAILED,
  TIMEOUT;

  public boolean isTerminal() {
    return this == FINISHED || this == FAILED || this == TIMEOUT;
  }
}
