package com.codeheadsystems.pqsession.server.handshake;

import com.codeheadsystems.pqsession.crypto.AlgorithmSuite;
import com.codeheadsystems.pqsession.crypto.KemAlgorithm;
import com.codeheadsystems.pqsession.crypto.KeyMaterial;
import com.codeheadsystems.pqsession.handshake.ClientHello;
import com.codeheadsystems.pqsession.handshake.HandshakeTranscript;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One pending handshake. The phase only moves through {@link #advance}, a compare-and-set, so
 * exactly one caller wins each transition.
 */
final class HandshakeState {

  private final String handshakeId;
  private final AlgorithmSuite suite;
  private final ClientHello clientHello;
  private final byte[] serverNonce;
  private final KeyMaterial ephemeralKey;
  private final KemAlgorithm staticKemAlgorithm;
  private final int kemKeyVersion;
  private final int signatureKeyVersion;
  private final HandshakeTranscript transcript;
  private final Instant createdAt;
  private final Instant expiresAt;
  private final AtomicReference<HandshakePhase> phase = new AtomicReference<>(HandshakePhase.INIT);

  HandshakeState(String handshakeId, AlgorithmSuite suite, ClientHello clientHello, byte[] serverNonce,
                 KeyMaterial ephemeralKey, KemAlgorithm staticKemAlgorithm, int kemKeyVersion,
                 int signatureKeyVersion, HandshakeTranscript transcript, Instant createdAt, Instant expiresAt) {
    this.handshakeId = handshakeId;
    this.suite = suite;
    this.clientHello = clientHello;
    this.serverNonce = serverNonce;
    this.ephemeralKey = ephemeralKey;
    this.staticKemAlgorithm = staticKemAlgorithm;
    this.kemKeyVersion = kemKeyVersion;
    this.signatureKeyVersion = signatureKeyVersion;
    this.transcript = transcript;
    this.createdAt = createdAt;
    this.expiresAt = expiresAt;
  }

  boolean advance(HandshakePhase from, HandshakePhase to) {
    return phase.compareAndSet(from, to);
  }

  HandshakePhase phase() {
    return phase.get();
  }

  boolean isExpired(Instant now) {
    return now.isAfter(expiresAt);
  }

  /**
   * Zeroes the ephemeral private key. Called once the state leaves the table.
   */
  void destroy() {
    ephemeralKey.destroy();
  }

  String handshakeId() {
    return handshakeId;
  }

  AlgorithmSuite suite() {
    return suite;
  }

  ClientHello clientHello() {
    return clientHello;
  }

  byte[] serverNonce() {
    return serverNonce;
  }

  KeyMaterial ephemeralKey() {
    return ephemeralKey;
  }

  KemAlgorithm staticKemAlgorithm() {
    return staticKemAlgorithm;
  }

  int kemKeyVersion() {
    return kemKeyVersion;
  }

  int signatureKeyVersion() {
    return signatureKeyVersion;
  }

  HandshakeTranscript transcript() {
    return transcript;
  }

  Instant createdAt() {
    return createdAt;
  }

  Instant expiresAt() {
    return expiresAt;
  }

  @Override
  public String toString() {
    return "HandshakeState[id=" + handshakeId + ", suite=" + suite + ", phase=" + phase.get() + "]";
  }
}
