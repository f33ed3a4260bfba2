package com.codeheadsystems.pqsession.server.handshake;

import com.codeheadsystems.pqsession.crypto.KemAlgorithm;
import com.codeheadsystems.pqsession.crypto.SignatureAlgorithm;
import java.time.Duration;
import java.util.EnumSet;
import java.util.Set;

/**
 * Handshake coordinator settings.
 *
 * @param handshakeTimeout     how long a pending handshake may wait for ClientKeyExchange
 * @param sweepInterval        period of the timeout sweep; zero disables the background sweep
 * @param sessionTtl           lifetime of an established session
 * @param maxPendingHandshakes soft cap on concurrently pending handshakes
 * @param supportedKems        KEM algorithms the server negotiates
 * @param supportedSignatures  signature algorithms the server negotiates
 * @param serverAddress        address recorded in session records
 */
public record HandshakeConfig(Duration handshakeTimeout,
                              Duration sweepInterval,
                              Duration sessionTtl,
                              int maxPendingHandshakes,
                              Set<KemAlgorithm> supportedKems,
                              Set<SignatureAlgorithm> supportedSignatures,
                              String serverAddress) {

  public HandshakeConfig {
    if (handshakeTimeout.isZero() || handshakeTimeout.isNegative()) {
      throw new IllegalArgumentException("handshakeTimeout must be positive");
    }
    if (sessionTtl.isZero() || sessionTtl.isNegative()) {
      throw new IllegalArgumentException("sessionTtl must be positive");
    }
    if (maxPendingHandshakes < 1) {
      throw new IllegalArgumentException("maxPendingHandshakes must be at least 1");
    }
    supportedKems = Set.copyOf(supportedKems);
    supportedSignatures = Set.copyOf(supportedSignatures);
    serverAddress = serverAddress == null ? "" : serverAddress;
  }

  public static HandshakeConfig defaults() {
    return new HandshakeConfig(Duration.ofSeconds(30), Duration.ofSeconds(5), Duration.ofSeconds(3600),
        10_000, EnumSet.allOf(KemAlgorithm.class), EnumSet.allOf(SignatureAlgorithm.class), "");
  }

  /**
   * Defaults without a background sweep, so tests drive the sweep with their own clock.
   */
  public static HandshakeConfig forTesting() {
    return new HandshakeConfig(Duration.ofSeconds(30), Duration.ZERO, Duration.ofSeconds(3600),
        10_000, EnumSet.allOf(KemAlgorithm.class), EnumSet.allOf(SignatureAlgorithm.class), "");
  }

  public HandshakeConfig withMaxPendingHandshakes(int max) {
    return new HandshakeConfig(handshakeTimeout, sweepInterval, sessionTtl, max, supportedKems,
        supportedSignatures, serverAddress);
  }
}
