package com.codeheadsystems.pqsession.server.handshake;

/**
 * Counters since startup plus the current number of pending handshakes.
 */
public record HandshakeStats(long started,
                             long completed,
                             long failed,
                             long integrityFailures,
                             long timedOut,
                             int pending) {
}
