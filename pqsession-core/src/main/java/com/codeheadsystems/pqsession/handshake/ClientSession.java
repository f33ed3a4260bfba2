package com.codeheadsystems.pqsession.handshake;

import java.time.Instant;

/**
 * Client view of an established session.
 *
 * @param sessionId     the session id assigned by the server
 * @param cipherSuite   negotiated suite name
 * @param keys          derived session keys
 * @param handshakeHash transcript hash through ClientKeyExchange
 * @param expiresAt     expiry announced by the server
 */
public record ClientSession(String sessionId,
                            String cipherSuite,
                            SessionKeys keys,
                            byte[] handshakeHash,
                            Instant expiresAt) {
}
