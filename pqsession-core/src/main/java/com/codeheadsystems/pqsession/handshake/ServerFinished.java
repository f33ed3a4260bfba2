package com.codeheadsystems.pqsession.handshake;

import java.time.Instant;

/**
 * Final handshake message announcing the new session.
 *
 * @param sessionId           the session identifier
 * @param signature           ML-DSA signature over the transcript hash
 * @param verifyData          HMAC over the transcript with the server finished key
 * @param signatureKeyVersion version of the signing key used
 * @param expiresAt           session expiry
 */
public record ServerFinished(String sessionId,
                             byte[] signature,
                             byte[] verifyData,
                             int signatureKeyVersion,
                             Instant expiresAt) {
}
