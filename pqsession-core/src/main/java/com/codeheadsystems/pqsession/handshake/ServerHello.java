package com.codeheadsystems.pqsession.handshake;

import com.codeheadsystems.pqsession.crypto.AlgorithmSuite;
import com.codeheadsystems.pqsession.crypto.KemAlgorithm;
import java.time.Instant;

/**
 * Server response to {@link ClientHello}.
 *
 * <p>The client encapsulates once to {@code ephemeralPublicKey} using the negotiated KEM and once to
 * {@code staticKemPublicKey}, the server's long-lived KEM key pinned at {@code kemKeyVersion}.
 *
 * @param handshakeId          identifier of the pending handshake
 * @param suite                negotiated algorithms
 * @param ephemeralPublicKey   per-handshake KEM public key
 * @param staticKemAlgorithm   algorithm of the long-lived KEM key
 * @param staticKemPublicKey   long-lived KEM public key
 * @param kemKeyVersion        version of the long-lived KEM key
 * @param signatureKeyVersion  version of the signing key that will sign ServerFinished
 * @param serverNonce          32 random bytes
 * @param expiresAt            deadline for the client's key exchange
 */
public record ServerHello(String handshakeId,
                          AlgorithmSuite suite,
                          byte[] ephemeralPublicKey,
                          KemAlgorithm staticKemAlgorithm,
                          byte[] staticKemPublicKey,
                          int kemKeyVersion,
                          int signatureKeyVersion,
                          byte[] serverNonce,
                          Instant expiresAt) {
}
