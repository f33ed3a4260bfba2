package com.codeheadsystems.pqsession.handshake;

/**
 * Client's key exchange.
 *
 * @param handshakeId         the handshake being completed
 * @param ephemeralCiphertext encapsulation to the ephemeral key
 * @param staticCiphertext    encapsulation to the long-lived key
 * @param clientVerifyData    HMAC over the transcript with the client finished key; may be null
 *                            when the server does not require it
 */
public record ClientKeyExchange(String handshakeId,
                                byte[] ephemeralCiphertext,
                                byte[] staticCiphertext,
                                byte[] clientVerifyData) {
}
