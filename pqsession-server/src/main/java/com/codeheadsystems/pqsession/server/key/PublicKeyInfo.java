package com.codeheadsystems.pqsession.server.key;

import java.time.Instant;

/**
 * Public half of a managed key.
 *
 * @param type       key type
 * @param algorithm  algorithm id
 * @param keyId      key identifier
 * @param version    version within its type
 * @param publicKey  encoded public key
 * @param createdAt  creation time
 * @param validUntil end of the grace period for a retired key, null for the current key
 */
public record PublicKeyInfo(KeyType type,
                            String algorithm,
                            String keyId,
                            int version,
                            byte[] publicKey,
                            Instant createdAt,
                            Instant validUntil) {
}
