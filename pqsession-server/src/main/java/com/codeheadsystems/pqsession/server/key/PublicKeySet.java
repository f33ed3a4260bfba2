package com.codeheadsystems.pqsession.server.key;

import java.util.List;

/**
 * Everything a client may need to verify or encapsulate to the server.
 *
 * @param kem       current KEM key
 * @param signature current signing key
 * @param retiring  retired keys still inside their grace period
 */
public record PublicKeySet(PublicKeyInfo kem, PublicKeyInfo signature, List<PublicKeyInfo> retiring) {
}
