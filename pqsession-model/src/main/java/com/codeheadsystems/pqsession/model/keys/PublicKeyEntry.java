package com.codeheadsystems.pqsession.model.keys;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One published public key.
 *
 * @param keyType         {@code KEM} or {@code SIGNATURE}
 * @param algorithm       algorithm id
 * @param keyId           stable key identifier
 * @param version         key version
 * @param publicKeyBase64 base64-encoded public key
 * @param createdAt       ISO-8601 creation time
 * @param validUntil      ISO-8601 end of the grace period for a retired key; absent for current keys
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PublicKeyEntry(
    @JsonProperty("keyType") String keyType,
    @JsonProperty("algorithm") String algorithm,
    @JsonProperty("keyId") String keyId,
    @JsonProperty("version") int version,
    @JsonProperty("publicKey") String publicKeyBase64,
    @JsonProperty("createdAt") String createdAt,
    @JsonProperty("validUntil") String validUntil) {
}
