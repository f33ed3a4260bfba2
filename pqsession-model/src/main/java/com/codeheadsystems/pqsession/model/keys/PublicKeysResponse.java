package com.codeheadsystems.pqsession.model.keys;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Optional;

/**
 * Published server keys: the current KEM and signing keys plus any retired keys still in their
 * grace period.
 * <p>
 * Used by: {@code GET /pqc/keys} response
 *
 * @param kem                    current KEM key
 * @param signature              current signing key
 * @param retiring               retired keys that remain valid
 * @param supportedKemAlgorithms KEMs the server negotiates, strongest first
 */
public record PublicKeysResponse(
    @JsonProperty("kem") PublicKeyEntry kem,
    @JsonProperty("signature") PublicKeyEntry signature,
    @JsonProperty("retiring") List<PublicKeyEntry> retiring,
    @JsonProperty("supportedKemAlgorithms") List<String> supportedKemAlgorithms) {

  /**
   * Finds the signing key with the given version among current and retiring keys.
   *
   * @param version the version
   * @return the entry if published
   */
  public Optional<PublicKeyEntry> signatureKey(int version) {
    if (signature != null && signature.version() == version) {
      return Optional.of(signature);
    }
    return (retiring == null ? List.<PublicKeyEntry>of() : retiring).stream()
        .filter(e -> "SIGNATURE".equals(e.keyType()) && e.version() == version)
        .findFirst();
  }
}
