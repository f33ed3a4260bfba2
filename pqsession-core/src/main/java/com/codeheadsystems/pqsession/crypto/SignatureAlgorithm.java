package com.codeheadsystems.pqsession.crypto;

import java.util.Locale;
import java.util.Optional;
import org.bouncycastle.pqc.crypto.mldsa.MLDSAParameters;

/**
 * Supported signature algorithms (FIPS 204).
 */
public enum SignatureAlgorithm implements NegotiableAlgorithm {

  ML_DSA_44("ML-DSA-44", "Dilithium2", 1),
  ML_DSA_65("ML-DSA-65", "Dilithium3", 2),
  ML_DSA_87("ML-DSA-87", "Dilithium5", 3);

  private final String id;
  private final String legacyName;
  private final int rank;

  SignatureAlgorithm(String id, String legacyName, int rank) {
    this.id = id;
    this.legacyName = legacyName;
    this.rank = rank;
  }

  /**
   * Resolves a wire name, accepting the canonical id or the pre-standard Dilithium name, case-insensitively.
   *
   * @param name the name
   * @return the algorithm, or empty if unknown
   */
  public static Optional<SignatureAlgorithm> fromName(String name) {
    if (name == null) {
      return Optional.empty();
    }
    String normalized = name.trim().toUpperCase(Locale.ROOT);
    for (SignatureAlgorithm alg : values()) {
      if (alg.id.equals(normalized) || alg.legacyName.toUpperCase(Locale.ROOT).equals(normalized)) {
        return Optional.of(alg);
      }
    }
    return Optional.empty();
  }

  @Override
  public String id() {
    return id;
  }

  @Override
  public int rank() {
    return rank;
  }

  @Override
  public int preference() {
    return values().length - ordinal();
  }

  public String legacyName() {
    return legacyName;
  }

  MLDSAParameters parameters() {
    return switch (this) {
      case ML_DSA_44 -> MLDSAParameters.ml_dsa_44;
      case ML_DSA_65 -> MLDSAParameters.ml_dsa_65;
      case ML_DSA_87 -> MLDSAParameters.ml_dsa_87;
    };
  }
}
