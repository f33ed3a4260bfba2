package com.codeheadsystems.pqsession.crypto;

import java.util.Locale;
import java.util.Optional;
import org.bouncycastle.pqc.crypto.mlkem.MLKEMParameters;

/**
 * Supported key encapsulation mechanisms (FIPS 203).
 * Sizes are in bytes; the shared secret is always 32 bytes.
 */
public enum KemAlgorithm implements NegotiableAlgorithm {

  ML_KEM_512("ML-KEM-512", "Kyber512", 1, 800, 768),
  ML_KEM_768("ML-KEM-768", "Kyber768", 2, 1184, 1088),
  ML_KEM_1024("ML-KEM-1024", "Kyber1024", 3, 1568, 1568);

  public static final int SHARED_SECRET_LENGTH = 32;

  private final String id;
  private final String legacyName;
  private final int rank;
  private final int publicKeyLength;
  private final int ciphertextLength;

  KemAlgorithm(String id, String legacyName, int rank, int publicKeyLength, int ciphertextLength) {
    this.id = id;
    this.legacyName = legacyName;
    this.rank = rank;
    this.publicKeyLength = publicKeyLength;
    this.ciphertextLength = ciphertextLength;
  }

  /**
   * Resolves a wire name, accepting the canonical id or the pre-standard Kyber name, case-insensitively.
   *
   * @param name the name
   * @return the algorithm, or empty if unknown
   */
  public static Optional<KemAlgorithm> fromName(String name) {
    if (name == null) {
      return Optional.empty();
    }
    String normalized = name.trim().toUpperCase(Locale.ROOT);
    for (KemAlgorithm alg : values()) {
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

  public int publicKeyLength() {
    return publicKeyLength;
  }

  public int ciphertextLength() {
    return ciphertextLength;
  }

  MLKEMParameters parameters() {
    return switch (this) {
      case ML_KEM_512 -> MLKEMParameters.ml_kem_512;
      case ML_KEM_768 -> MLKEMParameters.ml_kem_768;
      case ML_KEM_1024 -> MLKEMParameters.ml_kem_1024;
    };
  }
}
