package com.codeheadsystems.pqsession.crypto;

import java.util.Objects;

/**
 * A negotiated (KEM, signature) pair.
 *
 * @param kem       the key encapsulation mechanism
 * @param signature the signature algorithm
 */
public record AlgorithmSuite(KemAlgorithm kem, SignatureAlgorithm signature) {

  public AlgorithmSuite {
    Objects.requireNonNull(kem, "kem");
    Objects.requireNonNull(signature, "signature");
  }

  /**
   * The suite's security level: the weaker of its two components.
   *
   * @return the rank
   */
  public int securityLevel() {
    return Math.min(kem.rank(), signature.rank());
  }

  /**
   * Display name, e.g. {@code ML-KEM-768+ML-DSA-65}. Stored on session records.
   *
   * @return the suite name
   */
  public String suiteName() {
    return kem.id() + "+" + signature.id();
  }

  @Override
  public String toString() {
    return suiteName();
  }
}
