package com.codeheadsystems.pqsession.crypto;

/**
 * Key encapsulation primitive.
 */
public interface KemProvider {

  /**
   * Generates a fresh key pair.
   *
   * @param algorithm the algorithm
   * @return the key material
   */
  KeyMaterial generateKeyPair(KemAlgorithm algorithm);

  /**
   * Encapsulates a fresh secret to {@code publicKey}.
   *
   * @param algorithm the algorithm
   * @param publicKey the recipient's encoded public key
   * @return ciphertext and secret
   * @throws CryptoOperationException if the public key is malformed
   */
  Encapsulation encapsulate(KemAlgorithm algorithm, byte[] publicKey);

  /**
   * Recovers the secret from {@code ciphertext}.
   *
   * <p>ML-KEM uses implicit rejection: a well-formed but tampered ciphertext yields an unrelated
   * secret rather than an error. Callers detect tampering through key confirmation.
   *
   * @param algorithm  the algorithm
   * @param privateKey the encoded private key
   * @param ciphertext the ciphertext
   * @return the shared secret
   * @throws CryptoOperationException if the ciphertext length or key encoding is wrong
   */
  byte[] decapsulate(KemAlgorithm algorithm, byte[] privateKey, byte[] ciphertext);
}
