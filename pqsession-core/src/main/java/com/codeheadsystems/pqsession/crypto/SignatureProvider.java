package com.codeheadsystems.pqsession.crypto;

/**
 * Digital signature primitive.
 */
public interface SignatureProvider {

  KeyMaterial generateKeyPair(SignatureAlgorithm algorithm);

  /**
   * Signs {@code message}.
   *
   * @param algorithm  the algorithm
   * @param privateKey the encoded private key
   * @param message    the message
   * @return the signature
   * @throws CryptoOperationException if signing fails
   */
  byte[] sign(SignatureAlgorithm algorithm, byte[] privateKey, byte[] message);

  /**
   * Verifies {@code signature} over {@code message}. Malformed inputs verify as {@code false}.
   *
   * @param algorithm the algorithm
   * @param publicKey the encoded public key
   * @param message   the message
   * @param signature the signature
   * @return true if valid
   */
  boolean verify(SignatureAlgorithm algorithm, byte[] publicKey, byte[] message, byte[] signature);
}
