package com.codeheadsystems.pqsession.crypto;

import com.codeheadsystems.pqsession.common.ByteUtils;

/**
 * Encoded public and private key bytes produced by a provider.
 *
 * @param publicKey  the public key encoding
 * @param privateKey the private key encoding
 */
public record KeyMaterial(byte[] publicKey, byte[] privateKey) {

  /**
   * Overwrites the private key bytes.
   */
  public void destroy() {
    ByteUtils.zeroize(privateKey);
  }

  @Override
  public String toString() {
    return "KeyMaterial[publicKey=" + publicKey.length + " bytes, privateKey=<redacted>]";
  }
}
