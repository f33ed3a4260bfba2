package com.codeheadsystems.pqsession.crypto;

import com.codeheadsystems.pqsession.common.ByteUtils;

/**
 * Output of a KEM encapsulation.
 *
 * @param ciphertext   the ciphertext sent to the key holder
 * @param sharedSecret the encapsulated secret
 */
public record Encapsulation(byte[] ciphertext, byte[] sharedSecret) {

  public void destroy() {
    ByteUtils.zeroize(sharedSecret);
  }

  @Override
  public String toString() {
    return "Encapsulation[ciphertext=" + ciphertext.length + " bytes, sharedSecret=<redacted>]";
  }
}
