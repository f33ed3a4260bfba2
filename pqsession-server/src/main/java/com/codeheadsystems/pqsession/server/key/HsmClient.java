package com.codeheadsystems.pqsession.server.key;

/**
 * Boundary to a hardware security module. Keys never leave the device in plaintext; they are
 * addressed by handle and exported only as device-wrapped blobs.
 * <p>
 * Driver code is outside this project; deployments supply an implementation.
 */
public interface HsmClient {

  /**
   * A key created inside the HSM.
   *
   * @param handleId  device handle
   * @param publicKey encoded public key
   */
  record KeyHandle(String handleId, byte[] publicKey) {
  }

  KeyHandle generateKeyPair(KeyType type, String algorithm);

  byte[] decapsulate(String handleId, byte[] ciphertext);

  byte[] sign(String handleId, byte[] message);

  byte[] wrapKey(String handleId);

  /**
   * Loads a wrapped key back into the device.
   *
   * @param type      key type
   * @param algorithm algorithm id
   * @param wrapped   blob from {@link #wrapKey}
   * @return the new handle id
   */
  String unwrapKey(KeyType type, String algorithm, byte[] wrapped);

  void destroyKey(String handleId);
}
