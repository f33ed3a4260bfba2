package com.codeheadsystems.pqsession.server.key;

import com.codeheadsystems.pqsession.crypto.KeyMaterial;

/**
 * Holds private keys on behalf of {@link DefaultKeyManager} and performs the private-key
 * operations. The manager owns versions, grace periods, locking and auditing; custodians only
 * know how to create and use a key.
 * <p>
 * "Private material" is opaque to the manager: raw key bytes for software custody, a handle
 * reference for an HSM.
 */
public interface KeyCustodian {

  /**
   * Short name for logs and health output, e.g. {@code software}.
   *
   * @return the name
   */
  String name();

  /**
   * Creates a key pair.
   *
   * @param type      key type
   * @param algorithm algorithm id, already validated as supported
   * @return the public key and private material
   */
  KeyMaterial generate(KeyType type, String algorithm);

  byte[] decapsulate(String algorithm, byte[] privateMaterial, byte[] ciphertext);

  byte[] sign(String algorithm, byte[] privateMaterial, byte[] message);

  /**
   * Produces the bytes placed in an encrypted backup for this key.
   *
   * @param type            key type
   * @param algorithm       algorithm id
   * @param privateMaterial private material
   * @return exportable bytes
   */
  byte[] exportForBackup(KeyType type, String algorithm, byte[] privateMaterial);

  /**
   * Inverse of {@link #exportForBackup}.
   *
   * @param type      key type
   * @param algorithm algorithm id
   * @param exported  bytes from a backup
   * @return private material usable by this custodian
   */
  byte[] importFromBackup(KeyType type, String algorithm, byte[] exported);

  /**
   * Called once a key is permanently discarded.
   *
   * @param privateMaterial the discarded key's material
   */
  void release(byte[] privateMaterial);
}
