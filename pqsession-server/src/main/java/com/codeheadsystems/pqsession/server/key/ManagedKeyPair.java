package com.codeheadsystems.pqsession.server.key;

import com.codeheadsystems.pqsession.common.ErrorKind;
import java.time.Instant;
import java.util.Arrays;

/**
 * A versioned long-lived key pair held by a {@link KeyManager}.
 * <p>
 * {@code privateMaterial} is whatever the owning {@link KeyCustodian} needs to use the key: the raw
 * private key for software custody, a handle reference for an HSM. It is never exposed outside the
 * key package and is zeroed by {@link #destroy()}.
 */
public final class ManagedKeyPair {

  private final KeyType type;
  private final String algorithm;
  private final String keyId;
  private final int version;
  private final Instant createdAt;
  private final byte[] publicKey;
  private final byte[] privateMaterial;
  private boolean destroyed;

  ManagedKeyPair(KeyType type, String algorithm, String keyId, int version, Instant createdAt,
                 byte[] publicKey, byte[] privateMaterial) {
    this.type = type;
    this.algorithm = algorithm;
    this.keyId = keyId;
    this.version = version;
    this.createdAt = createdAt;
    this.publicKey = publicKey.clone();
    this.privateMaterial = privateMaterial.clone();
  }

  public KeyType type() {
    return type;
  }

  public String algorithm() {
    return algorithm;
  }

  public String keyId() {
    return keyId;
  }

  public int version() {
    return version;
  }

  public Instant createdAt() {
    return createdAt;
  }

  public byte[] publicKey() {
    return publicKey.clone();
  }

  /**
   * Copy of the private material for a single use. The caller zeroes the copy when done.
   *
   * @return the copy
   * @throws KeyManagerException if the key has been destroyed
   */
  synchronized byte[] privateMaterial() {
    if (destroyed) {
      throw new KeyManagerException(ErrorKind.KEY_NOT_AVAILABLE, "Key " + keyId + " has been discarded");
    }
    return privateMaterial.clone();
  }

  synchronized void destroy() {
    Arrays.fill(privateMaterial, (byte) 0);
    destroyed = true;
  }

  synchronized boolean isDestroyed() {
    return destroyed;
  }

  PublicKeyInfo publicInfo(Instant validUntil) {
    return new PublicKeyInfo(type, algorithm, keyId, version, publicKey.clone(), createdAt, validUntil);
  }

  @Override
  public String toString() {
    return "ManagedKeyPair[type=" + type + ", algorithm=" + algorithm + ", keyId=" + keyId
        + ", version=" + version + ", privateMaterial=<redacted>]";
  }
}
