package com.codeheadsystems.pqsession.server.key;

import java.util.List;
import java.util.Optional;

/**
 * Owns the server's long-lived KEM and signature keys.
 * <p>
 * Private material never leaves the manager except through {@link #backupKeys}, which yields
 * ciphertext. Each key type has a current key and, after a rotation, the immediately preceding key,
 * which remains usable for the configured grace period and is then discarded and zeroed.
 * <p>
 * <strong>Exception contract:</strong> rejected operations throw {@link KeyManagerException} with
 * {@code UNSUPPORTED_ALGORITHM}, {@code INVALID_PASSPHRASE}, {@code CORRUPT_BACKUP} or
 * {@code KEY_NOT_AVAILABLE}, and leave existing key state unchanged. Every successful generation,
 * rotation, backup and restore appends exactly one audit entry.
 */
public interface KeyManager {

  String SYSTEM_OPERATOR = "system";

  /**
   * Generates a KEM key pair and installs it as the current KEM key.
   *
   * @param algorithm algorithm id, e.g. {@code ML-KEM-768}
   * @return the new key's public information
   */
  PublicKeyInfo generateKemKeyPair(String algorithm);

  /**
   * Generates a signature key pair and installs it as the current signing key.
   *
   * @param algorithm algorithm id, e.g. {@code ML-DSA-65}
   * @return the new key's public information
   */
  PublicKeyInfo generateSignatureKeyPair(String algorithm);

  default PublicKeyInfo rotateKemKey() {
    return rotateKemKey(SYSTEM_OPERATOR, "manual rotation");
  }

  /**
   * Replaces the current KEM key with a new version of the same algorithm.
   *
   * @param operator who triggered the rotation
   * @param cause    why
   * @return the new key's public information
   */
  PublicKeyInfo rotateKemKey(String operator, String cause);

  default PublicKeyInfo rotateSignatureKey() {
    return rotateSignatureKey(SYSTEM_OPERATOR, "manual rotation");
  }

  PublicKeyInfo rotateSignatureKey(String operator, String cause);

  /**
   * Encrypts all current and in-grace keys under {@code passphrase}.
   *
   * @param passphrase the passphrase; the caller may clear it afterwards
   * @return the backup blob
   */
  byte[] backupKeys(char[] passphrase);

  /**
   * Replaces all keys with the content of a backup. Nothing changes unless the whole backup
   * decrypts and validates.
   *
   * @param passphrase the passphrase used for the backup
   * @param blob       the backup blob
   */
  void restoreKeys(char[] passphrase, byte[] blob);

  /**
   * Generates a key with the configured default algorithm for each type that has none yet.
   */
  void ensureKeys();

  PublicKeySet exportPublicKeys();

  List<RotationAuditEntry> getRotationAuditLog();

  Optional<PublicKeyInfo> currentKey(KeyType type);

  /**
   * Decapsulates with the KEM key of the given version, provided it is current or in grace.
   *
   * @param version    key version pinned by the handshake
   * @param ciphertext the ciphertext
   * @return the shared secret
   * @throws KeyManagerException with {@code KEY_NOT_AVAILABLE} if the version is gone
   */
  byte[] decapsulate(int version, byte[] ciphertext);

  /**
   * Signs with the signing key of the given version, provided it is current or in grace.
   *
   * @param version key version pinned by the handshake
   * @param message the message
   * @return the signature
   * @throws KeyManagerException with {@code KEY_NOT_AVAILABLE} if the version is gone
   */
  byte[] sign(int version, byte[] message);

  /**
   * Discards previous keys whose grace period has elapsed.
   *
   * @return the number of keys discarded
   */
  int purgeRetiredKeys();

  /**
   * Name of the custody backend, e.g. {@code software} or {@code hsm}.
   *
   * @return the name
   */
  String custody();
}
