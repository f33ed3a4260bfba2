package com.codeheadsystems.pqsession.handshake;

import static com.codeheadsystems.pqsession.common.ByteUtils.concat;

import com.codeheadsystems.pqsession.common.ByteUtils;
import com.codeheadsystems.pqsession.crypto.KeyDerivation;

/**
 * Derives session keys from the two KEM secrets and the handshake transcript.
 *
 * <pre>
 *   prk = HKDF-Extract(salt = client_nonce || server_nonce, ikm = ephemeral_secret || static_secret)
 *   key = HKDF-Expand-Label(prk, label, transcript_hash, length)
 * </pre>
 */
public class SessionKeySchedule {

  public static final int KEY_LENGTH = 32;
  public static final int IV_LENGTH = 12;
  public static final int FINISHED_KEY_LENGTH = 32;

  private final KeyDerivation kdf;

  public SessionKeySchedule(KeyDerivation kdf) {
    this.kdf = kdf;
  }

  /**
   * Derives the key set. The input secrets are not modified.
   *
   * @param ephemeralSecret secret from the ephemeral encapsulation
   * @param staticSecret    secret from the long-lived key encapsulation
   * @param clientNonce     client nonce
   * @param serverNonce     server nonce
   * @param transcriptHash  transcript hash through ClientKeyExchange
   * @return the session keys
   */
  public SessionKeys derive(byte[] ephemeralSecret, byte[] staticSecret,
                            byte[] clientNonce, byte[] serverNonce, byte[] transcriptHash) {
    byte[] ikm = concat(ephemeralSecret, staticSecret);
    byte[] prk = kdf.extract(concat(clientNonce, serverNonce), ikm);
    try {
      return new SessionKeys(
          kdf.expandLabel(prk, "c write key", transcriptHash, KEY_LENGTH),
          kdf.expandLabel(prk, "s write key", transcriptHash, KEY_LENGTH),
          kdf.expandLabel(prk, "c write iv", transcriptHash, IV_LENGTH),
          kdf.expandLabel(prk, "s write iv", transcriptHash, IV_LENGTH),
          kdf.expandLabel(prk, "c finished", transcriptHash, FINISHED_KEY_LENGTH),
          kdf.expandLabel(prk, "s finished", transcriptHash, FINISHED_KEY_LENGTH));
    } finally {
      ByteUtils.zeroize(ikm, prk);
    }
  }

  public byte[] clientVerifyData(SessionKeys keys, byte[] transcriptHash) {
    return kdf.mac(keys.clientFinishedKey(), transcriptHash);
  }

  public byte[] serverVerifyData(SessionKeys keys, byte[] transcriptHash) {
    return kdf.mac(keys.serverFinishedKey(), transcriptHash);
  }
}
