package com.codeheadsystems.pqsession.server.key;

import com.codeheadsystems.pqsession.common.ErrorKind;
import com.codeheadsystems.pqsession.crypto.KemAlgorithm;
import com.codeheadsystems.pqsession.crypto.KemProvider;
import com.codeheadsystems.pqsession.crypto.KeyMaterial;
import com.codeheadsystems.pqsession.crypto.SignatureAlgorithm;
import com.codeheadsystems.pqsession.crypto.SignatureProvider;

/**
 * Keeps private keys in process memory and uses the in-process KEM and signature providers.
 */
public class SoftwareKeyCustodian implements KeyCustodian {

  private final KemProvider kemProvider;
  private final SignatureProvider signatureProvider;

  public SoftwareKeyCustodian(KemProvider kemProvider, SignatureProvider signatureProvider) {
    this.kemProvider = kemProvider;
    this.signatureProvider = signatureProvider;
  }

  static KemAlgorithm kem(String algorithm) {
    return KemAlgorithm.fromName(algorithm)
        .orElseThrow(() -> new KeyManagerException(ErrorKind.UNSUPPORTED_ALGORITHM,
            "Unsupported KEM algorithm: " + algorithm));
  }

  static SignatureAlgorithm signature(String algorithm) {
    return SignatureAlgorithm.fromName(algorithm)
        .orElseThrow(() -> new KeyManagerException(ErrorKind.UNSUPPORTED_ALGORITHM,
            "Unsupported signature algorithm: " + algorithm));
  }

  @Override
  public String name() {
    return "software";
  }

  @Override
  public KeyMaterial generate(KeyType type, String algorithm) {
    return switch (type) {
      case KEM -> kemProvider.generateKeyPair(kem(algorithm));
      case SIGNATURE -> signatureProvider.generateKeyPair(signature(algorithm));
    };
  }

  @Override
  public byte[] decapsulate(String algorithm, byte[] privateMaterial, byte[] ciphertext) {
    return kemProvider.decapsulate(kem(algorithm), privateMaterial, ciphertext);
  }

  @Override
  public byte[] sign(String algorithm, byte[] privateMaterial, byte[] message) {
    return signatureProvider.sign(signature(algorithm), privateMaterial, message);
  }

  @Override
  public byte[] exportForBackup(KeyType type, String algorithm, byte[] privateMaterial) {
    return privateMaterial.clone();
  }

  @Override
  public byte[] importFromBackup(KeyType type, String algorithm, byte[] exported) {
    return exported.clone();
  }

  @Override
  public void release(byte[] privateMaterial) {
    // Zeroing is done by ManagedKeyPair.destroy().
  }
}
