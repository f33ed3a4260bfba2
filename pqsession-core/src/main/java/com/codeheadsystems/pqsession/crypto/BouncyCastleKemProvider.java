package com.codeheadsystems.pqsession.crypto;

import com.codeheadsystems.pqsession.common.RandomProvider;
import org.bouncycastle.crypto.AsymmetricCipherKeyPair;
import org.bouncycastle.crypto.SecretWithEncapsulation;
import org.bouncycastle.pqc.crypto.mlkem.MLKEMExtractor;
import org.bouncycastle.pqc.crypto.mlkem.MLKEMGenerator;
import org.bouncycastle.pqc.crypto.mlkem.MLKEMKeyGenerationParameters;
import org.bouncycastle.pqc.crypto.mlkem.MLKEMKeyPairGenerator;
import org.bouncycastle.pqc.crypto.mlkem.MLKEMPrivateKeyParameters;
import org.bouncycastle.pqc.crypto.mlkem.MLKEMPublicKeyParameters;

/**
 * ML-KEM backed by the BouncyCastle lightweight API.
 */
public class BouncyCastleKemProvider implements KemProvider {

  private final RandomProvider randomProvider;

  public BouncyCastleKemProvider(RandomProvider randomProvider) {
    this.randomProvider = randomProvider;
  }

  @Override
  public KeyMaterial generateKeyPair(KemAlgorithm algorithm) {
    MLKEMKeyPairGenerator generator = new MLKEMKeyPairGenerator();
    generator.init(new MLKEMKeyGenerationParameters(randomProvider.random(), algorithm.parameters()));
    AsymmetricCipherKeyPair pair = generator.generateKeyPair();
    return new KeyMaterial(
        ((MLKEMPublicKeyParameters) pair.getPublic()).getEncoded(),
        ((MLKEMPrivateKeyParameters) pair.getPrivate()).getEncoded());
  }

  @Override
  public Encapsulation encapsulate(KemAlgorithm algorithm, byte[] publicKey) {
    if (publicKey == null || publicKey.length != algorithm.publicKeyLength()) {
      throw new CryptoOperationException("Invalid " + algorithm.id() + " public key length");
    }
    try {
      MLKEMPublicKeyParameters pub = new MLKEMPublicKeyParameters(algorithm.parameters(), publicKey);
      SecretWithEncapsulation result = new MLKEMGenerator(randomProvider.random()).generateEncapsulated(pub);
      return new Encapsulation(result.getEncapsulation(), result.getSecret());
    } catch (IllegalArgumentException e) {
      throw new CryptoOperationException("Encapsulation failed for " + algorithm.id(), e);
    }
  }

  @Override
  public byte[] decapsulate(KemAlgorithm algorithm, byte[] privateKey, byte[] ciphertext) {
    if (ciphertext == null || ciphertext.length != algorithm.ciphertextLength()) {
      throw new CryptoOperationException("Invalid " + algorithm.id() + " ciphertext length: "
          + (ciphertext == null ? 0 : ciphertext.length));
    }
    try {
      MLKEMPrivateKeyParameters priv = new MLKEMPrivateKeyParameters(algorithm.parameters(), privateKey);
      return new MLKEMExtractor(priv).extractSecret(ciphertext);
    } catch (IllegalArgumentException e) {
      throw new CryptoOperationException("Decapsulation failed for " + algorithm.id(), e);
    }
  }
}
