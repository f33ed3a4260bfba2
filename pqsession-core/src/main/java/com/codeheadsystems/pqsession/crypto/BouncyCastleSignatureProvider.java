package com.codeheadsystems.pqsession.crypto;

import com.codeheadsystems.pqsession.common.RandomProvider;
import org.bouncycastle.crypto.AsymmetricCipherKeyPair;
import org.bouncycastle.crypto.CryptoException;
import org.bouncycastle.crypto.params.ParametersWithRandom;
import org.bouncycastle.pqc.crypto.mldsa.MLDSAKeyGenerationParameters;
import org.bouncycastle.pqc.crypto.mldsa.MLDSAKeyPairGenerator;
import org.bouncycastle.pqc.crypto.mldsa.MLDSAPrivateKeyParameters;
import org.bouncycastle.pqc.crypto.mldsa.MLDSAPublicKeyParameters;
import org.bouncycastle.pqc.crypto.mldsa.MLDSASigner;

/**
 * ML-DSA backed by the BouncyCastle lightweight API.
 */
public class BouncyCastleSignatureProvider implements SignatureProvider {

  private final RandomProvider randomProvider;

  public BouncyCastleSignatureProvider(RandomProvider randomProvider) {
    this.randomProvider = randomProvider;
  }

  @Override
  public KeyMaterial generateKeyPair(SignatureAlgorithm algorithm) {
    MLDSAKeyPairGenerator generator = new MLDSAKeyPairGenerator();
    generator.init(new MLDSAKeyGenerationParameters(randomProvider.random(), algorithm.parameters()));
    AsymmetricCipherKeyPair pair = generator.generateKeyPair();
    return new KeyMaterial(
        ((MLDSAPublicKeyParameters) pair.getPublic()).getEncoded(),
        ((MLDSAPrivateKeyParameters) pair.getPrivate()).getEncoded());
  }

  @Override
  public byte[] sign(SignatureAlgorithm algorithm, byte[] privateKey, byte[] message) {
    try {
      MLDSAPrivateKeyParameters priv = new MLDSAPrivateKeyParameters(algorithm.parameters(), privateKey);
      MLDSASigner signer = new MLDSASigner();
      signer.init(true, new ParametersWithRandom(priv, randomProvider.random()));
      signer.update(message, 0, message.length);
      return signer.generateSignature();
    } catch (CryptoException | IllegalArgumentException e) {
      throw new CryptoOperationException("Signing failed for " + algorithm.id(), e);
    }
  }

  @Override
  public boolean verify(SignatureAlgorithm algorithm, byte[] publicKey, byte[] message, byte[] signature) {
    if (publicKey == null || message == null || signature == null) {
      return false;
    }
    try {
      MLDSAPublicKeyParameters pub = new MLDSAPublicKeyParameters(algorithm.parameters(), publicKey);
      MLDSASigner verifier = new MLDSASigner();
      verifier.init(false, pub);
      verifier.update(message, 0, message.length);
      return verifier.verifySignature(signature);
    } catch (IllegalArgumentException e) {
      return false;
    }
  }
}
