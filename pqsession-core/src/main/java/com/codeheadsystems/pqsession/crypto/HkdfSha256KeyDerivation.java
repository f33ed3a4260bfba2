package com.codeheadsystems.pqsession.crypto;

import static com.codeheadsystems.pqsession.common.ByteUtils.I2OSP;
import static com.codeheadsystems.pqsession.common.ByteUtils.concat;

import java.nio.charset.StandardCharsets;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.generators.HKDFBytesGenerator;
import org.bouncycastle.crypto.macs.HMac;
import org.bouncycastle.crypto.params.HKDFParameters;
import org.bouncycastle.crypto.params.KeyParameter;

/**
 * HKDF (RFC 5869) and HMAC over SHA-256.
 */
public class HkdfSha256KeyDerivation implements KeyDerivation {

  static final String LABEL_PREFIX = "pqsession ";

  @Override
  public int hashLength() {
    return 32;
  }

  /**
   * HKDF-Extract(salt, ikm). An absent or empty salt is replaced by {@code hashLength()} zero bytes.
   */
  @Override
  public byte[] extract(byte[] salt, byte[] ikm) {
    byte[] actualSalt = (salt == null || salt.length == 0) ? new byte[hashLength()] : salt;
    return mac(actualSalt, ikm);
  }

  @Override
  public byte[] expandLabel(byte[] prk, String label, byte[] context, int length) {
    byte[] fullLabel = (LABEL_PREFIX + label).getBytes(StandardCharsets.US_ASCII);
    byte[] ctx = context == null ? new byte[0] : context;
    byte[] info = concat(
        I2OSP(length, 2),
        I2OSP(fullLabel.length, 1), fullLabel,
        I2OSP(ctx.length, 1), ctx);
    HKDFBytesGenerator generator = new HKDFBytesGenerator(new SHA256Digest());
    generator.init(HKDFParameters.skipExtractParameters(prk, info));
    byte[] out = new byte[length];
    generator.generateBytes(out, 0, length);
    return out;
  }

  @Override
  public byte[] mac(byte[] key, byte[] data) {
    HMac hmac = new HMac(new SHA256Digest());
    hmac.init(new KeyParameter(key));
    hmac.update(data, 0, data.length);
    byte[] out = new byte[hmac.getMacSize()];
    hmac.doFinal(out, 0);
    return out;
  }

  @Override
  public byte[] hash(byte[] data) {
    SHA256Digest digest = new SHA256Digest();
    digest.update(data, 0, data.length);
    byte[] out = new byte[digest.getDigestSize()];
    digest.doFinal(out, 0);
    return out;
  }
}
