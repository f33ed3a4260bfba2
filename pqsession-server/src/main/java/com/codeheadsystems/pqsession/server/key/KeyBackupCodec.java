package com.codeheadsystems.pqsession.server.key;

import static com.codeheadsystems.pqsession.common.ByteUtils.concat;

import com.codeheadsystems.pqsession.common.ByteUtils;
import com.codeheadsystems.pqsession.common.ErrorKind;
import com.codeheadsystems.pqsession.common.RandomProvider;
import com.codeheadsystems.pqsession.crypto.KeyDerivation;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Arrays;
import org.bouncycastle.crypto.InvalidCipherTextException;
import org.bouncycastle.crypto.engines.AESEngine;
import org.bouncycastle.crypto.generators.Argon2BytesGenerator;
import org.bouncycastle.crypto.modes.GCMBlockCipher;
import org.bouncycastle.crypto.modes.GCMModeCipher;
import org.bouncycastle.crypto.params.AEADParameters;
import org.bouncycastle.crypto.params.Argon2Parameters;
import org.bouncycastle.crypto.params.KeyParameter;

/**
 * Passphrase-encrypted key backup format.
 *
 * <pre>
 *   "PQSB" | version(1) | salt(16) | nonce(12) | verifier(32) | AES-256-GCM(JSON payload)
 * </pre>
 *
 * Argon2id stretches the passphrase into 64 bytes: the first half is the AES key, the second
 * half is hashed into the verifier. A verifier mismatch means the passphrase is wrong; every
 * other failure means the blob is corrupt. The header is bound to the ciphertext as associated
 * data.
 */
public class KeyBackupCodec {

  static final byte[] MAGIC = {'P', 'Q', 'S', 'B'};
  static final byte FORMAT_VERSION = 1;
  static final int SALT_LENGTH = 16;
  static final int NONCE_LENGTH = 12;
  static final int VERIFIER_LENGTH = 32;
  static final int HEADER_LENGTH = MAGIC.length + 1 + SALT_LENGTH + NONCE_LENGTH + VERIFIER_LENGTH;
  private static final int TAG_BITS = 128;

  private final KeyDerivation kdf;
  private final RandomProvider randomProvider;
  private final int argon2MemoryKib;
  private final int argon2Iterations;
  private final int argon2Parallelism;
  private final ObjectMapper mapper;

  public KeyBackupCodec(KeyDerivation kdf, RandomProvider randomProvider,
                        int argon2MemoryKib, int argon2Iterations, int argon2Parallelism) {
    this.kdf = kdf;
    this.randomProvider = randomProvider;
    this.argon2MemoryKib = argon2MemoryKib;
    this.argon2Iterations = argon2Iterations;
    this.argon2Parallelism = argon2Parallelism;
    this.mapper = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
  }

  /**
   * Encrypts a payload.
   *
   * @param payload    the keys
   * @param passphrase the passphrase, not retained
   * @return the backup blob
   */
  byte[] seal(BackupPayload payload, char[] passphrase) {
    byte[] salt = randomProvider.randomBytes(SALT_LENGTH);
    byte[] nonce = randomProvider.randomBytes(NONCE_LENGTH);
    byte[] stretched = stretch(passphrase, salt);
    byte[] encKey = Arrays.copyOfRange(stretched, 0, 32);
    byte[] plaintext = null;
    try {
      byte[] verifier = verifier(stretched);
      byte[] header = concat(MAGIC, new byte[]{FORMAT_VERSION}, salt, nonce, verifier);
      plaintext = mapper.writeValueAsBytes(payload);
      byte[] ciphertext = gcm(true, encKey, nonce, header, plaintext);
      return concat(header, ciphertext);
    } catch (IOException | InvalidCipherTextException e) {
      throw new IllegalStateException("Unable to encode key backup", e);
    } finally {
      ByteUtils.zeroize(stretched, encKey, plaintext);
    }
  }

  /**
   * Decrypts a blob.
   *
   * @param blob       the backup
   * @param passphrase the passphrase, not retained
   * @return the payload
   * @throws KeyManagerException with {@link ErrorKind#INVALID_PASSPHRASE} or
   *                             {@link ErrorKind#CORRUPT_BACKUP}
   */
  BackupPayload open(byte[] blob, char[] passphrase) {
    if (blob == null || blob.length <= HEADER_LENGTH + TAG_BITS / 8) {
      throw corrupt("Backup is truncated", null);
    }
    if (!Arrays.equals(Arrays.copyOfRange(blob, 0, MAGIC.length), MAGIC)) {
      throw corrupt("Not a key backup", null);
    }
    if (blob[MAGIC.length] != FORMAT_VERSION) {
      throw corrupt("Unsupported backup format version " + blob[MAGIC.length], null);
    }
    int offset = MAGIC.length + 1;
    byte[] salt = Arrays.copyOfRange(blob, offset, offset += SALT_LENGTH);
    byte[] nonce = Arrays.copyOfRange(blob, offset, offset += NONCE_LENGTH);
    byte[] storedVerifier = Arrays.copyOfRange(blob, offset, offset += VERIFIER_LENGTH);
    byte[] header = Arrays.copyOfRange(blob, 0, HEADER_LENGTH);
    byte[] ciphertext = Arrays.copyOfRange(blob, HEADER_LENGTH, blob.length);

    byte[] stretched = stretch(passphrase, salt);
    byte[] encKey = Arrays.copyOfRange(stretched, 0, 32);
    byte[] plaintext = null;
    try {
      if (!MessageDigest.isEqual(verifier(stretched), storedVerifier)) {
        throw new KeyManagerException(ErrorKind.INVALID_PASSPHRASE, "Backup passphrase is incorrect");
      }
      plaintext = gcm(false, encKey, nonce, header, ciphertext);
      BackupPayload payload = mapper.readValue(plaintext, BackupPayload.class);
      if (payload.keys() == null || payload.keys().isEmpty()) {
        throw corrupt("Backup contains no keys", null);
      }
      return payload;
    } catch (InvalidCipherTextException e) {
      throw corrupt("Backup failed authentication", e);
    } catch (IOException e) {
      throw corrupt("Backup payload is unreadable", e);
    } finally {
      ByteUtils.zeroize(stretched, encKey, plaintext);
    }
  }

  private static KeyManagerException corrupt(String message, Throwable cause) {
    return new KeyManagerException(ErrorKind.CORRUPT_BACKUP, message, cause);
  }

  private byte[] verifier(byte[] stretched) {
    return kdf.hash(Arrays.copyOfRange(stretched, 32, 64));
  }

  private byte[] stretch(char[] passphrase, byte[] salt) {
    if (passphrase == null || passphrase.length == 0) {
      throw new KeyManagerException(ErrorKind.INVALID_PASSPHRASE, "Backup passphrase must not be empty");
    }
    ByteBuffer encoded = StandardCharsets.UTF_8.encode(CharBuffer.wrap(passphrase));
    byte[] password = new byte[encoded.remaining()];
    encoded.get(password);
    if (encoded.hasArray()) {
      Arrays.fill(encoded.array(), (byte) 0);
    }
    try {
      Argon2BytesGenerator gen = new Argon2BytesGenerator();
      gen.init(new Argon2Parameters.Builder(Argon2Parameters.ARGON2_id)
          .withSalt(salt)
          .withMemoryAsKB(argon2MemoryKib)
          .withIterations(argon2Iterations)
          .withParallelism(argon2Parallelism)
          .build());
      byte[] output = new byte[64];
      gen.generateBytes(password, output, 0, output.length);
      return output;
    } finally {
      ByteUtils.zeroize(password);
    }
  }

  private static byte[] gcm(boolean encrypt, byte[] key, byte[] nonce, byte[] aad, byte[] input)
      throws InvalidCipherTextException {
    GCMModeCipher cipher = GCMBlockCipher.newInstance(AESEngine.newInstance());
    cipher.init(encrypt, new AEADParameters(new KeyParameter(key), TAG_BITS, nonce, aad));
    byte[] out = new byte[cipher.getOutputSize(input.length)];
    int len = cipher.processBytes(input, 0, input.length, out, 0);
    len += cipher.doFinal(out, len);
    return len == out.length ? out : Arrays.copyOf(out, len);
  }
}
