package com.codeheadsystems.pqsession.handshake;

import static com.codeheadsystems.pqsession.common.ByteUtils.I2OSP;
import static com.codeheadsystems.pqsession.common.ByteUtils.concat;
import static com.codeheadsystems.pqsession.common.ByteUtils.encodeVector;

import java.nio.charset.StandardCharsets;
import java.util.List;
import org.bouncycastle.crypto.digests.SHA256Digest;

/**
 * Running SHA-256 hash over the canonical encoding of every handshake message.
 *
 * <p>Each message is encoded as a one-byte type followed by length-prefixed fields. Both sides
 * feed the same messages in the same order, so their hashes agree only if nothing was altered.
 * Not thread-safe; a handshake is driven by one thread at a time.
 */
public final class HandshakeTranscript {

  private static final byte[] PREAMBLE = "pqsession-v1".getBytes(StandardCharsets.US_ASCII);

  private static final byte CLIENT_HELLO = 1;
  private static final byte SERVER_HELLO = 2;
  private static final byte CLIENT_KEY_EXCHANGE = 3;

  private final SHA256Digest digest;

  public HandshakeTranscript() {
    this.digest = new SHA256Digest();
    update(encodeVector(PREAMBLE));
  }

  private HandshakeTranscript(SHA256Digest digest) {
    this.digest = digest;
  }

  public void appendClientHello(ClientHello hello) {
    update(concat(
        new byte[]{CLIENT_HELLO},
        encodeNames(hello.offeredKems()),
        encodeNames(hello.offeredSignatures()),
        encodeVector(hello.clientNonce()),
        encodeVector(hello.clientAddress())));
  }

  public void appendServerHello(ServerHello hello) {
    update(concat(
        new byte[]{SERVER_HELLO},
        encodeVector(hello.handshakeId()),
        encodeVector(hello.suite().suiteName()),
        encodeVector(hello.ephemeralPublicKey()),
        encodeVector(hello.staticKemAlgorithm().id()),
        encodeVector(hello.staticKemPublicKey()),
        I2OSP(hello.kemKeyVersion(), 4),
        I2OSP(hello.signatureKeyVersion(), 4),
        encodeVector(hello.serverNonce())));
  }

  /**
   * Appends the key exchange ciphertexts. The client's verify data is computed over the hash that
   * results, so it is not part of the transcript itself.
   */
  public void appendClientKeyExchange(ClientKeyExchange exchange) {
    update(concat(
        new byte[]{CLIENT_KEY_EXCHANGE},
        encodeVector(exchange.handshakeId()),
        encodeVector(exchange.ephemeralCiphertext()),
        encodeVector(exchange.staticCiphertext())));
  }

  /**
   * Hash of everything appended so far. The running state is left untouched.
   *
   * @return 32-byte hash
   */
  public byte[] currentHash() {
    SHA256Digest snapshot = new SHA256Digest(digest);
    byte[] out = new byte[snapshot.getDigestSize()];
    snapshot.doFinal(out, 0);
    return out;
  }

  public HandshakeTranscript copy() {
    return new HandshakeTranscript(new SHA256Digest(digest));
  }

  // Two-byte count, then each name as its own vector.
  private static byte[] encodeNames(List<String> names) {
    byte[][] parts = new byte[names.size() + 1][];
    parts[0] = I2OSP(names.size(), 2);
    for (int i = 0; i < names.size(); i++) {
      parts[i + 1] = encodeVector(names.get(i));
    }
    return concat(parts);
  }

  private void update(byte[] bytes) {
    digest.update(bytes, 0, bytes.length);
  }
}
