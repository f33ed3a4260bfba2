package com.codeheadsystems.pqsession.handshake;

import com.codeheadsystems.pqsession.common.ByteUtils;
import com.codeheadsystems.pqsession.common.RandomProvider;
import com.codeheadsystems.pqsession.crypto.Encapsulation;
import com.codeheadsystems.pqsession.crypto.KemAlgorithm;
import com.codeheadsystems.pqsession.crypto.KemProvider;
import com.codeheadsystems.pqsession.crypto.KeyDerivation;
import com.codeheadsystems.pqsession.crypto.SignatureAlgorithm;
import com.codeheadsystems.pqsession.crypto.SignatureProvider;
import java.security.MessageDigest;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Client side of one handshake. Drive it in order: {@link #start}, {@link #respond},
 * {@link #finish}. Instances are single-use and not thread-safe.
 */
public class HandshakeClient {

  private static final Logger log = LoggerFactory.getLogger(HandshakeClient.class);

  private final KemProvider kemProvider;
  private final SignatureProvider signatureProvider;
  private final SessionKeySchedule keySchedule;
  private final RandomProvider randomProvider;
  private final List<KemAlgorithm> offeredKems;
  private final List<SignatureAlgorithm> offeredSignatures;

  private final HandshakeTranscript transcript = new HandshakeTranscript();
  private ClientHello hello;
  private ServerHello serverHello;
  private SessionKeys keys;
  private byte[] transcriptHash;

  /**
   * Creates a client offering the given algorithms.
   *
   * @param kemProvider       KEM primitive
   * @param signatureProvider signature primitive, used to verify ServerFinished
   * @param kdf               key derivation
   * @param randomProvider    randomness for the nonce and encapsulations
   * @param offeredKems       KEMs to offer
   * @param offeredSignatures signature algorithms to offer
   */
  public HandshakeClient(KemProvider kemProvider,
                         SignatureProvider signatureProvider,
                         KeyDerivation kdf,
                         RandomProvider randomProvider,
                         List<KemAlgorithm> offeredKems,
                         List<SignatureAlgorithm> offeredSignatures) {
    this.kemProvider = kemProvider;
    this.signatureProvider = signatureProvider;
    this.keySchedule = new SessionKeySchedule(kdf);
    this.randomProvider = randomProvider;
    this.offeredKems = List.copyOf(offeredKems);
    this.offeredSignatures = List.copyOf(offeredSignatures);
  }

  /**
   * Builds the ClientHello.
   *
   * @param clientAddress optional address to report
   * @return the hello
   */
  public ClientHello start(String clientAddress) {
    if (hello != null) {
      throw new IllegalStateException("Handshake already started");
    }
    hello = new ClientHello(
        offeredKems.stream().map(KemAlgorithm::id).toList(),
        offeredSignatures.stream().map(SignatureAlgorithm::id).toList(),
        randomProvider.randomBytes(ClientHello.NONCE_LENGTH),
        clientAddress);
    transcript.appendClientHello(hello);
    return hello;
  }

  /**
   * Encapsulates to both server keys and derives the session keys.
   *
   * @param response the server hello
   * @return the key exchange message, including client verify data
   */
  public ClientKeyExchange respond(ServerHello response) {
    if (hello == null || serverHello != null) {
      throw new IllegalStateException("respond() must follow start() exactly once");
    }
    Objects.requireNonNull(response, "response");
    if (!offeredKems.contains(response.suite().kem())
        || !offeredSignatures.contains(response.suite().signature())) {
      throw new SecurityException("Server selected an algorithm that was not offered: " + response.suite());
    }
    serverHello = response;
    transcript.appendServerHello(response);

    Encapsulation ephemeral = kemProvider.encapsulate(response.suite().kem(), response.ephemeralPublicKey());
    Encapsulation stat = kemProvider.encapsulate(response.staticKemAlgorithm(), response.staticKemPublicKey());
    ClientKeyExchange unsigned = new ClientKeyExchange(response.handshakeId(),
        ephemeral.ciphertext(), stat.ciphertext(), null);
    transcript.appendClientKeyExchange(unsigned);
    transcriptHash = transcript.currentHash();
    try {
      keys = keySchedule.derive(ephemeral.sharedSecret(), stat.sharedSecret(),
          hello.clientNonce(), response.serverNonce(), transcriptHash);
    } finally {
      ephemeral.destroy();
      stat.destroy();
    }
    return new ClientKeyExchange(response.handshakeId(), unsigned.ephemeralCiphertext(),
        unsigned.staticCiphertext(), keySchedule.clientVerifyData(keys, transcriptHash));
  }

  /**
   * Authenticates the server and returns the session.
   *
   * @param finished                 the server's final message
   * @param serverSignaturePublicKey signing key matching {@code finished.signatureKeyVersion()}
   * @return the established session
   * @throws SecurityException if the signature or verify data does not match
   */
  public ClientSession finish(ServerFinished finished, byte[] serverSignaturePublicKey) {
    if (keys == null) {
      throw new IllegalStateException("finish() must follow respond()");
    }
    byte[] expected = keySchedule.serverVerifyData(keys, transcriptHash);
    if (finished.verifyData() == null || !MessageDigest.isEqual(expected, finished.verifyData())) {
      log.debug("Server verify data mismatch for handshake {}", serverHello.handshakeId());
      keys.destroy();
      throw new SecurityException("Server verify data mismatch");
    }
    if (!signatureProvider.verify(serverHello.suite().signature(), serverSignaturePublicKey,
        transcriptHash, finished.signature())) {
      log.debug("Server signature invalid for handshake {}", serverHello.handshakeId());
      keys.destroy();
      throw new SecurityException("Server signature invalid");
    }
    return new ClientSession(finished.sessionId(), serverHello.suite().suiteName(), keys,
        ByteUtils.copy(transcriptHash), finished.expiresAt());
  }
}
