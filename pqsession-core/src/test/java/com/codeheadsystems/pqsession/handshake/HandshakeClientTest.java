package com.codeheadsystems.pqsession.handshake;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.pqsession.common.RandomProvider;
import com.codeheadsystems.pqsession.crypto.AlgorithmSuite;
import com.codeheadsystems.pqsession.crypto.BouncyCastleKemProvider;
import com.codeheadsystems.pqsession.crypto.BouncyCastleSignatureProvider;
import com.codeheadsystems.pqsession.crypto.HkdfSha256KeyDerivation;
import com.codeheadsystems.pqsession.crypto.KemAlgorithm;
import com.codeheadsystems.pqsession.crypto.KemProvider;
import com.codeheadsystems.pqsession.crypto.KeyDerivation;
import com.codeheadsystems.pqsession.crypto.KeyMaterial;
import com.codeheadsystems.pqsession.crypto.SignatureAlgorithm;
import com.codeheadsystems.pqsession.crypto.SignatureProvider;
import java.security.MessageDigest;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Drives the client against a minimal in-test server built from the same primitives.
 */
class HandshakeClientTest {

  private final RandomProvider random = new RandomProvider();
  private final KemProvider kem = new BouncyCastleKemProvider(random);
  private final SignatureProvider sig = new BouncyCastleSignatureProvider(random);
  private final KeyDerivation kdf = new HkdfSha256KeyDerivation();
  private final SessionKeySchedule schedule = new SessionKeySchedule(kdf);

  private KeyMaterial staticKem;
  private KeyMaterial signing;
  private HandshakeClient client;

  @BeforeEach
  void setUp() {
    staticKem = kem.generateKeyPair(KemAlgorithm.ML_KEM_768);
    signing = sig.generateKeyPair(SignatureAlgorithm.ML_DSA_44);
    client = new HandshakeClient(kem, sig, kdf, random,
        List.of(KemAlgorithm.ML_KEM_512, KemAlgorithm.ML_KEM_768),
        List.of(SignatureAlgorithm.ML_DSA_44));
  }

  private record ServerSide(ServerHello hello, KeyMaterial ephemeral, HandshakeTranscript transcript) {
  }

  private ServerSide serverHello(ClientHello hello) {
    KeyMaterial ephemeral = kem.generateKeyPair(KemAlgorithm.ML_KEM_512);
    HandshakeTranscript transcript = new HandshakeTranscript();
    transcript.appendClientHello(hello);
    ServerHello serverHello = new ServerHello("hs-1",
        new AlgorithmSuite(KemAlgorithm.ML_KEM_512, SignatureAlgorithm.ML_DSA_44),
        ephemeral.publicKey(), KemAlgorithm.ML_KEM_768, staticKem.publicKey(), 1, 1,
        random.randomBytes(32), Instant.now().plusSeconds(30));
    transcript.appendServerHello(serverHello);
    return new ServerSide(serverHello, ephemeral, transcript);
  }

  private ServerFinished serverFinish(ServerSide server, ClientHello hello, ClientKeyExchange exchange) {
    server.transcript().appendClientKeyExchange(exchange);
    byte[] hash = server.transcript().currentHash();
    byte[] eph = kem.decapsulate(KemAlgorithm.ML_KEM_512, server.ephemeral().privateKey(), exchange.ephemeralCiphertext());
    byte[] stat = kem.decapsulate(KemAlgorithm.ML_KEM_768, staticKem.privateKey(), exchange.staticCiphertext());
    SessionKeys keys = schedule.derive(eph, stat, hello.clientNonce(), server.hello().serverNonce(), hash);
    assertThat(MessageDigest.isEqual(schedule.clientVerifyData(keys, hash), exchange.clientVerifyData())).isTrue();
    return new ServerFinished("session-1", sig.sign(SignatureAlgorithm.ML_DSA_44, signing.privateKey(), hash),
        schedule.serverVerifyData(keys, hash), 1, Instant.now().plusSeconds(3600));
  }

  @Test
  void fullHandshake_establishesSession() {
    ClientHello hello = client.start("127.0.0.1");
    ServerSide server = serverHello(hello);
    ClientKeyExchange exchange = client.respond(server.hello());
    ServerFinished finished = serverFinish(server, hello, exchange);

    ClientSession session = client.finish(finished, signing.publicKey());

    assertThat(session.sessionId()).isEqualTo("session-1");
    assertThat(session.cipherSuite()).isEqualTo("ML-KEM-512+ML-DSA-44");
    assertThat(session.keys().clientWriteKey()).hasSize(32);
    assertThat(session.handshakeHash()).hasSize(32);
  }

  @Test
  void finish_rejectsForgedSignature() {
    ClientHello hello = client.start(null);
    ServerSide server = serverHello(hello);
    ServerFinished finished = serverFinish(server, hello, client.respond(server.hello()));
    KeyMaterial other = sig.generateKeyPair(SignatureAlgorithm.ML_DSA_44);

    assertThatThrownBy(() -> client.finish(finished, other.publicKey()))
        .isInstanceOf(SecurityException.class)
        .hasMessageContaining("signature");
  }

  @Test
  void finish_rejectsWrongVerifyData() {
    ClientHello hello = client.start(null);
    ServerSide server = serverHello(hello);
    ServerFinished finished = serverFinish(server, hello, client.respond(server.hello()));
    ServerFinished tampered = new ServerFinished(finished.sessionId(), finished.signature(), new byte[32],
        finished.signatureKeyVersion(), finished.expiresAt());

    assertThatThrownBy(() -> client.finish(tampered, signing.publicKey()))
        .isInstanceOf(SecurityException.class)
        .hasMessageContaining("verify data");
  }

  @Test
  void respond_rejectsAlgorithmNotOffered() {
    ClientHello hello = client.start(null);
    ServerSide server = serverHello(hello);
    ServerHello downgraded = new ServerHello(server.hello().handshakeId(),
        new AlgorithmSuite(KemAlgorithm.ML_KEM_1024, SignatureAlgorithm.ML_DSA_44),
        server.hello().ephemeralPublicKey(), KemAlgorithm.ML_KEM_768, staticKem.publicKey(), 1, 1,
        server.hello().serverNonce(), server.hello().expiresAt());

    assertThatThrownBy(() -> client.respond(downgraded)).isInstanceOf(SecurityException.class);
  }

  @Test
  void outOfOrderCalls_throw() {
    assertThatThrownBy(() -> client.respond(null)).isInstanceOf(IllegalStateException.class);
    assertThatThrownBy(() -> client.finish(null, null)).isInstanceOf(IllegalStateException.class);
    client.start(null);
    assertThatThrownBy(() -> client.start(null)).isInstanceOf(IllegalStateException.class);
  }
}
