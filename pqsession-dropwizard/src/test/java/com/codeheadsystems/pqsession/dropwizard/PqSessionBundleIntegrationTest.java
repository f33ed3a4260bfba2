package com.codeheadsystems.pqsession.dropwizard;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.pqsession.common.RandomProvider;
import com.codeheadsystems.pqsession.crypto.BouncyCastleKemProvider;
import com.codeheadsystems.pqsession.crypto.BouncyCastleSignatureProvider;
import com.codeheadsystems.pqsession.crypto.HkdfSha256KeyDerivation;
import com.codeheadsystems.pqsession.crypto.KemAlgorithm;
import com.codeheadsystems.pqsession.crypto.SignatureAlgorithm;
import com.codeheadsystems.pqsession.handshake.ClientSession;
import com.codeheadsystems.pqsession.handshake.HandshakeClient;
import com.codeheadsystems.pqsession.model.HealthResponse;
import com.codeheadsystems.pqsession.model.WireFields;
import com.codeheadsystems.pqsession.model.handshake.ClientHelloRequest;
import com.codeheadsystems.pqsession.model.handshake.ClientKeyExchangeRequest;
import com.codeheadsystems.pqsession.model.handshake.ServerFinishedResponse;
import com.codeheadsystems.pqsession.model.handshake.ServerHelloResponse;
import com.codeheadsystems.pqsession.model.keys.PublicKeysResponse;
import com.codeheadsystems.pqsession.model.session.SessionInvalidateResponse;
import com.codeheadsystems.pqsession.model.session.SessionVerifyRequest;
import com.codeheadsystems.pqsession.model.session.SessionVerifyResponse;
import com.codeheadsystems.pqsession.server.key.KeyManager;
import io.dropwizard.testing.ResourceHelpers;
import io.dropwizard.testing.junit5.DropwizardAppExtension;
import io.dropwizard.testing.junit5.DropwizardExtensionsSupport;
import jakarta.ws.rs.client.Entity;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

/**
 * Dropwizard integration tests for {@link PqSessionBundle}.
 * <p>
 * Starts a real embedded Jetty server with the test configuration and drives complete handshakes
 * over HTTP with {@link HandshakeClient}.
 */
@ExtendWith(DropwizardExtensionsSupport.class)
class PqSessionBundleIntegrationTest {

  static final DropwizardAppExtension<PqSessionConfiguration> APP =
      new DropwizardAppExtension<>(
          PqSessionApplication.class,
          ResourceHelpers.resourceFilePath("test-config.yml"));

  private static final RandomProvider RANDOM = new RandomProvider();

  private static HandshakeClient newClient() {
    return new HandshakeClient(new BouncyCastleKemProvider(RANDOM), new BouncyCastleSignatureProvider(RANDOM),
        new HkdfSha256KeyDerivation(), RANDOM,
        List.of(KemAlgorithm.ML_KEM_768), List.of(SignatureAlgorithm.ML_DSA_44));
  }

  // ── Health ───────────────────────────────────────────────────────────────

  @Test
  void adminHealthCheckReportsHealthy() {
    Response response = APP.client()
        .target(String.format("http://localhost:%d/healthcheck", APP.getAdminPort()))
        .request()
        .get();

    assertThat(response.getStatus()).isEqualTo(200);
    String body = response.readEntity(String.class);
    assertThat(body).contains("pqsession-keys");
    assertThat(body).contains("pqsession-session-store");
    assertThat(body).doesNotContain("\"healthy\":false");
  }

  @Test
  void healthEndpointReportsSubsystems() {
    HealthResponse health = APP.client()
        .target(baseUrl() + "/pqc/health")
        .request(MediaType.APPLICATION_JSON)
        .get(HealthResponse.class);

    assertThat(health.status()).isEqualTo("ok");
    assertThat(health.subsystems()).containsKeys("keys", "sessionStore", "handshakes");
  }

  // ── Keys ─────────────────────────────────────────────────────────────────

  @Test
  void keysArePublishedAfterStartup() {
    PublicKeysResponse keys = fetchKeys();

    assertThat(keys.kem().algorithm()).isEqualTo("ML-KEM-512");
    assertThat(keys.signature().algorithm()).isEqualTo("ML-DSA-44");
    assertThat(WireFields.decode(keys.kem().publicKeyBase64(), "publicKey"))
        .hasSize(KemAlgorithm.ML_KEM_512.publicKeyLength());
    assertThat(keys.supportedKemAlgorithms()).containsExactly("ML-KEM-1024", "ML-KEM-768", "ML-KEM-512");
  }

  // ── Handshake and session lifecycle ──────────────────────────────────────

  @Test
  void fullHandshakeThenVerifyAndInvalidate() {
    HandshakeClient client = newClient();
    ServerHelloResponse hello = post("/pqc/handshake/hello", new ClientHelloRequest(client.start("198.51.100.4")))
        .readEntity(ServerHelloResponse.class);
    assertThat(hello.kemAlgorithm()).isEqualTo("ML-KEM-768");

    Response exchange = post("/pqc/handshake/key-exchange",
        new ClientKeyExchangeRequest(client.respond(hello.serverHello())));
    assertThat(exchange.getStatus()).isEqualTo(200);
    ServerFinishedResponse finished = exchange.readEntity(ServerFinishedResponse.class);
    assertThat(finished.status()).isEqualTo(ServerFinishedResponse.ESTABLISHED);

    byte[] signingKey = WireFields.decode(
        fetchKeys().signatureKey(finished.signatureKeyVersion()).orElseThrow().publicKeyBase64(), "publicKey");
    ClientSession session = client.finish(finished.serverFinished(), signingKey);

    SessionVerifyResponse verified = post("/pqc/session/verify", new SessionVerifyRequest(session.sessionId()))
        .readEntity(SessionVerifyResponse.class);
    assertThat(verified.valid()).isTrue();
    assertThat(verified.cipherSuite()).isEqualTo("ML-KEM-768+ML-DSA-44");
    assertThat(verified.clientAddress()).isEqualTo("198.51.100.4");

    Response deleted = APP.client()
        .target(baseUrl() + "/pqc/session/" + session.sessionId())
        .request(MediaType.APPLICATION_JSON)
        .delete();
    assertThat(deleted.getStatus()).isEqualTo(200);
    assertThat(deleted.readEntity(SessionInvalidateResponse.class).status()).isEqualTo("invalidated");

    Response afterDelete = post("/pqc/session/verify", new SessionVerifyRequest(session.sessionId()));
    assertThat(afterDelete.getStatus()).isEqualTo(200);
    SessionVerifyResponse invalidated = afterDelete.readEntity(SessionVerifyResponse.class);
    assertThat(invalidated.valid()).isFalse();
    assertThat(invalidated.reason()).isEqualTo("INVALIDATED");
  }

  @Test
  void replayedKeyExchangeReturns404() {
    HandshakeClient client = newClient();
    ServerHelloResponse hello = post("/pqc/handshake/hello", new ClientHelloRequest(client.start(null)))
        .readEntity(ServerHelloResponse.class);
    ClientKeyExchangeRequest exchange = new ClientKeyExchangeRequest(client.respond(hello.serverHello()));

    assertThat(post("/pqc/handshake/key-exchange", exchange).getStatus()).isEqualTo(200);
    assertThat(post("/pqc/handshake/key-exchange", exchange).getStatus()).isEqualTo(404);
  }

  @Test
  void tamperedVerifyDataReturns401() {
    HandshakeClient client = newClient();
    ServerHelloResponse hello = post("/pqc/handshake/hello", new ClientHelloRequest(client.start(null)))
        .readEntity(ServerHelloResponse.class);
    ClientKeyExchangeRequest exchange = new ClientKeyExchangeRequest(client.respond(hello.serverHello()));
    ClientKeyExchangeRequest tampered = new ClientKeyExchangeRequest(exchange.handshakeId(),
        exchange.ephemeralCiphertextBase64(), exchange.staticCiphertextBase64(),
        WireFields.encode(new byte[32]));

    assertThat(post("/pqc/handshake/key-exchange", tampered).getStatus()).isEqualTo(401);
  }

  @Test
  void noCommonKemReturns400() {
    ClientHelloRequest request = new ClientHelloRequest(List.of("FrodoKEM-640"), List.of("ML-DSA-44"),
        WireFields.encode(RANDOM.randomBytes(32)), null);

    assertThat(post("/pqc/handshake/hello", request).getStatus()).isEqualTo(400);
  }

  @Test
  void malformedBase64Returns400() {
    ClientHelloRequest request = new ClientHelloRequest(List.of("ML-KEM-768"), List.of("ML-DSA-44"),
        "not base64!", null);

    assertThat(post("/pqc/handshake/hello", request).getStatus()).isEqualTo(400);
  }

  @Test
  void unknownSessionReturns404() {
    assertThat(post("/pqc/session/verify", new SessionVerifyRequest("no-such-session")).getStatus())
        .isEqualTo(404);
  }

  @Test
  void rotationKeepsPreviousSigningKeyPublishedDuringGrace() {
    KeyManager keyManager = ((PqSessionApplication) APP.getApplication()).bundle().manager().keyManager();
    int before = fetchKeys().signature().version();

    keyManager.rotateSignatureKey();

    PublicKeysResponse keys = fetchKeys();
    assertThat(keys.signature().version()).isEqualTo(before + 1);
    assertThat(keys.signatureKey(before)).isPresent();
  }

  // ── Helpers ──────────────────────────────────────────────────────────────

  private PublicKeysResponse fetchKeys() {
    return APP.client()
        .target(baseUrl() + "/pqc/keys")
        .request(MediaType.APPLICATION_JSON)
        .get(PublicKeysResponse.class);
  }

  private Response post(String path, Object body) {
    return APP.client()
        .target(baseUrl() + path)
        .request(MediaType.APPLICATION_JSON)
        .post(Entity.json(body));
  }

  private String baseUrl() {
    return String.format("http://localhost:%d", APP.getLocalPort());
  }
}
