package com.codeheadsystems.pqsession.server.handshake;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.spy;

import com.codeheadsystems.pqsession.common.ErrorKind;
import com.codeheadsystems.pqsession.common.Outcome;
import com.codeheadsystems.pqsession.common.RandomProvider;
import com.codeheadsystems.pqsession.crypto.BouncyCastleKemProvider;
import com.codeheadsystems.pqsession.crypto.BouncyCastleSignatureProvider;
import com.codeheadsystems.pqsession.crypto.HkdfSha256KeyDerivation;
import com.codeheadsystems.pqsession.crypto.KemAlgorithm;
import com.codeheadsystems.pqsession.crypto.KemProvider;
import com.codeheadsystems.pqsession.crypto.KeyDerivation;
import com.codeheadsystems.pqsession.crypto.SignatureAlgorithm;
import com.codeheadsystems.pqsession.crypto.SignatureProvider;
import com.codeheadsystems.pqsession.handshake.ClientHello;
import com.codeheadsystems.pqsession.handshake.ClientKeyExchange;
import com.codeheadsystems.pqsession.handshake.ClientSession;
import com.codeheadsystems.pqsession.handshake.HandshakeClient;
import com.codeheadsystems.pqsession.handshake.ServerFinished;
import com.codeheadsystems.pqsession.handshake.ServerHello;
import com.codeheadsystems.pqsession.server.MutableClock;
import com.codeheadsystems.pqsession.server.TestKeyManagers;
import com.codeheadsystems.pqsession.server.key.DefaultKeyManager;
import com.codeheadsystems.pqsession.server.key.KeyManager;
import com.codeheadsystems.pqsession.server.key.KeyType;
import com.codeheadsystems.pqsession.server.key.PublicKeyInfo;
import com.codeheadsystems.pqsession.server.key.PublicKeySet;
import com.codeheadsystems.pqsession.server.store.LocalSessionStore;
import com.codeheadsystems.pqsession.server.store.SessionRecord;
import com.codeheadsystems.pqsession.server.store.SessionStore;
import com.codeheadsystems.pqsession.server.store.StorageBackendUnavailableException;
import com.codeheadsystems.pqsession.server.store.VerificationReason;
import java.security.SecureRandom;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class HandshakeCoordinatorTest {

  private static final RandomProvider RANDOM = TestKeyManagers.RANDOM;

  private final KemProvider kem = new BouncyCastleKemProvider(RANDOM);
  private final SignatureProvider sig = new BouncyCastleSignatureProvider(RANDOM);
  private final KeyDerivation kdf = new HkdfSha256KeyDerivation();

  private MutableClock clock;
  private DefaultKeyManager keyManager;
  private LocalSessionStore store;
  private HandshakeCoordinator coordinator;

  @BeforeEach
  void setUp() {
    clock = MutableClock.startingAt("2026-01-01T00:00:00Z");
    keyManager = TestKeyManagers.software(clock);
    keyManager.ensureKeys();
    store = new LocalSessionStore(clock, Duration.ZERO);
    coordinator = coordinator(keyManager, store, HandshakeConfig.forTesting());
  }

  @AfterEach
  void tearDown() {
    coordinator.shutdown();
    store.close();
  }

  private HandshakeCoordinator coordinator(KeyManager km, SessionStore sessionStore, HandshakeConfig config) {
    return new HandshakeCoordinator(km, kem, kdf, sessionStore, config, RANDOM, clock);
  }

  private HandshakeClient client() {
    return client(RANDOM);
  }

  private HandshakeClient client(RandomProvider random) {
    return new HandshakeClient(new BouncyCastleKemProvider(random), sig, kdf, random,
        List.of(KemAlgorithm.ML_KEM_512, KemAlgorithm.ML_KEM_768),
        List.of(SignatureAlgorithm.ML_DSA_44, SignatureAlgorithm.ML_DSA_65));
  }

  private byte[] signingKey(int version) {
    PublicKeySet keys = keyManager.exportPublicKeys();
    return Stream.concat(Stream.of(keys.signature()), keys.retiring().stream())
        .filter(k -> k.type() == KeyType.SIGNATURE && k.version() == version)
        .findFirst()
        .map(PublicKeyInfo::publicKey)
        .orElseThrow();
  }

  private static <T> void assertFailure(Outcome<T> outcome, ErrorKind kind) {
    assertThat(outcome.isSuccess()).as("expected %s but got %s", kind, outcome).isFalse();
    assertThat(outcome.error()).isEqualTo(kind);
  }

  // ── Happy path ───────────────────────────────────────────────────────────

  @Test
  void fullHandshake_sessionValidUntilTtlThenExpired() {
    HandshakeClient client = client();
    ServerHello hello = coordinator.clientHello(client.start("10.0.0.7")).orElseThrow();
    assertThat(hello.suite().kem()).isEqualTo(KemAlgorithm.ML_KEM_768);
    assertThat(hello.suite().signature()).isEqualTo(SignatureAlgorithm.ML_DSA_44);
    assertThat(hello.expiresAt()).isEqualTo(clock.instant().plusSeconds(30));

    ServerFinished finished = coordinator.clientKeyExchange(client.respond(hello)).orElseThrow();
    ClientSession session = client.finish(finished, signingKey(finished.signatureKeyVersion()));

    SessionRecord record = store.get(finished.sessionId()).orElseThrow();
    assertThat(record.clientWriteKey()).isEqualTo(session.keys().clientWriteKey());
    assertThat(record.serverWriteIv()).isEqualTo(session.keys().serverWriteIv());
    assertThat(record.handshakeHash()).isEqualTo(session.handshakeHash());
    assertThat(record.cipherSuite()).isEqualTo("ML-KEM-768+ML-DSA-44");
    assertThat(record.clientAddress()).isEqualTo("10.0.0.7");
    assertThat(record.expiresAt()).isEqualTo(clock.instant().plusSeconds(3600));
    assertThat(coordinator.stats().pending()).isZero();
    assertThat(coordinator.stats().completed()).isEqualTo(1);

    clock.advanceSeconds(3600);
    assertThat(store.verify(finished.sessionId()).valid()).isTrue();
    clock.advanceSeconds(1);
    assertThat(store.verify(finished.sessionId()).reason()).isEqualTo(VerificationReason.EXPIRED);
  }

  @Test
  void clientHello_acceptsLegacyNamesAndIgnoresUnknown() {
    ClientHello hello = new ClientHello(List.of("Kyber1024", "Frodo-640", "Kyber768"), List.of("Dilithium2"),
        RANDOM.randomBytes(ClientHello.NONCE_LENGTH), null);

    ServerHello serverHello = coordinator.clientHello(hello).orElseThrow();

    assertThat(serverHello.suite().kem()).isEqualTo(KemAlgorithm.ML_KEM_1024);
    assertThat(serverHello.ephemeralPublicKey()).hasSize(KemAlgorithm.ML_KEM_1024.publicKeyLength());
    assertThat(serverHello.staticKemAlgorithm()).isEqualTo(KemAlgorithm.ML_KEM_512);
  }

  @Test
  void negotiation_picksHighestRankedCommonKem() {
    HandshakeConfig config = new HandshakeConfig(Duration.ofSeconds(30), Duration.ZERO, Duration.ofSeconds(3600),
        100, EnumSet.of(KemAlgorithm.ML_KEM_768, KemAlgorithm.ML_KEM_512),
        EnumSet.allOf(SignatureAlgorithm.class), "");
    HandshakeCoordinator restricted = coordinator(keyManager, store, config);
    ClientHello offer = new ClientHello(List.of("ML-KEM-1024", "ML-KEM-768"), List.of("ML-DSA-44"),
        RANDOM.randomBytes(ClientHello.NONCE_LENGTH), null);

    assertThat(restricted.clientHello(offer).orElseThrow().suite().kem()).isEqualTo(KemAlgorithm.ML_KEM_768);

    ClientHello unsupported = new ClientHello(List.of("ML-KEM-1024"), List.of("ML-DSA-44"),
        RANDOM.randomBytes(ClientHello.NONCE_LENGTH), null);
    assertFailure(restricted.clientHello(unsupported), ErrorKind.ALGORITHM_NEGOTIATION_FAILED);
    assertThat(restricted.stats().pending()).isEqualTo(1);
    restricted.shutdown();
  }

  @Test
  void negotiation_failsWhenSigningKeyAlgorithmNotOffered() {
    ClientHello hello = new ClientHello(List.of("ML-KEM-768"), List.of("ML-DSA-87"),
        RANDOM.randomBytes(ClientHello.NONCE_LENGTH), null);

    assertFailure(coordinator.clientHello(hello), ErrorKind.ALGORITHM_NEGOTIATION_FAILED);
    assertThat(coordinator.stats().pending()).isZero();
  }

  @Test
  void clientHello_badNonce_isInvalidRequest() {
    ClientHello hello = new ClientHello(List.of("ML-KEM-768"), List.of("ML-DSA-44"), new byte[8], null);

    assertFailure(coordinator.clientHello(hello), ErrorKind.INVALID_REQUEST);
  }

  @Test
  void clientHello_withoutKeys_isKeyNotAvailable() {
    HandshakeCoordinator empty = coordinator(TestKeyManagers.software(clock), store, HandshakeConfig.forTesting());

    assertFailure(empty.clientHello(client().start(null)), ErrorKind.KEY_NOT_AVAILABLE);
  }

  @Test
  void clientHello_capacityExceeded() {
    HandshakeCoordinator small = coordinator(keyManager, store, HandshakeConfig.forTesting().withMaxPendingHandshakes(2));
    small.clientHello(client().start(null)).orElseThrow();
    small.clientHello(client().start(null)).orElseThrow();

    assertFailure(small.clientHello(client().start(null)), ErrorKind.HANDSHAKE_CAPACITY_EXCEEDED);
    small.shutdown();
  }

  // ── Session ids ──────────────────────────────────────────────────────────

  @Test
  void concurrentHandshakes_getDistinctSessionIdsEvenWithCollidingNonces() throws Exception {
    RandomProvider zeros = new RandomProvider(new SecureRandom() {
      @Override
      public void nextBytes(byte[] bytes) {
        Arrays.fill(bytes, (byte) 0);
      }
    });
    ExecutorService pool = Executors.newFixedThreadPool(4);
    try {
      List<Future<String>> futures = new ArrayList<>();
      for (int i = 0; i < 12; i++) {
        futures.add(pool.submit(() -> {
          HandshakeClient client = client(zeros);
          ServerHello hello = coordinator.clientHello(client.start(null)).orElseThrow();
          return coordinator.clientKeyExchange(client.respond(hello)).orElseThrow().sessionId();
        }));
      }
      Set<String> ids = new HashSet<>();
      for (Future<String> f : futures) {
        ids.add(f.get(30, TimeUnit.SECONDS));
      }
      assertThat(ids).hasSize(12);
    } finally {
      pool.shutdownNow();
    }
    assertThat(store.stats().active()).isEqualTo(12);
  }

  // ── Rotation ─────────────────────────────────────────────────────────────

  @Test
  void rotationMidHandshake_withinGrace_succeedsWithPinnedVersions() {
    HandshakeClient client = client();
    ServerHello hello = coordinator.clientHello(client.start(null)).orElseThrow();
    keyManager.rotateKemKey();
    keyManager.rotateSignatureKey();
    clock.advanceSeconds(20);

    ServerFinished finished = coordinator.clientKeyExchange(client.respond(hello)).orElseThrow();

    assertThat(finished.signatureKeyVersion()).isEqualTo(1);
    assertThat(client.finish(finished, signingKey(1)).sessionId()).isEqualTo(finished.sessionId());
  }

  @Test
  void rotationMidHandshake_afterGrace_failsCleanly() {
    HandshakeConfig longTimeout = new HandshakeConfig(Duration.ofSeconds(120), Duration.ZERO,
        Duration.ofSeconds(3600), 100, EnumSet.allOf(KemAlgorithm.class),
        EnumSet.allOf(SignatureAlgorithm.class), "");
    HandshakeCoordinator patient = coordinator(keyManager, store, longTimeout);
    HandshakeClient client = client();
    ServerHello hello = patient.clientHello(client.start(null)).orElseThrow();
    keyManager.rotateKemKey();
    keyManager.rotateSignatureKey();
    clock.advanceSeconds(31);

    assertFailure(patient.clientKeyExchange(client.respond(hello)), ErrorKind.HANDSHAKE_NOT_FOUND);
    assertThat(store.stats().total()).isZero();
    assertThat(patient.stats().pending()).isZero();
    patient.shutdown();
  }

  // ── Integrity ────────────────────────────────────────────────────────────

  @Test
  void corruptedCiphertext_isIntegrityFailureAndStoresNothing() {
    HandshakeClient client = client();
    ServerHello hello = coordinator.clientHello(client.start(null)).orElseThrow();
    ClientKeyExchange exchange = client.respond(hello);
    byte[] corrupted = exchange.ephemeralCiphertext().clone();
    corrupted[17] ^= 0x5a;

    Outcome<ServerFinished> outcome = coordinator.clientKeyExchange(new ClientKeyExchange(exchange.handshakeId(),
        corrupted, exchange.staticCiphertext(), exchange.clientVerifyData()));

    assertFailure(outcome, ErrorKind.TRANSCRIPT_INTEGRITY_FAILURE);
    assertThat(store.stats().total()).isZero();
    assertThat(coordinator.stats().integrityFailures()).isEqualTo(1);
    assertFailure(coordinator.clientKeyExchange(exchange), ErrorKind.HANDSHAKE_NOT_FOUND);
  }

  @Test
  void wrongCiphertextLength_isIntegrityFailure() {
    HandshakeClient client = client();
    ServerHello hello = coordinator.clientHello(client.start(null)).orElseThrow();
    ClientKeyExchange exchange = client.respond(hello);

    Outcome<ServerFinished> outcome = coordinator.clientKeyExchange(new ClientKeyExchange(exchange.handshakeId(),
        new byte[5], exchange.staticCiphertext(), exchange.clientVerifyData()));

    assertFailure(outcome, ErrorKind.TRANSCRIPT_INTEGRITY_FAILURE);
    assertThat(store.stats().total()).isZero();
  }

  @Test
  void mismatchedClientVerifyData_isIntegrityFailure() {
    HandshakeClient client = client();
    ServerHello hello = coordinator.clientHello(client.start(null)).orElseThrow();
    ClientKeyExchange exchange = client.respond(hello);
    byte[] verify = exchange.clientVerifyData().clone();
    verify[0] ^= 0x01;

    assertFailure(coordinator.clientKeyExchange(new ClientKeyExchange(exchange.handshakeId(),
        exchange.ephemeralCiphertext(), exchange.staticCiphertext(), verify)), ErrorKind.TRANSCRIPT_INTEGRITY_FAILURE);
    assertThat(store.stats().total()).isZero();
  }

  @Test
  void missingClientVerifyData_isIntegrityFailure() {
    HandshakeClient client = client();
    ServerHello hello = coordinator.clientHello(client.start(null)).orElseThrow();
    ClientKeyExchange exchange = client.respond(hello);

    assertFailure(coordinator.clientKeyExchange(new ClientKeyExchange(exchange.handshakeId(),
        exchange.ephemeralCiphertext(), exchange.staticCiphertext(), null)), ErrorKind.TRANSCRIPT_INTEGRITY_FAILURE);
    assertThat(store.stats().total()).isZero();
  }

  @Test
  void corruptedCiphertextWithoutVerifyData_storesNothing() {
    HandshakeClient client = client();
    ServerHello hello = coordinator.clientHello(client.start(null)).orElseThrow();
    ClientKeyExchange exchange = client.respond(hello);
    byte[] corrupted = exchange.staticCiphertext().clone();
    corrupted[3] ^= 0x11;

    Outcome<ServerFinished> outcome = coordinator.clientKeyExchange(new ClientKeyExchange(exchange.handshakeId(),
        exchange.ephemeralCiphertext(), corrupted, null));

    assertFailure(outcome, ErrorKind.TRANSCRIPT_INTEGRITY_FAILURE);
    assertThat(store.stats().total()).isZero();
    assertThat(coordinator.stats().integrityFailures()).isEqualTo(1);
  }

  // ── Ordering ─────────────────────────────────────────────────────────────

  @Test
  void replayAfterCompletion_isNotFound() {
    HandshakeClient client = client();
    ServerHello hello = coordinator.clientHello(client.start(null)).orElseThrow();
    ClientKeyExchange exchange = client.respond(hello);
    coordinator.clientKeyExchange(exchange).orElseThrow();

    assertFailure(coordinator.clientKeyExchange(exchange), ErrorKind.HANDSHAKE_NOT_FOUND);
    assertFailure(coordinator.clientKeyExchange(new ClientKeyExchange("no-such-id", new byte[1], new byte[1], null)),
        ErrorKind.HANDSHAKE_NOT_FOUND);
  }

  @Test
  void secondExchangeWhileFirstInFlight_isProtocolOrderViolation() throws Exception {
    CountDownLatch entered = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    DefaultKeyManager blocking = spy(keyManager);
    doAnswer(invocation -> {
      entered.countDown();
      assertThat(release.await(10, TimeUnit.SECONDS)).isTrue();
      return invocation.callRealMethod();
    }).when(blocking).decapsulate(anyInt(), any());
    HandshakeCoordinator gated = coordinator(blocking, store, HandshakeConfig.forTesting());

    HandshakeClient client = client();
    ServerHello hello = gated.clientHello(client.start(null)).orElseThrow();
    ClientKeyExchange exchange = client.respond(hello);

    ExecutorService pool = Executors.newSingleThreadExecutor();
    try {
      Future<Outcome<ServerFinished>> first = pool.submit(() -> gated.clientKeyExchange(exchange));
      assertThat(entered.await(10, TimeUnit.SECONDS)).isTrue();

      assertFailure(gated.clientKeyExchange(exchange), ErrorKind.PROTOCOL_ORDER_VIOLATION);
      assertThat(gated.phase(hello.handshakeId())).contains(HandshakePhase.KEY_EXCHANGED);

      release.countDown();
      assertThat(first.get(10, TimeUnit.SECONDS).isSuccess()).isTrue();
    } finally {
      release.countDown();
      pool.shutdownNow();
    }
    assertThat(gated.phase(hello.handshakeId())).isEmpty();
    assertThat(store.stats().total()).isEqualTo(1);
  }

  @Test
  void concurrentDoubleCompletion_exactlyOneSucceeds() throws Exception {
    HandshakeClient client = client();
    ServerHello hello = coordinator.clientHello(client.start(null)).orElseThrow();
    ClientKeyExchange exchange = client.respond(hello);
    CountDownLatch go = new CountDownLatch(1);
    Callable<Outcome<ServerFinished>> attempt = () -> {
      go.await();
      return coordinator.clientKeyExchange(exchange);
    };

    ExecutorService pool = Executors.newFixedThreadPool(6);
    List<Outcome<ServerFinished>> outcomes = new ArrayList<>();
    try {
      List<Future<Outcome<ServerFinished>>> futures = new ArrayList<>();
      for (int i = 0; i < 6; i++) {
        futures.add(pool.submit(attempt));
      }
      go.countDown();
      for (Future<Outcome<ServerFinished>> f : futures) {
        outcomes.add(f.get(30, TimeUnit.SECONDS));
      }
    } finally {
      pool.shutdownNow();
    }

    assertThat(outcomes).filteredOn(Outcome::isSuccess).hasSize(1);
    assertThat(outcomes).filteredOn(o -> !o.isSuccess()).extracting(Outcome::error)
        .allMatch(e -> e == ErrorKind.PROTOCOL_ORDER_VIOLATION || e == ErrorKind.HANDSHAKE_NOT_FOUND);
    assertThat(store.stats().total()).isEqualTo(1);
  }

  // ── Timeouts ─────────────────────────────────────────────────────────────

  @Test
  void sweep_reclaimsAbandonedHandshakes() {
    HandshakeClient client = client();
    ServerHello hello = coordinator.clientHello(client.start(null)).orElseThrow();
    coordinator.clientHello(client().start(null)).orElseThrow();

    clock.advanceSeconds(30);
    assertThat(coordinator.sweepExpired()).isZero();
    clock.advanceSeconds(1);
    assertThat(coordinator.sweepExpired()).isEqualTo(2);

    assertThat(coordinator.stats().timedOut()).isEqualTo(2);
    assertThat(coordinator.stats().pending()).isZero();
    assertFailure(coordinator.clientKeyExchange(client.respond(hello)), ErrorKind.HANDSHAKE_NOT_FOUND);
  }

  @Test
  void expiredHandshake_rejectedEvenBeforeSweep() {
    HandshakeClient client = client();
    ServerHello hello = coordinator.clientHello(client.start(null)).orElseThrow();
    clock.advanceSeconds(31);

    assertFailure(coordinator.clientKeyExchange(client.respond(hello)), ErrorKind.HANDSHAKE_NOT_FOUND);
    assertThat(coordinator.stats().timedOut()).isEqualTo(1);
    assertThat(coordinator.stats().pending()).isZero();
  }

  // ── Storage ──────────────────────────────────────────────────────────────

  @Test
  void storageUnavailable_failsClosed() {
    SessionStore failing = mock(SessionStore.class);
    doThrow(new StorageBackendUnavailableException("redis down", null)).when(failing).put(any());
    HandshakeCoordinator withFailingStore = coordinator(keyManager, failing, HandshakeConfig.forTesting());
    HandshakeClient client = client();
    ServerHello hello = withFailingStore.clientHello(client.start(null)).orElseThrow();

    assertFailure(withFailingStore.clientKeyExchange(client.respond(hello)), ErrorKind.STORAGE_BACKEND_UNAVAILABLE);
    assertThat(withFailingStore.stats().pending()).isZero();
  }
}
