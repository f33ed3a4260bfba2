package com.codeheadsystems.pqsession.server.handshake;

import com.codeheadsystems.pqsession.common.ByteUtils;
import com.codeheadsystems.pqsession.common.ErrorKind;
import com.codeheadsystems.pqsession.common.Outcome;
import com.codeheadsystems.pqsession.common.RandomProvider;
import com.codeheadsystems.pqsession.crypto.AlgorithmNegotiator;
import com.codeheadsystems.pqsession.crypto.AlgorithmSuite;
import com.codeheadsystems.pqsession.crypto.CryptoOperationException;
import com.codeheadsystems.pqsession.crypto.KemAlgorithm;
import com.codeheadsystems.pqsession.crypto.KemProvider;
import com.codeheadsystems.pqsession.crypto.KeyDerivation;
import com.codeheadsystems.pqsession.crypto.KeyMaterial;
import com.codeheadsystems.pqsession.crypto.SignatureAlgorithm;
import com.codeheadsystems.pqsession.handshake.ClientHello;
import com.codeheadsystems.pqsession.handshake.ClientKeyExchange;
import com.codeheadsystems.pqsession.handshake.HandshakeTranscript;
import com.codeheadsystems.pqsession.handshake.ServerFinished;
import com.codeheadsystems.pqsession.handshake.ServerHello;
import com.codeheadsystems.pqsession.handshake.SessionKeySchedule;
import com.codeheadsystems.pqsession.handshake.SessionKeys;
import com.codeheadsystems.pqsession.server.key.KeyManager;
import com.codeheadsystems.pqsession.server.key.KeyManagerException;
import com.codeheadsystems.pqsession.server.key.KeyType;
import com.codeheadsystems.pqsession.server.key.PublicKeyInfo;
import com.codeheadsystems.pqsession.server.security.SecurityEvents;
import com.codeheadsystems.pqsession.server.store.SessionRecord;
import com.codeheadsystems.pqsession.server.store.SessionStore;
import com.codeheadsystems.pqsession.server.store.StorageBackendUnavailableException;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Instant;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Server side of the handshake: negotiates a suite on ClientHello, completes the hybrid key
 * exchange on ClientKeyExchange and hands the resulting session to the {@link SessionStore}.
 * <p>
 * Pending handshakes live in a concurrent table keyed by handshake id. Each state moves
 * {@code HELLO_RECEIVED -> KEY_EXCHANGED} through a compare-and-set, so two concurrent key
 * exchanges for the same id never both succeed. The long-term key versions are pinned at
 * ClientHello; a rotation in between is absorbed by the key manager's grace period.
 * <p>
 * Protocol failures are returned as {@link Outcome} values, never thrown.
 */
public class HandshakeCoordinator {

  private static final Logger log = LoggerFactory.getLogger(HandshakeCoordinator.class);

  private final KeyManager keyManager;
  private final KemProvider kemProvider;
  private final SessionKeySchedule keySchedule;
  private final SessionStore sessionStore;
  private final HandshakeConfig config;
  private final RandomProvider randomProvider;
  private final Clock clock;
  private final AlgorithmNegotiator negotiator;

  private final ConcurrentHashMap<String, HandshakeState> pending = new ConcurrentHashMap<>();

  private final AtomicLong started = new AtomicLong();
  private final AtomicLong completed = new AtomicLong();
  private final AtomicLong failed = new AtomicLong();
  private final AtomicLong integrityFailures = new AtomicLong();
  private final AtomicLong timedOut = new AtomicLong();

  private ScheduledExecutorService sweeper;

  public HandshakeCoordinator(KeyManager keyManager,
                              KemProvider kemProvider,
                              KeyDerivation kdf,
                              SessionStore sessionStore,
                              HandshakeConfig config,
                              RandomProvider randomProvider,
                              Clock clock) {
    this.keyManager = keyManager;
    this.kemProvider = kemProvider;
    this.keySchedule = new SessionKeySchedule(kdf);
    this.sessionStore = sessionStore;
    this.config = config;
    this.randomProvider = randomProvider;
    this.clock = clock;
    this.negotiator = new AlgorithmNegotiator(config.supportedKems(), config.supportedSignatures());
  }

  // ── ClientHello ──────────────────────────────────────────────────────────

  /**
   * Negotiates a suite, pins the current long-term key versions and opens a pending handshake.
   * <p>
   * {@link HandshakeConfig#maxPendingHandshakes()} is a soft cap: the size check and the insert
   * are separate steps, so concurrent hellos may overshoot it by the number of callers in flight.
   *
   * @param hello the client's hello
   * @return the server hello, or {@code INVALID_REQUEST}, {@code ALGORITHM_NEGOTIATION_FAILED},
   *     {@code KEY_NOT_AVAILABLE} or {@code HANDSHAKE_CAPACITY_EXCEEDED}
   */
  public Outcome<ServerHello> clientHello(ClientHello hello) {
    if (hello == null || hello.clientNonce() == null || hello.clientNonce().length != ClientHello.NONCE_LENGTH) {
      return Outcome.failure(ErrorKind.INVALID_REQUEST, "Client nonce must be " + ClientHello.NONCE_LENGTH + " bytes");
    }
    Optional<PublicKeyInfo> kemKey = keyManager.currentKey(KeyType.KEM);
    Optional<PublicKeyInfo> sigKey = keyManager.currentKey(KeyType.SIGNATURE);
    if (kemKey.isEmpty() || sigKey.isEmpty()) {
      return Outcome.failure(ErrorKind.KEY_NOT_AVAILABLE, "Server keys are not initialized");
    }
    Optional<SignatureAlgorithm> signingAlgorithm = SignatureAlgorithm.fromName(sigKey.get().algorithm());
    Optional<KemAlgorithm> staticKemAlgorithm = KemAlgorithm.fromName(kemKey.get().algorithm());
    if (signingAlgorithm.isEmpty() || staticKemAlgorithm.isEmpty()) {
      return Outcome.failure(ErrorKind.KEY_NOT_AVAILABLE, "Server keys use an unknown algorithm");
    }

    Outcome<AlgorithmSuite> negotiated = negotiator
        .restrictSignatures(Set.of(signingAlgorithm.get()))
        .negotiate(hello.offeredKems(), hello.offeredSignatures());
    if (!negotiated.isSuccess()) {
      log.debug("Negotiation failed: kems={} signatures={}", hello.offeredKems(), hello.offeredSignatures());
      failed.incrementAndGet();
      return Outcome.failure(negotiated.error(), negotiated.message());
    }
    if (pending.size() >= config.maxPendingHandshakes()) {
      log.warn("Rejecting ClientHello: {} handshakes pending", pending.size());
      return Outcome.failure(ErrorKind.HANDSHAKE_CAPACITY_EXCEEDED, "Too many pending handshakes");
    }

    AlgorithmSuite suite = negotiated.value();
    KeyMaterial ephemeral = kemProvider.generateKeyPair(suite.kem());
    Instant now = clock.instant();
    String handshakeId = UUID.randomUUID().toString();
    byte[] serverNonce = randomProvider.randomBytes(ClientHello.NONCE_LENGTH);
    Instant expiresAt = now.plus(config.handshakeTimeout());

    ServerHello serverHello = new ServerHello(handshakeId, suite, ephemeral.publicKey(),
        staticKemAlgorithm.get(), kemKey.get().publicKey(), kemKey.get().version(), sigKey.get().version(),
        serverNonce, expiresAt);
    HandshakeTranscript transcript = new HandshakeTranscript();
    transcript.appendClientHello(hello);
    transcript.appendServerHello(serverHello);

    HandshakeState state = new HandshakeState(handshakeId, suite, hello, serverNonce, ephemeral,
        staticKemAlgorithm.get(), kemKey.get().version(), sigKey.get().version(), transcript, now, expiresAt);
    state.advance(HandshakePhase.INIT, HandshakePhase.HELLO_RECEIVED);
    pending.put(handshakeId, state);
    started.incrementAndGet();
    log.debug("ClientHello accepted: handshake={} suite={} kemVersion={} sigVersion={}",
        handshakeId, suite, kemKey.get().version(), sigKey.get().version());
    return Outcome.success(serverHello);
  }

  // ── ClientKeyExchange ────────────────────────────────────────────────────

  /**
   * Completes the key exchange, authenticates the transcript and stores the new session.
   *
   * @param exchange the client's key exchange
   * @return ServerFinished, or {@code HANDSHAKE_NOT_FOUND}, {@code PROTOCOL_ORDER_VIOLATION},
   *     {@code TRANSCRIPT_INTEGRITY_FAILURE} or {@code STORAGE_BACKEND_UNAVAILABLE}
   */
  public Outcome<ServerFinished> clientKeyExchange(ClientKeyExchange exchange) {
    if (exchange == null || exchange.handshakeId() == null) {
      return Outcome.failure(ErrorKind.INVALID_REQUEST, "Missing handshake id");
    }
    String handshakeId = exchange.handshakeId();
    HandshakeState state = pending.get(handshakeId);
    if (state == null) {
      return Outcome.failure(ErrorKind.HANDSHAKE_NOT_FOUND, "Handshake not found or expired");
    }
    if (state.isExpired(clock.instant())) {
      if (state.advance(HandshakePhase.HELLO_RECEIVED, HandshakePhase.TIMEOUT)) {
        discard(state);
        timedOut.incrementAndGet();
      }
      return Outcome.failure(ErrorKind.HANDSHAKE_NOT_FOUND, "Handshake not found or expired");
    }
    if (!state.advance(HandshakePhase.HELLO_RECEIVED, HandshakePhase.KEY_EXCHANGED)) {
      // Owned by an in-flight exchange, which discards the state when it returns.
      HandshakePhase actual = state.phase();
      failed.incrementAndGet();
      SecurityEvents.protocolOrderViolation(handshakeId, HandshakePhase.HELLO_RECEIVED.name(), actual.name());
      return Outcome.failure(ErrorKind.PROTOCOL_ORDER_VIOLATION, "Handshake is in state " + actual);
    }

    try {
      return complete(state, exchange);
    } finally {
      discard(state);
    }
  }

  private Outcome<ServerFinished> complete(HandshakeState state, ClientKeyExchange exchange) {
    String handshakeId = state.handshakeId();
    AlgorithmSuite suite = state.suite();
    if (exchange.ephemeralCiphertext() == null
        || exchange.ephemeralCiphertext().length != suite.kem().ciphertextLength()
        || exchange.staticCiphertext() == null
        || exchange.staticCiphertext().length != state.staticKemAlgorithm().ciphertextLength()) {
      return integrityFailure(state, "ciphertext length mismatch");
    }
    // A corrupted ciphertext decapsulates to a different secret without error; only the client
    // verify data detects it.
    if (exchange.clientVerifyData() == null) {
      return integrityFailure(state, "client verify data missing");
    }

    byte[] ephemeralSecret;
    byte[] staticSecret;
    try {
      ephemeralSecret = kemProvider.decapsulate(suite.kem(), state.ephemeralKey().privateKey(),
          exchange.ephemeralCiphertext());
      staticSecret = keyManager.decapsulate(state.kemKeyVersion(), exchange.staticCiphertext());
    } catch (CryptoOperationException e) {
      return integrityFailure(state, "decapsulation failed");
    } catch (KeyManagerException e) {
      return keyUnavailable(state, e);
    }

    HandshakeTranscript transcript = state.transcript();
    transcript.appendClientKeyExchange(new ClientKeyExchange(handshakeId, exchange.ephemeralCiphertext(),
        exchange.staticCiphertext(), null));
    byte[] transcriptHash = transcript.currentHash();
    SessionKeys keys = keySchedule.derive(ephemeralSecret, staticSecret,
        state.clientHello().clientNonce(), state.serverNonce(), transcriptHash);
    ByteUtils.zeroize(ephemeralSecret, staticSecret);

    if (!MessageDigest.isEqual(keySchedule.clientVerifyData(keys, transcriptHash), exchange.clientVerifyData())) {
      keys.destroy();
      return integrityFailure(state, "client verify data mismatch");
    }

    byte[] signature;
    try {
      signature = keyManager.sign(state.signatureKeyVersion(), transcriptHash);
    } catch (KeyManagerException e) {
      keys.destroy();
      return keyUnavailable(state, e);
    }
    byte[] serverVerifyData = keySchedule.serverVerifyData(keys, transcriptHash);

    Instant now = clock.instant();
    Instant expiresAt = now.plus(config.sessionTtl());
    String sessionId = UUID.randomUUID().toString();
    SessionRecord record = new SessionRecord(sessionId, keys.clientWriteKey(), keys.serverWriteKey(),
        keys.clientWriteIv(), keys.serverWriteIv(), serverVerifyData, suite.suiteName(), transcriptHash,
        now, expiresAt, state.clientHello().clientAddress(), config.serverAddress(), null);
    try {
      sessionStore.put(record);
    } catch (StorageBackendUnavailableException e) {
      log.warn("Session store unavailable, handshake {} not completed", handshakeId);
      keys.destroy();
      state.advance(HandshakePhase.KEY_EXCHANGED, HandshakePhase.FAILED);
      failed.incrementAndGet();
      return Outcome.failure(ErrorKind.STORAGE_BACKEND_UNAVAILABLE, "Session storage is unavailable");
    }
    state.advance(HandshakePhase.KEY_EXCHANGED, HandshakePhase.FINISHED);
    completed.incrementAndGet();
    log.debug("Handshake {} finished: session={} suite={}", handshakeId, sessionId, suite);
    return Outcome.success(new ServerFinished(sessionId, signature, serverVerifyData,
        state.signatureKeyVersion(), expiresAt));
  }

  private Outcome<ServerFinished> integrityFailure(HandshakeState state, String reason) {
    state.advance(HandshakePhase.KEY_EXCHANGED, HandshakePhase.FAILED);
    failed.incrementAndGet();
    integrityFailures.incrementAndGet();
    SecurityEvents.transcriptIntegrityFailure(state.handshakeId(), state.suite().suiteName(), reason);
    return Outcome.failure(ErrorKind.TRANSCRIPT_INTEGRITY_FAILURE, "Handshake integrity check failed");
  }

  private Outcome<ServerFinished> keyUnavailable(HandshakeState state, KeyManagerException e) {
    state.advance(HandshakePhase.KEY_EXCHANGED, HandshakePhase.FAILED);
    failed.incrementAndGet();
    if (e.errorKind() != ErrorKind.KEY_NOT_AVAILABLE) {
      throw e;
    }
    log.info("Handshake {} pinned a key that is no longer available: {}", state.handshakeId(), e.getMessage());
    return Outcome.failure(ErrorKind.HANDSHAKE_NOT_FOUND, "Handshake keys have been rotated out, restart the handshake");
  }

  private void discard(HandshakeState state) {
    if (pending.remove(state.handshakeId(), state)) {
      state.destroy();
    }
  }

  // ── Timeout sweep ────────────────────────────────────────────────────────

  /**
   * Removes handshakes that are past their timeout and still waiting for ClientKeyExchange.
   *
   * @return the number removed
   */
  public int sweepExpired() {
    Instant now = clock.instant();
    int removed = 0;
    Iterator<Map.Entry<String, HandshakeState>> it = pending.entrySet().iterator();
    while (it.hasNext()) {
      HandshakeState state = it.next().getValue();
      if (state.isExpired(now) && state.advance(HandshakePhase.HELLO_RECEIVED, HandshakePhase.TIMEOUT)) {
        it.remove();
        state.destroy();
        removed++;
      }
    }
    if (removed > 0) {
      timedOut.addAndGet(removed);
      log.debug("Swept {} timed-out handshake(s)", removed);
    }
    return removed;
  }

  /**
   * Starts the background timeout sweep unless the configured interval is zero.
   */
  public synchronized void start() {
    if (sweeper != null || config.sweepInterval().isZero() || config.sweepInterval().isNegative()) {
      return;
    }
    sweeper = Executors.newSingleThreadScheduledExecutor(r -> {
      Thread t = new Thread(r, "pqsession-handshake-sweeper");
      t.setDaemon(true);
      return t;
    });
    long periodMillis = config.sweepInterval().toMillis();
    sweeper.scheduleAtFixedRate(() -> {
      try {
        sweepExpired();
      } catch (RuntimeException e) {
        log.error("Handshake sweep failed", e);
      }
    }, periodMillis, periodMillis, TimeUnit.MILLISECONDS);
  }

  /**
   * Stops the sweep and drops every pending handshake.
   */
  public synchronized void shutdown() {
    if (sweeper != null) {
      sweeper.shutdownNow();
      sweeper = null;
    }
    pending.values().forEach(state -> {
      if (pending.remove(state.handshakeId(), state)) {
        state.destroy();
      }
    });
  }

  public HandshakeStats stats() {
    return new HandshakeStats(started.get(), completed.get(), failed.get(), integrityFailures.get(),
        timedOut.get(), pending.size());
  }

  /**
   * KEM algorithms the coordinator negotiates, strongest first.
   */
  public List<String> supportedKemNames() {
    return negotiator.supportedKemNames();
  }

  Optional<HandshakePhase> phase(String handshakeId) {
    return Optional.ofNullable(pending.get(handshakeId)).map(HandshakeState::phase);
  }
}
