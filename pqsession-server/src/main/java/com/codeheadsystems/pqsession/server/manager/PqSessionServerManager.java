package com.codeheadsystems.pqsession.server.manager;

import static com.codeheadsystems.pqsession.model.WireFields.encode;
import static com.codeheadsystems.pqsession.model.WireFields.formatInstant;

import com.codeheadsystems.pqsession.common.ErrorKind;
import com.codeheadsystems.pqsession.common.Outcome;
import com.codeheadsystems.pqsession.model.HealthResponse;
import com.codeheadsystems.pqsession.model.handshake.ClientHelloRequest;
import com.codeheadsystems.pqsession.model.handshake.ClientKeyExchangeRequest;
import com.codeheadsystems.pqsession.model.handshake.ServerFinishedResponse;
import com.codeheadsystems.pqsession.model.handshake.ServerHelloResponse;
import com.codeheadsystems.pqsession.model.keys.PublicKeyEntry;
import com.codeheadsystems.pqsession.model.keys.PublicKeysResponse;
import com.codeheadsystems.pqsession.model.session.SessionInvalidateResponse;
import com.codeheadsystems.pqsession.model.session.SessionVerifyResponse;
import com.codeheadsystems.pqsession.server.handshake.HandshakeCoordinator;
import com.codeheadsystems.pqsession.server.handshake.HandshakeStats;
import com.codeheadsystems.pqsession.server.key.KeyManager;
import com.codeheadsystems.pqsession.server.key.KeyRotationScheduler;
import com.codeheadsystems.pqsession.server.key.PublicKeyInfo;
import com.codeheadsystems.pqsession.server.key.PublicKeySet;
import com.codeheadsystems.pqsession.server.store.SessionBackendSelection;
import com.codeheadsystems.pqsession.server.store.SessionRecord;
import com.codeheadsystems.pqsession.server.store.SessionStore;
import com.codeheadsystems.pqsession.server.store.SessionVerification;
import com.codeheadsystems.pqsession.server.store.StorageBackendUnavailableException;
import com.codeheadsystems.pqsession.server.store.VerificationReason;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Framework-agnostic service behind the pqsession HTTP surface.
 * <p>
 * Translates wire DTOs to protocol messages, delegates to the {@link HandshakeCoordinator},
 * {@link KeyManager} and {@link SessionStore}, and owns their lifecycle so that framework adapters
 * (the JAX-RS {@code PqSessionResource}, the Dropwizard bundle) stay thin.
 * <p>
 * <strong>Error contract:</strong> protocol failures come back as failed {@link Outcome}s whose
 * {@link ErrorKind#httpStatus()} is the suggested response status. Malformed DTOs throw
 * {@link IllegalArgumentException} (HTTP 400).
 */
public class PqSessionServerManager {

  private static final Logger log = LoggerFactory.getLogger(PqSessionServerManager.class);

  public static final String STATUS_OK = "ok";
  public static final String STATUS_DEGRADED = "degraded";
  public static final String STATUS_UNAVAILABLE = "unavailable";

  private final KeyManager keyManager;
  private final HandshakeCoordinator coordinator;
  private final SessionBackendSelection sessionBackend;
  private final KeyRotationScheduler rotationScheduler;

  /**
   * @param keyManager        long-term keys
   * @param coordinator       handshake state machine
   * @param sessionBackend    the selected session store and whether it is degraded
   * @param rotationScheduler scheduled rotation, or null to rotate only on demand
   */
  public PqSessionServerManager(KeyManager keyManager,
                                HandshakeCoordinator coordinator,
                                SessionBackendSelection sessionBackend,
                                KeyRotationScheduler rotationScheduler) {
    this.keyManager = keyManager;
    this.coordinator = coordinator;
    this.sessionBackend = sessionBackend;
    this.rotationScheduler = rotationScheduler;
  }

  // ── Lifecycle ────────────────────────────────────────────────────────────

  /**
   * Generates initial keys where none exist and starts the background tasks.
   */
  public void start() {
    keyManager.ensureKeys();
    coordinator.start();
    if (rotationScheduler != null) {
      rotationScheduler.start();
    }
    log.info("pqsession started: custody={} sessionStore={}", keyManager.custody(), sessionBackend.detail());
  }

  /**
   * Stops background tasks, drops pending handshakes and closes the session store.
   */
  public void shutdown() {
    if (rotationScheduler != null) {
      rotationScheduler.shutdown();
    }
    coordinator.shutdown();
    sessionBackend.store().close();
    log.info("pqsession stopped");
  }

  // ── Keys ─────────────────────────────────────────────────────────────────

  public PublicKeysResponse publicKeys() {
    PublicKeySet keys = keyManager.exportPublicKeys();
    return new PublicKeysResponse(
        entry(keys.kem()),
        entry(keys.signature()),
        keys.retiring().stream().map(PqSessionServerManager::entry).toList(),
        coordinator.supportedKemNames());
  }

  private static PublicKeyEntry entry(PublicKeyInfo info) {
    if (info == null) {
      return null;
    }
    return new PublicKeyEntry(info.type().name(), info.algorithm(), info.keyId(), info.version(),
        encode(info.publicKey()), formatInstant(info.createdAt()), formatInstant(info.validUntil()));
  }

  // ── Handshake ────────────────────────────────────────────────────────────

  /**
   * @throws IllegalArgumentException if the request is malformed
   */
  public Outcome<ServerHelloResponse> clientHello(ClientHelloRequest request) {
    log.debug("clientHello(kems={})", request.kemAlgorithms());
    return coordinator.clientHello(request.clientHello()).map(ServerHelloResponse::new);
  }

  /**
   * @throws IllegalArgumentException if the request is malformed
   */
  public Outcome<ServerFinishedResponse> clientKeyExchange(ClientKeyExchangeRequest request) {
    log.debug("clientKeyExchange(handshakeId={})", request.handshakeId());
    return coordinator.clientKeyExchange(request.clientKeyExchange()).map(ServerFinishedResponse::new);
  }

  // ── Sessions ─────────────────────────────────────────────────────────────

  /**
   * Reports whether a session is usable. Expired and invalidated sessions are a successful answer
   * with {@code valid=false}; an unknown id is a {@code SESSION_NOT_FOUND} failure.
   */
  public Outcome<SessionVerifyResponse> verifySession(String sessionId) {
    if (sessionId == null || sessionId.isBlank()) {
      throw new IllegalArgumentException("Missing required field: sessionId");
    }
    SessionVerification verification;
    try {
      verification = sessionBackend.store().verify(sessionId);
    } catch (StorageBackendUnavailableException e) {
      return Outcome.failure(ErrorKind.STORAGE_BACKEND_UNAVAILABLE, "Session storage is unavailable");
    }
    if (verification.reason() == VerificationReason.NOT_FOUND) {
      return Outcome.failure(ErrorKind.SESSION_NOT_FOUND, "Session not found");
    }
    if (!verification.valid()) {
      return Outcome.success(SessionVerifyResponse.invalid(sessionId, verification.reason().name()));
    }
    SessionRecord record = verification.record().orElseThrow();
    return Outcome.success(new SessionVerifyResponse(sessionId, true, VerificationReason.VALID.name(),
        record.cipherSuite(), formatInstant(record.createdAt()), formatInstant(record.expiresAt()),
        record.clientAddress()));
  }

  /**
   * Invalidates a session immediately.
   */
  public Outcome<SessionInvalidateResponse> invalidateSession(String sessionId) {
    if (sessionId == null || sessionId.isBlank()) {
      throw new IllegalArgumentException("Missing required field: sessionId");
    }
    try {
      if (!sessionBackend.store().invalidate(sessionId)) {
        return Outcome.failure(ErrorKind.SESSION_NOT_FOUND, "Session not found");
      }
    } catch (StorageBackendUnavailableException e) {
      return Outcome.failure(ErrorKind.STORAGE_BACKEND_UNAVAILABLE, "Session storage is unavailable");
    }
    log.debug("Session {} invalidated", sessionId);
    return Outcome.success(SessionInvalidateResponse.invalidated(sessionId));
  }

  // ── Health ───────────────────────────────────────────────────────────────

  public HealthResponse health() {
    Map<String, String> subsystems = new LinkedHashMap<>();
    PublicKeySet keys = keyManager.exportPublicKeys();
    boolean keysReady = keys.kem() != null && keys.signature() != null;
    subsystems.put("keys", keysReady
        ? keys.kem().algorithm() + " v" + keys.kem().version() + ", "
        + keys.signature().algorithm() + " v" + keys.signature().version() + " (" + keyManager.custody() + ")"
        : "missing");

    boolean storeUp = false;
    String storeDetail = sessionBackend.detail() + " unreachable";
    if (sessionBackend.store().isAvailable()) {
      try {
        storeDetail = sessionBackend.detail() + ", sessions=" + sessionBackend.store().size();
        storeUp = true;
      } catch (StorageBackendUnavailableException e) {
        log.warn("Session store failed during health check: {}", e.getMessage());
      }
    }
    subsystems.put("sessionStore", storeDetail);

    HandshakeStats handshakes = coordinator.stats();
    subsystems.put("handshakes", "pending=" + handshakes.pending() + ", completed=" + handshakes.completed()
        + ", failed=" + handshakes.failed() + ", timedOut=" + handshakes.timedOut());

    String status;
    if (!keysReady || !storeUp) {
      status = STATUS_UNAVAILABLE;
    } else if (sessionBackend.degraded()) {
      status = STATUS_DEGRADED;
    } else {
      status = STATUS_OK;
    }
    return new HealthResponse(status, subsystems);
  }

  public KeyManager keyManager() {
    return keyManager;
  }

  public HandshakeCoordinator coordinator() {
    return coordinator;
  }

  public SessionBackendSelection sessionBackend() {
    return sessionBackend;
  }
}
