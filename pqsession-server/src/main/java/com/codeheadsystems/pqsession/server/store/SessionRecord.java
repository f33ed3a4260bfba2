package com.codeheadsystems.pqsession.server.store;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.Objects;

/**
 * A completed session as persisted by a {@link SessionStore}.
 *
 * @param sessionId      unique session id
 * @param clientWriteKey client-to-server key
 * @param serverWriteKey server-to-client key
 * @param clientWriteIv  client IV
 * @param serverWriteIv  server IV
 * @param verifyData     server verify data (transcript MAC)
 * @param cipherSuite    negotiated suite, e.g. {@code ML-KEM-768+ML-DSA-65}
 * @param handshakeHash  transcript hash through ClientKeyExchange
 * @param createdAt      creation time
 * @param expiresAt      expiry, always after {@code createdAt}
 * @param clientAddress  peer address reported by the client, may be null
 * @param serverAddress  configured server address, may be null
 * @param state          lifecycle tag
 */
public record SessionRecord(
    @JsonProperty("sessionId") String sessionId,
    @JsonProperty("clientWriteKey") byte[] clientWriteKey,
    @JsonProperty("serverWriteKey") byte[] serverWriteKey,
    @JsonProperty("clientWriteIv") byte[] clientWriteIv,
    @JsonProperty("serverWriteIv") byte[] serverWriteIv,
    @JsonProperty("verifyData") byte[] verifyData,
    @JsonProperty("cipherSuite") String cipherSuite,
    @JsonProperty("handshakeHash") byte[] handshakeHash,
    @JsonProperty("createdAt") Instant createdAt,
    @JsonProperty("expiresAt") Instant expiresAt,
    @JsonProperty("clientAddress") String clientAddress,
    @JsonProperty("serverAddress") String serverAddress,
    @JsonProperty("state") SessionState state) {

  public SessionRecord {
    Objects.requireNonNull(sessionId, "sessionId");
    Objects.requireNonNull(createdAt, "createdAt");
    Objects.requireNonNull(expiresAt, "expiresAt");
    if (!expiresAt.isAfter(createdAt)) {
      throw new IllegalArgumentException("expiresAt must be after createdAt");
    }
    state = state == null ? SessionState.ACTIVE : state;
  }

  public SessionRecord withState(SessionState newState) {
    return new SessionRecord(sessionId, clientWriteKey, serverWriteKey, clientWriteIv, serverWriteIv,
        verifyData, cipherSuite, handshakeHash, createdAt, expiresAt, clientAddress, serverAddress, newState);
  }

  /**
   * True once {@code now} is past the expiry instant.
   *
   * @param now the current time
   * @return whether the session has expired
   */
  public boolean expiredAt(Instant now) {
    return now.isAfter(expiresAt);
  }

  /**
   * The state as observed at {@code now}: an ACTIVE record past its expiry reads as EXPIRED.
   *
   * @param now the current time
   * @return the effective state
   */
  public SessionState effectiveState(Instant now) {
    if (state == SessionState.ACTIVE && expiredAt(now)) {
      return SessionState.EXPIRED;
    }
    return state;
  }

  @Override
  public String toString() {
    return "SessionRecord[sessionId=" + sessionId
        + ", cipherSuite=" + cipherSuite
        + ", createdAt=" + createdAt
        + ", expiresAt=" + expiresAt
        + ", clientAddress=" + clientAddress
        + ", state=" + state
        + ", keys=<redacted>]";
  }
}
