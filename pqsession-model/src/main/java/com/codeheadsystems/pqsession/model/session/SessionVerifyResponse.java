package com.codeheadsystems.pqsession.model.session;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Result of a session verification. Metadata fields are omitted when the session is not valid.
 * <p>
 * Used by: {@code POST /pqc/session/verify} response
 *
 * @param sessionId     the session id
 * @param valid         whether the session is usable
 * @param reason        {@code VALID}, {@code EXPIRED}, {@code INVALIDATED} or {@code NOT_FOUND}
 * @param cipherSuite   negotiated suite, e.g. {@code ML-KEM-768+ML-DSA-65}
 * @param createdAt     ISO-8601 creation time
 * @param expiresAt     ISO-8601 expiry
 * @param clientAddress client address recorded at handshake time
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SessionVerifyResponse(
    @JsonProperty("sessionId") String sessionId,
    @JsonProperty("valid") boolean valid,
    @JsonProperty("reason") String reason,
    @JsonProperty("cipherSuite") String cipherSuite,
    @JsonProperty("createdAt") String createdAt,
    @JsonProperty("expiresAt") String expiresAt,
    @JsonProperty("clientAddress") String clientAddress) {

  public static SessionVerifyResponse invalid(String sessionId, String reason) {
    return new SessionVerifyResponse(sessionId, false, reason, null, null, null, null);
  }
}
