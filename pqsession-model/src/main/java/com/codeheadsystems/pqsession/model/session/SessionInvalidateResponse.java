package com.codeheadsystems.pqsession.model.session;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Used by: {@code DELETE /pqc/session/{sessionId}} response
 *
 * @param sessionId the session id
 * @param status    always {@code invalidated}
 */
public record SessionInvalidateResponse(
    @JsonProperty("sessionId") String sessionId,
    @JsonProperty("status") String status) {

  public static SessionInvalidateResponse invalidated(String sessionId) {
    return new SessionInvalidateResponse(sessionId, "invalidated");
  }
}
