package com.codeheadsystems.pqsession.model.session;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Used by: {@code POST /pqc/session/verify} request
 *
 * @param sessionId the session to check
 */
public record SessionVerifyRequest(@JsonProperty("sessionId") String sessionId) {
}
