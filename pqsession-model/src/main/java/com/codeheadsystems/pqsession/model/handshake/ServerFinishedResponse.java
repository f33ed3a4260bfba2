package com.codeheadsystems.pqsession.model.handshake;

import static com.codeheadsystems.pqsession.model.WireFields.decode;
import static com.codeheadsystems.pqsession.model.WireFields.encode;
import static com.codeheadsystems.pqsession.model.WireFields.formatInstant;
import static com.codeheadsystems.pqsession.model.WireFields.parseInstant;
import static com.codeheadsystems.pqsession.model.WireFields.required;

import com.codeheadsystems.pqsession.handshake.ServerFinished;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model for the server's final handshake message.
 * <p>
 * Used by: {@code POST /pqc/handshake/key-exchange} response
 *
 * @param status              always {@code established}
 * @param sessionId           the new session id
 * @param signatureBase64     base64-encoded ML-DSA signature over the transcript hash
 * @param verifyDataBase64    base64-encoded server verify data
 * @param signatureKeyVersion version of the signing key used
 * @param expiresAt           ISO-8601 session expiry
 */
public record ServerFinishedResponse(
    @JsonProperty("status") String status,
    @JsonProperty("sessionId") String sessionId,
    @JsonProperty("signature") String signatureBase64,
    @JsonProperty("verifyData") String verifyDataBase64,
    @JsonProperty("signatureKeyVersion") int signatureKeyVersion,
    @JsonProperty("expiresAt") String expiresAt) {

  public static final String ESTABLISHED = "established";

  public ServerFinishedResponse(ServerFinished finished) {
    this(ESTABLISHED,
        finished.sessionId(),
        encode(finished.signature()),
        encode(finished.verifyData()),
        finished.signatureKeyVersion(),
        formatInstant(finished.expiresAt()));
  }

  public ServerFinished serverFinished() {
    return new ServerFinished(
        required(sessionId, "sessionId"),
        decode(signatureBase64, "signature"),
        decode(verifyDataBase64, "verifyData"),
        signatureKeyVersion,
        parseInstant(expiresAt, "expiresAt"));
  }
}
