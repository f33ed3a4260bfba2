package com.codeheadsystems.pqsession.model.handshake;

import static com.codeheadsystems.pqsession.model.WireFields.decode;
import static com.codeheadsystems.pqsession.model.WireFields.decodeOptional;
import static com.codeheadsystems.pqsession.model.WireFields.encode;
import static com.codeheadsystems.pqsession.model.WireFields.required;

import com.codeheadsystems.pqsession.handshake.ClientKeyExchange;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model for the client's key exchange.
 * <p>
 * Used by: {@code POST /pqc/handshake/key-exchange} request
 *
 * @param handshakeId               handshake id from the server hello
 * @param ephemeralCiphertextBase64 base64-encoded encapsulation to the ephemeral key
 * @param staticCiphertextBase64    base64-encoded encapsulation to the long-lived key
 * @param clientVerifyDataBase64    base64-encoded client verify data; may be absent
 */
public record ClientKeyExchangeRequest(
    @JsonProperty("handshakeId") String handshakeId,
    @JsonProperty("ephemeralCiphertext") String ephemeralCiphertextBase64,
    @JsonProperty("staticCiphertext") String staticCiphertextBase64,
    @JsonProperty("clientVerifyData") String clientVerifyDataBase64) {

  public ClientKeyExchangeRequest(ClientKeyExchange exchange) {
    this(exchange.handshakeId(),
        encode(exchange.ephemeralCiphertext()),
        encode(exchange.staticCiphertext()),
        encode(exchange.clientVerifyData()));
  }

  public ClientKeyExchange clientKeyExchange() {
    return new ClientKeyExchange(
        required(handshakeId, "handshakeId"),
        decode(ephemeralCiphertextBase64, "ephemeralCiphertext"),
        decode(staticCiphertextBase64, "staticCiphertext"),
        decodeOptional(clientVerifyDataBase64, "clientVerifyData"));
  }
}
