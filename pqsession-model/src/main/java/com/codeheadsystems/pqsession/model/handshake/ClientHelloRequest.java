package com.codeheadsystems.pqsession.model.handshake;

import static com.codeheadsystems.pqsession.model.WireFields.decode;
import static com.codeheadsystems.pqsession.model.WireFields.encode;

import com.codeheadsystems.pqsession.handshake.ClientHello;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Wire model for the client's opening handshake message.
 * <p>
 * Used by: {@code POST /pqc/handshake/hello} request
 *
 * @param kemAlgorithms       offered KEM names, e.g. {@code ML-KEM-768}
 * @param signatureAlgorithms offered signature names, e.g. {@code ML-DSA-65}
 * @param clientNonceBase64   base64-encoded 32-byte client nonce
 * @param clientAddress       optional client address recorded on the session
 */
public record ClientHelloRequest(
    @JsonProperty("kemAlgorithms") List<String> kemAlgorithms,
    @JsonProperty("signatureAlgorithms") List<String> signatureAlgorithms,
    @JsonProperty("clientNonce") String clientNonceBase64,
    @JsonProperty("clientAddress") String clientAddress) {

  public ClientHelloRequest(ClientHello hello) {
    this(hello.offeredKems(), hello.offeredSignatures(), encode(hello.clientNonce()), hello.clientAddress());
  }

  public ClientHello clientHello() {
    return new ClientHello(kemAlgorithms, signatureAlgorithms,
        decode(clientNonceBase64, "clientNonce"), clientAddress);
  }
}
