package com.codeheadsystems.pqsession.model.handshake;

import static com.codeheadsystems.pqsession.model.WireFields.decode;
import static com.codeheadsystems.pqsession.model.WireFields.encode;
import static com.codeheadsystems.pqsession.model.WireFields.formatInstant;
import static com.codeheadsystems.pqsession.model.WireFields.parseInstant;
import static com.codeheadsystems.pqsession.model.WireFields.required;

import com.codeheadsystems.pqsession.crypto.AlgorithmSuite;
import com.codeheadsystems.pqsession.crypto.KemAlgorithm;
import com.codeheadsystems.pqsession.crypto.SignatureAlgorithm;
import com.codeheadsystems.pqsession.handshake.ServerHello;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model for the server's hello.
 * <p>
 * Used by: {@code POST /pqc/handshake/hello} response
 *
 * @param handshakeId              identifier echoed back in the key exchange
 * @param kemAlgorithm             negotiated KEM
 * @param signatureAlgorithm       negotiated signature algorithm
 * @param ephemeralPublicKeyBase64 base64-encoded per-handshake KEM public key
 * @param staticKemAlgorithm       algorithm of the server's long-lived KEM key
 * @param staticKemPublicKeyBase64 base64-encoded long-lived KEM public key
 * @param kemKeyVersion            long-lived KEM key version
 * @param signatureKeyVersion      signing key version
 * @param serverNonceBase64        base64-encoded 32-byte server nonce
 * @param expiresAt                ISO-8601 handshake deadline
 */
public record ServerHelloResponse(
    @JsonProperty("handshakeId") String handshakeId,
    @JsonProperty("kemAlgorithm") String kemAlgorithm,
    @JsonProperty("signatureAlgorithm") String signatureAlgorithm,
    @JsonProperty("ephemeralPublicKey") String ephemeralPublicKeyBase64,
    @JsonProperty("staticKemAlgorithm") String staticKemAlgorithm,
    @JsonProperty("staticKemPublicKey") String staticKemPublicKeyBase64,
    @JsonProperty("kemKeyVersion") int kemKeyVersion,
    @JsonProperty("signatureKeyVersion") int signatureKeyVersion,
    @JsonProperty("serverNonce") String serverNonceBase64,
    @JsonProperty("expiresAt") String expiresAt) {

  public ServerHelloResponse(ServerHello hello) {
    this(hello.handshakeId(),
        hello.suite().kem().id(),
        hello.suite().signature().id(),
        encode(hello.ephemeralPublicKey()),
        hello.staticKemAlgorithm().id(),
        encode(hello.staticKemPublicKey()),
        hello.kemKeyVersion(),
        hello.signatureKeyVersion(),
        encode(hello.serverNonce()),
        formatInstant(hello.expiresAt()));
  }

  private static KemAlgorithm kem(String name, String field) {
    return KemAlgorithm.fromName(required(name, field))
        .orElseThrow(() -> new IllegalArgumentException("Unknown KEM algorithm in field: " + field));
  }

  public ServerHello serverHello() {
    SignatureAlgorithm signature = SignatureAlgorithm.fromName(required(signatureAlgorithm, "signatureAlgorithm"))
        .orElseThrow(() -> new IllegalArgumentException("Unknown signature algorithm in field: signatureAlgorithm"));
    return new ServerHello(
        required(handshakeId, "handshakeId"),
        new AlgorithmSuite(kem(kemAlgorithm, "kemAlgorithm"), signature),
        decode(ephemeralPublicKeyBase64, "ephemeralPublicKey"),
        kem(staticKemAlgorithm, "staticKemAlgorithm"),
        decode(staticKemPublicKeyBase64, "staticKemPublicKey"),
        kemKeyVersion,
        signatureKeyVersion,
        decode(serverNonceBase64, "serverNonce"),
        parseInstant(expiresAt, "expiresAt"));
  }
}
