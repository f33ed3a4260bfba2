package com.codeheadsystems.pqsession.server.key;

import com.codeheadsystems.pqsession.common.ByteUtils;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.List;

/**
 * Plaintext content of an encrypted key backup.
 *
 * @param createdAt            when the backup was taken
 * @param custody              custodian name that exported the keys
 * @param kemLastVersion       highest KEM version issued so far
 * @param signatureLastVersion highest signature version issued so far
 * @param keys                 current and in-grace keys of both types
 */
record BackupPayload(
    @JsonProperty("createdAt") Instant createdAt,
    @JsonProperty("custody") String custody,
    @JsonProperty("kemLastVersion") int kemLastVersion,
    @JsonProperty("signatureLastVersion") int signatureLastVersion,
    @JsonProperty("keys") List<Entry> keys) {

  /**
   * One backed-up key.
   *
   * @param type            key type
   * @param keyId           key id
   * @param algorithm       algorithm id
   * @param version         version
   * @param createdAt       creation time
   * @param current         true for the current key of its type
   * @param retiredAt       retirement time for a previous key
   * @param publicKey       encoded public key
   * @param privateMaterial custodian export of the private key
   */
  record Entry(
      @JsonProperty("type") KeyType type,
      @JsonProperty("keyId") String keyId,
      @JsonProperty("algorithm") String algorithm,
      @JsonProperty("version") int version,
      @JsonProperty("createdAt") Instant createdAt,
      @JsonProperty("current") boolean current,
      @JsonProperty("retiredAt") Instant retiredAt,
      @JsonProperty("publicKey") byte[] publicKey,
      @JsonProperty("privateMaterial") byte[] privateMaterial) {

    @Override
    public String toString() {
      return "Entry[type=" + type + ", keyId=" + keyId + ", version=" + version + ", privateMaterial=<redacted>]";
    }
  }

  void destroy() {
    for (Entry entry : keys) {
      ByteUtils.zeroize(entry.privateMaterial());
    }
  }
}
