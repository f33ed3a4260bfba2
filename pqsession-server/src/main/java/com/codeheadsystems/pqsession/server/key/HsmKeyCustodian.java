package com.codeheadsystems.pqsession.server.key;

import com.codeheadsystems.pqsession.crypto.KeyMaterial;
import java.nio.charset.StandardCharsets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Delegates private-key custody to an {@link HsmClient}. The private material tracked by the
 * manager is the UTF-8 handle id.
 */
public class HsmKeyCustodian implements KeyCustodian {

  private static final Logger log = LoggerFactory.getLogger(HsmKeyCustodian.class);

  private final HsmClient hsmClient;

  public HsmKeyCustodian(HsmClient hsmClient) {
    this.hsmClient = hsmClient;
  }

  private static String handle(byte[] privateMaterial) {
    return new String(privateMaterial, StandardCharsets.UTF_8);
  }

  @Override
  public String name() {
    return "hsm";
  }

  @Override
  public KeyMaterial generate(KeyType type, String algorithm) {
    HsmClient.KeyHandle created = hsmClient.generateKeyPair(type, algorithm);
    log.debug("HSM generated {} key {}", type, created.handleId());
    return new KeyMaterial(created.publicKey(), created.handleId().getBytes(StandardCharsets.UTF_8));
  }

  @Override
  public byte[] decapsulate(String algorithm, byte[] privateMaterial, byte[] ciphertext) {
    return hsmClient.decapsulate(handle(privateMaterial), ciphertext);
  }

  @Override
  public byte[] sign(String algorithm, byte[] privateMaterial, byte[] message) {
    return hsmClient.sign(handle(privateMaterial), message);
  }

  @Override
  public byte[] exportForBackup(KeyType type, String algorithm, byte[] privateMaterial) {
    return hsmClient.wrapKey(handle(privateMaterial));
  }

  @Override
  public byte[] importFromBackup(KeyType type, String algorithm, byte[] exported) {
    return hsmClient.unwrapKey(type, algorithm, exported).getBytes(StandardCharsets.UTF_8);
  }

  @Override
  public void release(byte[] privateMaterial) {
    String handleId = handle(privateMaterial);
    hsmClient.destroyKey(handleId);
    log.debug("HSM destroyed key {}", handleId);
  }
}
