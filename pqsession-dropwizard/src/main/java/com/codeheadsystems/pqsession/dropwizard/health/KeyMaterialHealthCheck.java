package com.codeheadsystems.pqsession.dropwizard.health;

import com.codahale.metrics.health.HealthCheck;
import com.codeheadsystems.pqsession.server.key.KeyManager;
import com.codeheadsystems.pqsession.server.key.PublicKeyInfo;
import com.codeheadsystems.pqsession.server.key.PublicKeySet;

/**
 * Health check that verifies a current KEM key and a current signing key exist.
 */
public class KeyMaterialHealthCheck extends HealthCheck {

  private final KeyManager keyManager;

  public KeyMaterialHealthCheck(KeyManager keyManager) {
    this.keyManager = keyManager;
  }

  @Override
  protected Result check() {
    PublicKeySet keys = keyManager.exportPublicKeys();
    if (keys.kem() == null) {
      return Result.unhealthy("No current KEM key");
    }
    if (keys.signature() == null) {
      return Result.unhealthy("No current signature key");
    }
    return Result.builder()
        .healthy()
        .withMessage("kem=%s signature=%s", describe(keys.kem()), describe(keys.signature()))
        .withDetail("custody", keyManager.custody())
        .withDetail("retiring", keys.retiring().size())
        .build();
  }

  private static String describe(PublicKeyInfo key) {
    return key.algorithm() + " v" + key.version();
  }
}
