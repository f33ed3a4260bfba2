package com.codeheadsystems.pqsession.server.key;

import com.codeheadsystems.pqsession.crypto.KemAlgorithm;
import com.codeheadsystems.pqsession.crypto.SignatureAlgorithm;
import java.time.Duration;
import java.util.EnumSet;
import java.util.Set;

/**
 * Key management settings.
 *
 * @param defaultKemAlgorithm       algorithm for the initial KEM key
 * @param defaultSignatureAlgorithm algorithm for the initial signing key
 * @param supportedKems             KEM algorithms that may be generated
 * @param supportedSignatures       signature algorithms that may be generated
 * @param rotationInterval          scheduled rotation cadence
 * @param gracePeriod               how long a rotated-out key stays valid
 * @param backupArgon2MemoryKib     Argon2id memory cost for backups
 * @param backupArgon2Iterations    Argon2id iterations for backups
 * @param backupArgon2Parallelism   Argon2id lanes for backups
 */
public record KeyManagerConfig(KemAlgorithm defaultKemAlgorithm,
                               SignatureAlgorithm defaultSignatureAlgorithm,
                               Set<KemAlgorithm> supportedKems,
                               Set<SignatureAlgorithm> supportedSignatures,
                               Duration rotationInterval,
                               Duration gracePeriod,
                               int backupArgon2MemoryKib,
                               int backupArgon2Iterations,
                               int backupArgon2Parallelism) {

  public KeyManagerConfig {
    supportedKems = Set.copyOf(supportedKems);
    supportedSignatures = Set.copyOf(supportedSignatures);
    if (!supportedKems.contains(defaultKemAlgorithm)) {
      throw new IllegalArgumentException("Default KEM " + defaultKemAlgorithm.id() + " is not supported");
    }
    if (!supportedSignatures.contains(defaultSignatureAlgorithm)) {
      throw new IllegalArgumentException(
          "Default signature algorithm " + defaultSignatureAlgorithm.id() + " is not supported");
    }
  }

  /**
   * Production defaults: ML-KEM-768 and ML-DSA-65, 180 day rotation, 30 second grace period and
   * Argon2id at 64 MiB / 3 iterations.
   */
  public static KeyManagerConfig defaults() {
    return new KeyManagerConfig(KemAlgorithm.ML_KEM_768, SignatureAlgorithm.ML_DSA_65,
        EnumSet.allOf(KemAlgorithm.class), EnumSet.allOf(SignatureAlgorithm.class),
        Duration.ofDays(180), Duration.ofSeconds(30), 65536, 3, 1);
  }

  /**
   * Fast settings for tests: small parameter sets and a cheap Argon2id cost.
   */
  public static KeyManagerConfig forTesting() {
    return new KeyManagerConfig(KemAlgorithm.ML_KEM_512, SignatureAlgorithm.ML_DSA_44,
        EnumSet.allOf(KemAlgorithm.class), EnumSet.allOf(SignatureAlgorithm.class),
        Duration.ofDays(180), Duration.ofSeconds(30), 1024, 1, 1);
  }
}
