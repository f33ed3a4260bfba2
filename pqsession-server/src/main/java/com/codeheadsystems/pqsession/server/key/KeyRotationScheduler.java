package com.codeheadsystems.pqsession.server.key;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rotates both key types on a fixed cadence and discards retired keys once their grace period
 * has passed.
 */
public class KeyRotationScheduler {

  private static final Logger log = LoggerFactory.getLogger(KeyRotationScheduler.class);

  static final String OPERATOR = "scheduler";
  private static final Duration MIN_PURGE_INTERVAL = Duration.ofSeconds(1);

  private final KeyManager keyManager;
  private final Duration rotationInterval;
  private final Duration purgeInterval;
  private ScheduledExecutorService executor;

  /**
   * @param keyManager       keys to rotate
   * @param rotationInterval rotation cadence
   * @param gracePeriod      grace period of the key manager, used to pace purging
   */
  public KeyRotationScheduler(KeyManager keyManager, Duration rotationInterval, Duration gracePeriod) {
    if (rotationInterval.isZero() || rotationInterval.isNegative()) {
      throw new IllegalArgumentException("Rotation interval must be positive");
    }
    this.keyManager = keyManager;
    this.rotationInterval = rotationInterval;
    Duration half = gracePeriod.dividedBy(2);
    this.purgeInterval = half.compareTo(MIN_PURGE_INTERVAL) < 0 ? MIN_PURGE_INTERVAL : half;
  }

  public synchronized void start() {
    if (executor != null) {
      return;
    }
    executor = Executors.newSingleThreadScheduledExecutor(r -> {
      Thread t = new Thread(r, "pqsession-key-rotation");
      t.setDaemon(true);
      return t;
    });
    long rotateMillis = rotationInterval.toMillis();
    long purgeMillis = purgeInterval.toMillis();
    executor.scheduleAtFixedRate(this::rotateNow, rotateMillis, rotateMillis, TimeUnit.MILLISECONDS);
    executor.scheduleAtFixedRate(this::purgeNow, purgeMillis, purgeMillis, TimeUnit.MILLISECONDS);
    log.info("Key rotation every {}, purge every {}", rotationInterval, purgeInterval);
  }

  public synchronized void shutdown() {
    if (executor != null) {
      executor.shutdownNow();
      executor = null;
    }
  }

  Duration purgeInterval() {
    return purgeInterval;
  }

  /**
   * Rotates both key types. A failure on one type does not prevent rotating the other.
   */
  void rotateNow() {
    try {
      keyManager.rotateKemKey(OPERATOR, "scheduled rotation");
    } catch (RuntimeException e) {
      log.error("Scheduled KEM key rotation failed", e);
    }
    try {
      keyManager.rotateSignatureKey(OPERATOR, "scheduled rotation");
    } catch (RuntimeException e) {
      log.error("Scheduled signature key rotation failed", e);
    }
  }

  void purgeNow() {
    try {
      keyManager.purgeRetiredKeys();
    } catch (RuntimeException e) {
      log.error("Retired key purge failed", e);
    }
  }
}
