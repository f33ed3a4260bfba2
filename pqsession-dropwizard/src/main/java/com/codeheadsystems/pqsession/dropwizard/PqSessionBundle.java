package com.codeheadsystems.pqsession.dropwizard;

import com.codeheadsystems.pqsession.common.RandomProvider;
import com.codeheadsystems.pqsession.crypto.BouncyCastleKemProvider;
import com.codeheadsystems.pqsession.crypto.BouncyCastleSignatureProvider;
import com.codeheadsystems.pqsession.crypto.HkdfSha256KeyDerivation;
import com.codeheadsystems.pqsession.crypto.KemAlgorithm;
import com.codeheadsystems.pqsession.crypto.KemProvider;
import com.codeheadsystems.pqsession.crypto.KeyDerivation;
import com.codeheadsystems.pqsession.crypto.SignatureAlgorithm;
import com.codeheadsystems.pqsession.dropwizard.health.KeyMaterialHealthCheck;
import com.codeheadsystems.pqsession.dropwizard.health.SessionStoreHealthCheck;
import com.codeheadsystems.pqsession.server.handshake.HandshakeConfig;
import com.codeheadsystems.pqsession.server.handshake.HandshakeCoordinator;
import com.codeheadsystems.pqsession.server.key.DefaultKeyManager;
import com.codeheadsystems.pqsession.server.key.KeyBackupCodec;
import com.codeheadsystems.pqsession.server.key.KeyCustodian;
import com.codeheadsystems.pqsession.server.key.KeyManager;
import com.codeheadsystems.pqsession.server.key.KeyManagerConfig;
import com.codeheadsystems.pqsession.server.key.KeyRotationScheduler;
import com.codeheadsystems.pqsession.server.key.SoftwareKeyCustodian;
import com.codeheadsystems.pqsession.server.manager.PqSessionServerManager;
import com.codeheadsystems.pqsession.server.resource.PqSessionResource;
import com.codeheadsystems.pqsession.server.store.RedisSessionStore;
import com.codeheadsystems.pqsession.server.store.SessionBackendSelection;
import com.codeheadsystems.pqsession.server.store.SessionStoreConfig;
import com.codeheadsystems.pqsession.server.store.SessionStoreFactory;
import io.dropwizard.core.ConfiguredBundle;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dropwizard bundle that wires the pqsession server into an existing Dropwizard application.
 * <p>
 * Registers the {@code /pqc} JAX-RS resource, the key-material and session-store health checks,
 * and a managed lifecycle that generates missing keys on start and stops the background tasks on
 * shutdown. Requires a {@link PqSessionConfiguration} in the application's YAML config.
 * <p>
 * With software key custody:
 * <pre>{@code
 *   bootstrap.addBundle(new PqSessionBundle<>());
 * }</pre>
 * <p>
 * With keys held by an HSM:
 * <pre>{@code
 *   bootstrap.addBundle(new PqSessionBundle<>(new HsmKeyCustodian(myHsmClient)));
 * }</pre>
 */
@Singleton
public class PqSessionBundle<C extends PqSessionConfiguration> implements ConfiguredBundle<C> {

  private static final Logger log = LoggerFactory.getLogger(PqSessionBundle.class);

  private final KeyCustodian custodian;
  private final Clock clock;

  private PqSessionServerManager manager;

  /**
   * Creates a bundle that keeps private keys in process memory.
   */
  public PqSessionBundle() {
    this.custodian = null;
    this.clock = Clock.systemUTC();
  }

  /**
   * Creates a bundle that delegates private-key operations to the given custodian.
   */
  @Inject
  public PqSessionBundle(KeyCustodian custodian) {
    this.custodian = custodian;
    this.clock = Clock.systemUTC();
  }

  @Override
  public void initialize(Bootstrap<?> bootstrap) {
    // No additional bootstrapping needed
  }

  @Override
  public void run(C configuration, Environment environment) {
    RandomProvider random = new RandomProvider();
    KemProvider kemProvider = new BouncyCastleKemProvider(random);
    KeyDerivation kdf = new HkdfSha256KeyDerivation();

    KeyCustodian keyCustodian = custodian;
    if (keyCustodian == null) {
      log.warn("Using software key custody; private keys are held in process memory.");
      keyCustodian = new SoftwareKeyCustodian(kemProvider, new BouncyCastleSignatureProvider(random));
    }
    KeyManagerConfig keyConfig = buildKeyManagerConfig(configuration);
    KeyBackupCodec backupCodec = new KeyBackupCodec(kdf, random, keyConfig.backupArgon2MemoryKib(),
        keyConfig.backupArgon2Iterations(), keyConfig.backupArgon2Parallelism());
    KeyManager keyManager = new DefaultKeyManager(keyCustodian, keyConfig, backupCodec, random, clock);

    SessionBackendSelection sessionBackend = new SessionStoreFactory(clock).open(buildSessionStoreConfig(configuration));
    HandshakeCoordinator coordinator = new HandshakeCoordinator(keyManager, kemProvider, kdf,
        sessionBackend.store(), buildHandshakeConfig(configuration), random, clock);

    KeyRotationScheduler scheduler = null;
    if (configuration.getKeyRotationIntervalDays() > 0) {
      scheduler = new KeyRotationScheduler(keyManager, keyConfig.rotationInterval(), keyConfig.gracePeriod());
    } else {
      log.warn("Scheduled key rotation is disabled; rotate keys manually.");
    }

    manager = new PqSessionServerManager(keyManager, coordinator, sessionBackend, scheduler);
    environment.lifecycle().manage(new PqSessionLifecycle(manager));
    environment.jersey().register(new PqSessionResource(manager));
    environment.healthChecks().register("pqsession-keys", new KeyMaterialHealthCheck(keyManager));
    environment.healthChecks().register("pqsession-session-store", new SessionStoreHealthCheck(sessionBackend));
  }

  /**
   * The server manager built by {@link #run}, for applications that expose key administration
   * (rotation, backup, restore) through their own endpoints or tasks.
   *
   * @return the manager, or null before {@code run}
   */
  public PqSessionServerManager manager() {
    return manager;
  }

  private static KeyManagerConfig buildKeyManagerConfig(PqSessionConfiguration configuration) {
    return new KeyManagerConfig(
        kem(configuration.getKemAlgorithm(), "kemAlgorithm"),
        signature(configuration.getSignatureAlgorithm(), "signatureAlgorithm"),
        kems(configuration.getSupportedKemAlgorithms()),
        signatures(configuration.getSupportedSignatureAlgorithms()),
        Duration.ofDays(configuration.getKeyRotationIntervalDays()),
        Duration.ofSeconds(configuration.getKeyRotationGraceSeconds()),
        configuration.getBackupArgon2MemoryKib(),
        configuration.getBackupArgon2Iterations(),
        configuration.getBackupArgon2Parallelism());
  }

  private static HandshakeConfig buildHandshakeConfig(PqSessionConfiguration configuration) {
    if (configuration.getKeyRotationGraceSeconds() < configuration.getHandshakeTimeoutSeconds()) {
      log.warn("keyRotationGraceSeconds ({}) is shorter than handshakeTimeoutSeconds ({}); "
              + "handshakes in flight during a rotation may fail.",
          configuration.getKeyRotationGraceSeconds(), configuration.getHandshakeTimeoutSeconds());
    }
    return new HandshakeConfig(
        Duration.ofSeconds(configuration.getHandshakeTimeoutSeconds()),
        Duration.ofSeconds(configuration.getHandshakeSweepIntervalSeconds()),
        Duration.ofSeconds(configuration.getSessionTtlSeconds()),
        configuration.getMaxPendingHandshakes(),
        kems(configuration.getSupportedKemAlgorithms()),
        signatures(configuration.getSupportedSignatureAlgorithms()),
        configuration.getServerAddress());
  }

  private static SessionStoreConfig buildSessionStoreConfig(PqSessionConfiguration configuration) {
    return new SessionStoreConfig(
        configuration.getStorageBackend(),
        URI.create(configuration.getDurableBackendUri()),
        Duration.ofSeconds(configuration.getSessionSweepIntervalSeconds()),
        RedisSessionStore.DEFAULT_RETENTION,
        configuration.isDegradedReadCacheEnabled());
  }

  private static KemAlgorithm kem(String name, String field) {
    return KemAlgorithm.fromName(name)
        .orElseThrow(() -> new IllegalStateException("Unknown KEM algorithm in " + field + ": " + name));
  }

  private static SignatureAlgorithm signature(String name, String field) {
    return SignatureAlgorithm.fromName(name)
        .orElseThrow(() -> new IllegalStateException("Unknown signature algorithm in " + field + ": " + name));
  }

  private static Set<KemAlgorithm> kems(List<String> names) {
    EnumSet<KemAlgorithm> set = EnumSet.noneOf(KemAlgorithm.class);
    names.forEach(name -> set.add(kem(name, "supportedKemAlgorithms")));
    return set;
  }

  private static Set<SignatureAlgorithm> signatures(List<String> names) {
    EnumSet<SignatureAlgorithm> set = EnumSet.noneOf(SignatureAlgorithm.class);
    names.forEach(name -> set.add(signature(name, "supportedSignatureAlgorithms")));
    return set;
  }
}
