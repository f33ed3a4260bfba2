package com.codeheadsystems.pqsession.server.key;

import com.codeheadsystems.pqsession.common.ByteUtils;
import com.codeheadsystems.pqsession.common.ErrorKind;
import com.codeheadsystems.pqsession.common.RandomProvider;
import com.codeheadsystems.pqsession.crypto.KemAlgorithm;
import com.codeheadsystems.pqsession.crypto.KeyMaterial;
import com.codeheadsystems.pqsession.crypto.SignatureAlgorithm;
import com.codeheadsystems.pqsession.server.security.SecurityEvents;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link KeyManager} that keeps versions, grace periods and the audit log itself and delegates
 * private-key custody to a {@link KeyCustodian}.
 * <p>
 * Key rings are guarded by a read/write lock: many handshakes read, rotation and restore write.
 * Cryptographic work (generation, decapsulation, signing, Argon2id) always runs outside the lock
 * on a copy of the material looked up under it.
 */
public class DefaultKeyManager implements KeyManager {

  private static final Logger log = LoggerFactory.getLogger(DefaultKeyManager.class);

  private static final int KEY_ID_BYTES = 8;

  private final KeyCustodian custodian;
  private final KeyManagerConfig config;
  private final KeyBackupCodec backupCodec;
  private final RandomProvider randomProvider;
  private final Clock clock;

  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
  private final Map<KeyType, KeyRing> rings = new EnumMap<>(KeyType.class);
  private final List<RotationAuditEntry> auditLog = new ArrayList<>();

  public DefaultKeyManager(KeyCustodian custodian,
                           KeyManagerConfig config,
                           KeyBackupCodec backupCodec,
                           RandomProvider randomProvider,
                           Clock clock) {
    this.custodian = custodian;
    this.config = config;
    this.backupCodec = backupCodec;
    this.randomProvider = randomProvider;
    this.clock = clock;
    for (KeyType type : KeyType.values()) {
      rings.put(type, new KeyRing(type));
    }
  }

  // ── Generation and rotation ──────────────────────────────────────────────

  @Override
  public PublicKeyInfo generateKemKeyPair(String algorithm) {
    KemAlgorithm kem = KemAlgorithm.fromName(algorithm)
        .filter(config.supportedKems()::contains)
        .orElseThrow(() -> new KeyManagerException(ErrorKind.UNSUPPORTED_ALGORITHM,
            "Unsupported KEM algorithm: " + algorithm));
    return createAndInstall(KeyType.KEM, kem.id(), AuditAction.GENERATE, SYSTEM_OPERATOR, "generate");
  }

  @Override
  public PublicKeyInfo generateSignatureKeyPair(String algorithm) {
    SignatureAlgorithm sig = SignatureAlgorithm.fromName(algorithm)
        .filter(config.supportedSignatures()::contains)
        .orElseThrow(() -> new KeyManagerException(ErrorKind.UNSUPPORTED_ALGORITHM,
            "Unsupported signature algorithm: " + algorithm));
    return createAndInstall(KeyType.SIGNATURE, sig.id(), AuditAction.GENERATE, SYSTEM_OPERATOR, "generate");
  }

  @Override
  public PublicKeyInfo rotateKemKey(String operator, String cause) {
    String algorithm = currentAlgorithm(KeyType.KEM).orElse(config.defaultKemAlgorithm().id());
    return createAndInstall(KeyType.KEM, algorithm, AuditAction.ROTATE, operator, cause);
  }

  @Override
  public PublicKeyInfo rotateSignatureKey(String operator, String cause) {
    String algorithm = currentAlgorithm(KeyType.SIGNATURE).orElse(config.defaultSignatureAlgorithm().id());
    return createAndInstall(KeyType.SIGNATURE, algorithm, AuditAction.ROTATE, operator, cause);
  }

  @Override
  public void ensureKeys() {
    if (currentKey(KeyType.KEM).isEmpty()) {
      generateKemKeyPair(config.defaultKemAlgorithm().id());
    }
    if (currentKey(KeyType.SIGNATURE).isEmpty()) {
      generateSignatureKeyPair(config.defaultSignatureAlgorithm().id());
    }
  }

  private PublicKeyInfo createAndInstall(KeyType type, String algorithm, AuditAction action,
                                         String operator, String cause) {
    KeyMaterial material = custodian.generate(type, algorithm);
    String keyId = type.idPrefix() + "-" + randomProvider.randomHex(KEY_ID_BYTES);
    List<ManagedKeyPair> dropped;
    PublicKeyInfo installed;
    lock.writeLock().lock();
    try {
      KeyRing ring = rings.get(type);
      Optional<ManagedKeyPair> old = ring.current();
      Instant now = clock.instant();
      ManagedKeyPair next = new ManagedKeyPair(type, algorithm, keyId, ring.nextVersion(), now,
          material.publicKey(), material.privateKey());
      dropped = ring.install(next, now);
      installed = next.publicInfo(null);
      auditLog.add(new RotationAuditEntry(now, action, type,
          old.map(ManagedKeyPair::version).orElse(null), next.version(),
          old.map(ManagedKeyPair::keyId).orElse(null), keyId, operator, cause));
    } finally {
      lock.writeLock().unlock();
      material.destroy();
    }
    dropped.forEach(this::discard);
    log.info("{} {} key {} version {} ({})", action, type, keyId, installed.version(), algorithm);
    return installed;
  }

  // ── Private-key operations ───────────────────────────────────────────────

  @Override
  public byte[] decapsulate(int version, byte[] ciphertext) {
    ManagedKeyPair key = find(KeyType.KEM, version);
    byte[] material = key.privateMaterial();
    try {
      return custodian.decapsulate(key.algorithm(), material, ciphertext);
    } finally {
      ByteUtils.zeroize(material);
    }
  }

  @Override
  public byte[] sign(int version, byte[] message) {
    ManagedKeyPair key = find(KeyType.SIGNATURE, version);
    byte[] material = key.privateMaterial();
    try {
      return custodian.sign(key.algorithm(), material, message);
    } finally {
      ByteUtils.zeroize(material);
    }
  }

  private ManagedKeyPair find(KeyType type, int version) {
    lock.readLock().lock();
    try {
      return rings.get(type).find(version, clock.instant(), config.gracePeriod())
          .orElseThrow(() -> new KeyManagerException(ErrorKind.KEY_NOT_AVAILABLE,
              type + " key version " + version + " is not available"));
    } finally {
      lock.readLock().unlock();
    }
  }

  // ── Backup and restore ───────────────────────────────────────────────────

  @Override
  public byte[] backupKeys(char[] passphrase) {
    List<ManagedKeyPair> keys = new ArrayList<>();
    Map<ManagedKeyPair, Instant> retiredAt = new HashMap<>();
    Map<ManagedKeyPair, Boolean> current = new HashMap<>();
    int kemLastVersion;
    int sigLastVersion;
    lock.readLock().lock();
    try {
      Instant now = clock.instant();
      for (KeyRing ring : rings.values()) {
        ring.current().ifPresent(k -> {
          keys.add(k);
          current.put(k, true);
        });
        ring.retiring(now, config.gracePeriod()).ifPresent(k -> {
          keys.add(k);
          current.put(k, false);
          retiredAt.put(k, ring.previousRetiredAt().orElse(now));
        });
      }
      kemLastVersion = rings.get(KeyType.KEM).lastVersion();
      sigLastVersion = rings.get(KeyType.SIGNATURE).lastVersion();
    } finally {
      lock.readLock().unlock();
    }
    if (keys.isEmpty()) {
      throw new KeyManagerException(ErrorKind.KEY_NOT_AVAILABLE, "No keys to back up");
    }

    List<BackupPayload.Entry> entries = new ArrayList<>(keys.size());
    BackupPayload payload = new BackupPayload(clock.instant(), custodian.name(), kemLastVersion,
        sigLastVersion, entries);
    try {
      for (ManagedKeyPair key : keys) {
        byte[] material = key.privateMaterial();
        try {
          entries.add(new BackupPayload.Entry(key.type(), key.keyId(), key.algorithm(), key.version(),
              key.createdAt(), current.get(key), retiredAt.get(key), key.publicKey(),
              custodian.exportForBackup(key.type(), key.algorithm(), material)));
        } finally {
          ByteUtils.zeroize(material);
        }
      }
      byte[] blob = backupCodec.seal(payload, passphrase);
      appendAudit(new RotationAuditEntry(clock.instant(), AuditAction.BACKUP, null, null, null, null, null,
          SYSTEM_OPERATOR, "backup of " + entries.size() + " key(s)"));
      SecurityEvents.keysBackedUp(entries.size(), custodian.name());
      return blob;
    } finally {
      payload.destroy();
    }
  }

  @Override
  public void restoreKeys(char[] passphrase, byte[] blob) {
    BackupPayload payload;
    try {
      payload = backupCodec.open(blob, passphrase);
    } catch (KeyManagerException e) {
      SecurityEvents.restoreRejected(e.errorKind().name());
      throw e;
    }
    Map<KeyType, ManagedKeyPair> restoredCurrent = new EnumMap<>(KeyType.class);
    Map<KeyType, ManagedKeyPair> restoredPrevious = new EnumMap<>(KeyType.class);
    Map<KeyType, Instant> restoredRetiredAt = new EnumMap<>(KeyType.class);
    List<ManagedKeyPair> imported = new ArrayList<>();
    try {
      for (BackupPayload.Entry entry : payload.keys()) {
        validate(entry);
        Map<KeyType, ManagedKeyPair> slot = entry.current() ? restoredCurrent : restoredPrevious;
        if (slot.containsKey(entry.type())) {
          throw new KeyManagerException(ErrorKind.CORRUPT_BACKUP,
              "Backup holds more than one " + (entry.current() ? "current" : "previous") + " " + entry.type() + " key");
        }
        byte[] material = custodian.importFromBackup(entry.type(), entry.algorithm(), entry.privateMaterial());
        ManagedKeyPair key;
        try {
          key = new ManagedKeyPair(entry.type(), entry.algorithm(), entry.keyId(), entry.version(),
              entry.createdAt(), entry.publicKey(), material);
        } finally {
          ByteUtils.zeroize(material);
        }
        imported.add(key);
        slot.put(entry.type(), key);
        if (!entry.current()) {
          restoredRetiredAt.put(entry.type(), entry.retiredAt());
        }
      }
      for (KeyType type : KeyType.values()) {
        if (!restoredCurrent.containsKey(type)) {
          throw new KeyManagerException(ErrorKind.CORRUPT_BACKUP, "Backup has no current " + type + " key");
        }
      }
    } catch (KeyManagerException e) {
      imported.forEach(this::discard);
      SecurityEvents.restoreRejected(e.getMessage());
      throw e;
    } catch (IllegalArgumentException e) {
      imported.forEach(this::discard);
      SecurityEvents.restoreRejected(e.getMessage());
      throw new KeyManagerException(ErrorKind.CORRUPT_BACKUP, "Backup content is invalid", e);
    } finally {
      payload.destroy();
    }

    List<ManagedKeyPair> dropped = new ArrayList<>();
    lock.writeLock().lock();
    try {
      for (KeyType type : KeyType.values()) {
        int lastVersion = type == KeyType.KEM ? payload.kemLastVersion() : payload.signatureLastVersion();
        dropped.addAll(rings.get(type).replace(restoredCurrent.get(type), restoredPrevious.get(type),
            restoredRetiredAt.get(type), lastVersion));
      }
      auditLog.add(new RotationAuditEntry(clock.instant(), AuditAction.RESTORE, null, null, null, null, null,
          SYSTEM_OPERATOR, "restore of " + imported.size() + " key(s) taken " + payload.createdAt()));
    } finally {
      lock.writeLock().unlock();
    }
    dropped.forEach(this::discard);
    SecurityEvents.keysRestored(imported.size(), custodian.name());
  }

  private void validate(BackupPayload.Entry entry) {
    if (entry.type() == null || entry.keyId() == null || entry.publicKey() == null
        || entry.privateMaterial() == null || entry.createdAt() == null || entry.version() < 1) {
      throw new KeyManagerException(ErrorKind.CORRUPT_BACKUP, "Backup entry is incomplete");
    }
    boolean supported = switch (entry.type()) {
      case KEM -> KemAlgorithm.fromName(entry.algorithm()).filter(config.supportedKems()::contains).isPresent();
      case SIGNATURE -> SignatureAlgorithm.fromName(entry.algorithm())
          .filter(config.supportedSignatures()::contains).isPresent();
    };
    if (!supported) {
      throw new KeyManagerException(ErrorKind.UNSUPPORTED_ALGORITHM,
          "Backup holds unsupported algorithm " + entry.algorithm());
    }
    if (!entry.current() && entry.retiredAt() == null) {
      throw new KeyManagerException(ErrorKind.CORRUPT_BACKUP, "Previous key " + entry.keyId() + " has no retiredAt");
    }
  }

  // ── Queries and housekeeping ─────────────────────────────────────────────

  @Override
  public PublicKeySet exportPublicKeys() {
    lock.readLock().lock();
    try {
      Instant now = clock.instant();
      List<PublicKeyInfo> retiring = new ArrayList<>();
      for (KeyRing ring : rings.values()) {
        ring.retiring(now, config.gracePeriod()).ifPresent(k ->
            retiring.add(k.publicInfo(ring.retiringValidUntil(config.gracePeriod()).orElse(null))));
      }
      return new PublicKeySet(
          rings.get(KeyType.KEM).current().map(k -> k.publicInfo(null)).orElse(null),
          rings.get(KeyType.SIGNATURE).current().map(k -> k.publicInfo(null)).orElse(null),
          List.copyOf(retiring));
    } finally {
      lock.readLock().unlock();
    }
  }

  @Override
  public List<RotationAuditEntry> getRotationAuditLog() {
    lock.readLock().lock();
    try {
      return Collections.unmodifiableList(new ArrayList<>(auditLog));
    } finally {
      lock.readLock().unlock();
    }
  }

  @Override
  public Optional<PublicKeyInfo> currentKey(KeyType type) {
    lock.readLock().lock();
    try {
      return rings.get(type).current().map(k -> k.publicInfo(null));
    } finally {
      lock.readLock().unlock();
    }
  }

  @Override
  public int purgeRetiredKeys() {
    List<ManagedKeyPair> dropped = new ArrayList<>();
    lock.writeLock().lock();
    try {
      Instant now = clock.instant();
      for (KeyRing ring : rings.values()) {
        ring.purge(now, config.gracePeriod()).ifPresent(dropped::add);
      }
    } finally {
      lock.writeLock().unlock();
    }
    dropped.forEach(this::discard);
    if (!dropped.isEmpty()) {
      log.info("Discarded {} key(s) past their grace period", dropped.size());
    }
    return dropped.size();
  }

  @Override
  public String custody() {
    return custodian.name();
  }

  private Optional<String> currentAlgorithm(KeyType type) {
    return currentKey(type).map(PublicKeyInfo::algorithm);
  }

  private void appendAudit(RotationAuditEntry entry) {
    lock.writeLock().lock();
    try {
      auditLog.add(entry);
    } finally {
      lock.writeLock().unlock();
    }
  }

  private void discard(ManagedKeyPair key) {
    if (key.isDestroyed()) {
      return;
    }
    byte[] material = key.privateMaterial();
    try {
      custodian.release(material);
    } catch (RuntimeException e) {
      log.error("Custodian failed to release key {}", key.keyId(), e);
    } finally {
      ByteUtils.zeroize(material);
      key.destroy();
    }
    log.debug("Discarded key {} version {}", key.keyId(), key.version());
  }
}
