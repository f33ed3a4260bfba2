package com.codeheadsystems.pqsession.dropwizard;

import com.codeheadsystems.pqsession.server.store.StorageBackend;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.dropwizard.core.Configuration;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.util.List;

/**
 * Dropwizard configuration for the pqsession server.
 * <p>
 * Every option has a usable default, so an empty {@code pqsession} section runs a single instance
 * with the local session store and software key custody. For a cluster, set
 * {@code storageBackend: DURABLE} and point {@code durableBackendUri} at a shared Redis; if Redis
 * cannot be reached at startup the server runs degraded on the local store.
 * <p>
 * Algorithm names accept the ML-KEM / ML-DSA identifiers and their Kyber / Dilithium aliases.
 */
public class PqSessionConfiguration extends Configuration {

  // ── Handshake ────────────────────────────────────────────────────────────

  /**
   * Seconds a handshake may stay pending between ClientHello and ClientKeyExchange.
   */
  @Min(1)
  private long handshakeTimeoutSeconds = 30;

  /**
   * Period of the abandoned-handshake sweep. 0 disables the background sweep; expired handshakes
   * are still rejected when they are used.
   */
  @Min(0)
  private long handshakeSweepIntervalSeconds = 5;

  @Min(1)
  private int maxPendingHandshakes = 10_000;

  @NotEmpty
  private List<String> supportedKemAlgorithms = List.of("ML-KEM-1024", "ML-KEM-768", "ML-KEM-512");

  @NotEmpty
  private List<String> supportedSignatureAlgorithms = List.of("ML-DSA-87", "ML-DSA-65", "ML-DSA-44");

  /**
   * Address recorded on every session as the server side of the connection.
   */
  private String serverAddress = "";

  // ── Sessions ─────────────────────────────────────────────────────────────

  @Min(1)
  private long sessionTtlSeconds = 3600;

  /**
   * Period of the local store's expiry sweep. 0 disables it.
   */
  @Min(0)
  private long sessionSweepIntervalSeconds = 60;

  @NotNull
  private StorageBackend storageBackend = StorageBackend.LOCAL;

  /**
   * Redis URI used when {@code storageBackend} is DURABLE.
   */
  @NotEmpty
  private String durableBackendUri = "redis://localhost:6379/0";

  /**
   * Serve reads from a local cache while Redis is unreachable. Writes still fail closed.
   */
  private boolean degradedReadCacheEnabled = false;

  // ── Keys ─────────────────────────────────────────────────────────────────

  @NotEmpty
  private String kemAlgorithm = "ML-KEM-768";

  @NotEmpty
  private String signatureAlgorithm = "ML-DSA-65";

  /**
   * Days between scheduled rotations of both long-term keys. 0 disables scheduled rotation.
   */
  @Min(0)
  private long keyRotationIntervalDays = 180;

  /**
   * Seconds a rotated-out key keeps serving handshakes that pinned it. Should cover at least one
   * handshake timeout.
   */
  @Min(0)
  private long keyRotationGraceSeconds = 30;

  /**
   * Argon2id memory cost, in kibibytes, for the key-backup passphrase.
   */
  @Min(8)
  private int backupArgon2MemoryKib = 65536;

  @Min(1)
  private int backupArgon2Iterations = 3;

  @Min(1)
  private int backupArgon2Parallelism = 1;

  @JsonProperty
  public long getHandshakeTimeoutSeconds() {
    return handshakeTimeoutSeconds;
  }

  @JsonProperty
  public void setHandshakeTimeoutSeconds(long handshakeTimeoutSeconds) {
    this.handshakeTimeoutSeconds = handshakeTimeoutSeconds;
  }

  @JsonProperty
  public long getHandshakeSweepIntervalSeconds() {
    return handshakeSweepIntervalSeconds;
  }

  @JsonProperty
  public void setHandshakeSweepIntervalSeconds(long handshakeSweepIntervalSeconds) {
    this.handshakeSweepIntervalSeconds = handshakeSweepIntervalSeconds;
  }

  @JsonProperty
  public int getMaxPendingHandshakes() {
    return maxPendingHandshakes;
  }

  @JsonProperty
  public void setMaxPendingHandshakes(int maxPendingHandshakes) {
    this.maxPendingHandshakes = maxPendingHandshakes;
  }

  @JsonProperty
  public List<String> getSupportedKemAlgorithms() {
    return supportedKemAlgorithms;
  }

  @JsonProperty
  public void setSupportedKemAlgorithms(List<String> supportedKemAlgorithms) {
    this.supportedKemAlgorithms = supportedKemAlgorithms;
  }

  @JsonProperty
  public List<String> getSupportedSignatureAlgorithms() {
    return supportedSignatureAlgorithms;
  }

  @JsonProperty
  public void setSupportedSignatureAlgorithms(List<String> supportedSignatureAlgorithms) {
    this.supportedSignatureAlgorithms = supportedSignatureAlgorithms;
  }

  @JsonProperty
  public String getServerAddress() {
    return serverAddress;
  }

  @JsonProperty
  public void setServerAddress(String serverAddress) {
    this.serverAddress = serverAddress;
  }

  @JsonProperty
  public long getSessionTtlSeconds() {
    return sessionTtlSeconds;
  }

  @JsonProperty
  public void setSessionTtlSeconds(long sessionTtlSeconds) {
    this.sessionTtlSeconds = sessionTtlSeconds;
  }

  @JsonProperty
  public long getSessionSweepIntervalSeconds() {
    return sessionSweepIntervalSeconds;
  }

  @JsonProperty
  public void setSessionSweepIntervalSeconds(long sessionSweepIntervalSeconds) {
    this.sessionSweepIntervalSeconds = sessionSweepIntervalSeconds;
  }

  @JsonProperty
  public StorageBackend getStorageBackend() {
    return storageBackend;
  }

  @JsonProperty
  public void setStorageBackend(StorageBackend storageBackend) {
    this.storageBackend = storageBackend;
  }

  @JsonProperty
  public String getDurableBackendUri() {
    return durableBackendUri;
  }

  @JsonProperty
  public void setDurableBackendUri(String durableBackendUri) {
    this.durableBackendUri = durableBackendUri;
  }

  @JsonProperty
  public boolean isDegradedReadCacheEnabled() {
    return degradedReadCacheEnabled;
  }

  @JsonProperty
  public void setDegradedReadCacheEnabled(boolean degradedReadCacheEnabled) {
    this.degradedReadCacheEnabled = degradedReadCacheEnabled;
  }

  @JsonProperty
  public String getKemAlgorithm() {
    return kemAlgorithm;
  }

  @JsonProperty
  public void setKemAlgorithm(String kemAlgorithm) {
    this.kemAlgorithm = kemAlgorithm;
  }

  @JsonProperty
  public String getSignatureAlgorithm() {
    return signatureAlgorithm;
  }

  @JsonProperty
  public void setSignatureAlgorithm(String signatureAlgorithm) {
    this.signatureAlgorithm = signatureAlgorithm;
  }

  @JsonProperty
  public long getKeyRotationIntervalDays() {
    return keyRotationIntervalDays;
  }

  @JsonProperty
  public void setKeyRotationIntervalDays(long keyRotationIntervalDays) {
    this.keyRotationIntervalDays = keyRotationIntervalDays;
  }

  @JsonProperty
  public long getKeyRotationGraceSeconds() {
    return keyRotationGraceSeconds;
  }

  @JsonProperty
  public void setKeyRotationGraceSeconds(long keyRotationGraceSeconds) {
    this.keyRotationGraceSeconds = keyRotationGraceSeconds;
  }

  @JsonProperty
  public int getBackupArgon2MemoryKib() {
    return backupArgon2MemoryKib;
  }

  @JsonProperty
  public void setBackupArgon2MemoryKib(int backupArgon2MemoryKib) {
    this.backupArgon2MemoryKib = backupArgon2MemoryKib;
  }

  @JsonProperty
  public int getBackupArgon2Iterations() {
    return backupArgon2Iterations;
  }

  @JsonProperty
  public void setBackupArgon2Iterations(int backupArgon2Iterations) {
    this.backupArgon2Iterations = backupArgon2Iterations;
  }

  @JsonProperty
  public int getBackupArgon2Parallelism() {
    return backupArgon2Parallelism;
  }

  @JsonProperty
  public void setBackupArgon2Parallelism(int backupArgon2Parallelism) {
    this.backupArgon2Parallelism = backupArgon2Parallelism;
  }
}
