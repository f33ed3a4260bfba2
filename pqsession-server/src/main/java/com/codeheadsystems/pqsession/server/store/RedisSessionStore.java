package com.codeheadsystems.pqsession.server.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.UnifiedJedis;
import redis.clients.jedis.exceptions.JedisException;
import redis.clients.jedis.params.ScanParams;
import redis.clients.jedis.params.SetParams;
import redis.clients.jedis.resps.ScanResult;

/**
 * Durable, shared {@link SessionStore} on Redis.
 * <p>
 * Each session is one JSON string under {@value #KEY_PREFIX}{@code <sessionId>}. Records carry an
 * absolute Redis expiry of {@code expiresAt + retention}, so Redis reclaims them without a reaper
 * while {@link #verify} can still report {@link VerificationReason#EXPIRED} during the retention
 * window. Creation uses {@code SET NX} and invalidation uses {@code SET XX KEEPTTL}, so every write
 * is a single atomic command. A creation whose outcome is unknown is followed by a {@code DEL}.
 * <p>
 * When the degraded read cache is enabled, records written or read successfully are mirrored
 * locally and served from there if Redis becomes unreachable. Writes always fail closed.
 */
public class RedisSessionStore implements SessionStore {

  private static final Logger log = LoggerFactory.getLogger(RedisSessionStore.class);

  public static final String KEY_PREFIX = "pqsession:session:";
  public static final Duration DEFAULT_RETENTION = Duration.ofMinutes(5);

  static final int MAX_CACHED_RECORDS = 10_000;

  private final UnifiedJedis jedis;
  private final Clock clock;
  private final Duration retention;
  private final ObjectMapper mapper;
  private final Map<String, SessionRecord> readCache;

  /**
   * Creates a store over an existing connection.
   *
   * @param jedis                    the Redis client; closed by {@link #close()}
   * @param clock                    time source
   * @param retention                how long expired records stay readable
   * @param degradedReadCacheEnabled whether to serve reads from a local mirror during outages
   */
  public RedisSessionStore(UnifiedJedis jedis, Clock clock, Duration retention, boolean degradedReadCacheEnabled) {
    this.jedis = jedis;
    this.clock = clock;
    this.retention = retention;
    this.mapper = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    this.readCache = degradedReadCacheEnabled ? new ConcurrentHashMap<>() : null;
  }

  static String key(String sessionId) {
    return KEY_PREFIX + sessionId;
  }

  @Override
  public void put(SessionRecord record) {
    String json = toJson(record);
    long expireAtMillis = record.expiresAt().plus(retention).toEpochMilli();
    String reply;
    try {
      reply = jedis.set(key(record.sessionId()), json, SetParams.setParams().nx().pxAt(expireAtMillis));
    } catch (JedisException e) {
      StorageBackendUnavailableException failure =
          new StorageBackendUnavailableException("Redis unavailable while storing session", e);
      discardUnconfirmedWrite(record.sessionId(), failure);
      throw failure;
    }
    if (reply == null) {
      throw new IllegalStateException("Duplicate session id");
    }
    cache(record);
    log.debug("Stored session {} expiresAt={}", record.sessionId(), record.expiresAt());
  }

  /**
   * A failed SET may still have been applied (for example a reply lost to a read timeout). The key
   * is removed so a failed put leaves no usable session.
   */
  private void discardUnconfirmedWrite(String sessionId, StorageBackendUnavailableException failure) {
    try {
      jedis.del(key(sessionId));
    } catch (JedisException cleanup) {
      log.warn("Could not remove session {} after a failed write: {}", sessionId, cleanup.getMessage());
      failure.addSuppressed(cleanup);
    }
  }

  @Override
  public Optional<SessionRecord> get(String sessionId) {
    SessionRecord record = load(sessionId);
    if (record == null || record.effectiveState(clock.instant()) != SessionState.ACTIVE) {
      return Optional.empty();
    }
    return Optional.of(record);
  }

  @Override
  public SessionVerification verify(String sessionId) {
    return SessionVerification.of(sessionId, load(sessionId), clock.instant());
  }

  @Override
  public boolean invalidate(String sessionId) {
    SessionRecord current = load(sessionId);
    if (current == null) {
      return false;
    }
    SessionRecord invalidated = current.withState(SessionState.INVALIDATED);
    String reply;
    try {
      reply = jedis.set(key(sessionId), toJson(invalidated), SetParams.setParams().xx().keepttl());
    } catch (JedisException e) {
      throw new StorageBackendUnavailableException("Redis unavailable while invalidating session", e);
    }
    if (reply == null) {
      // Reclaimed by Redis between the read and the write.
      return false;
    }
    cache(invalidated);
    log.debug("Invalidated session {}", sessionId);
    return true;
  }

  @Override
  public SessionStoreStats stats() {
    Instant now = clock.instant();
    long total = 0;
    long active = 0;
    long expired = 0;
    long invalidated = 0;
    ScanParams params = new ScanParams().match(KEY_PREFIX + "*").count(500);
    String cursor = ScanParams.SCAN_POINTER_START;
    try {
      do {
        ScanResult<String> page = jedis.scan(cursor, params);
        for (String key : page.getResult()) {
          SessionRecord record = fromJson(jedis.get(key));
          if (record == null) {
            continue;
          }
          total++;
          switch (record.effectiveState(now)) {
            case ACTIVE -> active++;
            case EXPIRED -> expired++;
            case INVALIDATED -> invalidated++;
          }
        }
        cursor = page.getCursor();
      } while (!ScanParams.SCAN_POINTER_START.equals(cursor));
    } catch (JedisException e) {
      throw new StorageBackendUnavailableException("Redis unavailable while collecting stats", e);
    }
    return new SessionStoreStats(backendName(), total, active, expired, invalidated, false);
  }

  /**
   * Counts session keys with SCAN. Keys are not read, so this is safe to call from health checks.
   */
  @Override
  public long size() {
    long total = 0;
    ScanParams params = new ScanParams().match(KEY_PREFIX + "*").count(500);
    String cursor = ScanParams.SCAN_POINTER_START;
    try {
      do {
        ScanResult<String> page = jedis.scan(cursor, params);
        total += page.getResult().size();
        cursor = page.getCursor();
      } while (!ScanParams.SCAN_POINTER_START.equals(cursor));
    } catch (JedisException e) {
      throw new StorageBackendUnavailableException("Redis unavailable while counting sessions", e);
    }
    return total;
  }

  @Override
  public boolean isAvailable() {
    try {
      return "PONG".equalsIgnoreCase(jedis.ping());
    } catch (JedisException e) {
      log.debug("Redis ping failed: {}", e.getMessage());
      return false;
    }
  }

  @Override
  public String backendName() {
    return "redis";
  }

  @Override
  public void close() {
    jedis.close();
  }

  private SessionRecord load(String sessionId) {
    if (sessionId == null) {
      return null;
    }
    try {
      SessionRecord record = fromJson(jedis.get(key(sessionId)));
      if (record != null) {
        cache(record);
      }
      return record;
    } catch (JedisException e) {
      if (readCache == null) {
        throw new StorageBackendUnavailableException("Redis unavailable while reading session", e);
      }
      log.warn("Redis unavailable, serving session {} from the degraded read cache", sessionId);
      return readCache.get(sessionId);
    }
  }

  private void cache(SessionRecord record) {
    if (readCache == null) {
      return;
    }
    if (readCache.size() >= MAX_CACHED_RECORDS) {
      Instant now = clock.instant();
      readCache.values().removeIf(r -> r.expiredAt(now));
    }
    if (readCache.size() < MAX_CACHED_RECORDS) {
      readCache.put(record.sessionId(), record);
    }
  }

  private String toJson(SessionRecord record) {
    try {
      return mapper.writeValueAsString(record);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Unable to serialise session " + record.sessionId(), e);
    }
  }

  private SessionRecord fromJson(String json) {
    if (json == null) {
      return null;
    }
    try {
      return mapper.readValue(json, SessionRecord.class);
    } catch (JsonProcessingException e) {
      log.warn("Discarding unreadable session record: {}", e.getOriginalMessage());
      return null;
    }
  }
}
