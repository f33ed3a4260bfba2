package com.codeheadsystems.pqsession.server.store;

import java.net.URI;
import java.time.Clock;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.JedisPooled;
import redis.clients.jedis.UnifiedJedis;
import redis.clients.jedis.exceptions.JedisException;

/**
 * Chooses the session backend at startup.
 * <p>
 * A DURABLE configuration whose Redis instance does not answer {@code PING} falls back to the local
 * backend and is reported as degraded.
 */
public class SessionStoreFactory {

  private static final Logger log = LoggerFactory.getLogger(SessionStoreFactory.class);

  private final Function<URI, UnifiedJedis> redisClientFactory;
  private final Clock clock;

  public SessionStoreFactory(Clock clock) {
    this(clock, JedisPooled::new);
  }

  public SessionStoreFactory(Clock clock, Function<URI, UnifiedJedis> redisClientFactory) {
    this.clock = clock;
    this.redisClientFactory = redisClientFactory;
  }

  /**
   * Opens the configured backend.
   *
   * @param config storage settings
   * @return the selection
   */
  public SessionBackendSelection open(SessionStoreConfig config) {
    if (config.backend() == StorageBackend.LOCAL) {
      log.info("Using local session store (sweep every {})", config.sweepInterval());
      return new SessionBackendSelection(new LocalSessionStore(clock, config.sweepInterval()), false,
          "local");
    }
    UnifiedJedis jedis = null;
    try {
      jedis = redisClientFactory.apply(config.durableUri());
      String pong = jedis.ping();
      if (!"PONG".equalsIgnoreCase(pong)) {
        throw new JedisException("Unexpected PING reply: " + pong);
      }
      log.info("Using Redis session store at {}:{}", config.durableUri().getHost(), config.durableUri().getPort());
      return new SessionBackendSelection(
          new RedisSessionStore(jedis, clock, config.retention(), config.degradedReadCacheEnabled()),
          false, "redis");
    } catch (JedisException e) {
      if (jedis != null) {
        jedis.close();
      }
      log.warn("Redis at {}:{} is unreachable ({}); falling back to the local session store. "
              + "Sessions will not be shared between instances.",
          config.durableUri().getHost(), config.durableUri().getPort(), e.getMessage());
      return new SessionBackendSelection(new LocalSessionStore(clock, config.sweepInterval()), true,
          "local (durable backend unreachable)");
    }
  }
}
