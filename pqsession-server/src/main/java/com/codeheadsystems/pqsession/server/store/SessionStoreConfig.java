package com.codeheadsystems.pqsession.server.store;

import java.net.URI;
import java.time.Duration;

/**
 * Startup-time session storage settings.
 *
 * @param backend                  which backend to use
 * @param durableUri               Redis URI, used when {@code backend} is DURABLE
 * @param sweepInterval            local reaper period
 * @param retention                how long the durable backend keeps expired records readable
 * @param degradedReadCacheEnabled serve reads from a local mirror while Redis is down
 */
public record SessionStoreConfig(StorageBackend backend,
                                 URI durableUri,
                                 Duration sweepInterval,
                                 Duration retention,
                                 boolean degradedReadCacheEnabled) {

  public static SessionStoreConfig local(Duration sweepInterval) {
    return new SessionStoreConfig(StorageBackend.LOCAL, null, sweepInterval,
        RedisSessionStore.DEFAULT_RETENTION, false);
  }
}
