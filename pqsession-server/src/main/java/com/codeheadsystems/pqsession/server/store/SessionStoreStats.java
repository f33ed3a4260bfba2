package com.codeheadsystems.pqsession.server.store;

/**
 * Point-in-time counts for a session store.
 *
 * @param backend     backend name, {@code local} or {@code redis}
 * @param total       records held, in any state
 * @param active      records that would verify valid now
 * @param expired     records past expiry but not yet reclaimed
 * @param invalidated records explicitly invalidated
 * @param degraded    true when running on a fallback backend
 */
public record SessionStoreStats(String backend,
                                long total,
                                long active,
                                long expired,
                                long invalidated,
                                boolean degraded) {

  public SessionStoreStats withDegraded(boolean value) {
    return new SessionStoreStats(backend, total, active, expired, invalidated, value);
  }
}
