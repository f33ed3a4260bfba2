package com.codeheadsystems.pqsession.server.store;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-process {@link SessionStore}: a map guarded by a single lock plus a periodic
 * reaper.
 * <p>
 * The lock is held only for one operation, or for one sweep batch. Expired records stay readable
 * (reporting {@link VerificationReason#EXPIRED}) until the next sweep removes them. All sessions are
 * lost on restart.
 */
public class LocalSessionStore implements SessionStore {

  private static final Logger log = LoggerFactory.getLogger(LocalSessionStore.class);

  static final int SWEEP_BATCH_SIZE = 256;

  private final Map<String, SessionRecord> sessions = new HashMap<>();
  private final ReentrantLock lock = new ReentrantLock();
  private final Clock clock;
  private final ScheduledExecutorService reaper;

  /**
   * Creates a store. A zero or negative {@code sweepInterval} disables the background reaper;
   * callers then invoke {@link #sweepExpired()} themselves.
   *
   * @param clock         time source
   * @param sweepInterval reaper period
   */
  public LocalSessionStore(Clock clock, Duration sweepInterval) {
    this.clock = clock;
    if (sweepInterval.isZero() || sweepInterval.isNegative()) {
      this.reaper = null;
    } else {
      this.reaper = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "pqsession-session-reaper");
        t.setDaemon(true);
        return t;
      });
      long periodMillis = sweepInterval.toMillis();
      reaper.scheduleAtFixedRate(this::sweepSafely, periodMillis, periodMillis, TimeUnit.MILLISECONDS);
    }
  }

  @Override
  public void put(SessionRecord record) {
    lock.lock();
    try {
      if (sessions.containsKey(record.sessionId())) {
        throw new IllegalStateException("Duplicate session id");
      }
      sessions.put(record.sessionId(), record);
    } finally {
      lock.unlock();
    }
    log.debug("Stored session {} expiresAt={}", record.sessionId(), record.expiresAt());
  }

  @Override
  public Optional<SessionRecord> get(String sessionId) {
    SessionRecord record = lookup(sessionId);
    if (record == null || record.effectiveState(clock.instant()) != SessionState.ACTIVE) {
      return Optional.empty();
    }
    return Optional.of(record);
  }

  @Override
  public SessionVerification verify(String sessionId) {
    return SessionVerification.of(sessionId, lookup(sessionId), clock.instant());
  }

  @Override
  public boolean invalidate(String sessionId) {
    lock.lock();
    try {
      SessionRecord record = sessions.get(sessionId);
      if (record == null) {
        return false;
      }
      sessions.put(sessionId, record.withState(SessionState.INVALIDATED));
    } finally {
      lock.unlock();
    }
    log.debug("Invalidated session {}", sessionId);
    return true;
  }

  @Override
  public long size() {
    lock.lock();
    try {
      return sessions.size();
    } finally {
      lock.unlock();
    }
  }

  @Override
  public SessionStoreStats stats() {
    List<SessionRecord> snapshot;
    lock.lock();
    try {
      snapshot = new ArrayList<>(sessions.values());
    } finally {
      lock.unlock();
    }
    Instant now = clock.instant();
    long active = 0;
    long expired = 0;
    long invalidated = 0;
    for (SessionRecord record : snapshot) {
      switch (record.effectiveState(now)) {
        case ACTIVE -> active++;
        case EXPIRED -> expired++;
        case INVALIDATED -> invalidated++;
      }
    }
    return new SessionStoreStats(backendName(), snapshot.size(), active, expired, invalidated, false);
  }

  /**
   * Removes every record whose expiry has passed, in batches of {@value #SWEEP_BATCH_SIZE}.
   *
   * @return the number of records removed
   */
  public int sweepExpired() {
    List<String> ids;
    lock.lock();
    try {
      ids = new ArrayList<>(sessions.keySet());
    } finally {
      lock.unlock();
    }
    Instant now = clock.instant();
    int removed = 0;
    for (int start = 0; start < ids.size(); start += SWEEP_BATCH_SIZE) {
      List<String> batch = ids.subList(start, Math.min(ids.size(), start + SWEEP_BATCH_SIZE));
      lock.lock();
      try {
        for (String id : batch) {
          SessionRecord record = sessions.get(id);
          if (record != null && record.expiredAt(now)) {
            sessions.remove(id);
            removed++;
          }
        }
      } finally {
        lock.unlock();
      }
    }
    if (removed > 0) {
      log.debug("Swept {} expired session(s)", removed);
    }
    return removed;
  }

  @Override
  public boolean isAvailable() {
    return true;
  }

  @Override
  public String backendName() {
    return "local";
  }

  /**
   * Stops the reaper thread.
   */
  @Override
  public void close() {
    if (reaper != null) {
      reaper.shutdownNow();
    }
  }

  private SessionRecord lookup(String sessionId) {
    if (sessionId == null) {
      return null;
    }
    lock.lock();
    try {
      return sessions.get(sessionId);
    } finally {
      lock.unlock();
    }
  }

  private void sweepSafely() {
    try {
      sweepExpired();
    } catch (RuntimeException e) {
      log.error("Session sweep failed", e);
    }
  }
}
