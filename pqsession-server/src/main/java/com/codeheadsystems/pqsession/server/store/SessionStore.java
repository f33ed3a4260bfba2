package com.codeheadsystems.pqsession.server.store;

import java.util.Optional;

/**
 * Storage abstraction for completed sessions.
 * <p>
 * Implementations must be thread-safe and atomic per session id: {@code put}, {@code get} and
 * {@code invalidate} on one id never interleave partially. Expiry is enforced lazily on every
 * read; the local implementation additionally sweeps expired entries on a schedule.
 * <p>
 * Implementations backed by a remote service throw {@link StorageBackendUnavailableException}
 * when it cannot be reached. A failed {@link #put} leaves no record behind.
 */
public interface SessionStore extends AutoCloseable {

  /**
   * Stores a new session.
   *
   * @param record the session
   * @throws IllegalStateException               if the id is already present
   * @throws StorageBackendUnavailableException if the backend is unreachable
   */
  void put(SessionRecord record);

  /**
   * Loads a usable session.
   *
   * @param sessionId the session id
   * @return the record if present, active and unexpired
   */
  Optional<SessionRecord> get(String sessionId);

  /**
   * Verifies a session, distinguishing expired, invalidated and unknown ids.
   *
   * @param sessionId the session id
   * @return the verification
   */
  SessionVerification verify(String sessionId);

  /**
   * Marks a session invalidated, effective immediately.
   *
   * @param sessionId the session id
   * @return false if no such session exists
   */
  boolean invalidate(String sessionId);

  /**
   * Counts every state by reading each record. Costs one backend read per record.
   *
   * @return the counts
   * @throws StorageBackendUnavailableException if the backend is unreachable
   */
  SessionStoreStats stats();

  /**
   * Number of records held in any state, without reading them.
   *
   * @return the record count
   * @throws StorageBackendUnavailableException if the backend is unreachable
   */
  long size();

  /**
   * Whether the backend currently answers requests.
   *
   * @return true if reachable
   */
  boolean isAvailable();

  String backendName();

  /**
   * Releases background threads and connections.
   */
  @Override
  void close();
}
