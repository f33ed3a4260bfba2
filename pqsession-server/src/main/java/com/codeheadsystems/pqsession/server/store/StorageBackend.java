package com.codeheadsystems.pqsession.server.store;

/**
 * Session storage backend selector.
 */
public enum StorageBackend {
  /** In-process map with a periodic reaper. */
  LOCAL,
  /** Shared Redis instance. */
  DURABLE
}
