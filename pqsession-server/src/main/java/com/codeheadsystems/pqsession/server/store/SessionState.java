package com.codeheadsystems.pqsession.server.store;

/**
 * Lifecycle tag of a stored session.
 */
public enum SessionState {
  ACTIVE,
  EXPIRED,
  INVALIDATED
}
