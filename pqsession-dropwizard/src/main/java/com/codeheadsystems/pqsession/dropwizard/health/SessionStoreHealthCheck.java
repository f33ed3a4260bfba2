package com.codeheadsystems.pqsession.dropwizard.health;

import com.codahale.metrics.health.HealthCheck;
import com.codeheadsystems.pqsession.server.store.SessionBackendSelection;
import com.codeheadsystems.pqsession.server.store.StorageBackendUnavailableException;

/**
 * Health check for the session backend. A degraded fallback to the local store is healthy but
 * flagged; an unreachable backend is unhealthy.
 */
public class SessionStoreHealthCheck extends HealthCheck {

  private final SessionBackendSelection selection;

  public SessionStoreHealthCheck(SessionBackendSelection selection) {
    this.selection = selection;
  }

  @Override
  protected Result check() {
    if (!selection.store().isAvailable()) {
      return unreachable();
    }
    long sessions;
    try {
      sessions = selection.store().size();
    } catch (StorageBackendUnavailableException e) {
      return unreachable();
    }
    return Result.builder()
        .healthy()
        .withMessage(selection.detail())
        .withDetail("degraded", selection.degraded())
        .withDetail("sessions", sessions)
        .build();
  }

  private Result unreachable() {
    return Result.builder()
        .unhealthy()
        .withMessage("%s is unreachable", selection.store().backendName())
        .withDetail("degraded", selection.degraded())
        .build();
  }
}
