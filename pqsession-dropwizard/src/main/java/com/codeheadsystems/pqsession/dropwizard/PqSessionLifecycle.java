package com.codeheadsystems.pqsession.dropwizard;

import com.codeheadsystems.pqsession.server.manager.PqSessionServerManager;
import io.dropwizard.lifecycle.Managed;

/**
 * Ties the pqsession background tasks to the Jetty lifecycle: keys are ensured and the sweeps and
 * rotation scheduler start before the server accepts requests, and stop after it drains.
 */
public class PqSessionLifecycle implements Managed {

  private final PqSessionServerManager manager;

  public PqSessionLifecycle(PqSessionServerManager manager) {
    this.manager = manager;
  }

  @Override
  public void start() {
    manager.start();
  }

  @Override
  public void stop() {
    manager.shutdown();
  }
}
