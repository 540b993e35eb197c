package com.codeheadsystems.starch.dropwizard.health;

import com.codahale.metrics.health.HealthCheck;
import com.codeheadsystems.starch.store.SessionStore;

/**
 * Health check that runs a lookup for a key no session uses.
 * <p>
 * A healthy result means the database is reachable and the session table and its columns
 * resolve. The probe never writes.
 */
public class SessionStoreHealthCheck extends HealthCheck {

  static final String PROBE_KEY = "__starch_health_probe__";

  private final SessionStore sessionStore;

  /**
   * Instantiates a new Session store health check.
   *
   * @param sessionStore the session store
   */
  public SessionStoreHealthCheck(SessionStore sessionStore) {
    this.sessionStore = sessionStore;
  }

  @Override
  protected Result check() {
    try {
      sessionStore.get(PROBE_KEY);
    } catch (RuntimeException e) {
      return Result.unhealthy(e);
    }
    return Result.healthy("%s reachable", sessionStore.getClass().getSimpleName());
  }
}
