package com.codeheadsystems.starch.dropwizard;

import com.codeheadsystems.starch.store.jdbc.JdbcSessionStore;
import io.dropwizard.lifecycle.Managed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Closes the session store when the application stops.
 */
public class SessionStoreManager implements Managed {

  private static final Logger log = LoggerFactory.getLogger(SessionStoreManager.class);

  private final JdbcSessionStore sessionStore;

  /**
   * Instantiates a new Session store manager.
   *
   * @param sessionStore the session store
   */
  public SessionStoreManager(JdbcSessionStore sessionStore) {
    this.sessionStore = sessionStore;
  }

  @Override
  public void start() {
    log.debug("start({})", sessionStore.sessionTable().table());
  }

  @Override
  public void stop() {
    log.info("Closing session store for table {}", sessionStore.sessionTable().table());
    sessionStore.close();
  }
}
