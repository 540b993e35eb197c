package com.codeheadsystems.starch.dropwizard;

import com.codeheadsystems.starch.dropwizard.health.SessionStoreHealthCheck;
import com.codeheadsystems.starch.store.SessionStore;
import com.codeheadsystems.starch.store.jdbc.JdbcSessionStore;
import io.dropwizard.core.ConfiguredBundle;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;
import io.dropwizard.db.ManagedDataSource;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dropwizard bundle that builds a {@link JdbcSessionStore} from a {@link StarchConfiguration}.
 * <p>
 * Creates a managed data source from the {@code database} block, builds the store on it,
 * closes the store on shutdown and registers a {@code session-store} health check.
 * <p>
 * Embed in your application:
 * <pre>{@code
 *   private final StarchBundle<MyConfiguration> starch = new StarchBundle<>();
 *
 *   public void initialize(Bootstrap<MyConfiguration> bootstrap) {
 *     bootstrap.addBundle(starch);
 *   }
 *
 *   public void run(MyConfiguration configuration, Environment environment) {
 *     SessionStore sessions = starch.getSessionStore();
 *   }
 * }</pre>
 * <p>
 * Or supply a store of your own, in which case the {@code database} block is ignored:
 * <pre>{@code
 *   bootstrap.addBundle(new StarchBundle<>(mySessionStore));
 * }</pre>
 */
public class StarchBundle<C extends StarchConfiguration> implements ConfiguredBundle<C> {

  private static final Logger log = LoggerFactory.getLogger(StarchBundle.class);

  static final String NAME = "session-store";

  private final SessionStore suppliedStore;
  private SessionStore sessionStore;

  /**
   * Creates a bundle that builds a JDBC session store from the configuration.
   */
  public StarchBundle() {
    this.suppliedStore = null;
  }

  /**
   * Creates a bundle around the supplied store.
   *
   * @param sessionStore the session store
   */
  public StarchBundle(SessionStore sessionStore) {
    this.suppliedStore = Objects.requireNonNull(sessionStore, "sessionStore");
  }

  @Override
  public void initialize(Bootstrap<?> bootstrap) {
    // No additional bootstrapping needed
  }

  @Override
  public void run(C configuration, Environment environment) {
    if (suppliedStore != null) {
      log.info("Using supplied session store {}", suppliedStore.getClass().getSimpleName());
      sessionStore = suppliedStore;
    } else {
      ManagedDataSource dataSource = configuration.getDatabase().build(environment.metrics(), NAME);
      environment.lifecycle().manage(dataSource);
      JdbcSessionStore jdbcSessionStore = buildSessionStore(configuration, dataSource);
      environment.lifecycle().manage(new SessionStoreManager(jdbcSessionStore));
      sessionStore = jdbcSessionStore;
    }
    environment.healthChecks().register(NAME, new SessionStoreHealthCheck(sessionStore));
  }

  private JdbcSessionStore buildSessionStore(C configuration, ManagedDataSource dataSource) {
    return JdbcSessionStore.builder()
        .dataSource(dataSource)
        .sessionTable(configuration.sessionTable())
        .serializer(configuration.getSerializer())
        .insertConflictFallback(configuration.isInsertConflictFallback())
        .build();
  }

  /**
   * Gets the session store. Available once the bundle has run.
   *
   * @return the session store
   */
  public SessionStore getSessionStore() {
    if (sessionStore == null) {
      throw new IllegalStateException("StarchBundle has not been run yet");
    }
    return sessionStore;
  }
}
