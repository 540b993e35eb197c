package com.codeheadsystems.starch.store.jdbc;

import com.codeheadsystems.starch.exceptions.SessionStoreException;
import com.codeheadsystems.starch.serializer.Serializer;
import com.codeheadsystems.starch.serializer.SerializerConfig;
import com.codeheadsystems.starch.serializer.Serializers;
import com.codeheadsystems.starch.store.SessionKeys;
import com.codeheadsystems.starch.store.SessionStore;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.time.Clock;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link SessionStore} that keeps one row per session in a relational table.
 * <p>
 * Each row holds the key, the serialized payload and the expiration in epoch seconds. A row
 * is only visible while its expiration is strictly greater than the current time; expired
 * rows stay in the table until the same key is set again or removed. Reclaiming rows for
 * keys that are never touched again is left to an external sweep.
 * <p>
 * {@link #set} reads before it writes: if a live row exists it is updated, otherwise a row
 * is inserted. The read and the write are separate statements, so two writers racing on a
 * new key can both choose insert. When the key column is a primary or unique key, the losing
 * insert fails with an integrity violation and, with {@code insertConflictFallback} enabled
 * (the default), is retried as an update. The same path handles re-setting a key whose row
 * has expired but is still present.
 * <p>
 * Database failures surface as {@link SessionStoreException} with the original
 * {@link SQLException} as the cause. Nothing is retried and no transaction is opened.
 * <p>
 * Example:
 * <pre>{@code
 *   JdbcSessionStore store = JdbcSessionStore.builder()
 *       .dataSource(dataSource)
 *       .table("my_sessions")
 *       .serializer("CBOR")
 *       .build();
 * }</pre>
 */
public class JdbcSessionStore implements SessionStore, AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(JdbcSessionStore.class);

  private static final String INTEGRITY_CONSTRAINT_VIOLATION = "23";

  private final DatabaseHandle database;
  private final Serializer serializer;
  private final SessionTable sessionTable;
  private final SessionSql sql;
  private final Clock clock;
  private final boolean insertConflictFallback;

  /**
   * Instantiates a new Jdbc session store.
   *
   * @param database               the database handle
   * @param serializer             the payload codec
   * @param sessionTable           table and column names
   * @param clock                  source of the current time
   * @param insertConflictFallback retry a conflicting insert as an update
   */
  public JdbcSessionStore(final DatabaseHandle database,
                          final Serializer serializer,
                          final SessionTable sessionTable,
                          final Clock clock,
                          final boolean insertConflictFallback) {
    this.database = Objects.requireNonNull(database, "database");
    this.serializer = Objects.requireNonNull(serializer, "serializer");
    this.sessionTable = Objects.requireNonNull(sessionTable, "sessionTable");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.insertConflictFallback = insertConflictFallback;
    this.sql = SessionSql.forTable(sessionTable);
    log.info("JdbcSessionStore({}, {}, insertConflictFallback={})",
        sessionTable, serializer, insertConflictFallback);
  }

  /**
   * Builder.
   *
   * @return the builder
   */
  public static Builder builder() {
    return new Builder();
  }

  @Override
  public void set(final String key, final Map<String, Object> value, final long ttlSeconds) {
    SessionKeys.requireKey(key);
    SessionKeys.requireTtl(ttlSeconds);
    Objects.requireNonNull(value, "value");

    final long now = now();
    final byte[] data = serializer.serialize(value);
    final long expiration = SessionKeys.expiration(now, ttlSeconds);
    try {
      if (exists(key, now)) {
        if (update(key, data, expiration) == 0) {
          // removed between the check and the update
          insert(key, data, expiration);
        }
      } else {
        insert(key, data, expiration);
      }
    } catch (SQLException e) {
      throw new SessionStoreException("Unable to store session key=" + key, e);
    }
    log.debug("Stored session key={} expiration={}", key, expiration);
  }

  @Override
  public Optional<Map<String, Object>> get(final String key) {
    SessionKeys.requireKey(key);
    final long now = now();
    final byte[] data;
    try {
      data = database.execute(sql.selectSql(), statement -> {
        statement.setString(1, key);
        statement.setLong(2, now);
        try (ResultSet resultSet = statement.executeQuery()) {
          return resultSet.next() ? resultSet.getBytes(1) : null;
        }
      });
    } catch (SQLException e) {
      throw new SessionStoreException("Unable to load session key=" + key, e);
    }
    if (data == null) {
      log.trace("get({}): absent or expired", key);
      return Optional.empty();
    }
    return Optional.of(serializer.deserialize(data));
  }

  @Override
  public void remove(final String key) {
    SessionKeys.requireKey(key);
    try {
      database.execute(sql.deleteSql(), statement -> {
        statement.setString(1, key);
        return statement.executeUpdate();
      });
    } catch (SQLException e) {
      throw new SessionStoreException("Unable to remove session key=" + key, e);
    }
    log.debug("Removed session key={}", key);
  }

  private boolean exists(final String key, final long now) throws SQLException {
    return database.execute(sql.existsSql(), statement -> {
      statement.setString(1, key);
      statement.setLong(2, now);
      try (ResultSet resultSet = statement.executeQuery()) {
        return resultSet.next();
      }
    });
  }

  private int update(final String key, final byte[] data, final long expiration) throws SQLException {
    return database.execute(sql.updateSql(), statement -> {
      statement.setBytes(1, data);
      statement.setLong(2, expiration);
      statement.setString(3, key);
      return statement.executeUpdate();
    });
  }

  private void insert(final String key, final byte[] data, final long expiration) throws SQLException {
    try {
      database.execute(sql.insertSql(), statement -> {
        statement.setString(1, key);
        statement.setBytes(2, data);
        statement.setLong(3, expiration);
        return statement.executeUpdate();
      });
    } catch (SQLException e) {
      if (!insertConflictFallback || !isIntegrityViolation(e)) {
        throw e;
      }
      log.warn("Insert for session key={} conflicted with an existing row (SQLState {}); updating instead",
          key, e.getSQLState());
      if (update(key, data, expiration) == 0) {
        throw e;
      }
    }
  }

  private static boolean isIntegrityViolation(final SQLException e) {
    return e instanceof SQLIntegrityConstraintViolationException
        || (e.getSQLState() != null && e.getSQLState().startsWith(INTEGRITY_CONSTRAINT_VIOLATION));
  }

  private long now() {
    return clock.instant().getEpochSecond();
  }

  /**
   * Gets the table and column names.
   *
   * @return the session table
   */
  public SessionTable sessionTable() {
    return sessionTable;
  }

  /**
   * Gets the statements derived from the session table.
   *
   * @return the session sql
   */
  public SessionSql sql() {
    return sql;
  }

  /**
   * Gets the serializer.
   *
   * @return the serializer
   */
  public Serializer serializer() {
    return serializer;
  }

  /**
   * Releases cached statements and any connection the store opened itself.
   */
  @Override
  public void close() {
    try {
      database.close();
    } catch (SQLException e) {
      throw new SessionStoreException("Unable to close session store", e);
    }
    log.debug("Closed JdbcSessionStore({})", sessionTable.table());
  }

  /**
   * Builder for {@link JdbcSessionStore}. Exactly one database source must be given.
   */
  public static class Builder {

    private DatabaseHandle database;
    private Serializer serializer;
    private SessionTable sessionTable = SessionTable.DEFAULT;
    private Clock clock = Clock.systemUTC();
    private boolean insertConflictFallback = true;

    private Builder() {
    }

    /**
     * Uses a caller-owned connection; the store caches prepared statements on it.
     *
     * @param connection the connection
     * @return the builder
     */
    public Builder connection(final Connection connection) {
      return database(DatabaseHandle.of(Objects.requireNonNull(connection, "connection")));
    }

    /**
     * Opens a connection on first use and closes it with the store.
     *
     * @param parameters the connection parameters
     * @return the builder
     */
    public Builder connectionParameters(final ConnectionParameters parameters) {
      return database(DatabaseHandle.of(Objects.requireNonNull(parameters, "parameters")));
    }

    /**
     * Borrows a connection from the data source for every statement.
     *
     * @param dataSource the data source
     * @return the builder
     */
    public Builder dataSource(final DataSource dataSource) {
      return database(DatabaseHandle.of(Objects.requireNonNull(dataSource, "dataSource")));
    }

    /**
     * Uses a custom database handle.
     *
     * @param database the database handle
     * @return the builder
     */
    public Builder database(final DatabaseHandle database) {
      if (this.database != null) {
        throw new IllegalStateException("A database source has already been configured");
      }
      this.database = Objects.requireNonNull(database, "database");
      return this;
    }

    /**
     * Uses the named built-in codec.
     *
     * @param codec codec name such as {@code JSON}
     * @return the builder
     */
    public Builder serializer(final String codec) {
      return serializer(Serializers.fromName(codec));
    }

    /**
     * Uses the built-in codec described by the config.
     *
     * @param config the serializer config
     * @return the builder
     */
    public Builder serializer(final SerializerConfig config) {
      return serializer(Serializers.fromConfig(Objects.requireNonNull(config, "config")));
    }

    /**
     * Uses a caller-supplied serializer.
     *
     * @param serializer the serializer
     * @return the builder
     */
    public Builder serializer(final Serializer serializer) {
      this.serializer = Objects.requireNonNull(serializer, "serializer");
      return this;
    }

    /**
     * Sets all table and column names at once.
     *
     * @param sessionTable the session table
     * @return the builder
     */
    public Builder sessionTable(final SessionTable sessionTable) {
      this.sessionTable = Objects.requireNonNull(sessionTable, "sessionTable");
      return this;
    }

    /**
     * Table.
     *
     * @param table the table
     * @return the builder
     */
    public Builder table(final String table) {
      this.sessionTable = sessionTable.withTable(table);
      return this;
    }

    /**
     * Key column.
     *
     * @param keyColumn the key column
     * @return the builder
     */
    public Builder keyColumn(final String keyColumn) {
      this.sessionTable = sessionTable.withKeyColumn(keyColumn);
      return this;
    }

    /**
     * Data column.
     *
     * @param dataColumn the data column
     * @return the builder
     */
    public Builder dataColumn(final String dataColumn) {
      this.sessionTable = sessionTable.withDataColumn(dataColumn);
      return this;
    }

    /**
     * Expiration column.
     *
     * @param expirationColumn the expiration column
     * @return the builder
     */
    public Builder expirationColumn(final String expirationColumn) {
      this.sessionTable = sessionTable.withExpirationColumn(expirationColumn);
      return this;
    }

    /**
     * Clock.
     *
     * @param clock the clock
     * @return the builder
     */
    public Builder clock(final Clock clock) {
      this.clock = Objects.requireNonNull(clock, "clock");
      return this;
    }

    /**
     * Whether an insert rejected by an integrity constraint is retried as an update.
     *
     * @param insertConflictFallback the flag
     * @return the builder
     */
    public Builder insertConflictFallback(final boolean insertConflictFallback) {
      this.insertConflictFallback = insertConflictFallback;
      return this;
    }

    /**
     * Build the store.
     *
     * @return the jdbc session store
     */
    public JdbcSessionStore build() {
      if (database == null) {
        throw new IllegalStateException(
            "A database source is required: connection, connectionParameters or dataSource");
      }
      return new JdbcSessionStore(database,
          serializer == null ? Serializers.json() : serializer,
          sessionTable, clock, insertConflictFallback);
    }
  }
}
