package com.codeheadsystems.starch.store.jdbc;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.HashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link DatabaseHandle} over one long-lived connection with a prepared statement cache.
 * <p>
 * Each distinct SQL text is prepared once and reused for the life of the handle. A JDBC
 * statement cannot be bound by two callers at once, so every execution holds the handle's
 * monitor.
 */
class SingleConnectionHandle implements DatabaseHandle {

  private static final Logger log = LoggerFactory.getLogger(SingleConnectionHandle.class);

  /**
   * Supplies the connection on first use.
   */
  @FunctionalInterface
  interface ConnectionFactory {
    Connection open() throws SQLException;
  }

  private final ConnectionFactory connectionFactory;
  private final boolean ownsConnection;
  private final Map<String, PreparedStatement> statements = new HashMap<>();
  private Connection connection;
  private boolean closed;

  SingleConnectionHandle(ConnectionFactory connectionFactory, boolean ownsConnection) {
    this.connectionFactory = connectionFactory;
    this.ownsConnection = ownsConnection;
  }

  @Override
  public synchronized <T> T execute(String sql, StatementCallback<T> callback) throws SQLException {
    if (closed) {
      throw new SQLException("Database handle is closed");
    }
    PreparedStatement statement = prepareCached(sql);
    statement.clearParameters();
    return callback.apply(statement);
  }

  private PreparedStatement prepareCached(String sql) throws SQLException {
    PreparedStatement statement = statements.get(sql);
    if (statement == null || statement.isClosed()) {
      statement = connection().prepareStatement(sql);
      statements.put(sql, statement);
      log.trace("prepareCached({})", sql);
    }
    return statement;
  }

  private Connection connection() throws SQLException {
    if (connection == null) {
      connection = connectionFactory.open();
      log.debug("Opened session store connection (owned={})", ownsConnection);
    }
    return connection;
  }

  synchronized int cachedStatementCount() {
    return statements.size();
  }

  @Override
  public synchronized void close() throws SQLException {
    if (closed) {
      return;
    }
    closed = true;
    SQLException failure = null;
    for (PreparedStatement statement : statements.values()) {
      try {
        statement.close();
      } catch (SQLException e) {
        if (failure == null) {
          failure = e;
        } else {
          failure.addSuppressed(e);
        }
      }
    }
    statements.clear();
    if (ownsConnection && connection != null) {
      try {
        connection.close();
      } catch (SQLException e) {
        if (failure == null) {
          failure = e;
        } else {
          failure.addSuppressed(e);
        }
      }
    }
    connection = null;
    if (failure != null) {
      throw failure;
    }
  }
}
