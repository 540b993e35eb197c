package com.codeheadsystems.starch.store.jdbc;

import java.sql.Connection;
import java.sql.SQLException;
import javax.sql.DataSource;

/**
 * The database client a {@link JdbcSessionStore} runs its statements against.
 * <p>
 * Handles are created from a pre-built {@link Connection}, from {@link ConnectionParameters}
 * or from a {@link DataSource}. Connection handling, pooling and reconnects belong to the
 * underlying client; a handle only prepares and runs one statement at a time.
 */
public interface DatabaseHandle extends AutoCloseable {

  /**
   * Prepares the statement (or reuses a cached one) and hands it to the callback.
   *
   * @param sql      parameterized statement text
   * @param callback binds parameters and executes
   * @param <T>      the result type
   * @return the callback's result
   * @throws SQLException the sql exception
   */
  <T> T execute(String sql, StatementCallback<T> callback) throws SQLException;

  @Override
  void close() throws SQLException;

  /**
   * Handle over a connection owned by the caller. Closing the handle leaves it open.
   *
   * @param connection the connection
   * @return the database handle
   */
  static DatabaseHandle of(Connection connection) {
    return new SingleConnectionHandle(() -> connection, false);
  }

  /**
   * Handle that opens its own connection on first use and closes it with the handle.
   *
   * @param parameters the connection parameters
   * @return the database handle
   */
  static DatabaseHandle of(ConnectionParameters parameters) {
    return new SingleConnectionHandle(parameters::connect, true);
  }

  /**
   * Handle that borrows a connection from the data source for every statement.
   *
   * @param dataSource the data source
   * @return the database handle
   */
  static DatabaseHandle of(DataSource dataSource) {
    return new DataSourceHandle(dataSource);
  }
}
