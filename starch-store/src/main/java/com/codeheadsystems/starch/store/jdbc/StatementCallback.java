package com.codeheadsystems.starch.store.jdbc;

import java.sql.PreparedStatement;
import java.sql.SQLException;

/**
 * Binds parameters on a prepared statement and executes it.
 *
 * @param <T> the result type
 */
@FunctionalInterface
public interface StatementCallback<T> {

  /**
   * Apply t.
   *
   * @param statement the prepared statement, parameters cleared
   * @return the result
   * @throws SQLException the sql exception
   */
  T apply(PreparedStatement statement) throws SQLException;
}
