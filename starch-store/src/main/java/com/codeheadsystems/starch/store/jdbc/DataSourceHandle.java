package com.codeheadsystems.starch.store.jdbc;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import javax.sql.DataSource;

/**
 * {@link DatabaseHandle} that borrows a connection from a {@link DataSource} per statement.
 * <p>
 * Statement caching, pooling and validation are left to the data source. The data source
 * belongs to the caller and is not closed with the handle.
 */
class DataSourceHandle implements DatabaseHandle {

  private final DataSource dataSource;

  DataSourceHandle(DataSource dataSource) {
    this.dataSource = dataSource;
  }

  @Override
  public <T> T execute(String sql, StatementCallback<T> callback) throws SQLException {
    try (Connection connection = dataSource.getConnection();
         PreparedStatement statement = connection.prepareStatement(sql)) {
      return callback.apply(statement);
    }
  }

  @Override
  public void close() {
    // the data source outlives the handle
  }
}
