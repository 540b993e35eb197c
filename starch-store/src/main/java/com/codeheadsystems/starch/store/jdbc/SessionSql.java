package com.codeheadsystems.starch.store.jdbc;

/**
 * The parameterized statements a {@link JdbcSessionStore} issues, derived once from a
 * {@link SessionTable}.
 *
 * @param insertSql binds key, data, expiration
 * @param updateSql binds data, expiration, key
 * @param existsSql binds key, now; returns a row only for a live session
 * @param selectSql binds key, now; returns the data column of a live session
 * @param deleteSql binds key
 */
public record SessionSql(String insertSql, String updateSql, String existsSql, String selectSql,
                         String deleteSql) {

  /**
   * Builds the statements for the given table.
   *
   * @param table the session table
   * @return the session sql
   */
  public static SessionSql forTable(SessionTable table) {
    return new SessionSql(
        String.format("INSERT INTO %s (%s, %s, %s) VALUES (?, ?, ?)",
            table.table(), table.keyColumn(), table.dataColumn(), table.expirationColumn()),
        String.format("UPDATE %s SET %s=?, %s=? WHERE %s=?",
            table.table(), table.dataColumn(), table.expirationColumn(), table.keyColumn()),
        String.format("SELECT 1 FROM %s WHERE %s = ? AND %s > ?",
            table.table(), table.keyColumn(), table.expirationColumn()),
        String.format("SELECT %s FROM %s WHERE %s = ? AND %s > ?",
            table.dataColumn(), table.table(), table.keyColumn(), table.expirationColumn()),
        String.format("DELETE FROM %s WHERE %s = ?",
            table.table(), table.keyColumn()));
  }
}
