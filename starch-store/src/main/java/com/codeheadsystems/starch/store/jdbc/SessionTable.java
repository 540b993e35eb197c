package com.codeheadsystems.starch.store.jdbc;

import java.util.regex.Pattern;

/**
 * Names of the session table and its three columns.
 * <p>
 * Names are interpolated into SQL text, so each must be a plain SQL identifier. The table
 * name may carry a schema qualifier ({@code schema.table}).
 *
 * @param table            table holding one row per session
 * @param keyColumn        column holding the session key
 * @param dataColumn       column holding the serialized payload
 * @param expirationColumn column holding the expiration as epoch seconds
 */
public record SessionTable(String table, String keyColumn, String dataColumn, String expirationColumn) {

  private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_$]*");
  private static final Pattern QUALIFIED_IDENTIFIER =
      Pattern.compile("[A-Za-z_][A-Za-z0-9_$]*(\\.[A-Za-z_][A-Za-z0-9_$]*)?");

  /**
   * {@code sessions(key, data, expiration)}.
   */
  public static final SessionTable DEFAULT = new SessionTable("sessions", "key", "data", "expiration");

  /**
   * Instantiates a new Session table.
   */
  public SessionTable {
    require("table", table, QUALIFIED_IDENTIFIER);
    require("keyColumn", keyColumn, IDENTIFIER);
    require("dataColumn", dataColumn, IDENTIFIER);
    require("expirationColumn", expirationColumn, IDENTIFIER);
  }

  private static void require(String option, String value, Pattern pattern) {
    if (value == null || value.isEmpty()) {
      throw new IllegalArgumentException(option + " must not be empty");
    }
    if (!pattern.matcher(value).matches()) {
      throw new IllegalArgumentException(option + " is not a valid SQL identifier: " + value);
    }
  }

  /**
   * Returns a copy with a different table name.
   *
   * @param table the table name
   * @return the session table
   */
  public SessionTable withTable(String table) {
    return new SessionTable(table, keyColumn, dataColumn, expirationColumn);
  }

  /**
   * Returns a copy with a different key column.
   *
   * @param keyColumn the key column
   * @return the session table
   */
  public SessionTable withKeyColumn(String keyColumn) {
    return new SessionTable(table, keyColumn, dataColumn, expirationColumn);
  }

  /**
   * Returns a copy with a different data column.
   *
   * @param dataColumn the data column
   * @return the session table
   */
  public SessionTable withDataColumn(String dataColumn) {
    return new SessionTable(table, keyColumn, dataColumn, expirationColumn);
  }

  /**
   * Returns a copy with a different expiration column.
   *
   * @param expirationColumn the expiration column
   * @return the session table
   */
  public SessionTable withExpirationColumn(String expirationColumn) {
    return new SessionTable(table, keyColumn, dataColumn, expirationColumn);
  }
}
