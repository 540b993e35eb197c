package com.codeheadsystems.starch.store.jdbc;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;

/**
 * Arguments for opening a JDBC connection through {@link DriverManager}.
 *
 * @param url        the JDBC url
 * @param user       the user, may be null
 * @param password   the password, may be null
 * @param properties additional driver properties
 */
public record ConnectionParameters(String url, String user, String password, Map<String, String> properties) {

  /**
   * Instantiates new Connection parameters.
   */
  public ConnectionParameters {
    Objects.requireNonNull(url, "url");
    properties = properties == null ? Map.of() : Map.copyOf(properties);
  }

  /**
   * Parameters with no extra driver properties.
   *
   * @param url      the JDBC url
   * @param user     the user
   * @param password the password
   * @return the connection parameters
   */
  public static ConnectionParameters of(String url, String user, String password) {
    return new ConnectionParameters(url, user, password, Map.of());
  }

  /**
   * Opens a new connection.
   *
   * @return the connection
   * @throws SQLException the sql exception
   */
  public Connection connect() throws SQLException {
    Properties info = new Properties();
    info.putAll(properties);
    if (user != null) {
      info.setProperty("user", user);
    }
    if (password != null) {
      info.setProperty("password", password);
    }
    return DriverManager.getConnection(url, info);
  }

  @Override
  public String toString() {
    return "ConnectionParameters[url=" + url + ", user=" + user + ", properties=" + properties.keySet() + "]";
  }
}
