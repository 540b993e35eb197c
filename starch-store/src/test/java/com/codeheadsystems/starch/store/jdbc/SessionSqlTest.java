package com.codeheadsystems.starch.store.jdbc;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class SessionSqlTest {

  @Test
  void forTable_defaultNames() {
    SessionSql sql = SessionSql.forTable(SessionTable.DEFAULT);

    assertThat(sql.insertSql()).isEqualTo("INSERT INTO sessions (key, data, expiration) VALUES (?, ?, ?)");
    assertThat(sql.updateSql()).isEqualTo("UPDATE sessions SET data=?, expiration=? WHERE key=?");
    assertThat(sql.existsSql()).isEqualTo("SELECT 1 FROM sessions WHERE key = ? AND expiration > ?");
    assertThat(sql.selectSql()).isEqualTo("SELECT data FROM sessions WHERE key = ? AND expiration > ?");
    assertThat(sql.deleteSql()).isEqualTo("DELETE FROM sessions WHERE key = ?");
  }

  @Test
  void forTable_customNames() {
    SessionSql sql = SessionSql.forTable(
        new SessionTable("my_sessions", "session_id", "payload", "expires_at"));

    assertThat(sql.insertSql())
        .isEqualTo("INSERT INTO my_sessions (session_id, payload, expires_at) VALUES (?, ?, ?)");
    assertThat(sql.updateSql()).isEqualTo("UPDATE my_sessions SET payload=?, expires_at=? WHERE session_id=?");
    assertThat(sql.deleteSql()).isEqualTo("DELETE FROM my_sessions WHERE session_id = ?");
  }

  @Test
  void forTable_neverInterpolatesValues() {
    SessionSql sql = SessionSql.forTable(SessionTable.DEFAULT);

    assertThat(sql.insertSql()).contains("VALUES (?, ?, ?)");
    assertThat(sql.existsSql()).endsWith("key = ? AND expiration > ?");
  }
}
