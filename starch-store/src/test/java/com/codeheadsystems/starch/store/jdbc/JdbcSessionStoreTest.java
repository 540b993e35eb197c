package com.codeheadsystems.starch.store.jdbc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.AdditionalMatchers.aryEq;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.codeheadsystems.starch.exceptions.SerializationException;
import com.codeheadsystems.starch.exceptions.SessionStoreException;
import com.codeheadsystems.starch.serializer.JacksonSerializer;
import com.codeheadsystems.starch.serializer.Serializer;
import com.codeheadsystems.starch.serializer.SerializerConfig;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class JdbcSessionStoreTest {

  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
  private static final long NOW_SECONDS = NOW.getEpochSecond();
  private static final SessionSql SQL = SessionSql.forTable(SessionTable.DEFAULT);
  private static final byte[] USER_42 = "{\"user_id\":42}".getBytes(StandardCharsets.UTF_8);

  @Mock private Connection connection;
  @Mock private PreparedStatement existsStatement;
  @Mock private PreparedStatement insertStatement;
  @Mock private PreparedStatement updateStatement;
  @Mock private PreparedStatement selectStatement;
  @Mock private PreparedStatement deleteStatement;
  @Mock private ResultSet resultSet;

  private JdbcSessionStore store;

  @BeforeEach
  void setUp() {
    store = JdbcSessionStore.builder()
        .connection(connection)
        .clock(Clock.fixed(NOW, ZoneOffset.UTC))
        .build();
  }

  private void givenLiveRow(boolean live) throws SQLException {
    when(connection.prepareStatement(SQL.existsSql())).thenReturn(existsStatement);
    when(existsStatement.executeQuery()).thenReturn(resultSet);
    when(resultSet.next()).thenReturn(live);
  }

  @Test
  void set_newKey_insertsKeyDataAndExpiration() throws SQLException {
    givenLiveRow(false);
    when(connection.prepareStatement(SQL.insertSql())).thenReturn(insertStatement);
    when(insertStatement.executeUpdate()).thenReturn(1);

    store.set("abc", Map.of("user_id", 42), 3600);

    verify(existsStatement).setString(1, "abc");
    verify(existsStatement).setLong(2, NOW_SECONDS);
    verify(insertStatement).setString(1, "abc");
    verify(insertStatement).setBytes(eq(2), aryEq(USER_42));
    verify(insertStatement).setLong(3, NOW_SECONDS + 3600);
    verify(connection, never()).prepareStatement(SQL.updateSql());
  }

  @Test
  void set_liveKey_updatesDataAndExpiration() throws SQLException {
    givenLiveRow(true);
    when(connection.prepareStatement(SQL.updateSql())).thenReturn(updateStatement);
    when(updateStatement.executeUpdate()).thenReturn(1);

    store.set("abc", Map.of("user_id", 42), 60);

    verify(updateStatement).setBytes(eq(1), aryEq(USER_42));
    verify(updateStatement).setLong(2, NOW_SECONDS + 60);
    verify(updateStatement).setString(3, "abc");
    verify(connection, never()).prepareStatement(SQL.insertSql());
  }

  @Test
  void set_rowRemovedBetweenCheckAndUpdate_inserts() throws SQLException {
    givenLiveRow(true);
    when(connection.prepareStatement(SQL.updateSql())).thenReturn(updateStatement);
    when(updateStatement.executeUpdate()).thenReturn(0);
    when(connection.prepareStatement(SQL.insertSql())).thenReturn(insertStatement);
    when(insertStatement.executeUpdate()).thenReturn(1);

    store.set("abc", Map.of("user_id", 42), 60);

    verify(insertStatement).setString(1, "abc");
    verify(insertStatement).setLong(3, NOW_SECONDS + 60);
  }

  @Test
  void set_insertConflict_retriesAsUpdate() throws SQLException {
    givenLiveRow(false);
    when(connection.prepareStatement(SQL.insertSql())).thenReturn(insertStatement);
    when(insertStatement.executeUpdate())
        .thenThrow(new SQLIntegrityConstraintViolationException("duplicate key", "23505"));
    when(connection.prepareStatement(SQL.updateSql())).thenReturn(updateStatement);
    when(updateStatement.executeUpdate()).thenReturn(1);

    store.set("abc", Map.of("user_id", 42), 60);

    verify(updateStatement).setString(3, "abc");
  }

  @Test
  void set_insertConflictBySqlStateOnly_retriesAsUpdate() throws SQLException {
    givenLiveRow(false);
    when(connection.prepareStatement(SQL.insertSql())).thenReturn(insertStatement);
    when(insertStatement.executeUpdate()).thenThrow(new SQLException("unique violation", "23000"));
    when(connection.prepareStatement(SQL.updateSql())).thenReturn(updateStatement);
    when(updateStatement.executeUpdate()).thenReturn(1);

    store.set("abc", Map.of("user_id", 42), 60);

    verify(updateStatement).setBytes(eq(1), aryEq(USER_42));
  }

  @Test
  void set_otherInsertFailure_propagatesOriginalCause() throws SQLException {
    SQLException failure = new SQLException("connection reset", "08006");
    givenLiveRow(false);
    when(connection.prepareStatement(SQL.insertSql())).thenReturn(insertStatement);
    when(insertStatement.executeUpdate()).thenThrow(failure);

    assertThatThrownBy(() -> store.set("abc", Map.of("user_id", 42), 60))
        .isInstanceOf(SessionStoreException.class)
        .hasCauseReference(failure);
    verify(connection, never()).prepareStatement(SQL.updateSql());
  }

  @Test
  void set_unserializableValue_neverTouchesDatabase() {
    assertThatThrownBy(() -> store.set("abc", Map.of("bad", new Object()), 60))
        .isInstanceOf(SerializationException.class);

    verifyNoInteractions(connection);
  }

  @Test
  void get_liveRow_deserializesData() throws SQLException {
    when(connection.prepareStatement(SQL.selectSql())).thenReturn(selectStatement);
    when(selectStatement.executeQuery()).thenReturn(resultSet);
    when(resultSet.next()).thenReturn(true);
    when(resultSet.getBytes(1)).thenReturn(USER_42);

    assertThat(store.get("abc")).contains(Map.of("user_id", 42));
    verify(selectStatement).setString(1, "abc");
    verify(selectStatement).setLong(2, NOW_SECONDS);
    verify(resultSet).close();
  }

  @Test
  void get_noRow_returnsEmpty() throws SQLException {
    when(connection.prepareStatement(SQL.selectSql())).thenReturn(selectStatement);
    when(selectStatement.executeQuery()).thenReturn(resultSet);
    when(resultSet.next()).thenReturn(false);

    assertThat(store.get("abc")).isEmpty();
  }

  @Test
  void get_reusesPreparedStatement() throws SQLException {
    when(connection.prepareStatement(SQL.selectSql())).thenReturn(selectStatement);
    when(selectStatement.executeQuery()).thenReturn(resultSet);
    when(resultSet.next()).thenReturn(false);

    store.get("a");
    store.get("b");

    verify(connection, times(1)).prepareStatement(anyString());
    verify(selectStatement, times(2)).clearParameters();
  }

  @Test
  void remove_deletesByKeyWithoutCheckingExistence() throws SQLException {
    when(connection.prepareStatement(SQL.deleteSql())).thenReturn(deleteStatement);
    when(deleteStatement.executeUpdate()).thenReturn(0);

    store.remove("abc");

    verify(deleteStatement).setString(1, "abc");
    verify(connection, never()).prepareStatement(SQL.existsSql());
  }

  @Test
  void close_closesStatementsButNotCallerConnection() throws SQLException {
    when(connection.prepareStatement(SQL.deleteSql())).thenReturn(deleteStatement);
    store.remove("abc");

    store.close();

    verify(deleteStatement).close();
    verify(connection, never()).close();
  }

  // ── Builder ──────────────────────────────────────────────────────────────

  @Test
  void builder_defaults() {
    assertThat(store.sessionTable()).isEqualTo(SessionTable.DEFAULT);
    assertThat(store.sql()).isEqualTo(SQL);
    assertThat(store.serializer()).isInstanceOf(JacksonSerializer.class);
    assertThat(((JacksonSerializer) store.serializer()).name()).isEqualTo("JSON");
  }

  @Test
  void builder_serializerByNameOrConfig() {
    JdbcSessionStore byName = JdbcSessionStore.builder().connection(connection).serializer("smile").build();
    JdbcSessionStore byConfig = JdbcSessionStore.builder().connection(connection)
        .serializer(new SerializerConfig("cbor", true, false)).build();

    assertThat(((JacksonSerializer) byName.serializer()).name()).isEqualTo("SMILE");
    assertThat(((JacksonSerializer) byConfig.serializer()).name()).isEqualTo("CBOR");
  }

  @Test
  void builder_serializerInstance_isUsedAsIs(@Mock Serializer serializer) {
    JdbcSessionStore custom = JdbcSessionStore.builder().connection(connection).serializer(serializer).build();

    assertThat(custom.serializer()).isSameAs(serializer);
  }

  @Test
  void builder_columnNames_flowIntoSql() {
    JdbcSessionStore custom = JdbcSessionStore.builder()
        .connection(connection)
        .table("web.my_sessions")
        .keyColumn("id")
        .dataColumn("payload")
        .expirationColumn("expires")
        .build();

    assertThat(custom.sql().selectSql())
        .isEqualTo("SELECT payload FROM web.my_sessions WHERE id = ? AND expires > ?");
  }

  @Test
  void builder_withoutDatabase_throws() {
    assertThatThrownBy(() -> JdbcSessionStore.builder().build())
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("database source is required");
  }

  @Test
  void builder_twoDatabases_throws() {
    JdbcSessionStore.Builder builder = JdbcSessionStore.builder().connection(connection);

    assertThatThrownBy(() -> builder.connectionParameters(ConnectionParameters.of("jdbc:derby:x", null, null)))
        .isInstanceOf(IllegalStateException.class);
  }

  @Test
  void builder_invalidColumnName_throws() {
    assertThatThrownBy(() -> JdbcSessionStore.builder().keyColumn("key; DROP TABLE sessions"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("keyColumn");
  }

  @Test
  void operations_emptyKey_neverTouchConnection() {
    assertThatThrownBy(() -> store.get("")).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> store.remove("")).isInstanceOf(IllegalArgumentException.class);
    verifyNoInteractions(connection);
  }

  @Test
  void set_maximumTtl_bindsSaturatedExpiration() throws SQLException {
    givenLiveRow(false);
    when(connection.prepareStatement(SQL.insertSql())).thenReturn(insertStatement);
    when(insertStatement.executeUpdate()).thenReturn(1);

    store.set("abc", Map.of("user_id", 42), Long.MAX_VALUE);

    verify(insertStatement).setLong(3, Long.MAX_VALUE);
  }
}
