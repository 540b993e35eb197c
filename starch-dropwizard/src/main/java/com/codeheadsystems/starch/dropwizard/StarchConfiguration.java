package com.codeheadsystems.starch.dropwizard;

import com.codeheadsystems.starch.serializer.SerializerConfig;
import com.codeheadsystems.starch.store.jdbc.SessionTable;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.dropwizard.core.Configuration;
import io.dropwizard.db.DataSourceFactory;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

/**
 * Dropwizard configuration for the JDBC session store.
 * <p>
 * The session table must already exist; the store never creates or migrates schema. A
 * minimal table needs a unique string key column, a binary data column and an integer
 * expiration column holding epoch seconds.
 */
public class StarchConfiguration extends Configuration {

  /**
   * Connection settings for the database holding the session table.
   */
  @Valid
  @NotNull
  private DataSourceFactory database = new DataSourceFactory();

  /**
   * Session table name, optionally schema-qualified.
   */
  @NotEmpty
  private String table = SessionTable.DEFAULT.table();

  /**
   * Column holding the session key.
   */
  @NotEmpty
  private String keyColumn = SessionTable.DEFAULT.keyColumn();

  /**
   * Column holding the serialized payload.
   */
  @NotEmpty
  private String dataColumn = SessionTable.DEFAULT.dataColumn();

  /**
   * Column holding the expiration as epoch seconds.
   */
  @NotEmpty
  private String expirationColumn = SessionTable.DEFAULT.expirationColumn();

  /**
   * Payload codec.  {@code codec} is one of {@code JSON} (default), {@code CBOR}, {@code SMILE}.
   */
  @NotNull
  private SerializerConfig serializer = SerializerConfig.DEFAULT;

  /**
   * Retry an insert rejected by the key's unique constraint as an update.
   */
  private boolean insertConflictFallback = true;

  /**
   * Gets database.
   *
   * @return the database
   */
  @JsonProperty
  public DataSourceFactory getDatabase() {
    return database;
  }

  /**
   * Sets database.
   *
   * @param database the database
   */
  @JsonProperty
  public void setDatabase(DataSourceFactory database) {
    this.database = database;
  }

  /**
   * Gets table.
   *
   * @return the table
   */
  @JsonProperty
  public String getTable() {
    return table;
  }

  /**
   * Sets table.
   *
   * @param table the table
   */
  @JsonProperty
  public void setTable(String table) {
    this.table = table;
  }

  /**
   * Gets key column.
   *
   * @return the key column
   */
  @JsonProperty
  public String getKeyColumn() {
    return keyColumn;
  }

  /**
   * Sets key column.
   *
   * @param keyColumn the key column
   */
  @JsonProperty
  public void setKeyColumn(String keyColumn) {
    this.keyColumn = keyColumn;
  }

  /**
   * Gets data column.
   *
   * @return the data column
   */
  @JsonProperty
  public String getDataColumn() {
    return dataColumn;
  }

  /**
   * Sets data column.
   *
   * @param dataColumn the data column
   */
  @JsonProperty
  public void setDataColumn(String dataColumn) {
    this.dataColumn = dataColumn;
  }

  /**
   * Gets expiration column.
   *
   * @return the expiration column
   */
  @JsonProperty
  public String getExpirationColumn() {
    return expirationColumn;
  }

  /**
   * Sets expiration column.
   *
   * @param expirationColumn the expiration column
   */
  @JsonProperty
  public void setExpirationColumn(String expirationColumn) {
    this.expirationColumn = expirationColumn;
  }

  /**
   * Gets serializer.
   *
   * @return the serializer
   */
  @JsonProperty
  public SerializerConfig getSerializer() {
    return serializer;
  }

  /**
   * Sets serializer.
   *
   * @param serializer the serializer
   */
  @JsonProperty
  public void setSerializer(SerializerConfig serializer) {
    this.serializer = serializer;
  }

  /**
   * Is insert conflict fallback boolean.
   *
   * @return the boolean
   */
  @JsonProperty
  public boolean isInsertConflictFallback() {
    return insertConflictFallback;
  }

  /**
   * Sets insert conflict fallback.
   *
   * @param insertConflictFallback the insert conflict fallback
   */
  @JsonProperty
  public void setInsertConflictFallback(boolean insertConflictFallback) {
    this.insertConflictFallback = insertConflictFallback;
  }

  /**
   * The configured table and column names.
   *
   * @return the session table
   */
  public SessionTable sessionTable() {
    return new SessionTable(table, keyColumn, dataColumn, expirationColumn);
  }
}
