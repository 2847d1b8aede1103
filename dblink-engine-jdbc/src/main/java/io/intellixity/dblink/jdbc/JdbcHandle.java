package io.intellixity.dblink.jdbc;

import io.intellixity.dblink.exec.EngineHandle;

import javax.sql.DataSource;
import java.util.Objects;

/** JDBC-family engine handle: a pooled {@link DataSource} bound to one database. */
public final class JdbcHandle implements EngineHandle<DataSource> {
  private final String id;
  private final DataSource client;
  private final String database;

  public JdbcHandle(String id, DataSource client, String database) {
    this.id = Objects.requireNonNull(id, "id");
    this.client = Objects.requireNonNull(client, "client");
    this.database = (database == null || database.isBlank()) ? null : database;
  }

  @Override public String id() { return id; }
  @Override public DataSource client() { return client; }
  @Override public String namespace() { return database; }

  public String database() { return database; }
}
