package io.intellixity.dblink.exec;

import io.intellixity.dblink.model.DbQueryResult;
import io.intellixity.dblink.model.DbSchema;
import io.intellixity.dblink.model.DbTableStructure;
import io.intellixity.dblink.model.DbType;

import java.time.Duration;

/**
 * Capability every backend adapter implements.
 * <p>
 * Each operation exists in a form taking a deadline; {@code null} means the engine's default
 * timeout. All failures are {@link io.intellixity.dblink.error.DbException} subclasses, never raw
 * driver exceptions.
 */
public interface DatabaseEngine {
  DbType type();

  EngineHandle<?> handle();

  /** Tables, views and collections visible through this connection. */
  DbSchema getSchema(Duration timeout);

  /**
   * One page of rows from {@code table}. An {@code offset} past the end yields zero rows.
   *
   * @throws io.intellixity.dblink.error.NotFoundException        unknown table/collection
   * @throws io.intellixity.dblink.error.InvalidArgumentException negative offset or limit
   */
  DbQueryResult getTableData(String table, long offset, long limit, Duration timeout);

  DbTableStructure getTableStructure(String table, Duration timeout);

  /**
   * Runs backend-native query text: SQL for relational backends, a JSON command document for
   * document stores. Statements that return no rows give an empty, well-formed result.
   */
  DbQueryResult executeQuery(String query, Duration timeout);

  /**
   * Like {@link #executeQuery(String, Duration)}, with the table the caller currently has
   * selected. Document stores run a bare filter document against it; relational backends
   * ignore it.
   */
  DbQueryResult executeQuery(String query, String contextTable, Duration timeout);

  /**
   * Cheapest round trip to the backend. Returns {@code false} for any server-side or network
   * problem; throws only for configuration errors.
   */
  boolean testConnection(Duration timeout);

  /**
   * Same round trip as {@link #testConnection(Duration)}, but failures are thrown as
   * {@link io.intellixity.dblink.error.ConnectionException} with the driver's reason.
   */
  void checkConnectivity(Duration timeout);

  /** Releases native resources. Idempotent. */
  void disconnect();

  boolean isOpen();

  default DbSchema getSchema() { return getSchema(null); }

  default DbQueryResult getTableData(String table, long offset, long limit) {
    return getTableData(table, offset, limit, null);
  }

  default DbTableStructure getTableStructure(String table) { return getTableStructure(table, null); }

  default DbQueryResult executeQuery(String query) { return executeQuery(query, null); }

  default boolean testConnection() { return testConnection(null); }
}
