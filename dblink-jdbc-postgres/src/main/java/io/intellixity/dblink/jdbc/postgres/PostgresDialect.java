package io.intellixity.dblink.jdbc.postgres;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zaxxer.hikari.pool.HikariPool;
import io.intellixity.dblink.error.ConnectionException;
import io.intellixity.dblink.error.DbException;
import io.intellixity.dblink.error.DbTimeoutException;
import io.intellixity.dblink.error.DriverException;
import io.intellixity.dblink.error.QuerySyntaxException;
import io.intellixity.dblink.jdbc.JdbcValues;
import io.intellixity.dblink.jdbc.dialect.AbstractJdbcDialect;
import io.intellixity.dblink.model.DbColumnInfo;
import io.intellixity.dblink.model.DbTableInfo;
import io.intellixity.dblink.model.DbType;
import io.intellixity.dblink.model.JsonValues;
import io.intellixity.dblink.model.TableKind;
import org.postgresql.util.PGobject;

import java.math.BigDecimal;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLTransientConnectionException;
import java.util.Set;

/**
 * Postgres dialect: catalog queries, value normalization and SQLState translation.
 * Generic paging and quoting live in {@link AbstractJdbcDialect}.
 */
public final class PostgresDialect extends AbstractJdbcDialect {
  private static final ObjectMapper JSON = new ObjectMapper();

  private static final Set<String> SYNTAX_STATES = Set.of("42601", "42000", "42602", "42622");
  private static final Set<String> CONNECTION_STATES = Set.of("57P01", "57P02", "57P03");

  private static final String LIST_TABLES_SQL = """
      SELECT t.table_schema, t.table_name, t.table_type, c.reltuples::bigint AS row_estimate
      FROM information_schema.tables t
      LEFT JOIN pg_catalog.pg_namespace n ON n.nspname = t.table_schema
      LEFT JOIN pg_catalog.pg_class c ON c.relnamespace = n.oid AND c.relname = t.table_name
      WHERE t.table_schema NOT IN ('pg_catalog', 'information_schema')
      UNION ALL
      SELECT m.schemaname, m.matviewname, 'MATERIALIZED VIEW', c.reltuples::bigint
      FROM pg_catalog.pg_matviews m
      JOIN pg_catalog.pg_namespace n ON n.nspname = m.schemaname
      JOIN pg_catalog.pg_class c ON c.relnamespace = n.oid AND c.relname = m.matviewname
      ORDER BY 1, 2""";

  private static final String TABLE_EXISTS_SQL = """
      SELECT 1
      FROM pg_catalog.pg_class c
      JOIN pg_catalog.pg_namespace n ON n.oid = c.relnamespace
      WHERE n.nspname = COALESCE(CAST(? AS text), current_schema())
        AND c.relname = ?
        AND c.relkind IN ('r', 'v', 'm', 'f', 'p')""";

  private static final String COLUMNS_SQL = """
      WITH target AS (
        SELECT n.nspname AS schema_name, c.relname AS table_name
        FROM pg_catalog.pg_class c
        JOIN pg_catalog.pg_namespace n ON n.oid = c.relnamespace
        WHERE n.nspname = COALESCE(CAST(? AS text), current_schema())
          AND c.relname = ?
      )
      SELECT col.column_name,
             CASE WHEN col.data_type IN ('USER-DEFINED', 'ARRAY') THEN col.udt_name ELSE col.data_type END AS data_type,
             col.is_nullable = 'YES' AS nullable,
             EXISTS (
               SELECT 1
               FROM information_schema.table_constraints tc
               JOIN information_schema.key_column_usage kcu
                 ON kcu.constraint_schema = tc.constraint_schema
                AND kcu.constraint_name = tc.constraint_name
               WHERE tc.constraint_type = 'PRIMARY KEY'
                 AND tc.table_schema = col.table_schema
                 AND tc.table_name = col.table_name
                 AND kcu.column_name = col.column_name
             ) AS is_pk,
             col.column_default
      FROM information_schema.columns col
      JOIN target t ON col.table_schema = t.schema_name AND col.table_name = t.table_name
      ORDER BY col.ordinal_position""";

  @Override public String id() { return "postgres"; }

  @Override public DbType type() { return DbType.POSTGRES; }

  @Override public String listTablesSql() { return LIST_TABLES_SQL; }

  @Override public String tableExistsSql() { return TABLE_EXISTS_SQL; }

  @Override public String columnsSql() { return COLUMNS_SQL; }

  @Override
  public DbTableInfo readTableInfo(ResultSet rs) throws SQLException {
    String schema = rs.getString(1);
    String name = rs.getString(2);
    TableKind kind = tableKind(rs.getString(3));
    long estimate = rs.getLong(4);
    boolean known = !rs.wasNull() && estimate >= 0
        && (kind == TableKind.TABLE || kind == TableKind.MATERIALIZED_VIEW);
    return new DbTableInfo(name, schema, kind, known ? estimate : null);
  }

  @Override
  public DbColumnInfo readColumn(ResultSet rs) throws SQLException {
    return new DbColumnInfo(
        rs.getString(1),
        rs.getString(2),
        rs.getBoolean(3),
        rs.getBoolean(4),
        rs.getString(5));
  }

  static TableKind tableKind(String tableType) {
    if (tableType == null) return TableKind.OTHER;
    return switch (tableType) {
      case "BASE TABLE" -> TableKind.TABLE;
      case "VIEW" -> TableKind.VIEW;
      case "FOREIGN", "FOREIGN TABLE" -> TableKind.FOREIGN_TABLE;
      case "MATERIALIZED VIEW" -> TableKind.MATERIALIZED_VIEW;
      default -> TableKind.OTHER;
    };
  }

  /**
   * Types whose object form maps losslessly go through {@link #normalize}; money, temporal
   * types, uuid and anything unknown use the driver's text rendering.
   */
  @Override
  public JsonNode readValue(ResultSet rs, int column, String typeName) throws SQLException {
    if (usesObjectForm(typeName)) return normalize(rs.getObject(column), typeName);
    return JsonValues.text(rs.getString(column));
  }

  static boolean usesObjectForm(String typeName) {
    if (typeName == null) return false;
    if (typeName.startsWith("_")) return true;
    return switch (typeName) {
      case "bool", "int2", "int4", "int8", "float4", "float8", "numeric", "json", "jsonb", "bytea" -> true;
      default -> false;
    };
  }

  static JsonNode normalize(Object raw, String typeName) throws SQLException {
    if (raw == null) return JsonValues.nullValue();
    if ("numeric".equals(typeName)) {
      // pgjdbc hands back Double.NaN for numeric 'NaN'
      return JsonValues.text(raw instanceof BigDecimal bd ? bd.toPlainString() : String.valueOf(raw));
    }
    if ("json".equals(typeName) || "jsonb".equals(typeName)) {
      String text = (raw instanceof PGobject pg) ? pg.getValue() : String.valueOf(raw);
      if (text == null) return JsonValues.nullValue();
      try {
        return JSON.readTree(text);
      } catch (JsonProcessingException e) {
        return JsonValues.text(text);
      }
    }
    return JdbcValues.fromObject(raw);
  }

  @Override
  public DbException translate(Exception e) {
    if (e instanceof HikariPool.PoolInitializationException pie) {
      Throwable cause = (pie.getCause() != null) ? pie.getCause() : pie;
      return new ConnectionException("Failed to initialize connection pool: " + cause.getMessage(), pie);
    }
    if (e instanceof SQLTransientConnectionException tce) {
      Throwable cause = tce.getCause();
      String reason = (cause != null && cause.getMessage() != null) ? cause.getMessage() : tce.getMessage();
      return new ConnectionException("Connection unavailable: " + reason, tce);
    }
    if (!(e instanceof SQLException se)) return super.translate(e);

    String state = se.getSQLState();
    String message = se.getMessage();
    if (state == null) return new DriverException(message, se);
    if (state.startsWith("28") || "3D000".equals(state)) return new ConnectionException(message, se, true);
    if (state.startsWith("08") || CONNECTION_STATES.contains(state)) return new ConnectionException(message, se);
    if ("57014".equals(state)) return new DbTimeoutException(message, se);
    if (SYNTAX_STATES.contains(state)) return new QuerySyntaxException(message, se);
    return new DriverException(message, state, se);
  }
}
