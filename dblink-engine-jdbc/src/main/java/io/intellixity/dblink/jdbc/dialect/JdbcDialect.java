package io.intellixity.dblink.jdbc.dialect;

import com.fasterxml.jackson.databind.JsonNode;
import io.intellixity.dblink.error.DbException;
import io.intellixity.dblink.jdbc.TableRef;
import io.intellixity.dblink.model.DbColumnInfo;
import io.intellixity.dblink.model.DbTableInfo;
import io.intellixity.dblink.model.DbType;

import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * Backend-specific SQL and type knowledge for {@link io.intellixity.dblink.jdbc.JdbcDatabaseEngine}.
 * <p>
 * Catalog statements ({@link #tableExistsSql()}, {@link #columnsSql()}) take exactly two
 * parameters: the schema (may be {@code null}, meaning the current schema) and the relation name.
 */
public interface JdbcDialect {
  /** Stable identifier used in logs ("postgres"). */
  String id();

  DbType type();

  String quoteIdentifier(String identifier);

  /** Quoted, optionally schema-qualified relation name. */
  default String qualifiedName(TableRef ref) {
    return ref.qualified()
        ? quoteIdentifier(ref.schema()) + "." + quoteIdentifier(ref.name())
        : quoteIdentifier(ref.name());
  }

  String listTablesSql();

  DbTableInfo readTableInfo(ResultSet rs) throws SQLException;

  /** Returns at least one row iff the relation exists. */
  String tableExistsSql();

  String columnsSql();

  DbColumnInfo readColumn(ResultSet rs) throws SQLException;

  String countSql(TableRef ref);

  /** Page query with two parameters: limit, then offset. */
  String pageSql(TableRef ref);

  String pingSql();

  /** Normalized value of column {@code column} (1-based) of the current row. */
  JsonNode readValue(ResultSet rs, int column, String typeName) throws SQLException;

  /** Maps a native failure (usually a {@link SQLException}) to the caller-facing error kind. */
  DbException translate(Exception e);
}
