package io.intellixity.dblink.jdbc.dialect;

import com.fasterxml.jackson.databind.JsonNode;
import io.intellixity.dblink.error.DbException;
import io.intellixity.dblink.error.DriverException;
import io.intellixity.dblink.jdbc.JdbcValues;
import io.intellixity.dblink.jdbc.TableRef;

import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * JDBC-generic dialect base: ANSI quoting, {@code LIMIT/OFFSET} paging, object-based value
 * normalization. Backend dialects override what their driver does differently.
 */
public abstract class AbstractJdbcDialect implements JdbcDialect {
  @Override
  public String quoteIdentifier(String identifier) {
    if (identifier == null) throw new IllegalArgumentException("identifier is null");
    return "\"" + identifier.replace("\"", "\"\"") + "\"";
  }

  @Override
  public String countSql(TableRef ref) {
    return "SELECT COUNT(*) FROM " + qualifiedName(ref);
  }

  @Override
  public String pageSql(TableRef ref) {
    return "SELECT * FROM " + qualifiedName(ref) + " LIMIT ? OFFSET ?";
  }

  @Override
  public String pingSql() {
    return "SELECT 1";
  }

  @Override
  public JsonNode readValue(ResultSet rs, int column, String typeName) throws SQLException {
    return JdbcValues.fromObject(rs.getObject(column));
  }

  @Override
  public DbException translate(Exception e) {
    if (e instanceof SQLException se) {
      return new DriverException(se.getMessage(), se.getSQLState(), se);
    }
    return new DriverException(String.valueOf(e.getMessage()), e);
  }
}
