package io.intellixity.dblink.jdbc;

import com.fasterxml.jackson.databind.JsonNode;
import io.intellixity.dblink.jdbc.dialect.JdbcDialect;
import io.intellixity.dblink.model.DbColumnInfo;

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/** Reads a {@link ResultSet} into normalized columns and rows. */
final class JdbcRows {
  private JdbcRows() {}

  record Page(List<DbColumnInfo> columns, List<List<JsonNode>> rows, boolean truncated) {}

  /** Column metadata comes from the result set itself, so empty results still carry columns. */
  static Page read(ResultSet rs, JdbcDialect dialect, int maxRows) throws SQLException {
    ResultSetMetaData md = rs.getMetaData();
    int n = md.getColumnCount();
    List<DbColumnInfo> columns = new ArrayList<>(n);
    String[] typeNames = new String[n];
    for (int i = 1; i <= n; i++) {
      typeNames[i - 1] = md.getColumnTypeName(i);
      columns.add(new DbColumnInfo(md.getColumnLabel(i), typeNames[i - 1], nullable(md.isNullable(i)), false, null));
    }

    List<List<JsonNode>> rows = new ArrayList<>();
    boolean truncated = false;
    while (rs.next()) {
      if (rows.size() >= maxRows) {
        truncated = true;
        break;
      }
      List<JsonNode> row = new ArrayList<>(n);
      for (int i = 1; i <= n; i++) row.add(dialect.readValue(rs, i, typeNames[i - 1]));
      rows.add(row);
    }
    return new Page(columns, rows, truncated);
  }

  private static Boolean nullable(int flag) {
    return switch (flag) {
      case ResultSetMetaData.columnNullable -> Boolean.TRUE;
      case ResultSetMetaData.columnNoNulls -> Boolean.FALSE;
      default -> null;
    };
  }
}
