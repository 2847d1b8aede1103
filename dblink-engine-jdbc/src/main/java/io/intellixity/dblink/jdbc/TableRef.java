package io.intellixity.dblink.jdbc;

import java.util.Objects;

/**
 * Table name as a caller gave it, split into an optional schema and the relation name.
 *
 * @param schema schema name, {@code null} to resolve against the session's current schema
 * @param name   relation name
 */
public record TableRef(String schema, String name) {
  public TableRef {
    Objects.requireNonNull(name, "name");
    if (schema != null && schema.isBlank()) schema = null;
  }

  /**
   * Splits {@code "schema.table"}; anything else (no dot, several dots, leading/trailing dot)
   * is taken as an unqualified name.
   */
  public static TableRef parse(String table) {
    Objects.requireNonNull(table, "table");
    int dot = table.indexOf('.');
    if (dot <= 0 || dot == table.length() - 1 || table.indexOf('.', dot + 1) >= 0) {
      return new TableRef(null, table);
    }
    return new TableRef(table.substring(0, dot), table.substring(dot + 1));
  }

  public boolean qualified() { return schema != null; }
}
