package io.intellixity.dblink.model;

import java.util.Objects;

/**
 * One table, view or collection in a {@link DbSchema}.
 *
 * @param name     table or collection name
 * @param schema   owning schema ("public" for Postgres), {@code null} for Mongo
 * @param kind     relation kind
 * @param rowCount approximate row/document count, {@code null} when the backend has no cheap estimate
 */
public record DbTableInfo(String name, String schema, TableKind kind, Long rowCount) {
  public DbTableInfo {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(kind, "kind");
    if (rowCount != null && rowCount < 0) rowCount = null;
  }
}
