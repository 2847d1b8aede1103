package io.intellixity.dblink.model;

import java.util.List;
import java.util.Objects;

public record DbTableStructure(String tableName, List<DbColumnInfo> columns) {
  public DbTableStructure {
    Objects.requireNonNull(tableName, "tableName");
    columns = (columns == null) ? List.of() : List.copyOf(columns);
  }
}
