package io.intellixity.dblink.model;

import java.util.List;
import java.util.Optional;

/** Ordered list of the tables/collections visible through a connection. */
public record DbSchema(List<DbTableInfo> tables) {
  public DbSchema {
    tables = (tables == null) ? List.of() : List.copyOf(tables);
  }

  public Optional<DbTableInfo> find(String name) {
    for (DbTableInfo t : tables) {
      if (t.name().equals(name)) return Optional.of(t);
    }
    return Optional.empty();
  }
}
