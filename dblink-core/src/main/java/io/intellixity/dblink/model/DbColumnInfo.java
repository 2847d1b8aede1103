package io.intellixity.dblink.model;

import java.util.Objects;

/**
 * Column (relational) or field (document) descriptor.
 *
 * @param name         column or field name
 * @param dataType     declared type as a normalized string ("integer", "text", "int32 | string")
 * @param nullable     nullability, {@code null} when the backend does not say
 * @param primaryKey   whether the column is part of the primary key
 * @param defaultValue default expression, if any
 */
public record DbColumnInfo(String name, String dataType, Boolean nullable, boolean primaryKey, String defaultValue) {
  public DbColumnInfo {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(dataType, "dataType");
  }

  /** Result-set column with only a name and type known. */
  public static DbColumnInfo of(String name, String dataType) {
    return new DbColumnInfo(name, dataType, null, false, null);
  }
}
