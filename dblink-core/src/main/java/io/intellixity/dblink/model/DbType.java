package io.intellixity.dblink.model;

import java.util.Locale;

/** Backend kinds this layer can open connections to. */
public enum DbType {
  POSTGRES("PostgreSQL", 5432),
  MONGODB("MongoDB", 27017);

  private final String displayName;
  private final int defaultPort;

  DbType(String displayName, int defaultPort) {
    this.displayName = displayName;
    this.defaultPort = defaultPort;
  }

  public String displayName() { return displayName; }
  public int defaultPort() { return defaultPort; }

  /**
   * Parses a backend tag as callers send it ("postgres", "PostgreSQL", "mongo", "MongoDB").
   *
   * @throws IllegalArgumentException for an unknown tag
   */
  public static DbType fromTag(String tag) {
    if (tag == null || tag.isBlank()) throw new IllegalArgumentException("Database type tag is blank");
    return switch (tag.trim().toLowerCase(Locale.ROOT)) {
      case "postgres", "postgresql", "pg" -> POSTGRES;
      case "mongo", "mongodb" -> MONGODB;
      default -> throw new IllegalArgumentException("Unknown database type: " + tag);
    };
  }

  @Override
  public String toString() { return displayName; }
}
