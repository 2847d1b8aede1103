package io.intellixity.dblink.manager;

import io.intellixity.dblink.error.InvalidArgumentException;
import io.intellixity.dblink.model.DbType;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/** Adapter registry keyed by backend kind. */
public final class EngineFactories {
  private final Map<DbType, EngineFactory> byType;

  private EngineFactories(Map<DbType, EngineFactory> byType) {
    this.byType = byType;
  }

  public static Builder builder() { return new Builder(); }

  public EngineFactory forType(DbType type) {
    Objects.requireNonNull(type, "type");
    EngineFactory f = byType.get(type);
    if (f == null) throw new InvalidArgumentException("No adapter registered for " + type);
    return f;
  }

  public boolean supports(DbType type) { return byType.containsKey(type); }

  public static final class Builder {
    private final Map<DbType, EngineFactory> byType = new EnumMap<>(DbType.class);

    private Builder() {}

    public Builder register(DbType type, EngineFactory factory) {
      byType.put(Objects.requireNonNull(type, "type"), Objects.requireNonNull(factory, "factory"));
      return this;
    }

    public EngineFactories build() {
      return new EngineFactories(new EnumMap<>(byType));
    }
  }
}
