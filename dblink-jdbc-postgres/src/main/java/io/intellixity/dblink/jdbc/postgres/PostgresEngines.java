package io.intellixity.dblink.jdbc.postgres;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.intellixity.dblink.error.InvalidArgumentException;
import io.intellixity.dblink.jdbc.JdbcDatabaseEngine;
import io.intellixity.dblink.jdbc.JdbcHandle;
import io.intellixity.dblink.model.ConnectionId;
import io.intellixity.dblink.model.ConnectionSpec;
import io.intellixity.dblink.model.DbType;
import io.intellixity.dblink.spi.exec.DriverTimeouts;
import io.intellixity.dblink.spi.exec.ExecutionBridge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * Builds Postgres engines: one HikariCP pool per connection id.
 * <p>
 * The pool is created lazily (no connection is attempted here); the caller's connectivity check
 * is the first round trip.
 */
public final class PostgresEngines {
  private static final Logger log = LoggerFactory.getLogger(PostgresEngines.class);

  public static final int DEFAULT_POOL_SIZE = 5;
  public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);

  // Hikari rejects connection timeouts below 250ms.
  private static final Duration MIN_CONNECT_TIMEOUT = Duration.ofMillis(250);

  private static final PostgresDialect DIALECT = new PostgresDialect();

  private PostgresEngines() {}

  public static PostgresDialect dialect() { return DIALECT; }

  public static JdbcDatabaseEngine open(ConnectionId id,
                                        ConnectionSpec spec,
                                        ExecutionBridge bridge,
                                        Duration disconnectGrace,
                                        int maxRows) {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(bridge, "bridge");
    HikariDataSource ds = dataSource(id, spec);
    JdbcHandle handle = new JdbcHandle(id.value(), ds, spec.database());
    log.info("dblink.postgres pool_created handleId={} url={} maxPoolSize={}",
        id, ds.getJdbcUrl(), ds.getMaximumPoolSize());
    return new JdbcDatabaseEngine(handle, DIALECT, bridge, deadline(spec), disconnectGrace, maxRows);
  }

  public static JdbcDatabaseEngine open(ConnectionId id, ConnectionSpec spec, ExecutionBridge bridge) {
    return open(id, spec, bridge, null, JdbcDatabaseEngine.DEFAULT_MAX_ROWS);
  }

  static HikariDataSource dataSource(ConnectionId id, ConnectionSpec spec) {
    HikariConfig hc = config(id, spec);
    try {
      return new HikariDataSource(hc);
    } catch (RuntimeException e) {
      throw new InvalidArgumentException("Invalid Postgres connection settings: " + e.getMessage(), e);
    }
  }

  static HikariConfig config(ConnectionId id, ConnectionSpec spec) {
    Objects.requireNonNull(spec, "spec");
    if (spec.type() != DbType.POSTGRES) {
      throw new InvalidArgumentException("Not a Postgres connection spec: " + spec.type());
    }
    String url = spec.connectionUrl();
    if (!url.startsWith("jdbc:postgresql:")) {
      throw new InvalidArgumentException("Postgres URL must start with 'jdbc:postgresql:'");
    }
    int poolSize = (spec.maxPoolSize() == null) ? DEFAULT_POOL_SIZE : spec.maxPoolSize();
    if (poolSize <= 0) throw new InvalidArgumentException("maxPoolSize must be > 0: " + poolSize);

    Duration connectTimeout = connectTimeout(spec);

    HikariConfig hc = new HikariConfig();
    hc.setPoolName("dblink-" + id.value());
    hc.setJdbcUrl(url);
    if (!spec.user().isEmpty()) hc.setUsername(spec.user());
    if (!spec.password().isEmpty()) hc.setPassword(spec.password());
    hc.setMaximumPoolSize(poolSize);
    hc.setMinimumIdle(Math.min(1, poolSize));
    hc.setConnectionTimeout(connectTimeout.toMillis());
    hc.setInitializationFailTimeout(-1);
    return hc;
  }

  /** Pool checkout timeout; shorter than the operation deadline so the pool reports first. */
  static Duration connectTimeout(ConnectionSpec spec) {
    if (spec.operationTimeout() == null) return DEFAULT_CONNECT_TIMEOUT;
    return DriverTimeouts.connectTimeout(spec.operationTimeout(), MIN_CONNECT_TIMEOUT);
  }

  /** Engine default deadline; {@code null} leaves the bridge default. */
  static Duration deadline(ConnectionSpec spec) {
    if (spec.operationTimeout() == null) return null;
    return DriverTimeouts.deadline(spec.operationTimeout(), connectTimeout(spec));
  }
}
