package io.intellixity.dblink.mongo;

import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.MongoCredential;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import io.intellixity.dblink.error.InvalidArgumentException;
import io.intellixity.dblink.model.ConnectionId;
import io.intellixity.dblink.model.ConnectionSpec;
import io.intellixity.dblink.model.DbType;
import io.intellixity.dblink.spi.exec.DriverTimeouts;
import io.intellixity.dblink.spi.exec.ExecutionBridge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Builds Mongo engines: one {@link MongoClient} per connection id. Client creation does not
 * contact the server; the caller's connectivity check is the first round trip.
 */
public final class MongoEngines {
  private static final Logger log = LoggerFactory.getLogger(MongoEngines.class);

  public static final Duration DEFAULT_SERVER_SELECTION_TIMEOUT = Duration.ofSeconds(10);
  public static final String DEFAULT_DATABASE = "test";

  private MongoEngines() {}

  public static MongoDatabaseEngine open(ConnectionId id,
                                         ConnectionSpec spec,
                                         ExecutionBridge bridge,
                                         Duration disconnectGrace,
                                         int maxRows,
                                         int sampleSize) {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(bridge, "bridge");
    ConnectionString cs = connectionString(spec);
    MongoClientSettings settings = settings(id, spec, cs);
    String database = database(spec, cs);

    MongoClient client;
    try {
      client = MongoClients.create(settings);
    } catch (IllegalArgumentException e) {
      throw new InvalidArgumentException("Invalid MongoDB connection settings: " + e.getMessage(), e);
    }
    log.info("dblink.mongo client_created handleId={} hosts={} database={}", id, cs.getHosts(), database);
    MongoHandle handle = new MongoHandle(id.value(), client, database);
    Duration deadline = (spec.operationTimeout() == null)
        ? null
        : DriverTimeouts.deadline(spec.operationTimeout(), selectionTimeout(spec));
    return new MongoDatabaseEngine(handle, bridge, deadline, disconnectGrace, maxRows, sampleSize);
  }

  public static MongoDatabaseEngine open(ConnectionId id, ConnectionSpec spec, ExecutionBridge bridge) {
    return open(id, spec, bridge, null, MongoDatabaseEngine.DEFAULT_MAX_ROWS, MongoDatabaseEngine.DEFAULT_SAMPLE_SIZE);
  }

  static ConnectionString connectionString(ConnectionSpec spec) {
    Objects.requireNonNull(spec, "spec");
    if (spec.type() != DbType.MONGODB) {
      throw new InvalidArgumentException("Not a MongoDB connection spec: " + spec.type());
    }
    try {
      return new ConnectionString(spec.connectionUrl());
    } catch (IllegalArgumentException e) {
      throw new InvalidArgumentException("Invalid MongoDB connection string: " + e.getMessage(), e);
    }
  }

  static MongoClientSettings settings(ConnectionId id, ConnectionSpec spec, ConnectionString cs) {
    long selectionMs = selectionTimeout(spec).toMillis();

    MongoClientSettings.Builder b = MongoClientSettings.builder()
        .applyConnectionString(cs)
        .applicationName("dblink-" + id.value())
        .applyToClusterSettings(c -> c.serverSelectionTimeout(selectionMs, TimeUnit.MILLISECONDS))
        .applyToSocketSettings(s -> s.connectTimeout((int) Math.min(selectionMs, Integer.MAX_VALUE), TimeUnit.MILLISECONDS));

    if (spec.maxPoolSize() != null) {
      int size = spec.maxPoolSize();
      if (size <= 0) throw new InvalidArgumentException("maxPoolSize must be > 0: " + size);
      b.applyToConnectionPoolSettings(p -> p.maxSize(size));
    }

    // An explicit URL without credentials still honours the separately supplied user.
    if (cs.getCredential() == null && !spec.user().isEmpty()) {
      String source = (cs.getDatabase() != null) ? cs.getDatabase() : "admin";
      b.credential(MongoCredential.createCredential(spec.user(), source, spec.password().toCharArray()));
    }
    return b.build();
  }

  /** Server selection gives up before the operation deadline, so it reports as a connection failure. */
  static Duration selectionTimeout(ConnectionSpec spec) {
    if (spec.operationTimeout() == null) return DEFAULT_SERVER_SELECTION_TIMEOUT;
    return DriverTimeouts.connectTimeout(spec.operationTimeout(), null);
  }

  static String database(ConnectionSpec spec, ConnectionString cs) {
    if (spec.database() != null && !spec.database().isBlank()) return spec.database();
    if (cs.getDatabase() != null && !cs.getDatabase().isBlank()) return cs.getDatabase();
    return DEFAULT_DATABASE;
  }
}
