package io.intellixity.dblink.manager;

import io.intellixity.dblink.error.ConnectionException;
import io.intellixity.dblink.error.DbException;
import io.intellixity.dblink.error.InvalidArgumentException;
import io.intellixity.dblink.error.NotFoundException;
import io.intellixity.dblink.exec.DatabaseEngine;
import io.intellixity.dblink.model.ConnectionId;
import io.intellixity.dblink.model.ConnectionSpec;
import io.intellixity.dblink.spi.exec.ExecutionBridge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Registry of live engine instances keyed by connection id.
 * <p>
 * Mutations (open, close, eviction) are serialized by one lock; lookups read a concurrent map and
 * never see a half-registered engine. Driver connects and disconnects run outside the lock.
 */
public final class ConnectionManager implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(ConnectionManager.class);

  private final EngineFactories factories;
  private final ExecutionBridge bridge;

  private final ConcurrentHashMap<ConnectionId, DatabaseEngine> engines = new ConcurrentHashMap<>();
  private final ReentrantLock lock = new ReentrantLock();
  private final Set<ConnectionId> opening = new HashSet<>();
  private volatile boolean closed;

  public ConnectionManager(EngineFactories factories, ExecutionBridge bridge) {
    this.factories = Objects.requireNonNull(factories, "factories");
    this.bridge = Objects.requireNonNull(bridge, "bridge");
  }

  /** Opens a connection under a fresh manager-assigned id. */
  public ConnectionId open(ConnectionSpec spec) {
    Objects.requireNonNull(spec, "spec");
    ConnectionId id = reserveFresh();
    connect(id, spec);
    return id;
  }

  /**
   * Opens a connection under a caller-chosen id. The id must not be open or opening; callers
   * {@link #close(ConnectionId)} first to reconnect.
   *
   * @throws InvalidArgumentException unknown backend kind, bad settings, or id in use
   * @throws ConnectionException      the backend could not be reached; nothing is registered
   */
  public DatabaseEngine open(ConnectionId id, ConnectionSpec spec) {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(spec, "spec");
    reserve(id);
    return connect(id, spec);
  }

  /** {@code id} is already reserved in {@code opening}. */
  private DatabaseEngine connect(ConnectionId id, ConnectionSpec spec) {
    DatabaseEngine engine = null;
    try {
      engine = factories.forType(spec.type()).create(id, spec, bridge);
      engine.checkConnectivity(null);
    } catch (InvalidArgumentException | ConnectionException e) {
      abandon(id, engine);
      throw e;
    } catch (DbException e) {
      abandon(id, engine);
      throw new ConnectionException("Failed to connect '" + id + "': " + e.getMessage(), e);
    } catch (RuntimeException e) {
      abandon(id, engine);
      throw e;
    }

    lock.lock();
    try {
      opening.remove(id);
      if (!closed) {
        engines.put(id, engine);
        log.info("dblink.manager opened id={} type={} open={}", id, spec.type(), engines.size());
        return engine;
      }
    } finally {
      lock.unlock();
    }
    engine.disconnect();
    throw new ConnectionException("Connection manager is closed");
  }

  /** @throws NotFoundException unknown or already closed id */
  public DatabaseEngine get(ConnectionId id) {
    DatabaseEngine e = engines.get(Objects.requireNonNull(id, "id"));
    if (e == null) throw new NotFoundException("Unknown connection: " + id);
    return e;
  }

  /**
   * Runs {@code work} against the connection's engine. A fatal {@link ConnectionException} (bad
   * credentials, database gone) evicts the instance before the error is rethrown.
   */
  public <T> T withEngine(ConnectionId id, Function<DatabaseEngine, T> work) {
    DatabaseEngine engine = get(id);
    try {
      return work.apply(engine);
    } catch (ConnectionException e) {
      if (e.fatal()) evict(id, engine, e);
      throw e;
    }
  }

  /** Disconnects and forgets {@code id}. Returns {@code false} when it was not open. */
  public boolean close(ConnectionId id) {
    Objects.requireNonNull(id, "id");
    DatabaseEngine engine;
    lock.lock();
    try {
      engine = engines.remove(id);
    } finally {
      lock.unlock();
    }
    if (engine == null) return false;
    engine.disconnect();
    log.info("dblink.manager closed id={} open={}", id, engines.size());
    return true;
  }

  /** Closes every open connection and refuses later opens. Returns how many were closed. */
  public int closeAll() {
    List<DatabaseEngine> snapshot;
    lock.lock();
    try {
      closed = true;
      snapshot = new ArrayList<>(engines.values());
      engines.clear();
    } finally {
      lock.unlock();
    }
    for (DatabaseEngine e : snapshot) e.disconnect();
    if (!snapshot.isEmpty()) log.info("dblink.manager closed_all count={}", snapshot.size());
    return snapshot.size();
  }

  /**
   * Connects with {@code spec} on a throwaway engine, without registering anything.
   *
   * @throws ConnectionException with the driver's reason when the backend cannot be reached
   */
  public void checkConnection(ConnectionSpec spec) {
    Objects.requireNonNull(spec, "spec");
    ConnectionId probeId = ConnectionIds.next("probe");
    DatabaseEngine engine = factories.forType(spec.type()).create(probeId, spec, bridge);
    try {
      engine.checkConnectivity(null);
    } finally {
      engine.disconnect();
    }
  }

  /** Like {@link #checkConnection(ConnectionSpec)}, reporting failure as {@code false}. */
  public boolean testConnection(ConnectionSpec spec) {
    try {
      checkConnection(spec);
      return true;
    } catch (ConnectionException e) {
      log.debug("dblink.manager test_connection type={} ok=false message={}", spec.type(), e.getMessage());
      return false;
    }
  }

  public Set<ConnectionId> ids() { return Set.copyOf(engines.keySet()); }

  public int size() { return engines.size(); }

  public boolean isClosed() { return closed; }

  @Override
  public void close() {
    closeAll();
  }

  private void reserve(ConnectionId id) {
    lock.lock();
    try {
      if (closed) throw new ConnectionException("Connection manager is closed");
      if (engines.containsKey(id) || !opening.add(id)) {
        throw new InvalidArgumentException("Connection id already in use: " + id);
      }
    } finally {
      lock.unlock();
    }
  }

  /** Skips ids a caller has already taken, open or still opening. */
  private ConnectionId reserveFresh() {
    lock.lock();
    try {
      if (closed) throw new ConnectionException("Connection manager is closed");
      while (true) {
        ConnectionId id = ConnectionIds.next("conn");
        if (!engines.containsKey(id) && opening.add(id)) return id;
      }
    } finally {
      lock.unlock();
    }
  }

  private void abandon(ConnectionId id, DatabaseEngine engine) {
    lock.lock();
    try {
      opening.remove(id);
    } finally {
      lock.unlock();
    }
    if (engine != null) engine.disconnect();
  }

  private void evict(ConnectionId id, DatabaseEngine engine, ConnectionException cause) {
    boolean removed;
    lock.lock();
    try {
      removed = engines.remove(id, engine);
    } finally {
      lock.unlock();
    }
    if (!removed) return;
    log.warn("dblink.manager evicted id={} reason={}", id, cause.getMessage());
    engine.disconnect();
  }
}
