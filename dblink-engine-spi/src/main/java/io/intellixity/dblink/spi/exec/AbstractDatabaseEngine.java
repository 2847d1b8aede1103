package io.intellixity.dblink.spi.exec;

import io.intellixity.dblink.error.ConnectionException;
import io.intellixity.dblink.error.DbException;
import io.intellixity.dblink.error.InvalidArgumentException;
import io.intellixity.dblink.exec.DatabaseEngine;
import io.intellixity.dblink.exec.EngineHandle;
import io.intellixity.dblink.model.DbQueryResult;
import io.intellixity.dblink.model.DbSchema;
import io.intellixity.dblink.model.DbTableStructure;
import io.intellixity.dblink.model.DbType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * Template-method base for backend adapters.
 * <p>
 * Responsibilities:
 * <ul>
 *   <li>argument validation shared by every backend</li>
 *   <li>running each driver call on the shared {@link ExecutionBridge} with a deadline</li>
 *   <li>translating native failures through {@link #translate(Exception)}</li>
 *   <li>the disconnect policy: once {@link #disconnect()} starts, new operations fail with
 *   {@link ConnectionException}, and disconnect waits (up to a grace period) for running ones</li>
 * </ul>
 * Subclasses implement the {@code fetch*}/{@code runQuery}/{@code ping}/{@code closeClient} hooks,
 * which are always invoked on a bridge worker thread.
 */
public abstract class AbstractDatabaseEngine<H extends EngineHandle<?>> implements DatabaseEngine {
  private static final Logger log = LoggerFactory.getLogger(AbstractDatabaseEngine.class);

  public static final Duration DEFAULT_DISCONNECT_GRACE = Duration.ofSeconds(30);

  private final DbType type;
  private final H handle;
  private final ExecutionBridge bridge;
  private final Duration defaultTimeout;
  private final Duration disconnectGrace;
  private final InFlightGuard guard = new InFlightGuard();

  protected AbstractDatabaseEngine(DbType type,
                                   H handle,
                                   ExecutionBridge bridge,
                                   Duration defaultTimeout,
                                   Duration disconnectGrace) {
    this.type = Objects.requireNonNull(type, "type");
    this.handle = Objects.requireNonNull(handle, "handle");
    this.bridge = Objects.requireNonNull(bridge, "bridge");
    this.defaultTimeout = defaultTimeout;
    this.disconnectGrace = (disconnectGrace == null) ? DEFAULT_DISCONNECT_GRACE : disconnectGrace;
  }

  protected AbstractDatabaseEngine(DbType type, H handle, ExecutionBridge bridge, Duration defaultTimeout) {
    this(type, handle, bridge, defaultTimeout, DEFAULT_DISCONNECT_GRACE);
  }

  // --- Backend-specific hooks (run on a bridge worker) ---

  protected abstract DbSchema fetchSchema() throws Exception;

  /** {@code table} is non-blank, {@code offset} and {@code limit} are non-negative. */
  protected abstract DbQueryResult fetchTableData(String table, long offset, long limit) throws Exception;

  protected abstract DbTableStructure fetchTableStructure(String table) throws Exception;

  /** {@code contextTable} is the caller's selected table, or {@code null}. */
  protected abstract DbQueryResult runQuery(String query, String contextTable) throws Exception;

  /** Cheapest round trip; throws on any failure. */
  protected abstract void ping() throws Exception;

  /** Releases the native client. Called once. */
  protected abstract void closeClient() throws Exception;

  /** Maps a native failure to the caller-facing error kind. Never sees {@link DbException}s. */
  protected abstract DbException translate(Exception e);

  // --- DatabaseEngine ---

  @Override
  public final DbType type() { return type; }

  @Override
  public final H handle() { return handle; }

  @Override
  public final boolean isOpen() { return !guard.closing(); }

  @Override
  public final DbSchema getSchema(Duration timeout) {
    return call("getSchema", timeout, this::fetchSchema);
  }

  @Override
  public final DbQueryResult getTableData(String table, long offset, long limit, Duration timeout) {
    String t = requireTable(table);
    if (offset < 0) throw new InvalidArgumentException("offset must be >= 0: " + offset);
    if (limit < 0) throw new InvalidArgumentException("limit must be >= 0: " + limit);
    return call("getTableData", timeout, () -> fetchTableData(t, offset, limit));
  }

  @Override
  public final DbTableStructure getTableStructure(String table, Duration timeout) {
    String t = requireTable(table);
    return call("getTableStructure", timeout, () -> fetchTableStructure(t));
  }

  @Override
  public final DbQueryResult executeQuery(String query, Duration timeout) {
    return executeQuery(query, null, timeout);
  }

  @Override
  public final DbQueryResult executeQuery(String query, String contextTable, Duration timeout) {
    if (query == null || query.isBlank()) throw new InvalidArgumentException("query is blank");
    String table = (contextTable == null || contextTable.isBlank()) ? null : contextTable.trim();
    return call("executeQuery", timeout, () -> runQuery(query, table));
  }

  @Override
  public final boolean testConnection(Duration timeout) {
    try {
      checkConnectivity(timeout);
      return true;
    } catch (InvalidArgumentException e) {
      throw e;
    } catch (DbException e) {
      log.debug("dblink.engine testConnection handleId={} ok=false kind={} message={}",
          handle.id(), e.kind(), e.getMessage());
      return false;
    }
  }

  @Override
  public final void checkConnectivity(Duration timeout) {
    try {
      call("ping", timeout, () -> {
        ping();
        return Boolean.TRUE;
      });
    } catch (ConnectionException | InvalidArgumentException e) {
      throw e;
    } catch (DbException e) {
      throw new ConnectionException("Connectivity check failed for '" + handle.id() + "': " + e.getMessage(), e);
    }
  }

  @Override
  public final void disconnect() {
    if (!guard.beginClose()) return;
    boolean idle;
    try {
      idle = guard.awaitIdle(disconnectGrace);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      idle = false;
    }
    if (!idle) {
      log.warn("dblink.engine disconnect handleId={} inFlight={} graceMs={}: closing with operations still running",
          handle.id(), guard.inFlight(), disconnectGrace.toMillis());
    }
    try {
      closeClient();
      log.info("dblink.engine disconnected type={} handleId={}", type, handle.id());
    } catch (Exception e) {
      log.warn("dblink.engine disconnect handleId={}: failed to release native client", handle.id(), e);
    }
  }

  // --- Execution ---

  /**
   * Runs {@code work} on the bridge, holding an in-flight registration for its duration.
   * Registration happens on the worker, so a task still queued when disconnect starts is
   * rejected instead of touching a closing client.
   */
  protected final <T> T call(String op, Duration timeout, DbOperation<T> work) {
    if (guard.closing()) throw closed();
    long start = System.nanoTime();
    try {
      T out = bridge.runToCompletion(() -> {
        if (!guard.tryEnter()) throw closed();
        try {
          return work.run();
        } catch (DbException e) {
          throw e;
        } catch (Exception e) {
          throw translate(e);
        } finally {
          guard.exit();
        }
      }, effectiveTimeout(timeout));
      if (log.isDebugEnabled()) {
        log.debug("dblink.engine op={} type={} handleId={} durationMs={}",
            op, type, handle.id(), (System.nanoTime() - start) / 1_000_000.0);
      }
      return out;
    } catch (DbException e) {
      if (log.isDebugEnabled()) {
        log.debug("dblink.engine_failed op={} type={} handleId={} kind={} durationMs={} message={}",
            op, type, handle.id(), e.kind(), (System.nanoTime() - start) / 1_000_000.0, e.getMessage());
      }
      throw e;
    }
  }

  protected final ExecutionBridge bridge() { return bridge; }

  protected static long elapsedMillis(long startNanos) {
    return (System.nanoTime() - startNanos) / 1_000_000L;
  }

  private Duration effectiveTimeout(Duration timeout) {
    return (timeout != null) ? timeout : defaultTimeout;
  }

  private ConnectionException closed() {
    return new ConnectionException("Connection '" + handle.id() + "' is closed or closing");
  }

  private static String requireTable(String table) {
    if (table == null || table.isBlank()) throw new InvalidArgumentException("table is blank");
    return table.trim();
  }
}
