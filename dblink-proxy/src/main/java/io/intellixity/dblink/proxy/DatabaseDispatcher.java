package io.intellixity.dblink.proxy;

import io.intellixity.dblink.error.ConnectionException;
import io.intellixity.dblink.error.DbException;
import io.intellixity.dblink.error.ErrorKind;
import io.intellixity.dblink.error.InvalidArgumentException;
import io.intellixity.dblink.manager.ConnectionManager;
import io.intellixity.dblink.model.ConnectionId;
import io.intellixity.dblink.model.DbSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Turns {@link DbRequest}s into {@link DbResponse}s against a {@link ConnectionManager}.
 * <p>
 * {@link #handle(DbRequest)} runs on the calling thread and blocks for one database operation;
 * {@link #submit(DbRequest)} runs it on the bounded dispatch pool. Neither ever throws a
 * {@link DbException}: failures become {@link DbResponse.ErrorResponse}.
 */
public final class DatabaseDispatcher implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(DatabaseDispatcher.class);

  private final ConnectionManager manager;
  private final ThreadPoolExecutor pool;
  private final AtomicInteger threadSeq = new AtomicInteger();

  public DatabaseDispatcher(ConnectionManager manager, int threads, int queueCapacity) {
    if (threads <= 0) throw new IllegalArgumentException("threads must be > 0");
    if (queueCapacity <= 0) throw new IllegalArgumentException("queueCapacity must be > 0");
    this.manager = Objects.requireNonNull(manager, "manager");
    this.pool = new ThreadPoolExecutor(
        threads, threads,
        0L, TimeUnit.MILLISECONDS,
        new LinkedBlockingQueue<>(queueCapacity),
        r -> {
          Thread t = new Thread(r, "dblink-dispatch-" + threadSeq.incrementAndGet());
          t.setDaemon(true);
          return t;
        },
        new ThreadPoolExecutor.AbortPolicy());
  }

  public DbResponse handle(DbRequest request) {
    Objects.requireNonNull(request, "request");
    try {
      return dispatch(request);
    } catch (DbException e) {
      if (e.kind() == ErrorKind.DRIVER || e.kind() == ErrorKind.CONNECTION) {
        log.warn("dblink.dispatch failed request={} kind={} message={}",
            request.getClass().getSimpleName(), e.kind(), e.getMessage());
      } else {
        log.debug("dblink.dispatch failed request={} kind={} message={}",
            request.getClass().getSimpleName(), e.kind(), e.getMessage());
      }
      return new DbResponse.ErrorResponse(e.kind(), e.getMessage());
    }
  }

  /** Runs {@link #handle(DbRequest)} on the dispatch pool. A full pool answers with an error response. */
  public CompletableFuture<DbResponse> submit(DbRequest request) {
    Objects.requireNonNull(request, "request");
    try {
      return CompletableFuture.supplyAsync(() -> handle(request), pool);
    } catch (RejectedExecutionException e) {
      return CompletableFuture.completedFuture(new DbResponse.ErrorResponse(ErrorKind.DRIVER,
          pool.isShutdown() ? "Dispatcher is closed" : "Dispatcher is saturated"));
    }
  }

  public ConnectionManager manager() { return manager; }

  @Override
  public void close() {
    pool.shutdown();
    try {
      if (!pool.awaitTermination(5, TimeUnit.SECONDS)) pool.shutdownNow();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      pool.shutdownNow();
    }
  }

  private DbResponse dispatch(DbRequest request) {
    if (request instanceof DbRequest.Connect r) return connect(r);
    if (request instanceof DbRequest.Disconnect r) {
      return new DbResponse.DisconnectResponse(r.id(), manager.close(r.id()));
    }
    if (request instanceof DbRequest.GetSchema r) {
      return new DbResponse.SchemaResponse(manager.withEngine(r.id(), e -> e.getSchema()));
    }
    if (request instanceof DbRequest.GetTableData r) {
      return new DbResponse.QueryResponse(
          manager.withEngine(r.id(), e -> e.getTableData(r.table(), r.offset(), r.limit())));
    }
    if (request instanceof DbRequest.GetTableStructure r) {
      return new DbResponse.TableStructureResponse(manager.withEngine(r.id(), e -> e.getTableStructure(r.table())));
    }
    if (request instanceof DbRequest.ExecuteQuery r) {
      return new DbResponse.QueryResponse(manager.withEngine(r.id(), e -> e.executeQuery(r.query(), r.table(), null)));
    }
    if (request instanceof DbRequest.TestConnection r) {
      try {
        manager.checkConnection(r.spec());
        return new DbResponse.TestConnectionResponse(true, "Connection successful");
      } catch (ConnectionException e) {
        return new DbResponse.TestConnectionResponse(false, "Connection failed: " + e.getMessage());
      }
    }
    throw new InvalidArgumentException("Unsupported request: " + request.getClass().getName());
  }

  /** Opens and lists the schema; a connection whose schema cannot be read is closed again. */
  private DbResponse connect(DbRequest.Connect r) {
    ConnectionId id = r.id();
    if (id == null) {
      id = manager.open(r.spec());
    } else {
      manager.open(id, r.spec());
    }
    try {
      DbSchema schema = manager.withEngine(id, e -> e.getSchema());
      return new DbResponse.ConnectResponse(id, schema);
    } catch (DbException e) {
      manager.close(id);
      throw e;
    }
  }
}
