package io.intellixity.dblink.spi.exec;

import io.intellixity.dblink.error.DbTimeoutException;
import io.intellixity.dblink.error.DriverException;
import io.intellixity.dblink.error.InvalidArgumentException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Shared execution context that drives driver work for every engine instance.
 * <p>
 * Dispatch threads call {@link #runToCompletion(DbOperation, Duration)} and block until the
 * operation finishes on one of the bridge's worker threads. The bridge never serializes
 * unrelated operations and holds no per-connection state.
 * <p>
 * On timeout the caller gets a {@link DbTimeoutException}; the operation is not interrupted and
 * runs to completion on its worker, and its result is dropped with the abandoned future.
 */
public final class ExecutionBridge implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(ExecutionBridge.class);

  public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);
  public static final int DEFAULT_QUEUE_CAPACITY = 1024;

  private final ThreadPoolExecutor executor;
  private final Duration defaultTimeout;
  private final AtomicInteger threadSeq = new AtomicInteger();

  public ExecutionBridge(int threads, int queueCapacity, Duration defaultTimeout) {
    if (threads <= 0) throw new IllegalArgumentException("threads must be > 0");
    if (queueCapacity <= 0) throw new IllegalArgumentException("queueCapacity must be > 0");
    this.defaultTimeout = requirePositive(Objects.requireNonNull(defaultTimeout, "defaultTimeout"));
    this.executor = new ThreadPoolExecutor(
        threads, threads,
        0L, TimeUnit.MILLISECONDS,
        new LinkedBlockingQueue<>(queueCapacity),
        r -> new BridgeThread(this, r, "dblink-exec-" + threadSeq.incrementAndGet()),
        new ThreadPoolExecutor.AbortPolicy());
  }

  /** Bridge sized to the machine, with the default queue and timeout. */
  public static ExecutionBridge create() {
    int threads = Math.max(4, Runtime.getRuntime().availableProcessors());
    return new ExecutionBridge(threads, DEFAULT_QUEUE_CAPACITY, DEFAULT_TIMEOUT);
  }

  public Duration defaultTimeout() { return defaultTimeout; }

  public <T> T runToCompletion(DbOperation<T> operation) {
    return runToCompletion(operation, null);
  }

  /**
   * Runs {@code operation} on the shared context and blocks until it completes or
   * {@code timeout} elapses ({@code null} = bridge default).
   * <p>
   * Runtime exceptions thrown by the operation surface unchanged; checked ones are wrapped in
   * {@link DriverException}.
   */
  public <T> T runToCompletion(DbOperation<T> operation, Duration timeout) {
    Objects.requireNonNull(operation, "operation");
    Duration deadline = (timeout == null) ? defaultTimeout : requirePositive(timeout);

    // Re-entrant call from a bridge worker: waiting on our own pool could starve it.
    if (Thread.currentThread() instanceof BridgeThread bt && bt.owner == this) {
      try {
        return operation.run();
      } catch (Exception e) {
        throw surface(e);
      }
    }

    Callable<T> task = operation::run;
    Future<T> future;
    try {
      future = executor.submit(task);
    } catch (RejectedExecutionException e) {
      throw new DriverException(executor.isShutdown()
          ? "Execution bridge is closed"
          : "Execution bridge is saturated (" + executor.getQueue().size() + " operations queued)", e);
    }

    try {
      return future.get(deadline.toNanos(), TimeUnit.NANOSECONDS);
    } catch (TimeoutException e) {
      log.debug("dblink.bridge timeout afterMs={} active={} queued={}",
          deadline.toMillis(), executor.getActiveCount(), executor.getQueue().size());
      throw new DbTimeoutException("Operation did not complete within " + deadline.toMillis() + " ms");
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new DriverException("Interrupted while waiting for database operation", e);
    } catch (ExecutionException e) {
      throw surface(e.getCause());
    }
  }

  @Override
  public void close() {
    executor.shutdown();
    try {
      if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
        log.warn("dblink.bridge close: workers still busy after 5s, interrupting");
        executor.shutdownNow();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      executor.shutdownNow();
    }
  }

  public boolean isClosed() { return executor.isShutdown(); }

  /** Operations waiting for a worker. */
  public int queuedOperations() { return executor.getQueue().size(); }

  public int activeOperations() { return executor.getActiveCount(); }

  private static RuntimeException surface(Throwable t) {
    if (t instanceof RuntimeException re) return re;
    if (t instanceof Error err) throw err;
    String msg = (t == null || t.getMessage() == null) ? String.valueOf(t) : t.getMessage();
    return new DriverException(msg, t);
  }

  private static Duration requirePositive(Duration d) {
    if (d.isNegative() || d.isZero()) throw new InvalidArgumentException("timeout must be positive: " + d);
    return d;
  }

  private static final class BridgeThread extends Thread {
    final ExecutionBridge owner;

    BridgeThread(ExecutionBridge owner, Runnable r, String name) {
      super(r, name);
      this.owner = owner;
      setDaemon(true);
    }
  }
}
