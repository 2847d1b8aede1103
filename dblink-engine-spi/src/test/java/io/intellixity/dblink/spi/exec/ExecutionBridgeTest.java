package io.intellixity.dblink.spi.exec;

import io.intellixity.dblink.error.DbTimeoutException;
import io.intellixity.dblink.error.DriverException;
import io.intellixity.dblink.error.InvalidArgumentException;
import io.intellixity.dblink.error.NotFoundException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

final class ExecutionBridgeTest {
  private final ExecutionBridge bridge = new ExecutionBridge(2, 2, Duration.ofSeconds(5));

  @AfterEach
  void tearDown() {
    bridge.close();
  }

  @Test
  void returnsResultFromWorkerThread() {
    String thread = bridge.runToCompletion(() -> Thread.currentThread().getName());
    assertTrue(thread.startsWith("dblink-exec-"), thread);
  }

  @Test
  void runtimeFailuresSurfaceUnchanged() {
    NotFoundException original = new NotFoundException("Table not found: x");
    NotFoundException thrown = assertThrows(NotFoundException.class, () -> bridge.runToCompletion(() -> {
      throw original;
    }));
    assertSame(original, thrown);
  }

  @Test
  void checkedFailuresBecomeDriverErrors() {
    DriverException e = assertThrows(DriverException.class, () -> bridge.runToCompletion(() -> {
      throw new IOException("socket closed");
    }));
    assertEquals("socket closed", e.getMessage());
    assertInstanceOf(IOException.class, e.getCause());
  }

  @Test
  void timeoutAbandonsTaskWithoutCancelling() throws Exception {
    CountDownLatch release = new CountDownLatch(1);
    CountDownLatch finished = new CountDownLatch(1);
    AtomicBoolean interrupted = new AtomicBoolean();

    assertThrows(DbTimeoutException.class, () -> bridge.runToCompletion(() -> {
      try {
        release.await();
      } catch (InterruptedException e) {
        interrupted.set(true);
      }
      finished.countDown();
      return "late";
    }, Duration.ofMillis(100)));

    release.countDown();
    assertTrue(finished.await(5, TimeUnit.SECONDS));
    assertFalse(interrupted.get());
  }

  @Test
  void rejectsNonPositiveTimeout() {
    assertThrows(InvalidArgumentException.class, () -> bridge.runToCompletion(() -> 1, Duration.ZERO));
    assertThrows(InvalidArgumentException.class, () -> bridge.runToCompletion(() -> 1, Duration.ofMillis(-1)));
  }

  @Test
  void nestedCallRunsInline() {
    String outer = bridge.runToCompletion(() -> {
      String here = Thread.currentThread().getName();
      String inner = bridge.runToCompletion(() -> Thread.currentThread().getName());
      return here.equals(inner) ? "inline" : "hopped";
    });
    assertEquals("inline", outer);
  }

  @Test
  void saturationIsDriverError() throws Exception {
    CountDownLatch release = new CountDownLatch(1);
    CountDownLatch started = new CountDownLatch(2);
    Thread[] blockers = new Thread[4];
    // 2 workers busy + 2 queued fills the bridge
    for (int i = 0; i < blockers.length; i++) {
      blockers[i] = new Thread(() -> {
        bridge.runToCompletion(() -> {
          started.countDown();
          release.await();
          return null;
        }, Duration.ofSeconds(10));
      });
      blockers[i].start();
    }
    try {
      assertTrue(started.await(5, TimeUnit.SECONDS));
      awaitQueued(2);
      DriverException e = assertThrows(DriverException.class, () -> bridge.runToCompletion(() -> 1));
      assertTrue(e.getMessage().contains("saturated"));
    } finally {
      release.countDown();
      for (Thread t : blockers) t.join(5_000);
    }
  }

  @Test
  void interruptedCallerKeepsInterruptFlag() throws Exception {
    CountDownLatch release = new CountDownLatch(1);
    AtomicReference<Throwable> failure = new AtomicReference<>();
    AtomicBoolean flag = new AtomicBoolean();
    Thread caller = new Thread(() -> {
      try {
        bridge.runToCompletion(() -> {
          release.await();
          return null;
        });
      } catch (DriverException e) {
        failure.set(e);
        flag.set(Thread.currentThread().isInterrupted());
      }
    });
    caller.start();
    Thread.sleep(100);
    caller.interrupt();
    caller.join(5_000);
    release.countDown();

    assertInstanceOf(DriverException.class, failure.get());
    assertTrue(flag.get());
  }

  @Test
  void closedBridgeRejects() {
    bridge.close();
    assertTrue(bridge.isClosed());
    DriverException e = assertThrows(DriverException.class, () -> bridge.runToCompletion(() -> 1));
    assertTrue(e.getMessage().contains("closed"));
  }

  private void awaitQueued(int n) throws InterruptedException {
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
    while (System.nanoTime() < deadline) {
      if (bridge.queuedOperations() >= n) return;
      Thread.sleep(10);
    }
    fail("queue never reached " + n);
  }
}
