package io.intellixity.dblink.spi.exec;

import java.time.Duration;

/**
 * Counts operations currently touching an engine's native client and blocks disconnect until
 * they drain. Once closing, no new operation may enter.
 */
final class InFlightGuard {
  private int inFlight;
  private boolean closing;

  synchronized boolean tryEnter() {
    if (closing) return false;
    inFlight++;
    return true;
  }

  synchronized void exit() {
    if (inFlight > 0) inFlight--;
    if (inFlight == 0) notifyAll();
  }

  /** @return {@code true} for the first caller only */
  synchronized boolean beginClose() {
    if (closing) return false;
    closing = true;
    return true;
  }

  /** @return {@code false} if operations were still running when {@code grace} ran out */
  synchronized boolean awaitIdle(Duration grace) throws InterruptedException {
    long deadline = System.nanoTime() + grace.toNanos();
    while (inFlight > 0) {
      long remainingMs = (deadline - System.nanoTime()) / 1_000_000L;
      if (remainingMs <= 0) return false;
      wait(remainingMs);
    }
    return true;
  }

  synchronized boolean closing() { return closing; }

  synchronized int inFlight() { return inFlight; }
}
