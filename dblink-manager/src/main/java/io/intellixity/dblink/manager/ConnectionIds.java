package io.intellixity.dblink.manager;

import io.intellixity.dblink.model.ConnectionId;

import java.util.concurrent.atomic.AtomicLong;

/** Process-wide id sequence; ids are never handed out twice in one process. */
final class ConnectionIds {
  private static final AtomicLong SEQ = new AtomicLong();

  private ConnectionIds() {}

  static ConnectionId next(String prefix) {
    return ConnectionId.of(prefix + "-" + SEQ.incrementAndGet());
  }
}
