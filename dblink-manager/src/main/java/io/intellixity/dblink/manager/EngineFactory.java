package io.intellixity.dblink.manager;

import io.intellixity.dblink.exec.DatabaseEngine;
import io.intellixity.dblink.model.ConnectionId;
import io.intellixity.dblink.model.ConnectionSpec;
import io.intellixity.dblink.spi.exec.ExecutionBridge;

/**
 * Creates an engine for one connection. Must not contact the server; the manager runs the
 * connectivity check itself.
 */
@FunctionalInterface
public interface EngineFactory {
  DatabaseEngine create(ConnectionId id, ConnectionSpec spec, ExecutionBridge bridge);
}
