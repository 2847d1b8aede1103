package io.intellixity.dblink.proxy;

import io.intellixity.dblink.model.ConnectionId;
import io.intellixity.dblink.model.ConnectionSpec;

import java.util.Objects;

/** Operation requests accepted by {@link DatabaseDispatcher}. */
public sealed interface DbRequest {

  /** Opens a connection; {@code id} may be {@code null} to let the manager assign one. */
  record Connect(ConnectionId id, ConnectionSpec spec) implements DbRequest {
    public Connect {
      Objects.requireNonNull(spec, "spec");
    }
  }

  record Disconnect(ConnectionId id) implements DbRequest {
    public Disconnect {
      Objects.requireNonNull(id, "id");
    }
  }

  record GetSchema(ConnectionId id) implements DbRequest {
    public GetSchema {
      Objects.requireNonNull(id, "id");
    }
  }

  record GetTableData(ConnectionId id, String table, long offset, long limit) implements DbRequest {
    public GetTableData {
      Objects.requireNonNull(id, "id");
    }
  }

  record GetTableStructure(ConnectionId id, String table) implements DbRequest {
    public GetTableStructure {
      Objects.requireNonNull(id, "id");
    }
  }

  /** {@code table} is the caller's selected table, used by document stores for bare filters; may be {@code null}. */
  record ExecuteQuery(ConnectionId id, String query, String table) implements DbRequest {
    public ExecuteQuery {
      Objects.requireNonNull(id, "id");
    }
  }

  /** Tests settings that are not (yet) an open connection. */
  record TestConnection(ConnectionSpec spec) implements DbRequest {
    public TestConnection {
      Objects.requireNonNull(spec, "spec");
    }
  }
}
