package io.intellixity.dblink.proxy;

import io.intellixity.dblink.error.ErrorKind;
import io.intellixity.dblink.model.ConnectionId;
import io.intellixity.dblink.model.DbQueryResult;
import io.intellixity.dblink.model.DbSchema;
import io.intellixity.dblink.model.DbTableStructure;

/** Responses produced by {@link DatabaseDispatcher}; failures are always {@link ErrorResponse}. */
public sealed interface DbResponse {

  record ConnectResponse(ConnectionId id, DbSchema schema) implements DbResponse {}

  record SchemaResponse(DbSchema schema) implements DbResponse {}

  record QueryResponse(DbQueryResult result) implements DbResponse {}

  record TableStructureResponse(DbTableStructure structure) implements DbResponse {}

  record TestConnectionResponse(boolean success, String message) implements DbResponse {}

  record DisconnectResponse(ConnectionId id, boolean wasOpen) implements DbResponse {}

  record ErrorResponse(ErrorKind kind, String message) implements DbResponse {}
}
