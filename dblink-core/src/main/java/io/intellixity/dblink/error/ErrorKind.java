package io.intellixity.dblink.error;

/** Error categories surfaced to callers. None of them is retried inside this layer. */
public enum ErrorKind {
  /** Malformed request parameters; a caller bug. */
  INVALID_ARGUMENT,
  /** Unknown connection id, table or collection. */
  NOT_FOUND,
  /** Cannot establish, or has lost, the connection. */
  CONNECTION,
  /** Backend rejected the query text. */
  QUERY_SYNTAX,
  /** Backend-reported runtime fault during a well-formed operation. */
  DRIVER,
  /** Deadline exceeded. */
  TIMEOUT
}
