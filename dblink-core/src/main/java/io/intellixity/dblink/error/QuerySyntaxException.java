package io.intellixity.dblink.error;

/** Raised when the backend (or the adapter's parser) rejects query text. The message is the backend's own where available. */
public final class QuerySyntaxException extends DbException {
  public QuerySyntaxException(String message) {
    super(message);
  }

  public QuerySyntaxException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override
  public ErrorKind kind() { return ErrorKind.QUERY_SYNTAX; }
}
