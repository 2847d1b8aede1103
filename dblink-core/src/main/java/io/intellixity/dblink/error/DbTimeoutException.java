package io.intellixity.dblink.error;

/** Raised when an operation exceeds its deadline. The backend work may still complete in the background; its result is discarded. */
public final class DbTimeoutException extends DbException {
  public DbTimeoutException(String message) {
    super(message);
  }

  public DbTimeoutException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override
  public ErrorKind kind() { return ErrorKind.TIMEOUT; }
}
