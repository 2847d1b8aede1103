package io.intellixity.dblink.error;

/** Raised for malformed request parameters or an unusable connection spec. */
public final class InvalidArgumentException extends DbException {
  public InvalidArgumentException(String message) {
    super(message);
  }

  public InvalidArgumentException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override
  public ErrorKind kind() { return ErrorKind.INVALID_ARGUMENT; }
}
