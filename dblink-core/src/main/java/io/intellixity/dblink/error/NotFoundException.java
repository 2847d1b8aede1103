package io.intellixity.dblink.error;

/** Raised for an unknown connection id, table or collection. */
public final class NotFoundException extends DbException {
  public NotFoundException(String message) {
    super(message);
  }

  public NotFoundException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override
  public ErrorKind kind() { return ErrorKind.NOT_FOUND; }
}
