package io.intellixity.dblink.error;

/** Backend-reported runtime fault, carrying the backend's message and native error code when known. */
public final class DriverException extends DbException {
  private final String nativeCode;

  public DriverException(String message) {
    this(message, null, null);
  }

  public DriverException(String message, Throwable cause) {
    this(message, null, cause);
  }

  public DriverException(String message, String nativeCode, Throwable cause) {
    super(message, cause);
    this.nativeCode = nativeCode;
  }

  /** SQLState for Postgres, server error code for Mongo; {@code null} if unknown. */
  public String nativeCode() { return nativeCode; }

  @Override
  public ErrorKind kind() { return ErrorKind.DRIVER; }
}
