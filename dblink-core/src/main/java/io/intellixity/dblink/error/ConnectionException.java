package io.intellixity.dblink.error;

/**
 * Raised when a connection cannot be established or is no longer usable.
 * <p>
 * A {@code fatal} failure means the engine instance will not recover (revoked credentials,
 * closed client); the connection manager evicts such instances.
 */
public final class ConnectionException extends DbException {
  private final boolean fatal;

  public ConnectionException(String message) {
    this(message, null, false);
  }

  public ConnectionException(String message, Throwable cause) {
    this(message, cause, false);
  }

  public ConnectionException(String message, Throwable cause, boolean fatal) {
    super(message, cause);
    this.fatal = fatal;
  }

  public boolean fatal() { return fatal; }

  @Override
  public ErrorKind kind() { return ErrorKind.CONNECTION; }
}
