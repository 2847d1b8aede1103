package io.intellixity.dblink.error;

/**
 * Base of every failure this layer hands to callers.
 * <p>
 * Adapters translate native driver exceptions into a subclass at their boundary; the native
 * exception, if any, is kept as the cause.
 */
public abstract class DbException extends RuntimeException {
  protected DbException(String message) {
    super(message);
  }

  protected DbException(String message, Throwable cause) {
    super(message, cause);
  }

  public abstract ErrorKind kind();
}
