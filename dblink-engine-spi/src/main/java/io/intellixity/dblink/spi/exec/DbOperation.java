package io.intellixity.dblink.spi.exec;

/** Unit of driver work executed on the {@link ExecutionBridge}. */
@FunctionalInterface
public interface DbOperation<T> {
  T run() throws Exception;
}
