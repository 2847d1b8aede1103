package io.intellixity.dblink.model;

/** Opaque identifier of an open connection; unique among currently open connections. */
public record ConnectionId(String value) {
  public ConnectionId {
    if (value == null || value.isBlank()) throw new IllegalArgumentException("connection id is blank");
  }

  public static ConnectionId of(String value) {
    return new ConnectionId(value);
  }

  @Override
  public String toString() { return value; }
}
