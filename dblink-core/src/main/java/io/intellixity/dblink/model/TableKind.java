package io.intellixity.dblink.model;

public enum TableKind {
  TABLE,
  VIEW,
  MATERIALIZED_VIEW,
  FOREIGN_TABLE,
  COLLECTION,
  OTHER
}
