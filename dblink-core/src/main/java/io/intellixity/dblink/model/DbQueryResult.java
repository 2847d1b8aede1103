package io.intellixity.dblink.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Backend-agnostic tabular result.
 * <p>
 * Every row holds exactly {@code columns.size()} values, positionally aligned with
 * {@link #columns()}. Values are JSON trees: text, number, boolean, null, or a nested
 * object/array for document values. SQL NULL and missing document fields are
 * {@link NullNode}, never Java {@code null}.
 *
 * @param columns         column metadata, in display order
 * @param rows            row values
 * @param affectedRows    rows changed by a write statement, {@code null} for reads
 * @param totalCount      total rows available when cheaply known, else {@code null}
 * @param executionTimeMs wall time spent in the backend call
 * @param hasMore         whether rows exist beyond this page
 */
public record DbQueryResult(List<DbColumnInfo> columns,
                           List<List<JsonNode>> rows,
                           Long affectedRows,
                           Long totalCount,
                           long executionTimeMs,
                           boolean hasMore) {
  public DbQueryResult {
    columns = (columns == null) ? List.of() : List.copyOf(columns);
    List<List<JsonNode>> copied = new ArrayList<>(rows == null ? 0 : rows.size());
    if (rows != null) {
      int width = columns.size();
      for (int i = 0; i < rows.size(); i++) {
        List<JsonNode> row = rows.get(i);
        if (row == null || row.size() != width) {
          throw new IllegalArgumentException("Row " + i + " has " + (row == null ? 0 : row.size())
              + " values but result has " + width + " columns");
        }
        List<JsonNode> r = new ArrayList<>(width);
        for (JsonNode v : row) r.add(v == null ? NullNode.instance : v);
        copied.add(List.copyOf(r));
      }
    }
    rows = List.copyOf(copied);
  }

  /** Result of a statement that returns no rows. */
  public static DbQueryResult ofUpdate(Long affectedRows, long executionTimeMs) {
    return new DbQueryResult(List.of(), List.of(), affectedRows, null, executionTimeMs, false);
  }

  public static DbQueryResult empty() {
    return new DbQueryResult(List.of(), List.of(), null, null, 0, false);
  }

  public List<String> columnNames() {
    List<String> out = new ArrayList<>(columns.size());
    for (DbColumnInfo c : columns) out.add(c.name());
    return out;
  }

  public int rowCount() { return rows.size(); }
}
