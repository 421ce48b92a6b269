package io.intellixity.sqlgate.exec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Materialized result of one statement: column labels in projection order and rows of scalars
 * aligned with them.
 */
public record QueryResult(List<String> columns, List<List<Object>> rows) {
  public QueryResult {
    Objects.requireNonNull(columns, "columns");
    Objects.requireNonNull(rows, "rows");
    columns = List.copyOf(columns);
    List<List<Object>> copy = new ArrayList<>(rows.size());
    for (List<Object> r : rows) copy.add(Collections.unmodifiableList(new ArrayList<>(r)));
    rows = Collections.unmodifiableList(copy);
  }

  public static QueryResult empty() {
    return new QueryResult(List.of(), List.of());
  }

  public int rowCount() { return rows.size(); }

  public boolean isEmpty() { return rows.isEmpty(); }

  /** First column of the first row, or null when there are no rows. */
  public Object scalar() {
    if (rows.isEmpty() || rows.get(0).isEmpty()) return null;
    return rows.get(0).get(0);
  }

  /** {@link #scalar()} as a long; null and empty results count as zero. */
  public long scalarLong() {
    Object v = scalar();
    if (v == null) return 0L;
    if (v instanceof Number n) return n.longValue();
    return Long.parseLong(v.toString().trim());
  }

  public List<Object> fetchOne() {
    return rows.isEmpty() ? null : rows.get(0);
  }

  public List<List<Object>> fetchAll() {
    return rows;
  }

  /** Rows keyed by column label; later duplicate labels overwrite earlier ones. */
  public List<Map<String, Object>> asMaps() {
    List<Map<String, Object>> out = new ArrayList<>(rows.size());
    for (List<Object> r : rows) {
      Map<String, Object> m = new LinkedHashMap<>();
      for (int i = 0; i < columns.size() && i < r.size(); i++) m.put(columns.get(i), r.get(i));
      out.add(m);
    }
    return out;
  }

  /** Value of {@code column} (case-insensitive label match) in row {@code row}. */
  public Object value(int row, String column) {
    List<Object> r = rows.get(row);
    for (int i = 0; i < columns.size(); i++) {
      if (columns.get(i).equalsIgnoreCase(column)) return i < r.size() ? r.get(i) : null;
    }
    return null;
  }
}
