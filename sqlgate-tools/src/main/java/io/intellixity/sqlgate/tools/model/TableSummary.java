package io.intellixity.sqlgate.tools.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Structural description of one table. Columns and foreign keys share a single page window:
 * {@code totalCount} is the number of columns plus the number of foreign key rows.
 */
public record TableSummary(
    @JsonProperty("table") String table,
    @JsonProperty("columns") List<ColumnInfo> columns,
    @JsonProperty("sample_rows") List<List<Object>> sampleRows,
    @JsonProperty("foreign_keys") List<ForeignKey> foreignKeys,
    @JsonProperty("incoming_foreign_keys") List<ForeignKey> incomingForeignKeys,
    @JsonProperty("total_count") long totalCount,
    @JsonProperty("current_page") int currentPage,
    @JsonProperty("total_pages") long totalPages
) implements ToolResponse {
  static final int MAX_CELL_CHARS = 50;

  public TableSummary {
    columns = List.copyOf(columns);
    sampleRows = Collections.unmodifiableList(new ArrayList<>(sampleRows));
    foreignKeys = List.copyOf(foreignKeys);
    incomingForeignKeys = List.copyOf(incomingForeignKeys);
  }

  @Override
  public String render() {
    StringBuilder sb = new StringBuilder();
    sb.append("Table \"").append(table).append("\"\n");

    if (!columns.isEmpty()) {
      sb.append("\nCOLUMNS:\n");
      for (ColumnInfo c : columns) sb.append(c.render()).append('\n');
    }

    if (!sampleRows.isEmpty() && !columns.isEmpty()) {
      sb.append("\nSAMPLE ROWS:\n");
      List<String> names = new ArrayList<>();
      for (ColumnInfo c : columns) names.add(c.name());
      String header = String.join(" | ", names);
      sb.append("  ").append(header).append('\n');
      sb.append("  ").append("-".repeat(header.length())).append('\n');
      for (List<Object> row : sampleRows) {
        List<String> cells = new ArrayList<>();
        for (Object v : row) cells.add(sampleCell(v));
        sb.append("  ").append(String.join(" | ", cells)).append('\n');
      }
    }

    if (!foreignKeys.isEmpty()) {
      sb.append("\nFOREIGN KEY CONSTRAINTS:\n");
      for (ForeignKey fk : foreignKeys) {
        sb.append("  ").append(String.join(", ", fk.fromColumns()))
            .append(" → ").append(fk.toTable())
            .append('(').append(String.join(", ", fk.toColumns())).append(")\n");
      }
    }

    if (!incomingForeignKeys.isEmpty()) {
      sb.append("\nREFERENCED BY:\n");
      for (ForeignKey fk : incomingForeignKeys) {
        sb.append("  ").append(fk.fromTable()).append('.').append(String.join(", ", fk.fromColumns()))
            .append(" → ").append(String.join(", ", fk.toColumns())).append('\n');
      }
    }

    sb.append("\nPage ").append(currentPage).append(" of ").append(totalPages)
        .append(" (Total: ").append(totalCount).append(" items)");
    return sb.toString();
  }

  private static String sampleCell(Object v) {
    if (v == null) return "NULL";
    String s = v.toString();
    return s.length() > MAX_CELL_CHARS ? s.substring(0, MAX_CELL_CHARS) + "..." : s;
  }
}
