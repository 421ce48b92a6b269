package io.intellixity.sqlgate.tools.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * One page of a query result.
 *
 * @param totalRows exact row count, present only when an accurate count was requested
 */
public record QueryResponse(
    @JsonProperty("columns") List<String> columns,
    @JsonProperty("rows") List<Map<String, Object>> rows,
    @JsonProperty("row_count") int rowCount,
    @JsonProperty("current_page") int currentPage,
    @JsonProperty("total_pages") long totalPages,
    @JsonProperty("truncated") boolean truncated,
    @JsonProperty("total_rows") @JsonInclude(JsonInclude.Include.NON_NULL) Long totalRows
) implements ToolResponse {

  public QueryResponse {
    columns = List.copyOf(columns);
    rows = Collections.unmodifiableList(new ArrayList<>(rows));
  }

  @Override
  public String render() {
    if (rows.isEmpty()) return "Query returned 0 rows";

    int[] widths = new int[columns.size()];
    for (int i = 0; i < columns.size(); i++) widths[i] = columns.get(i).length();
    for (Map<String, Object> row : rows) {
      for (int i = 0; i < columns.size(); i++) {
        widths[i] = Math.max(widths[i], ValueFormat.cell(row.get(columns.get(i))).length());
      }
    }

    StringBuilder sb = new StringBuilder();
    List<String> header = new ArrayList<>();
    for (int i = 0; i < columns.size(); i++) header.add(ValueFormat.padRight(columns.get(i), widths[i]));
    sb.append(String.join("  ", header)).append('\n');
    for (Map<String, Object> row : rows) {
      List<String> cells = new ArrayList<>();
      for (int i = 0; i < columns.size(); i++) {
        cells.add(ValueFormat.padRight(ValueFormat.cell(row.get(columns.get(i))), widths[i]));
      }
      sb.append(String.join("  ", cells)).append('\n');
    }

    sb.append('\n');
    if (totalRows != null) {
      sb.append("Page ").append(currentPage).append(" of ").append(totalPages)
          .append(" (showing ").append(rowCount).append(" of ").append(totalRows).append(" rows)");
    } else if (truncated) {
      sb.append("Page ").append(currentPage).append(" (showing ").append(rowCount).append(" rows, more may exist)");
    } else {
      sb.append("Page ").append(currentPage).append(" of ").append(totalPages)
          .append(" (showing ").append(rowCount).append(" rows)");
    }
    return sb.toString();
  }
}
