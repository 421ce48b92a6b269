package io.intellixity.sqlgate.tools.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record SearchResponse(@JsonProperty("rows") List<SearchRow> rows) implements ToolResponse {
  public SearchResponse {
    rows = List.copyOf(rows);
  }

  @Override
  public String render() {
    if (rows.isEmpty()) return "No results found";
    StringBuilder sb = new StringBuilder();
    for (SearchRow r : rows) sb.append(r.render()).append('\n');
    return sb.toString();
  }
}
