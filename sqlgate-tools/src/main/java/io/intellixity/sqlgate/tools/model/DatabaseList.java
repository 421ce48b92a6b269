package io.intellixity.sqlgate.tools.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

public record DatabaseList(
    @JsonProperty("databases") List<DatabaseInfo> databases,
    @JsonProperty("total_count") int totalCount
) implements ToolResponse {
  public DatabaseList {
    databases = List.copyOf(databases);
  }

  public static DatabaseList of(List<DatabaseInfo> databases) {
    return new DatabaseList(databases, databases.size());
  }

  @Override
  public String render() {
    if (databases.isEmpty()) return "No databases configured";
    List<String> lines = new ArrayList<>();
    for (DatabaseInfo db : databases) lines.add(db.render());
    return String.join("\n", lines).stripTrailing();
  }
}
