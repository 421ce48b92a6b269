package io.intellixity.sqlgate.tools.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

public record ColumnInfo(
    @JsonProperty("name") String name,
    @JsonProperty("type") String type,
    @JsonProperty("nullable") boolean nullable,
    @JsonProperty("default") Object defaultValue,
    @JsonProperty("primary_key") boolean primaryKey,
    @JsonProperty("enum_values") String enumValues
) {
  String render() {
    List<String> parts = new ArrayList<>();
    parts.add(type);
    if (primaryKey) parts.add("PRIMARY KEY");
    parts.add(nullable ? "nullable" : "not null");
    if (defaultValue != null) parts.add("default: " + defaultValue);
    if (enumValues != null && !enumValues.isEmpty()) parts.add("values: " + enumValues);
    return "  " + name + ": " + String.join(", ", parts);
  }
}
