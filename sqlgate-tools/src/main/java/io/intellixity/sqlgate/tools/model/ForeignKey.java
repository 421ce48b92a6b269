package io.intellixity.sqlgate.tools.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** One foreign key constraint; table names are schema-qualified when the catalog reports a schema. */
public record ForeignKey(
    @JsonProperty("from_table") String fromTable,
    @JsonProperty("from_columns") List<String> fromColumns,
    @JsonProperty("to_table") String toTable,
    @JsonProperty("to_columns") List<String> toColumns,
    @JsonProperty("constraint_name") String constraintName
) {
  public static final String UNMAPPED_COLUMNS = "(column mapping not available)";

  public ForeignKey {
    fromColumns = List.copyOf(fromColumns);
    toColumns = List.copyOf(toColumns);
  }
}
