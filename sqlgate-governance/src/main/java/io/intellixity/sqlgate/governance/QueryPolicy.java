package io.intellixity.sqlgate.governance;

import io.intellixity.sqlgate.transform.SqlQueryTransformer;

import java.util.List;
import java.util.Objects;

/** WHERE fragments plus table access rules to apply to one catalog query. */
public record QueryPolicy(List<String> whereFragments, TableAccessPolicy tableAccess) {
  public QueryPolicy {
    whereFragments = List.copyOf(whereFragments);
    Objects.requireNonNull(tableAccess, "tableAccess");
  }

  /** ANDs every fragment into the statement, in order. */
  public SqlQueryTransformer applyFilters(SqlQueryTransformer transformer) {
    for (String fragment : whereFragments) transformer.addWhereCondition(fragment);
    return transformer;
  }
}
