package io.intellixity.sqlgate.tools;

import io.intellixity.sqlgate.config.DatabaseConfig;
import io.intellixity.sqlgate.dialect.SqlDialect;
import io.intellixity.sqlgate.exec.QueryResult;
import io.intellixity.sqlgate.governance.DatabaseRegistry;
import io.intellixity.sqlgate.governance.PolicyEvaluator;
import io.intellixity.sqlgate.jdbc.catalog.CatalogQueries;
import io.intellixity.sqlgate.jdbc.catalog.CatalogQuery;
import io.intellixity.sqlgate.tools.model.SearchResponse;
import io.intellixity.sqlgate.tools.model.SearchRow;
import io.intellixity.sqlgate.transform.SqlQueryTransformer;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Ranked lookup of tables and columns whose names match a term, narrowed by the database's filters. */
public final class SearchTool {
  static final int MAX_RESULTS = 250;

  private final DatabaseRegistry registry;
  private final CatalogQueries catalog;
  private final PolicyEvaluator policies;

  public SearchTool(DatabaseRegistry registry, CatalogQueries catalog, PolicyEvaluator policies) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.catalog = Objects.requireNonNull(catalog, "catalog");
    this.policies = Objects.requireNonNull(policies, "policies");
  }

  public SearchResponse search(String database, String term, String schema) {
    Objects.requireNonNull(term, "term");
    DatabaseConfig db = registry.database(database);
    SqlDialect dialect = db.dialect();
    int limit = Math.min(MAX_RESULTS, registry.settings().maxRowsPerQuery());

    String sql = catalog.render(dialect, CatalogQuery.SEARCH, Map.of(CatalogQueries.SEARCH_TERM, term));
    SqlQueryTransformer transformer = new SqlQueryTransformer(sql, dialect);
    policies.forSearch(db, schema).applyFilters(transformer);
    String paginated = transformer.addPagination(limit).validateReadOnly().sql();

    QueryResult result = registry.execute(database, paginated);
    List<SearchRow> rows = new ArrayList<>(result.rowCount());
    for (int i = 0; i < result.rowCount(); i++) {
      rows.add(new SearchRow(
          text(result.value(i, "object_type")),
          text(result.value(i, "schema_name")),
          text(result.value(i, "user_friendly_descriptor")),
          text(result.value(i, "data_type"))));
    }
    return new SearchResponse(rows);
  }

  private static String text(Object v) {
    return v == null ? null : v.toString();
  }
}
