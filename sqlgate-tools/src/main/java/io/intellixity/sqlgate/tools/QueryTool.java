package io.intellixity.sqlgate.tools;

import io.intellixity.sqlgate.dialect.SqlDialect;
import io.intellixity.sqlgate.exec.QueryResult;
import io.intellixity.sqlgate.governance.DatabaseRegistry;
import io.intellixity.sqlgate.governance.TableAccessPolicy;
import io.intellixity.sqlgate.tools.model.QueryResponse;
import io.intellixity.sqlgate.transform.SqlQueryTransformer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Free-form read-only queries and table sampling.
 *
 * Every statement is classified and checked against the database's table policy before the
 * database is touched. Without an accurate count the page total is estimated: a full page
 * means more rows may exist.
 */
public final class QueryTool {
  private static final Logger log = LoggerFactory.getLogger(QueryTool.class);

  public static final int DEFAULT_LIMIT = 100;

  private final DatabaseRegistry registry;

  public QueryTool(DatabaseRegistry registry) {
    this.registry = Objects.requireNonNull(registry, "registry");
  }

  public QueryResponse executeQuery(String database, String query) {
    return executeQuery(database, query, DEFAULT_LIMIT, 1, false);
  }

  public QueryResponse executeQuery(String database, String query, int limit, int page, boolean accurateCount) {
    Objects.requireNonNull(query, "query");
    Paging paging = Paging.of(limit, page, registry.settings().maxRowsPerQuery());
    SqlDialect dialect = registry.dialect(database);

    SqlQueryTransformer transformer = new SqlQueryTransformer(query.strip(), dialect).validateReadOnly();
    TableAccessPolicy.of(registry.database(database)).enforce(transformer);

    Long totalRows = null;
    if (accurateCount) {
      totalRows = registry.execute(database, transformer.toCountQuery()).scalarLong();
    }

    String paginated = transformer.addPagination(paging.limit(), paging.offset()).sql();
    QueryResult result = registry.execute(database, paginated);
    int rowCount = result.rowCount();

    long totalPages;
    boolean truncated;
    if (totalRows != null) {
      totalPages = Paging.totalPages(totalRows, paging.limit());
      truncated = (long) paging.page() * paging.limit() < totalRows;
    } else {
      totalPages = paging.page();
      truncated = rowCount == paging.limit();
    }
    if (log.isDebugEnabled()) {
      log.debug("sqlgate.tool op=execute_query database={} page={} limit={} rows={} totalRows={}",
          database, paging.page(), paging.limit(), rowCount, totalRows);
    }
    return new QueryResponse(result.columns(), result.asMaps(), rowCount, paging.page(), totalPages, truncated, totalRows);
  }

  /** First {@code sample_size} rows of {@code schema.table}; the schema defaults to the database's. */
  public QueryResponse sampleTable(String database, String table, String schema) {
    Objects.requireNonNull(table, "table");
    TableAccessPolicy.of(registry.database(database)).check(table);
    String sql = "SELECT * FROM " + qualified(registry, database, table, schema);
    return executeQuery(database, sql, registry.settings().sampleSize(), 1, false);
  }

  static String qualified(DatabaseRegistry registry, String database, String table, String schema) {
    String s = schema == null || schema.isBlank() ? registry.defaultSchema(database) : schema;
    return s == null ? table : s + "." + table;
  }
}
