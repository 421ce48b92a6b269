package io.intellixity.sqlgate.tools;

import io.intellixity.sqlgate.dialect.SqlDialect;
import io.intellixity.sqlgate.error.SqlGatewayException;
import io.intellixity.sqlgate.error.TableNotFoundException;
import io.intellixity.sqlgate.error.TableSummaryException;
import io.intellixity.sqlgate.exec.QueryResult;
import io.intellixity.sqlgate.governance.DatabaseRegistry;
import io.intellixity.sqlgate.governance.TableAccessPolicy;
import io.intellixity.sqlgate.jdbc.catalog.CatalogQueries;
import io.intellixity.sqlgate.jdbc.catalog.CatalogQuery;
import io.intellixity.sqlgate.tools.model.ColumnInfo;
import io.intellixity.sqlgate.tools.model.ForeignKey;
import io.intellixity.sqlgate.tools.model.QueryResponse;
import io.intellixity.sqlgate.tools.model.TableSummary;
import io.intellixity.sqlgate.transform.SqlQueryTransformer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Columns, keys, foreign keys and a few sample rows of one table.
 * <p>
 * Columns and foreign key rows form one concatenated sequence that is paged as a whole:
 * a page first takes the remaining columns, then fills up with foreign key rows.
 * Foreign keys are reported in both directions; rows whose referencing table (schema and
 * name) is the summarized table are outgoing, all others incoming.
 */
public final class TableSummaryTool {
  private static final Logger log = LoggerFactory.getLogger(TableSummaryTool.class);

  public static final int DEFAULT_LIMIT = 250;
  static final int SAMPLE_ROWS = 5;

  private final DatabaseRegistry registry;
  private final CatalogQueries catalog;
  private final QueryTool queries;

  public TableSummaryTool(DatabaseRegistry registry, CatalogQueries catalog, QueryTool queries) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.catalog = Objects.requireNonNull(catalog, "catalog");
    this.queries = Objects.requireNonNull(queries, "queries");
  }

  public TableSummary tableSummary(String database, String table, String schema) {
    return tableSummary(database, table, schema, DEFAULT_LIMIT, 1);
  }

  public TableSummary tableSummary(String database, String table, String schema, int limit, int page) {
    Objects.requireNonNull(table, "table");
    Paging paging = Paging.of(limit, page, registry.settings().maxRowsPerQuery());
    TableAccessPolicy.of(registry.database(database)).check(table);

    Target t = new Target(database, table,
        schema == null || schema.isBlank() ? registry.defaultSchema(database) : schema,
        registry.dialect(database));

    boolean exists = step(
        "Failed to check if table '" + table + "' exists in database '" + database + "'",
        () -> !run(t, CatalogQuery.TABLE_EXISTS).isEmpty());
    if (!exists) throw new TableNotFoundException("Table '" + table + "' not found in database '" + database + "'");

    long columnCount = step(failure(t, "get counts"), () -> count(t, CatalogQuery.COLUMNS));
    long fkCount = step(failure(t, "get counts"), () -> count(t, CatalogQuery.FOREIGN_KEY));
    long total = columnCount + fkCount;

    Set<String> primaryKeys = step(failure(t, "get primary keys"), () -> primaryKeys(t));
    Map<String, String> enums = enumValues(t);

    QueryResponse sample = queries.executeQuery(database,
        "SELECT * FROM " + t.reference(), SAMPLE_ROWS, 1, false);
    List<List<Object>> sampleRows = new ArrayList<>();
    for (Map<String, Object> row : sample.rows()) sampleRows.add(new ArrayList<>(row.values()));

    long remaining = paging.limit();
    long offset = paging.offset();
    List<ColumnInfo> columns = List.of();
    List<ForeignKey> outgoing = new ArrayList<>();
    List<ForeignKey> incoming = new ArrayList<>();

    if (offset < columnCount && remaining > 0) {
      long n = Math.min(remaining, columnCount - offset);
      long from = offset;
      columns = step(failure(t, "get columns"), () -> columns(t, n, from, primaryKeys, enums));
      remaining -= columns.size();
      offset = 0;
    } else {
      offset -= columnCount;
    }

    if (offset < fkCount && remaining > 0) {
      long n = Math.min(remaining, fkCount - offset);
      long from = offset;
      ForeignKeyPage fks = step(failure(t, "get foreign keys"), () -> foreignKeys(t, n, from));
      outgoing.addAll(fks.outgoing());
      incoming.addAll(fks.incoming());
    }

    log.debug("sqlgate.tool op=table_summary database={} table={} columns={} foreignKeys={}",
        database, t.reference(), columnCount, fkCount);
    return new TableSummary(t.reference(), columns, sampleRows, outgoing, incoming,
        total, paging.page(), Paging.totalPages(total, paging.limit()));
  }

  private record Target(String database, String table, String schema, SqlDialect dialect) {
    String reference() {
      return schema == null ? table : schema + "." + table;
    }

    /** Whether a catalog row's referencing table is this table; schemas compare only when both are known. */
    boolean isSelf(String rowSchema, String rowTable) {
      if (rowTable == null || !rowTable.equalsIgnoreCase(table)) return false;
      return schema == null || rowSchema == null || rowSchema.isEmpty() || rowSchema.equalsIgnoreCase(schema);
    }

    Map<String, String> params() {
      Map<String, String> p = new HashMap<>();
      p.put(CatalogQueries.TABLE_NAME, table);
      p.put(CatalogQueries.SCHEMA_NAME, schema == null ? "" : schema);
      return p;
    }
  }

  private SqlQueryTransformer transformer(Target t, CatalogQuery q) {
    return new SqlQueryTransformer(catalog.render(t.dialect(), q, t.params()), t.dialect()).validateReadOnly();
  }

  private QueryResult run(Target t, CatalogQuery q) {
    return registry.execute(t.database(), transformer(t, q).sql());
  }

  private long count(Target t, CatalogQuery q) {
    return registry.execute(t.database(), transformer(t, q).toCountQuery()).scalarLong();
  }

  private Set<String> primaryKeys(Target t) {
    Set<String> out = new HashSet<>();
    // no primary key catalog for this dialect: columns are reported without key markers
    if (!catalog.supports(t.dialect(), CatalogQuery.PRIMARY_KEY)) return out;
    for (List<Object> row : run(t, CatalogQuery.PRIMARY_KEY).rows()) {
      if (row.get(0) != null) out.add(row.get(0).toString());
    }
    return out;
  }

  private Map<String, String> enumValues(Target t) {
    Map<String, String> out = new HashMap<>();
    if (!catalog.supports(t.dialect(), CatalogQuery.ENUM_VALUES)) return out;
    try {
      for (List<Object> row : run(t, CatalogQuery.ENUM_VALUES).rows()) {
        if (row.size() > 1 && row.get(0) != null && row.get(1) != null) {
          out.put(row.get(0).toString(), row.get(1).toString());
        }
      }
    } catch (SqlGatewayException e) {
      log.warn("sqlgate.tool op=enum_values database={} table={} degraded=true error={}",
          t.database(), t.reference(), e.getMessage());
      return new HashMap<>();
    }
    return out;
  }

  private List<ColumnInfo> columns(Target t, long limit, long offset, Set<String> pks, Map<String, String> enums) {
    String sql = transformer(t, CatalogQuery.COLUMNS).addPagination(limit, offset).sql();
    List<ColumnInfo> out = new ArrayList<>();
    for (List<Object> row : registry.execute(t.database(), sql).rows()) {
      String name = String.valueOf(row.get(0));
      Object nullable = row.get(2);
      out.add(new ColumnInfo(
          name,
          row.get(1) == null ? null : row.get(1).toString(),
          nullable == null || "YES".equalsIgnoreCase(nullable.toString()),
          row.get(3),
          pks.contains(name),
          enums.get(name)));
    }
    return out;
  }

  private record ForeignKeyPage(List<ForeignKey> outgoing, List<ForeignKey> incoming) {}

  private ForeignKeyPage foreignKeys(Target t, long limit, long offset) {
    String sql = transformer(t, CatalogQuery.FOREIGN_KEY).addPagination(limit, offset).sql();
    Map<String, FkGroup> groups = new LinkedHashMap<>();
    for (List<Object> row : registry.execute(t.database(), sql).rows()) {
      String constraint = text(row.get(6));
      FkGroup g = groups.computeIfAbsent(constraint, k -> new FkGroup(
          qualify(text(row.get(0)), text(row.get(1))),
          qualify(text(row.get(3)), text(row.get(4))),
          t.isSelf(text(row.get(0)), text(row.get(1)))));
      if (row.get(2) != null) g.fromColumns.add(text(row.get(2)));
      if (row.get(5) != null) g.toColumns.add(text(row.get(5)));
    }
    List<ForeignKey> outgoing = new ArrayList<>();
    List<ForeignKey> incoming = new ArrayList<>();
    for (Map.Entry<String, FkGroup> e : groups.entrySet()) {
      FkGroup g = e.getValue();
      ForeignKey fk = new ForeignKey(g.fromTable, orUnmapped(g.fromColumns), g.toTable, orUnmapped(g.toColumns), e.getKey());
      (g.outgoing ? outgoing : incoming).add(fk);
    }
    return new ForeignKeyPage(outgoing, incoming);
  }

  private static final class FkGroup {
    final String fromTable;
    final String toTable;
    final boolean outgoing;
    final List<String> fromColumns = new ArrayList<>();
    final List<String> toColumns = new ArrayList<>();

    FkGroup(String fromTable, String toTable, boolean outgoing) {
      this.fromTable = fromTable;
      this.toTable = toTable;
      this.outgoing = outgoing;
    }
  }

  private static List<String> orUnmapped(List<String> cols) {
    return cols.isEmpty() ? List.of(ForeignKey.UNMAPPED_COLUMNS) : cols;
  }

  private static String qualify(String schema, String table) {
    return schema == null || schema.isEmpty() ? table : schema + "." + table;
  }

  private static String text(Object v) {
    return v == null ? null : v.toString();
  }

  private static String failure(Target t, String what) {
    return "Failed to " + what + " for table '" + t.table() + "' in database '" + t.database() + "'";
  }

  private static <T> T step(String failure, Supplier<T> work) {
    try {
      return work.get();
    } catch (TableSummaryException e) {
      throw e;
    } catch (SqlGatewayException e) {
      throw new TableSummaryException(failure + ": " + e.getMessage(), e);
    }
  }
}
