package io.intellixity.sqlgate.tools;

import io.intellixity.sqlgate.config.DatabaseConfig;
import io.intellixity.sqlgate.config.GatewayConfig;
import io.intellixity.sqlgate.config.GlobalSettings;
import io.intellixity.sqlgate.error.TableAccessException;
import io.intellixity.sqlgate.error.TableNotFoundException;
import io.intellixity.sqlgate.exec.QueryResult;
import io.intellixity.sqlgate.governance.DatabaseRegistry;
import io.intellixity.sqlgate.jdbc.catalog.CatalogQueries;
import io.intellixity.sqlgate.tools.model.ColumnInfo;
import io.intellixity.sqlgate.tools.model.ForeignKey;
import io.intellixity.sqlgate.tools.model.TableSummary;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class TableSummaryToolTest {
  @TempDir
  Path tmp;

  private Path file;
  private DatabaseRegistry registry;

  @BeforeEach
  void setUp() throws Exception {
    file = ShopDatabase.create(tmp);
    registry = ShopDatabase.registry(ShopDatabase.config(file).build(), GlobalSettings.defaults());
  }

  @AfterEach
  void tearDown() {
    registry.close();
  }

  private TableSummaryTool tool() {
    return new TableSummaryTool(registry, new CatalogQueries(), new QueryTool(registry));
  }

  @Test
  void describesColumnsKeysAndBothForeignKeyDirections() {
    TableSummary s = tool().tableSummary(ShopDatabase.NAME, "orders", null);

    assertEquals("main.orders", s.table());
    assertEquals(List.of("id", "customer_id", "total"), s.columns().stream().map(ColumnInfo::name).toList());
    ColumnInfo id = s.columns().get(0);
    assertTrue(id.primaryKey());
    ColumnInfo customer = s.columns().get(1);
    assertFalse(customer.nullable());
    assertFalse(customer.primaryKey());
    assertEquals("0", String.valueOf(s.columns().get(2).defaultValue()));

    assertEquals(1, s.foreignKeys().size());
    ForeignKey out = s.foreignKeys().get(0);
    assertEquals("main.orders", out.fromTable());
    assertEquals(List.of("customer_id"), out.fromColumns());
    assertEquals("main.customer", out.toTable());
    assertEquals(List.of("id"), out.toColumns());

    assertEquals(1, s.incomingForeignKeys().size());
    assertEquals("main.order_line", s.incomingForeignKeys().get(0).fromTable());

    assertEquals(5, s.totalCount());
    assertEquals(1, s.totalPages());
    assertEquals(5, s.sampleRows().size());
  }

  @Test
  void pagesRunAcrossColumnsThenForeignKeys() {
    TableSummaryTool t = tool();

    TableSummary p2 = t.tableSummary(ShopDatabase.NAME, "orders", null, 2, 2);
    assertEquals(List.of("total"), p2.columns().stream().map(ColumnInfo::name).toList());
    assertEquals(1, p2.foreignKeys().size());
    assertTrue(p2.incomingForeignKeys().isEmpty());
    assertEquals(3, p2.totalPages());

    TableSummary p3 = t.tableSummary(ShopDatabase.NAME, "orders", null, 2, 3);
    assertTrue(p3.columns().isEmpty());
    assertTrue(p3.foreignKeys().isEmpty());
    assertEquals(1, p3.incomingForeignKeys().size());
    assertEquals(List.of("order_id"), p3.incomingForeignKeys().get(0).fromColumns());
  }

  @Test
  void missingTableIsReported() {
    TableNotFoundException ex = assertThrows(TableNotFoundException.class,
        () -> tool().tableSummary(ShopDatabase.NAME, "invoices", null));
    assertEquals("Table 'invoices' not found in database 'shop'", ex.getMessage());
  }

  @Test
  void targetMustPassTablePolicy() {
    registry.close();
    registry = ShopDatabase.registry(
        ShopDatabase.config(file).allowedTables(List.of("customer")).build(), GlobalSettings.defaults());
    TableAccessException ex = assertThrows(TableAccessException.class,
        () -> tool().tableSummary(ShopDatabase.NAME, "orders", null));
    assertEquals("Table 'orders' is not in the allowed list", ex.getMessage());
    assertTrue(registry.activeExecutors().isEmpty());
  }

  @Test
  void renderListsSectionsAndFooter() {
    String text = tool().tableSummary(ShopDatabase.NAME, "orders", null).render();
    assertTrue(text.startsWith("Table \"main.orders\"\n"), text);
    assertTrue(text.contains("\nCOLUMNS:\n  id: INTEGER, PRIMARY KEY, nullable\n"), text);
    assertTrue(text.contains("  customer_id: INTEGER, not null\n"), text);
    assertTrue(text.contains("\nSAMPLE ROWS:\n  id | customer_id | total\n"), text);
    assertTrue(text.contains("\nFOREIGN KEY CONSTRAINTS:\n  customer_id → main.customer(id)\n"), text);
    assertTrue(text.contains("\nREFERENCED BY:\n  main.order_line.order_id → id\n"), text);
    assertTrue(text.endsWith("Page 1 of 1 (Total: 5 items)"), text);
  }

  @Test
  void sameNamedTableInAnotherSchemaIsIncoming() {
    QueryResult fkRows = new QueryResult(
        List.of("source_schema_name", "source_table_name", "source_column_name",
            "dest_schema_name", "dest_table_name", "dest_column_name", "constraint_name"),
        List.of(
            List.of("sales", "orders", "customer_id", "sales", "customer", "id", "orders_customer_fk"),
            List.of("archive", "orders", "order_id", "sales", "orders", "id", "archive_orders_fk")));
    RecordingExecutor pg = new RecordingExecutor("pg", sql -> {
      if (sql.contains("COUNT(*)")) return RecordingExecutor.count(sql.contains("pg_constraint") ? 2 : 0);
      if (sql.contains("pg_constraint")) return fkRows;
      if (sql.contains("information_schema.tables")) return RecordingExecutor.rows(1);
      return QueryResult.empty();
    });
    DatabaseConfig db = DatabaseConfig.builder("postgresql").host("localhost").database("app").username("u").build();
    DatabaseRegistry pgRegistry = new DatabaseRegistry(
        new GatewayConfig(Map.of("pg", db), GlobalSettings.defaults()), (id, cfg, settings) -> pg);

    TableSummary s = new TableSummaryTool(pgRegistry, new CatalogQueries(), new QueryTool(pgRegistry))
        .tableSummary("pg", "orders", "sales");

    assertEquals(List.of("sales.customer"), s.foreignKeys().stream().map(ForeignKey::toTable).toList());
    assertEquals(List.of("archive.orders"), s.incomingForeignKeys().stream().map(ForeignKey::fromTable).toList());
    assertEquals(List.of("order_id"), s.incomingForeignKeys().get(0).fromColumns());
  }
}
