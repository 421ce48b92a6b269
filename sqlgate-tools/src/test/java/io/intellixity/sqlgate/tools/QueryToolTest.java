package io.intellixity.sqlgate.tools;

import io.intellixity.sqlgate.config.DatabaseConfig;
import io.intellixity.sqlgate.config.GatewayConfig;
import io.intellixity.sqlgate.config.GlobalSettings;
import io.intellixity.sqlgate.error.InvalidPaginationException;
import io.intellixity.sqlgate.error.InvalidSqlException;
import io.intellixity.sqlgate.error.ReadOnlyViolationException;
import io.intellixity.sqlgate.error.TableAccessException;
import io.intellixity.sqlgate.exec.QueryResult;
import io.intellixity.sqlgate.governance.DatabaseRegistry;
import io.intellixity.sqlgate.tools.model.QueryResponse;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

final class QueryToolTest {

  private RecordingExecutor executor;
  private final AtomicInteger creates = new AtomicInteger();

  private QueryTool tool(DatabaseConfig db, GlobalSettings settings, Function<String, QueryResult> answers) {
    DatabaseRegistry registry = new DatabaseRegistry(new GatewayConfig(Map.of("db", db), settings), (id, cfg, s) -> {
      creates.incrementAndGet();
      executor = new RecordingExecutor(id, answers);
      return executor;
    });
    return new QueryTool(registry);
  }

  private static DatabaseConfig pg() {
    return DatabaseConfig.builder("postgresql").host("localhost").database("app").username("u").build();
  }

  @Test
  void rejectsNonPositiveLimitAndPage() {
    QueryTool t = tool(pg(), GlobalSettings.defaults(), sql -> RecordingExecutor.rows(0));
    InvalidPaginationException limit = assertThrows(InvalidPaginationException.class,
        () -> t.executeQuery("db", "SELECT 1", 0, 1, false));
    assertEquals("Limit must be greater than 0", limit.getMessage());
    InvalidPaginationException page = assertThrows(InvalidPaginationException.class,
        () -> t.executeQuery("db", "SELECT 1", 10, 0, false));
    assertEquals("Page number must be greater than 0", page.getMessage());
    assertEquals(0, creates.get());
  }

  @Test
  void ddlAndStackedStatementsNeverReachDatabase() {
    QueryTool t = tool(pg(), GlobalSettings.defaults(), sql -> RecordingExecutor.rows(0));
    assertThrows(ReadOnlyViolationException.class,
        () -> t.executeQuery("db", "CREATE FUNCTION f() RETURNS int AS 'select 1' LANGUAGE sql"));
    assertThrows(ReadOnlyViolationException.class, () -> t.executeQuery("db", "COMMENT ON TABLE users IS 'x'"));
    assertThrows(InvalidSqlException.class, () -> t.executeQuery("db", "SELECT 1; DROP TABLE users"));
    assertEquals(0, creates.get());
  }

  @Test
  void mutatingStatementNeverReachesDatabase() {
    QueryTool t = tool(pg(), GlobalSettings.defaults(), sql -> RecordingExecutor.rows(0));
    ReadOnlyViolationException ex = assertThrows(ReadOnlyViolationException.class,
        () -> t.executeQuery("db", "DELETE FROM users"));
    assertEquals("Query contains non-SELECT operations", ex.getMessage());
    assertEquals(0, creates.get());
  }

  @Test
  void forbiddenTableNeverReachesDatabase() {
    DatabaseConfig db = DatabaseConfig.builder("postgresql").host("h").database("app").username("u")
        .disallowedTables(List.of("salaries")).build();
    QueryTool t = tool(db, GlobalSettings.defaults(), sql -> RecordingExecutor.rows(0));
    TableAccessException ex = assertThrows(TableAccessException.class,
        () -> t.executeQuery("db", "SELECT * FROM people p JOIN Salaries s ON s.pid = p.id"));
    assertEquals("Table 'Salaries' is in the excluded list", ex.getMessage());
    assertEquals(0, creates.get());
  }

  @Test
  void limitIsClampedToMaxRows() {
    QueryTool t = tool(pg(), new GlobalSettings(50, 10, null, null), sql -> RecordingExecutor.rows(50));
    QueryResponse r = t.executeQuery("db", "SELECT id FROM users", 500, 1, false);
    assertEquals("SELECT id FROM users LIMIT 50", executor.statements.get(0));
    assertTrue(r.truncated());
    assertEquals(1, r.totalPages());
    assertNull(r.totalRows());
  }

  @Test
  void pageTranslatesToOffset() {
    QueryTool t = tool(pg(), GlobalSettings.defaults(), sql -> RecordingExecutor.rows(4));
    QueryResponse r = t.executeQuery("db", "SELECT id FROM users ORDER BY id", 10, 3, false);
    assertEquals("SELECT id FROM users ORDER BY id LIMIT 10 OFFSET 20", executor.statements.get(0));
    assertFalse(r.truncated());
    assertEquals(3, r.currentPage());
    assertEquals(3, r.totalPages());
    assertEquals(4, r.rowCount());
  }

  @Test
  void accurateCountRunsCountFirst() {
    QueryTool t = tool(pg(), GlobalSettings.defaults(),
        sql -> sql.startsWith("SELECT COUNT(*)") ? RecordingExecutor.count(25) : RecordingExecutor.rows(10));
    QueryResponse r = t.executeQuery("db", "SELECT id FROM users", 10, 1, true);

    assertEquals(2, executor.statements.size());
    assertEquals("SELECT COUNT(*) FROM (SELECT id FROM users) AS count_subquery", executor.statements.get(0));
    assertEquals(25L, r.totalRows());
    assertEquals(3, r.totalPages());
    assertTrue(r.truncated());

    QueryResponse last = t.executeQuery("db", "SELECT id FROM users", 10, 3, true);
    assertFalse(last.truncated());
  }

  @Test
  void emptyCountReportsOnePage() {
    QueryTool t = tool(pg(), GlobalSettings.defaults(),
        sql -> sql.startsWith("SELECT COUNT(*)") ? RecordingExecutor.count(0) : RecordingExecutor.rows(0));
    QueryResponse r = t.executeQuery("db", "SELECT id FROM users", 10, 1, true);
    assertEquals(1, r.totalPages());
    assertEquals(0L, r.totalRows());
    assertEquals("Query returned 0 rows", r.render());
  }

  @Test
  void sampleUsesDefaultSchemaAndSampleSize() {
    QueryTool t = tool(pg(), new GlobalSettings(1000, 3, null, null), sql -> RecordingExecutor.rows(3));
    t.sampleTable("db", "users", null);
    assertEquals("SELECT * FROM public.users LIMIT 3", executor.statements.get(0));
    t.sampleTable("db", "users", "audit");
    assertEquals("SELECT * FROM audit.users LIMIT 3", executor.statements.get(1));
  }
}
