package io.intellixity.sqlgate.governance;

import io.intellixity.sqlgate.config.DatabaseConfig;
import io.intellixity.sqlgate.transform.SqlQueryTransformer;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class PolicyEvaluatorTest {
  private final PolicyEvaluator evaluator = new PolicyEvaluator();

  private static DatabaseConfig.Builder pg() {
    return DatabaseConfig.builder("postgresql").host("localhost").database("db").username("u");
  }

  @Test
  void noFiltersYieldsNoFragments() {
    QueryPolicy p = evaluator.forSearch(pg().build(), null);
    assertTrue(p.whereFragments().isEmpty());
    assertFalse(p.tableAccess().restricted());
  }

  @Test
  void explicitSchemaReplacesConfiguredFilter() {
    QueryPolicy p = evaluator.forSearch(pg().includeSchemas(List.of("sales")).build(), "Hr");
    assertEquals(List.of("LOWER(schema_name) = LOWER('Hr')"), p.whereFragments());
  }

  @Test
  void includeAndExcludeSchemasAreLowerCased() {
    QueryPolicy inc = evaluator.forSearch(pg().includeSchemas(List.of("Sales", "HR")).build(), null);
    assertEquals(List.of("LOWER(schema_name) IN ('sales', 'hr')"), inc.whereFragments());

    QueryPolicy exc = evaluator.forSearch(pg().excludeSchemas(List.of("pg_catalog")).build(), "  ");
    assertEquals(List.of("LOWER(schema_name) NOT IN ('pg_catalog')"), exc.whereFragments());
  }

  @Test
  void tableFilterLeavesNonTableRowsAlone() {
    QueryPolicy p = evaluator.forSearch(pg().allowedTables(List.of("Users")).build(), null);
    assertEquals(List.of("LOWER(object_name) IN ('users') OR object_type != 'table'"), p.whereFragments());

    DatabaseConfig lite = DatabaseConfig.builder("sqlite").database("x.db")
        .disallowedTables(List.of("secrets")).build();
    assertEquals(List.of("LOWER(name) NOT IN ('secrets') OR object_type != 'table'"),
        evaluator.forSearch(lite, null).whereFragments());
  }

  @Test
  void quotesInNamesAreEscaped() {
    QueryPolicy p = evaluator.forSearch(pg().build(), "o'brien");
    assertEquals("LOWER(schema_name) = LOWER('o''brien')", p.whereFragments().get(0));
  }

  @Test
  void fragmentsAreAndedIntoQuery() {
    QueryPolicy p = evaluator.forSearch(pg().excludeSchemas(List.of("tmp")).allowedTables(List.of("a")).build(), null);
    SqlQueryTransformer t = p.applyFilters(
        new SqlQueryTransformer("SELECT object_name, object_type, schema_name FROM objects WHERE x = 1", "postgres"));
    String sql = t.sql();
    assertTrue(sql.contains("x = 1 AND LOWER(schema_name) NOT IN ('tmp')"), sql);
    assertTrue(sql.contains("(LOWER(object_name) IN ('a') OR object_type != 'table')"), sql);
  }
}
