package io.intellixity.sqlgate.dialect;

import java.util.Locale;

/**
 * Logical database dialects understood by the gateway.
 *
 * Maps configured type names to a dialect and carries the per-dialect knobs the
 * transformer and the catalog lookups need.
 * {@link #GENERIC} is the passthrough for names without catalog support.
 */
public enum SqlDialect {
  POSTGRESQL("postgresql", PaginationStyle.LIMIT_OFFSET, "public", true),
  MYSQL("mysql", PaginationStyle.LIMIT_OFFSET, null, true),
  SQLITE("sqlite", PaginationStyle.LIMIT_OFFSET, "main", true),
  MSSQL("mssql", PaginationStyle.TOP_OR_OFFSET_FETCH, "dbo", true),
  SNOWFLAKE("snowflake", PaginationStyle.LIMIT_OFFSET, "PUBLIC", true),
  GENERIC("generic", PaginationStyle.LIMIT_OFFSET, null, false);

  /** How a row window is expressed in rendered SQL. */
  public enum PaginationStyle {
    LIMIT_OFFSET,
    /** {@code TOP n} without an offset, {@code OFFSET m ROWS FETCH NEXT n ROWS ONLY} with one. */
    TOP_OR_OFFSET_FETCH
  }

  private final String id;
  private final PaginationStyle paginationStyle;
  private final String defaultSchema;
  private final boolean configurable;

  SqlDialect(String id, PaginationStyle paginationStyle, String defaultSchema, boolean configurable) {
    this.id = id;
    this.paginationStyle = paginationStyle;
    this.defaultSchema = defaultSchema;
    this.configurable = configurable;
  }

  /** Directory name of this dialect's catalog templates. */
  public String id() { return id; }

  public PaginationStyle paginationStyle() { return paginationStyle; }

  /**
   * Schema used when a request does not name one.
   * MySQL has no fixed default: its schema is the configured database, so null is returned.
   */
  public String defaultSchema() { return defaultSchema; }

  /** Whether the type may appear as a configured database type. */
  public boolean configurable() { return configurable; }

  /** Bracket-quoted identifiers ({@code [dbo].[Users]}) are only valid on SQL Server. */
  public boolean squareBracketIdentifiers() { return this == MSSQL; }

  public static SqlDialect fromName(String name) {
    if (name == null || name.isBlank()) return GENERIC;
    return switch (name.trim().toLowerCase(Locale.ROOT)) {
      case "postgres", "postgresql" -> POSTGRESQL;
      case "mysql" -> MYSQL;
      case "sqlite" -> SQLITE;
      case "mssql", "tsql", "sqlserver" -> MSSQL;
      case "snowflake" -> SNOWFLAKE;
      default -> GENERIC;
    };
  }

  /** Strict variant used by configuration validation: unknown names yield null instead of GENERIC. */
  public static SqlDialect configuredType(String name) {
    SqlDialect d = fromName(name);
    return d.configurable() ? d : null;
  }
}
