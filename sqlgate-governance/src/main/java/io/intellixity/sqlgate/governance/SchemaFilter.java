package io.intellixity.sqlgate.governance;

import io.intellixity.sqlgate.config.DatabaseConfig;

import java.util.List;
import java.util.Objects;

/** Include-only or exclude list of schema names for one database. */
public record SchemaFilter(Mode mode, List<String> schemas) {
  public enum Mode { INCLUDE, EXCLUDE }

  public SchemaFilter {
    Objects.requireNonNull(mode, "mode");
    schemas = List.copyOf(schemas);
  }

  /** Filter declared by {@code db}, or null when it declares none. */
  public static SchemaFilter of(DatabaseConfig db) {
    if (db.includeSchemas() != null && !db.includeSchemas().isEmpty()) {
      return new SchemaFilter(Mode.INCLUDE, db.includeSchemas());
    }
    if (db.excludeSchemas() != null && !db.excludeSchemas().isEmpty()) {
      return new SchemaFilter(Mode.EXCLUDE, db.excludeSchemas());
    }
    return null;
  }
}
