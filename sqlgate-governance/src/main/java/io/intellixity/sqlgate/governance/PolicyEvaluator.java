package io.intellixity.sqlgate.governance;

import io.intellixity.sqlgate.config.DatabaseConfig;
import io.intellixity.sqlgate.dialect.SqlDialect;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Translates a database's schema and table filters into WHERE fragments over the
 * search result columns ({@code schema_name}, {@code object_name}, {@code object_type}).
 * <p>
 * An explicit schema argument replaces the configured schema filter for that call.
 * Table filters only constrain rows whose {@code object_type} is {@code table}.
 */
public final class PolicyEvaluator {
  static final String SCHEMA_COLUMN = "schema_name";

  public QueryPolicy forSearch(DatabaseConfig db, String schemaOverride) {
    List<String> fragments = new ArrayList<>();

    if (schemaOverride != null && !schemaOverride.isBlank()) {
      fragments.add("LOWER(" + SCHEMA_COLUMN + ") = LOWER(" + literal(schemaOverride) + ")");
    } else {
      SchemaFilter sf = SchemaFilter.of(db);
      if (sf != null) {
        String op = sf.mode() == SchemaFilter.Mode.INCLUDE ? "IN" : "NOT IN";
        fragments.add("LOWER(" + SCHEMA_COLUMN + ") " + op + " (" + lowerLiterals(sf.schemas()) + ")");
      }
    }

    TableAccessPolicy tables = TableAccessPolicy.of(db);
    if (tables.restricted()) {
      String column = objectNameColumn(db.dialect());
      boolean allow = tables.allowed() != null;
      String op = allow ? "IN" : "NOT IN";
      List<String> names = allow ? tables.allowed() : tables.disallowed();
      fragments.add("LOWER(" + column + ") " + op + " (" + lowerLiterals(names) + ") OR object_type != 'table'");
    }
    return new QueryPolicy(fragments, tables);
  }

  // the SQLite search template selects straight from sqlite_master
  static String objectNameColumn(SqlDialect dialect) {
    return dialect == SqlDialect.SQLITE ? "name" : "object_name";
  }

  static String literal(String value) {
    return "'" + value.replace("'", "''") + "'";
  }

  private static String lowerLiterals(List<String> values) {
    return values.stream()
        .map(v -> literal(v.toLowerCase(Locale.ROOT)))
        .collect(Collectors.joining(", "));
  }
}
