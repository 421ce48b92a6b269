package io.intellixity.sqlgate.governance;

import io.intellixity.sqlgate.config.DatabaseConfig;
import io.intellixity.sqlgate.error.TableAccessException;
import io.intellixity.sqlgate.transform.SqlQueryTransformer;

import java.util.List;
import java.util.Locale;

/**
 * Table allow/deny lists of one database. At most one side is set; both null means unrestricted.
 */
public record TableAccessPolicy(List<String> allowed, List<String> disallowed) {
  public static final TableAccessPolicy UNRESTRICTED = new TableAccessPolicy(null, null);

  public TableAccessPolicy {
    allowed = allowed == null || allowed.isEmpty() ? null : List.copyOf(allowed);
    disallowed = disallowed == null || disallowed.isEmpty() ? null : List.copyOf(disallowed);
  }

  public static TableAccessPolicy of(DatabaseConfig db) {
    return new TableAccessPolicy(db.allowedTables(), db.disallowedTables());
  }

  public boolean restricted() {
    return allowed != null || disallowed != null;
  }

  /** Validates every table the statement references. */
  public SqlQueryTransformer enforce(SqlQueryTransformer transformer) {
    return transformer.validateTableAccess(allowed, disallowed);
  }

  /** Validates a single table named by a structural request. */
  public void check(String table) {
    String key = fold(table);
    if (allowed != null && allowed.stream().map(TableAccessPolicy::fold).noneMatch(key::equals)) {
      throw new TableAccessException("Table '" + table + "' is not in the allowed list");
    }
    if (disallowed != null && disallowed.stream().map(TableAccessPolicy::fold).anyMatch(key::equals)) {
      throw new TableAccessException("Table '" + table + "' is in the excluded list");
    }
  }

  private static String fold(String s) {
    return s == null ? "" : s.trim().toLowerCase(Locale.ROOT);
  }
}
