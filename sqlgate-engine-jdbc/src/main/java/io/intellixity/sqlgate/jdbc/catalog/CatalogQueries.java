package io.intellixity.sqlgate.jdbc.catalog;

import io.intellixity.sqlgate.dialect.SqlDialect;
import io.intellixity.sqlgate.error.QueryException;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-dialect catalog SQL, loaded from classpath resources and cached.
 *
 * Templates use {@code {{name}}} placeholders; substituted values are embedded as the body of a
 * single-quoted SQL literal with embedded quotes doubled.
 */
public final class CatalogQueries {
  public static final String TABLE_NAME = "table_name";
  public static final String SCHEMA_NAME = "schema_name";
  public static final String SEARCH_TERM = "search_term";

  private static final String ROOT = "catalog/";

  private final ClassLoader loader;
  private final Map<String, Optional<String>> cache = new ConcurrentHashMap<>();

  public CatalogQueries() {
    this(CatalogQueries.class.getClassLoader());
  }

  public CatalogQueries(ClassLoader loader) {
    this.loader = Objects.requireNonNull(loader, "loader");
  }

  public boolean supports(SqlDialect dialect, CatalogQuery query) {
    return template(dialect, query).isPresent();
  }

  /**
   * @throws QueryException when the dialect ships no template for {@code query}
   */
  public String render(SqlDialect dialect, CatalogQuery query, Map<String, String> params) {
    String sql = template(dialect, query).orElseThrow(() -> new QueryException(
        "Dialect '" + dialect.id() + "' is not supported for " + query.resource() + " queries"));
    for (Map.Entry<String, String> p : params.entrySet()) {
      sql = sql.replace("{{" + p.getKey() + "}}", literalBody(p.getValue()));
    }
    return sql;
  }

  static String literalBody(String value) {
    return value == null ? "" : value.replace("'", "''");
  }

  private Optional<String> template(SqlDialect dialect, CatalogQuery query) {
    String path = ROOT + dialect.id() + "/" + query.resource() + ".sql";
    return cache.computeIfAbsent(path, this::read);
  }

  private Optional<String> read(String path) {
    try (InputStream in = loader.getResourceAsStream(path)) {
      if (in == null) return Optional.empty();
      return Optional.of(new String(in.readAllBytes(), StandardCharsets.UTF_8).strip());
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read catalog template " + path, e);
    }
  }
}
