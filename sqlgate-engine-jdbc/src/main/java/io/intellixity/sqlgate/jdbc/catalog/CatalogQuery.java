package io.intellixity.sqlgate.jdbc.catalog;

/** Named catalog lookups; each maps to {@code catalog/<dialect>/<resource>.sql}. */
public enum CatalogQuery {
  TABLE_EXISTS("table_exists"),
  COLUMNS("columns"),
  FOREIGN_KEY("foreign_key"),
  PRIMARY_KEY("primary_key"),
  ENUM_VALUES("enum_values"),
  SEARCH("search");

  private final String resource;

  CatalogQuery(String resource) {
    this.resource = resource;
  }

  public String resource() { return resource; }
}
