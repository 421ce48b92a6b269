package io.intellixity.sqlgate.config;

import io.intellixity.sqlgate.dialect.SqlDialect;
import io.intellixity.sqlgate.error.ConfigurationException;

import java.util.List;

/**
 * One configured database. Validated on construction; equality drives reload change detection.
 */
public record DatabaseConfig(
    String type,
    String description,
    String connectionString,
    String host,
    Integer port,
    String database,
    String username,
    String password,
    String defaultSchema,
    List<String> includeSchemas,
    List<String> excludeSchemas,
    List<String> allowedTables,
    List<String> disallowedTables
) {
  public DatabaseConfig {
    if (SqlDialect.configuredType(type) == null) {
      throw new ConfigurationException("Unsupported database type: " + type);
    }
    boolean hasConnectionString = !isBlank(connectionString);
    if (SqlDialect.configuredType(type) == SqlDialect.SQLITE) {
      if (!hasConnectionString && isBlank(database)) {
        throw new ConfigurationException("Either connection_string or database must be provided");
      }
    } else if (!hasConnectionString && (isBlank(host) || isBlank(database) || isBlank(username))) {
      throw new ConfigurationException("Either connection_string or host/database/username must be provided");
    }
    if (port != null && (port <= 0 || port > 65535)) {
      throw new ConfigurationException("Invalid port: " + port);
    }
    if (notEmpty(includeSchemas) && notEmpty(excludeSchemas)) {
      throw new ConfigurationException("Cannot specify both include_schemas and exclude_schemas");
    }
    if (notEmpty(allowedTables) && notEmpty(disallowedTables)) {
      throw new ConfigurationException("Cannot specify both allowed_tables and disallowed_tables");
    }
    description = description == null ? "" : description;
    includeSchemas = copyOrNull(includeSchemas);
    excludeSchemas = copyOrNull(excludeSchemas);
    allowedTables = copyOrNull(allowedTables);
    disallowedTables = copyOrNull(disallowedTables);
  }

  public static Builder builder(String type) {
    return new Builder(type);
  }

  public SqlDialect dialect() {
    return SqlDialect.configuredType(type);
  }

  /** Configured default schema, else the dialect's; on MySQL the schema is the database itself. */
  public String effectiveDefaultSchema() {
    if (!isBlank(defaultSchema)) return defaultSchema;
    if (dialect() == SqlDialect.MYSQL) return database;
    return dialect().defaultSchema();
  }

  private static boolean isBlank(String s) {
    return s == null || s.isBlank();
  }

  private static boolean notEmpty(List<String> l) {
    return l != null && !l.isEmpty();
  }

  private static List<String> copyOrNull(List<String> l) {
    return l == null ? null : List.copyOf(l);
  }

  public static final class Builder {
    private final String type;
    private String description;
    private String connectionString;
    private String host;
    private Integer port;
    private String database;
    private String username;
    private String password;
    private String defaultSchema;
    private List<String> includeSchemas;
    private List<String> excludeSchemas;
    private List<String> allowedTables;
    private List<String> disallowedTables;

    private Builder(String type) { this.type = type; }

    public Builder description(String v) { this.description = v; return this; }
    public Builder connectionString(String v) { this.connectionString = v; return this; }
    public Builder host(String v) { this.host = v; return this; }
    public Builder port(Integer v) { this.port = v; return this; }
    public Builder database(String v) { this.database = v; return this; }
    public Builder username(String v) { this.username = v; return this; }
    public Builder password(String v) { this.password = v; return this; }
    public Builder defaultSchema(String v) { this.defaultSchema = v; return this; }
    public Builder includeSchemas(List<String> v) { this.includeSchemas = v; return this; }
    public Builder excludeSchemas(List<String> v) { this.excludeSchemas = v; return this; }
    public Builder allowedTables(List<String> v) { this.allowedTables = v; return this; }
    public Builder disallowedTables(List<String> v) { this.disallowedTables = v; return this; }

    public DatabaseConfig build() {
      return new DatabaseConfig(type, description, connectionString, host, port, database, username, password,
          defaultSchema, includeSchemas, excludeSchemas, allowedTables, disallowedTables);
    }
  }
}
