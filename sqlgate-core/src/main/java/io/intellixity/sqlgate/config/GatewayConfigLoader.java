package io.intellixity.sqlgate.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import io.intellixity.sqlgate.error.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Reads the YAML configuration file into a validated {@link GatewayConfig}. */
public final class GatewayConfigLoader {
  private static final Logger log = LoggerFactory.getLogger(GatewayConfigLoader.class);

  private final YAMLMapper mapper = new YAMLMapper();

  public GatewayConfig load(Path path) {
    if (path == null || !Files.isRegularFile(path)) {
      throw new ConfigurationException("Config file not found: " + path);
    }
    String yaml;
    try {
      yaml = Files.readString(path);
    } catch (IOException e) {
      throw new ConfigurationException("Failed to read config file " + path + ": " + e.getMessage(), e);
    }
    GatewayConfig cfg = parse(yaml, path);
    log.info("sqlgate.config op=load path={} databases={}", path, cfg.databases().keySet());
    return cfg;
  }

  public GatewayConfig parse(String yaml) {
    return parse(yaml, null);
  }

  private GatewayConfig parse(String yaml, Path source) {
    JsonNode root;
    try {
      root = mapper.readTree(yaml == null ? "" : yaml);
    } catch (IOException e) {
      throw new ConfigurationException("Invalid config file: " + e.getMessage(), e);
    }
    if (root == null || root.isNull() || root.isMissingNode()) {
      return new GatewayConfig(Map.of(), GlobalSettings.defaults(), source);
    }
    if (!root.isObject()) throw new ConfigurationException("Config root must be a mapping");

    Map<String, DatabaseConfig> databases = new LinkedHashMap<>();
    JsonNode dbs = root.get("databases");
    if (dbs != null && !dbs.isNull()) {
      if (!dbs.isObject()) throw new ConfigurationException("'databases' must be a mapping");
      Iterator<Map.Entry<String, JsonNode>> it = dbs.fields();
      while (it.hasNext()) {
        Map.Entry<String, JsonNode> e = it.next();
        databases.put(e.getKey(), parseDatabase(e.getKey(), e.getValue()));
      }
    }
    return new GatewayConfig(databases, parseSettings(root.get("settings")), source);
  }

  private static DatabaseConfig parseDatabase(String name, JsonNode n) {
    if (n == null || !n.isObject()) throw new ConfigurationException("Database '" + name + "' must be a mapping");
    try {
      return DatabaseConfig.builder(textOrNull(n.get("type")))
          .description(textOrNull(n.get("description")))
          .connectionString(textOrNull(n.get("connection_string")))
          .host(textOrNull(n.get("host")))
          .port(intOrNull(n.get("port"), "port"))
          .database(textOrNull(n.get("database")))
          .username(textOrNull(n.get("username")))
          .password(textOrNull(n.get("password")))
          .defaultSchema(textOrNull(n.get("default_schema")))
          .includeSchemas(stringsOrNull(n.get("include_schemas")))
          .excludeSchemas(stringsOrNull(n.get("exclude_schemas")))
          .allowedTables(stringsOrNull(n.get("allowed_tables")))
          .disallowedTables(stringsOrNull(n.get("disallowed_tables")))
          .build();
    } catch (ConfigurationException e) {
      throw new ConfigurationException("Database '" + name + "': " + e.getMessage(), e);
    }
  }

  private static GlobalSettings parseSettings(JsonNode n) {
    if (n == null || n.isNull()) return GlobalSettings.defaults();
    if (!n.isObject()) throw new ConfigurationException("'settings' must be a mapping");
    Integer maxRows = intOrNull(n.get("max_rows_per_query"), "max_rows_per_query");
    Integer sample = intOrNull(n.get("sample_size"), "sample_size");
    return new GlobalSettings(
        maxRows == null ? GlobalSettings.DEFAULT_MAX_ROWS_PER_QUERY : maxRows,
        sample == null ? GlobalSettings.DEFAULT_SAMPLE_SIZE : sample,
        intOrNull(n.get("max_query_timeout"), "max_query_timeout"),
        stringsOrNull(n.get("available_tools"))
    );
  }

  private static String textOrNull(JsonNode n) {
    if (n == null || n.isNull()) return null;
    return n.isValueNode() ? n.asText() : n.toString();
  }

  private static Integer intOrNull(JsonNode n, String field) {
    if (n == null || n.isNull()) return null;
    if (n.canConvertToInt() && n.isIntegralNumber()) return n.intValue();
    if (n.isTextual()) {
      try {
        return Integer.parseInt(n.asText().trim());
      } catch (NumberFormatException e) {
        throw new ConfigurationException(field + " must be an integer", e);
      }
    }
    throw new ConfigurationException(field + " must be an integer");
  }

  private static List<String> stringsOrNull(JsonNode n) {
    if (n == null || n.isNull()) return null;
    List<String> out = new ArrayList<>();
    if (n.isArray()) {
      for (JsonNode x : n) if (x.isValueNode() && !x.isNull()) out.add(x.asText());
    } else if (n.isValueNode()) {
      out.add(n.asText());
    }
    return out;
  }
}
