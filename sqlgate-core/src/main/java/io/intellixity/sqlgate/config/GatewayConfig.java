package io.intellixity.sqlgate.config;

import io.intellixity.sqlgate.error.ConfigurationException;
import io.intellixity.sqlgate.error.UnknownDatabaseException;

import java.nio.file.Path;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/** Whole configuration file: databases in declaration order plus global settings. */
public record GatewayConfig(Map<String, DatabaseConfig> databases, GlobalSettings settings, Path source) {
  public GatewayConfig {
    Objects.requireNonNull(databases, "databases");
    settings = settings == null ? GlobalSettings.defaults() : settings;
    Set<String> seen = new HashSet<>();
    for (String name : databases.keySet()) {
      if (!seen.add(name.toLowerCase(Locale.ROOT))) {
        throw new ConfigurationException(name + " is defined twice!");
      }
    }
    databases = Collections.unmodifiableMap(new LinkedHashMap<>(databases));
  }

  public GatewayConfig(Map<String, DatabaseConfig> databases, GlobalSettings settings) {
    this(databases, settings, null);
  }

  public DatabaseConfig database(String name) {
    DatabaseConfig db = name == null ? null : databases.get(name);
    if (db == null) throw new UnknownDatabaseException("Database '" + name + "' not found in configuration");
    return db;
  }
}
