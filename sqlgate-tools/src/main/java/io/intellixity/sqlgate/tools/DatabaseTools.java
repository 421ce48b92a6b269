package io.intellixity.sqlgate.tools;

import io.intellixity.sqlgate.config.ConfigChange;
import io.intellixity.sqlgate.config.DatabaseConfig;
import io.intellixity.sqlgate.config.GatewayConfig;
import io.intellixity.sqlgate.governance.DatabaseRegistry;
import io.intellixity.sqlgate.tools.model.ConnectionStatus;
import io.intellixity.sqlgate.tools.model.DatabaseInfo;
import io.intellixity.sqlgate.tools.model.DatabaseList;
import io.intellixity.sqlgate.tools.model.ReloadResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/** Configuration-level tools: listing, reloading and connectivity checks. */
public final class DatabaseTools {
  private static final Logger log = LoggerFactory.getLogger(DatabaseTools.class);

  private final DatabaseRegistry registry;
  private final Supplier<GatewayConfig> configSource;

  /**
   * @param configSource re-reads the configuration for {@link #reloadConfig()}
   */
  public DatabaseTools(DatabaseRegistry registry, Supplier<GatewayConfig> configSource) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.configSource = Objects.requireNonNull(configSource, "configSource");
  }

  public DatabaseList listDatabases() {
    List<DatabaseInfo> out = new ArrayList<>();
    for (Map.Entry<String, DatabaseConfig> e : registry.config().databases().entrySet()) {
      DatabaseConfig db = e.getValue();
      out.add(new DatabaseInfo(e.getKey(), db.description() == null ? "" : db.description(), db.type(),
          db.host(), db.port(), db.username(), db.database()));
    }
    return DatabaseList.of(out);
  }

  /** Re-reads the configuration; a file that fails validation leaves the current one in place. */
  public ReloadResponse reloadConfig() {
    GatewayConfig next = configSource.get();
    ConfigChange change = registry.reload(next);
    return ReloadResponse.of(change);
  }

  public ConnectionStatus testConnection(String database) {
    registry.database(database);
    try {
      registry.executor(database).testConnection();
      return new ConnectionStatus(database, true, "Connection successful");
    } catch (RuntimeException e) {
      log.warn("sqlgate.tool op=test_connection database={} connected=false", database, e);
      return new ConnectionStatus(database, false, e.getMessage());
    }
  }
}
