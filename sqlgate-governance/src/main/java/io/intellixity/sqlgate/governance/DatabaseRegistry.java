package io.intellixity.sqlgate.governance;

import io.intellixity.sqlgate.config.ConfigChange;
import io.intellixity.sqlgate.config.DatabaseConfig;
import io.intellixity.sqlgate.config.GatewayConfig;
import io.intellixity.sqlgate.config.GlobalSettings;
import io.intellixity.sqlgate.dialect.SqlDialect;
import io.intellixity.sqlgate.exec.QueryExecutor;
import io.intellixity.sqlgate.exec.QueryResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Current configuration plus one lazily created executor per configured database.
 *
 * Reload swaps the configuration atomically, then disposes the executors of every
 * added, removed or modified database; untouched databases keep their pools.
 */
public final class DatabaseRegistry implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(DatabaseRegistry.class);

  private final ExecutorFactory factory;
  private final AtomicReference<GatewayConfig> config;
  private final Map<String, QueryExecutor> executors = new ConcurrentHashMap<>();

  public DatabaseRegistry(GatewayConfig config, ExecutorFactory factory) {
    this.config = new AtomicReference<>(Objects.requireNonNull(config, "config"));
    this.factory = Objects.requireNonNull(factory, "factory");
  }

  public GatewayConfig config() { return config.get(); }

  public GlobalSettings settings() { return config.get().settings(); }

  /** @throws io.intellixity.sqlgate.error.UnknownDatabaseException for unconfigured names */
  public DatabaseConfig database(String name) {
    return config.get().database(name);
  }

  public SqlDialect dialect(String name) {
    return database(name).dialect();
  }

  public String defaultSchema(String name) {
    return database(name).effectiveDefaultSchema();
  }

  /** Configured tool names, or null when every tool is enabled. */
  public List<String> availableTools() {
    return settings().availableTools();
  }

  /**
   * Executor for {@code name}, created on first use.
   * The configuration is read inside the map's compute step, so a reload that swapped the
   * configuration either happens before it (and the new settings are used) or waits for it
   * on the same key and then disposes the created executor.
   */
  public QueryExecutor executor(String name) {
    database(name);
    return executors.computeIfAbsent(name, k -> {
      GatewayConfig current = config.get();
      QueryExecutor e = factory.create(k, current.database(k), current.settings());
      if (e == null) throw new IllegalStateException("ExecutorFactory returned null for " + k);
      return e;
    });
  }

  public QueryResult execute(String name, String sql) {
    return executor(name).execute(sql);
  }

  public synchronized ConfigChange reload(GatewayConfig next) {
    Objects.requireNonNull(next, "next");
    GatewayConfig previous = config.getAndSet(next);
    ConfigChange change = ConfigChange.between(previous, next);
    List<String> disposed = new ArrayList<>();
    for (String name : change.changed()) {
      QueryExecutor e = executors.remove(name);
      if (e != null) {
        e.close();
        disposed.add(name);
      }
    }
    log.info("sqlgate.config op=reload added={} removed={} modified={} disposed={}",
        change.added(), change.removed(), change.modified(), disposed);
    return change;
  }

  /** Names of databases with a live executor. */
  public List<String> activeExecutors() {
    return List.copyOf(executors.keySet());
  }

  @Override
  public void close() {
    List<RuntimeException> failures = new ArrayList<>();
    for (String name : List.copyOf(executors.keySet())) {
      QueryExecutor e = executors.remove(name);
      if (e == null) continue;
      try {
        e.close();
      } catch (RuntimeException ex) {
        failures.add(ex);
      }
    }
    if (!failures.isEmpty()) {
      RuntimeException first = failures.get(0);
      for (int i = 1; i < failures.size(); i++) first.addSuppressed(failures.get(i));
      throw first;
    }
  }
}
