package io.intellixity.sqlgate.tools;

import io.intellixity.sqlgate.config.DatabaseConfig;
import io.intellixity.sqlgate.config.GlobalSettings;
import io.intellixity.sqlgate.exec.QueryExecutor;
import io.intellixity.sqlgate.governance.ExecutorFactory;
import io.intellixity.sqlgate.jdbc.JdbcDataSources;
import io.intellixity.sqlgate.jdbc.JdbcQueryExecutor;
import io.intellixity.sqlgate.jdbc.PoolSettings;

import java.util.Objects;

/** Pooled JDBC executors honoring the configured statement timeout. */
public final class JdbcExecutorFactory implements ExecutorFactory {
  private final JdbcDataSources dataSources;

  public JdbcExecutorFactory(PoolSettings pool) {
    this.dataSources = new JdbcDataSources(Objects.requireNonNull(pool, "pool"));
  }

  @Override
  public QueryExecutor create(String databaseId, DatabaseConfig db, GlobalSettings settings) {
    return new JdbcQueryExecutor(dataSources.open(databaseId, db), settings.maxQueryTimeout());
  }
}
