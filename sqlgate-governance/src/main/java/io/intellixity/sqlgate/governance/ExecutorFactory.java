package io.intellixity.sqlgate.governance;

import io.intellixity.sqlgate.config.DatabaseConfig;
import io.intellixity.sqlgate.config.GlobalSettings;
import io.intellixity.sqlgate.exec.QueryExecutor;

@FunctionalInterface
public interface ExecutorFactory {
  QueryExecutor create(String databaseId, DatabaseConfig db, GlobalSettings settings);
}
