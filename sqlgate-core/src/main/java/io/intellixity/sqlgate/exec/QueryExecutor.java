package io.intellixity.sqlgate.exec;

/**
 * Execution collaborator for one configured database.
 *
 * Implementations hold the connection resources for that database; SQL handed to
 * {@link #execute(String)} has already been validated and bounded by the caller.
 */
public interface QueryExecutor extends AutoCloseable {
  String databaseId();

  /**
   * Runs a single statement and materializes its result.
   *
   * @throws io.intellixity.sqlgate.error.QueryException on any database-side failure
   */
  QueryResult execute(String sql);

  /** Cheap liveness check; throws {@link io.intellixity.sqlgate.error.QueryException} when unreachable. */
  void testConnection();

  /** Releases pooled resources. Idempotent. */
  @Override
  void close();
}
