package io.intellixity.sqlgate.jdbc;

import io.intellixity.sqlgate.error.QueryException;
import io.intellixity.sqlgate.exec.QueryExecutor;
import io.intellixity.sqlgate.exec.QueryResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Objects;

/** {@link QueryExecutor} over a pooled JDBC {@link javax.sql.DataSource}. */
public final class JdbcQueryExecutor implements QueryExecutor {
  private static final Logger log = LoggerFactory.getLogger(JdbcQueryExecutor.class);
  private static final int VALIDATION_TIMEOUT_SECONDS = 5;

  private final JdbcHandle handle;
  private final Integer queryTimeoutSeconds;

  public JdbcQueryExecutor(JdbcHandle handle, Integer queryTimeoutSeconds) {
    this.handle = Objects.requireNonNull(handle, "handle");
    this.queryTimeoutSeconds = queryTimeoutSeconds;
  }

  @Override
  public String databaseId() { return handle.id(); }

  public JdbcHandle handle() { return handle; }

  @Override
  public QueryResult execute(String sql) {
    Objects.requireNonNull(sql, "sql");
    long start = System.nanoTime();
    debugSql("QUERY", sql);
    try (Connection c = handle.client().getConnection()) {
      if (handle.readOnlyConnections() && !c.isReadOnly()) c.setReadOnly(true);
      try (Statement st = c.createStatement()) {
        if (queryTimeoutSeconds != null) st.setQueryTimeout(queryTimeoutSeconds);
        if (!st.execute(sql)) {
          debugDone("QUERY", st.getUpdateCount(), System.nanoTime() - start);
          return QueryResult.empty();
        }
        try (ResultSet rs = st.getResultSet()) {
          QueryResult out = JdbcResultReader.read(rs);
          debugDone("QUERY", out.rowCount(), System.nanoTime() - start);
          return out;
        }
      }
    } catch (SQLException e) {
      throw new QueryException("Query failed on database '" + handle.id() + "': " + e.getMessage(), e);
    }
  }

  @Override
  public void testConnection() {
    debugSql("PING", "<isValid>");
    try (Connection c = handle.client().getConnection()) {
      if (!c.isValid(VALIDATION_TIMEOUT_SECONDS)) {
        throw new QueryException("Connection to database '" + handle.id() + "' is not valid");
      }
    } catch (SQLException e) {
      throw new QueryException("Query failed on database '" + handle.id() + "': " + e.getMessage(), e);
    }
  }

  @Override
  public void close() {
    handle.close();
  }

  private void debugSql(String op, String sql) {
    if (!log.isDebugEnabled()) return;
    log.debug("sqlgate.jdbc op={} database={} schema={} timeoutSec={} sql={}",
        op, handle.id(), handle.schema() == null ? "null" : handle.schema(),
        queryTimeoutSeconds == null ? "none" : queryTimeoutSeconds, sql);
  }

  private void debugDone(String op, long rows, long durationNanos) {
    if (!log.isDebugEnabled()) return;
    log.debug("sqlgate.jdbc_done op={} database={} durationMs={} rows={}",
        op, handle.id(), durationNanos / 1_000_000.0, rows);
  }
}
