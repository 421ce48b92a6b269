package io.intellixity.sqlgate.jdbc;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Objects;

/** Pooled JDBC access for one configured database. */
public final class JdbcHandle implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(JdbcHandle.class);

  private final String id;
  private final DataSource client;
  private final String schema;
  private final boolean readOnlyConnections;

  public JdbcHandle(String id, DataSource client, String schema, boolean readOnlyConnections) {
    this.id = Objects.requireNonNull(id, "id");
    this.client = Objects.requireNonNull(client, "client");
    this.schema = (schema == null || schema.isBlank()) ? null : schema;
    this.readOnlyConnections = readOnlyConnections;
  }

  public String id() { return id; }
  public DataSource client() { return client; }
  public String schema() { return schema; }

  /** Whether connections should be flagged read-only before use. */
  public boolean readOnlyConnections() { return readOnlyConnections; }

  @Override
  public void close() {
    if (!(client instanceof Closeable c)) return;
    try {
      c.close();
      log.info("sqlgate.pool op=close database={}", id);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to close pool for database '" + id + "'", e);
    }
  }
}
