package io.intellixity.sqlgate.jdbc;

/** HikariCP knobs shared by every database pool. */
public record PoolSettings(int maximumPoolSize, long connectionTimeoutMillis) {
  public static final PoolSettings DEFAULTS = new PoolSettings(5, 30_000L);

  public PoolSettings {
    if (maximumPoolSize <= 0) throw new IllegalArgumentException("maximumPoolSize must be > 0");
    if (connectionTimeoutMillis < 250) throw new IllegalArgumentException("connectionTimeoutMillis must be >= 250");
  }
}
