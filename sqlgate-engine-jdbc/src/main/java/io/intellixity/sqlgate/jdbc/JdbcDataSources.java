package io.intellixity.sqlgate.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.intellixity.sqlgate.config.DatabaseConfig;
import io.intellixity.sqlgate.dialect.SqlDialect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/** Builds one HikariCP pool per configured database. */
public final class JdbcDataSources {
  private static final Logger log = LoggerFactory.getLogger(JdbcDataSources.class);

  private final PoolSettings pool;

  public JdbcDataSources(PoolSettings pool) {
    this.pool = Objects.requireNonNull(pool, "pool");
  }

  public JdbcHandle open(String databaseId, DatabaseConfig db) {
    Objects.requireNonNull(databaseId, "databaseId");
    Objects.requireNonNull(db, "db");
    String url = JdbcUrls.of(db);

    HikariConfig hc = new HikariConfig();
    hc.setPoolName("sqlgate-" + databaseId);
    hc.setJdbcUrl(url);
    if (db.username() != null) hc.setUsername(db.username());
    if (db.password() != null) hc.setPassword(db.password());
    hc.setMaximumPoolSize(pool.maximumPoolSize());
    hc.setConnectionTimeout(pool.connectionTimeoutMillis());
    // the pool starts lazily so an unreachable database does not fail configuration loading
    hc.setInitializationFailTimeout(-1);
    hc.setMinimumIdle(0);
    boolean readOnly = supportsReadOnlyFlag(db.dialect());
    hc.setReadOnly(readOnly);

    log.info("sqlgate.pool op=open database={} type={} maxPoolSize={}", databaseId, db.type(), pool.maximumPoolSize());
    return new JdbcHandle(databaseId, new HikariDataSource(hc), db.effectiveDefaultSchema(), readOnly);
  }

  // sqlite-jdbc rejects the flag on an open connection and snowflake-jdbc does not implement it
  static boolean supportsReadOnlyFlag(SqlDialect dialect) {
    return dialect == SqlDialect.POSTGRESQL || dialect == SqlDialect.MYSQL || dialect == SqlDialect.MSSQL;
  }
}
