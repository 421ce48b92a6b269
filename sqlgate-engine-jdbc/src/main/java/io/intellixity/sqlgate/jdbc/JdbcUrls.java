package io.intellixity.sqlgate.jdbc;

import io.intellixity.sqlgate.config.DatabaseConfig;
import io.intellixity.sqlgate.dialect.SqlDialect;
import io.intellixity.sqlgate.error.ConfigurationException;

/** Derives a JDBC URL from a database configuration. */
public final class JdbcUrls {
  private JdbcUrls() {}

  public static String of(DatabaseConfig db) {
    if (db.connectionString() != null && !db.connectionString().isBlank()) {
      return db.connectionString().trim();
    }
    SqlDialect d = db.dialect();
    return switch (d) {
      case POSTGRESQL -> "jdbc:postgresql://" + hostPort(db, 5432) + "/" + db.database();
      case MYSQL -> "jdbc:mysql://" + hostPort(db, 3306) + "/" + db.database();
      case SQLITE -> "jdbc:sqlite:" + db.database();
      case MSSQL -> "jdbc:sqlserver://" + hostPort(db, 1433) + ";databaseName=" + db.database() + ";encrypt=false";
      case SNOWFLAKE -> "jdbc:snowflake://" + db.host() + "/?db=" + db.database()
          + (db.defaultSchema() == null ? "" : "&schema=" + db.defaultSchema());
      case GENERIC -> throw new ConfigurationException("Unsupported database type: " + db.type());
    };
  }

  private static String hostPort(DatabaseConfig db, int defaultPort) {
    return db.host() + ":" + (db.port() == null ? defaultPort : db.port());
  }
}
