package io.intellixity.sqlgate.server.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "sqlgate")
public class SqlGateProperties {
  /** Gateway YAML file; when absent the file is discovered from arguments, environment and home directory. */
  private String configPath;
  private final Pool pool = new Pool();

  public String getConfigPath() { return configPath; }
  public void setConfigPath(String configPath) { this.configPath = configPath; }
  public Pool getPool() { return pool; }

  public static class Pool {
    private int maximumPoolSize = 5;
    private long connectionTimeoutMs = 30_000L;

    public int getMaximumPoolSize() { return maximumPoolSize; }
    public void setMaximumPoolSize(int maximumPoolSize) { this.maximumPoolSize = maximumPoolSize; }
    public long getConnectionTimeoutMs() { return connectionTimeoutMs; }
    public void setConnectionTimeoutMs(long connectionTimeoutMs) { this.connectionTimeoutMs = connectionTimeoutMs; }
  }
}
