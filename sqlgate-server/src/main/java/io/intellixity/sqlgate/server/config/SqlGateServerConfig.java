package io.intellixity.sqlgate.server.config;

import io.intellixity.sqlgate.config.ConfigLocator;
import io.intellixity.sqlgate.config.GatewayConfig;
import io.intellixity.sqlgate.config.GatewayConfigLoader;
import io.intellixity.sqlgate.governance.DatabaseRegistry;
import io.intellixity.sqlgate.jdbc.PoolSettings;
import io.intellixity.sqlgate.jdbc.catalog.CatalogQueries;
import io.intellixity.sqlgate.tools.GatewayTools;
import io.intellixity.sqlgate.tools.JdbcExecutorFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

@Configuration
@EnableConfigurationProperties(SqlGateProperties.class)
public class SqlGateServerConfig {

  @Bean
  public GatewayConfigLoader gatewayConfigLoader() {
    return new GatewayConfigLoader();
  }

  @Bean
  public Path gatewayConfigPath(SqlGateProperties props, ApplicationArguments args) {
    String explicit = props.getConfigPath();
    if (explicit != null && !explicit.isBlank()) return Path.of(explicit.trim());
    return ConfigLocator.system().locate(args.getSourceArgs());
  }

  @Bean(destroyMethod = "close")
  public DatabaseRegistry databaseRegistry(GatewayConfigLoader loader, Path gatewayConfigPath, SqlGateProperties props) {
    GatewayConfig config = loader.load(gatewayConfigPath);
    PoolSettings pool = new PoolSettings(props.getPool().getMaximumPoolSize(), props.getPool().getConnectionTimeoutMs());
    return new DatabaseRegistry(config, new JdbcExecutorFactory(pool));
  }

  @Bean
  public CatalogQueries catalogQueries() {
    return new CatalogQueries();
  }

  @Bean
  public GatewayTools gatewayTools(DatabaseRegistry registry, CatalogQueries catalog,
                                   GatewayConfigLoader loader, Path gatewayConfigPath) {
    return new GatewayTools(registry, catalog, () -> loader.load(gatewayConfigPath));
  }
}
