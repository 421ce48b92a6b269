package io.intellixity.sqlgate.tools;

import io.intellixity.sqlgate.config.DatabaseConfig;
import io.intellixity.sqlgate.config.GatewayConfig;
import io.intellixity.sqlgate.config.GlobalSettings;
import io.intellixity.sqlgate.error.ConfigurationException;
import io.intellixity.sqlgate.error.QueryException;
import io.intellixity.sqlgate.error.UnknownDatabaseException;
import io.intellixity.sqlgate.exec.QueryResult;
import io.intellixity.sqlgate.governance.DatabaseRegistry;
import io.intellixity.sqlgate.tools.model.ConnectionStatus;
import io.intellixity.sqlgate.tools.model.DatabaseList;
import io.intellixity.sqlgate.tools.model.ReloadResponse;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

final class DatabaseToolsTest {

  private static DatabaseConfig chinook() {
    return DatabaseConfig.builder("sqlite").description("Music store").database("./Chinook.sqlite").build();
  }

  private static DatabaseConfig warehouse() {
    return DatabaseConfig.builder("postgresql").description("Analytics warehouse, nightly loads")
        .host("db.internal").port(5432).database("dw").username("reader").password("secret").build();
  }

  private static GatewayConfig config(Map<String, DatabaseConfig> dbs) {
    return new GatewayConfig(dbs, GlobalSettings.defaults());
  }

  @Test
  void listsDatabasesWithoutPasswords() {
    Map<String, DatabaseConfig> dbs = new LinkedHashMap<>();
    dbs.put("chinook", chinook());
    dbs.put("dw", warehouse());
    DatabaseRegistry registry = new DatabaseRegistry(config(dbs), (id, db, s) -> fail("lazy"));
    DatabaseList list = new DatabaseTools(registry, () -> fail("no reload")).listDatabases();

    assertEquals(2, list.totalCount());
    assertEquals("dw", list.databases().get(1).name());
    assertEquals(5432, list.databases().get(1).port());
    assertEquals(
        "Music store" + " ".repeat(10) + "./Chinook.sqlite\n"
            + "Analytics warehou..  reader@db.internal:5432",
        list.render());
  }

  @Test
  void emptyConfigRendersPlaceholder() {
    DatabaseRegistry registry = new DatabaseRegistry(config(Map.of()), (id, db, s) -> fail("lazy"));
    assertEquals("No databases configured", new DatabaseTools(registry, () -> fail("no reload")).listDatabases().render());
  }

  @Test
  void reloadReportsChangesAndDisposesExecutors() {
    Map<String, DatabaseConfig> before = new LinkedHashMap<>();
    before.put("chinook", chinook());
    AtomicReference<RecordingExecutor> created = new AtomicReference<>();
    DatabaseRegistry registry = new DatabaseRegistry(config(before), (id, db, s) -> {
      RecordingExecutor e = new RecordingExecutor(id, sql -> QueryResult.empty());
      created.set(e);
      return e;
    });
    registry.executor("chinook");

    Map<String, DatabaseConfig> after = new LinkedHashMap<>();
    after.put("chinook", DatabaseConfig.builder("sqlite").description("Music store").database("./other.sqlite").build());
    after.put("dw", warehouse());
    ReloadResponse r = new DatabaseTools(registry, () -> config(after)).reloadConfig();

    assertEquals(List.of("dw"), r.added());
    assertEquals(List.of("chinook"), r.modified());
    assertEquals("Added: dw\nModified: chinook", r.render());
    assertTrue(created.get().closed);

    assertEquals("No changes detected", new DatabaseTools(registry, () -> config(after)).reloadConfig().render());
  }

  @Test
  void invalidReloadKeepsCurrentConfig() {
    DatabaseRegistry registry = new DatabaseRegistry(config(Map.of("chinook", chinook())), (id, db, s) -> fail("lazy"));
    DatabaseTools tools = new DatabaseTools(registry, () -> {
      throw new ConfigurationException("Cannot specify both include_schemas and exclude_schemas");
    });
    assertThrows(ConfigurationException.class, tools::reloadConfig);
    assertNotNull(registry.database("chinook"));
  }

  @Test
  void connectionFailureIsReportedNotThrown() {
    DatabaseRegistry registry = new DatabaseRegistry(config(Map.of("dw", warehouse())),
        (id, db, s) -> new RecordingExecutor(id, sql -> QueryResult.empty()) {
          @Override public void testConnection() {
            throw new QueryException("Query failed on database 'dw': connection refused");
          }
        });
    DatabaseTools tools = new DatabaseTools(registry, () -> fail("no reload"));

    ConnectionStatus status = tools.testConnection("dw");
    assertFalse(status.connected());
    assertEquals("Connection to 'dw' failed: Query failed on database 'dw': connection refused", status.render());

    assertThrows(UnknownDatabaseException.class, () -> tools.testConnection("missing"));
  }

  @Test
  void successfulConnection() {
    DatabaseRegistry registry = new DatabaseRegistry(config(Map.of("chinook", chinook())),
        (id, db, s) -> new RecordingExecutor(id, sql -> QueryResult.empty()));
    ConnectionStatus status = new DatabaseTools(registry, () -> fail("no reload")).testConnection("chinook");
    assertTrue(status.connected());
    assertEquals("Connection to 'chinook' successful", status.render());
  }
}
