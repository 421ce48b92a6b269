package io.intellixity.sqlgate.server.web;

import io.intellixity.sqlgate.server.SqlGateApplication;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(classes = SqlGateApplication.class)
@AutoConfigureMockMvc
final class ToolApiTest {
  @TempDir
  static Path tmp;

  @Autowired
  MockMvc mvc;

  @DynamicPropertySource
  static void gatewayConfig(DynamicPropertyRegistry registry) {
    registry.add("sqlgate.config-path", () -> writeFixture().toString());
  }

  private static Path writeFixture() {
    try {
      Path db = tmp.resolve("shop.sqlite");
      try (Connection c = DriverManager.getConnection("jdbc:sqlite:" + db);
           Statement st = c.createStatement()) {
        st.execute("CREATE TABLE IF NOT EXISTS product (id INTEGER PRIMARY KEY, name TEXT NOT NULL, price REAL)");
        st.execute("DELETE FROM product");
        st.execute("INSERT INTO product (id, name, price) VALUES (1, 'Widget', 2.5), (2, 'Gadget', 10.0), (3, 'Gizmo', NULL)");
      }
      Path config = tmp.resolve("config.yaml");
      Files.writeString(config, String.join("\n",
          "databases:",
          "  shop:",
          "    type: sqlite",
          "    description: Shop",
          "    database: " + db.toString().replace('\\', '/'),
          "settings:",
          "  max_rows_per_query: 100",
          "  available_tools: [execute_query, table_summary, list_databases, sample_table]",
          ""));
      return config;
    } catch (IOException | SQLException e) {
      throw new IllegalStateException("Failed to prepare gateway fixture", e);
    }
  }

  @Test
  void listsOnlyEnabledTools() throws Exception {
    mvc.perform(get("/api/tools"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.tools.length()").value(4))
        .andExpect(jsonPath("$.tools[0]").value("execute_query"));
  }

  @Test
  void executesPaginatedQuery() throws Exception {
    mvc.perform(post("/api/tools/execute_query")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"database\":\"shop\",\"query\":\"SELECT id, name FROM product ORDER BY id\",\"limit\":2,\"accurate_count\":true}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.structured.row_count").value(2))
        .andExpect(jsonPath("$.structured.total_rows").value(3))
        .andExpect(jsonPath("$.structured.total_pages").value(2))
        .andExpect(jsonPath("$.structured.truncated").value(true))
        .andExpect(jsonPath("$.structured.rows[1].name").value("Gadget"))
        .andExpect(jsonPath("$.text").value(containsString("Page 1 of 2 (showing 2 of 3 rows)")));
  }

  @Test
  void mutatingQueryIsBadRequest() throws Exception {
    mvc.perform(post("/api/tools/execute_query")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"database\":\"shop\",\"query\":\"DROP TABLE product\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("ReadOnlyViolation"))
        .andExpect(jsonPath("$.message").value("Query contains non-SELECT operations"));
  }

  @Test
  void unknownDatabaseAndMissingTableAreNotFound() throws Exception {
    mvc.perform(post("/api/tools/execute_query")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"database\":\"nope\",\"query\":\"SELECT 1\"}"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.message").value("Database 'nope' not found in configuration"));

    mvc.perform(post("/api/tools/table_summary")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"database\":\"shop\",\"table_name\":\"invoice\"}"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.error").value("TableNotFound"));
  }

  @Test
  void databaseErrorIsBadGateway() throws Exception {
    mvc.perform(post("/api/tools/execute_query")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"database\":\"shop\",\"query\":\"SELECT missing_column FROM product\"}"))
        .andExpect(status().isBadGateway())
        .andExpect(jsonPath("$.error").value("Query"))
        .andExpect(jsonPath("$.message").value(containsString("Query failed on database 'shop'")));
  }

  @Test
  void disabledToolIsNotFound() throws Exception {
    mvc.perform(post("/api/tools/search")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"database\":\"shop\",\"search_term\":\"prod\"}"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.error").value("ToolNotAvailable"))
        .andExpect(jsonPath("$.message").value("Tool 'search' is not available"));
  }

  @Test
  void missingArgumentIsBadRequest() throws Exception {
    mvc.perform(post("/api/tools/sample_table")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"database\":\"shop\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("Missing required argument: table_name"));
  }

  @Test
  void listDatabasesRendersText() throws Exception {
    mvc.perform(post("/api/tools/list_databases"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.structured.total_count").value(1))
        .andExpect(jsonPath("$.structured.databases[0].name").value("shop"))
        .andExpect(jsonPath("$.text").value(containsString("Shop")));
  }
}
