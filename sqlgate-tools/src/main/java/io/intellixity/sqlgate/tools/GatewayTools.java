package io.intellixity.sqlgate.tools;

import io.intellixity.sqlgate.config.GatewayConfig;
import io.intellixity.sqlgate.governance.DatabaseRegistry;
import io.intellixity.sqlgate.governance.PolicyEvaluator;
import io.intellixity.sqlgate.jdbc.catalog.CatalogQueries;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/** Every tool operation over one registry, plus the enablement rule from {@code available_tools}. */
public final class GatewayTools {
  private final DatabaseRegistry registry;
  private final QueryTool queries;
  private final TableSummaryTool summaries;
  private final SearchTool search;
  private final DatabaseTools databases;

  public GatewayTools(DatabaseRegistry registry, CatalogQueries catalog, Supplier<GatewayConfig> configSource) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.queries = new QueryTool(registry);
    this.summaries = new TableSummaryTool(registry, catalog, queries);
    this.search = new SearchTool(registry, catalog, new PolicyEvaluator());
    this.databases = new DatabaseTools(registry, configSource);
  }

  public QueryTool queries() { return queries; }

  public TableSummaryTool summaries() { return summaries; }

  public SearchTool search() { return search; }

  public DatabaseTools databases() { return databases; }

  public DatabaseRegistry registry() { return registry; }

  /** Evaluated against the current configuration, so a reload can change the answer. */
  public boolean enabled(ToolName tool) {
    return registry.settings().toolEnabled(tool.id());
  }

  public List<ToolName> enabledTools() {
    List<ToolName> out = new ArrayList<>();
    for (ToolName t : ToolName.values()) {
      if (enabled(t)) out.add(t);
    }
    return out;
  }
}
