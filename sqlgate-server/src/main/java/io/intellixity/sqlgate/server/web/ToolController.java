package io.intellixity.sqlgate.server.web;

import io.intellixity.sqlgate.tools.GatewayTools;
import io.intellixity.sqlgate.tools.QueryTool;
import io.intellixity.sqlgate.tools.TableSummaryTool;
import io.intellixity.sqlgate.tools.ToolName;
import io.intellixity.sqlgate.tools.model.ToolResponse;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping(ToolController.BASE_PATH)
public final class ToolController {
  static final String BASE_PATH = "/api/tools";

  private final GatewayTools tools;

  public ToolController(GatewayTools tools) {
    this.tools = tools;
  }

  public record ToolList(List<String> tools) {}

  @GetMapping
  public ToolList list() {
    return new ToolList(tools.enabledTools().stream().map(ToolName::id).toList());
  }

  @PostMapping("/{tool}")
  public ToolResult invoke(@PathVariable("tool") String tool,
                           @RequestBody(required = false) Map<String, Object> body) {
    ToolName name = ToolName.fromId(tool);
    if (name == null || !tools.enabled(name)) throw new ToolNotAvailableException(tool);
    return ToolResult.of(dispatch(name, new ToolArguments(body)));
  }

  private ToolResponse dispatch(ToolName name, ToolArguments args) {
    return switch (name) {
      case EXECUTE_QUERY -> tools.queries().executeQuery(
          args.required("database"),
          args.required("query"),
          args.intOr("limit", QueryTool.DEFAULT_LIMIT),
          args.intOr("page", 1),
          args.boolOr("accurate_count", false));
      case TABLE_SUMMARY -> tools.summaries().tableSummary(
          args.required("database"),
          args.required("table_name"),
          args.optional("db_schema"),
          args.intOr("limit", TableSummaryTool.DEFAULT_LIMIT),
          args.intOr("page", 1));
      case SEARCH -> tools.search().search(
          args.required("database"),
          args.required("search_term"),
          args.optional("schema"));
      case SAMPLE_TABLE -> tools.queries().sampleTable(
          args.required("database"),
          args.required("table_name"),
          args.optional("db_schema"));
      case LIST_DATABASES -> tools.databases().listDatabases();
      case RELOAD_CONFIG -> tools.databases().reloadConfig();
      case TEST_CONNECTION -> tools.databases().testConnection(args.required("database"));
    };
  }
}
