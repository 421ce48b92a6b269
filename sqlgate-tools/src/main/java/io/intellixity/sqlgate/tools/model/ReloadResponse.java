package io.intellixity.sqlgate.tools.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.intellixity.sqlgate.config.ConfigChange;

import java.util.List;

public record ReloadResponse(
    @JsonProperty("added") List<String> added,
    @JsonProperty("removed") List<String> removed,
    @JsonProperty("modified") List<String> modified
) implements ToolResponse {

  public static ReloadResponse of(ConfigChange change) {
    return new ReloadResponse(change.added(), change.removed(), change.modified());
  }

  @Override
  public String render() {
    return new ConfigChange(added, removed, modified).render();
  }
}
