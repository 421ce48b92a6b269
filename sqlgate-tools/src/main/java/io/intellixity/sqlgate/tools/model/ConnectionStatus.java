package io.intellixity.sqlgate.tools.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ConnectionStatus(
    @JsonProperty("database") String database,
    @JsonProperty("connected") boolean connected,
    @JsonProperty("message") String message
) implements ToolResponse {

  @Override
  public String render() {
    return connected
        ? "Connection to '" + database + "' successful"
        : "Connection to '" + database + "' failed: " + message;
  }
}
