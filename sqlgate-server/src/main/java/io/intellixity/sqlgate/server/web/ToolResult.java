package io.intellixity.sqlgate.server.web;

import io.intellixity.sqlgate.tools.model.ToolResponse;

/** Wire envelope: the structured response plus its text rendering. */
public record ToolResult(Object structured, String text) {
  static ToolResult of(ToolResponse response) {
    return new ToolResult(response, response.render());
  }
}
