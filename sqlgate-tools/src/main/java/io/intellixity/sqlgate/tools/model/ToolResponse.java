package io.intellixity.sqlgate.tools.model;

/** Structured tool result that also has a plain-text rendering for human readers. */
public interface ToolResponse {
  String render();
}
