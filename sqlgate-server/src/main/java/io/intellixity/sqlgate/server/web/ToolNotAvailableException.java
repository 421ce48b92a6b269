package io.intellixity.sqlgate.server.web;

/** Unknown tool name, or a tool left out of {@code available_tools}. */
public final class ToolNotAvailableException extends RuntimeException {
  public ToolNotAvailableException(String tool) {
    super("Tool '" + tool + "' is not available");
  }
}
