package io.intellixity.sqlgate.tools;

import java.util.Locale;

/** Tool identifiers as they appear in the {@code available_tools} setting and on the wire. */
public enum ToolName {
  EXECUTE_QUERY,
  TABLE_SUMMARY,
  SEARCH,
  SAMPLE_TABLE,
  LIST_DATABASES,
  RELOAD_CONFIG,
  TEST_CONNECTION;

  public String id() {
    return name().toLowerCase(Locale.ROOT);
  }

  /** Null for unknown ids. */
  public static ToolName fromId(String id) {
    if (id == null) return null;
    for (ToolName t : values()) {
      if (t.id().equalsIgnoreCase(id.trim())) return t;
    }
    return null;
  }
}
