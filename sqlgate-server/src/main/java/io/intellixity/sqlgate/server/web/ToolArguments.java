package io.intellixity.sqlgate.server.web;

import java.util.Map;

/** Typed access to a tool's JSON arguments. Missing or mistyped arguments are caller errors. */
final class ToolArguments {
  private final Map<String, Object> values;

  ToolArguments(Map<String, Object> values) {
    this.values = values == null ? Map.of() : values;
  }

  String required(String name) {
    String v = optional(name);
    if (v == null || v.isBlank()) throw new IllegalArgumentException("Missing required argument: " + name);
    return v;
  }

  String optional(String name) {
    Object v = values.get(name);
    return v == null ? null : v.toString();
  }

  int intOr(String name, int fallback) {
    Object v = values.get(name);
    if (v == null) return fallback;
    if (v instanceof Number n) {
      if (n.doubleValue() != Math.rint(n.doubleValue())) {
        throw new IllegalArgumentException("Argument '" + name + "' must be an integer");
      }
      return n.intValue();
    }
    try {
      return Integer.parseInt(v.toString().trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Argument '" + name + "' must be an integer", e);
    }
  }

  boolean boolOr(String name, boolean fallback) {
    Object v = values.get(name);
    if (v == null) return fallback;
    if (v instanceof Boolean b) return b;
    String s = v.toString().trim();
    if ("true".equalsIgnoreCase(s)) return true;
    if ("false".equalsIgnoreCase(s)) return false;
    throw new IllegalArgumentException("Argument '" + name + "' must be a boolean");
  }
}
