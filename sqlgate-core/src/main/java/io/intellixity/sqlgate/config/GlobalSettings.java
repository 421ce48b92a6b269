package io.intellixity.sqlgate.config;

import io.intellixity.sqlgate.error.ConfigurationException;

import java.util.List;

/**
 * Gateway-wide settings.
 *
 * @param maxRowsPerQuery ceiling applied to every caller-requested limit
 * @param sampleSize      rows returned by table sampling
 * @param maxQueryTimeout statement timeout in seconds, null for the driver default
 * @param availableTools  tool names to expose, null for all
 */
public record GlobalSettings(int maxRowsPerQuery, int sampleSize, Integer maxQueryTimeout, List<String> availableTools) {
  public static final int DEFAULT_MAX_ROWS_PER_QUERY = 1000;
  public static final int DEFAULT_SAMPLE_SIZE = 10;

  public GlobalSettings {
    requirePositive("max_rows_per_query", maxRowsPerQuery);
    requirePositive("sample_size", sampleSize);
    if (maxQueryTimeout != null) requirePositive("max_query_timeout", maxQueryTimeout);
    availableTools = availableTools == null ? null : List.copyOf(availableTools);
  }

  public static GlobalSettings defaults() {
    return new GlobalSettings(DEFAULT_MAX_ROWS_PER_QUERY, DEFAULT_SAMPLE_SIZE, null, null);
  }

  public boolean toolEnabled(String tool) {
    return availableTools == null || availableTools.contains(tool);
  }

  private static void requirePositive(String name, int value) {
    if (value <= 0) throw new ConfigurationException(name + " must be a positive integer");
  }
}
