package io.intellixity.sqlgate.config;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/** Database names added, removed and modified between two configurations, each sorted. */
public record ConfigChange(List<String> added, List<String> removed, List<String> modified) {
  public ConfigChange {
    added = List.copyOf(added);
    removed = List.copyOf(removed);
    modified = List.copyOf(modified);
  }

  public static ConfigChange between(GatewayConfig before, GatewayConfig after) {
    Map<String, DatabaseConfig> old = before.databases();
    Map<String, DatabaseConfig> neu = after.databases();
    Set<String> added = new TreeSet<>(neu.keySet());
    added.removeAll(old.keySet());
    Set<String> removed = new TreeSet<>(old.keySet());
    removed.removeAll(neu.keySet());
    Set<String> modified = new TreeSet<>();
    for (Map.Entry<String, DatabaseConfig> e : old.entrySet()) {
      DatabaseConfig other = neu.get(e.getKey());
      if (other != null && !other.equals(e.getValue())) modified.add(e.getKey());
    }
    return new ConfigChange(new ArrayList<>(added), new ArrayList<>(removed), new ArrayList<>(modified));
  }

  /** Every database whose executor must be discarded. */
  @JsonIgnore
  public Set<String> changed() {
    Set<String> all = new LinkedHashSet<>(added);
    all.addAll(removed);
    all.addAll(modified);
    return all;
  }

  public String render() {
    List<String> lines = new ArrayList<>();
    if (!added.isEmpty()) lines.add("Added: " + String.join(", ", added));
    if (!removed.isEmpty()) lines.add("Removed: " + String.join(", ", removed));
    if (!modified.isEmpty()) lines.add("Modified: " + String.join(", ", modified));
    return lines.isEmpty() ? "No changes detected" : String.join("\n", lines);
  }
}
