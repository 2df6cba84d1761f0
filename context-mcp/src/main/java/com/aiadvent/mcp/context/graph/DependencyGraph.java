package com.aiadvent.mcp.context.graph;

import com.aiadvent.mcp.context.change.FileRecord;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Forward and reverse import edges between known project files. */
public final class DependencyGraph {

  private static final DependencyGraph EMPTY = new DependencyGraph(Map.of(), Map.of());

  private final Map<String, Set<String>> forward;
  private final Map<String, Set<String>> reverse;

  private DependencyGraph(Map<String, Set<String>> forward, Map<String, Set<String>> reverse) {
    this.forward = forward;
    this.reverse = reverse;
  }

  public static DependencyGraph empty() {
    return EMPTY;
  }

  /**
   * Builds the graph from persisted records. Imports that cannot be resolved against {@code
   * knownFiles}, including explicit paths to files that do not exist, are dropped.
   */
  public static DependencyGraph build(
      Collection<FileRecord> records, Collection<String> knownFiles) {
    if (records == null || records.isEmpty()) {
      return EMPTY;
    }
    Set<String> known = new HashSet<>();
    if (knownFiles != null) {
      known.addAll(knownFiles);
    }
    records.forEach(record -> known.add(record.path()));

    Map<String, Set<String>> forward = new LinkedHashMap<>();
    Map<String, Set<String>> reverse = new LinkedHashMap<>();
    for (FileRecord record : records) {
      Set<String> targets = new LinkedHashSet<>();
      for (String specifier : record.imports()) {
        String resolved = ImportResolver.resolve(record.path(), specifier, known);
        if (resolved != null && known.contains(resolved) && !resolved.equals(record.path())) {
          targets.add(resolved);
        }
      }
      if (!targets.isEmpty()) {
        forward.put(record.path(), Collections.unmodifiableSet(targets));
        for (String target : targets) {
          reverse.computeIfAbsent(target, key -> new LinkedHashSet<>()).add(record.path());
        }
      }
    }
    reverse.replaceAll((key, value) -> Collections.unmodifiableSet(value));
    return new DependencyGraph(forward, reverse);
  }

  public Set<String> importsOf(String path) {
    return forward.getOrDefault(path, Set.of());
  }

  public Set<String> importersOf(String path) {
    return reverse.getOrDefault(path, Set.of());
  }

  public Map<String, Set<String>> reverseIndex() {
    return Collections.unmodifiableMap(reverse);
  }

  public boolean isEmpty() {
    return forward.isEmpty();
  }

  /** Fan-in per file normalised by the largest fan-in, so the most imported file scores 1.0. */
  public Map<String, Double> importance() {
    int max = reverse.values().stream().mapToInt(Set::size).max().orElse(0);
    if (max == 0) {
      return Map.of();
    }
    Map<String, Double> importance = new LinkedHashMap<>();
    reverse.forEach((path, importers) -> importance.put(path, importers.size() / (double) max));
    return importance;
  }

  public DependencyContext contextOf(String path) {
    return new DependencyContext(List.copyOf(importsOf(path)), List.copyOf(importersOf(path)));
  }
}
