package com.aiadvent.mcp.context.change;

import java.util.ArrayList;
import java.util.List;

public record FileChangeSet(
    List<String> created, List<String> modified, List<String> deleted, List<String> unchanged) {

  public FileChangeSet {
    created = created != null ? List.copyOf(created) : List.of();
    modified = modified != null ? List.copyOf(modified) : List.of();
    deleted = deleted != null ? List.copyOf(deleted) : List.of();
    unchanged = unchanged != null ? List.copyOf(unchanged) : List.of();
  }

  public static FileChangeSet empty() {
    return new FileChangeSet(List.of(), List.of(), List.of(), List.of());
  }

  /** Created and modified paths, in that order. */
  public List<String> touched() {
    List<String> touched = new ArrayList<>(created.size() + modified.size());
    touched.addAll(created);
    touched.addAll(modified);
    return touched;
  }

  public boolean hasChanges() {
    return !created.isEmpty() || !modified.isEmpty() || !deleted.isEmpty();
  }
}
