package com.aiadvent.mcp.context.graph;

import java.util.List;

/** Imports and importers of one target file. */
public record DependencyContext(List<String> imports, List<String> importers) {

  public DependencyContext {
    imports = imports != null ? List.copyOf(imports) : List.of();
    importers = importers != null ? List.copyOf(importers) : List.of();
  }

  public static DependencyContext empty() {
    return new DependencyContext(List.of(), List.of());
  }

  public boolean isEmpty() {
    return imports.isEmpty() && importers.isEmpty();
  }
}
