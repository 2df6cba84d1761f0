package com.aiadvent.mcp.context.budget;

import java.util.List;

/** Files accepted by the budget walk together with their token total. */
public record FileSelection(List<RelevantFile> files, int tokens, int tokenBudget) {

  public FileSelection {
    files = files != null ? List.copyOf(files) : List.of();
  }

  public boolean isEmpty() {
    return files.isEmpty();
  }
}
