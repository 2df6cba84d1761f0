package com.aiadvent.mcp.context.memory;

import java.util.List;

/** Current goal of a project with its progress, blockers and last known state. */
public record TaskLedger(
    String currentGoal, List<TaskSubstep> substeps, List<String> blockers, String lastKnownState) {

  public TaskLedger {
    substeps = substeps != null ? List.copyOf(substeps) : List.of();
    blockers = blockers != null ? List.copyOf(blockers) : List.of();
  }

  public static TaskLedger empty() {
    return new TaskLedger(null, List.of(), List.of(), null);
  }
}
