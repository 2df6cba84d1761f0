package com.aiadvent.mcp.context.memory;

import java.util.List;

/** Ledger plus the most recent deltas, newest first. */
public record TaskContext(TaskLedger ledger, List<TaskDelta> recentDeltas) {

  public TaskContext {
    ledger = ledger != null ? ledger : TaskLedger.empty();
    recentDeltas = recentDeltas != null ? List.copyOf(recentDeltas) : List.of();
  }
}
