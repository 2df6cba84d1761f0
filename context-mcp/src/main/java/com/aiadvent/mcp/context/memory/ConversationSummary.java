package com.aiadvent.mcp.context.memory;

import java.util.List;

public record ConversationSummary(
    String summaryText,
    int messageRangeStart,
    int messageRangeEnd,
    List<String> tasksCompleted,
    List<String> filesModified,
    int sequenceNumber) {

  public ConversationSummary {
    summaryText = summaryText != null ? summaryText : "";
    tasksCompleted = tasksCompleted != null ? List.copyOf(tasksCompleted) : List.of();
    filesModified = filesModified != null ? List.copyOf(filesModified) : List.of();
  }
}
