package com.aiadvent.mcp.context.memory;

import java.time.Instant;
import java.util.List;

/** What happened during one conversation turn. */
public record TaskDelta(
    String projectId,
    String sessionId,
    int turnNumber,
    String userRequest,
    String whatTried,
    List<String> whatChanged,
    String whatSucceeded,
    String whatFailed,
    String whatNext,
    Integer tokensUsed,
    Long durationMs,
    Instant createdAt) {

  public TaskDelta {
    whatChanged = whatChanged != null ? List.copyOf(whatChanged) : List.of();
  }
}
