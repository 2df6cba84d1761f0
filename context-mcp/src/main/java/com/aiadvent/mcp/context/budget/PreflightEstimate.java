package com.aiadvent.mcp.context.budget;

import com.aiadvent.mcp.context.intent.IntentAction;

public record PreflightEstimate(
    int estimatedTokens,
    int tokenBudget,
    boolean withinBudget,
    ContextMode recommendedMode,
    Breakdown breakdown,
    int filesToInclude,
    IntentAction intent) {

  public record Breakdown(
      int filesTokens,
      int memoryTokens,
      int conversationTokens,
      int taskContextTokens,
      int reservedTokens) {

    public int total() {
      return filesTokens + memoryTokens + conversationTokens + taskContextTokens + reservedTokens;
    }
  }
}
