package com.aiadvent.mcp.context.intent;

import java.util.LinkedHashSet;
import java.util.List;

public record IntentClassification(
    IntentAction action,
    double confidence,
    List<String> targetFiles,
    List<String> keywords,
    boolean trivialChange,
    boolean visualChange,
    boolean structuralChange) {

  public IntentClassification {
    action = action != null ? action : IntentAction.MODIFY;
    targetFiles =
        targetFiles != null ? List.copyOf(new LinkedHashSet<>(targetFiles)) : List.of();
    keywords = keywords != null ? List.copyOf(keywords) : List.of();
  }

  public boolean isAction(IntentAction candidate) {
    return action == candidate;
  }
}
