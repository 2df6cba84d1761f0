package com.aiadvent.mcp.context.assembly;

import java.util.List;

public record StructuredPlan(
    String goal,
    List<PlanStep> steps,
    int totalComplexity,
    List<String> affectedFiles,
    List<Integer> executionOrder) {

  public StructuredPlan {
    steps = steps != null ? List.copyOf(steps) : List.of();
    affectedFiles = affectedFiles != null ? List.copyOf(affectedFiles) : List.of();
    executionOrder = executionOrder != null ? List.copyOf(executionOrder) : List.of();
  }
}
