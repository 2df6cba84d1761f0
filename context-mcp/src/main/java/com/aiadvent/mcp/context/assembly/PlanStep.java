package com.aiadvent.mcp.context.assembly;

import java.util.List;
import java.util.Locale;

public record PlanStep(
    int stepNumber,
    String description,
    List<String> files,
    Operation operation,
    int complexity,
    List<Integer> dependsOn) {

  public PlanStep {
    files = files != null ? List.copyOf(files) : List.of();
    dependsOn = dependsOn != null ? List.copyOf(dependsOn) : List.of();
  }

  public enum Operation {
    CREATE,
    MODIFY,
    DELETE,
    MOVE;

    public String id() {
      return name().toLowerCase(Locale.ROOT);
    }
  }
}
