package com.aiadvent.mcp.context.memory;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Long-lived knowledge about a project carried between requests. */
public record ProjectMemory(
    String projectSummary,
    String gameType,
    List<String> techStack,
    List<CompletedTask> completedTasks,
    Map<String, Double> fileImportance,
    List<KeyEntity> keyEntities) {

  public ProjectMemory {
    techStack = techStack != null ? List.copyOf(techStack) : List.of();
    completedTasks = completedTasks != null ? List.copyOf(completedTasks) : List.of();
    fileImportance =
        fileImportance != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(fileImportance))
            : Map.of();
    keyEntities = keyEntities != null ? List.copyOf(keyEntities) : List.of();
  }

  public static ProjectMemory empty() {
    return new ProjectMemory(null, null, List.of(), List.of(), Map.of(), List.of());
  }

  /** Summary, game type and tech stack only. */
  public ProjectMemory reduced() {
    return new ProjectMemory(projectSummary, gameType, techStack, List.of(), Map.of(), List.of());
  }

  public double importanceOf(String path) {
    Double value = fileImportance.get(path);
    return value != null ? value : 0.0;
  }

  public record CompletedTask(String task, Instant timestamp) {}

  public record KeyEntity(String name, String type, String file) {}
}
