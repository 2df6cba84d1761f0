package com.aiadvent.mcp.context.retrieval;

import java.time.Instant;
import java.util.List;

/**
 * What the context offered against what the generation actually touched. {@code
 * selectionAccuracy} is the share of modified files that were in the context.
 */
public record GenerationOutcome(
    String projectId,
    String intentType,
    String contextMode,
    List<String> filesSelectedForContext,
    List<String> filesActuallyModified,
    List<String> missedFiles,
    Double selectionAccuracy,
    Instant createdAt) {

  public GenerationOutcome {
    filesSelectedForContext =
        filesSelectedForContext != null ? List.copyOf(filesSelectedForContext) : List.of();
    filesActuallyModified =
        filesActuallyModified != null ? List.copyOf(filesActuallyModified) : List.of();
    missedFiles = missedFiles != null ? List.copyOf(missedFiles) : List.of();
  }

  public double accuracy() {
    return selectionAccuracy != null ? selectionAccuracy : 0.0;
  }
}
