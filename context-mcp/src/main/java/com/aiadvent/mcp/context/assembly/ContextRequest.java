package com.aiadvent.mcp.context.assembly;

import com.aiadvent.mcp.context.memory.ConversationMessage;
import com.aiadvent.mcp.context.memory.ConversationSummary;
import com.aiadvent.mcp.context.memory.ProjectMemory;
import java.util.List;
import java.util.Map;

/**
 * Input of {@link ContextAssembler#buildContext}. A {@code null} memory or summary list is read
 * from the memory services; a {@code null} {@code semanticSearch} falls back to
 * {@code context.engine.hybrid.enabled}.
 */
public record ContextRequest(
    String projectId,
    String prompt,
    Map<String, String> files,
    String selectedFile,
    List<ConversationMessage> conversationHistory,
    List<String> changedFiles,
    ProjectMemory projectMemory,
    List<ConversationSummary> conversationSummaries,
    Boolean semanticSearch) {

  public ContextRequest {
    conversationHistory =
        conversationHistory != null ? List.copyOf(conversationHistory) : List.of();
    changedFiles = changedFiles != null ? List.copyOf(changedFiles) : List.of();
  }

  public static ContextRequest of(String projectId, String prompt, Map<String, String> files) {
    return new ContextRequest(projectId, prompt, files, null, null, null, null, null, null);
  }
}
