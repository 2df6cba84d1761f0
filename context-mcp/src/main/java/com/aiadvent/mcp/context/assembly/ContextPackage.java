package com.aiadvent.mcp.context.assembly;

import com.aiadvent.mcp.context.budget.ContextMode;
import com.aiadvent.mcp.context.budget.RelevantFile;
import com.aiadvent.mcp.context.memory.AssetManifest;
import com.aiadvent.mcp.context.memory.ConversationMessage;
import com.aiadvent.mcp.context.memory.ProjectMemory;
import com.aiadvent.mcp.context.memory.TaskContext;
import java.util.List;

public record ContextPackage(
    List<RelevantFile> relevantFiles,
    ContextMode contextMode,
    int tokenBudget,
    TokenBreakdown tokens,
    List<String> changedSinceLastRequest,
    List<String> fileTree,
    ProjectMemory projectMemory,
    TaskContext taskContext,
    String taskContextFormatted,
    StructuredPlan structuredPlan,
    String structuredPlanFormatted,
    AssetManifest assetManifest,
    String assetManifestFormatted,
    List<String> conversationSummaries,
    List<ConversationMessage> recentMessages,
    Classification classification) {

  public ContextPackage {
    relevantFiles = relevantFiles != null ? List.copyOf(relevantFiles) : List.of();
    changedSinceLastRequest =
        changedSinceLastRequest != null ? List.copyOf(changedSinceLastRequest) : List.of();
    fileTree = fileTree != null ? List.copyOf(fileTree) : List.of();
    conversationSummaries =
        conversationSummaries != null ? List.copyOf(conversationSummaries) : List.of();
    recentMessages = recentMessages != null ? List.copyOf(recentMessages) : List.of();
    tokens = tokens != null ? tokens : TokenBreakdown.filesOnly(0);
  }

  public int estimatedTokens() {
    return tokens.total();
  }

  public List<String> relevantPaths() {
    return relevantFiles.stream().map(RelevantFile::path).toList();
  }
}
