package com.aiadvent.mcp.context.assembly;

import com.aiadvent.mcp.context.budget.ContextMode;
import com.aiadvent.mcp.context.intent.IntentAction;
import com.aiadvent.mcp.context.intent.ResponseModeAdvisor.Recommendation;
import com.aiadvent.mcp.context.retrieval.HybridWeights;
import java.util.Map;

/**
 * How a package was built. {@code weights} is only set when hybrid retrieval consulted the
 * adaptive weights; {@code enrichments} holds one entry per optional section that ran.
 */
public record Classification(
    IntentAction intentType,
    ContextMode contextMode,
    boolean usedSemanticSearch,
    double confidence,
    HybridWeights weights,
    double weightsConfidence,
    Map<String, EnrichmentResult> enrichments,
    Recommendation responseMode) {

  public Classification {
    enrichments = enrichments != null ? Map.copyOf(enrichments) : Map.of();
  }

  public boolean degraded() {
    return enrichments.values().stream().anyMatch(result -> !result.isOk());
  }
}
