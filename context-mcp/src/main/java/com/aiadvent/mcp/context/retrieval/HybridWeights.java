package com.aiadvent.mcp.context.retrieval;

import com.aiadvent.mcp.context.config.ContextEngineProperties;

/** Weights of the four hybrid retrieval signals; adapted weights always sum to 1. */
public record HybridWeights(
    double semanticWeight, double keywordWeight, double recencyWeight, double importanceWeight) {

  public static HybridWeights defaults(ContextEngineProperties.Hybrid hybrid) {
    return new HybridWeights(
        hybrid.getSemanticWeight(),
        hybrid.getKeywordWeight(),
        hybrid.getRecencyWeight(),
        hybrid.getImportanceWeight());
  }

  public double total() {
    return semanticWeight + keywordWeight + recencyWeight + importanceWeight;
  }
}
