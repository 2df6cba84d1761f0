package com.aiadvent.mcp.context.retrieval;

public record WeightAnalysis(
    HybridWeights weights, double confidence, int sampleSize, double avgAccuracy) {

  public static WeightAnalysis fallback(HybridWeights defaults) {
    return new WeightAnalysis(defaults, 0.0, 0, 0.0);
  }
}
