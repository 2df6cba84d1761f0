package com.aiadvent.mcp.context.retrieval;

/** Supplies hybrid retrieval weights for a project; never throws. */
public interface AdaptiveWeightsProvider {

  WeightAnalysis getWeights(String projectId);
}
