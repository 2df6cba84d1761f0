package com.aiadvent.mcp.context.retrieval;

import java.util.List;

/** Vector search over the indexed code fragments of a project. */
public interface SemanticSearchClient {

  float[] embedQuery(String text);

  List<SimilarFragment> searchSimilar(
      String projectId, float[] vector, int limit, double threshold);

  /** {@code false} when no embedding backend is configured. */
  default boolean isAvailable() {
    return true;
  }
}
