package com.aiadvent.mcp.context.scope;

import com.aiadvent.mcp.context.retrieval.SemanticSearchClient;
import com.aiadvent.mcp.context.retrieval.SimilarFragment;
import com.aiadvent.mcp.context.retrieval.embedding.EmbeddingIndexer;
import com.aiadvent.mcp.context.retrieval.embedding.QueryEmbeddingCache;
import java.util.List;
import org.springframework.stereotype.Component;

/** Searches the embedding index of an open project scope; closed projects have no matches. */
@Component
public class ScopedSemanticSearchClient implements SemanticSearchClient {

  private final ProjectScopeRegistry registry;
  private final EmbeddingIndexer indexer;
  private final QueryEmbeddingCache queryCache;

  public ScopedSemanticSearchClient(
      ProjectScopeRegistry registry, EmbeddingIndexer indexer, QueryEmbeddingCache queryCache) {
    this.registry = registry;
    this.indexer = indexer;
    this.queryCache = queryCache;
  }

  @Override
  public float[] embedQuery(String text) {
    return queryCache.get(text, indexer::embedQuery);
  }

  @Override
  public List<SimilarFragment> searchSimilar(
      String projectId, float[] vector, int limit, double threshold) {
    return registry
        .find(projectId)
        .map(scope -> scope.index().search(vector, limit, threshold))
        .orElse(List.of());
  }

  @Override
  public boolean isAvailable() {
    return indexer.isAvailable();
  }
}
