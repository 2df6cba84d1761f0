package com.aiadvent.mcp.context.retrieval;

import com.aiadvent.mcp.context.config.ContextEngineProperties;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

/**
 * Vector search re-ranked by literal query keywords: twice the requested number of fragments
 * is fetched, fragments mentioning a keyword gain similarity, and the best {@code limit} remain.
 */
@Component
public class SemanticCodeSearch {

  private final ObjectProvider<SemanticSearchClient> clientProvider;
  private final double contentBoost;
  private final double symbolBoost;

  public SemanticCodeSearch(
      ObjectProvider<SemanticSearchClient> clientProvider, ContextEngineProperties properties) {
    this.clientProvider = clientProvider;
    this.contentBoost = properties.getHybrid().getKeywordContentBoost();
    this.symbolBoost = properties.getHybrid().getKeywordSymbolBoost();
  }

  public boolean isAvailable() {
    SemanticSearchClient client = clientProvider.getIfAvailable();
    return client != null && client.isAvailable();
  }

  public List<SimilarFragment> search(
      String projectId, String query, int limit, double similarityThreshold) {
    SemanticSearchClient client = clientProvider.getIfAvailable();
    if (client == null || limit <= 0) {
      return List.of();
    }
    float[] vector = client.embedQuery(query);
    List<SimilarFragment> candidates =
        client.searchSimilar(projectId, vector, limit * 2, similarityThreshold);
    if (candidates == null || candidates.isEmpty()) {
      return List.of();
    }

    List<String> keywords = keywords(query);
    List<SimilarFragment> boosted = new ArrayList<>(candidates.size());
    for (SimilarFragment fragment : candidates) {
      String content = lower(fragment.fragment());
      String symbol = lower(fragment.symbolName());
      double boost = 0.0;
      for (String keyword : keywords) {
        if (content.contains(keyword)) {
          boost += contentBoost;
        }
        if (symbol.contains(keyword)) {
          boost += symbolBoost;
        }
      }
      boosted.add(fragment.withSimilarity(Math.min(1.0, fragment.similarity() + boost)));
    }
    boosted.sort(Comparator.comparingDouble(SimilarFragment::similarity).reversed());
    return List.copyOf(boosted.subList(0, Math.min(limit, boosted.size())));
  }

  static List<String> keywords(String query) {
    if (query == null) {
      return List.of();
    }
    return Arrays.stream(query.toLowerCase(Locale.ROOT).split("\\s+"))
        .filter(word -> word.length() > 2)
        .toList();
  }

  private static String lower(String value) {
    return value != null ? value.toLowerCase(Locale.ROOT) : "";
  }
}
