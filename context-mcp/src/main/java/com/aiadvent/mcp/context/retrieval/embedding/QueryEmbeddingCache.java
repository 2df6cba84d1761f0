package com.aiadvent.mcp.context.retrieval.embedding;

import com.aiadvent.mcp.context.config.ContextEngineProperties;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import java.util.function.Function;
import org.springframework.stereotype.Component;

/** Caches query vectors by the normalised query text. */
@Component
public class QueryEmbeddingCache {

  private final Cache<String, float[]> cache;

  public QueryEmbeddingCache(ContextEngineProperties properties) {
    ContextEngineProperties.Embedding embedding = properties.getEmbedding();
    this.cache =
        Caffeine.newBuilder()
            .maximumSize(embedding.getQueryCacheSize())
            .expireAfterWrite(embedding.getQueryCacheTtl())
            .recordStats()
            .build();
  }

  public float[] get(String query, Function<String, float[]> loader) {
    String key = normalize(query);
    return cache.get(key, ignored -> loader.apply(query));
  }

  public Stats stats() {
    CacheStats stats = cache.stats();
    return new Stats(
        stats.hitCount(), stats.missCount(), cache.estimatedSize(), stats.hitRate());
  }

  public void clear() {
    cache.invalidateAll();
  }

  static String normalize(String query) {
    return query == null ? "" : query.trim().toLowerCase().replaceAll("\\s+", " ");
  }

  public record Stats(long hits, long misses, long size, double hitRate) {}
}
