package com.aiadvent.mcp.context.retrieval.embedding;

import com.aiadvent.mcp.context.change.ContentHashes;
import com.aiadvent.mcp.context.retrieval.embedding.EmbeddingIndex.EmbeddedChunk;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

/**
 * Chunks a file and stores the chunk vectors in a project's {@link EmbeddingIndex}. A file is
 * re-embedded only when its cheap hash differs from the indexed one.
 */
@Component
public class EmbeddingIndexer {

  private static final Logger log = LoggerFactory.getLogger(EmbeddingIndexer.class);

  private final CodeChunker chunker;
  private final ObjectProvider<EmbeddingModel> embeddingModelProvider;

  public EmbeddingIndexer(
      CodeChunker chunker, ObjectProvider<EmbeddingModel> embeddingModelProvider) {
    this.chunker = chunker;
    this.embeddingModelProvider = embeddingModelProvider;
  }

  public boolean isAvailable() {
    return embeddingModelProvider.getIfAvailable() != null;
  }

  /** Returns the outcome for this file; never throws on embedding failures. */
  public IndexResult index(EmbeddingIndex index, String path, String content) {
    if (!CodeChunker.isIndexable(path)) {
      return IndexResult.SKIPPED;
    }
    EmbeddingModel model = embeddingModelProvider.getIfAvailable();
    if (model == null) {
      return IndexResult.UNAVAILABLE;
    }
    String hash = ContentHashes.quickHash(content);
    Optional<String> indexedHash = index.contentHash(path);
    if (indexedHash.isPresent() && indexedHash.get().equals(hash)) {
      return IndexResult.UNCHANGED;
    }

    List<CodeChunk> chunks = chunker.chunk(path, content);
    if (chunks.isEmpty()) {
      index.replace(path, hash, List.of());
      return IndexResult.INDEXED;
    }
    Map<String, float[]> vectorsByText = new LinkedHashMap<>();
    chunks.forEach(chunk -> vectorsByText.putIfAbsent(chunk.content(), null));
    List<String> texts = new ArrayList<>(vectorsByText.keySet());
    try {
      List<float[]> vectors = model.embed(texts);
      for (int i = 0; i < texts.size() && i < vectors.size(); i++) {
        vectorsByText.put(texts.get(i), vectors.get(i));
      }
    } catch (RuntimeException ex) {
      log.warn("Failed to embed {} ({} chunks): {}", path, chunks.size(), ex.getMessage());
      return IndexResult.FAILED;
    }

    List<EmbeddedChunk> embedded = new ArrayList<>(chunks.size());
    for (CodeChunk chunk : chunks) {
      float[] vector = vectorsByText.get(chunk.content());
      if (vector != null) {
        embedded.add(new EmbeddedChunk(chunk, vector));
      }
    }
    index.replace(path, hash, embedded);
    log.debug(
        "Indexed {}: {} chunks, {} distinct texts embedded", path, chunks.size(), texts.size());
    return IndexResult.INDEXED;
  }

  public float[] embedQuery(String text) {
    EmbeddingModel model = embeddingModelProvider.getIfAvailable();
    if (model == null) {
      throw new IllegalStateException("No embedding model configured");
    }
    return model.embed(text);
  }

  public enum IndexResult {
    INDEXED,
    UNCHANGED,
    SKIPPED,
    UNAVAILABLE,
    FAILED
  }
}
