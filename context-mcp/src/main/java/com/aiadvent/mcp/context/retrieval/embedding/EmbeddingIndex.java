package com.aiadvent.mcp.context.retrieval.embedding;

import com.aiadvent.mcp.context.retrieval.SimilarFragment;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/** In-memory vector index of one project scope, keyed by file path. */
public class EmbeddingIndex {

  private final Map<String, IndexedFile> files = new ConcurrentHashMap<>();

  public Optional<String> contentHash(String path) {
    return Optional.ofNullable(files.get(path)).map(IndexedFile::contentHash);
  }

  public void replace(String path, String contentHash, List<EmbeddedChunk> chunks) {
    files.put(path, new IndexedFile(contentHash, List.copyOf(chunks)));
  }

  public void remove(String path) {
    files.remove(path);
  }

  public List<SimilarFragment> search(float[] query, int limit, double threshold) {
    if (query == null || query.length == 0 || limit <= 0) {
      return List.of();
    }
    List<SimilarFragment> matches = new ArrayList<>();
    for (IndexedFile file : files.values()) {
      for (EmbeddedChunk embedded : file.chunks()) {
        double similarity = cosine(query, embedded.vector());
        if (similarity >= threshold) {
          CodeChunk chunk = embedded.chunk();
          matches.add(
              new SimilarFragment(chunk.path(), similarity, chunk.content(), chunk.symbolName()));
        }
      }
    }
    return matches.stream()
        .sorted(Comparator.comparingDouble(SimilarFragment::similarity).reversed())
        .limit(limit)
        .toList();
  }

  public int fileCount() {
    return files.size();
  }

  public int chunkCount() {
    return files.values().stream().mapToInt(file -> file.chunks().size()).sum();
  }

  public void clear() {
    files.clear();
  }

  static double cosine(float[] left, float[] right) {
    if (left == null || right == null || left.length != right.length) {
      return 0.0;
    }
    double dot = 0.0;
    double leftNorm = 0.0;
    double rightNorm = 0.0;
    for (int i = 0; i < left.length; i++) {
      dot += left[i] * right[i];
      leftNorm += left[i] * left[i];
      rightNorm += right[i] * right[i];
    }
    if (leftNorm == 0.0 || rightNorm == 0.0) {
      return 0.0;
    }
    return dot / (Math.sqrt(leftNorm) * Math.sqrt(rightNorm));
  }

  public record EmbeddedChunk(CodeChunk chunk, float[] vector) {}

  private record IndexedFile(String contentHash, List<EmbeddedChunk> chunks) {}
}
