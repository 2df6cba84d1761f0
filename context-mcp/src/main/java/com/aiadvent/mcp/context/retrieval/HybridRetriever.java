package com.aiadvent.mcp.context.retrieval;

import com.aiadvent.mcp.context.config.ContextEngineProperties;
import com.aiadvent.mcp.context.graph.DependencyContext;
import com.aiadvent.mcp.context.scoring.FileScore;
import com.aiadvent.mcp.context.scoring.RelevanceScorer;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Blends keyword scores with semantic similarity, recency, memory importance and dependency
 * proximity. Any failure of the semantic side returns the keyword scores unchanged.
 */
@Service
public class HybridRetriever {

  private static final Logger log = LoggerFactory.getLogger(HybridRetriever.class);

  private final SemanticCodeSearch semanticSearch;
  private final AdaptiveWeightsProvider weightsProvider;
  private final ContextEngineProperties properties;

  public HybridRetriever(
      SemanticCodeSearch semanticSearch,
      AdaptiveWeightsProvider weightsProvider,
      ContextEngineProperties properties) {
    this.semanticSearch = semanticSearch;
    this.weightsProvider = weightsProvider;
    this.properties = properties;
  }

  public Result retrieve(
      String projectId,
      String prompt,
      List<FileScore> keywordScores,
      Map<String, DependencyContext> dependencies,
      String selectedFile,
      List<String> recentFiles) {
    if (!semanticSearch.isAvailable()) {
      log.debug("No semantic search backend, keeping keyword scores for {}", projectId);
      return new Result(keywordScores, null, Status.UNAVAILABLE, "no embedding backend");
    }
    WeightAnalysis analysis = null;
    try {
      analysis = weightsProvider.getWeights(projectId);
      HybridWeights weights = analysis.weights();
      log.debug(
          "Hybrid weights for {} (confidence {}): {}",
          projectId,
          Math.round(analysis.confidence() * 100),
          weights);

      Map<String, DependencyHint> related = relatedByDependency(dependencies);
      String query = QueryEnhancer.enhance(prompt, selectedFile, recentFiles);
      ContextEngineProperties.Hybrid hybrid = properties.getHybrid();
      List<SimilarFragment> fragments =
          semanticSearch.search(
              projectId, query, hybrid.getLimit(), hybrid.getSimilarityThreshold());
      if (fragments.isEmpty()) {
        log.info("No semantic matches for project {}", projectId);
        return new Result(
            keywordScores, analysis, Status.NO_MATCHES, "no semantic matches");
      }

      List<FileScore> combined = combine(keywordScores, fragments, related, weights);
      log.info(
          "Hybrid retrieval for {}: {} semantic fragments, top files {}",
          projectId,
          fragments.size(),
          combined.stream()
              .limit(5)
              .map(score -> RelevanceScorer.baseName(score.path()) + " " + percent(score.score()))
              .collect(Collectors.joining(", ")));
      return new Result(combined, analysis, Status.APPLIED, null);
    } catch (RuntimeException ex) {
      log.warn("Hybrid retrieval failed for project {}: {}", projectId, ex.getMessage());
      return new Result(keywordScores, analysis, Status.FAILED, ex.getMessage());
    }
  }

  List<FileScore> combine(
      List<FileScore> keywordScores,
      List<SimilarFragment> fragments,
      Map<String, DependencyHint> related,
      HybridWeights weights) {
    Map<String, Double> semanticByFile = new LinkedHashMap<>();
    for (SimilarFragment fragment : fragments) {
      semanticByFile.merge(fragment.path(), fragment.similarity(), Math::max);
    }
    double maxKeywordScore =
        Math.max(keywordScores.stream().mapToDouble(FileScore::score).max().orElse(0.0), 1.0);

    List<FileScore> combined = new ArrayList<>(keywordScores.size() + semanticByFile.size());
    Set<String> seen = new HashSet<>();
    for (FileScore score : keywordScores) {
      double keyword = score.score() / maxKeywordScore;
      double semantic = semanticByFile.getOrDefault(score.path(), 0.0);
      DependencyHint hint = related.get(score.path());
      double value =
          semantic * weights.semanticWeight()
              + keyword * weights.keywordWeight()
              + (score.hasReason(RelevanceScorer.REASON_RECENTLY_MODIFIED) ? 1 : 0)
                  * weights.recencyWeight()
              + (score.hasReason(RelevanceScorer.REASON_HIGH_IMPORTANCE) ? 1 : 0)
                  * weights.importanceWeight()
              + (hint != null ? hint.boost() : 0.0);
      List<String> reasons = new ArrayList<>(score.reasons());
      if (semantic > 0) {
        reasons.add("semantic: " + percent(semantic) + "%");
      }
      if (hint != null) {
        reasons.add(hint.reason());
      }
      combined.add(new FileScore(score.path(), value, reasons, semantic, keyword));
      seen.add(score.path());
    }

    semanticByFile.forEach(
        (path, similarity) -> {
          if (seen.add(path)) {
            DependencyHint hint = related.get(path);
            List<String> reasons = new ArrayList<>();
            reasons.add("semantic match: " + percent(similarity) + "%");
            if (hint != null) {
              reasons.add(hint.reason());
            }
            double value =
                similarity * weights.semanticWeight() + (hint != null ? hint.boost() : 0.0);
            combined.add(new FileScore(path, value, reasons, similarity, 0.0));
          }
        });

    related.forEach(
        (path, hint) -> {
          if (seen.add(path)) {
            combined.add(new FileScore(path, hint.boost(), List.of(hint.reason()), 0.0, 0.0));
          }
        });

    combined.sort(FileScore.BY_SCORE_DESC);
    return combined;
  }

  /** First hint per path wins; imports of a target are visited before its importers. */
  Map<String, DependencyHint> relatedByDependency(Map<String, DependencyContext> dependencies) {
    Map<String, DependencyHint> related = new LinkedHashMap<>();
    if (dependencies == null) {
      return related;
    }
    ContextEngineProperties.Scoring scoring = properties.getScoring();
    dependencies.forEach(
        (target, context) -> {
          String name = RelevanceScorer.baseName(target);
          for (String dependency : context.imports()) {
            related.putIfAbsent(
                dependency,
                new DependencyHint(scoring.getDirectDependency(), "dependency of " + name));
          }
          for (String importer : context.importers()) {
            related.putIfAbsent(
                importer, new DependencyHint(scoring.getReverseDependency(), "imports " + name));
          }
        });
    return related;
  }

  private static long percent(double value) {
    return Math.round(value * 100);
  }

  record DependencyHint(double boost, String reason) {}

  public enum Status {
    APPLIED,
    NO_MATCHES,
    UNAVAILABLE,
    FAILED
  }

  /** {@code weights} is {@code null} when retrieval stopped before the weights were read. */
  public record Result(
      List<FileScore> scores, WeightAnalysis weights, Status status, String reason) {

    public boolean applied() {
      return status == Status.APPLIED;
    }
  }
}
