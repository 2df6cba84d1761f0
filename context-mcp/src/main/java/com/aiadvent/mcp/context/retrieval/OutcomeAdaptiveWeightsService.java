package com.aiadvent.mcp.context.retrieval;

import com.aiadvent.mcp.context.config.ContextEngineProperties;
import com.aiadvent.mcp.context.retrieval.persistence.GenerationOutcomeRepository;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

/**
 * Tunes hybrid weights from recorded selection accuracy. Projects with little history or high
 * accuracy keep the configured defaults; otherwise missed-file patterns shift weight towards
 * recency, importance or keyword matching. Results are cached per project.
 */
@Service
public class OutcomeAdaptiveWeightsService implements AdaptiveWeightsProvider {

  private static final Logger log = LoggerFactory.getLogger(OutcomeAdaptiveWeightsService.class);

  private static final String GLOBAL_KEY = "*";

  private final GenerationOutcomeRepository repository;
  private final ContextEngineProperties.Adaptive properties;
  private final HybridWeights defaults;
  private final Cache<String, WeightAnalysis> cache;

  public OutcomeAdaptiveWeightsService(
      GenerationOutcomeRepository repository, ContextEngineProperties properties) {
    this.repository = repository;
    this.properties = properties.getAdaptive();
    this.defaults = HybridWeights.defaults(properties.getHybrid());
    this.cache =
        Caffeine.newBuilder()
            .maximumSize(1000)
            .expireAfterWrite(this.properties.getCacheTtl())
            .build();
  }

  @Override
  public WeightAnalysis getWeights(String projectId) {
    if (!properties.isEnabled()) {
      return new WeightAnalysis(defaults, 0.0, 0, 0.0);
    }
    WeightAnalysis cached = cache.getIfPresent(projectId);
    if (cached != null) {
      return cached;
    }
    try {
      WeightAnalysis analysis = analyze(load(projectId));
      cache.put(projectId, analysis);
      return analysis;
    } catch (RuntimeException ex) {
      log.warn("Adaptive weight analysis failed for project {}: {}", projectId, ex.getMessage());
      return WeightAnalysis.fallback(defaults);
    }
  }

  /** Analysis across every project; not cached. */
  public WeightAnalysis global() {
    return analyze(load(GLOBAL_KEY));
  }

  public void clearCache(String projectId) {
    if (projectId == null) {
      cache.invalidateAll();
    } else {
      cache.invalidate(projectId);
    }
  }

  public Diagnostics diagnostics(String projectId) {
    List<GenerationOutcome> outcomes =
        repository.findRecentScored(projectId, PageRequest.of(0, 20)).stream()
            .map(GenerationOutcomeService::toOutcome)
            .toList();
    WeightAnalysis analysis = getWeights(projectId);
    double successRate =
        outcomes.isEmpty()
            ? 0.0
            : outcomes.stream()
                    .filter(outcome -> outcome.accuracy() >= properties.getSuccessThreshold())
                    .count()
                / (double) outcomes.size();
    List<OutcomeSummary> recent =
        outcomes.stream()
            .limit(10)
            .map(
                outcome ->
                    new OutcomeSummary(
                        outcome.accuracy(),
                        outcome.filesSelectedForContext().size(),
                        outcome.filesActuallyModified().size(),
                        outcome.missedFiles().size()))
            .toList();
    return new Diagnostics(
        analysis.weights(),
        analysis.confidence(),
        analysis.sampleSize(),
        analysis.avgAccuracy(),
        successRate,
        recent);
  }

  private List<GenerationOutcome> load(String projectId) {
    PageRequest page = PageRequest.of(0, properties.getSampleLimit());
    var entities =
        GLOBAL_KEY.equals(projectId)
            ? repository.findRecentScored(page)
            : repository.findRecentScored(projectId, page);
    return entities.stream().map(GenerationOutcomeService::toOutcome).toList();
  }

  WeightAnalysis analyze(List<GenerationOutcome> outcomes) {
    double avgAccuracy = average(outcomes);
    if (outcomes.size() < properties.getMinOutcomes()) {
      log.debug(
          "Insufficient outcomes ({}/{}), using default weights",
          outcomes.size(),
          properties.getMinOutcomes());
      return new WeightAnalysis(defaults, 0.0, outcomes.size(), avgAccuracy);
    }
    if (avgAccuracy >= properties.getHighAccuracy()) {
      return new WeightAnalysis(defaults, 0.9, outcomes.size(), avgAccuracy);
    }

    List<GenerationOutcome> unsuccessful =
        outcomes.stream()
            .filter(outcome -> outcome.accuracy() < properties.getSuccessThreshold())
            .toList();
    HybridWeights adapted = applyAdjustments(adjustments(unsuccessful));
    double confidence = Math.min(0.9, outcomes.size() / 50.0);
    log.info(
        "Adapted weights from {} outcomes (avg accuracy {}): {}",
        outcomes.size(),
        String.format("%.2f", avgAccuracy),
        adapted);
    return new WeightAnalysis(adapted, confidence, outcomes.size(), avgAccuracy);
  }

  private Adjustments adjustments(List<GenerationOutcome> unsuccessful) {
    Adjustments adjustments = new Adjustments();
    if (unsuccessful.isEmpty()) {
      return adjustments;
    }
    int totalMissed = 0;
    int importantMissed = 0;
    for (GenerationOutcome outcome : unsuccessful) {
      for (String file : outcome.missedFiles()) {
        totalMissed++;
        if (isImportantFile(file)) {
          importantMissed++;
        }
      }
    }
    // every missed file counts towards the recency miss rate
    double recentMissRate = totalMissed > 0 ? 1.0 : 0.0;
    double importantMissRate = totalMissed > 0 ? importantMissed / (double) totalMissed : 0.0;

    if (recentMissRate > properties.getMissRateThreshold()) {
      adjustments.recency = 0.1;
      adjustments.semantic = -0.05;
    }
    if (importantMissRate > properties.getMissRateThreshold()) {
      adjustments.importance = 0.1;
      adjustments.keyword = -0.05;
    }
    if (average(unsuccessful) < properties.getLowAccuracy()) {
      adjustments.keyword += 0.1;
      adjustments.semantic -= 0.1;
    }
    return adjustments;
  }

  private HybridWeights applyAdjustments(Adjustments adjustments) {
    double semantic = clamp(defaults.semanticWeight() + adjustments.semantic, 0.1, 0.6);
    double keyword = clamp(defaults.keywordWeight() + adjustments.keyword, 0.1, 0.4);
    double recency = clamp(defaults.recencyWeight() + adjustments.recency, 0.1, 0.4);
    double importance = clamp(defaults.importanceWeight() + adjustments.importance, 0.05, 0.3);
    double total = semantic + keyword + recency + importance;
    return new HybridWeights(
        round3(semantic / total),
        round3(keyword / total),
        round3(recency / total),
        round3(importance / total));
  }

  static boolean isImportantFile(String file) {
    return file.contains("/pages/")
        || file.contains("Index.tsx")
        || file.contains("Game")
        || file.contains("Main");
  }

  private static double average(List<GenerationOutcome> outcomes) {
    return outcomes.stream().mapToDouble(GenerationOutcome::accuracy).average().orElse(0.0);
  }

  private static double clamp(double value, double min, double max) {
    return Math.max(min, Math.min(max, value));
  }

  private static double round3(double value) {
    return BigDecimal.valueOf(value).setScale(3, RoundingMode.HALF_UP).doubleValue();
  }

  private static final class Adjustments {
    private double semantic;
    private double keyword;
    private double recency;
    private double importance;
  }

  public record OutcomeSummary(
      double accuracy, int filesSelected, int filesModified, int missed) {}

  public record Diagnostics(
      HybridWeights currentWeights,
      double confidence,
      int sampleSize,
      double avgAccuracy,
      double successRate,
      List<OutcomeSummary> recentOutcomes) {}
}
