package com.aiadvent.mcp.context.scoring;

import com.aiadvent.mcp.context.analysis.FileType;
import com.aiadvent.mcp.context.change.FileRecord;
import com.aiadvent.mcp.context.change.FileRecordStore;
import com.aiadvent.mcp.context.config.ContextEngineProperties;
import com.aiadvent.mcp.context.graph.DependencyContext;
import com.aiadvent.mcp.context.graph.DependencyGraph;
import com.aiadvent.mcp.context.intent.IntentAction;
import com.aiadvent.mcp.context.intent.IntentClassification;
import com.aiadvent.mcp.context.memory.ProjectMemory;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Additive keyword and structure scoring. A direct pass scores every file on its own signals,
 * then files connected by imports to a mentioned or selected file receive a dependency bonus.
 */
@Component
public class RelevanceScorer {

  static final String REASON_MENTIONED = "mentioned in prompt";
  static final String REASON_SELECTED = "currently selected";
  public static final String REASON_RECENTLY_MODIFIED = "recently modified";
  static final String REASON_ENTRY_POINT = "entry point";
  static final String REASON_FREQUENTLY_MODIFIED = "frequently modified";
  public static final String REASON_HIGH_IMPORTANCE = "high importance";
  static final String REASON_STYLE_FILE = "style file for style change";
  static final String REASON_PAGE_FILE = "page file for debugging";

  private static final Logger log = LoggerFactory.getLogger(RelevanceScorer.class);

  private final FileRecordStore store;
  private final ContextEngineProperties.Scoring weights;

  public RelevanceScorer(FileRecordStore store, ContextEngineProperties properties) {
    this.store = store;
    this.weights = properties.getScoring();
  }

  public List<FileScore> score(
      String projectId,
      Map<String, String> files,
      String selectedFile,
      Collection<String> changedFiles,
      IntentClassification intent,
      ProjectMemory projectMemory) {
    if (files == null || files.isEmpty()) {
      return List.of();
    }
    Map<String, FileRecord> records = store.getFileRecords(projectId);
    Set<String> known = new HashSet<>(files.keySet());
    known.addAll(records.keySet());
    DependencyGraph graph = DependencyGraph.build(records.values(), known);
    Set<String> changed = changedFiles != null ? new HashSet<>(changedFiles) : Set.of();
    ProjectMemory memory = projectMemory != null ? projectMemory : ProjectMemory.empty();

    Map<String, ScoreAccumulator> scores = new LinkedHashMap<>();
    Set<String> directlyRelevant = new LinkedHashSet<>();
    files.forEach(
        (path, content) -> {
          ScoreAccumulator acc = new ScoreAccumulator(path);
          if (intent.targetFiles().contains(path)) {
            acc.add(weights.getMentionedInPrompt(), REASON_MENTIONED);
            directlyRelevant.add(path);
          }
          if (selectedFile != null && path.equals(selectedFile)) {
            acc.add(weights.getSelectedFile(), REASON_SELECTED);
            directlyRelevant.add(path);
          }
          if (changed.contains(path)) {
            acc.add(weights.getRecentlyModified(), REASON_RECENTLY_MODIFIED);
          }
          if (weights.getEntryPoints().contains(path)) {
            acc.add(weights.getEntryPoint(), REASON_ENTRY_POINT);
          }
          scoreKeywords(acc, content, intent.keywords());

          FileRecord record = records.get(path);
          if (record != null
              && record.modificationCount() > weights.getModificationCountThreshold()) {
            acc.add(weights.getHighModificationCount(), REASON_FREQUENTLY_MODIFIED);
          }
          double importance = memory.importanceOf(path);
          if (importance > 0) {
            acc.add(importance * weights.getMemoryImportanceFactor(), REASON_HIGH_IMPORTANCE);
          }
          if (record != null) {
            scoreTypeMatch(acc, record.fileType(), intent);
          }
          scores.put(path, acc);
        });

    for (String relevant : directlyRelevant) {
      String name = baseName(relevant);
      for (String imported : graph.importsOf(relevant)) {
        ScoreAccumulator target = scores.get(imported);
        if (target != null) {
          target.add(weights.getImportedByRelevant(), "imported by " + name);
        }
      }
    }
    for (String relevant : directlyRelevant) {
      String name = baseName(relevant);
      for (String importer : graph.importersOf(relevant)) {
        ScoreAccumulator target = scores.get(importer);
        if (target != null) {
          target.add(weights.getReverseDependency(), "imports " + name);
        }
      }
    }

    List<FileScore> result = new ArrayList<>();
    scores.values().forEach(acc -> result.add(acc.toScore()));
    result.sort(FileScore.BY_SCORE_DESC);
    log.debug(
        "Scored {} files for project {} ({} directly relevant)",
        result.size(),
        projectId,
        directlyRelevant.size());
    return result;
  }

  /**
   * Boosts the imports (+direct dependency) and importers (+reverse dependency) of each target
   * file already present in {@code scores}, then re-sorts.
   */
  public List<FileScore> applyDependencyBoosts(
      List<FileScore> scores, Map<String, DependencyContext> dependencyContext) {
    if (dependencyContext == null || dependencyContext.isEmpty() || scores.isEmpty()) {
      return scores;
    }
    Map<String, FileScore> byPath = new LinkedHashMap<>();
    scores.forEach(score -> byPath.put(score.path(), score));
    dependencyContext.forEach(
        (target, context) -> {
          String name = baseName(target);
          for (String dependency : context.imports()) {
            byPath.computeIfPresent(
                dependency,
                (path, score) ->
                    score.boosted(weights.getDirectDependency(), "dependency of " + name));
          }
          for (String importer : context.importers()) {
            byPath.computeIfPresent(
                importer,
                (path, score) -> score.boosted(weights.getReverseDependency(), "imports " + name));
          }
        });
    List<FileScore> boosted = new ArrayList<>(byPath.values());
    boosted.sort(FileScore.BY_SCORE_DESC);
    return boosted;
  }

  private void scoreKeywords(ScoreAccumulator acc, String content, List<String> keywords) {
    if (keywords.isEmpty() || content == null) {
      return;
    }
    String lower = content.toLowerCase(Locale.ROOT);
    List<String> matched = keywords.stream().filter(lower::contains).toList();
    if (matched.isEmpty()) {
      return;
    }
    double saturation = Math.min(matched.size() / (double) weights.getKeywordSaturation(), 1.0);
    acc.add(
        weights.getKeywordMatch() * saturation,
        "keywords: " + String.join(", ", matched.subList(0, Math.min(3, matched.size()))));
  }

  private void scoreTypeMatch(ScoreAccumulator acc, FileType type, IntentClassification intent) {
    if (intent.isAction(IntentAction.STYLE) && type == FileType.STYLE) {
      acc.add(weights.getTypeMatch(), REASON_STYLE_FILE);
    } else if (intent.isAction(IntentAction.DEBUG) && type == FileType.PAGE) {
      acc.add(weights.getTypeMatch(), REASON_PAGE_FILE);
    }
  }

  public static String baseName(String path) {
    int slash = path.lastIndexOf('/');
    return slash >= 0 ? path.substring(slash + 1) : path;
  }

  private static final class ScoreAccumulator {
    private final String path;
    private final List<String> reasons = new ArrayList<>();
    private double score;

    private ScoreAccumulator(String path) {
      this.path = path;
    }

    private void add(double delta, String reason) {
      score += delta;
      reasons.add(reason);
    }

    private FileScore toScore() {
      return new FileScore(path, score, reasons);
    }
  }
}
