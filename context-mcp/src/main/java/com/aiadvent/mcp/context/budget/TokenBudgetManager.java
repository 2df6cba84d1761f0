package com.aiadvent.mcp.context.budget;

import com.aiadvent.mcp.context.analysis.PatternSourceStructureExtractor;
import com.aiadvent.mcp.context.config.ContextEngineProperties;
import com.aiadvent.mcp.context.intent.IntentAction;
import com.aiadvent.mcp.context.intent.IntentClassification;
import com.aiadvent.mcp.context.intent.IntentClassifier;
import com.aiadvent.mcp.context.memory.ConversationMessage;
import com.aiadvent.mcp.context.memory.ProjectMemory;
import com.aiadvent.mcp.context.outline.OutlineGenerator;
import com.aiadvent.mcp.context.outline.OutlineGenerator.ContentOrOutline;
import com.aiadvent.mcp.context.scoring.FileScore;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Chooses the context mode and walks scored files under the per-intent token ceiling. Main entry
 * files, the selected file and high confidence matches are kept in full and may overrun the
 * ceiling while fewer than {@code mustIncludeCap} files are selected.
 */
@Service
public class TokenBudgetManager {

  private static final Logger log = LoggerFactory.getLogger(TokenBudgetManager.class);

  private final ContextEngineProperties properties;
  private final IntentClassifier classifier;
  private final OutlineGenerator outlineGenerator;
  private final TokenEstimator tokenEstimator;

  public TokenBudgetManager(
      ContextEngineProperties properties,
      IntentClassifier classifier,
      OutlineGenerator outlineGenerator,
      TokenEstimator tokenEstimator) {
    this.properties = properties;
    this.classifier = classifier;
    this.outlineGenerator = outlineGenerator;
    this.tokenEstimator = tokenEstimator;
  }

  public int tokenBudget(IntentAction action) {
    return properties.getBudget().tokensFor(action);
  }

  public ContextMode contextMode(IntentClassification intent) {
    if (intent.trivialChange() || intent.isAction(IntentAction.TWEAK)) {
      return ContextMode.MINIMAL;
    }
    return intent.isAction(IntentAction.EXPLAIN) ? ContextMode.OUTLINE : ContextMode.FULL;
  }

  public int maxFiles(IntentAction action) {
    ContextEngineProperties.Selection selection = properties.getSelection();
    return switch (action) {
      case DEBUG -> selection.getMaxFilesDebug();
      case EXPLAIN -> selection.getMaxFilesExplain();
      default -> selection.getMaxFiles();
    };
  }

  /** Greedy walk over {@code scores} in order; stops once {@link #maxFiles} files are taken. */
  public FileSelection select(
      List<FileScore> scores,
      Map<String, String> files,
      String selectedFile,
      IntentAction action,
      ContextMode mode) {
    ContextEngineProperties.Selection selection = properties.getSelection();
    int tokenBudget = tokenBudget(action);
    int fileBudget = tokenBudget - properties.getBudget().getReservedTokens();
    int maxFiles = maxFiles(action);
    boolean useOutlines = mode == ContextMode.OUTLINE;

    Set<String> mustInclude = new HashSet<>(selection.getMustIncludeFiles());
    if (StringUtils.hasText(selectedFile)) {
      mustInclude.add(selectedFile);
    }

    List<RelevantFile> selected = new ArrayList<>();
    int tokens = 0;
    for (FileScore scored : scores) {
      if (scored.score() <= 0) {
        continue;
      }
      String content = files.get(scored.path());
      if (!StringUtils.hasText(content)) {
        continue;
      }
      boolean mainFile =
          mustInclude.contains(scored.path())
              || scored.score() >= selection.getHighConfidenceScore();
      String fileContent = content;
      boolean outline = false;
      boolean large =
          PatternSourceStructureExtractor.lineCount(content) > selection.getLargeFileLines();
      if (!mainFile && (useOutlines || large)) {
        ContentOrOutline result = outlineGenerator.contentOrOutline(scored.path(), content);
        fileContent = result.content();
        outline = result.outline();
      }
      int fileTokens = tokenEstimator.estimate(fileContent);
      boolean includeAnyway = mainFile && selected.size() < selection.getMustIncludeCap();

      if (tokens + fileTokens <= fileBudget || includeAnyway) {
        String reason =
            scored.summary(3) + (outline ? " [outline]" : "") + (mainFile ? " [full]" : "");
        selected.add(
            new RelevantFile(
                scored.path(), fileContent, outline, Math.min(scored.score(), 1.0), reason));
        tokens += fileTokens;
      } else {
        log.debug(
            "Skipped {} ({} tokens) over file budget {}", scored.path(), fileTokens, fileBudget);
      }
      if (selected.size() >= maxFiles) {
        break;
      }
    }
    return new FileSelection(selected, tokens, tokenBudget);
  }

  /** Main entry file plus the selected file, both in full, under the tweak budget. */
  public FileSelection selectMinimal(Map<String, String> files, String selectedFile) {
    String mainFile = properties.getSelection().getMainFile();
    List<RelevantFile> selected = new ArrayList<>();
    if (StringUtils.hasText(files.get(mainFile))) {
      selected.add(new RelevantFile(mainFile, files.get(mainFile), false, 1.0, "main game file"));
    }
    if (StringUtils.hasText(selectedFile)
        && !selectedFile.equals(mainFile)
        && StringUtils.hasText(files.get(selectedFile))) {
      selected.add(
          new RelevantFile(
              selectedFile, files.get(selectedFile), false, 0.9, "currently selected"));
    }
    int tokens = tokenEstimator.estimate(joinContent(selected));
    return new FileSelection(selected, tokens, tokenBudget(IntentAction.TWEAK));
  }

  /** Cost estimate computed from raw sizes, without scoring or persistence lookups. */
  public PreflightEstimate preflight(
      String prompt,
      Map<String, String> files,
      String selectedFile,
      List<ConversationMessage> history,
      ProjectMemory projectMemory) {
    IntentClassification intent = classifier.classify(prompt);
    ContextEngineProperties.Budget budget = properties.getBudget();
    int tokenBudget = tokenBudget(intent.action());
    Map<String, String> safeFiles = files != null ? files : Map.of();

    int sampleSize =
        intent.trivialChange() ? 2 : intent.isAction(IntentAction.CREATE) ? 10 : 6;
    int filesToInclude = Math.min(safeFiles.size(), sampleSize);
    List<String> entryPoints = properties.getScoring().getEntryPoints();
    Comparator<String> priority =
        Comparator.comparingInt(
            path -> path.equals(selectedFile) ? 0 : entryPoints.contains(path) ? 1 : 2);
    int fileChars =
        safeFiles.keySet().stream()
            .sorted(priority)
            .limit(filesToInclude)
            .mapToInt(path -> lengthOf(safeFiles.get(path)))
            .sum();
    int filesTokens = (int) Math.ceil(fileChars / (double) budget.getCharsPerToken());

    int memoryTokens = tokenEstimator.estimateJson(projectMemory);

    int messageCount =
        intent.trivialChange()
            ? properties.getConversation().getRecentMessagesMinimal()
            : intent.isAction(IntentAction.EXPLAIN)
                ? properties.getConversation().getRecentMessagesExplain()
                : properties.getConversation().getRecentMessages();
    int messageChars =
        tail(history, messageCount).stream().mapToInt(message -> message.content().length()).sum();
    int conversationTokens = (int) Math.ceil(messageChars / (double) budget.getCharsPerToken());

    PreflightEstimate.Breakdown breakdown =
        new PreflightEstimate.Breakdown(
            filesTokens,
            memoryTokens,
            conversationTokens,
            budget.getTaskContextEstimate(),
            budget.getReservedTokens());
    int total = breakdown.total();

    ContextMode recommended;
    if (intent.trivialChange() || intent.isAction(IntentAction.TWEAK)) {
      recommended = ContextMode.MINIMAL;
    } else if (total > tokenBudget * budget.getOutlineRecommendationFactor()) {
      recommended = ContextMode.OUTLINE;
    } else {
      recommended = ContextMode.FULL;
    }
    return new PreflightEstimate(
        total,
        tokenBudget,
        total <= tokenBudget,
        recommended,
        breakdown,
        filesToInclude,
        intent.action());
  }

  public boolean needsFullContext(String prompt) {
    IntentClassification intent = classifier.classify(prompt);
    if (intent.trivialChange()) {
      return false;
    }
    return switch (intent.action()) {
      case TWEAK, STYLE, RENAME, EXPLAIN -> false;
      default -> true;
    };
  }

  public ContextMode recommendedContextMode(String prompt) {
    IntentClassification intent = classifier.classify(prompt);
    if (intent.trivialChange() || intent.isAction(IntentAction.TWEAK)) {
      return ContextMode.MINIMAL;
    }
    if (intent.isAction(IntentAction.STYLE) || intent.isAction(IntentAction.EXPLAIN)) {
      return ContextMode.OUTLINE;
    }
    return ContextMode.FULL;
  }

  public static <T> List<T> tail(List<T> items, int count) {
    if (items == null || items.isEmpty() || count <= 0) {
      return List.of();
    }
    return List.copyOf(items.subList(Math.max(0, items.size() - count), items.size()));
  }

  private static String joinContent(List<RelevantFile> files) {
    StringBuilder builder = new StringBuilder();
    files.forEach(file -> builder.append(file.content()));
    return builder.toString();
  }

  private static int lengthOf(String content) {
    return content != null ? content.length() : 0;
  }
}
