package com.aiadvent.mcp.context.budget;

import static com.aiadvent.mcp.context.SampleSources.INDEX;
import static com.aiadvent.mcp.context.SampleSources.PLAYER;
import static org.assertj.core.api.Assertions.assertThat;

import com.aiadvent.mcp.context.SampleSources;
import com.aiadvent.mcp.context.analysis.PatternSourceStructureExtractor;
import com.aiadvent.mcp.context.config.ContextEngineProperties;
import com.aiadvent.mcp.context.intent.IntentAction;
import com.aiadvent.mcp.context.intent.IntentClassifier;
import com.aiadvent.mcp.context.memory.ConversationMessage;
import com.aiadvent.mcp.context.outline.OutlineGenerator;
import com.aiadvent.mcp.context.scoring.FileScore;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TokenBudgetManagerTest {

  private ContextEngineProperties properties;
  private IntentClassifier classifier;
  private TokenBudgetManager manager;

  @BeforeEach
  void setUp() {
    properties = new ContextEngineProperties();
    classifier = new IntentClassifier();
    TokenEstimator estimator = new TokenEstimator(properties, new ObjectMapper());
    OutlineGenerator outlines =
        new OutlineGenerator(new PatternSourceStructureExtractor(), properties, estimator);
    manager = new TokenBudgetManager(properties, classifier, outlines, estimator);
  }

  @Test
  void contextModeFollowsIntent() {
    assertThat(manager.contextMode(classifier.classify("change the color to red")))
        .isEqualTo(ContextMode.MINIMAL);
    assertThat(manager.contextMode(classifier.classify("explain how the score works")))
        .isEqualTo(ContextMode.OUTLINE);
    assertThat(manager.contextMode(classifier.classify("create a new snake game")))
        .isEqualTo(ContextMode.FULL);
    assertThat(manager.tokenBudget(IntentAction.CREATE))
        .isGreaterThan(manager.tokenBudget(IntentAction.TWEAK));
  }

  @Test
  void minimalSelectionHoldsMainAndSelectedFile() {
    FileSelection selection = manager.selectMinimal(SampleSources.project(), PLAYER);

    assertThat(selection.files()).extracting(RelevantFile::path).containsExactly(INDEX, PLAYER);
    assertThat(selection.files()).noneMatch(RelevantFile::outline);
    assertThat(selection.tokenBudget()).isEqualTo(manager.tokenBudget(IntentAction.TWEAK));
  }

  @Test
  void minimalSelectionDoesNotDuplicateMainFile() {
    FileSelection selection = manager.selectMinimal(SampleSources.project(), INDEX);

    assertThat(selection.files()).hasSize(1);
  }

  @Test
  void fullSelectionStaysWithinFileBudget() {
    Map<String, String> files = new LinkedHashMap<>();
    List<FileScore> scores = new ArrayList<>();
    for (int i = 0; i < 6; i++) {
      String path = "/src/components/Widget" + i + ".tsx";
      files.put(path, "x".repeat(8000));
      scores.add(new FileScore(path, 0.5, List.of("keywords: widget")));
    }

    FileSelection selection =
        manager.select(scores, files, null, IntentAction.MODIFY, ContextMode.FULL);

    int fileBudget = 10000 - properties.getBudget().getReservedTokens();
    assertThat(selection.tokens()).isLessThanOrEqualTo(fileBudget);
    assertThat(selection.files()).hasSize(4);
    assertThat(selection.tokenBudget()).isEqualTo(10000);
  }

  @Test
  void selectedFileIsKeptEvenWhenOverBudget() {
    Map<String, String> files = Map.of(PLAYER, "y".repeat(40000));
    List<FileScore> scores = List.of(new FileScore(PLAYER, 0.9, List.of("currently selected")));

    FileSelection selection =
        manager.select(scores, files, PLAYER, IntentAction.MODIFY, ContextMode.FULL);

    assertThat(selection.files()).hasSize(1);
    assertThat(selection.tokens()).isEqualTo(10000);
    assertThat(selection.files().get(0).relevanceReason())
        .isEqualTo("currently selected [full]");
  }

  @Test
  void outlineModeOutlinesLongSecondaryFiles() {
    Map<String, String> files = SampleSources.project();
    List<FileScore> scores =
        List.of(
            new FileScore(PLAYER, 0.5, List.of("keywords: player")),
            new FileScore(SampleSources.MATH, 0.0, List.of()));

    FileSelection selection =
        manager.select(scores, files, null, IntentAction.EXPLAIN, ContextMode.OUTLINE);

    assertThat(selection.files()).hasSize(1);
    RelevantFile player = selection.files().get(0);
    assertThat(player.outline()).isTrue();
    assertThat(player.relevanceReason()).isEqualTo("keywords: player [outline]");
    assertThat(player.content()).startsWith("// " + PLAYER);
  }

  @Test
  void preflightEstimatesFromRawSizes() {
    Map<String, String> files = new LinkedHashMap<>();
    files.put("/src/components/Big.tsx", "a".repeat(400));
    files.put(INDEX, "b".repeat(40));
    files.put("/src/lib/other.ts", "c".repeat(4));
    List<ConversationMessage> history =
        List.of(
            new ConversationMessage("user", "d".repeat(400)),
            new ConversationMessage("assistant", "e".repeat(8)));

    PreflightEstimate estimate =
        manager.preflight(
            "change the color to red", files, "/src/components/Big.tsx", history, null);

    assertThat(estimate.intent()).isEqualTo(IntentAction.TWEAK);
    assertThat(estimate.recommendedMode()).isEqualTo(ContextMode.MINIMAL);
    assertThat(estimate.filesToInclude()).isEqualTo(2);
    assertThat(estimate.breakdown().filesTokens()).isEqualTo(110);
    assertThat(estimate.breakdown().memoryTokens()).isZero();
    assertThat(estimate.breakdown().conversationTokens()).isEqualTo(102);
    assertThat(estimate.estimatedTokens()).isEqualTo(110 + 102 + 300 + 2000);
    assertThat(estimate.withinBudget()).isTrue();
  }

  @Test
  void preflightRecommendsOutlineForOversizedRequests() {
    Map<String, String> files = new LinkedHashMap<>();
    for (int i = 0; i < 12; i++) {
      files.put("/src/components/Part" + i + ".tsx", "z".repeat(10000));
    }

    PreflightEstimate estimate =
        manager.preflight("create a new racing game", files, null, List.of(), null);

    assertThat(estimate.filesToInclude()).isEqualTo(10);
    assertThat(estimate.withinBudget()).isFalse();
    assertThat(estimate.recommendedMode()).isEqualTo(ContextMode.OUTLINE);
  }

  @Test
  void fullContextNeedsByPrompt() {
    assertThat(manager.needsFullContext("explain how the score works")).isFalse();
    assertThat(manager.needsFullContext("add a leaderboard with high scores")).isTrue();
    assertThat(manager.recommendedContextMode("give the menu a darker theme"))
        .isEqualTo(ContextMode.OUTLINE);
    assertThat(TokenBudgetManager.tail(List.of(1, 2, 3, 4), 2)).containsExactly(3, 4);
  }
}
