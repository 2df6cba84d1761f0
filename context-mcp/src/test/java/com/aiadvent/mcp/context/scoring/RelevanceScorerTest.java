package com.aiadvent.mcp.context.scoring;

import static com.aiadvent.mcp.context.SampleSources.INDEX;
import static com.aiadvent.mcp.context.SampleSources.MATH;
import static com.aiadvent.mcp.context.SampleSources.PLAYER;
import static com.aiadvent.mcp.context.SampleSources.SCORE_BOARD;
import static com.aiadvent.mcp.context.SampleSources.STYLES;
import static com.aiadvent.mcp.context.SampleSources.USE_GAME;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.aiadvent.mcp.context.SampleSources;
import com.aiadvent.mcp.context.analysis.PatternSourceStructureExtractor;
import com.aiadvent.mcp.context.change.ChangeStoreService;
import com.aiadvent.mcp.context.change.InMemoryFileRecordStore;
import com.aiadvent.mcp.context.config.ContextEngineProperties;
import com.aiadvent.mcp.context.graph.DependencyContext;
import com.aiadvent.mcp.context.intent.IntentAction;
import com.aiadvent.mcp.context.intent.IntentClassification;
import com.aiadvent.mcp.context.memory.ProjectMemory;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RelevanceScorerTest {

  private static final String PROJECT = "scoring";

  private RelevanceScorer scorer;
  private Map<String, String> files;

  @BeforeEach
  void setUp() {
    InMemoryFileRecordStore store = new InMemoryFileRecordStore();
    files = SampleSources.project();
    new ChangeStoreService(store, new PatternSourceStructureExtractor())
        .sync(PROJECT, files, false);
    scorer = new RelevanceScorer(store, new ContextEngineProperties());
  }

  @Test
  void mentionedFileOutranksSingleKeywordMatch() {
    Map<String, FileScore> scores =
        byPath(
            scorer.score(
                PROJECT, files, null, List.of(), intent(List.of(SCORE_BOARD), "health"), null));

    assertThat(scores.get(SCORE_BOARD).score()).isGreaterThan(scores.get(PLAYER).score());
    assertThat(scores.get(SCORE_BOARD).reasons()).contains("mentioned in prompt");
    assertThat(scores.get(PLAYER).reasons()).containsExactly("keywords: health");
    assertThat(scores.get(PLAYER).score()).isCloseTo(0.5 / 3, within(1e-9));
  }

  @Test
  void selectedFilePropagatesToImportsAndImporters() {
    Map<String, FileScore> scores =
        byPath(scorer.score(PROJECT, files, USE_GAME, List.of(), intent(List.of()), null));

    assertThat(scores.get(USE_GAME).reasons()).containsExactly("currently selected");
    assertThat(scores.get(MATH).reasons()).containsExactly("imported by useGame.ts");
    assertThat(scores.get(PLAYER).reasons()).containsExactly("imports useGame.ts");
    assertThat(scores.get(INDEX).reasons()).containsExactly("entry point", "imports useGame.ts");
  }

  @Test
  void recencyMemoryAndTypeSignalsAreAdded() {
    ProjectMemory memory =
        new ProjectMemory(null, null, null, null, Map.of(MATH, 0.5), null);
    IntentClassification style =
        new IntentClassification(
            IntentAction.STYLE, 0.75, List.of(), List.of(), false, true, false);

    Map<String, FileScore> scores =
        byPath(scorer.score(PROJECT, files, null, List.of(PLAYER), style, memory));

    assertThat(scores.get(PLAYER).reasons())
        .containsExactly(RelevanceScorer.REASON_RECENTLY_MODIFIED);
    assertThat(scores.get(MATH).score()).isCloseTo(0.15, within(1e-9));
    assertThat(scores.get(STYLES).reasons()).containsExactly("style file for style change");
  }

  @Test
  void resultIsSortedByScore() {
    List<FileScore> scores =
        scorer.score(PROJECT, files, PLAYER, List.of(), intent(List.of(), "score"), null);

    assertThat(scores).isSortedAccordingTo(FileScore.BY_SCORE_DESC);
    assertThat(scores.get(0).path()).isEqualTo(INDEX);
    assertThat(scores.get(1).path()).isEqualTo(PLAYER);
    assertThat(scorer.score(PROJECT, Map.of(), null, null, intent(List.of()), null)).isEmpty();
  }

  @Test
  void dependencyBoostsReorderScores() {
    List<FileScore> scores =
        List.of(
            new FileScore(INDEX, 1.0, List.of("entry point")),
            new FileScore(USE_GAME, 0.3, List.of("keywords: score")),
            new FileScore(MATH, 0.1, List.of()));

    List<FileScore> boosted =
        scorer.applyDependencyBoosts(
            scores, Map.of(INDEX, new DependencyContext(List.of(USE_GAME), List.of())));

    assertThat(boosted).extracting(FileScore::path).containsExactly(USE_GAME, INDEX, MATH);
    assertThat(boosted.get(0).score()).isCloseTo(1.1, within(1e-9));
    assertThat(boosted.get(0).hasReason("dependency of Index.tsx")).isTrue();
  }

  private static IntentClassification intent(List<String> targets, String... keywords) {
    return new IntentClassification(
        IntentAction.MODIFY, 0.5, targets, List.of(keywords), false, false, false);
  }

  private static Map<String, FileScore> byPath(List<FileScore> scores) {
    return scores.stream().collect(Collectors.toMap(FileScore::path, Function.identity()));
  }
}
