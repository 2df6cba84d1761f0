package com.aiadvent.mcp.context.retrieval;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

import com.aiadvent.mcp.context.StaticObjectProvider;
import com.aiadvent.mcp.context.config.ContextEngineProperties;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SemanticCodeSearchTest {

  @Mock private SemanticSearchClient client;

  @Test
  void keywordMentionsReRankFragments() {
    when(client.embedQuery(anyString())).thenReturn(new float[] {1f});
    when(client.searchSimilar(eq("p"), any(float[].class), eq(4), anyDouble()))
        .thenReturn(
            List.of(
                new SimilarFragment("/src/lib/math.ts", 0.7, "export function clamp()", "clamp"),
                new SimilarFragment(
                    "/src/hooks/useGame.ts", 0.6, "const jump = () => setPosition()", "useGame"),
                new SimilarFragment("/src/App.tsx", 0.5, "render", null)));
    SemanticCodeSearch search =
        new SemanticCodeSearch(new StaticObjectProvider<>(client), new ContextEngineProperties());

    List<SimilarFragment> result = search.search("p", "make jump usegame higher", 2, 0.4);

    assertThat(result).hasSize(2);
    assertThat(result.get(0).path()).isEqualTo("/src/hooks/useGame.ts");
    assertThat(result.get(0).similarity()).isCloseTo(0.9, within(1e-9));
    assertThat(result.get(1).path()).isEqualTo("/src/lib/math.ts");
  }

  @Test
  void similarityIsCappedAtOne() {
    when(client.embedQuery(anyString())).thenReturn(new float[] {1f});
    when(client.searchSimilar(eq("p"), any(float[].class), eq(20), anyDouble()))
        .thenReturn(
            List.of(new SimilarFragment("/src/a.ts", 0.95, "player player", "playerSprite")));
    SemanticCodeSearch search =
        new SemanticCodeSearch(new StaticObjectProvider<>(client), new ContextEngineProperties());

    assertThat(search.search("p", "player", 10, 0.4).get(0).similarity()).isEqualTo(1.0);
  }

  @Test
  void missingClientIsUnavailable() {
    SemanticCodeSearch search =
        new SemanticCodeSearch(StaticObjectProvider.empty(), new ContextEngineProperties());

    assertThat(search.isAvailable()).isFalse();
    assertThat(search.search("p", "anything", 5, 0.4)).isEmpty();
  }

  @Test
  void keywordsDropShortWords() {
    assertThat(SemanticCodeSearch.keywords("Fix the UI of Player"))
        .containsExactly("fix", "the", "player");
  }
}
