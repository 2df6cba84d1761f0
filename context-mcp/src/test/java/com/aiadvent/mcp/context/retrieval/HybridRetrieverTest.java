package com.aiadvent.mcp.context.retrieval;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

import com.aiadvent.mcp.context.StaticObjectProvider;
import com.aiadvent.mcp.context.config.ContextEngineProperties;
import com.aiadvent.mcp.context.graph.DependencyContext;
import com.aiadvent.mcp.context.retrieval.HybridRetriever.DependencyHint;
import com.aiadvent.mcp.context.retrieval.HybridRetriever.Result;
import com.aiadvent.mcp.context.retrieval.HybridRetriever.Status;
import com.aiadvent.mcp.context.scoring.FileScore;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

class HybridRetrieverTest {

  private static final String PROJECT = "hybrid";
  private static final String A = "/src/components/A.tsx";
  private static final String B = "/src/components/B.tsx";
  private static final String C = "/src/components/C.tsx";
  private static final String D = "/src/lib/D.ts";
  private static final String TARGET = "/src/pages/X.tsx";

  @Mock private SemanticSearchClient client;

  private ContextEngineProperties properties;
  private HybridWeights weights;
  private List<FileScore> keywordScores;

  @BeforeEach
  void setUp() {
    MockitoAnnotations.openMocks(this);
    properties = new ContextEngineProperties();
    weights = HybridWeights.defaults(properties.getHybrid());
    keywordScores =
        List.of(
            new FileScore(A, 2.0, List.of("recently modified")),
            new FileScore(B, 1.0, List.of("high importance")));
  }

  @Test
  void combinesSignalsWithDependencyHints() {
    when(client.isAvailable()).thenReturn(true);
    when(client.embedQuery(anyString())).thenReturn(new float[] {1f, 0f});
    when(client.searchSimilar(eq(PROJECT), any(float[].class), eq(20), eq(0.4)))
        .thenReturn(
            List.of(
                new SimilarFragment(A, 0.8, "zzz", null),
                new SimilarFragment(C, 0.6, "zzz", null),
                new SimilarFragment(A, 0.5, "zzz", null)));

    Result result =
        retriever(new StaticObjectProvider<>(client))
            .retrieve(PROJECT, "tune gravity", keywordScores, dependencies(), null, List.of());

    assertThat(result.status()).isEqualTo(Status.APPLIED);
    assertThat(result.applied()).isTrue();
    assertThat(result.scores()).extracting(FileScore::path).containsExactly(D, A, B, C);
    Map<String, FileScore> byPath = new LinkedHashMap<>();
    result.scores().forEach(score -> byPath.put(score.path(), score));
    assertThat(byPath.get(D).score()).isCloseTo(0.8, within(1e-9));
    assertThat(byPath.get(D).reasons()).containsExactly("dependency of X.tsx");
    assertThat(byPath.get(A).score()).isCloseTo(0.77, within(1e-9));
    assertThat(byPath.get(A).semanticScore()).isEqualTo(0.8);
    assertThat(byPath.get(A).keywordScore()).isEqualTo(1.0);
    assertThat(byPath.get(A).reasons()).containsExactly("recently modified", "semantic: 80%");
    assertThat(byPath.get(B).score()).isCloseTo(0.25, within(1e-9));
    assertThat(byPath.get(C).score()).isCloseTo(0.24, within(1e-9));
    assertThat(byPath.get(C).reasons()).containsExactly("semantic match: 60%");
    assertThat(result.weights().weights()).isEqualTo(weights);
  }

  @Test
  void semanticFailureKeepsKeywordScores() {
    when(client.isAvailable()).thenReturn(true);
    when(client.embedQuery(anyString())).thenThrow(new IllegalStateException("embedding timeout"));

    Result result =
        retriever(new StaticObjectProvider<>(client))
            .retrieve(PROJECT, "tune gravity", keywordScores, dependencies(), null, null);

    assertThat(result.status()).isEqualTo(Status.FAILED);
    assertThat(result.reason()).isEqualTo("embedding timeout");
    assertThat(result.scores()).isSameAs(keywordScores);
  }

  @Test
  void emptySearchResultKeepsKeywordScores() {
    when(client.isAvailable()).thenReturn(true);
    when(client.embedQuery(anyString())).thenReturn(new float[] {1f});
    when(client.searchSimilar(eq(PROJECT), any(float[].class), eq(20), eq(0.4)))
        .thenReturn(List.of());

    Result result =
        retriever(new StaticObjectProvider<>(client))
            .retrieve(PROJECT, "tune gravity", keywordScores, Map.of(), null, null);

    assertThat(result.status()).isEqualTo(Status.NO_MATCHES);
    assertThat(result.scores()).isSameAs(keywordScores);
  }

  @Test
  void missingBackendIsUnavailable() {
    Result result =
        retriever(StaticObjectProvider.empty())
            .retrieve(PROJECT, "tune gravity", keywordScores, Map.of(), null, null);

    assertThat(result.status()).isEqualTo(Status.UNAVAILABLE);
    assertThat(result.weights()).isNull();
    assertThat(result.scores()).isSameAs(keywordScores);
  }

  @Test
  void firstDependencyHintWins() {
    Map<String, DependencyContext> dependencies = new LinkedHashMap<>();
    dependencies.put(TARGET, new DependencyContext(List.of(D), List.of(A)));
    dependencies.put(B, new DependencyContext(List.of(A), List.of(D)));

    Map<String, DependencyHint> related =
        retriever(StaticObjectProvider.empty()).relatedByDependency(dependencies);

    assertThat(related.get(D)).isEqualTo(new DependencyHint(0.8, "dependency of X.tsx"));
    assertThat(related.get(A)).isEqualTo(new DependencyHint(0.6, "imports X.tsx"));
  }

  private HybridRetriever retriever(StaticObjectProvider<SemanticSearchClient> provider) {
    AdaptiveWeightsProvider weightsProvider =
        projectId -> new WeightAnalysis(weights, 0.5, 12, 0.6);
    return new HybridRetriever(
        new SemanticCodeSearch(provider, properties), weightsProvider, properties);
  }

  private static Map<String, DependencyContext> dependencies() {
    return Map.of(TARGET, new DependencyContext(List.of(D), List.of()));
  }
}
