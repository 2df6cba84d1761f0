package com.aiadvent.mcp.context.retrieval.embedding;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.aiadvent.mcp.context.SampleSources;
import com.aiadvent.mcp.context.StaticObjectProvider;
import com.aiadvent.mcp.context.WordBucketEmbeddingModel;
import com.aiadvent.mcp.context.config.ContextEngineProperties;
import com.aiadvent.mcp.context.retrieval.SimilarFragment;
import com.aiadvent.mcp.context.retrieval.embedding.EmbeddingIndexer.IndexResult;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.ai.embedding.EmbeddingModel;

class EmbeddingIndexerTest {

  private WordBucketEmbeddingModel model;
  private EmbeddingIndexer indexer;
  private EmbeddingIndex index;

  @BeforeEach
  void setUp() {
    model = new WordBucketEmbeddingModel(64);
    indexer = indexer(new StaticObjectProvider<>(model));
    index = new EmbeddingIndex();
  }

  @Test
  void indexesChunksAndFindsThemBySimilarity() {
    assertThat(indexer.index(index, SampleSources.USE_GAME, SampleSources.useGame()))
        .isEqualTo(IndexResult.INDEXED);
    assertThat(
            indexer.index(
                index, SampleSources.PLAYER, SampleSources.component("Player", 10)))
        .isEqualTo(IndexResult.INDEXED);

    List<SimilarFragment> matches =
        index.search(model.vectorFor("setScore setPosition clamp position"), 3, 0.1);

    assertThat(index.fileCount()).isEqualTo(2);
    assertThat(index.chunkCount()).isPositive();
    assertThat(matches).isNotEmpty();
    assertThat(matches.get(0).path()).isEqualTo(SampleSources.USE_GAME);
    assertThat(matches.get(0).symbolName()).isEqualTo("useGame");
  }

  @Test
  void unchangedContentIsNotEmbeddedAgain() {
    indexer.index(index, SampleSources.USE_GAME, SampleSources.useGame());
    int calls = model.calls();

    IndexResult result = indexer.index(index, SampleSources.USE_GAME, SampleSources.useGame());

    assertThat(result).isEqualTo(IndexResult.UNCHANGED);
    assertThat(model.calls()).isEqualTo(calls);
  }

  @Test
  void nonScriptFilesAreSkipped() {
    assertThat(indexer.index(index, SampleSources.STYLES, "body { margin: 0; }"))
        .isEqualTo(IndexResult.SKIPPED);
    assertThat(index.fileCount()).isZero();
  }

  @Test
  void embeddingFailureLeavesIndexUntouched() {
    model.failWith(new IllegalStateException("rate limited"));

    IndexResult result = indexer.index(index, SampleSources.USE_GAME, SampleSources.useGame());

    assertThat(result).isEqualTo(IndexResult.FAILED);
    assertThat(index.contentHash(SampleSources.USE_GAME)).isEmpty();
  }

  @Test
  void missingModelIsUnavailable() {
    EmbeddingIndexer unavailable = indexer(StaticObjectProvider.empty());

    assertThat(unavailable.isAvailable()).isFalse();
    assertThat(unavailable.index(index, SampleSources.USE_GAME, SampleSources.useGame()))
        .isEqualTo(IndexResult.UNAVAILABLE);
    assertThatThrownBy(() -> unavailable.embedQuery("jump"))
        .isInstanceOf(IllegalStateException.class);
  }

  @Test
  void cosineOfOrthogonalAndMismatchedVectors() {
    assertThat(EmbeddingIndex.cosine(new float[] {1f, 0f}, new float[] {0f, 1f})).isZero();
    assertThat(EmbeddingIndex.cosine(new float[] {1f, 1f}, new float[] {2f, 2f}))
        .isCloseTo(1.0, within(1e-6));
    assertThat(EmbeddingIndex.cosine(new float[] {1f}, new float[] {1f, 0f})).isZero();
  }

  private static EmbeddingIndexer indexer(StaticObjectProvider<EmbeddingModel> provider) {
    return new EmbeddingIndexer(new CodeChunker(new ContextEngineProperties()), provider);
  }
}
