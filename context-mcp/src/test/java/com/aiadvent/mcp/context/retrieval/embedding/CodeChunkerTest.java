package com.aiadvent.mcp.context.retrieval.embedding;

import static org.assertj.core.api.Assertions.assertThat;

import com.aiadvent.mcp.context.config.ContextEngineProperties;
import com.aiadvent.mcp.context.retrieval.embedding.CodeChunk.ChunkType;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class CodeChunkerTest {

  private static final String HOOK_AND_COMPONENT =
      String.join(
          "\n",
          "import { useState } from 'react';",
          "import { clamp } from './math';",
          "",
          "export function useScore() {",
          "  const [score, setScore] = useState(0);",
          "  const add = (n: number) => setScore(score + n);",
          "  const reset = () => setScore(0);",
          "  return { score, add, reset };",
          "}",
          "",
          "export function Board() {",
          "  return (",
          "    <div>",
          "      <span>board</span>",
          "    </div>",
          "  );",
          "}",
          "");

  @Test
  void chunksOnDeclarationBoundariesAndDropsImports() {
    List<CodeChunk> chunks = chunker(200, 5).chunk("/src/Board.tsx", HOOK_AND_COMPONENT);

    assertThat(chunks).hasSize(2);
    CodeChunk hook = chunks.get(0);
    assertThat(hook.chunkType()).isEqualTo(ChunkType.HOOK);
    assertThat(hook.symbolName()).isEqualTo("useScore");
    assertThat(hook.startLine()).isEqualTo(4);
    assertThat(hook.endLine()).isEqualTo(9);
    assertThat(hook.content()).startsWith("export function useScore()").endsWith("}");
    CodeChunk component = chunks.get(1);
    assertThat(component.chunkType()).isEqualTo(ChunkType.COMPONENT);
    assertThat(component.symbolName()).isEqualTo("Board");
    assertThat(component.chunkIndex()).isEqualTo(1);
    assertThat(chunks).noneMatch(chunk -> chunk.content().contains("import "));
  }

  @Test
  void shortDeclarationsAreDropped() {
    assertThat(chunker(200, 5).chunk("/src/config.ts", "export const MAX_SPEED = 10;\n"))
        .isEmpty();
  }

  @Test
  void oversizedDeclarationsAreSplitWithOverlap() {
    List<String> lines = new ArrayList<>();
    lines.add("function simulate() {");
    for (int i = 0; i < 48; i++) {
      lines.add("  step(" + i + ");");
    }
    lines.add("}");

    List<CodeChunk> chunks = chunker(20, 5).chunk("/src/physics.ts", String.join("\n", lines));

    assertThat(chunks)
        .extracting(CodeChunk::symbolName)
        .containsExactly("simulate", "simulate#2", "simulate#3");
    assertThat(chunks)
        .extracting(CodeChunk::startLine)
        .containsExactly(1, 16, 31);
    assertThat(chunks.get(2).endLine()).isEqualTo(50);
    assertThat(chunks).allMatch(chunk -> chunk.chunkType() == ChunkType.FUNCTION);
  }

  @Test
  void filesWithoutDeclarationsUseLineWindows() {
    List<String> lines = new ArrayList<>();
    for (int i = 0; i < 30; i++) {
      lines.add("value" + i + " = " + i + ";");
    }

    List<CodeChunk> chunks = chunker(20, 5).chunk("/src/data.js", String.join("\n", lines));

    assertThat(chunks).hasSize(2);
    assertThat(chunks.get(0).startLine()).isEqualTo(1);
    assertThat(chunks.get(0).endLine()).isEqualTo(20);
    assertThat(chunks.get(1).startLine()).isEqualTo(16);
    assertThat(chunks.get(1).endLine()).isEqualTo(30);
    assertThat(chunks).allMatch(chunk -> chunk.chunkType() == ChunkType.OTHER);
  }

  @Test
  void identicalContentHasIdenticalHash() {
    CodeChunker chunker = chunker(200, 5);

    String first = chunker.chunk("/a.tsx", HOOK_AND_COMPONENT).get(0).contentHash();
    String second = chunker.chunk("/b.tsx", HOOK_AND_COMPONENT).get(0).contentHash();

    assertThat(first).isEqualTo(second);
  }

  @Test
  void onlyScriptSourcesAreIndexable() {
    assertThat(CodeChunker.isIndexable("/src/App.tsx")).isTrue();
    assertThat(CodeChunker.isIndexable("/src/lib/math.js")).isTrue();
    assertThat(CodeChunker.isIndexable("/src/vite-env.d.ts")).isFalse();
    assertThat(CodeChunker.isIndexable("/src/index.css")).isFalse();
    assertThat(CodeChunker.isIndexable("/src/App.test.tsx")).isFalse();
    assertThat(CodeChunker.isIndexable("/vite.config.ts")).isFalse();
    assertThat(CodeChunker.isIndexable(null)).isFalse();
  }

  private static CodeChunker chunker(int maxLines, int overlap) {
    ContextEngineProperties properties = new ContextEngineProperties();
    properties.getEmbedding().setMaxChunkLines(maxLines);
    properties.getEmbedding().setOverlapLines(overlap);
    return new CodeChunker(properties);
  }
}
