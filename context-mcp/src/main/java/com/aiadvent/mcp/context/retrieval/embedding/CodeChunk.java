package com.aiadvent.mcp.context.retrieval.embedding;

public record CodeChunk(
    String path,
    int chunkIndex,
    int startLine,
    int endLine,
    String content,
    String contentHash,
    ChunkType chunkType,
    String symbolName) {

  public enum ChunkType {
    FUNCTION,
    COMPONENT,
    CLASS,
    TYPE,
    HOOK,
    CONSTANT,
    IMPORT,
    OTHER
  }
}
