package com.aiadvent.mcp.context.scope;

import com.aiadvent.mcp.context.retrieval.embedding.EmbeddingIndex;

/** Per-project holder of the change tracker and the in-memory embedding index. */
public record ProjectScope(String projectId, FileChangeTracker tracker, EmbeddingIndex index) {}
