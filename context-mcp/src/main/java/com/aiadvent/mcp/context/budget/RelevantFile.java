package com.aiadvent.mcp.context.budget;

/** A file chosen for the context, either full text or an outline of it. */
public record RelevantFile(
    String path, String content, boolean outline, double relevanceScore, String relevanceReason) {

  public RelevantFile {
    content = content != null ? content : "";
    relevanceReason = relevanceReason != null ? relevanceReason : "";
  }
}
