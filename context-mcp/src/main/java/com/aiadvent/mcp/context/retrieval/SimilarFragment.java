package com.aiadvent.mcp.context.retrieval;

public record SimilarFragment(String path, double similarity, String fragment, String symbolName) {

  public SimilarFragment withSimilarity(double value) {
    return new SimilarFragment(path, value, fragment, symbolName);
  }
}
