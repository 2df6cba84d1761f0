package com.aiadvent.mcp.context.scoring;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Relevance of one file with the human readable reasons that produced it. {@code semanticScore}
 * and {@code keywordScore} are only set once hybrid retrieval has combined the signals.
 */
public record FileScore(
    String path, double score, List<String> reasons, Double semanticScore, Double keywordScore) {

  public static final Comparator<FileScore> BY_SCORE_DESC =
      Comparator.comparingDouble(FileScore::score).reversed();

  public FileScore {
    reasons = reasons != null ? List.copyOf(reasons) : List.of();
  }

  public FileScore(String path, double score, List<String> reasons) {
    this(path, score, reasons, null, null);
  }

  public FileScore boosted(double delta, String reason) {
    List<String> updated = new ArrayList<>(reasons);
    updated.add(reason);
    return new FileScore(path, score + delta, updated, semanticScore, keywordScore);
  }

  public boolean hasReason(String reason) {
    return reasons.contains(reason);
  }

  public String summary(int maxReasons) {
    return String.join(", ", reasons.subList(0, Math.min(maxReasons, reasons.size())));
  }
}
