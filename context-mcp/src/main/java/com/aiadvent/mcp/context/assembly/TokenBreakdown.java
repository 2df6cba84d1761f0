package com.aiadvent.mcp.context.assembly;

public record TokenBreakdown(
    int files,
    int memory,
    int summaries,
    int messages,
    int taskContext,
    int plan,
    int assets,
    int overhead) {

  public static TokenBreakdown filesOnly(int files) {
    return new TokenBreakdown(files, 0, 0, 0, 0, 0, 0, 0);
  }

  public int total() {
    return files + memory + summaries + messages + taskContext + plan + assets + overhead;
  }
}
