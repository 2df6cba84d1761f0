package com.aiadvent.mcp.context.memory;

public record TaskSubstep(String step, boolean done) {

  public TaskSubstep markDone() {
    return new TaskSubstep(step, true);
  }
}
