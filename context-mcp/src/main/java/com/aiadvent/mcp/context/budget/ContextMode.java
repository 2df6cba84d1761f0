package com.aiadvent.mcp.context.budget;

public enum ContextMode {
  MINIMAL("minimal"),
  OUTLINE("outline"),
  FULL("full");

  private final String id;

  ContextMode(String id) {
    this.id = id;
  }

  public String id() {
    return id;
  }
}
