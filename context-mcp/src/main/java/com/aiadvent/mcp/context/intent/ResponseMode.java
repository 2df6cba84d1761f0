package com.aiadvent.mcp.context.intent;

import java.util.Locale;

/** How the generator should shape its answer: targeted edits, whole files, or its own choice. */
public enum ResponseMode {
  EDIT,
  FILE,
  HYBRID;

  public String id() {
    return name().toLowerCase(Locale.ROOT);
  }
}
