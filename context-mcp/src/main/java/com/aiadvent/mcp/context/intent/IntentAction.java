package com.aiadvent.mcp.context.intent;

import java.util.Locale;

public enum IntentAction {
  CREATE,
  ADD,
  MODIFY,
  DEBUG,
  EXPLAIN,
  STYLE,
  RENAME,
  REMOVE,
  TWEAK;

  public String id() {
    return name().toLowerCase(Locale.ROOT);
  }
}
