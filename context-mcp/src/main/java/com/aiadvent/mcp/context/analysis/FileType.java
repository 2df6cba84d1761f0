package com.aiadvent.mcp.context.analysis;

import java.util.Locale;

public enum FileType {
  PAGE,
  COMPONENT,
  HOOK,
  UTIL,
  STORE,
  TYPE,
  STYLE,
  CONFIG,
  UNKNOWN;

  public String id() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static FileType fromId(String value) {
    if (value == null || value.isBlank()) {
      return UNKNOWN;
    }
    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      return UNKNOWN;
    }
  }
}
