package com.aiadvent.mcp.context.memory;

import java.util.Locale;

public enum AssetCategory {
  CHARACTER,
  BACKGROUND,
  UI,
  ITEM,
  TILE,
  EFFECT,
  MODEL,
  TEXTURE,
  SKYBOX,
  AUDIO;

  public String id() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static AssetCategory fromId(String value) {
    if (value == null || value.isBlank()) {
      return ITEM;
    }
    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      return ITEM;
    }
  }
}
