package com.aiadvent.mcp.context.memory;

import java.util.Locale;

public enum AssetType {
  TWO_D("2d"),
  THREE_D("3d"),
  AUDIO("audio");

  private final String id;

  AssetType(String id) {
    this.id = id;
  }

  public String id() {
    return id;
  }

  public static AssetType fromId(String value) {
    if (value == null) {
      return TWO_D;
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    for (AssetType type : values()) {
      if (type.id.equals(normalized) || type.name().equalsIgnoreCase(normalized)) {
        return type;
      }
    }
    return TWO_D;
  }
}
