package com.aiadvent.mcp.context.memory;

import java.util.List;

public record Asset(
    String projectId,
    String displayName,
    String publicPath,
    AssetType assetType,
    AssetCategory category,
    long fileSize,
    Integer width,
    Integer height,
    boolean spriteSheet,
    Integer frameCount,
    Integer frameWidth,
    Integer frameHeight,
    List<String> animations,
    String description) {

  public Asset {
    assetType = assetType != null ? assetType : AssetType.TWO_D;
    category = category != null ? category : AssetCategory.ITEM;
    animations = animations != null ? List.copyOf(animations) : List.of();
  }

  public boolean is2d() {
    return assetType == AssetType.TWO_D;
  }

  public boolean is3d() {
    return assetType == AssetType.THREE_D;
  }

  public boolean isAudio() {
    return assetType == AssetType.AUDIO;
  }
}
