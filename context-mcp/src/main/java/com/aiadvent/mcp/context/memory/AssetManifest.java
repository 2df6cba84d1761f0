package com.aiadvent.mcp.context.memory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

public record AssetManifest(
    String projectId,
    List<Asset> assets,
    Map<AssetCategory, List<Asset>> categories,
    List<Asset> spriteSheets,
    List<Asset> models3d,
    int totalCount,
    long totalSize) {

  public AssetManifest {
    assets = assets != null ? List.copyOf(assets) : List.of();
    Map<AssetCategory, List<Asset>> copy = new EnumMap<>(AssetCategory.class);
    if (categories != null) {
      categories.forEach((key, value) -> copy.put(key, List.copyOf(value)));
    }
    categories = Collections.unmodifiableMap(copy);
    spriteSheets = spriteSheets != null ? List.copyOf(spriteSheets) : List.of();
    models3d = models3d != null ? List.copyOf(models3d) : List.of();
  }

  public static AssetManifest of(String projectId, List<Asset> assets) {
    Map<AssetCategory, List<Asset>> categories = new EnumMap<>(AssetCategory.class);
    for (AssetCategory category : AssetCategory.values()) {
      categories.put(
          category, assets.stream().filter(asset -> asset.category() == category).toList());
    }
    return new AssetManifest(
        projectId,
        assets,
        categories,
        assets.stream().filter(Asset::spriteSheet).toList(),
        assets.stream().filter(Asset::is3d).toList(),
        assets.size(),
        assets.stream().mapToLong(Asset::fileSize).sum());
  }

  public List<Asset> category(AssetCategory category) {
    return categories.getOrDefault(category, List.of());
  }

  public boolean isEmpty() {
    return totalCount == 0;
  }
}
