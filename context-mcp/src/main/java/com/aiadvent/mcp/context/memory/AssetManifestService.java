package com.aiadvent.mcp.context.memory;

import com.aiadvent.mcp.context.memory.persistence.ProjectAssetEntity;
import com.aiadvent.mcp.context.memory.persistence.ProjectAssetRepository;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

/** Builds the manifest of uploaded project assets and renders it for prompts. */
@Service
public class AssetManifestService {

  private final ProjectAssetRepository repository;

  public AssetManifestService(ProjectAssetRepository repository) {
    this.repository = repository;
  }

  @Transactional(readOnly = true)
  public AssetManifest getManifest(String projectId) {
    List<Asset> assets =
        repository.findByProjectIdOrderByCreatedAtAsc(projectId).stream()
            .map(this::toAsset)
            .toList();
    return AssetManifest.of(projectId, assets);
  }

  public String formatForPrompt(AssetManifest manifest) {
    if (manifest == null || manifest.isEmpty()) {
      return "";
    }
    List<String> lines = new ArrayList<>();
    lines.add("## AVAILABLE GAME ASSETS");
    lines.add("");
    lines.add(
        "Total: "
            + manifest.totalCount()
            + " assets ("
            + formatFileSize(manifest.totalSize())
            + ")");
    lines.add("");

    section(lines, "Characters", manifest.category(AssetCategory.CHARACTER));
    section(lines, "Backgrounds", manifest.category(AssetCategory.BACKGROUND));
    section(lines, "Items", manifest.category(AssetCategory.ITEM));
    section(lines, "Tiles", manifest.category(AssetCategory.TILE));
    section(lines, "UI Elements", manifest.category(AssetCategory.UI));
    section(lines, "Effects", manifest.category(AssetCategory.EFFECT));
    section(lines, "3D Models", manifest.models3d());
    section(lines, "Textures", manifest.category(AssetCategory.TEXTURE));
    section(lines, "Skyboxes", manifest.category(AssetCategory.SKYBOX));
    section(lines, "Audio", manifest.category(AssetCategory.AUDIO));

    lines.add("### HOW TO USE ASSETS");
    lines.add("");
    lines.add("**React/JSX:**");
    lines.add("```jsx");
    lines.add("<img src=\"/assets/characters/player.png\" alt=\"Player\" />");
    lines.add("```");
    lines.add("");
    lines.add("**Canvas 2D:**");
    lines.add("```javascript");
    lines.add("const img = new Image();");
    lines.add("img.src = '/assets/characters/player.png';");
    lines.add("img.onload = () => ctx.drawImage(img, x, y);");
    lines.add("```");
    lines.add("");
    if (!manifest.spriteSheets().isEmpty()) {
      lines.add("**Phaser 3 (Sprite Sheet):**");
      lines.add("```javascript");
      lines.add("// In preload():");
      lines.add("this.load.spritesheet('player', '/assets/characters/player.png', {");
      lines.add("  frameWidth: 32,");
      lines.add("  frameHeight: 48");
      lines.add("});");
      lines.add("```");
      lines.add("");
    }
    if (!manifest.models3d().isEmpty()) {
      lines.add("**Three.js / React Three Fiber:**");
      lines.add("```jsx");
      lines.add("import { useGLTF } from '@react-three/drei';");
      lines.add("");
      lines.add("function Model() {");
      lines.add("  const { scene } = useGLTF('/assets/models/character.glb');");
      lines.add("  return <primitive object={scene} />;");
      lines.add("}");
      lines.add("```");
      lines.add("");
    }
    lines.add("**IMPORTANT:**");
    lines.add("1. Always use the exact paths shown above");
    lines.add("2. Preload assets before using them");
    lines.add("3. For sprite sheets, use the provided frame dimensions");
    return String.join("\n", lines);
  }

  public String formatCompact(AssetManifest manifest) {
    if (manifest == null || manifest.isEmpty()) {
      return "";
    }
    List<String> lines = new ArrayList<>();
    lines.add("ASSETS:");
    for (Asset asset : manifest.assets()) {
      StringBuilder line = new StringBuilder(asset.publicPath());
      if (asset.is2d() && hasSize(asset)) {
        line.append(" (").append(asset.width()).append('×').append(asset.height()).append(')');
      }
      if (asset.spriteSheet() && positive(asset.frameCount())) {
        line.append(" [sprite:")
            .append(asset.frameCount())
            .append("f@")
            .append(asset.frameWidth())
            .append('×')
            .append(asset.frameHeight())
            .append(']');
      }
      if (asset.is3d() && !asset.animations().isEmpty()) {
        line.append(" [anims:").append(String.join(",", asset.animations())).append(']');
      }
      lines.add(line.toString());
    }
    return String.join("\n", lines);
  }

  public String codeSnippet(Asset asset, Engine engine) {
    String key = sanitizeVarName(asset.displayName());
    return switch (engine) {
      case REACT -> {
        if (asset.is2d()) {
          yield "<img src=\"" + asset.publicPath() + "\" alt=\"" + asset.displayName() + "\" />";
        }
        if (asset.is3d()) {
          yield String.join(
              "\n",
              "import { useGLTF } from '@react-three/drei';",
              "const { scene } = useGLTF('" + asset.publicPath() + "');",
              "<primitive object={scene} />");
        }
        yield "<audio src=\"" + asset.publicPath() + "\" />";
      }
      case CANVAS ->
          asset.is2d()
              ? String.join(
                  "\n",
                  "const " + key + " = new Image();",
                  key + ".src = '" + asset.publicPath() + "';")
              : "";
      case PHASER -> {
        if (asset.is2d()) {
          if (asset.spriteSheet()
              && positive(asset.frameWidth())
              && positive(asset.frameHeight())) {
            yield String.join(
                "\n",
                "// In preload():",
                "this.load.spritesheet('" + key + "', '" + asset.publicPath() + "', {",
                "  frameWidth: " + asset.frameWidth() + ",",
                "  frameHeight: " + asset.frameHeight(),
                "});");
          }
          yield "this.load.image('" + key + "', '" + asset.publicPath() + "');";
        }
        if (asset.isAudio()) {
          yield "this.load.audio('" + key + "', '" + asset.publicPath() + "');";
        }
        yield "";
      }
      case THREEJS -> {
        if (asset.is3d()) {
          yield String.join(
              "\n",
              "import { GLTFLoader } from 'three/examples/jsm/loaders/GLTFLoader';",
              "const loader = new GLTFLoader();",
              "loader.load('" + asset.publicPath() + "', (gltf) => {",
              "  scene.add(gltf.scene);",
              "});");
        }
        if (asset.is2d()) {
          yield String.join(
              "\n",
              "import { TextureLoader } from 'three';",
              "const texture = new TextureLoader().load('" + asset.publicPath() + "');");
        }
        yield "";
      }
    };
  }

  static String formatFileSize(long bytes) {
    if (bytes < 1024) {
      return bytes + "B";
    }
    if (bytes < 1024 * 1024) {
      return String.format(Locale.ROOT, "%.1fKB", bytes / 1024.0);
    }
    return String.format(Locale.ROOT, "%.1fMB", bytes / (1024.0 * 1024.0));
  }

  static String sanitizeVarName(String name) {
    String safe = (name != null ? name : "").replaceAll("[^a-zA-Z0-9]", "_");
    if (!safe.isEmpty() && Character.isDigit(safe.charAt(0))) {
      safe = "_" + safe;
    }
    return safe.toLowerCase(Locale.ROOT);
  }

  private static void section(List<String> lines, String title, List<Asset> assets) {
    if (assets.isEmpty()) {
      return;
    }
    lines.add("### " + title);
    assets.forEach(asset -> lines.add(formatAssetLine(asset)));
    lines.add("");
  }

  private static String formatAssetLine(Asset asset) {
    List<String> parts = new ArrayList<>();
    parts.add("- **" + asset.displayName() + "**: `" + asset.publicPath() + "`");
    if (asset.is2d() && hasSize(asset)) {
      parts.add("(" + asset.width() + "×" + asset.height() + ")");
    }
    if (asset.spriteSheet() && positive(asset.frameCount())) {
      parts.add(
          "["
              + asset.frameCount()
              + " frames, "
              + asset.frameWidth()
              + "×"
              + asset.frameHeight()
              + "]");
    }
    if (asset.is3d() && !asset.animations().isEmpty()) {
      parts.add("[Animations: " + String.join(", ", asset.animations()) + "]");
    }
    if (StringUtils.hasText(asset.description())) {
      parts.add("- " + asset.description());
    }
    return String.join(" ", parts);
  }

  private static boolean hasSize(Asset asset) {
    return positive(asset.width()) && positive(asset.height());
  }

  private static boolean positive(Integer value) {
    return value != null && value > 0;
  }

  private Asset toAsset(ProjectAssetEntity entity) {
    return new Asset(
        entity.getProjectId(),
        entity.getDisplayName(),
        entity.getPublicPath(),
        AssetType.fromId(entity.getAssetType()),
        AssetCategory.fromId(entity.getCategory()),
        entity.getFileSize(),
        entity.getWidth(),
        entity.getHeight(),
        entity.isSpriteSheet(),
        entity.getFrameCount(),
        entity.getFrameWidth(),
        entity.getFrameHeight(),
        entity.getAnimations(),
        entity.getDescription());
  }

  public enum Engine {
    REACT,
    CANVAS,
    PHASER,
    THREEJS
  }
}
