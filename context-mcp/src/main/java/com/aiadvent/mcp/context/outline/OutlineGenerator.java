package com.aiadvent.mcp.context.outline;

import com.aiadvent.mcp.context.analysis.FileType;
import com.aiadvent.mcp.context.analysis.PatternSourceStructureExtractor;
import com.aiadvent.mcp.context.analysis.SourceStructure;
import com.aiadvent.mcp.context.analysis.SourceStructure.ComponentHints;
import com.aiadvent.mcp.context.analysis.SourceStructure.FunctionSignature;
import com.aiadvent.mcp.context.analysis.SourceStructure.ImportBinding;
import com.aiadvent.mcp.context.analysis.SourceStructureExtractor;
import com.aiadvent.mcp.context.budget.TokenEstimator;
import com.aiadvent.mcp.context.config.ContextEngineProperties;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Renders a compact comment-only summary of a source file: exports, key imports, component
 * props, state and hooks, and the main functions.
 */
@Component
public class OutlineGenerator {

  private static final List<FileType> MAP_ORDER =
      List.of(
          FileType.PAGE,
          FileType.COMPONENT,
          FileType.HOOK,
          FileType.UTIL,
          FileType.STORE,
          FileType.TYPE,
          FileType.STYLE,
          FileType.CONFIG);

  private final SourceStructureExtractor extractor;
  private final ContextEngineProperties.Outline properties;
  private final TokenEstimator tokenEstimator;

  public OutlineGenerator(
      SourceStructureExtractor extractor,
      ContextEngineProperties properties,
      TokenEstimator tokenEstimator) {
    this.extractor = extractor;
    this.properties = properties.getOutline();
    this.tokenEstimator = tokenEstimator;
  }

  public boolean shouldOutline(String path, String content) {
    String fileName = baseName(path);
    if (properties.getAlwaysFull().contains(fileName)) {
      return false;
    }
    return PatternSourceStructureExtractor.lineCount(content) > properties.getThresholdLines();
  }

  public FileOutline outline(String path, String content) {
    String text = content != null ? content : "";
    SourceStructure structure = extractor.extract(path, text);
    FileType type = displayType(structure.fileType());

    List<String> lines = new ArrayList<>();
    lines.add("// " + path + " (" + structure.lineCount() + " lines, " + type.id() + ")");
    if (!structure.exports().isEmpty()) {
      lines.add("// Exports: " + String.join(", ", structure.exports()));
    }

    List<ImportBinding> keyImports =
        structure.importBindings().stream()
            .filter(binding -> !properties.getSkippedImports().contains(binding.from()))
            .toList();
    if (!keyImports.isEmpty()) {
      String summary =
          keyImports.stream()
              .limit(properties.getMaxImports())
              .map(
                  binding ->
                      binding.names().stream()
                              .limit(properties.getMaxImportNames())
                              .collect(Collectors.joining(", "))
                          + " from '"
                          + binding.from()
                          + "'")
              .collect(Collectors.joining("; "));
      lines.add("// Imports: " + summary);
    }

    ComponentHints component = structure.component();
    if (component != null) {
      if (!component.props().isEmpty()) {
        lines.add("// Props: { " + String.join(", ", component.props()) + " }");
      }
      if (!component.stateVariables().isEmpty()) {
        lines.add("// State: " + String.join(", ", component.stateVariables()));
      }
      if (!component.hooks().isEmpty()) {
        lines.add("// Hooks: " + String.join(", ", component.hooks()));
      }
    }

    List<String> functions =
        structure.functions().stream()
            .filter(fn -> fn.exported() || !fn.name().startsWith("handle"))
            .limit(properties.getMaxFunctions())
            .map(FunctionSignature::name)
            .map(name -> name + "()")
            .toList();
    if (!functions.isEmpty()) {
      lines.add("// Functions: " + String.join(", ", functions));
    }

    String outline = String.join("\n", lines);
    return new FileOutline(
        path,
        structure.lineCount(),
        type,
        structure.exports(),
        outline,
        tokenEstimator.estimate(outline));
  }

  public ContentOrOutline contentOrOutline(String path, String content) {
    String text = content != null ? content : "";
    if (shouldOutline(path, text)) {
      FileOutline outline = outline(path, text);
      return new ContentOrOutline(outline.text(), true, outline.estimatedTokens());
    }
    return new ContentOrOutline(text, false, tokenEstimator.estimate(text));
  }

  /** Outlines of every file grouped under a heading per file type. */
  public String repositoryMap(Map<String, String> files) {
    Map<FileType, List<FileOutline>> byType = new EnumMap<>(FileType.class);
    if (files != null) {
      files.forEach(
          (path, content) -> {
            FileOutline outline = outline(path, content);
            byType.computeIfAbsent(outline.type(), key -> new ArrayList<>()).add(outline);
          });
    }
    List<String> parts = new ArrayList<>();
    parts.add("# Repository Map\n");
    for (FileType type : MAP_ORDER) {
      List<FileOutline> outlines = byType.get(type);
      if (outlines == null || outlines.isEmpty()) {
        continue;
      }
      parts.add("\n## " + heading(type));
      outlines.forEach(outline -> parts.add(outline.text()));
    }
    return String.join("\n", parts);
  }

  private static FileType displayType(FileType type) {
    return type == FileType.UNKNOWN ? FileType.UTIL : type;
  }

  private static String heading(FileType type) {
    String id = type.id();
    return id.substring(0, 1).toUpperCase(Locale.ROOT) + id.substring(1) + "s";
  }

  static String baseName(String path) {
    if (path == null) {
      return "";
    }
    int slash = path.lastIndexOf('/');
    return slash >= 0 ? path.substring(slash + 1) : path;
  }

  public record ContentOrOutline(String content, boolean outline, int tokens) {}
}
