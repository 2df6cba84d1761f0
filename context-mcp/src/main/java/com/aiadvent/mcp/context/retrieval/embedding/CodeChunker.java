package com.aiadvent.mcp.context.retrieval.embedding;

import com.aiadvent.mcp.context.change.ContentHashes;
import com.aiadvent.mcp.context.config.ContextEngineProperties;
import com.aiadvent.mcp.context.retrieval.embedding.CodeChunk.ChunkType;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Splits script sources on declaration boundaries (hooks, components, classes, types,
 * functions, exported constants). Import blocks and fragments shorter than the minimum are
 * dropped, oversized declarations are cut into overlapping windows, and a file without any
 * boundary is chunked by line windows.
 */
@Component
public class CodeChunker {

  private static final List<String> INDEXABLE_EXTENSIONS = List.of(".ts", ".tsx", ".js", ".jsx");
  private static final List<Pattern> SKIP_PATTERNS =
      List.of(
          Pattern.compile("node_modules"),
          Pattern.compile("\\.d\\.ts$"),
          Pattern.compile("vite\\.config"),
          Pattern.compile("eslint\\.config"),
          Pattern.compile("tailwind\\.config"),
          Pattern.compile("postcss\\.config"),
          Pattern.compile("tsconfig"),
          Pattern.compile("package\\.json$"),
          Pattern.compile("package-lock\\.json$"),
          Pattern.compile("\\.test\\."),
          Pattern.compile("\\.spec\\."));

  private static final Pattern FUNCTION_DECL =
      Pattern.compile("^(?:export\\s+)?(?:async\\s+)?function\\s+(\\w+)");
  private static final Pattern ARROW_FUNCTION =
      Pattern.compile(
          "^(?:export\\s+)?const\\s+(\\w+)\\s*=\\s*(?:async\\s+)?\\([^)]*\\)\\s*(?::\\s*[^=]+)?\\s*=>");
  private static final Pattern COMPONENT =
      Pattern.compile("^(?:export\\s+)?(?:const|function)\\s+([A-Z]\\w+)");
  private static final Pattern CLASS_DECL =
      Pattern.compile("^(?:export\\s+)?(?:abstract\\s+)?class\\s+(\\w+)");
  private static final Pattern TYPE_DECL =
      Pattern.compile("^(?:export\\s+)?(?:interface|type)\\s+(\\w+)");
  private static final Pattern HOOK_DECL =
      Pattern.compile("^(?:export\\s+)?(?:const|function)\\s+(use\\w+)");
  private static final Pattern CONST_EXPORT = Pattern.compile("^export\\s+const\\s+(\\w+)\\s*=");
  private static final Pattern IMPORT_START = Pattern.compile("^import\\s+");

  private final int minChunkLines;
  private final int maxChunkLines;
  private final int overlapLines;

  public CodeChunker(ContextEngineProperties properties) {
    ContextEngineProperties.Embedding embedding = properties.getEmbedding();
    this.minChunkLines = Math.max(1, embedding.getMinChunkLines());
    this.maxChunkLines = Math.max(embedding.getOverlapLines() + 1, embedding.getMaxChunkLines());
    this.overlapLines = Math.max(0, embedding.getOverlapLines());
  }

  public static boolean isIndexable(String path) {
    if (path == null || INDEXABLE_EXTENSIONS.stream().noneMatch(path::endsWith)) {
      return false;
    }
    return SKIP_PATTERNS.stream().noneMatch(pattern -> pattern.matcher(path).find());
  }

  public List<CodeChunk> chunk(String path, String content) {
    String text = content != null ? content : "";
    String[] lines = text.split("\n", -1);
    List<Boundary> boundaries = detectBoundaries(lines);
    if (boundaries.isEmpty()) {
      return chunkByLines(path, lines);
    }

    List<CodeChunk> chunks = new ArrayList<>();
    int lastEndLine = 0;
    for (Boundary boundary : boundaries) {
      if (boundary.startLine() > lastEndLine + 1) {
        String gap = join(lines, lastEndLine, boundary.startLine() - 1).trim();
        if (!gap.isEmpty() && lineCount(gap) >= minChunkLines) {
          chunks.add(
              chunk(path, chunks.size(), lastEndLine + 1, boundary.startLine() - 1, gap,
                  ChunkType.OTHER, null));
        }
      }
      String body = join(lines, boundary.startLine() - 1, boundary.endLine());
      int bodyLines = lineCount(body);
      if (boundary.type() == ChunkType.IMPORT || bodyLines < minChunkLines) {
        lastEndLine = boundary.endLine();
        continue;
      }
      if (bodyLines > maxChunkLines) {
        splitLarge(path, body, boundary, chunks);
      } else {
        chunks.add(
            chunk(path, chunks.size(), boundary.startLine(), boundary.endLine(), body,
                boundary.type(), boundary.name()));
      }
      lastEndLine = boundary.endLine();
    }

    if (lastEndLine < lines.length) {
      String remaining = join(lines, lastEndLine, lines.length).trim();
      if (!remaining.isEmpty() && lineCount(remaining) >= minChunkLines) {
        chunks.add(
            chunk(path, chunks.size(), lastEndLine + 1, lines.length, remaining,
                ChunkType.OTHER, null));
      }
    }
    return chunks;
  }

  List<Boundary> detectBoundaries(String[] lines) {
    List<Boundary> boundaries = new ArrayList<>();
    OpenBoundary current = null;
    int braceDepth = 0;
    boolean inImportBlock = false;
    int importStartLine = -1;

    for (int i = 0; i < lines.length; i++) {
      String line = lines[i].trim();
      int lineNumber = i + 1;

      if (line.isEmpty() || line.startsWith("//") || line.startsWith("/*")
          || line.startsWith("*")) {
        if (inImportBlock && line.isEmpty()) {
          boundaries.add(
              new Boundary(ChunkType.IMPORT, "imports", importStartLine, lineNumber - 1));
          inImportBlock = false;
        }
        continue;
      }

      if (IMPORT_START.matcher(line).find()) {
        if (!inImportBlock) {
          inImportBlock = true;
          importStartLine = lineNumber;
        }
        continue;
      } else if (inImportBlock) {
        boundaries.add(new Boundary(ChunkType.IMPORT, "imports", importStartLine, lineNumber - 1));
        inImportBlock = false;
      }

      if (current != null) {
        braceDepth += braceBalance(line);
        if (braceDepth <= 0) {
          boundaries.add(current.close(lineNumber));
          current = null;
          braceDepth = 0;
        }
        continue;
      }

      OpenBoundary detected = detect(line, lineNumber);
      if (detected != null) {
        braceDepth = braceBalance(line);
        if (braceDepth <= 0) {
          boundaries.add(detected.close(lineNumber));
          braceDepth = 0;
        } else {
          current = detected;
        }
      }
    }
    if (current != null) {
      boundaries.add(current.close(lines.length));
    }
    return boundaries;
  }

  private static OpenBoundary detect(String line, int lineNumber) {
    Matcher matcher;
    if ((matcher = HOOK_DECL.matcher(line)).find()) {
      return new OpenBoundary(ChunkType.HOOK, matcher.group(1), lineNumber);
    }
    if ((matcher = COMPONENT.matcher(line)).find()) {
      return new OpenBoundary(ChunkType.COMPONENT, matcher.group(1), lineNumber);
    }
    if ((matcher = CLASS_DECL.matcher(line)).find()) {
      return new OpenBoundary(ChunkType.CLASS, matcher.group(1), lineNumber);
    }
    if ((matcher = TYPE_DECL.matcher(line)).find()) {
      return new OpenBoundary(ChunkType.TYPE, matcher.group(1), lineNumber);
    }
    if ((matcher = FUNCTION_DECL.matcher(line)).find()) {
      return new OpenBoundary(ChunkType.FUNCTION, matcher.group(1), lineNumber);
    }
    if ((matcher = ARROW_FUNCTION.matcher(line)).find()) {
      return new OpenBoundary(ChunkType.FUNCTION, matcher.group(1), lineNumber);
    }
    if ((matcher = CONST_EXPORT.matcher(line)).find()) {
      return new OpenBoundary(ChunkType.CONSTANT, matcher.group(1), lineNumber);
    }
    return null;
  }

  private void splitLarge(String path, String body, Boundary boundary, List<CodeChunk> target) {
    String[] lines = body.split("\n", -1);
    int start = 0;
    int part = 0;
    while (start < lines.length) {
      int end = Math.min(start + maxChunkLines, lines.length);
      String text = join(lines, start, end);
      String symbol = part == 0 ? boundary.name() : boundary.name() + "#" + (part + 1);
      target.add(
          chunk(path, target.size(), boundary.startLine() + start, boundary.startLine() + end - 1,
              text, boundary.type(), symbol));
      part++;
      start = end - overlapLines;
      if (start >= lines.length - overlapLines) {
        break;
      }
    }
  }

  private List<CodeChunk> chunkByLines(String path, String[] lines) {
    List<CodeChunk> chunks = new ArrayList<>();
    int start = 0;
    while (start < lines.length) {
      int end = Math.min(start + maxChunkLines, lines.length);
      String text = join(lines, start, end);
      if (!text.isBlank()) {
        chunks.add(chunk(path, chunks.size(), start + 1, end, text, ChunkType.OTHER, null));
      }
      start = end - overlapLines;
      if (start >= lines.length - overlapLines) {
        break;
      }
    }
    return chunks;
  }

  private static CodeChunk chunk(
      String path,
      int index,
      int startLine,
      int endLine,
      String content,
      ChunkType type,
      String symbolName) {
    return new CodeChunk(
        path, index, startLine, endLine, content, ContentHashes.quickHash(content), type,
        symbolName);
  }

  private static int braceBalance(String line) {
    int balance = 0;
    for (int i = 0; i < line.length(); i++) {
      char c = line.charAt(i);
      if (c == '{') {
        balance++;
      } else if (c == '}') {
        balance--;
      }
    }
    return balance;
  }

  private static String join(String[] lines, int fromInclusive, int toExclusive) {
    StringBuilder builder = new StringBuilder();
    int start = Math.max(0, fromInclusive);
    for (int i = start; i < Math.min(lines.length, toExclusive); i++) {
      if (i > start) {
        builder.append('\n');
      }
      builder.append(lines[i]);
    }
    return builder.toString();
  }

  private static int lineCount(String text) {
    return text.split("\n", -1).length;
  }

  record Boundary(ChunkType type, String name, int startLine, int endLine) {}

  private record OpenBoundary(ChunkType type, String name, int startLine) {

    Boundary close(int endLine) {
      return new Boundary(type, name, startLine, endLine);
    }
  }
}
