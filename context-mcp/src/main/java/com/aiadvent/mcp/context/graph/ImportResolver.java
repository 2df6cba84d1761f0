package com.aiadvent.mcp.context.graph;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.regex.Pattern;
import org.springframework.util.StringUtils;

/**
 * Maps an import specifier of one project file onto another project file. Resolution is pure:
 * the same inputs always give the same path, and external packages resolve to {@code null}.
 */
public final class ImportResolver {

  private static final List<String> CANDIDATE_SUFFIXES =
      List.of(".ts", ".tsx", ".js", ".jsx", "/index.ts", "/index.tsx", "/index.js", "/index.jsx");
  private static final List<String> FUZZY_EXTENSIONS = List.of(".ts", ".tsx", ".js", ".jsx");
  private static final Pattern HAS_EXTENSION = Pattern.compile(".*\\.[A-Za-z0-9]+$");

  private ImportResolver() {}

  public static String resolve(String fromFile, String specifier, Collection<String> knownFiles) {
    if (!StringUtils.hasText(specifier)) {
      return null;
    }
    String candidate;
    if (specifier.startsWith("@/")) {
      candidate = "/src" + specifier.substring(1);
    } else if (specifier.startsWith(".")) {
      candidate = walk(directoryOf(fromFile), specifier);
    } else {
      return null;
    }

    String lastSegment = candidate.substring(candidate.lastIndexOf('/') + 1);
    if (HAS_EXTENSION.matcher(lastSegment).matches()) {
      return candidate;
    }
    if (knownFiles == null || knownFiles.isEmpty()) {
      return null;
    }
    for (String suffix : CANDIDATE_SUFFIXES) {
      String path = candidate + suffix;
      if (knownFiles.contains(path)) {
        return path;
      }
    }
    return fuzzyMatch(lastSegment, knownFiles);
  }

  static String directoryOf(String path) {
    if (path == null) {
      return "";
    }
    int slash = path.lastIndexOf('/');
    return slash > 0 ? path.substring(0, slash) : "";
  }

  static String walk(String directory, String relative) {
    Deque<String> parts = new ArrayDeque<>();
    for (String part : directory.split("/")) {
      if (!part.isEmpty()) {
        parts.addLast(part);
      }
    }
    for (String part : relative.split("/")) {
      if ("..".equals(part)) {
        parts.pollLast();
      } else if (!".".equals(part) && !part.isEmpty()) {
        parts.addLast(part);
      }
    }
    return "/" + String.join("/", parts);
  }

  private static String fuzzyMatch(String baseName, Collection<String> knownFiles) {
    if (!StringUtils.hasText(baseName)) {
      return null;
    }
    return knownFiles.stream()
        .filter(
            file ->
                FUZZY_EXTENSIONS.stream().anyMatch(ext -> file.endsWith("/" + baseName + ext)))
        .sorted()
        .findFirst()
        .orElse(null);
  }
}
