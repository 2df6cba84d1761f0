package com.aiadvent.mcp.context.outline;

import com.aiadvent.mcp.context.analysis.FileType;
import java.util.List;

public record FileOutline(
    String path,
    int lineCount,
    FileType type,
    List<String> exports,
    String text,
    int estimatedTokens) {

  public FileOutline {
    exports = exports != null ? List.copyOf(exports) : List.of();
    text = text != null ? text : "";
  }
}
