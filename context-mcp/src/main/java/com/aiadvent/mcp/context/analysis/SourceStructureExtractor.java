package com.aiadvent.mcp.context.analysis;

/**
 * Extracts the structural facts the engine relies on (file type, exports, imports, component
 * hints) from raw file content. Implementations are best effort: unusual code styles such as
 * re-exports or computed imports may be missed.
 */
public interface SourceStructureExtractor {

  SourceStructure extract(String path, String content);

  default FileType classify(String path, String content) {
    return extract(path, content).fileType();
  }
}
