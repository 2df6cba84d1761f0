package com.aiadvent.mcp.context.change;

import com.aiadvent.mcp.context.analysis.FileType;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public record FileRecord(
    String projectId,
    String path,
    String contentHash,
    long byteSize,
    Instant lastModifiedAt,
    FileType fileType,
    Set<String> exports,
    List<String> imports,
    int modificationCount) {

  public FileRecord {
    fileType = fileType != null ? fileType : FileType.UNKNOWN;
    exports =
        exports != null
            ? Collections.unmodifiableSet(new LinkedHashSet<>(exports))
            : Set.of();
    imports = imports != null ? List.copyOf(imports) : List.of();
    modificationCount = Math.max(1, modificationCount);
  }
}
