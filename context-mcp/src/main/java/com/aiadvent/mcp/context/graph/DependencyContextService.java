package com.aiadvent.mcp.context.graph;

import com.aiadvent.mcp.context.change.FileRecord;
import com.aiadvent.mcp.context.change.FileRecordStore;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

@Service
public class DependencyContextService {

  private static final Logger log = LoggerFactory.getLogger(DependencyContextService.class);

  private final FileRecordStore store;

  public DependencyContextService(FileRecordStore store) {
    this.store = store;
  }

  public DependencyGraph graph(String projectId) {
    Map<String, FileRecord> records = store.getFileRecords(projectId);
    return DependencyGraph.build(records.values(), records.keySet());
  }

  /** Reverse import index of the persisted records: file to the files that import it. */
  public Map<String, Set<String>> buildReverseIndex(String projectId) {
    return graph(projectId).reverseIndex();
  }

  /**
   * Looks up imports and importers for each target, one file at a time. A target whose lookup
   * fails gets an empty context and is reported in {@link Result#failedFiles()}.
   */
  public Result fetch(String projectId, Collection<String> targetFiles) {
    Map<String, DependencyContext> contexts = new LinkedHashMap<>();
    if (targetFiles == null || targetFiles.isEmpty()) {
      return new Result(contexts, 0);
    }
    DependencyGraph graph;
    try {
      graph = graph(projectId);
    } catch (RuntimeException ex) {
      log.warn("Failed to load dependency graph for project {}: {}", projectId, ex.getMessage());
      targetFiles.stream()
          .filter(StringUtils::hasText)
          .forEach(file -> contexts.put(file, DependencyContext.empty()));
      return new Result(contexts, contexts.size());
    }

    int failed = 0;
    for (String file : targetFiles) {
      if (!StringUtils.hasText(file) || contexts.containsKey(file)) {
        continue;
      }
      try {
        contexts.put(file, graph.contextOf(file));
      } catch (RuntimeException ex) {
        log.warn("Failed to resolve dependency context for {}: {}", file, ex.getMessage());
        contexts.put(file, DependencyContext.empty());
        failed++;
      }
    }
    if (log.isDebugEnabled()) {
      contexts.forEach(
          (file, ctx) ->
              log.debug(
                  "Dependency context {}: {} imports, {} importers",
                  file,
                  ctx.imports().size(),
                  ctx.importers().size()));
    }
    return new Result(contexts, failed);
  }

  public record Result(Map<String, DependencyContext> contexts, int failedFiles) {

    public Result {
      contexts = contexts != null ? Collections.unmodifiableMap(contexts) : Map.of();
    }

    public boolean degraded() {
      return failedFiles > 0;
    }
  }
}
