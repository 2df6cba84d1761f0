package com.aiadvent.mcp.context.scope;

import com.aiadvent.mcp.context.change.ChangeStoreService;
import com.aiadvent.mcp.context.config.ContextEngineProperties;
import com.aiadvent.mcp.context.retrieval.embedding.EmbeddingIndex;
import com.aiadvent.mcp.context.retrieval.embedding.EmbeddingIndexer;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

@Component
public class ProjectScopeRegistry implements DisposableBean {

  private static final Logger log = LoggerFactory.getLogger(ProjectScopeRegistry.class);

  private final ChangeStoreService changeStore;
  private final EmbeddingIndexer indexer;
  private final ContextEngineProperties properties;
  private final ScheduledExecutorService scheduler;
  private final Map<String, ProjectScope> scopes = new ConcurrentHashMap<>();

  public ProjectScopeRegistry(
      ChangeStoreService changeStore,
      EmbeddingIndexer indexer,
      ContextEngineProperties properties) {
    this.changeStore = changeStore;
    this.indexer = indexer;
    this.properties = properties;
    this.scheduler =
        Executors.newSingleThreadScheduledExecutor(
            runnable -> {
              Thread thread = new Thread(runnable, "context-change-tracker");
              thread.setDaemon(true);
              return thread;
            });
  }

  public ProjectScope open(String projectId) {
    String id = requireProject(projectId);
    return scopes.computeIfAbsent(id, this::createScope);
  }

  public Optional<ProjectScope> find(String projectId) {
    if (!StringUtils.hasText(projectId)) {
      return Optional.empty();
    }
    return Optional.ofNullable(scopes.get(projectId.trim()));
  }

  /** Flushes pending changes and releases the scope; returns {@code false} if none was open. */
  public boolean close(String projectId) {
    ProjectScope scope = scopes.remove(requireProject(projectId));
    if (scope == null) {
      return false;
    }
    release(scope);
    return true;
  }

  public void closeAll() {
    List<String> ids = List.copyOf(scopes.keySet());
    ids.forEach(this::close);
  }

  public int openCount() {
    return scopes.size();
  }

  @Override
  public void destroy() {
    closeAll();
    scheduler.shutdownNow();
  }

  private ProjectScope createScope(String projectId) {
    ContextEngineProperties.Tracking tracking = properties.getTracking();
    EmbeddingIndex index = new EmbeddingIndex();
    FileChangeTracker tracker =
        new FileChangeTracker(
            projectId,
            changeStore,
            indexer,
            index,
            scheduler,
            tracking.getDebounce(),
            tracking.getMaxBatchSize(),
            properties.getEmbedding().isEnabled());
    log.info("Opened project scope {}", projectId);
    return new ProjectScope(projectId, tracker, index);
  }

  private void release(ProjectScope scope) {
    try {
      int flushed = scope.tracker().flush();
      log.info("Closed project scope {} ({} pending changes flushed)", scope.projectId(), flushed);
    } catch (RuntimeException ex) {
      log.warn("Failed to flush project scope {}: {}", scope.projectId(), ex.getMessage());
    } finally {
      scope.tracker().dispose();
      scope.index().clear();
    }
  }

  private static String requireProject(String projectId) {
    if (!StringUtils.hasText(projectId)) {
      throw new IllegalArgumentException("projectId must not be blank");
    }
    return projectId.trim();
  }
}
