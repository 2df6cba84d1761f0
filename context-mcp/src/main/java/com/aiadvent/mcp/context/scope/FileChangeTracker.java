package com.aiadvent.mcp.context.scope;

import com.aiadvent.mcp.context.change.ChangeStoreService;
import com.aiadvent.mcp.context.change.FileChangeSet;
import com.aiadvent.mcp.context.retrieval.embedding.CodeChunker;
import com.aiadvent.mcp.context.retrieval.embedding.EmbeddingIndex;
import com.aiadvent.mcp.context.retrieval.embedding.EmbeddingIndexer;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Coalesces file edits of one project and hands them to the change store after a quiet period.
 * A later edit of the same path replaces the pending one and restarts the debounce.
 */
public class FileChangeTracker {

  private static final Logger log = LoggerFactory.getLogger(FileChangeTracker.class);

  private final String projectId;
  private final ChangeStoreService changeStore;
  private final EmbeddingIndexer indexer;
  private final EmbeddingIndex embeddingIndex;
  private final ScheduledExecutorService scheduler;
  private final Duration debounce;
  private final int maxBatchSize;
  private final boolean indexingEnabled;

  private final Map<String, PendingChange> pending = new LinkedHashMap<>();
  private ScheduledFuture<?> scheduled;
  private boolean disposed;

  FileChangeTracker(
      String projectId,
      ChangeStoreService changeStore,
      EmbeddingIndexer indexer,
      EmbeddingIndex embeddingIndex,
      ScheduledExecutorService scheduler,
      Duration debounce,
      int maxBatchSize,
      boolean indexingEnabled) {
    this.projectId = Objects.requireNonNull(projectId, "projectId");
    this.changeStore = Objects.requireNonNull(changeStore, "changeStore");
    this.indexer = indexer;
    this.embeddingIndex = embeddingIndex;
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    this.debounce = debounce;
    this.maxBatchSize = Math.max(1, maxBatchSize);
    this.indexingEnabled = indexingEnabled && indexer != null && embeddingIndex != null;
  }

  public void track(String path, String content, ChangeSource source) {
    trackBatch(Map.of(path, content != null ? content : ""), source);
  }

  public synchronized void trackBatch(Map<String, String> files, ChangeSource source) {
    if (disposed) {
      throw new IllegalStateException("Tracker of project " + projectId + " is disposed");
    }
    if (files == null || files.isEmpty()) {
      return;
    }
    Instant now = Instant.now();
    files.forEach(
        (path, content) -> {
          String normalized = normalizePath(path);
          pending.remove(normalized);
          pending.put(normalized, new PendingChange(content != null ? content : "", source, now));
        });
    reschedule();
  }

  public synchronized int pendingCount() {
    return pending.size();
  }

  /** Processes every pending change on the caller's thread; returns the processed count. */
  public int flush() {
    synchronized (this) {
      cancelScheduled();
    }
    return processPending();
  }

  public synchronized void dispose() {
    cancelScheduled();
    int dropped = pending.size();
    pending.clear();
    disposed = true;
    if (dropped > 0) {
      log.debug("Disposed tracker of project {} with {} pending changes", projectId, dropped);
    }
  }

  int processPending() {
    int processed = 0;
    List<Map.Entry<String, PendingChange>> batch;
    while (!(batch = nextBatch()).isEmpty()) {
      Map<String, String> files = new LinkedHashMap<>();
      batch.forEach(entry -> files.put(entry.getKey(), entry.getValue().content()));
      try {
        FileChangeSet changes = changeStore.sync(projectId, files, false);
        log.debug(
            "Processed {} tracked changes of project {} ({} created, {} modified)",
            files.size(),
            projectId,
            changes.created().size(),
            changes.modified().size());
      } catch (RuntimeException ex) {
        log.warn(
            "Failed to record {} tracked changes of project {}: {}",
            files.size(),
            projectId,
            ex.getMessage());
        continue;
      }
      processed += files.size();
      if (indexingEnabled) {
        files.forEach(
            (path, content) -> {
              if (CodeChunker.isIndexable(path)) {
                indexer.index(embeddingIndex, path, content);
              }
            });
      }
    }
    return processed;
  }

  private synchronized List<Map.Entry<String, PendingChange>> nextBatch() {
    List<Map.Entry<String, PendingChange>> batch = new ArrayList<>();
    Iterator<Map.Entry<String, PendingChange>> iterator = pending.entrySet().iterator();
    while (iterator.hasNext() && batch.size() < maxBatchSize) {
      Map.Entry<String, PendingChange> entry = iterator.next();
      batch.add(Map.entry(entry.getKey(), entry.getValue()));
      iterator.remove();
    }
    return batch;
  }

  private void reschedule() {
    cancelScheduled();
    scheduled =
        scheduler.schedule(this::runScheduled, debounce.toMillis(), TimeUnit.MILLISECONDS);
  }

  private void runScheduled() {
    synchronized (this) {
      scheduled = null;
    }
    try {
      processPending();
    } catch (RuntimeException ex) {
      log.warn("Tracked change processing of project {} failed", projectId, ex);
    }
  }

  private void cancelScheduled() {
    if (scheduled != null) {
      scheduled.cancel(false);
      scheduled = null;
    }
  }

  static String normalizePath(String path) {
    if (path == null || path.isBlank()) {
      throw new IllegalArgumentException("path must not be blank");
    }
    String trimmed = path.trim();
    return trimmed.startsWith("/") ? trimmed : "/" + trimmed;
  }

  record PendingChange(String content, ChangeSource source, Instant timestamp) {}
}
