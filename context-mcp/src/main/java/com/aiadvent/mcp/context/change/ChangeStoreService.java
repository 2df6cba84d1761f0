package com.aiadvent.mcp.context.change;

import com.aiadvent.mcp.context.analysis.SourceStructure;
import com.aiadvent.mcp.context.analysis.SourceStructureExtractor;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Tracks per-file content hashes between requests. A missing record is reported as created, a
 * hash change increments the modification counter, and records are only removed by an explicit
 * deletion sync or a project reset.
 */
@Service
public class ChangeStoreService {

  private static final Logger log = LoggerFactory.getLogger(ChangeStoreService.class);

  private final FileRecordStore store;
  private final SourceStructureExtractor extractor;

  public ChangeStoreService(FileRecordStore store, SourceStructureExtractor extractor) {
    this.store = Objects.requireNonNull(store, "store");
    this.extractor = Objects.requireNonNull(extractor, "extractor");
  }

  public ChangeKind recordObservation(String projectId, String path, String content) {
    requireProject(projectId);
    if (!StringUtils.hasText(path)) {
      throw new IllegalArgumentException("path must not be blank");
    }
    String hash = ContentHashes.sha256(content);
    Optional<FileRecord> existing = store.getFileRecord(projectId, path);
    if (existing.isPresent() && hash.equals(existing.get().contentHash())) {
      return ChangeKind.UNCHANGED;
    }
    int count = existing.map(record -> record.modificationCount() + 1).orElse(1);
    store.upsertFileRecords(List.of(buildRecord(projectId, path, content, hash, count)));
    return existing.isPresent() ? ChangeKind.MODIFIED : ChangeKind.CREATED;
  }

  public FileChangeSet diff(String projectId, Map<String, String> currentFiles) {
    return diff(projectId, currentFiles, false);
  }

  /** Read-only comparison of the current file map against the persisted hashes. */
  public FileChangeSet diff(
      String projectId, Map<String, String> currentFiles, boolean deletionSync) {
    requireProject(projectId);
    Map<String, FileRecord> previous = new HashMap<>(store.getFileRecords(projectId));
    return compare(projectId, previous, safeFiles(currentFiles), deletionSync, null);
  }

  /**
   * Records every file of the map and, when {@code deletionSync} is set, drops records whose
   * path is no longer present.
   */
  public FileChangeSet sync(
      String projectId, Map<String, String> currentFiles, boolean deletionSync) {
    requireProject(projectId);
    Map<String, FileRecord> previous = new HashMap<>(store.getFileRecords(projectId));
    List<FileRecord> updates = new ArrayList<>();
    Map<String, String> files = safeFiles(currentFiles);
    FileChangeSet result = compare(projectId, previous, files, deletionSync, updates);

    if (!updates.isEmpty()) {
      store.upsertFileRecords(updates);
    }
    if (deletionSync && !result.deleted().isEmpty()) {
      store.deleteFileRecords(projectId, result.deleted());
    }
    log.debug(
        "Synced project {}: {} created, {} modified, {} deleted, {} unchanged",
        projectId,
        result.created().size(),
        result.modified().size(),
        result.deleted().size(),
        result.unchanged().size());
    return result;
  }

  public Map<String, FileRecord> records(String projectId) {
    requireProject(projectId);
    return store.getFileRecords(projectId);
  }

  public List<String> filesByModificationCount(String projectId) {
    return records(projectId).values().stream()
        .sorted(
            Comparator.comparingInt(FileRecord::modificationCount)
                .reversed()
                .thenComparing(FileRecord::path))
        .map(FileRecord::path)
        .toList();
  }

  public void reset(String projectId) {
    requireProject(projectId);
    store.deleteProject(projectId);
    log.info("Cleared change records of project {}", projectId);
  }

  private FileChangeSet compare(
      String projectId,
      Map<String, FileRecord> previous,
      Map<String, String> files,
      boolean deletionSync,
      List<FileRecord> updates) {
    List<String> created = new ArrayList<>();
    List<String> modified = new ArrayList<>();
    List<String> unchanged = new ArrayList<>();

    for (Map.Entry<String, String> entry : files.entrySet()) {
      String path = entry.getKey();
      String hash = ContentHashes.sha256(entry.getValue());
      FileRecord existing = previous.remove(path);
      if (existing == null) {
        created.add(path);
        if (updates != null) {
          updates.add(buildRecord(projectId, path, entry.getValue(), hash, 1));
        }
      } else if (!hash.equals(existing.contentHash())) {
        modified.add(path);
        if (updates != null) {
          updates.add(
              buildRecord(
                  projectId,
                  path,
                  entry.getValue(),
                  hash,
                  existing.modificationCount() + 1));
        }
      } else {
        unchanged.add(path);
      }
    }

    List<String> deleted =
        deletionSync ? previous.keySet().stream().sorted().toList() : List.of();
    return new FileChangeSet(created, modified, deleted, unchanged);
  }

  private FileRecord buildRecord(
      String projectId, String path, String content, String hash, int modificationCount) {
    String text = content != null ? content : "";
    SourceStructure structure = extractor.extract(path, text);
    return new FileRecord(
        projectId,
        path,
        hash,
        text.getBytes(StandardCharsets.UTF_8).length,
        Instant.now(),
        structure.fileType(),
        new LinkedHashSet<>(structure.exports()),
        structure.imports(),
        modificationCount);
  }

  private static Map<String, String> safeFiles(Map<String, String> files) {
    if (files == null) {
      throw new IllegalArgumentException("file map must not be null");
    }
    return files;
  }

  private static void requireProject(String projectId) {
    if (!StringUtils.hasText(projectId)) {
      throw new IllegalArgumentException("projectId must not be blank");
    }
  }
}
