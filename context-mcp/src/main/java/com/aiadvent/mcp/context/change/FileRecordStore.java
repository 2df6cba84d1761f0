package com.aiadvent.mcp.context.change;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;

/** Persistence boundary of the change store, scoped by project identifier. */
public interface FileRecordStore {

  Map<String, FileRecord> getFileRecords(String projectId);

  default Optional<FileRecord> getFileRecord(String projectId, String path) {
    return Optional.ofNullable(getFileRecords(projectId).get(path));
  }

  /** Last write wins for concurrent upserts of the same path. */
  void upsertFileRecords(Collection<FileRecord> records);

  void deleteFileRecords(String projectId, Collection<String> paths);

  void deleteProject(String projectId);
}
