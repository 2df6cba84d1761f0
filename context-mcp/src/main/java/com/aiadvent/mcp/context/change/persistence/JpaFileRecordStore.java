package com.aiadvent.mcp.context.change.persistence;

import com.aiadvent.mcp.context.analysis.FileType;
import com.aiadvent.mcp.context.change.FileRecord;
import com.aiadvent.mcp.context.change.FileRecordStore;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Component
public class JpaFileRecordStore implements FileRecordStore {

  private final ProjectFileStateRepository repository;

  public JpaFileRecordStore(ProjectFileStateRepository repository) {
    this.repository = repository;
  }

  @Override
  @Transactional(readOnly = true)
  public Map<String, FileRecord> getFileRecords(String projectId) {
    Map<String, FileRecord> records = new LinkedHashMap<>();
    for (ProjectFileStateEntity entity : repository.findByProjectId(projectId)) {
      records.put(entity.getFilePath(), toRecord(entity));
    }
    return records;
  }

  @Override
  @Transactional(readOnly = true)
  public Optional<FileRecord> getFileRecord(String projectId, String path) {
    return repository.findByProjectIdAndFilePath(projectId, path).map(this::toRecord);
  }

  @Override
  @Transactional
  public void upsertFileRecords(Collection<FileRecord> records) {
    if (records == null || records.isEmpty()) {
      return;
    }
    Map<String, List<FileRecord>> byProject =
        records.stream().collect(Collectors.groupingBy(FileRecord::projectId));
    List<ProjectFileStateEntity> toSave = new ArrayList<>();
    byProject.forEach(
        (projectId, projectRecords) -> {
          Map<String, ProjectFileStateEntity> existing =
              repository.findByProjectId(projectId).stream()
                  .collect(
                      Collectors.toMap(
                          ProjectFileStateEntity::getFilePath,
                          Function.identity(),
                          (left, right) -> left));
          for (FileRecord record : projectRecords) {
            ProjectFileStateEntity entity =
                existing.computeIfAbsent(record.path(), path -> new ProjectFileStateEntity());
            apply(entity, record);
            toSave.add(entity);
          }
        });
    repository.saveAll(toSave);
  }

  @Override
  public void deleteFileRecords(String projectId, Collection<String> paths) {
    if (paths == null || paths.isEmpty()) {
      return;
    }
    repository.deleteByProjectIdAndFilePathIn(projectId, paths);
  }

  @Override
  public void deleteProject(String projectId) {
    repository.deleteByProjectId(projectId);
  }

  private void apply(ProjectFileStateEntity entity, FileRecord record) {
    entity.setProjectId(record.projectId());
    entity.setFilePath(record.path());
    entity.setContentHash(record.contentHash());
    entity.setByteSize(record.byteSize());
    entity.setFileType(record.fileType().id());
    entity.setExports(new ArrayList<>(record.exports()));
    entity.setImports(new ArrayList<>(record.imports()));
    entity.setModificationCount(record.modificationCount());
    entity.setLastModifiedAt(record.lastModifiedAt());
  }

  private FileRecord toRecord(ProjectFileStateEntity entity) {
    return new FileRecord(
        entity.getProjectId(),
        entity.getFilePath(),
        entity.getContentHash(),
        entity.getByteSize(),
        entity.getLastModifiedAt(),
        FileType.fromId(entity.getFileType()),
        entity.getExports() != null ? new LinkedHashSet<>(entity.getExports()) : null,
        entity.getImports(),
        entity.getModificationCount());
  }
}
