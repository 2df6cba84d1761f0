package com.aiadvent.mcp.context.change.persistence;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UuidGenerator;
import org.hibernate.type.SqlTypes;

@Entity
@Table(
    name = "context_file_state",
    uniqueConstraints = @UniqueConstraint(columnNames = {"project_id", "file_path"}))
public class ProjectFileStateEntity {

  @Id
  @GeneratedValue
  @UuidGenerator
  private UUID id;

  @Column(name = "project_id", length = 256, nullable = false)
  private String projectId;

  @Column(name = "file_path", columnDefinition = "text", nullable = false)
  private String filePath;

  @Column(name = "content_hash", length = 64, nullable = false)
  private String contentHash;

  @Column(name = "byte_size", nullable = false)
  private long byteSize;

  @Column(name = "file_type", length = 32, nullable = false)
  private String fileType;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "exports", columnDefinition = "jsonb")
  private List<String> exports = new ArrayList<>();

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "imports", columnDefinition = "jsonb")
  private List<String> imports = new ArrayList<>();

  @Column(name = "modification_count", nullable = false)
  private int modificationCount = 1;

  @Column(name = "last_modified_at", nullable = false)
  private Instant lastModifiedAt;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  public UUID getId() {
    return id;
  }

  public String getProjectId() {
    return projectId;
  }

  public void setProjectId(String projectId) {
    this.projectId = projectId;
  }

  public String getFilePath() {
    return filePath;
  }

  public void setFilePath(String filePath) {
    this.filePath = filePath;
  }

  public String getContentHash() {
    return contentHash;
  }

  public void setContentHash(String contentHash) {
    this.contentHash = contentHash;
  }

  public long getByteSize() {
    return byteSize;
  }

  public void setByteSize(long byteSize) {
    this.byteSize = byteSize;
  }

  public String getFileType() {
    return fileType;
  }

  public void setFileType(String fileType) {
    this.fileType = fileType;
  }

  public List<String> getExports() {
    return exports;
  }

  public void setExports(List<String> exports) {
    this.exports = exports;
  }

  public List<String> getImports() {
    return imports;
  }

  public void setImports(List<String> imports) {
    this.imports = imports;
  }

  public int getModificationCount() {
    return modificationCount;
  }

  public void setModificationCount(int modificationCount) {
    this.modificationCount = modificationCount;
  }

  public Instant getLastModifiedAt() {
    return lastModifiedAt;
  }

  public void setLastModifiedAt(Instant lastModifiedAt) {
    this.lastModifiedAt = lastModifiedAt;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  @PrePersist
  void onCreate() {
    Instant now = Instant.now();
    this.createdAt = now;
    this.updatedAt = now;
    if (this.lastModifiedAt == null) {
      this.lastModifiedAt = now;
    }
  }

  @PreUpdate
  void onUpdate() {
    this.updatedAt = Instant.now();
  }
}
