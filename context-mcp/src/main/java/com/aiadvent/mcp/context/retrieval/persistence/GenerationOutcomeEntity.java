package com.aiadvent.mcp.context.retrieval.persistence;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UuidGenerator;
import org.hibernate.type.SqlTypes;

@Entity
@Table(
    name = "context_generation_outcome",
    indexes = @Index(name = "idx_context_outcome_project", columnList = "project_id, created_at"))
public class GenerationOutcomeEntity {

  @Id
  @GeneratedValue
  @UuidGenerator
  private UUID id;

  @Column(name = "project_id", length = 256, nullable = false)
  private String projectId;

  @Column(name = "intent_type", length = 32)
  private String intentType;

  @Column(name = "context_mode", length = 32)
  private String contextMode;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "files_selected_for_context", columnDefinition = "jsonb")
  private List<String> filesSelectedForContext = new ArrayList<>();

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "files_actually_modified", columnDefinition = "jsonb")
  private List<String> filesActuallyModified = new ArrayList<>();

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "missed_files", columnDefinition = "jsonb")
  private List<String> missedFiles = new ArrayList<>();

  @Column(name = "selection_accuracy")
  private Double selectionAccuracy;

  @Column(name = "config_version")
  private Integer configVersion;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  public UUID getId() {
    return id;
  }

  public String getProjectId() {
    return projectId;
  }

  public void setProjectId(String projectId) {
    this.projectId = projectId;
  }

  public String getIntentType() {
    return intentType;
  }

  public void setIntentType(String intentType) {
    this.intentType = intentType;
  }

  public String getContextMode() {
    return contextMode;
  }

  public void setContextMode(String contextMode) {
    this.contextMode = contextMode;
  }

  public List<String> getFilesSelectedForContext() {
    return filesSelectedForContext;
  }

  public void setFilesSelectedForContext(List<String> filesSelectedForContext) {
    this.filesSelectedForContext = filesSelectedForContext;
  }

  public List<String> getFilesActuallyModified() {
    return filesActuallyModified;
  }

  public void setFilesActuallyModified(List<String> filesActuallyModified) {
    this.filesActuallyModified = filesActuallyModified;
  }

  public List<String> getMissedFiles() {
    return missedFiles;
  }

  public void setMissedFiles(List<String> missedFiles) {
    this.missedFiles = missedFiles;
  }

  public Double getSelectionAccuracy() {
    return selectionAccuracy;
  }

  public void setSelectionAccuracy(Double selectionAccuracy) {
    this.selectionAccuracy = selectionAccuracy;
  }

  public Integer getConfigVersion() {
    return configVersion;
  }

  public void setConfigVersion(Integer configVersion) {
    this.configVersion = configVersion;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  @PrePersist
  void onCreate() {
    if (createdAt == null) {
      createdAt = Instant.now();
    }
  }
}
