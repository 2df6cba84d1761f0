package com.aiadvent.mcp.context.memory.persistence;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
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
    name = "context_conversation_summary",
    uniqueConstraints = @UniqueConstraint(columnNames = {"project_id", "sequence_number"}))
public class ConversationSummaryEntity {

  @Id
  @GeneratedValue
  @UuidGenerator
  private UUID id;

  @Column(name = "project_id", length = 256, nullable = false)
  private String projectId;

  @Column(name = "summary_text", columnDefinition = "text", nullable = false)
  private String summaryText;

  @Column(name = "message_range_start", nullable = false)
  private int messageRangeStart;

  @Column(name = "message_range_end", nullable = false)
  private int messageRangeEnd;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "tasks_completed", columnDefinition = "jsonb")
  private List<String> tasksCompleted = new ArrayList<>();

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "files_modified", columnDefinition = "jsonb")
  private List<String> filesModified = new ArrayList<>();

  @Column(name = "sequence_number", nullable = false)
  private int sequenceNumber;

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

  public String getSummaryText() {
    return summaryText;
  }

  public void setSummaryText(String summaryText) {
    this.summaryText = summaryText;
  }

  public int getMessageRangeStart() {
    return messageRangeStart;
  }

  public void setMessageRangeStart(int messageRangeStart) {
    this.messageRangeStart = messageRangeStart;
  }

  public int getMessageRangeEnd() {
    return messageRangeEnd;
  }

  public void setMessageRangeEnd(int messageRangeEnd) {
    this.messageRangeEnd = messageRangeEnd;
  }

  public List<String> getTasksCompleted() {
    return tasksCompleted;
  }

  public void setTasksCompleted(List<String> tasksCompleted) {
    this.tasksCompleted = tasksCompleted;
  }

  public List<String> getFilesModified() {
    return filesModified;
  }

  public void setFilesModified(List<String> filesModified) {
    this.filesModified = filesModified;
  }

  public int getSequenceNumber() {
    return sequenceNumber;
  }

  public void setSequenceNumber(int sequenceNumber) {
    this.sequenceNumber = sequenceNumber;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  @PrePersist
  void onCreate() {
    this.createdAt = Instant.now();
  }
}
