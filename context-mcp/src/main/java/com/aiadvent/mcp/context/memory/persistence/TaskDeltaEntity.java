package com.aiadvent.mcp.context.memory.persistence;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.Id;
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
@Table(name = "context_task_delta")
public class TaskDeltaEntity {

  @Id
  @GeneratedValue
  @UuidGenerator
  private UUID id;

  @Column(name = "project_id", length = 256, nullable = false)
  private String projectId;

  @Column(name = "session_id", length = 128)
  private String sessionId;

  @Column(name = "turn_number", nullable = false)
  private int turnNumber;

  @Column(name = "user_request", columnDefinition = "text")
  private String userRequest;

  @Column(name = "what_tried", columnDefinition = "text")
  private String whatTried;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "what_changed", columnDefinition = "jsonb")
  private List<String> whatChanged = new ArrayList<>();

  @Column(name = "what_succeeded", columnDefinition = "text")
  private String whatSucceeded;

  @Column(name = "what_failed", columnDefinition = "text")
  private String whatFailed;

  @Column(name = "what_next", columnDefinition = "text")
  private String whatNext;

  @Column(name = "tokens_used")
  private Integer tokensUsed;

  @Column(name = "duration_ms")
  private Long durationMs;

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

  public String getSessionId() {
    return sessionId;
  }

  public void setSessionId(String sessionId) {
    this.sessionId = sessionId;
  }

  public int getTurnNumber() {
    return turnNumber;
  }

  public void setTurnNumber(int turnNumber) {
    this.turnNumber = turnNumber;
  }

  public String getUserRequest() {
    return userRequest;
  }

  public void setUserRequest(String userRequest) {
    this.userRequest = userRequest;
  }

  public String getWhatTried() {
    return whatTried;
  }

  public void setWhatTried(String whatTried) {
    this.whatTried = whatTried;
  }

  public List<String> getWhatChanged() {
    return whatChanged;
  }

  public void setWhatChanged(List<String> whatChanged) {
    this.whatChanged = whatChanged;
  }

  public String getWhatSucceeded() {
    return whatSucceeded;
  }

  public void setWhatSucceeded(String whatSucceeded) {
    this.whatSucceeded = whatSucceeded;
  }

  public String getWhatFailed() {
    return whatFailed;
  }

  public void setWhatFailed(String whatFailed) {
    this.whatFailed = whatFailed;
  }

  public String getWhatNext() {
    return whatNext;
  }

  public void setWhatNext(String whatNext) {
    this.whatNext = whatNext;
  }

  public Integer getTokensUsed() {
    return tokensUsed;
  }

  public void setTokensUsed(Integer tokensUsed) {
    this.tokensUsed = tokensUsed;
  }

  public Long getDurationMs() {
    return durationMs;
  }

  public void setDurationMs(Long durationMs) {
    this.durationMs = durationMs;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  @PrePersist
  void onCreate() {
    this.createdAt = Instant.now();
  }
}
