package com.aiadvent.mcp.context.memory.persistence;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UuidGenerator;
import org.hibernate.type.SqlTypes;

@Entity
@Table(name = "context_project_memory")
public class ProjectMemoryEntity {

  @Id
  @GeneratedValue
  @UuidGenerator
  private UUID id;

  @Column(name = "project_id", length = 256, nullable = false, unique = true)
  private String projectId;

  @Column(name = "project_summary", columnDefinition = "text")
  private String projectSummary;

  @Column(name = "game_type", length = 64)
  private String gameType;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "tech_stack", columnDefinition = "jsonb")
  private List<String> techStack = new ArrayList<>();

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "completed_tasks", columnDefinition = "jsonb")
  private JsonNode completedTasks;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "file_importance", columnDefinition = "jsonb")
  private JsonNode fileImportance;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "key_entities", columnDefinition = "jsonb")
  private JsonNode keyEntities;

  @Column(name = "current_goal", columnDefinition = "text")
  private String currentGoal;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "goal_substeps", columnDefinition = "jsonb")
  private JsonNode goalSubsteps;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "known_blockers", columnDefinition = "jsonb")
  private List<String> knownBlockers = new ArrayList<>();

  @Column(name = "last_known_state", columnDefinition = "text")
  private String lastKnownState;

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

  public String getProjectSummary() {
    return projectSummary;
  }

  public void setProjectSummary(String projectSummary) {
    this.projectSummary = projectSummary;
  }

  public String getGameType() {
    return gameType;
  }

  public void setGameType(String gameType) {
    this.gameType = gameType;
  }

  public List<String> getTechStack() {
    return techStack;
  }

  public void setTechStack(List<String> techStack) {
    this.techStack = techStack;
  }

  public JsonNode getCompletedTasks() {
    return completedTasks;
  }

  public void setCompletedTasks(JsonNode completedTasks) {
    this.completedTasks = completedTasks;
  }

  public JsonNode getFileImportance() {
    return fileImportance;
  }

  public void setFileImportance(JsonNode fileImportance) {
    this.fileImportance = fileImportance;
  }

  public JsonNode getKeyEntities() {
    return keyEntities;
  }

  public void setKeyEntities(JsonNode keyEntities) {
    this.keyEntities = keyEntities;
  }

  public String getCurrentGoal() {
    return currentGoal;
  }

  public void setCurrentGoal(String currentGoal) {
    this.currentGoal = currentGoal;
  }

  public JsonNode getGoalSubsteps() {
    return goalSubsteps;
  }

  public void setGoalSubsteps(JsonNode goalSubsteps) {
    this.goalSubsteps = goalSubsteps;
  }

  public List<String> getKnownBlockers() {
    return knownBlockers;
  }

  public void setKnownBlockers(List<String> knownBlockers) {
    this.knownBlockers = knownBlockers;
  }

  public String getLastKnownState() {
    return lastKnownState;
  }

  public void setLastKnownState(String lastKnownState) {
    this.lastKnownState = lastKnownState;
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
  }

  @PreUpdate
  void onUpdate() {
    this.updatedAt = Instant.now();
  }
}
