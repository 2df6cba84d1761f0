package com.aiadvent.mcp.context.memory.persistence;

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
@Table(name = "context_project_asset")
public class ProjectAssetEntity {

  @Id
  @GeneratedValue
  @UuidGenerator
  private UUID id;

  @Column(name = "project_id", length = 256, nullable = false)
  private String projectId;

  @Column(name = "display_name", length = 256, nullable = false)
  private String displayName;

  @Column(name = "public_path", columnDefinition = "text", nullable = false)
  private String publicPath;

  @Column(name = "asset_type", length = 16, nullable = false)
  private String assetType;

  @Column(name = "category", length = 32, nullable = false)
  private String category;

  @Column(name = "file_size", nullable = false)
  private long fileSize;

  @Column(name = "width")
  private Integer width;

  @Column(name = "height")
  private Integer height;

  @Column(name = "is_sprite_sheet", nullable = false)
  private boolean spriteSheet;

  @Column(name = "frame_count")
  private Integer frameCount;

  @Column(name = "frame_width")
  private Integer frameWidth;

  @Column(name = "frame_height")
  private Integer frameHeight;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "animations", columnDefinition = "jsonb")
  private List<String> animations = new ArrayList<>();

  @Column(name = "description", columnDefinition = "text")
  private String description;

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

  public String getDisplayName() {
    return displayName;
  }

  public void setDisplayName(String displayName) {
    this.displayName = displayName;
  }

  public String getPublicPath() {
    return publicPath;
  }

  public void setPublicPath(String publicPath) {
    this.publicPath = publicPath;
  }

  public String getAssetType() {
    return assetType;
  }

  public void setAssetType(String assetType) {
    this.assetType = assetType;
  }

  public String getCategory() {
    return category;
  }

  public void setCategory(String category) {
    this.category = category;
  }

  public long getFileSize() {
    return fileSize;
  }

  public void setFileSize(long fileSize) {
    this.fileSize = fileSize;
  }

  public Integer getWidth() {
    return width;
  }

  public void setWidth(Integer width) {
    this.width = width;
  }

  public Integer getHeight() {
    return height;
  }

  public void setHeight(Integer height) {
    this.height = height;
  }

  public boolean isSpriteSheet() {
    return spriteSheet;
  }

  public void setSpriteSheet(boolean spriteSheet) {
    this.spriteSheet = spriteSheet;
  }

  public Integer getFrameCount() {
    return frameCount;
  }

  public void setFrameCount(Integer frameCount) {
    this.frameCount = frameCount;
  }

  public Integer getFrameWidth() {
    return frameWidth;
  }

  public void setFrameWidth(Integer frameWidth) {
    this.frameWidth = frameWidth;
  }

  public Integer getFrameHeight() {
    return frameHeight;
  }

  public void setFrameHeight(Integer frameHeight) {
    this.frameHeight = frameHeight;
  }

  public List<String> getAnimations() {
    return animations;
  }

  public void setAnimations(List<String> animations) {
    this.animations = animations;
  }

  public String getDescription() {
    return description;
  }

  public void setDescription(String description) {
    this.description = description;
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
