package com.aiadvent.mcp.context.change.persistence;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

public interface ProjectFileStateRepository extends JpaRepository<ProjectFileStateEntity, UUID> {

  @Query("select f from ProjectFileStateEntity f where f.projectId = :projectId")
  List<ProjectFileStateEntity> findByProjectId(@Param("projectId") String projectId);

  @Query(
      "select f from ProjectFileStateEntity f"
          + " where f.projectId = :projectId and f.filePath = :filePath")
  Optional<ProjectFileStateEntity> findByProjectIdAndFilePath(
      @Param("projectId") String projectId, @Param("filePath") String filePath);

  @Modifying
  @Transactional
  @Query(
      "delete from ProjectFileStateEntity f"
          + " where f.projectId = :projectId and f.filePath in :paths")
  int deleteByProjectIdAndFilePathIn(
      @Param("projectId") String projectId, @Param("paths") Collection<String> paths);

  @Modifying
  @Transactional
  @Query("delete from ProjectFileStateEntity f where f.projectId = :projectId")
  int deleteByProjectId(@Param("projectId") String projectId);
}
