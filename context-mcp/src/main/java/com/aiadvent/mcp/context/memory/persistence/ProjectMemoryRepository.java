package com.aiadvent.mcp.context.memory.persistence;

import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

public interface ProjectMemoryRepository extends JpaRepository<ProjectMemoryEntity, UUID> {

  Optional<ProjectMemoryEntity> findByProjectId(String projectId);

  @Modifying
  @Transactional
  @Query("delete from ProjectMemoryEntity m where m.projectId = :projectId")
  int deleteByProjectId(@Param("projectId") String projectId);
}
