package com.aiadvent.mcp.context.memory.persistence;

import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

public interface TaskDeltaRepository extends JpaRepository<TaskDeltaEntity, UUID> {

  @Query(
      "select d from TaskDeltaEntity d where d.projectId = :projectId "
          + "order by d.turnNumber desc, d.createdAt desc")
  List<TaskDeltaEntity> findRecent(@Param("projectId") String projectId, Pageable pageable);

  @Query("select max(d.turnNumber) from TaskDeltaEntity d where d.projectId = :projectId")
  Integer findMaxTurnNumber(@Param("projectId") String projectId);

  @Modifying
  @Transactional
  @Query("delete from TaskDeltaEntity d where d.projectId = :projectId")
  int deleteByProjectId(@Param("projectId") String projectId);
}
