package com.aiadvent.mcp.context.retrieval.persistence;

import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

public interface GenerationOutcomeRepository extends JpaRepository<GenerationOutcomeEntity, UUID> {

  @Query(
      "select o from GenerationOutcomeEntity o where o.projectId = :projectId "
          + "and o.selectionAccuracy is not null order by o.createdAt desc")
  List<GenerationOutcomeEntity> findRecentScored(
      @Param("projectId") String projectId, Pageable pageable);

  @Query(
      "select o from GenerationOutcomeEntity o where o.selectionAccuracy is not null "
          + "order by o.createdAt desc")
  List<GenerationOutcomeEntity> findRecentScored(Pageable pageable);

  @Modifying
  @Transactional
  @Query("delete from GenerationOutcomeEntity o where o.projectId = :projectId")
  int deleteByProjectId(@Param("projectId") String projectId);
}
