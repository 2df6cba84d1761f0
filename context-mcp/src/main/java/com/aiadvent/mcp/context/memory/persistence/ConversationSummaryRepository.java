package com.aiadvent.mcp.context.memory.persistence;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

public interface ConversationSummaryRepository
    extends JpaRepository<ConversationSummaryEntity, UUID> {

  List<ConversationSummaryEntity> findByProjectIdOrderBySequenceNumberAsc(String projectId);

  @Modifying
  @Transactional
  @Query("delete from ConversationSummaryEntity s where s.projectId = :projectId")
  int deleteByProjectId(@Param("projectId") String projectId);
}
