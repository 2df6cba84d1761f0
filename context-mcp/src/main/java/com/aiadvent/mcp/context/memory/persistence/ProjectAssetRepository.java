package com.aiadvent.mcp.context.memory.persistence;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ProjectAssetRepository extends JpaRepository<ProjectAssetEntity, UUID> {

  List<ProjectAssetEntity> findByProjectIdOrderByCreatedAtAsc(String projectId);
}
