package com.aiadvent.mcp.context.memory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

import com.aiadvent.mcp.context.memory.ProjectMemory.CompletedTask;
import com.aiadvent.mcp.context.memory.ProjectMemory.KeyEntity;
import com.aiadvent.mcp.context.memory.persistence.ProjectMemoryEntity;
import com.aiadvent.mcp.context.memory.persistence.ProjectMemoryRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ProjectMemoryServiceTest {

  private static final String PROJECT = "memory";

  @Mock private ProjectMemoryRepository repository;

  private ProjectMemoryService service;

  @BeforeEach
  void setUp() {
    service = new ProjectMemoryService(repository, new ObjectMapper().findAndRegisterModules());
    when(repository.save(any(ProjectMemoryEntity.class)))
        .thenAnswer(invocation -> invocation.getArgument(0));
  }

  @Test
  void decaysDropsAndBoostsImportance() {
    Map<String, Double> current = new LinkedHashMap<>();
    current.put("/src/a.ts", 1.0);
    current.put("/src/b.ts", 0.1);
    current.put("/src/c.ts", 0.5);

    Map<String, Double> updated =
        ProjectMemoryService.decayAndBoost(current, List.of("/src/c.ts", "/src/d.ts"), "/src/a.ts");

    assertThat(updated).doesNotContainKey("/src/b.ts");
    assertThat(updated.get("/src/a.ts")).isEqualTo(1.0);
    assertThat(updated.get("/src/c.ts")).isCloseTo(0.775, within(1e-9));
    assertThat(updated.get("/src/d.ts")).isCloseTo(0.3, within(1e-9));
  }

  @Test
  void updateFileImportancePersistsDecayedScores() {
    ProjectMemoryEntity entity = new ProjectMemoryEntity();
    entity.setProjectId(PROJECT);
    entity.setFileImportance(new ObjectMapper().valueToTree(Map.of("/src/a.ts", 0.5)));
    when(repository.findByProjectId(PROJECT)).thenReturn(Optional.of(entity));

    Map<String, Double> importance =
        service.updateFileImportance(PROJECT, List.of("/src/b.ts"), null);

    assertThat(importance.get("/src/a.ts")).isCloseTo(0.475, within(1e-9));
    assertThat(importance.get("/src/b.ts")).isCloseTo(0.3, within(1e-9));
    assertThat(service.find(PROJECT).orElseThrow().importanceOf("/src/b.ts"))
        .isCloseTo(0.3, within(1e-9));
  }

  @Test
  void newestCompletedTaskComesFirst() {
    ProjectMemoryEntity entity = new ProjectMemoryEntity();
    entity.setProjectId(PROJECT);
    when(repository.findByProjectId(PROJECT)).thenReturn(Optional.of(entity));

    service.addCompletedTask(PROJECT, "built the board");
    service.addCompletedTask(PROJECT, "added scoring");

    assertThat(service.recentTasks(PROJECT, 5))
        .extracting(CompletedTask::task)
        .containsExactly("added scoring", "built the board");
  }

  @Test
  void formatsSummaryStackTasksAndEntities() {
    ProjectMemory memory =
        new ProjectMemory(
            "A snake game",
            "arcade",
            List.of("react", "vite"),
            List.of(new CompletedTask("added scoring", Instant.EPOCH)),
            Map.of(),
            List.of(new KeyEntity("Snake", "component", "/src/components/Snake.tsx")));

    assertThat(service.format(memory))
        .isEqualTo(
            "## Project Summary\nA snake game\n\nGame type: arcade\n\nTech stack: react, vite\n\n"
                + "### Completed Tasks\n- added scoring\n\n"
                + "### Key Entities\n- Snake (component) in /src/components/Snake.tsx");
    assertThat(service.format(null)).isEmpty();
  }
}
