package com.aiadvent.mcp.context.memory;

import com.aiadvent.mcp.context.memory.ProjectMemory.CompletedTask;
import com.aiadvent.mcp.context.memory.ProjectMemory.KeyEntity;
import com.aiadvent.mcp.context.memory.persistence.ProjectMemoryEntity;
import com.aiadvent.mcp.context.memory.persistence.ProjectMemoryRepository;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

@Service
public class ProjectMemoryService {

  private static final Logger log = LoggerFactory.getLogger(ProjectMemoryService.class);

  static final int MAX_COMPLETED_TASKS = 50;
  static final int MAX_KEY_ENTITIES = 100;
  static final double IMPORTANCE_DECAY = 0.95;
  static final double IMPORTANCE_FLOOR = 0.1;
  static final double MODIFIED_BOOST = 0.3;
  static final double SELECTED_BOOST = 0.2;

  private static final TypeReference<List<CompletedTask>> TASKS_TYPE = new TypeReference<>() {};
  private static final TypeReference<Map<String, Double>> IMPORTANCE_TYPE =
      new TypeReference<>() {};
  private static final TypeReference<List<KeyEntity>> ENTITIES_TYPE = new TypeReference<>() {};

  private final ProjectMemoryRepository repository;
  private final ObjectMapper objectMapper;

  public ProjectMemoryService(ProjectMemoryRepository repository, ObjectMapper objectMapper) {
    this.repository = repository;
    this.objectMapper = objectMapper;
  }

  @Transactional(readOnly = true)
  public Optional<ProjectMemory> find(String projectId) {
    return repository.findByProjectId(projectId).map(this::toMemory);
  }

  @Transactional
  public ProjectMemory upsert(String projectId, ProjectMemory memory) {
    ProjectMemoryEntity entity =
        repository.findByProjectId(projectId).orElseGet(() -> newEntity(projectId));
    apply(entity, memory != null ? memory : ProjectMemory.empty());
    return toMemory(repository.save(entity));
  }

  /** Creates an empty memory row unless one already exists. */
  @Transactional
  public ProjectMemory initialize(String projectId, String initialSummary) {
    Optional<ProjectMemoryEntity> existing = repository.findByProjectId(projectId);
    if (existing.isPresent()) {
      return toMemory(existing.get());
    }
    ProjectMemoryEntity entity = newEntity(projectId);
    entity.setProjectSummary(StringUtils.hasText(initialSummary) ? initialSummary : null);
    return toMemory(repository.save(entity));
  }

  @Transactional
  public void addCompletedTask(String projectId, String task) {
    ProjectMemory memory = find(projectId).orElseGet(ProjectMemory::empty);
    List<CompletedTask> tasks = new ArrayList<>();
    tasks.add(new CompletedTask(task, Instant.now()));
    tasks.addAll(memory.completedTasks());
    List<CompletedTask> trimmed = tasks.subList(0, Math.min(tasks.size(), MAX_COMPLETED_TASKS));
    upsert(
        projectId,
        new ProjectMemory(
            memory.projectSummary(),
            memory.gameType(),
            memory.techStack(),
            trimmed,
            memory.fileImportance(),
            memory.keyEntities()));
  }

  public List<CompletedTask> recentTasks(String projectId, int limit) {
    return find(projectId)
        .map(memory -> memory.completedTasks().stream().limit(Math.max(0, limit)).toList())
        .orElse(List.of());
  }

  /**
   * Decays every importance score, drops the ones that fall below the floor, then boosts the
   * modified files and the selected file.
   */
  @Transactional
  public Map<String, Double> updateFileImportance(
      String projectId, List<String> modifiedFiles, String selectedFile) {
    ProjectMemory memory = find(projectId).orElseGet(ProjectMemory::empty);
    Map<String, Double> importance =
        decayAndBoost(memory.fileImportance(), modifiedFiles, selectedFile);
    upsert(
        projectId,
        new ProjectMemory(
            memory.projectSummary(),
            memory.gameType(),
            memory.techStack(),
            memory.completedTasks(),
            importance,
            memory.keyEntities()));
    return importance;
  }

  static Map<String, Double> decayAndBoost(
      Map<String, Double> current, List<String> modifiedFiles, String selectedFile) {
    Map<String, Double> importance = new LinkedHashMap<>();
    current.forEach(
        (path, score) -> {
          double decayed = score * IMPORTANCE_DECAY;
          if (decayed >= IMPORTANCE_FLOOR) {
            importance.put(path, decayed);
          }
        });
    if (modifiedFiles != null) {
      for (String path : modifiedFiles) {
        importance.put(path, Math.min(importance.getOrDefault(path, 0.0) + MODIFIED_BOOST, 1.0));
      }
    }
    if (StringUtils.hasText(selectedFile)) {
      importance.put(
          selectedFile, Math.min(importance.getOrDefault(selectedFile, 0.0) + SELECTED_BOOST, 1.0));
    }
    return importance;
  }

  public List<Map.Entry<String, Double>> importantFiles(String projectId, int limit) {
    return find(projectId).map(ProjectMemory::fileImportance).orElse(Map.of()).entrySet().stream()
        .sorted(Map.Entry.<String, Double>comparingByValue(Comparator.reverseOrder()))
        .limit(Math.max(0, limit))
        .toList();
  }

  @Transactional
  public void updateSummary(String projectId, String summary) {
    ProjectMemory memory = find(projectId).orElseGet(ProjectMemory::empty);
    upsert(
        projectId,
        new ProjectMemory(
            summary,
            memory.gameType(),
            memory.techStack(),
            memory.completedTasks(),
            memory.fileImportance(),
            memory.keyEntities()));
  }

  @Transactional
  public void updateGameType(String projectId, String gameType) {
    ProjectMemory memory = find(projectId).orElseGet(ProjectMemory::empty);
    upsert(
        projectId,
        new ProjectMemory(
            memory.projectSummary(),
            gameType,
            memory.techStack(),
            memory.completedTasks(),
            memory.fileImportance(),
            memory.keyEntities()));
  }

  @Transactional
  public void updateTechStack(String projectId, List<String> techStack) {
    ProjectMemory memory = find(projectId).orElseGet(ProjectMemory::empty);
    upsert(
        projectId,
        new ProjectMemory(
            memory.projectSummary(),
            memory.gameType(),
            techStack,
            memory.completedTasks(),
            memory.fileImportance(),
            memory.keyEntities()));
  }

  /** Replaces an entity with the same name and type, otherwise appends; keeps the newest 100. */
  @Transactional
  public void addKeyEntity(String projectId, KeyEntity entity) {
    ProjectMemory memory = find(projectId).orElseGet(ProjectMemory::empty);
    List<KeyEntity> entities = new ArrayList<>(memory.keyEntities());
    int index = -1;
    for (int i = 0; i < entities.size(); i++) {
      KeyEntity candidate = entities.get(i);
      if (candidate.name().equals(entity.name()) && candidate.type().equals(entity.type())) {
        index = i;
        break;
      }
    }
    if (index >= 0) {
      entities.set(index, entity);
    } else {
      entities.add(entity);
    }
    if (entities.size() > MAX_KEY_ENTITIES) {
      entities =
          new ArrayList<>(entities.subList(entities.size() - MAX_KEY_ENTITIES, entities.size()));
    }
    saveEntities(projectId, memory, entities);
  }

  public List<KeyEntity> fileEntities(String projectId, String filePath) {
    return find(projectId).map(ProjectMemory::keyEntities).orElse(List.of()).stream()
        .filter(entity -> entity.file().equals(filePath))
        .toList();
  }

  @Transactional
  public void removeFileEntities(String projectId, String filePath) {
    ProjectMemory memory = find(projectId).orElseGet(ProjectMemory::empty);
    List<KeyEntity> entities =
        memory.keyEntities().stream().filter(entity -> !entity.file().equals(filePath)).toList();
    saveEntities(projectId, memory, entities);
  }

  @Transactional
  public void delete(String projectId) {
    int removed = repository.deleteByProjectId(projectId);
    log.info("Deleted project memory of {} ({} rows)", projectId, removed);
  }

  /** Clears tasks, importance and entities, keeping summary, game type and tech stack. */
  @Transactional
  public void reset(String projectId) {
    ProjectMemory memory = find(projectId).orElseGet(ProjectMemory::empty);
    upsert(projectId, memory.reduced());
  }

  public String format(ProjectMemory memory) {
    if (memory == null) {
      return "";
    }
    List<String> parts = new ArrayList<>();
    if (StringUtils.hasText(memory.projectSummary())) {
      parts.add("## Project Summary\n" + memory.projectSummary());
    }
    if (StringUtils.hasText(memory.gameType())) {
      parts.add("Game type: " + memory.gameType());
    }
    if (!memory.techStack().isEmpty()) {
      parts.add("Tech stack: " + String.join(", ", memory.techStack()));
    }
    if (!memory.completedTasks().isEmpty()) {
      parts.add(
          "### Completed Tasks\n"
              + memory.completedTasks().stream()
                  .limit(5)
                  .map(task -> "- " + task.task())
                  .collect(Collectors.joining("\n")));
    }
    if (!memory.keyEntities().isEmpty()) {
      parts.add(
          "### Key Entities\n"
              + memory.keyEntities().stream()
                  .limit(10)
                  .map(
                      entity ->
                          "- " + entity.name() + " (" + entity.type() + ") in " + entity.file())
                  .collect(Collectors.joining("\n")));
    }
    return String.join("\n\n", parts);
  }

  private void saveEntities(String projectId, ProjectMemory memory, List<KeyEntity> entities) {
    upsert(
        projectId,
        new ProjectMemory(
            memory.projectSummary(),
            memory.gameType(),
            memory.techStack(),
            memory.completedTasks(),
            memory.fileImportance(),
            entities));
  }

  private ProjectMemoryEntity newEntity(String projectId) {
    ProjectMemoryEntity entity = new ProjectMemoryEntity();
    entity.setProjectId(projectId);
    return entity;
  }

  private void apply(ProjectMemoryEntity entity, ProjectMemory memory) {
    entity.setProjectSummary(memory.projectSummary());
    entity.setGameType(memory.gameType());
    entity.setTechStack(new ArrayList<>(memory.techStack()));
    entity.setCompletedTasks(objectMapper.valueToTree(memory.completedTasks()));
    entity.setFileImportance(objectMapper.valueToTree(memory.fileImportance()));
    entity.setKeyEntities(objectMapper.valueToTree(memory.keyEntities()));
  }

  ProjectMemory toMemory(ProjectMemoryEntity entity) {
    return new ProjectMemory(
        entity.getProjectSummary(),
        entity.getGameType(),
        entity.getTechStack(),
        read(entity.getCompletedTasks(), TASKS_TYPE),
        read(entity.getFileImportance(), IMPORTANCE_TYPE),
        read(entity.getKeyEntities(), ENTITIES_TYPE));
  }

  private <T> T read(JsonNode node, TypeReference<T> type) {
    if (node == null || node.isNull() || node.isMissingNode()) {
      return null;
    }
    try {
      return objectMapper.convertValue(node, type);
    } catch (IllegalArgumentException ex) {
      log.warn("Ignoring malformed project memory column: {}", ex.getMessage());
      return null;
    }
  }
}
