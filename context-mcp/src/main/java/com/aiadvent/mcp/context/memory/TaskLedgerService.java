package com.aiadvent.mcp.context.memory;

import com.aiadvent.mcp.context.memory.persistence.ProjectMemoryEntity;
import com.aiadvent.mcp.context.memory.persistence.ProjectMemoryRepository;
import com.aiadvent.mcp.context.memory.persistence.TaskDeltaEntity;
import com.aiadvent.mcp.context.memory.persistence.TaskDeltaRepository;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

/**
 * Keeps the current goal of a project (substeps, blockers, last known state) and a log of
 * per-turn deltas.
 */
@Service
public class TaskLedgerService {

  private static final Logger log = LoggerFactory.getLogger(TaskLedgerService.class);

  private static final TypeReference<List<TaskSubstep>> SUBSTEPS_TYPE = new TypeReference<>() {};
  private static final int MIN_GOAL_PROMPT_LENGTH = 20;
  private static final int MAX_GOAL_LENGTH = 100;
  private static final List<Pattern> GOAL_PATTERNS =
      List.of(
          Pattern.compile(
              "^(?:i want to|let's|please|can you|help me)\\s+(.+)", Pattern.CASE_INSENSITIVE),
          Pattern.compile("^(?:add|create|build|implement|make)\\s+(.+)", Pattern.CASE_INSENSITIVE),
          Pattern.compile("^(?:fix|update|change|modify)\\s+(.+)", Pattern.CASE_INSENSITIVE));

  private final ProjectMemoryRepository memoryRepository;
  private final TaskDeltaRepository deltaRepository;
  private final ObjectMapper objectMapper;

  public TaskLedgerService(
      ProjectMemoryRepository memoryRepository,
      TaskDeltaRepository deltaRepository,
      ObjectMapper objectMapper) {
    this.memoryRepository = memoryRepository;
    this.deltaRepository = deltaRepository;
    this.objectMapper = objectMapper;
  }

  @Transactional(readOnly = true)
  public TaskLedger getLedger(String projectId) {
    return memoryRepository
        .findByProjectId(projectId)
        .map(this::toLedger)
        .orElseGet(TaskLedger::empty);
  }

  /** Writes every field of the ledger. Creates the memory row when the project has none. */
  @Transactional
  public void updateLedger(String projectId, TaskLedger ledger) {
    ProjectMemoryEntity entity =
        memoryRepository
            .findByProjectId(projectId)
            .orElseGet(
                () -> {
                  ProjectMemoryEntity created = new ProjectMemoryEntity();
                  created.setProjectId(projectId);
                  return created;
                });
    entity.setCurrentGoal(ledger.currentGoal());
    entity.setGoalSubsteps(objectMapper.valueToTree(ledger.substeps()));
    entity.setKnownBlockers(new ArrayList<>(ledger.blockers()));
    entity.setLastKnownState(ledger.lastKnownState());
    memoryRepository.save(entity);
  }

  /** Replaces goal, substeps and state; blockers are kept. */
  @Transactional
  public void setNewGoal(String projectId, String goal, List<TaskSubstep> substeps) {
    TaskLedger current = getLedger(projectId);
    updateLedger(projectId, new TaskLedger(goal, substeps, current.blockers(), null));
    log.info("Project {} has a new goal: {}", projectId, abbreviate(goal, 50));
  }

  @Transactional
  public void markSubstepDone(String projectId, int stepIndex) {
    TaskLedger ledger = getLedger(projectId);
    if (stepIndex < 0 || stepIndex >= ledger.substeps().size()) {
      return;
    }
    List<TaskSubstep> substeps = new ArrayList<>(ledger.substeps());
    substeps.set(stepIndex, substeps.get(stepIndex).markDone());
    updateLedger(
        projectId,
        new TaskLedger(ledger.currentGoal(), substeps, ledger.blockers(), ledger.lastKnownState()));
    log.debug("Project {} substep {} done", projectId, stepIndex + 1);
  }

  @Transactional
  public void addBlocker(String projectId, String blocker) {
    TaskLedger ledger = getLedger(projectId);
    if (ledger.blockers().contains(blocker)) {
      return;
    }
    List<String> blockers = new ArrayList<>(ledger.blockers());
    blockers.add(blocker);
    updateLedger(
        projectId,
        new TaskLedger(ledger.currentGoal(), ledger.substeps(), blockers, ledger.lastKnownState()));
  }

  @Transactional
  public void removeBlocker(String projectId, String blocker) {
    TaskLedger ledger = getLedger(projectId);
    if (!ledger.blockers().contains(blocker)) {
      return;
    }
    List<String> blockers = new ArrayList<>(ledger.blockers());
    blockers.remove(blocker);
    updateLedger(
        projectId,
        new TaskLedger(ledger.currentGoal(), ledger.substeps(), blockers, ledger.lastKnownState()));
  }

  @Transactional
  public void clearBlockers(String projectId) {
    TaskLedger ledger = getLedger(projectId);
    updateLedger(
        projectId,
        new TaskLedger(
            ledger.currentGoal(), ledger.substeps(), List.of(), ledger.lastKnownState()));
  }

  @Transactional
  public void completeGoal(String projectId) {
    updateLedger(projectId, TaskLedger.empty());
    log.info("Project {} goal completed", projectId);
  }

  @Transactional(readOnly = true)
  public int nextTurnNumber(String projectId) {
    Integer max = deltaRepository.findMaxTurnNumber(projectId);
    return max != null ? max + 1 : 1;
  }

  @Transactional
  public TaskDelta recordDelta(TaskDelta delta) {
    TaskDeltaEntity entity = new TaskDeltaEntity();
    entity.setProjectId(delta.projectId());
    entity.setSessionId(delta.sessionId());
    entity.setTurnNumber(delta.turnNumber());
    entity.setUserRequest(delta.userRequest());
    entity.setWhatTried(delta.whatTried());
    entity.setWhatChanged(new ArrayList<>(delta.whatChanged()));
    entity.setWhatSucceeded(delta.whatSucceeded());
    entity.setWhatFailed(delta.whatFailed());
    entity.setWhatNext(delta.whatNext());
    entity.setTokensUsed(delta.tokensUsed());
    entity.setDurationMs(delta.durationMs());
    TaskDelta saved = toDelta(deltaRepository.save(entity));
    log.debug("Recorded delta for project {} turn {}", delta.projectId(), delta.turnNumber());
    return saved;
  }

  @Transactional(readOnly = true)
  public List<TaskDelta> recentDeltas(String projectId, int limit) {
    if (limit <= 0) {
      return List.of();
    }
    return deltaRepository.findRecent(projectId, PageRequest.of(0, limit)).stream()
        .map(this::toDelta)
        .toList();
  }

  public Optional<TaskDelta> latestDelta(String projectId) {
    return recentDeltas(projectId, 1).stream().findFirst();
  }

  public TaskContext getTaskContext(String projectId, int deltaLimit) {
    return new TaskContext(getLedger(projectId), recentDeltas(projectId, deltaLimit));
  }

  /** Records the delta of a finished turn and, when given, stores the new state. */
  @Transactional
  public TaskDelta recordTurnComplete(String projectId, TurnRecord turn) {
    int turnNumber = nextTurnNumber(projectId);
    TaskDelta delta =
        recordDelta(
            new TaskDelta(
                projectId,
                turn.sessionId(),
                turnNumber,
                turn.userRequest(),
                turn.whatTried(),
                turn.whatChanged(),
                turn.whatSucceeded(),
                turn.whatFailed(),
                turn.whatNext(),
                turn.tokensUsed(),
                turn.durationMs(),
                null));
    if (StringUtils.hasText(turn.newState())) {
      TaskLedger ledger = getLedger(projectId);
      updateLedger(
          projectId,
          new TaskLedger(
              ledger.currentGoal(), ledger.substeps(), ledger.blockers(), turn.newState()));
    }
    return delta;
  }

  public String format(TaskContext context) {
    if (context == null) {
      return "";
    }
    TaskLedger ledger = context.ledger();
    List<String> parts = new ArrayList<>();
    if (StringUtils.hasText(ledger.currentGoal())) {
      parts.add("## Current Goal\n" + ledger.currentGoal());
      if (!ledger.substeps().isEmpty()) {
        List<String> steps = new ArrayList<>();
        for (int i = 0; i < ledger.substeps().size(); i++) {
          TaskSubstep step = ledger.substeps().get(i);
          steps.add((i + 1) + ". [" + (step.done() ? "x" : " ") + "] " + step.step());
        }
        parts.add("### Progress\n" + String.join("\n", steps));
      }
    }
    if (!ledger.blockers().isEmpty()) {
      parts.add(
          "### Known Blockers\n"
              + ledger.blockers().stream().map(b -> "- " + b).collect(Collectors.joining("\n")));
    }
    if (StringUtils.hasText(ledger.lastKnownState())) {
      parts.add("### Current State\n" + ledger.lastKnownState());
    }
    if (!context.recentDeltas().isEmpty()) {
      List<TaskDelta> oldestFirst = new ArrayList<>(context.recentDeltas());
      Collections.reverse(oldestFirst);
      parts.add(
          "## Recent History\n"
              + oldestFirst.stream()
                  .map(TaskLedgerService::formatDelta)
                  .collect(Collectors.joining("\n\n")));
    }
    return String.join("\n\n", parts);
  }

  public GoalDetection extractGoalFromPrompt(String prompt) {
    if (prompt == null || prompt.length() < MIN_GOAL_PROMPT_LENGTH) {
      return GoalDetection.none();
    }
    for (Pattern pattern : GOAL_PATTERNS) {
      if (pattern.matcher(prompt).find()) {
        return new GoalDetection(
            true, prompt.substring(0, Math.min(prompt.length(), MAX_GOAL_LENGTH)));
      }
    }
    return GoalDetection.none();
  }

  private static String formatDelta(TaskDelta delta) {
    List<String> lines = new ArrayList<>();
    if (StringUtils.hasText(delta.userRequest())) {
      lines.add("Request: " + delta.userRequest());
    }
    if (StringUtils.hasText(delta.whatTried())) {
      lines.add("Tried: " + delta.whatTried());
    }
    if (!delta.whatChanged().isEmpty()) {
      lines.add("Changed: " + String.join(", ", delta.whatChanged()));
    }
    if (StringUtils.hasText(delta.whatSucceeded())) {
      lines.add("Succeeded: " + delta.whatSucceeded());
    }
    if (StringUtils.hasText(delta.whatFailed())) {
      lines.add("Failed: " + delta.whatFailed());
    }
    if (StringUtils.hasText(delta.whatNext())) {
      lines.add("Next: " + delta.whatNext());
    }
    return "Turn "
        + delta.turnNumber()
        + ":\n"
        + lines.stream().map(line -> "  " + line).collect(Collectors.joining("\n"));
  }

  private TaskLedger toLedger(ProjectMemoryEntity entity) {
    return new TaskLedger(
        entity.getCurrentGoal(),
        readSubsteps(entity.getGoalSubsteps()),
        entity.getKnownBlockers(),
        entity.getLastKnownState());
  }

  private List<TaskSubstep> readSubsteps(JsonNode node) {
    if (node == null || node.isNull() || !node.isArray()) {
      return List.of();
    }
    try {
      return objectMapper.convertValue(node, SUBSTEPS_TYPE);
    } catch (IllegalArgumentException ex) {
      log.warn("Ignoring malformed goal substeps: {}", ex.getMessage());
      return List.of();
    }
  }

  private TaskDelta toDelta(TaskDeltaEntity entity) {
    return new TaskDelta(
        entity.getProjectId(),
        entity.getSessionId(),
        entity.getTurnNumber(),
        entity.getUserRequest(),
        entity.getWhatTried(),
        entity.getWhatChanged(),
        entity.getWhatSucceeded(),
        entity.getWhatFailed(),
        entity.getWhatNext(),
        entity.getTokensUsed(),
        entity.getDurationMs(),
        entity.getCreatedAt());
  }

  private static String abbreviate(String text, int max) {
    if (text == null || text.length() <= max) {
      return text;
    }
    return text.substring(0, max) + "...";
  }

  public record TurnRecord(
      String sessionId,
      String userRequest,
      String whatTried,
      List<String> whatChanged,
      String whatSucceeded,
      String whatFailed,
      String whatNext,
      String newState,
      Integer tokensUsed,
      Long durationMs) {}

  public record GoalDetection(boolean newGoal, String goal) {

    static GoalDetection none() {
      return new GoalDetection(false, null);
    }
  }
}
