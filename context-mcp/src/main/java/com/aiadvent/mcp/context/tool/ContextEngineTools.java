package com.aiadvent.mcp.context.tool;

import com.aiadvent.mcp.context.assembly.ContextAssembler;
import com.aiadvent.mcp.context.assembly.ContextPackage;
import com.aiadvent.mcp.context.assembly.ContextRequest;
import com.aiadvent.mcp.context.budget.ContextMode;
import com.aiadvent.mcp.context.budget.PreflightEstimate;
import com.aiadvent.mcp.context.budget.TokenBudgetManager;
import com.aiadvent.mcp.context.change.ChangeStoreService;
import com.aiadvent.mcp.context.change.FileChangeSet;
import com.aiadvent.mcp.context.intent.IntentAction;
import com.aiadvent.mcp.context.intent.IntentClassification;
import com.aiadvent.mcp.context.intent.IntentClassifier;
import com.aiadvent.mcp.context.intent.ResponseModeAdvisor;
import com.aiadvent.mcp.context.memory.ConversationMessage;
import com.aiadvent.mcp.context.memory.ProjectMemory;
import com.aiadvent.mcp.context.memory.ProjectMemoryService;
import com.aiadvent.mcp.context.outline.OutlineGenerator;
import com.aiadvent.mcp.context.retrieval.GenerationOutcome;
import com.aiadvent.mcp.context.retrieval.GenerationOutcomeService;
import com.aiadvent.mcp.context.retrieval.OutcomeAdaptiveWeightsService;
import com.aiadvent.mcp.context.scope.ChangeSource;
import com.aiadvent.mcp.context.scope.FileChangeTracker;
import com.aiadvent.mcp.context.scope.ProjectScopeRegistry;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

@Component
public class ContextEngineTools {

  private final ContextAssembler assembler;
  private final TokenBudgetManager budgetManager;
  private final IntentClassifier classifier;
  private final ResponseModeAdvisor responseModeAdvisor;
  private final ChangeStoreService changeStore;
  private final ProjectMemoryService memoryService;
  private final ProjectScopeRegistry scopeRegistry;
  private final GenerationOutcomeService outcomeService;
  private final OutcomeAdaptiveWeightsService weightsService;
  private final OutlineGenerator outlineGenerator;

  public ContextEngineTools(
      ContextAssembler assembler,
      TokenBudgetManager budgetManager,
      IntentClassifier classifier,
      ResponseModeAdvisor responseModeAdvisor,
      ChangeStoreService changeStore,
      ProjectMemoryService memoryService,
      ProjectScopeRegistry scopeRegistry,
      GenerationOutcomeService outcomeService,
      OutcomeAdaptiveWeightsService weightsService,
      OutlineGenerator outlineGenerator) {
    this.assembler = assembler;
    this.budgetManager = budgetManager;
    this.classifier = classifier;
    this.responseModeAdvisor = responseModeAdvisor;
    this.changeStore = changeStore;
    this.memoryService = memoryService;
    this.scopeRegistry = scopeRegistry;
    this.outcomeService = outcomeService;
    this.weightsService = weightsService;
    this.outlineGenerator = outlineGenerator;
  }

  @Tool(
      name = "context.build",
      description =
          "Builds the context package for a code generation request: relevant files (full or"
              + " outline), memory, task context, plan and conversation. Required fields:"
              + " `projectId`, `prompt`, `files`. When `changedFiles` is omitted the file map is"
              + " compared with the stored hashes and the stored hashes are updated.")
  public BuildContextResponse buildContext(BuildContextInput input) {
    requireInput(input);
    requireProject(input.projectId());
    if (input.files() == null) {
      throw new IllegalArgumentException("files must not be null");
    }
    List<String> changedFiles = input.changedFiles();
    FileChangeSet changes = null;
    if (changedFiles == null) {
      changes = changeStore.sync(input.projectId(), input.files(), false);
      boolean firstObservation = changes.modified().isEmpty() && changes.unchanged().isEmpty();
      changedFiles = firstObservation ? List.of() : changes.touched();
    }
    ContextPackage contextPackage =
        assembler.buildContext(
            new ContextRequest(
                input.projectId(),
                input.prompt(),
                input.files(),
                input.selectedFile(),
                toMessages(input.conversationHistory()),
                changedFiles,
                null,
                null,
                input.semanticSearch()));
    return new BuildContextResponse(contextPackage, changes);
  }

  @Tool(
      name = "context.preflight",
      description =
          "Estimates the token cost of a request before building its context and recommends a"
              + " context mode. Required fields: `prompt`, `files`; `projectId` adds the stored"
              + " project memory to the estimate.")
  public PreflightEstimate preflight(PreflightInput input) {
    requireInput(input);
    ProjectMemory memory =
        StringUtils.hasText(input.projectId())
            ? memoryService.find(input.projectId()).orElse(null)
            : null;
    return budgetManager.preflight(
        input.prompt(),
        input.files(),
        input.selectedFile(),
        toMessages(input.conversationHistory()),
        memory);
  }

  @Tool(
      name = "context.classify",
      description =
          "Classifies a prompt: intent, confidence, target files, keywords, recommended context"
              + " mode and response mode (edit, file or hybrid). Required field: `prompt`.")
  public ClassifyResponse classify(ClassifyInput input) {
    requireInput(input);
    String prompt = input.prompt() != null ? input.prompt() : "";
    IntentClassification intent = classifier.classify(prompt);
    return new ClassifyResponse(
        intent,
        budgetManager.recommendedContextMode(prompt),
        budgetManager.needsFullContext(prompt),
        responseModeAdvisor.recommend(prompt, intent));
  }

  @Tool(
      name = "context.track_changes",
      description =
          "Queues file edits of a project; they are recorded after a short quiet period. Source"
              + " is one of USER_EDIT, AI_GENERATION, AI_EDIT. Set `flush` to record them"
              + " immediately. Required fields: `projectId`, `files`.")
  public TrackChangesResponse trackChanges(TrackChangesInput input) {
    requireInput(input);
    requireProject(input.projectId());
    FileChangeTracker tracker = scopeRegistry.open(input.projectId()).tracker();
    tracker.trackBatch(input.files(), parseSource(input.source()));
    int processed = Boolean.TRUE.equals(input.flush()) ? tracker.flush() : 0;
    return new TrackChangesResponse(input.projectId(), tracker.pendingCount(), processed);
  }

  @Tool(
      name = "context.record_outcome",
      description =
          "Records which files were given to the model and which files it actually modified;"
              + " the selection accuracy feeds the adaptive retrieval weights. Required fields:"
              + " `projectId`, `selectedFiles`, `modifiedFiles`.")
  public GenerationOutcome recordOutcome(RecordOutcomeInput input) {
    requireInput(input);
    requireProject(input.projectId());
    return outcomeService.record(
        input.projectId(),
        parseEnum(IntentAction.class, input.intentType(), "intentType"),
        parseMode(input.contextMode()),
        input.selectedFiles(),
        input.modifiedFiles());
  }

  @Tool(
      name = "context.weights",
      description =
          "Returns the current hybrid retrieval weights of a project with their confidence,"
              + " success rate and the latest recorded outcomes. Required field: `projectId`.")
  public OutcomeAdaptiveWeightsService.Diagnostics weights(WeightsInput input) {
    requireInput(input);
    requireProject(input.projectId());
    return weightsService.diagnostics(input.projectId());
  }

  @Tool(
      name = "context.repository_map",
      description =
          "Renders outlines of the given files grouped by file type. Required field: `files`.")
  public RepositoryMapResponse repositoryMap(RepositoryMapInput input) {
    requireInput(input);
    Map<String, String> files = input.files() != null ? input.files() : Map.of();
    return new RepositoryMapResponse(outlineGenerator.repositoryMap(files), files.size());
  }

  @Tool(
      name = "context.close_project",
      description =
          "Flushes pending tracked changes of a project and releases its change tracker and"
              + " in-memory search index. Required field: `projectId`.")
  public CloseProjectResponse closeProject(CloseProjectInput input) {
    requireInput(input);
    requireProject(input.projectId());
    return new CloseProjectResponse(input.projectId(), scopeRegistry.close(input.projectId()));
  }

  private static List<ConversationMessage> toMessages(List<MessageInput> history) {
    if (history == null) {
      return List.of();
    }
    return history.stream()
        .map(message -> new ConversationMessage(message.role(), message.content()))
        .toList();
  }

  private static ChangeSource parseSource(String source) {
    ChangeSource parsed = parseEnum(ChangeSource.class, source, "source");
    return parsed != null ? parsed : ChangeSource.USER_EDIT;
  }

  private static ContextMode parseMode(String mode) {
    if (!StringUtils.hasText(mode)) {
      return null;
    }
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    return Arrays.stream(ContextMode.values())
        .filter(candidate -> candidate.id().equals(normalized))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unknown contextMode: " + mode));
  }

  private static <E extends Enum<E>> E parseEnum(Class<E> type, String value, String field) {
    if (!StringUtils.hasText(value)) {
      return null;
    }
    try {
      return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("Unknown " + field + ": " + value, ex);
    }
  }

  private static void requireInput(Object input) {
    if (input == null) {
      throw new IllegalArgumentException("Input must not be null");
    }
  }

  private static void requireProject(String projectId) {
    if (!StringUtils.hasText(projectId)) {
      throw new IllegalArgumentException("projectId must not be blank");
    }
  }

  public record MessageInput(String role, String content) {}

  public record BuildContextInput(
      String projectId,
      String prompt,
      Map<String, String> files,
      String selectedFile,
      List<MessageInput> conversationHistory,
      List<String> changedFiles,
      Boolean semanticSearch) {}

  public record BuildContextResponse(ContextPackage contextPackage, FileChangeSet changes) {}

  public record PreflightInput(
      String projectId,
      String prompt,
      Map<String, String> files,
      String selectedFile,
      List<MessageInput> conversationHistory) {}

  public record ClassifyInput(String prompt) {}

  public record ClassifyResponse(
      IntentClassification intent,
      ContextMode recommendedContextMode,
      boolean needsFullContext,
      ResponseModeAdvisor.Recommendation responseMode) {}

  public record TrackChangesInput(
      String projectId, Map<String, String> files, String source, Boolean flush) {}

  public record TrackChangesResponse(String projectId, int pending, int processed) {}

  public record RecordOutcomeInput(
      String projectId,
      String intentType,
      String contextMode,
      List<String> selectedFiles,
      List<String> modifiedFiles) {}

  public record WeightsInput(String projectId) {}

  public record RepositoryMapInput(Map<String, String> files) {}

  public record RepositoryMapResponse(String map, int fileCount) {}

  public record CloseProjectInput(String projectId) {}

  public record CloseProjectResponse(String projectId, boolean closed) {}
}
