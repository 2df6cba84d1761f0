package com.aiadvent.mcp.context.assembly;

import com.aiadvent.mcp.context.budget.ContextMode;
import com.aiadvent.mcp.context.budget.FileSelection;
import com.aiadvent.mcp.context.budget.TokenBudgetManager;
import com.aiadvent.mcp.context.budget.TokenEstimator;
import com.aiadvent.mcp.context.config.ContextEngineProperties;
import com.aiadvent.mcp.context.graph.DependencyContext;
import com.aiadvent.mcp.context.graph.DependencyContextService;
import com.aiadvent.mcp.context.intent.IntentAction;
import com.aiadvent.mcp.context.intent.IntentClassification;
import com.aiadvent.mcp.context.intent.IntentClassifier;
import com.aiadvent.mcp.context.intent.ResponseModeAdvisor;
import com.aiadvent.mcp.context.memory.AssetManifest;
import com.aiadvent.mcp.context.memory.AssetManifestService;
import com.aiadvent.mcp.context.memory.ConversationMessage;
import com.aiadvent.mcp.context.memory.ConversationSummarizer;
import com.aiadvent.mcp.context.memory.ConversationSummary;
import com.aiadvent.mcp.context.memory.ProjectMemory;
import com.aiadvent.mcp.context.memory.ProjectMemoryService;
import com.aiadvent.mcp.context.memory.TaskContext;
import com.aiadvent.mcp.context.memory.TaskLedgerService;
import com.aiadvent.mcp.context.retrieval.HybridRetriever;
import com.aiadvent.mcp.context.retrieval.WeightAnalysis;
import com.aiadvent.mcp.context.scoring.FileScore;
import com.aiadvent.mcp.context.scoring.RelevanceScorer;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Builds the context package for one generation request. Trivial and tweak requests get the
 * minimal package; everything else is scored, optionally blended with semantic search and
 * selected under the intent's token budget. Optional sections never fail the request: a
 * failing collaborator is logged, its section omitted and the outcome recorded in
 * {@link Classification#enrichments()}.
 */
@Service
public class ContextAssembler {

  private static final Logger log = LoggerFactory.getLogger(ContextAssembler.class);

  private final IntentClassifier classifier;
  private final ResponseModeAdvisor responseModeAdvisor;
  private final RelevanceScorer scorer;
  private final DependencyContextService dependencyContextService;
  private final HybridRetriever hybridRetriever;
  private final TokenBudgetManager budgetManager;
  private final TokenEstimator tokenEstimator;
  private final StructuredPlanner planner;
  private final ProjectMemoryService memoryService;
  private final TaskLedgerService taskLedgerService;
  private final AssetManifestService assetManifestService;
  private final ConversationSummarizer summarizer;
  private final ContextAssemblyMetrics metrics;
  private final ContextEngineProperties properties;

  public ContextAssembler(
      IntentClassifier classifier,
      ResponseModeAdvisor responseModeAdvisor,
      RelevanceScorer scorer,
      DependencyContextService dependencyContextService,
      HybridRetriever hybridRetriever,
      TokenBudgetManager budgetManager,
      TokenEstimator tokenEstimator,
      StructuredPlanner planner,
      ProjectMemoryService memoryService,
      TaskLedgerService taskLedgerService,
      AssetManifestService assetManifestService,
      ConversationSummarizer summarizer,
      ContextAssemblyMetrics metrics,
      ContextEngineProperties properties) {
    this.classifier = classifier;
    this.responseModeAdvisor = responseModeAdvisor;
    this.scorer = scorer;
    this.dependencyContextService = dependencyContextService;
    this.hybridRetriever = hybridRetriever;
    this.budgetManager = budgetManager;
    this.tokenEstimator = tokenEstimator;
    this.planner = planner;
    this.memoryService = memoryService;
    this.taskLedgerService = taskLedgerService;
    this.assetManifestService = assetManifestService;
    this.summarizer = summarizer;
    this.metrics = metrics;
    this.properties = properties;
  }

  public ContextPackage buildContext(ContextRequest request) {
    validate(request);
    IntentClassification intent = classifier.classify(request.prompt());
    log.info(
        "Intent for project {}: {} (confidence {}), trivial: {}",
        request.projectId(),
        intent.action().id(),
        intent.confidence(),
        intent.trivialChange());

    Map<String, EnrichmentResult> enrichments = new LinkedHashMap<>();
    ContextMode mode = budgetManager.contextMode(intent);
    ContextPackage contextPackage =
        mode == ContextMode.MINIMAL
            ? buildMinimal(request, intent, enrichments)
            : buildFull(request, intent, mode, enrichments);

    metrics.recordPackage(
        contextPackage.contextMode(),
        contextPackage.classification().intentType(),
        contextPackage.estimatedTokens(),
        contextPackage.relevantFiles().size());
    return contextPackage;
  }

  private ContextPackage buildMinimal(
      ContextRequest request,
      IntentClassification intent,
      Map<String, EnrichmentResult> enrichments) {
    FileSelection selection = budgetManager.selectMinimal(request.files(), request.selectedFile());
    ProjectMemory memory = resolveMemory(request, enrichments);
    List<ConversationMessage> recent =
        TokenBudgetManager.tail(
            request.conversationHistory(),
            properties.getConversation().getRecentMessagesMinimal());

    log.info(
        "Built minimal context for {}: {} file(s), ~{}/{} tokens",
        request.projectId(),
        selection.files().size(),
        selection.tokens(),
        selection.tokenBudget());

    Classification classification =
        new Classification(
            IntentAction.TWEAK,
            ContextMode.MINIMAL,
            false,
            0.9,
            null,
            0.0,
            enrichments,
            responseModeAdvisor.recommend(request.prompt(), intent));
    return new ContextPackage(
        selection.files(),
        ContextMode.MINIMAL,
        selection.tokenBudget(),
        TokenBreakdown.filesOnly(selection.tokens()),
        List.of(),
        List.of(),
        memory != null ? memory.reduced() : null,
        null,
        null,
        null,
        null,
        null,
        null,
        List.of(),
        recent,
        classification);
  }

  private ContextPackage buildFull(
      ContextRequest request,
      IntentClassification intent,
      ContextMode mode,
      Map<String, EnrichmentResult> enrichments) {
    String projectId = request.projectId();
    ProjectMemory memory = resolveMemory(request, enrichments);

    List<FileScore> scores =
        scorer.score(
            projectId,
            request.files(),
            request.selectedFile(),
            request.changedFiles(),
            intent,
            memory);

    Map<String, DependencyContext> dependencies = fetchDependencies(request, enrichments);
    scores = scorer.applyDependencyBoosts(scores, dependencies);

    boolean usedSemanticSearch = false;
    WeightAnalysis weights = null;
    if (semanticSearchRequested(request)) {
      HybridRetriever.Result hybrid =
          hybridRetriever.retrieve(
              projectId,
              request.prompt(),
              scores,
              dependencies,
              request.selectedFile(),
              request.changedFiles());
      scores = hybrid.scores();
      weights = hybrid.weights();
      usedSemanticSearch = hybrid.applied();
      record(enrichments, EnrichmentResult.SEMANTIC, toEnrichment(hybrid));
    }

    FileSelection selection =
        budgetManager.select(
            scores, request.files(), request.selectedFile(), intent.action(), mode);

    int messageCount =
        intent.isAction(IntentAction.EXPLAIN)
            ? properties.getConversation().getRecentMessagesExplain()
            : properties.getConversation().getRecentMessages();
    List<ConversationMessage> recentMessages =
        TokenBudgetManager.tail(request.conversationHistory(), messageCount);
    List<String> summaryTexts =
        intent.trivialChange() ? List.of() : summaryTexts(request, enrichments);

    TaskContext taskContext = null;
    String taskContextFormatted = null;
    try {
      taskContext =
          taskLedgerService.getTaskContext(
              projectId, properties.getConversation().getTaskDeltas());
      String formatted = taskLedgerService.format(taskContext);
      taskContextFormatted = StringUtils.hasText(formatted) ? formatted : null;
      record(enrichments, EnrichmentResult.TASK_CONTEXT, EnrichmentResult.ok());
    } catch (RuntimeException ex) {
      log.warn("Failed to load task context for {}: {}", projectId, ex.getMessage());
      record(enrichments, EnrichmentResult.TASK_CONTEXT, EnrichmentResult.failed(ex.getMessage()));
    }

    StructuredPlan plan = null;
    String planFormatted = null;
    try {
      Optional<StructuredPlan> generated =
          planner.generate(request.prompt(), intent, request.files(), memory);
      if (generated.isPresent()) {
        plan = generated.get();
        planFormatted = planner.format(plan);
        log.debug(
            "Generated plan for {}: {} steps, complexity {}",
            projectId,
            plan.steps().size(),
            plan.totalComplexity());
      }
      record(enrichments, EnrichmentResult.STRUCTURED_PLAN, EnrichmentResult.ok());
    } catch (RuntimeException ex) {
      log.warn("Failed to generate plan for {}: {}", projectId, ex.getMessage());
      record(
          enrichments, EnrichmentResult.STRUCTURED_PLAN, EnrichmentResult.failed(ex.getMessage()));
    }

    AssetManifest manifest = null;
    String manifestFormatted = null;
    try {
      AssetManifest loaded = assetManifestService.getManifest(projectId);
      if (loaded != null && !loaded.isEmpty()) {
        manifest = loaded;
        manifestFormatted =
            intent.trivialChange()
                ? assetManifestService.formatCompact(loaded)
                : assetManifestService.formatForPrompt(loaded);
        log.debug("Asset manifest for {}: {} assets", projectId, loaded.totalCount());
      }
      record(enrichments, EnrichmentResult.ASSET_MANIFEST, EnrichmentResult.ok());
    } catch (RuntimeException ex) {
      log.warn("Failed to load asset manifest for {}: {}", projectId, ex.getMessage());
      record(
          enrichments, EnrichmentResult.ASSET_MANIFEST, EnrichmentResult.failed(ex.getMessage()));
    }

    List<String> fileTree = request.files().keySet().stream().sorted().toList();
    TokenBreakdown tokens =
        new TokenBreakdown(
            selection.tokens(),
            memory != null ? tokenEstimator.estimateJson(memory) : 0,
            tokenEstimator.estimateJoined(summaryTexts),
            tokenEstimator.estimateJoined(
                recentMessages.stream().map(ConversationMessage::content).toList()),
            tokenEstimator.estimate(taskContextFormatted),
            tokenEstimator.estimate(planFormatted),
            tokenEstimator.estimate(manifestFormatted),
            properties.getBudget().getOverheadTokens());

    log.info(
        "Built {} context for {}: {} files, ~{}/{} tokens{}",
        mode.id(),
        projectId,
        selection.files().size(),
        tokens.total(),
        selection.tokenBudget(),
        usedSemanticSearch ? " (with semantic search)" : "");

    Classification classification =
        new Classification(
            intent.action(),
            mode,
            usedSemanticSearch,
            intent.confidence(),
            weights != null ? weights.weights() : null,
            weights != null ? weights.confidence() : 0.0,
            enrichments,
            responseModeAdvisor.recommend(request.prompt(), intent));
    return new ContextPackage(
        selection.files(),
        mode,
        selection.tokenBudget(),
        tokens,
        request.changedFiles(),
        fileTree,
        memory,
        taskContext,
        taskContextFormatted,
        plan,
        planFormatted,
        manifest,
        manifestFormatted,
        summaryTexts,
        recentMessages,
        classification);
  }

  private ProjectMemory resolveMemory(
      ContextRequest request, Map<String, EnrichmentResult> enrichments) {
    if (request.projectMemory() != null) {
      record(enrichments, EnrichmentResult.PROJECT_MEMORY, EnrichmentResult.ok("supplied"));
      return request.projectMemory();
    }
    try {
      Optional<ProjectMemory> memory = memoryService.find(request.projectId());
      record(
          enrichments,
          EnrichmentResult.PROJECT_MEMORY,
          memory.isPresent() ? EnrichmentResult.ok() : EnrichmentResult.ok("no memory"));
      return memory.orElse(null);
    } catch (RuntimeException ex) {
      log.warn("Failed to load project memory for {}: {}", request.projectId(), ex.getMessage());
      record(
          enrichments, EnrichmentResult.PROJECT_MEMORY, EnrichmentResult.failed(ex.getMessage()));
      return null;
    }
  }

  private Map<String, DependencyContext> fetchDependencies(
      ContextRequest request, Map<String, EnrichmentResult> enrichments) {
    Set<String> targets = new LinkedHashSet<>();
    if (StringUtils.hasText(request.selectedFile())) {
      targets.add(request.selectedFile());
    }
    request.changedFiles().stream().filter(StringUtils::hasText).forEach(targets::add);
    if (targets.isEmpty()) {
      return Map.of();
    }
    try {
      DependencyContextService.Result result =
          dependencyContextService.fetch(request.projectId(), new ArrayList<>(targets));
      record(
          enrichments,
          EnrichmentResult.DEPENDENCIES,
          result.degraded()
              ? EnrichmentResult.degraded(
                  result.failedFiles() + " of " + targets.size() + " lookups failed")
              : EnrichmentResult.ok());
      return result.contexts();
    } catch (RuntimeException ex) {
      log.warn("Dependency lookup failed for {}: {}", request.projectId(), ex.getMessage());
      record(enrichments, EnrichmentResult.DEPENDENCIES, EnrichmentResult.failed(ex.getMessage()));
      return Map.of();
    }
  }

  private List<String> summaryTexts(
      ContextRequest request, Map<String, EnrichmentResult> enrichments) {
    List<ConversationSummary> summaries = request.conversationSummaries();
    if (summaries == null) {
      try {
        summaries = summarizer.getSummaries(request.projectId());
        record(enrichments, EnrichmentResult.CONVERSATION, EnrichmentResult.ok());
      } catch (RuntimeException ex) {
        log.warn(
            "Failed to load conversation summaries for {}: {}",
            request.projectId(),
            ex.getMessage());
        record(
            enrichments, EnrichmentResult.CONVERSATION, EnrichmentResult.failed(ex.getMessage()));
        return List.of();
      }
    } else {
      record(enrichments, EnrichmentResult.CONVERSATION, EnrichmentResult.ok("supplied"));
    }
    return summaries.stream()
        .sorted(Comparator.comparingInt(ConversationSummary::sequenceNumber))
        .map(ConversationSummary::summaryText)
        .toList();
  }

  private boolean semanticSearchRequested(ContextRequest request) {
    return request.semanticSearch() != null
        ? request.semanticSearch()
        : properties.getHybrid().isEnabled();
  }

  private static EnrichmentResult toEnrichment(HybridRetriever.Result hybrid) {
    return switch (hybrid.status()) {
      case APPLIED -> EnrichmentResult.ok();
      case NO_MATCHES -> EnrichmentResult.ok(hybrid.reason());
      case UNAVAILABLE -> EnrichmentResult.degraded(hybrid.reason());
      case FAILED -> EnrichmentResult.failed(hybrid.reason());
    };
  }

  private void record(
      Map<String, EnrichmentResult> enrichments, String section, EnrichmentResult result) {
    enrichments.put(section, result);
    if (!result.isOk()) {
      metrics.recordDegraded(section);
    }
  }

  private static void validate(ContextRequest request) {
    if (request == null) {
      throw new IllegalArgumentException("request must not be null");
    }
    if (!StringUtils.hasText(request.projectId())) {
      throw new IllegalArgumentException("projectId must not be blank");
    }
    if (request.prompt() == null) {
      throw new IllegalArgumentException("prompt must not be null");
    }
    if (request.files() == null) {
      throw new IllegalArgumentException("file map must not be null");
    }
  }
}
