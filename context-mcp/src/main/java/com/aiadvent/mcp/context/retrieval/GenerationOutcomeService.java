package com.aiadvent.mcp.context.retrieval;

import com.aiadvent.mcp.context.budget.ContextMode;
import com.aiadvent.mcp.context.config.ContextEngineProperties;
import com.aiadvent.mcp.context.intent.IntentAction;
import com.aiadvent.mcp.context.retrieval.persistence.GenerationOutcomeEntity;
import com.aiadvent.mcp.context.retrieval.persistence.GenerationOutcomeRepository;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

@Service
public class GenerationOutcomeService {

  private static final Logger log = LoggerFactory.getLogger(GenerationOutcomeService.class);

  private final GenerationOutcomeRepository repository;
  private final OutcomeAdaptiveWeightsService weightsService;
  private final int configVersion;

  public GenerationOutcomeService(
      GenerationOutcomeRepository repository,
      OutcomeAdaptiveWeightsService weightsService,
      ContextEngineProperties properties) {
    this.repository = repository;
    this.weightsService = weightsService;
    this.configVersion = properties.getConfigVersion();
  }

  @Transactional
  public GenerationOutcome record(
      String projectId,
      IntentAction intent,
      ContextMode mode,
      Collection<String> selectedFiles,
      Collection<String> modifiedFiles) {
    if (!StringUtils.hasText(projectId)) {
      throw new IllegalArgumentException("projectId must not be blank");
    }
    Set<String> selected = selectedFiles != null ? new LinkedHashSet<>(selectedFiles) : Set.of();
    Set<String> modified = modifiedFiles != null ? new LinkedHashSet<>(modifiedFiles) : Set.of();
    List<String> missed = modified.stream().filter(path -> !selected.contains(path)).toList();
    double accuracy =
        modified.isEmpty() ? 1.0 : (modified.size() - missed.size()) / (double) modified.size();

    GenerationOutcomeEntity entity = new GenerationOutcomeEntity();
    entity.setProjectId(projectId);
    entity.setIntentType(intent != null ? intent.id() : null);
    entity.setContextMode(mode != null ? mode.id() : null);
    entity.setFilesSelectedForContext(new ArrayList<>(selected));
    entity.setFilesActuallyModified(new ArrayList<>(modified));
    entity.setMissedFiles(new ArrayList<>(missed));
    entity.setSelectionAccuracy(accuracy);
    entity.setConfigVersion(configVersion);
    GenerationOutcome outcome = toOutcome(repository.save(entity));

    weightsService.clearCache(projectId);
    log.info(
        "Recorded outcome for project {}: accuracy {}, {} missed",
        projectId,
        String.format("%.2f", accuracy),
        missed.size());
    return outcome;
  }

  @Transactional(readOnly = true)
  public List<GenerationOutcome> recent(String projectId, int limit) {
    return repository.findRecentScored(projectId, PageRequest.of(0, Math.max(1, limit))).stream()
        .map(GenerationOutcomeService::toOutcome)
        .toList();
  }

  static GenerationOutcome toOutcome(GenerationOutcomeEntity entity) {
    return new GenerationOutcome(
        entity.getProjectId(),
        entity.getIntentType(),
        entity.getContextMode(),
        entity.getFilesSelectedForContext(),
        entity.getFilesActuallyModified(),
        entity.getMissedFiles(),
        entity.getSelectionAccuracy(),
        entity.getCreatedAt());
  }
}
