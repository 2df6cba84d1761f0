package com.aiadvent.mcp.context.retrieval;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.aiadvent.mcp.context.budget.ContextMode;
import com.aiadvent.mcp.context.config.ContextEngineProperties;
import com.aiadvent.mcp.context.intent.IntentAction;
import com.aiadvent.mcp.context.retrieval.persistence.GenerationOutcomeEntity;
import com.aiadvent.mcp.context.retrieval.persistence.GenerationOutcomeRepository;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

class GenerationOutcomeServiceTest {

  @Mock private GenerationOutcomeRepository repository;
  @Mock private OutcomeAdaptiveWeightsService weightsService;

  private GenerationOutcomeService service;

  @BeforeEach
  void setUp() {
    MockitoAnnotations.openMocks(this);
    service =
        new GenerationOutcomeService(repository, weightsService, new ContextEngineProperties());
  }

  @Test
  void recordsAccuracyAndMissedFiles() {
    when(repository.save(any(GenerationOutcomeEntity.class)))
        .thenAnswer(invocation -> invocation.getArgument(0));

    GenerationOutcome outcome =
        service.record(
            "p1",
            IntentAction.ADD,
            ContextMode.FULL,
            List.of("/src/pages/Index.tsx", "/src/components/Player.tsx"),
            List.of("/src/components/Player.tsx", "/src/hooks/useGame.ts"));

    assertThat(outcome.selectionAccuracy()).isEqualTo(0.5);
    assertThat(outcome.missedFiles()).containsExactly("/src/hooks/useGame.ts");
    assertThat(outcome.intentType()).isEqualTo("add");
    assertThat(outcome.contextMode()).isEqualTo("full");

    ArgumentCaptor<GenerationOutcomeEntity> captor =
        ArgumentCaptor.forClass(GenerationOutcomeEntity.class);
    verify(repository).save(captor.capture());
    assertThat(captor.getValue().getConfigVersion()).isEqualTo(1);
    verify(weightsService).clearCache("p1");
  }

  @Test
  void nothingModifiedCountsAsFullAccuracy() {
    when(repository.save(any(GenerationOutcomeEntity.class)))
        .thenAnswer(invocation -> invocation.getArgument(0));

    GenerationOutcome outcome =
        service.record("p1", IntentAction.EXPLAIN, ContextMode.OUTLINE, List.of("/a.ts"), null);

    assertThat(outcome.selectionAccuracy()).isEqualTo(1.0);
    assertThat(outcome.missedFiles()).isEmpty();
  }

  @Test
  void rejectsBlankProject() {
    assertThatThrownBy(() -> service.record(" ", null, null, List.of(), List.of()))
        .isInstanceOf(IllegalArgumentException.class);
    verifyNoInteractions(repository, weightsService);
  }
}
