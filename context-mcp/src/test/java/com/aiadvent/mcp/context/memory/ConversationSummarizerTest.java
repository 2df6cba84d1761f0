package com.aiadvent.mcp.context.memory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.aiadvent.mcp.context.config.ContextEngineProperties;
import com.aiadvent.mcp.context.memory.ConversationSummarizer.LocalSummary;
import com.aiadvent.mcp.context.memory.persistence.ConversationSummaryEntity;
import com.aiadvent.mcp.context.memory.persistence.ConversationSummaryRepository;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

class ConversationSummarizerTest {

  private static final String PROJECT = "summaries";

  @Mock private ConversationSummaryRepository repository;

  private ConversationSummarizer summarizer;

  @BeforeEach
  void setUp() {
    MockitoAnnotations.openMocks(this);
    summarizer = new ConversationSummarizer(repository, new ContextEngineProperties());
    when(repository.save(any(ConversationSummaryEntity.class)))
        .thenAnswer(invocation -> invocation.getArgument(0));
  }

  @Test
  void extractsUserActions() {
    assertThat(ConversationSummarizer.extractUserAction("please add a pause menu to the game"))
        .isEqualTo("add a pause menu to the game");
    assertThat(ConversationSummarizer.extractUserAction("I want to build a racing track"))
        .isEqualTo("build a racing track");
    assertThat(ConversationSummarizer.extractUserAction("ok")).isEqualTo("ok");
  }

  @Test
  void extractsCompletedTasks() {
    assertThat(
            ConversationSummarizer.extractCompletedTask(
                "I've added a pause menu to the game. Enjoy!"))
        .isEqualTo("Added a pause menu to the game");
    assertThat(ConversationSummarizer.extractCompletedTask("Sure thing")).isNull();
  }

  @Test
  void summaryPrefersCompletedTasksAndCollectsFiles() {
    LocalSummary summary =
        ConversationSummarizer.summarizeLocally(
            List.of(
                new ConversationMessage(
                    ConversationMessage.USER, "please add a pause menu to the game"),
                new ConversationMessage(
                    ConversationMessage.ASSISTANT,
                    "I've added a pause menu to the game. See /src/components/PauseMenu.tsx")));

    assertThat(summary.summary()).isEqualTo("Added a pause menu to the game");
    assertThat(summary.tasks()).containsExactly("Added a pause menu to the game");
    assertThat(summary.files()).containsExactly("/src/components/PauseMenu.tsx");
  }

  @Test
  void summaryFallsBackToUserRequests() {
    LocalSummary summary =
        ConversationSummarizer.summarizeLocally(
            List.of(
                new ConversationMessage(
                    ConversationMessage.USER, "please add a pause menu to the game")));

    assertThat(summary.summary()).isEqualTo("User requested: add a pause menu to the game");
    assertThat(summary.tasks()).isEmpty();
  }

  @Test
  void waitsUntilEnoughMessagesAccumulate() {
    when(repository.findByProjectIdOrderBySequenceNumberAsc(PROJECT)).thenReturn(List.of());

    Optional<ConversationSummary> summary =
        summarizer.checkAndSummarize(PROJECT, messages(14), 13);

    assertThat(summary).isEmpty();
    verify(repository, never()).save(any(ConversationSummaryEntity.class));
  }

  @Test
  void summarizesOldestWindowAndKeepsRecentMessages() {
    when(repository.findByProjectIdOrderBySequenceNumberAsc(PROJECT)).thenReturn(List.of());

    ConversationSummary summary =
        summarizer.checkAndSummarize(PROJECT, messages(15), 14).orElseThrow();

    assertThat(summary.sequenceNumber()).isZero();
    assertThat(summary.messageRangeStart()).isZero();
    assertThat(summary.messageRangeEnd()).isEqualTo(9);
    assertThat(summary.summaryText()).startsWith("User requested: ");
  }

  @Test
  void continuesAfterLastStoredSummary() {
    ConversationSummaryEntity first = new ConversationSummaryEntity();
    first.setProjectId(PROJECT);
    first.setSummaryText("first");
    first.setMessageRangeStart(0);
    first.setMessageRangeEnd(9);
    first.setSequenceNumber(0);
    when(repository.findByProjectIdOrderBySequenceNumberAsc(PROJECT)).thenReturn(List.of(first));

    ConversationSummary summary =
        summarizer.checkAndSummarize(PROJECT, messages(25), 24).orElseThrow();

    assertThat(summary.sequenceNumber()).isEqualTo(1);
    assertThat(summary.messageRangeStart()).isEqualTo(10);
    assertThat(summary.messageRangeEnd()).isEqualTo(19);
    assertThat(summarizer.stats(PROJECT).summaryCount()).isEqualTo(1);
  }

  @Test
  void conversationContextSkipsSystemMessages() {
    when(repository.findByProjectIdOrderBySequenceNumberAsc(PROJECT)).thenReturn(List.of());
    List<ConversationMessage> all = new ArrayList<>(messages(6));
    all.add(new ConversationMessage(ConversationMessage.SYSTEM, "system prompt"));

    ConversationSummarizer.ConversationContext context =
        summarizer.getConversationContext(PROJECT, all);

    assertThat(context.summaries()).isEmpty();
    assertThat(context.recentMessages())
        .hasSize(5)
        .noneMatch(ConversationMessage::isSystem);
  }

  private static List<ConversationMessage> messages(int count) {
    List<ConversationMessage> messages = new ArrayList<>();
    for (int i = 0; i < count; i++) {
      messages.add(
          new ConversationMessage(ConversationMessage.USER, "please add feature number " + i));
    }
    return messages;
  }
}
