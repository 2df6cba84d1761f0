package com.aiadvent.mcp.context.memory;

import com.aiadvent.mcp.context.config.ContextEngineProperties;
import com.aiadvent.mcp.context.memory.persistence.ConversationSummaryEntity;
import com.aiadvent.mcp.context.memory.persistence.ConversationSummaryRepository;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Compresses older conversation messages into rule-based summaries. No model call is made: user
 * requests, completed tasks and mentioned source files are extracted with patterns.
 */
@Service
public class ConversationSummarizer {

  private static final Logger log = LoggerFactory.getLogger(ConversationSummarizer.class);

  private static final Pattern FILE_MENTION = Pattern.compile("/src/[^\\s'\"`)]+\\.tsx?");
  private static final Pattern SENTENCE_END = Pattern.compile("[.!?]");
  private static final List<Pattern> USER_ACTION_PATTERNS =
      List.of(
          Pattern.compile(
              "^(?:please\\s+)?(?:can you\\s+)?(?:help me\\s+)?"
                  + "(create|make|build|add|fix|change|update|remove)\\s+(.{10,60})",
              Pattern.CASE_INSENSITIVE),
          Pattern.compile("^I want (?:to\\s+)?(.{10,60})", Pattern.CASE_INSENSITIVE),
          Pattern.compile("^(.{10,60})\\s+(?:please|now)$", Pattern.CASE_INSENSITIVE));
  private static final int MULTILINE_IGNORE_CASE = Pattern.CASE_INSENSITIVE | Pattern.MULTILINE;
  private static final List<Pattern> COMPLETED_TASK_PATTERNS =
      List.of(
          Pattern.compile("^I've (.{10,80}?)(?:\\.|!|$)", MULTILINE_IGNORE_CASE),
          Pattern.compile(
              "^(?:Done|Created|Added|Fixed|Updated|Implemented)!?\\s*(.{10,80}?)(?:\\.|!|$)",
              MULTILINE_IGNORE_CASE),
          Pattern.compile(
              "^(.{10,80}) (?:has been|is now|are now) (?:created|added|implemented|fixed)",
              MULTILINE_IGNORE_CASE),
          Pattern.compile("^(.{10,80}) (?:complete|done|ready)", MULTILINE_IGNORE_CASE));

  private final ConversationSummaryRepository repository;
  private final ContextEngineProperties.Conversation properties;

  public ConversationSummarizer(
      ConversationSummaryRepository repository, ContextEngineProperties properties) {
    this.repository = repository;
    this.properties = properties.getConversation();
  }

  @Transactional(readOnly = true)
  public List<ConversationSummary> getSummaries(String projectId) {
    return repository.findByProjectIdOrderBySequenceNumberAsc(projectId).stream()
        .map(ConversationSummarizer::toSummary)
        .sorted(Comparator.comparingInt(ConversationSummary::sequenceNumber))
        .toList();
  }

  /**
   * Stores a new summary once enough messages have accumulated past the last summarised index,
   * always leaving the most recent messages unsummarised.
   */
  @Transactional
  public Optional<ConversationSummary> checkAndSummarize(
      String projectId, List<ConversationMessage> messages, int currentIndex) {
    int perSummary = properties.getMessagesPerSummary();
    int keepRecent = properties.getRecentToKeep();
    List<ConversationSummary> summaries = getSummaries(projectId);
    int lastSummarizedIndex =
        summaries.isEmpty()
            ? -1
            : summaries.get(summaries.size() - 1).sequenceNumber() * perSummary + perSummary - 1;

    int unsummarized = currentIndex - lastSummarizedIndex;
    if (unsummarized < perSummary + keepRecent || messages == null) {
      return Optional.empty();
    }
    int start = lastSummarizedIndex + 1;
    int end = currentIndex - keepRecent;
    int toExclusive = Math.min(end + 1, messages.size());
    if (start >= toExclusive) {
      return Optional.empty();
    }
    List<ConversationMessage> slice = messages.subList(start, toExclusive);
    if (slice.size() < perSummary) {
      return Optional.empty();
    }

    LocalSummary local = summarizeLocally(slice);
    int sequence =
        summaries.isEmpty() ? 0 : summaries.get(summaries.size() - 1).sequenceNumber() + 1;
    ConversationSummaryEntity entity = new ConversationSummaryEntity();
    entity.setProjectId(projectId);
    entity.setSummaryText(local.summary());
    entity.setMessageRangeStart(start);
    entity.setMessageRangeEnd(end);
    entity.setTasksCompleted(new ArrayList<>(local.tasks()));
    entity.setFilesModified(new ArrayList<>(local.files()));
    entity.setSequenceNumber(sequence);
    ConversationSummary saved = toSummary(repository.save(entity));
    log.info("Summarised messages {}-{} of project {}", start, end, projectId);
    return Optional.of(saved);
  }

  /** Stored summary texts plus the last non-system messages. */
  public ConversationContext getConversationContext(
      String projectId, List<ConversationMessage> allMessages) {
    List<String> summaries =
        getSummaries(projectId).stream().map(ConversationSummary::summaryText).toList();
    List<ConversationMessage> visible =
        allMessages == null
            ? List.of()
            : allMessages.stream().filter(message -> !message.isSystem()).toList();
    int from = Math.max(0, visible.size() - properties.getRecentToKeep());
    return new ConversationContext(summaries, visible.subList(from, visible.size()));
  }

  @Transactional
  public void clear(String projectId) {
    repository.deleteByProjectId(projectId);
  }

  public SummaryStats stats(String projectId) {
    List<ConversationSummary> summaries = getSummaries(projectId);
    if (summaries.isEmpty()) {
      return new SummaryStats(0, 0, null, null);
    }
    return new SummaryStats(
        summaries.size(),
        summaries.size() * properties.getMessagesPerSummary(),
        summaries.get(0).summaryText(),
        summaries.get(summaries.size() - 1).summaryText());
  }

  static LocalSummary summarizeLocally(List<ConversationMessage> messages) {
    List<String> tasks = new ArrayList<>();
    List<String> actions = new ArrayList<>();
    Set<String> files = new LinkedHashSet<>();
    for (ConversationMessage message : messages) {
      if (message.isUser()) {
        String action = extractUserAction(message.content());
        if (action != null) {
          actions.add(action);
        }
      } else if (message.isAssistant()) {
        String task = extractCompletedTask(message.content());
        if (task != null) {
          tasks.add(task);
        }
        Matcher matcher = FILE_MENTION.matcher(message.content());
        while (matcher.find()) {
          files.add(matcher.group());
        }
      }
    }

    String summary;
    if (!tasks.isEmpty()) {
      summary = String.join(". ", tasks.subList(0, Math.min(3, tasks.size())));
    } else if (!actions.isEmpty()) {
      summary =
          "User requested: " + String.join(", ", actions.subList(0, Math.min(3, actions.size())));
    } else {
      summary = "Conversation with " + messages.size() + " messages";
    }
    return new LocalSummary(
        summary,
        tasks.subList(0, Math.min(5, tasks.size())),
        files.stream().limit(10).toList());
  }

  static String extractUserAction(String content) {
    for (Pattern pattern : USER_ACTION_PATTERNS) {
      Matcher matcher = pattern.matcher(content);
      if (matcher.find()) {
        String second = matcher.groupCount() >= 2 ? matcher.group(2) : null;
        return (matcher.group(1) + (second != null ? " " + second : "")).trim();
      }
    }
    String firstSentence = SENTENCE_END.split(content, 2)[0];
    if (!firstSentence.isEmpty() && firstSentence.length() < 80) {
      return firstSentence.trim();
    }
    return null;
  }

  static String extractCompletedTask(String content) {
    for (Pattern pattern : COMPLETED_TASK_PATTERNS) {
      Matcher matcher = pattern.matcher(content);
      if (matcher.find()) {
        String task = matcher.group(1).trim();
        if (task.isEmpty()) {
          return task;
        }
        return Character.toUpperCase(task.charAt(0)) + task.substring(1);
      }
    }
    return null;
  }

  private static ConversationSummary toSummary(ConversationSummaryEntity entity) {
    return new ConversationSummary(
        entity.getSummaryText(),
        entity.getMessageRangeStart(),
        entity.getMessageRangeEnd(),
        entity.getTasksCompleted(),
        entity.getFilesModified(),
        entity.getSequenceNumber());
  }

  record LocalSummary(String summary, List<String> tasks, List<String> files) {}

  public record ConversationContext(
      List<String> summaries, List<ConversationMessage> recentMessages) {}

  public record SummaryStats(
      int summaryCount, int messagesCompressed, String oldestSummary, String newestSummary) {}
}
