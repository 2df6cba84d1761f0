package com.aiadvent.mcp.context.intent;

import java.util.List;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

@Component
public class ResponseModeAdvisor {

  private static final int FLAGS = Pattern.CASE_INSENSITIVE;
  private static final double EDIT_SUGGESTION_CONFIDENCE = 0.7;

  private static final List<Pattern> EDIT_PATTERNS =
      List.of(
          Pattern.compile("^(change|make|set|update)\\s+(?:the\\s+)?(?:\\w+\\s+)?(?:color|colour)", FLAGS),
          Pattern.compile(
              "(?:to\\s+)?(?:red|blue|green|yellow|purple|orange|pink|white|black|gray|grey|#[0-9a-f]{3,8})\\b",
              FLAGS),
          Pattern.compile(
              "^(change|set|update|make)\\s+(?:the\\s+)?"
                  + "(?:speed|size|width|height|delay|duration|timeout|interval)\\s+(?:to\\s+)?\\d",
              FLAGS),
          Pattern.compile(
              "^(change|update|fix)\\s+(?:the\\s+)?"
                  + "(?:text|title|label|button\\s+text|heading|message)\\s+(?:to|from)",
              FLAGS),
          Pattern.compile(
              "^(make|change)\\s+(?:it|this|the\\s+\\w+)\\s+"
                  + "(bigger|smaller|larger|wider|taller|shorter|bolder|lighter)",
              FLAGS),
          Pattern.compile("^fix\\s+(?:the\\s+)?(?:typo|spelling)", FLAGS),
          Pattern.compile("^(show|hide|toggle)\\s+(?:the\\s+)?", FLAGS),
          Pattern.compile(
              "^(add|remove|change|increase|decrease)\\s+(?:the\\s+)?"
                  + "(?:border|margin|padding|shadow|radius)",
              FLAGS),
          Pattern.compile("^replace\\s+[\"']?[^\"']+[\"']?\\s+with\\s+[\"']?[^\"']+[\"']?", FLAGS));

  private static final List<Pattern> FILE_PATTERNS =
      List.of(
          Pattern.compile(
              "^(add|create|implement|build)\\s+(a\\s+)?(new\\s+)?"
                  + "(?:feature|component|page|hook|function)",
              FLAGS),
          Pattern.compile("\\b(refactor|restructure|reorganize|rewrite|redesign)\\b", FLAGS),
          Pattern.compile(
              "\\b(add|implement)\\s+(?:a\\s+)?(?:new\\s+)?"
                  + "(?:level|enemy|power-?up|game\\s+mode|multiplayer)",
              FLAGS),
          Pattern.compile(
              "\\b(add|implement)\\s+(?:state\\s+)?(?:management|context|store|reducer)", FLAGS),
          Pattern.compile(
              "\\b(add|create)\\s+(?:a\\s+)?(?:new\\s+)?(?:screen|page|view|modal|dialog)", FLAGS),
          Pattern.compile("\\b(integrate|connect|hook\\s+up|wire\\s+up)\\b", FLAGS),
          Pattern.compile(
              "\\b(add|create|implement)\\s+(?:complex\\s+)?(?:animation|transition|effect)s?\\b",
              FLAGS));

  private static final Pattern SIMPLE_FIX =
      Pattern.compile("^fix\\s+(?:the\\s+)?(?:typo|color|text|label|value|number)", FLAGS);
  private static final Pattern SMALL_REMOVAL =
      Pattern.compile("^remove\\s+(?:the\\s+)?(?:button|text|label|icon|class|style)", FLAGS);

  private final IntentClassifier classifier;

  public ResponseModeAdvisor(IntentClassifier classifier) {
    this.classifier = classifier;
  }

  public Recommendation recommend(String prompt) {
    String text = prompt != null ? prompt : "";
    return recommend(text, classifier.classify(text));
  }

  public Recommendation recommend(String prompt, IntentClassification intent) {
    String text = prompt != null ? prompt : "";
    if (matchesAny(EDIT_PATTERNS, text) || intent.trivialChange()) {
      return new Recommendation(
          ResponseMode.EDIT, 0.9, "Small, targeted change that can be done with search/replace");
    }
    if (matchesAny(FILE_PATTERNS, text) || intent.structuralChange()) {
      return new Recommendation(
          ResponseMode.FILE,
          0.85,
          "Structural change or new feature that needs full file context");
    }

    IntentAction action = intent.action();
    return switch (action) {
      case TWEAK, STYLE, RENAME ->
          new Recommendation(
              ResponseMode.EDIT,
              0.8,
              action.id() + " action typically requires small, localized changes");
      case CREATE, ADD ->
          new Recommendation(
              ResponseMode.FILE,
              0.85,
              action.id() + " action typically requires full file replacement");
      case DEBUG -> {
        boolean simple = SIMPLE_FIX.matcher(text).find();
        yield new Recommendation(
            simple ? ResponseMode.EDIT : ResponseMode.FILE,
            0.7,
            simple ? "Simple fix can use edit mode" : "Complex bug fix needs full context");
      }
      case REMOVE -> {
        boolean small = SMALL_REMOVAL.matcher(text).find();
        yield new Recommendation(
            small ? ResponseMode.EDIT : ResponseMode.FILE,
            0.75,
            small ? "Small removal can use edit mode" : "Larger removal needs file mode");
      }
      default ->
          new Recommendation(
              ResponseMode.HYBRID, 0.5, "Ambiguous request - AI will choose appropriate format");
    };
  }

  public boolean shouldSuggestEditMode(String prompt) {
    Recommendation recommendation = recommend(prompt);
    return recommendation.mode() == ResponseMode.EDIT
        && recommendation.confidence() >= EDIT_SUGGESTION_CONFIDENCE;
  }

  private static boolean matchesAny(List<Pattern> patterns, String text) {
    return patterns.stream().anyMatch(pattern -> pattern.matcher(text).find());
  }

  public record Recommendation(ResponseMode mode, double confidence, String reason) {}
}
