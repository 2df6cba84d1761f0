package com.aiadvent.mcp.context.intent;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Rule-based classification of a free-text request. Rules are evaluated in a fixed order and
 * the first matching rule decides the action.
 */
@Component
public class IntentClassifier {

  private static final int FLAGS = Pattern.CASE_INSENSITIVE;

  private static final List<Pattern> TRIVIAL_PATTERNS =
      List.of(
          Pattern.compile(
              "^(change|make|set|update)\\s+(?:the\\s+)?(?:\\w+\\s+)?(?:color|colour)\\s+(?:to|from)",
              FLAGS),
          Pattern.compile(
              "^(?:change|make)\\s+(?:it|this|the\\s+\\w+)\\s+(?:to\\s+)?"
                  + "(?:red|blue|green|yellow|purple|orange|pink|white|black|gray|grey)",
              FLAGS),
          Pattern.compile(
              "^(make|change)\\s+(?:it|this|the\\s+\\w+)\\s+(bigger|smaller|larger|wider|taller|shorter)",
              FLAGS),
          Pattern.compile(
              "^(increase|decrease)\\s+(?:the\\s+)?(?:size|width|height|font|padding|margin)", FLAGS),
          Pattern.compile(
              "^(change|update|fix)\\s+(?:the\\s+)?(?:text|title|label|button\\s+text)\\s+(?:to|from)",
              FLAGS),
          Pattern.compile("^rename\\s+[\"']?[\\w\\s]+[\"']?\\s+to\\s+[\"']?[\\w\\s]+[\"']?", FLAGS),
          Pattern.compile(
              "^(set|change)\\s+(?:the\\s+)?(?:speed|delay|duration|interval|timeout)\\s+to\\s+\\d+",
              FLAGS),
          Pattern.compile("^fix\\s+(?:the\\s+)?(?:typo|spelling|text)", FLAGS));

  private static final Pattern CREATE_VERB =
      Pattern.compile("^(create|make|build|generate)\\s+(a\\s+)?(new\\s+)?", FLAGS);
  private static final Pattern CREATE_SUBJECT = Pattern.compile("game|app|project|component", FLAGS);
  private static final Pattern DEBUG =
      Pattern.compile(
          "\\b(fix|debug|error|bug|issue|broken|crash|not working|doesn't work|won't)\\b", FLAGS);
  private static final Pattern EXPLAIN =
      Pattern.compile("^(what|how|why|explain|tell me|can you explain|describe)", FLAGS);
  private static final Pattern STYLE =
      Pattern.compile(
          "\\b(style|css|look|appearance|design|theme|color|colour|font|ui|visual)\\b", FLAGS);
  private static final Pattern STYLE_EXCLUSION =
      Pattern.compile("\\b(add|create|new|feature|function)\\b", FLAGS);
  private static final Pattern RENAME = Pattern.compile("^rename\\b", FLAGS);
  private static final Pattern REMOVE =
      Pattern.compile("\\b(remove|delete|get rid of|take out|drop)\\b", FLAGS);
  private static final Pattern ADD =
      Pattern.compile("\\b(add|include|insert|implement|create)\\b", FLAGS);

  private static final Pattern TARGET_FILE =
      Pattern.compile(
          "(?:/src/[\\w/.-]+\\.(?:tsx?|css|json))|(?:(?:Index|App|GameplayPage)\\.tsx)", FLAGS);

  private static final List<Pattern> KEYWORD_GROUPS =
      List.of(
          Pattern.compile(
              "\\b(player|enemy|score|level|game|board|tile|piece|card|ball|paddle|snake|food)\\b",
              FLAGS),
          Pattern.compile(
              "\\b(move|jump|shoot|collect|spawn|animate|collision|click|tap|drag)\\b", FLAGS),
          Pattern.compile(
              "\\b(button|menu|modal|header|footer|sidebar|panel|screen|page)\\b", FLAGS),
          Pattern.compile(
              "\\b(hook|component|function|state|effect|context|store|props|ref)\\b", FLAGS),
          Pattern.compile(
              "\\b(color|size|font|border|background|shadow|margin|padding|width|height)\\b",
              FLAGS));

  private static final Pattern VISUAL =
      Pattern.compile(
          "color|style|css|look|appear|theme|background|font|border|shadow|animation|ui|visual",
          FLAGS);
  private static final Pattern STRUCTURAL =
      Pattern.compile(
          "add|remove|create|delete|refactor|restructure|move|new\\s+(?:feature|component|function)",
          FLAGS);

  public IntentClassification classify(String prompt) {
    String text = prompt != null ? prompt : "";
    boolean trivial = isTrivial(text);

    IntentAction action;
    double confidence;
    if (trivial) {
      action = IntentAction.TWEAK;
      confidence = 0.9;
    } else if (CREATE_VERB.matcher(text).find() && CREATE_SUBJECT.matcher(text).find()) {
      action = IntentAction.CREATE;
      confidence = 0.85;
    } else if (DEBUG.matcher(text).find()) {
      action = IntentAction.DEBUG;
      confidence = 0.8;
    } else if (EXPLAIN.matcher(text).find()) {
      action = IntentAction.EXPLAIN;
      confidence = 0.9;
    } else if (STYLE.matcher(text).find() && !STYLE_EXCLUSION.matcher(text).find()) {
      action = IntentAction.STYLE;
      confidence = 0.75;
    } else if (RENAME.matcher(text).find()) {
      action = IntentAction.RENAME;
      confidence = 0.9;
    } else if (REMOVE.matcher(text).find()) {
      action = IntentAction.REMOVE;
      confidence = 0.8;
    } else if (ADD.matcher(text).find()) {
      action = IntentAction.ADD;
      confidence = 0.7;
    } else {
      action = IntentAction.MODIFY;
      confidence = 0.5;
    }

    return new IntentClassification(
        action,
        confidence,
        targetFiles(text),
        keywords(text),
        trivial,
        VISUAL.matcher(text).find(),
        STRUCTURAL.matcher(text).find());
  }

  static boolean isTrivial(String prompt) {
    return TRIVIAL_PATTERNS.stream().anyMatch(pattern -> pattern.matcher(prompt).find());
  }

  private List<String> targetFiles(String prompt) {
    List<String> files = new ArrayList<>();
    Matcher matcher = TARGET_FILE.matcher(prompt);
    while (matcher.find()) {
      String path = matcher.group();
      String file = path.startsWith("/") ? path : "/src/pages/" + path;
      if (!files.contains(file)) {
        files.add(file);
      }
    }
    return files;
  }

  private List<String> keywords(String prompt) {
    List<String> keywords = new ArrayList<>();
    for (Pattern group : KEYWORD_GROUPS) {
      Matcher matcher = group.matcher(prompt);
      while (matcher.find()) {
        String keyword = matcher.group(1).toLowerCase(Locale.ROOT);
        if (!keywords.contains(keyword)) {
          keywords.add(keyword);
        }
      }
    }
    return keywords;
  }
}
