package com.aiadvent.mcp.context.assembly;

import com.aiadvent.mcp.context.assembly.PlanStep.Operation;
import com.aiadvent.mcp.context.config.ContextEngineProperties;
import com.aiadvent.mcp.context.intent.IntentAction;
import com.aiadvent.mcp.context.intent.IntentClassification;
import com.aiadvent.mcp.context.intent.IntentClassifier;
import com.aiadvent.mcp.context.memory.ProjectMemory;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Derives a numbered execution plan from the intent of a non-trivial request. Steps are
 * templated per action; the affected files are entry points plus files whose path mentions a
 * prompt keyword, most important first.
 */
@Component
public class StructuredPlanner {

  static final String STYLESHEET = "/src/index.css";
  private static final int MAX_GOAL_LENGTH = 200;

  private final IntentClassifier classifier;
  private final ContextEngineProperties properties;

  public StructuredPlanner(IntentClassifier classifier, ContextEngineProperties properties) {
    this.classifier = classifier;
    this.properties = properties;
  }

  public Optional<StructuredPlan> generate(
      String prompt, Map<String, String> files, ProjectMemory memory) {
    return generate(prompt, classifier.classify(prompt), files, memory);
  }

  public Optional<StructuredPlan> generate(
      String prompt,
      IntentClassification intent,
      Map<String, String> files,
      ProjectMemory memory) {
    if (intent.trivialChange()
        || intent.isAction(IntentAction.TWEAK)
        || intent.isAction(IntentAction.EXPLAIN)) {
      return Optional.empty();
    }
    List<String> affected = affectedFiles(intent, files, memory);
    String mainFile = properties.getSelection().getMainFile();
    List<String> primary = affected.isEmpty() ? List.of(mainFile) : affected;

    List<PlanStep> steps = new ArrayList<>();
    switch (intent.action()) {
      case CREATE -> {
        steps.add(step(1, "Set up base structure and types", List.of(mainFile), 3));
        steps.add(step(2, "Implement core game logic", primary, 4, 1));
        steps.add(step(3, "Add styling and polish", List.of(STYLESHEET), 2, 2));
      }
      case ADD -> {
        steps.add(step(1, "Add feature implementation", primary, 3));
        if (intent.visualChange()) {
          steps.add(step(2, "Update styles for new feature", List.of(STYLESHEET), 2, 1));
        }
      }
      case DEBUG -> {
        steps.add(step(1, "Identify and fix the issue", primary, 3));
        steps.add(step(2, "Verify fix and add error handling", affected, 2, 1));
      }
      default ->
          steps.add(
              new PlanStep(
                  1,
                  intent.action().id() + " requested changes",
                  primary,
                  intent.isAction(IntentAction.REMOVE) ? Operation.DELETE : Operation.MODIFY,
                  intent.isAction(IntentAction.STYLE) ? 2 : 3,
                  List.of()));
    }

    LinkedHashSet<String> touched = new LinkedHashSet<>();
    steps.forEach(step -> touched.addAll(step.files()));
    String goal = prompt.length() > MAX_GOAL_LENGTH ? prompt.substring(0, MAX_GOAL_LENGTH) : prompt;
    return Optional.of(
        new StructuredPlan(
            goal,
            steps,
            steps.stream().mapToInt(PlanStep::complexity).sum(),
            new ArrayList<>(touched),
            steps.stream().map(PlanStep::stepNumber).toList()));
  }

  public String format(StructuredPlan plan) {
    List<String> lines = new ArrayList<>();
    lines.add("## Execution Plan");
    lines.add("Goal: " + plan.goal());
    lines.add("");
    lines.add("### Steps:");
    for (PlanStep step : plan.steps()) {
      lines.add(step.stepNumber() + ". " + step.description());
      lines.add("   Files: " + String.join(", ", step.files()));
      lines.add("   Operation: " + step.operation().id());
      if (!step.dependsOn().isEmpty()) {
        lines.add(
            "   After: step "
                + String.join(", ", step.dependsOn().stream().map(String::valueOf).toList()));
      }
      lines.add("");
    }
    return String.join("\n", lines);
  }

  private List<String> affectedFiles(
      IntentClassification intent, Map<String, String> files, ProjectMemory memory) {
    List<String> entryPoints = properties.getScoring().getEntryPoints();
    ProjectMemory safeMemory = memory != null ? memory : ProjectMemory.empty();
    return files.keySet().stream()
        .filter(
            path -> {
              if (entryPoints.contains(path)) {
                return true;
              }
              String lower = path.toLowerCase(Locale.ROOT);
              return intent.keywords().stream().anyMatch(lower::contains);
            })
        .sorted(Comparator.comparingDouble(safeMemory::importanceOf).reversed())
        .toList();
  }

  private static PlanStep step(
      int number, String description, List<String> files, int complexity, Integer... after) {
    return new PlanStep(number, description, files, Operation.MODIFY, complexity, List.of(after));
  }
}
