package com.aiadvent.mcp.context.config;

import com.aiadvent.mcp.context.intent.IntentAction;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.StringUtils;

/**
 * Single versioned record of every weight, budget and threshold the engine uses. Bumping {@code
 * configVersion} marks a tuning change so recorded outcomes can be compared across versions.
 */
@ConfigurationProperties(prefix = "context.engine")
public class ContextEngineProperties implements InitializingBean {

  public static final int CURRENT_CONFIG_VERSION = 1;

  private int configVersion = CURRENT_CONFIG_VERSION;
  private final Scoring scoring = new Scoring();
  private final Budget budget = new Budget();
  private final Selection selection = new Selection();
  private final Outline outline = new Outline();
  private final Hybrid hybrid = new Hybrid();
  private final Adaptive adaptive = new Adaptive();
  private final Conversation conversation = new Conversation();
  private final Tracking tracking = new Tracking();
  private final Embedding embedding = new Embedding();

  @Override
  public void afterPropertiesSet() {
    if (configVersion < 1) {
      throw new IllegalStateException(
          "context.engine.config-version must be positive, got %d".formatted(configVersion));
    }
    for (IntentAction action : IntentAction.values()) {
      Integer tokens = budget.getTokens().get(action);
      if (tokens == null || tokens <= budget.getReservedTokens()) {
        throw new IllegalStateException(
            "context.engine.budget.tokens.%s must exceed reserved tokens (%d)"
                .formatted(action.id(), budget.getReservedTokens()));
      }
    }
    if (budget.getCharsPerToken() <= 0) {
      throw new IllegalStateException("context.engine.budget.chars-per-token must be positive");
    }
    if (outline.getThresholdLines() < 1) {
      throw new IllegalStateException("context.engine.outline.threshold-lines must be positive");
    }
    if (hybrid.getSimilarityThreshold() < 0 || hybrid.getSimilarityThreshold() > 1) {
      throw new IllegalStateException(
          "context.engine.hybrid.similarity-threshold must be within [0, 1]");
    }
    if (!StringUtils.hasText(selection.getMainFile())) {
      throw new IllegalStateException("context.engine.selection.main-file must not be blank");
    }
    if (tracking.getMaxBatchSize() < 1) {
      throw new IllegalStateException("context.engine.tracking.max-batch-size must be positive");
    }
  }

  public int getConfigVersion() {
    return configVersion;
  }

  public void setConfigVersion(int configVersion) {
    this.configVersion = configVersion;
  }

  public Scoring getScoring() {
    return scoring;
  }

  public Budget getBudget() {
    return budget;
  }

  public Selection getSelection() {
    return selection;
  }

  public Outline getOutline() {
    return outline;
  }

  public Hybrid getHybrid() {
    return hybrid;
  }

  public Adaptive getAdaptive() {
    return adaptive;
  }

  public Conversation getConversation() {
    return conversation;
  }

  public Tracking getTracking() {
    return tracking;
  }

  public Embedding getEmbedding() {
    return embedding;
  }

  public static class Scoring {
    private double mentionedInPrompt = 1.0;
    private double selectedFile = 0.9;
    private double recentlyModified = 0.8;
    private double directDependency = 0.8;
    private double importedByRelevant = 0.7;
    private double reverseDependency = 0.6;
    private double entryPoint = 0.6;
    private double keywordMatch = 0.5;
    private int keywordSaturation = 3;
    private double highModificationCount = 0.4;
    private int modificationCountThreshold = 3;
    private double typeMatch = 0.3;
    private double memoryImportanceFactor = 0.3;
    private List<String> entryPoints =
        new ArrayList<>(
            List.of("/src/pages/Index.tsx", "/src/pages/GameplayPage.tsx", "/src/App.tsx"));

    public double getMentionedInPrompt() {
      return mentionedInPrompt;
    }

    public void setMentionedInPrompt(double mentionedInPrompt) {
      this.mentionedInPrompt = mentionedInPrompt;
    }

    public double getSelectedFile() {
      return selectedFile;
    }

    public void setSelectedFile(double selectedFile) {
      this.selectedFile = selectedFile;
    }

    public double getRecentlyModified() {
      return recentlyModified;
    }

    public void setRecentlyModified(double recentlyModified) {
      this.recentlyModified = recentlyModified;
    }

    public double getDirectDependency() {
      return directDependency;
    }

    public void setDirectDependency(double directDependency) {
      this.directDependency = directDependency;
    }

    public double getImportedByRelevant() {
      return importedByRelevant;
    }

    public void setImportedByRelevant(double importedByRelevant) {
      this.importedByRelevant = importedByRelevant;
    }

    public double getReverseDependency() {
      return reverseDependency;
    }

    public void setReverseDependency(double reverseDependency) {
      this.reverseDependency = reverseDependency;
    }

    public double getEntryPoint() {
      return entryPoint;
    }

    public void setEntryPoint(double entryPoint) {
      this.entryPoint = entryPoint;
    }

    public double getKeywordMatch() {
      return keywordMatch;
    }

    public void setKeywordMatch(double keywordMatch) {
      this.keywordMatch = keywordMatch;
    }

    public int getKeywordSaturation() {
      return keywordSaturation;
    }

    public void setKeywordSaturation(int keywordSaturation) {
      this.keywordSaturation = keywordSaturation;
    }

    public double getHighModificationCount() {
      return highModificationCount;
    }

    public void setHighModificationCount(double highModificationCount) {
      this.highModificationCount = highModificationCount;
    }

    public int getModificationCountThreshold() {
      return modificationCountThreshold;
    }

    public void setModificationCountThreshold(int modificationCountThreshold) {
      this.modificationCountThreshold = modificationCountThreshold;
    }

    public double getTypeMatch() {
      return typeMatch;
    }

    public void setTypeMatch(double typeMatch) {
      this.typeMatch = typeMatch;
    }

    public double getMemoryImportanceFactor() {
      return memoryImportanceFactor;
    }

    public void setMemoryImportanceFactor(double memoryImportanceFactor) {
      this.memoryImportanceFactor = memoryImportanceFactor;
    }

    public List<String> getEntryPoints() {
      return entryPoints;
    }

    public void setEntryPoints(List<String> entryPoints) {
      this.entryPoints = entryPoints != null ? new ArrayList<>(entryPoints) : new ArrayList<>();
    }
  }

  public static class Budget {
    private final Map<IntentAction, Integer> tokens = defaultTokens();
    private int reservedTokens = 2000;
    private int charsPerToken = 4;
    private int overheadTokens = 500;
    private int taskContextEstimate = 300;
    private double outlineRecommendationFactor = 1.5;

    private static Map<IntentAction, Integer> defaultTokens() {
      Map<IntentAction, Integer> defaults = new EnumMap<>(IntentAction.class);
      defaults.put(IntentAction.CREATE, 15000);
      defaults.put(IntentAction.ADD, 12000);
      defaults.put(IntentAction.MODIFY, 10000);
      defaults.put(IntentAction.DEBUG, 8000);
      defaults.put(IntentAction.REMOVE, 6000);
      defaults.put(IntentAction.STYLE, 10000);
      defaults.put(IntentAction.EXPLAIN, 4000);
      defaults.put(IntentAction.RENAME, 3000);
      defaults.put(IntentAction.TWEAK, 5000);
      return defaults;
    }

    public int tokensFor(IntentAction action) {
      return tokens.getOrDefault(action, tokens.get(IntentAction.MODIFY));
    }

    public Map<IntentAction, Integer> getTokens() {
      return tokens;
    }

    public int getReservedTokens() {
      return reservedTokens;
    }

    public void setReservedTokens(int reservedTokens) {
      this.reservedTokens = reservedTokens;
    }

    public int getCharsPerToken() {
      return charsPerToken;
    }

    public void setCharsPerToken(int charsPerToken) {
      this.charsPerToken = charsPerToken;
    }

    public int getOverheadTokens() {
      return overheadTokens;
    }

    public void setOverheadTokens(int overheadTokens) {
      this.overheadTokens = overheadTokens;
    }

    public int getTaskContextEstimate() {
      return taskContextEstimate;
    }

    public void setTaskContextEstimate(int taskContextEstimate) {
      this.taskContextEstimate = taskContextEstimate;
    }

    public double getOutlineRecommendationFactor() {
      return outlineRecommendationFactor;
    }

    public void setOutlineRecommendationFactor(double outlineRecommendationFactor) {
      this.outlineRecommendationFactor = outlineRecommendationFactor;
    }
  }

  public static class Selection {
    private int maxFiles = 8;
    private int maxFilesDebug = 5;
    private int maxFilesExplain = 2;
    private String mainFile = "/src/pages/Index.tsx";
    private List<String> mustIncludeFiles =
        new ArrayList<>(List.of("/src/pages/Index.tsx", "/src/pages/GameplayPage.tsx"));
    private int mustIncludeCap = 3;
    private double highConfidenceScore = 0.9;
    private int largeFileLines = 150;

    public int getMaxFiles() {
      return maxFiles;
    }

    public void setMaxFiles(int maxFiles) {
      this.maxFiles = maxFiles;
    }

    public int getMaxFilesDebug() {
      return maxFilesDebug;
    }

    public void setMaxFilesDebug(int maxFilesDebug) {
      this.maxFilesDebug = maxFilesDebug;
    }

    public int getMaxFilesExplain() {
      return maxFilesExplain;
    }

    public void setMaxFilesExplain(int maxFilesExplain) {
      this.maxFilesExplain = maxFilesExplain;
    }

    public String getMainFile() {
      return mainFile;
    }

    public void setMainFile(String mainFile) {
      this.mainFile = mainFile;
    }

    public List<String> getMustIncludeFiles() {
      return mustIncludeFiles;
    }

    public void setMustIncludeFiles(List<String> mustIncludeFiles) {
      this.mustIncludeFiles =
          mustIncludeFiles != null ? new ArrayList<>(mustIncludeFiles) : new ArrayList<>();
    }

    public int getMustIncludeCap() {
      return mustIncludeCap;
    }

    public void setMustIncludeCap(int mustIncludeCap) {
      this.mustIncludeCap = mustIncludeCap;
    }

    public double getHighConfidenceScore() {
      return highConfidenceScore;
    }

    public void setHighConfidenceScore(double highConfidenceScore) {
      this.highConfidenceScore = highConfidenceScore;
    }

    public int getLargeFileLines() {
      return largeFileLines;
    }

    public void setLargeFileLines(int largeFileLines) {
      this.largeFileLines = largeFileLines;
    }
  }

  public static class Outline {
    private int thresholdLines = 50;
    private List<String> alwaysFull =
        new ArrayList<>(
            List.of("package.json", "tsconfig.json", "tailwind.config.ts", "vite.config.ts"));
    private List<String> skippedImports =
        new ArrayList<>(List.of("react", "react-dom", "@/lib/utils"));
    private int maxImports = 5;
    private int maxImportNames = 3;
    private int maxFunctions = 8;

    public int getThresholdLines() {
      return thresholdLines;
    }

    public void setThresholdLines(int thresholdLines) {
      this.thresholdLines = thresholdLines;
    }

    public List<String> getAlwaysFull() {
      return alwaysFull;
    }

    public void setAlwaysFull(List<String> alwaysFull) {
      this.alwaysFull = alwaysFull != null ? new ArrayList<>(alwaysFull) : new ArrayList<>();
    }

    public List<String> getSkippedImports() {
      return skippedImports;
    }

    public void setSkippedImports(List<String> skippedImports) {
      this.skippedImports =
          skippedImports != null ? new ArrayList<>(skippedImports) : new ArrayList<>();
    }

    public int getMaxImports() {
      return maxImports;
    }

    public void setMaxImports(int maxImports) {
      this.maxImports = maxImports;
    }

    public int getMaxImportNames() {
      return maxImportNames;
    }

    public void setMaxImportNames(int maxImportNames) {
      this.maxImportNames = maxImportNames;
    }

    public int getMaxFunctions() {
      return maxFunctions;
    }

    public void setMaxFunctions(int maxFunctions) {
      this.maxFunctions = maxFunctions;
    }
  }

  public static class Hybrid {
    private boolean enabled = false;
    private double similarityThreshold = 0.4;
    private int limit = 10;
    private double semanticWeight = 0.4;
    private double keywordWeight = 0.2;
    private double recencyWeight = 0.25;
    private double importanceWeight = 0.15;
    private double keywordContentBoost = 0.1;
    private double keywordSymbolBoost = 0.2;

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public double getSimilarityThreshold() {
      return similarityThreshold;
    }

    public void setSimilarityThreshold(double similarityThreshold) {
      this.similarityThreshold = similarityThreshold;
    }

    public int getLimit() {
      return limit;
    }

    public void setLimit(int limit) {
      this.limit = limit;
    }

    public double getSemanticWeight() {
      return semanticWeight;
    }

    public void setSemanticWeight(double semanticWeight) {
      this.semanticWeight = semanticWeight;
    }

    public double getKeywordWeight() {
      return keywordWeight;
    }

    public void setKeywordWeight(double keywordWeight) {
      this.keywordWeight = keywordWeight;
    }

    public double getRecencyWeight() {
      return recencyWeight;
    }

    public void setRecencyWeight(double recencyWeight) {
      this.recencyWeight = recencyWeight;
    }

    public double getImportanceWeight() {
      return importanceWeight;
    }

    public void setImportanceWeight(double importanceWeight) {
      this.importanceWeight = importanceWeight;
    }

    public double getKeywordContentBoost() {
      return keywordContentBoost;
    }

    public void setKeywordContentBoost(double keywordContentBoost) {
      this.keywordContentBoost = keywordContentBoost;
    }

    public double getKeywordSymbolBoost() {
      return keywordSymbolBoost;
    }

    public void setKeywordSymbolBoost(double keywordSymbolBoost) {
      this.keywordSymbolBoost = keywordSymbolBoost;
    }
  }

  public static class Adaptive {
    private boolean enabled = true;
    private int minOutcomes = 10;
    private int sampleLimit = 100;
    private double successThreshold = 0.7;
    private double highAccuracy = 0.8;
    private double missRateThreshold = 0.3;
    private double lowAccuracy = 0.3;
    private Duration cacheTtl = Duration.ofMinutes(5);

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public int getMinOutcomes() {
      return minOutcomes;
    }

    public void setMinOutcomes(int minOutcomes) {
      this.minOutcomes = minOutcomes;
    }

    public int getSampleLimit() {
      return sampleLimit;
    }

    public void setSampleLimit(int sampleLimit) {
      this.sampleLimit = sampleLimit;
    }

    public double getSuccessThreshold() {
      return successThreshold;
    }

    public void setSuccessThreshold(double successThreshold) {
      this.successThreshold = successThreshold;
    }

    public double getHighAccuracy() {
      return highAccuracy;
    }

    public void setHighAccuracy(double highAccuracy) {
      this.highAccuracy = highAccuracy;
    }

    public double getMissRateThreshold() {
      return missRateThreshold;
    }

    public void setMissRateThreshold(double missRateThreshold) {
      this.missRateThreshold = missRateThreshold;
    }

    public double getLowAccuracy() {
      return lowAccuracy;
    }

    public void setLowAccuracy(double lowAccuracy) {
      this.lowAccuracy = lowAccuracy;
    }

    public Duration getCacheTtl() {
      return cacheTtl;
    }

    public void setCacheTtl(Duration cacheTtl) {
      this.cacheTtl = cacheTtl;
    }
  }

  public static class Conversation {
    private int recentMessages = 5;
    private int recentMessagesExplain = 3;
    private int recentMessagesMinimal = 2;
    private int taskDeltas = 3;
    private int messagesPerSummary = 10;
    private int recentToKeep = 5;

    public int getRecentMessages() {
      return recentMessages;
    }

    public void setRecentMessages(int recentMessages) {
      this.recentMessages = recentMessages;
    }

    public int getRecentMessagesExplain() {
      return recentMessagesExplain;
    }

    public void setRecentMessagesExplain(int recentMessagesExplain) {
      this.recentMessagesExplain = recentMessagesExplain;
    }

    public int getRecentMessagesMinimal() {
      return recentMessagesMinimal;
    }

    public void setRecentMessagesMinimal(int recentMessagesMinimal) {
      this.recentMessagesMinimal = recentMessagesMinimal;
    }

    public int getTaskDeltas() {
      return taskDeltas;
    }

    public void setTaskDeltas(int taskDeltas) {
      this.taskDeltas = taskDeltas;
    }

    public int getMessagesPerSummary() {
      return messagesPerSummary;
    }

    public void setMessagesPerSummary(int messagesPerSummary) {
      this.messagesPerSummary = messagesPerSummary;
    }

    public int getRecentToKeep() {
      return recentToKeep;
    }

    public void setRecentToKeep(int recentToKeep) {
      this.recentToKeep = recentToKeep;
    }
  }

  public static class Tracking {
    private Duration debounce = Duration.ofMillis(500);
    private int maxBatchSize = 10;

    public Duration getDebounce() {
      return debounce;
    }

    public void setDebounce(Duration debounce) {
      this.debounce = debounce;
    }

    public int getMaxBatchSize() {
      return maxBatchSize;
    }

    public void setMaxBatchSize(int maxBatchSize) {
      this.maxBatchSize = maxBatchSize;
    }
  }

  public static class Embedding {
    private boolean enabled = false;
    private Duration queryCacheTtl = Duration.ofMinutes(30);
    private int queryCacheSize = 100;
    private int minChunkLines = 5;
    private int maxChunkLines = 200;
    private int overlapLines = 5;

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public Duration getQueryCacheTtl() {
      return queryCacheTtl;
    }

    public void setQueryCacheTtl(Duration queryCacheTtl) {
      this.queryCacheTtl = queryCacheTtl;
    }

    public int getQueryCacheSize() {
      return queryCacheSize;
    }

    public void setQueryCacheSize(int queryCacheSize) {
      this.queryCacheSize = queryCacheSize;
    }

    public int getMinChunkLines() {
      return minChunkLines;
    }

    public void setMinChunkLines(int minChunkLines) {
      this.minChunkLines = minChunkLines;
    }

    public int getMaxChunkLines() {
      return maxChunkLines;
    }

    public void setMaxChunkLines(int maxChunkLines) {
      this.maxChunkLines = maxChunkLines;
    }

    public int getOverlapLines() {
      return overlapLines;
    }

    public void setOverlapLines(int overlapLines) {
      this.overlapLines = overlapLines;
    }
  }
}
