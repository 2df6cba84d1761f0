package com.aiadvent.mcp.context.assembly;

/** Outcome of one optional context section. */
public record EnrichmentResult(Status status, String reason) {

  public static final String DEPENDENCIES = "dependencies";
  public static final String SEMANTIC = "semantic";
  public static final String TASK_CONTEXT = "taskContext";
  public static final String STRUCTURED_PLAN = "structuredPlan";
  public static final String ASSET_MANIFEST = "assetManifest";
  public static final String CONVERSATION = "conversation";
  public static final String PROJECT_MEMORY = "projectMemory";

  public static EnrichmentResult ok() {
    return new EnrichmentResult(Status.OK, null);
  }

  public static EnrichmentResult ok(String reason) {
    return new EnrichmentResult(Status.OK, reason);
  }

  public static EnrichmentResult degraded(String reason) {
    return new EnrichmentResult(Status.DEGRADED, reason);
  }

  public static EnrichmentResult failed(String reason) {
    return new EnrichmentResult(Status.FAILED, reason);
  }

  public boolean isOk() {
    return status == Status.OK;
  }

  public enum Status {
    OK,
    DEGRADED,
    FAILED
  }
}
