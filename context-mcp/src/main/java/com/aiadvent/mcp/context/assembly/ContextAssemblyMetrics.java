package com.aiadvent.mcp.context.assembly;

import com.aiadvent.mcp.context.budget.ContextMode;
import com.aiadvent.mcp.context.intent.IntentAction;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

@Component
public class ContextAssemblyMetrics {

  static final String REQUESTS = "context.assembly.requests";
  static final String DEGRADED = "context.assembly.degraded";
  static final String TOKENS = "context.assembly.tokens";
  static final String FILES = "context.assembly.files";

  private final MeterRegistry meterRegistry;

  public ContextAssemblyMetrics(@Nullable MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry != null ? meterRegistry : new SimpleMeterRegistry();
  }

  public void recordPackage(ContextMode mode, IntentAction intent, int tokens, int files) {
    Counter.builder(REQUESTS)
        .tag("mode", mode.id())
        .tag("intent", intent.id())
        .register(meterRegistry)
        .increment();
    DistributionSummary.builder(TOKENS)
        .tag("mode", mode.id())
        .register(meterRegistry)
        .record(tokens);
    DistributionSummary.builder(FILES)
        .tag("mode", mode.id())
        .register(meterRegistry)
        .record(files);
  }

  public void recordDegraded(String section) {
    Counter.builder(DEGRADED).tag("section", section).register(meterRegistry).increment();
  }
}
