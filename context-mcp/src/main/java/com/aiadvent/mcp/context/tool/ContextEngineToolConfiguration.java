package com.aiadvent.mcp.context.tool;

import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.ai.tool.method.MethodToolCallbackProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
class ContextEngineToolConfiguration {

  @Bean
  ToolCallbackProvider contextEngineToolCallbackProvider(ContextEngineTools contextEngineTools) {
    return MethodToolCallbackProvider.builder().toolObjects(contextEngineTools).build();
  }
}
