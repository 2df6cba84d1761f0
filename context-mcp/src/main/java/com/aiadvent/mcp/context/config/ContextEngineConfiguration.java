package com.aiadvent.mcp.context.config;

import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.transaction.annotation.EnableTransactionManagement;

@Configuration
@EnableTransactionManagement
@EnableConfigurationProperties(ContextEngineProperties.class)
@EnableJpaRepositories(
    basePackages = {
      "com.aiadvent.mcp.context.change.persistence",
      "com.aiadvent.mcp.context.memory.persistence",
      "com.aiadvent.mcp.context.retrieval.persistence"
    })
@EntityScan(
    basePackages = {
      "com.aiadvent.mcp.context.change.persistence",
      "com.aiadvent.mcp.context.memory.persistence",
      "com.aiadvent.mcp.context.retrieval.persistence"
    })
public class ContextEngineConfiguration {}
