package com.aiadvent.mcp.context;

import org.junit.jupiter.api.Assumptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.testcontainers.DockerClientFactory;
import org.testcontainers.containers.PostgreSQLContainer;

/**
 * Shared PostgreSQL instance for persistence tests. Starts once per test JVM when Docker is
 * available.
 */
public final class PostgresTestContainer {

  private static final Logger log = LoggerFactory.getLogger(PostgresTestContainer.class);

  private static final boolean DOCKER_AVAILABLE = isDockerAvailable();
  private static final PostgreSQLContainer<?> POSTGRES = startContainer();

  private PostgresTestContainer() {}

  public static void assumeDockerAvailable() {
    Assumptions.assumeTrue(
        DOCKER_AVAILABLE, "Docker is required to run Postgres-backed integration tests");
  }

  public static void register(DynamicPropertyRegistry registry) {
    if (!DOCKER_AVAILABLE || POSTGRES == null) {
      throw new IllegalStateException("Docker is required to configure Postgres test container");
    }
    registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
    registry.add("spring.datasource.username", POSTGRES::getUsername);
    registry.add("spring.datasource.password", POSTGRES::getPassword);
    registry.add("spring.datasource.driver-class-name", POSTGRES::getDriverClassName);
    registry.add("spring.jpa.hibernate.ddl-auto", () -> "create-drop");
  }

  private static PostgreSQLContainer<?> startContainer() {
    if (!DOCKER_AVAILABLE) {
      return null;
    }
    PostgreSQLContainer<?> container =
        new PostgreSQLContainer<>("postgres:16-alpine")
            .withDatabaseName("context_engine_test")
            .withUsername("context")
            .withPassword("context");
    container.start();
    return container;
  }

  private static boolean isDockerAvailable() {
    try {
      DockerClientFactory.instance().client();
      return true;
    } catch (Throwable ex) {
      log.warn("Docker is not available for Testcontainers: {}", ex.getMessage());
      return false;
    }
  }
}
