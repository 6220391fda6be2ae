/*
 * Where: Monitor test infrastructure
 * What: Provides a shared Postgres Testcontainer and the DataSource and Flyway settings for it
 * Why: Repository SQL relies on Postgres features such as SKIP LOCKED, partial indexes and jsonb
 */
package com.breachwatch.monitor;

import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;

public abstract class AbstractPostgresContainerTest {

  // One container for the whole test JVM
  static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:16-alpine");

  static {
    // Started eagerly: @DynamicPropertySource may be evaluated before any JUnit extension runs
    POSTGRES.start();
  }

  @DynamicPropertySource
  static void registerProperties(DynamicPropertyRegistry registry) {
    registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
    registry.add("spring.datasource.username", POSTGRES::getUsername);
    registry.add("spring.datasource.password", POSTGRES::getPassword);
    registry.add("spring.datasource.hikari.schema", () -> "monitor");

    registry.add("spring.flyway.enabled", () -> "true");
    registry.add("spring.flyway.locations", () -> "classpath:db/migration");
    registry.add("spring.flyway.default-schema", () -> "monitor");
    registry.add("spring.flyway.schemas", () -> "monitor");
    registry.add("spring.flyway.create-schemas", () -> "true");
    registry.add("spring.flyway.table", () -> "flyway_schema_history_monitor");
  }
}
