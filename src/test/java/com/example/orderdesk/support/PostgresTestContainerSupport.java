package com.example.orderdesk.support;

import org.junit.jupiter.api.condition.EnabledIfSystemProperty;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

/**
 * Workflow fixtures on PostgreSQL. The work code and single-assignee constraints are only
 * trustworthy once the production dialect enforces them.
 *
 * Requires Docker. Opt in with {@code -Dtestcontainers.enabled=true}.
 */
@Testcontainers
@EnabledIfSystemProperty(named = "testcontainers.enabled", matches = "true")
public abstract class PostgresTestContainerSupport extends WorkflowTestSupport {

    @Container
    protected static final PostgreSQLContainer<?> orderDeskDb = new PostgreSQLContainer<>("postgres:16-alpine")
            .withDatabaseName("orderdesk")
            .withUsername("orderdesk")
            .withPassword("orderdesk")
            .withCommand("postgres", "-c", "max_connections=50", "-c", "lock_timeout=10000");

    @DynamicPropertySource
    static void useContainerDatabase(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", orderDeskDb::getJdbcUrl);
        registry.add("spring.datasource.username", orderDeskDb::getUsername);
        registry.add("spring.datasource.password", orderDeskDb::getPassword);
        registry.add("spring.datasource.driver-class-name", orderDeskDb::getDriverClassName);
        registry.add("spring.jpa.properties.hibernate.dialect", () -> "org.hibernate.dialect.PostgreSQLDialect");
    }
}
