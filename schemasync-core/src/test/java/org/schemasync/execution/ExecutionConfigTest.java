package org.schemasync.execution;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.schemasync.database.DatabaseConfig;
import org.schemasync.error.ErrorType;
import org.schemasync.error.SchemaSyncException;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ExecutionConfigTest {

    private static DatabaseConfig db(String name) {
        return DatabaseConfig.builder().host("localhost").username("root").database(name).build();
    }

    @Test
    @DisplayName("fromOptions reads both roles, execution and retry settings")
    void fromOptions() {
        Map<String, String> options = new HashMap<>();
        options.put("schemasync.source.host", "db1");
        options.put("schemasync.source.port", "3307");
        options.put("schemasync.source.username", "app");
        options.put("schemasync.source.password", "secret");
        options.put("schemasync.source.database", "app_dev");
        options.put("schemasync.target.url", "jdbc:mysql://db2:3306/app_prod");
        options.put("schemasync.target.username", "deploy");
        options.put("schemasync.target.database", "app_prod");
        options.put("schemasync.target.timeoutSeconds", "5");
        options.put("schemasync.execution.dryRun", "true");
        options.put("schemasync.execution.timeoutSeconds", "120");
        options.put("schemasync.retry.maxAttempts", "5");
        options.put("schemasync.retry.baseDelayMillis", "250");

        ExecutionConfig config = ExecutionConfig.fromOptions(options);

        assertEquals("db1", config.getSource().getHost());
        assertEquals(3307, config.getSource().getPort());
        assertEquals("secret", config.getSource().getPassword());
        assertEquals("jdbc:mysql://db2:3306/app_prod", config.getTarget().jdbcUrl());
        assertEquals(Duration.ofSeconds(5), config.getTarget().getTimeout());
        assertEquals(Duration.ofSeconds(30), config.getSource().getTimeout());
        assertTrue(config.isDryRun());
        assertEquals(Duration.ofSeconds(120), config.getTimeout());
        assertEquals(5, config.getRetry().getMaxAttempts());
        assertEquals(Duration.ofMillis(250), config.getRetry().getBaseDelay());
        assertEquals(Duration.ofSeconds(30), config.getRetry().getMaxDelay());
        assertDoesNotThrow(config::validate);
    }

    @Test
    @DisplayName("Unparseable numbers are validation errors naming the option")
    void badNumber() {
        SchemaSyncException ex = assertThrows(SchemaSyncException.class,
                () -> ExecutionConfig.fromOptions(Map.of("schemasync.source.port", "abc")));

        assertEquals(ErrorType.VALIDATION, ex.getType());
        assertEquals("invalid value for schemasync.source.port: abc", ex.getMessage());
        assertEquals("schemasync.source.port", ex.getContext().get("option"));
    }

    @Test
    @DisplayName("Missing roles are rejected")
    void missingRole() {
        SchemaSyncException ex = assertThrows(SchemaSyncException.class,
                () -> ExecutionConfig.builder().source(db("a")).build().validate());

        assertEquals("target database configuration is required", ex.getMessage());
    }

    @Test
    @DisplayName("Role errors name the offending role")
    void invalidRole() {
        ExecutionConfig config = ExecutionConfig.builder()
                .source(db("a"))
                .target(DatabaseConfig.builder().host("localhost").database("b").build())
                .build();

        SchemaSyncException ex = assertThrows(SchemaSyncException.class, config::validate);

        assertEquals(ErrorType.VALIDATION, ex.getType());
        assertTrue(ex.getMessage().startsWith("invalid target database configuration: "));
        assertTrue(ex.getMessage().contains("username is required"));
        assertEquals("target", ex.getContext().get("role"));
    }

    @Test
    @DisplayName("Retry and timeout bounds")
    void bounds() {
        ExecutionConfig base = ExecutionConfig.builder().source(db("a")).target(db("b")).build();

        assertEquals(Duration.ZERO, base.getTimeout());
        assertEquals(RetryConfig.defaults(), base.getRetry());
        assertThrows(SchemaSyncException.class,
                () -> base.toBuilder().retry(RetryConfig.builder().maxAttempts(0).build()).build().validate());
        assertThrows(SchemaSyncException.class,
                () -> base.toBuilder().timeout(Duration.ofSeconds(-1)).build().validate());
    }
}
