package org.schemasync.execution;

import lombok.Builder;
import lombok.Value;
import org.schemasync.database.DatabaseConfig;
import org.schemasync.error.ErrorType;
import org.schemasync.error.SchemaSyncException;
import org.schemasync.options.SchemaSyncOptions.Database;
import org.schemasync.options.SchemaSyncOptions.Execution;
import org.schemasync.options.SchemaSyncOptions.Retry;

import java.time.Duration;
import java.util.Map;

/**
 * Everything one synchronization run needs, passed explicitly to {@link SchemaSyncExecutor}.
 */
@Value
@Builder(toBuilder = true)
public class ExecutionConfig {

    DatabaseConfig source;
    DatabaseConfig target;
    boolean dryRun;
    /** Whole-run deadline; zero means none. */
    @Builder.Default Duration timeout = Duration.ZERO;
    @Builder.Default RetryConfig retry = RetryConfig.defaults();

    /**
     * @throws SchemaSyncException VALIDATION naming the offending role
     */
    public void validate() {
        if (source == null) {
            throw SchemaSyncException.validation("source database configuration is required");
        }
        if (target == null) {
            throw SchemaSyncException.validation("target database configuration is required");
        }
        validateRole("source", source);
        validateRole("target", target);
        if (retry == null || retry.getMaxAttempts() < 1) {
            throw SchemaSyncException.validation("retry maxAttempts must be at least 1");
        }
        if (timeout != null && timeout.isNegative()) {
            throw SchemaSyncException.validation("timeout cannot be negative");
        }
    }

    private static void validateRole(String role, DatabaseConfig config) {
        try {
            config.validate();
        } catch (SchemaSyncException e) {
            throw SchemaSyncException.wrap(e, "invalid " + role + " database configuration: " + e.getMessage())
                    .withContext("role", role);
        }
    }

    /**
     * Builds a config from flattened option keys, as produced by the configuration loader and CLI overrides.
     *
     * @throws SchemaSyncException VALIDATION when a numeric option cannot be parsed
     */
    public static ExecutionConfig fromOptions(Map<String, String> options) {
        RetryConfig defaults = RetryConfig.defaults();
        RetryConfig retry = RetryConfig.builder()
                .maxAttempts(intOption(options, Retry.MAX_ATTEMPTS_KEY, defaults.getMaxAttempts()))
                .baseDelay(Duration.ofMillis(longOption(options, Retry.BASE_DELAY_MILLIS_KEY, defaults.getBaseDelay().toMillis())))
                .maxDelay(Duration.ofMillis(longOption(options, Retry.MAX_DELAY_MILLIS_KEY, defaults.getMaxDelay().toMillis())))
                .multiplier(doubleOption(options, Retry.MULTIPLIER_KEY, defaults.getMultiplier()))
                .build();

        return ExecutionConfig.builder()
                .source(database(options, Database.SOURCE_PREFIX))
                .target(database(options, Database.TARGET_PREFIX))
                .dryRun(Boolean.parseBoolean(options.getOrDefault(Execution.DRY_RUN_KEY, String.valueOf(Execution.DRY_RUN_DEFAULT))))
                .timeout(Duration.ofSeconds(intOption(options, Execution.TIMEOUT_SECONDS_KEY, Execution.TIMEOUT_SECONDS_DEFAULT)))
                .retry(retry)
                .build();
    }

    private static DatabaseConfig database(Map<String, String> options, String prefix) {
        return DatabaseConfig.builder()
                .host(options.get(prefix + Database.HOST))
                .port(intOption(options, prefix + Database.PORT, Database.PORT_DEFAULT))
                .username(options.get(prefix + Database.USERNAME))
                .password(options.get(prefix + Database.PASSWORD))
                .database(options.get(prefix + Database.NAME))
                .url(options.get(prefix + Database.URL))
                .timeout(Duration.ofSeconds(intOption(options, prefix + Database.TIMEOUT_SECONDS, Database.TIMEOUT_SECONDS_DEFAULT)))
                .build();
    }

    private static int intOption(Map<String, String> options, String key, int defaultValue) {
        String value = options.get(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw invalidOption(key, value, e);
        }
    }

    private static long longOption(Map<String, String> options, String key, long defaultValue) {
        String value = options.get(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw invalidOption(key, value, e);
        }
    }

    private static double doubleOption(Map<String, String> options, String key, double defaultValue) {
        String value = options.get(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw invalidOption(key, value, e);
        }
    }

    private static SchemaSyncException invalidOption(String key, String value, NumberFormatException cause) {
        return new SchemaSyncException(ErrorType.VALIDATION,
                "invalid value for " + key + ": " + value, cause)
                .withContext("option", key);
    }
}
