package org.schemasync.execution;

import lombok.extern.slf4j.Slf4j;
import org.schemasync.error.ErrorClassifier;
import org.schemasync.error.ErrorType;
import org.schemasync.error.SchemaSyncException;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Callable;

/**
 * Runs an operation under a {@link RetryConfig}. Only recoverable failures are retried; cancellation is checked
 * before every attempt and wins over any pending backoff.
 */
@Slf4j
public class RetryHandler {

    @FunctionalInterface
    public interface Action {
        void run() throws Exception;
    }

    private final RetryConfig config;

    public RetryHandler(RetryConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        if (config.getMaxAttempts() < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
    }

    public RetryConfig getConfig() {
        return config;
    }

    public void run(SyncContext context, String operationName, Action action) {
        execute(context, operationName, () -> {
            action.run();
            return null;
        });
    }

    public <T> T execute(SyncContext context, String operationName, Callable<T> operation) {
        Objects.requireNonNull(context, "context must not be null");
        Objects.requireNonNull(operation, "operation must not be null");

        int maxAttempts = config.getMaxAttempts();
        SchemaSyncException last = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            context.checkActive();
            try {
                log.debug("Attempting {}: attempt {}/{}", operationName, attempt, maxAttempts);
                return operation.call();
            } catch (Exception e) {
                SchemaSyncException classified = ErrorClassifier.classify(e);
                if (classified.getType() == ErrorType.INTERRUPTION || !classified.isRecoverable()) {
                    throw classified;
                }
                last = classified;
                if (attempt < maxAttempts) {
                    Duration delay = config.delayFor(attempt);
                    log.warn("Attempt {}/{} failed for {}: {}. Retrying in {}ms...",
                            attempt, maxAttempts, operationName, classified.getMessage(), delay.toMillis());
                    context.await(delay);
                }
            }
        }

        log.error("All {} attempts failed for {}", maxAttempts, operationName);
        throw last.withContext("attempts", maxAttempts);
    }
}
