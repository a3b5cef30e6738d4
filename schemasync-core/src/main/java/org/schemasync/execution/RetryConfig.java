package org.schemasync.execution;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Exponential backoff settings. The wait after the n-th failed attempt is
 * {@code min(baseDelay * multiplier^(n-1), maxDelay)}.
 */
@Value
@Builder(toBuilder = true)
public class RetryConfig {
    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final Duration DEFAULT_BASE_DELAY = Duration.ofSeconds(1);
    public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(30);
    public static final double DEFAULT_MULTIPLIER = 2.0;

    @Builder.Default int maxAttempts = DEFAULT_MAX_ATTEMPTS;
    @Builder.Default Duration baseDelay = DEFAULT_BASE_DELAY;
    @Builder.Default Duration maxDelay = DEFAULT_MAX_DELAY;
    @Builder.Default double multiplier = DEFAULT_MULTIPLIER;

    public static RetryConfig defaults() {
        return RetryConfig.builder().build();
    }

    /** Single attempt, no waiting. */
    public static RetryConfig noRetry() {
        return RetryConfig.builder().maxAttempts(1).baseDelay(Duration.ZERO).maxDelay(Duration.ZERO).build();
    }

    public Duration delayFor(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be >= 1: " + attempt);
        }
        double millis = baseDelay.toMillis() * Math.pow(multiplier, attempt - 1);
        if (Double.isInfinite(millis) || millis >= maxDelay.toMillis()) {
            return maxDelay;
        }
        return Duration.ofMillis((long) millis);
    }
}
