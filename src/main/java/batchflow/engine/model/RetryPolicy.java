package batchflow.engine.model;

import java.time.Duration;
import java.util.Objects;

/**
 * Retry policy of a job: attempt limit and exponential backoff parameters.
 *
 * @param maxAttempts total executions allowed, the first one included
 * @param baseDelay   delay before the first retry
 * @param multiplier  growth factor applied per further retry
 * @param maxDelay    cap on any single delay
 */
public record RetryPolicy(int maxAttempts, Duration baseDelay, double multiplier, Duration maxDelay) {

    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final Duration DEFAULT_BASE_DELAY = Duration.ofSeconds(1);
    public static final double DEFAULT_MULTIPLIER = 2.0;
    public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(60);

    public RetryPolicy {
        Objects.requireNonNull(baseDelay, "baseDelay is required");
        Objects.requireNonNull(maxDelay, "maxDelay is required");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (baseDelay.isNegative() || maxDelay.isNegative()) {
            throw new IllegalArgumentException("delays must not be negative");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be at least 1.0");
        }
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(DEFAULT_MAX_ATTEMPTS, DEFAULT_BASE_DELAY, DEFAULT_MULTIPLIER, DEFAULT_MAX_DELAY);
    }

    /** Single attempt, never retried. */
    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, Duration.ZERO, 1.0, Duration.ZERO);
    }

    public RetryPolicy withMaxAttempts(int maxAttempts) {
        return new RetryPolicy(maxAttempts, baseDelay, multiplier, maxDelay);
    }

    public RetryPolicy withBaseDelay(Duration baseDelay) {
        return new RetryPolicy(maxAttempts, baseDelay, multiplier, maxDelay);
    }
}
