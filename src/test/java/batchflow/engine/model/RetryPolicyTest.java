package batchflow.engine.model;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class RetryPolicyTest {

    @Test
    void defaults() {
        RetryPolicy policy = RetryPolicy.defaults();

        assertEquals(3, policy.maxAttempts());
        assertEquals(Duration.ofSeconds(1), policy.baseDelay());
        assertEquals(2.0, policy.multiplier());
        assertEquals(Duration.ofSeconds(60), policy.maxDelay());
    }

    @Test
    void noRetryAllowsSingleAttempt() {
        assertEquals(1, RetryPolicy.noRetry().maxAttempts());
    }

    @Test
    void rejectsInvalidValues() {
        assertThrows(IllegalArgumentException.class,
                () -> new RetryPolicy(0, Duration.ZERO, 2.0, Duration.ZERO));
        assertThrows(IllegalArgumentException.class,
                () -> new RetryPolicy(3, Duration.ZERO, 0.5, Duration.ZERO));
    }

    @Test
    void withersKeepOtherFields() {
        RetryPolicy policy = RetryPolicy.defaults().withMaxAttempts(5).withBaseDelay(Duration.ofMillis(10));

        assertEquals(5, policy.maxAttempts());
        assertEquals(Duration.ofMillis(10), policy.baseDelay());
        assertEquals(2.0, policy.multiplier());
    }
}
