package batchflow.engine.scheduler;

import batchflow.engine.model.Job;
import batchflow.engine.model.JobError;
import batchflow.engine.model.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Decides, when an attempt fails, between re-queueing with backoff and failing
 * the job for good. Attempts are counted when they start, so a job reaching
 * this point has {@code attempts >= 1}.
 */
public class RetryCoordinator {

    private static final Logger log = LoggerFactory.getLogger(RetryCoordinator.class);

    /**
     * Outcome of {@link #decide}.
     *
     * @param retry true to re-queue
     * @param delay backoff before the next attempt (zero when failing)
     */
    public record Decision(boolean retry, Duration delay) {

        public static Decision retryAfter(Duration delay) {
            return new Decision(true, delay);
        }

        public static Decision fail() {
            return new Decision(false, Duration.ZERO);
        }
    }

    public Decision decide(Job job, JobError error) {
        if (!error.kind().retryable()) {
            log.debug("Job {} failed with non-retryable {}", job.id(), error.kind());
            return Decision.fail();
        }
        if (!job.canRetry()) {
            log.debug("Job {} exhausted {} attempts", job.id(), job.attempts());
            return Decision.fail();
        }
        return Decision.retryAfter(backoff(job.retryPolicy(), job.attempts()));
    }

    /**
     * Delay after the given number of failed attempts:
     * {@code baseDelay * multiplier^(attempts - 1)}, capped at {@code maxDelay}.
     */
    public Duration backoff(RetryPolicy policy, int attempts) {
        int exponent = Math.max(0, attempts - 1);
        double millis = policy.baseDelay().toMillis() * Math.pow(policy.multiplier(), exponent);
        long capped = (long) Math.min(millis, (double) policy.maxDelay().toMillis());
        return Duration.ofMillis(capped);
    }
}
