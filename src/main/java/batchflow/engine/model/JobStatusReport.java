package batchflow.engine.model;

import java.time.Instant;

/**
 * Non-blocking snapshot of a job for progress displays.
 */
public record JobStatusReport(
        String jobId,
        String name,
        JobStatus status,
        int attempts,
        int maxAttempts,
        double progress,
        String progressMessage,
        Instant createdAt,
        Instant startedAt,
        Instant finishedAt,
        Instant nextAttemptAt) {

    public static JobStatusReport from(Job job) {
        return new JobStatusReport(
                job.id(),
                job.name(),
                job.status(),
                job.attempts(),
                job.retryPolicy().maxAttempts(),
                job.progress(),
                job.progressMessage(),
                job.createdAt(),
                job.startedAt(),
                job.finishedAt(),
                job.nextAttemptAt());
    }
}
