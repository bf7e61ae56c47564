package batchflow.engine.model;

/**
 * Result of reporting the end of an execution attempt.
 */
public enum AttemptOutcome {
    /** Job completed successfully */
    COMPLETED,

    /** Job failed and was re-queued with a backoff delay */
    RETRY_SCHEDULED,

    /** Job failed permanently */
    FAILED,

    /** Job was canceled while running */
    CANCELED,

    /** Report ignored: the attempt is no longer the current one (timed out, or job gone) */
    STALE
}
