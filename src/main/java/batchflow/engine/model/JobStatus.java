package batchflow.engine.model;

/**
 * Job lifecycle state.
 */
public enum JobStatus {
    /** Job created, not submitted yet */
    CREATED,
    /** Job submitted and eligible once a worker is free (or its backoff elapses) */
    QUEUED,
    /** Job submitted but blocked on dependencies or an earlier member of a sequential group */
    WAITING,
    /** Job being executed by a worker */
    RUNNING,
    /** Job held back from execution until resumed */
    PAUSED,
    /** Job finished successfully */
    COMPLETED,
    /** Job failed permanently */
    FAILED,
    /** Job canceled by request or by failure propagation */
    CANCELED;

    /** Completed, Failed and Canceled accept no further transitions. */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELED;
    }

    /** Queued or Waiting: held by the scheduler. */
    public boolean isPending() {
        return this == QUEUED || this == WAITING;
    }

    /**
     * Parse a status name, case-insensitive.
     *
     * @throws IllegalArgumentException for unknown names
     */
    public static JobStatus parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("status is required");
        }
        try {
            return valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown job status: " + value);
        }
    }
}
