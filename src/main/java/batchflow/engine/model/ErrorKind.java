package batchflow.engine.model;

/**
 * Classification of a job failure.
 */
public enum ErrorKind {
    /** Task name not bound in the registry */
    UNKNOWN_TASK(false),
    /** Task body raised */
    TASK_EXECUTION(true),
    /** Task exceeded its time budget */
    TIMEOUT(true),
    /** A dependency or an earlier sequential group member ended Failed or Canceled */
    DEPENDENCY_FAILED(false),
    /** Canceled by request or by a failing group sibling */
    CANCELED(false);

    private final boolean retryable;

    ErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    /** Whether the retry policy applies to this kind of failure. */
    public boolean retryable() {
        return retryable;
    }
}
