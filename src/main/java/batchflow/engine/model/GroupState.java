package batchflow.engine.model;

/**
 * Derived state of a job group.
 */
public enum GroupState {
    /** No members yet */
    EMPTY,
    /** At least one member is not terminal */
    RUNNING,
    /** Every member completed */
    COMPLETED,
    /** At least one member failed */
    FAILED,
    /** Group canceled explicitly, or all members terminal with some canceled */
    CANCELED;

    /** A resolved group no longer changes and is not reloaded on restart. */
    public boolean isResolved() {
        return this == COMPLETED || this == FAILED || this == CANCELED;
    }
}
