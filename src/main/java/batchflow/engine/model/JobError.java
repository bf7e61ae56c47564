package batchflow.engine.model;

import java.util.Objects;

/**
 * Error captured on a job that ended Failed or Canceled.
 *
 * @param kind          failure classification
 * @param message       human readable message
 * @param exceptionType class name of the raised exception, if any
 */
public record JobError(ErrorKind kind, String message, String exceptionType) {

    public JobError {
        Objects.requireNonNull(kind, "kind is required");
    }

    public static JobError of(ErrorKind kind, String message) {
        return new JobError(kind, message, null);
    }

    public static JobError from(ErrorKind kind, Throwable t) {
        String message = t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
        return new JobError(kind, message, t.getClass().getName());
    }

    @Override
    public String toString() {
        return kind + ": " + message;
    }
}
