package batchflow.engine.task;

import java.util.Map;
import java.util.Objects;

/**
 * What a task body sees of the job it executes: arguments, attempt number,
 * a cancellation token and a progress callback.
 */
public final class TaskContext {

    /**
     * Receives progress updates of the running attempt.
     */
    @FunctionalInterface
    public interface ProgressSink {
        void report(double percent, String message);
    }

    private final String jobId;
    private final String taskName;
    private final int attempt;
    private final Map<String, Object> args;
    private final CancellationToken token;
    private final ProgressSink progressSink;

    public TaskContext(String jobId, String taskName, int attempt, Map<String, Object> args,
            CancellationToken token, ProgressSink progressSink) {
        this.jobId = Objects.requireNonNull(jobId, "jobId is required");
        this.taskName = Objects.requireNonNull(taskName, "taskName is required");
        this.attempt = attempt;
        this.args = args != null ? args : Map.of();
        this.token = token != null ? token : new CancellationToken();
        this.progressSink = progressSink;
    }

    public String jobId() {
        return jobId;
    }

    public String taskName() {
        return taskName;
    }

    /** 1-based number of the current attempt. */
    public int attempt() {
        return attempt;
    }

    public Map<String, Object> args() {
        return args;
    }

    public Object arg(String name) {
        return args.get(name);
    }

    public String stringArg(String name) {
        Object value = args.get(name);
        return value != null ? value.toString() : null;
    }

    public long longArg(String name, long defaultValue) {
        Object value = args.get(name);
        if (value instanceof Number n) {
            return n.longValue();
        }
        if (value instanceof String s && !s.isBlank()) {
            try {
                return Long.parseLong(s.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Argument '" + name + "' is not a number: " + s);
            }
        }
        return defaultValue;
    }

    public CancellationToken cancellationToken() {
        return token;
    }

    public boolean isCancelled() {
        return token.isCancelled();
    }

    public void throwIfCancelled() {
        token.throwIfCancelled();
    }

    /**
     * Report progress of the current attempt. Percent is clamped to [0, 100].
     */
    public void reportProgress(double percent, String message) {
        if (progressSink != null) {
            progressSink.report(Math.max(0.0, Math.min(100.0, percent)), message);
        }
    }
}
