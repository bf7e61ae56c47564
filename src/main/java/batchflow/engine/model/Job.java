package batchflow.engine.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable domain model of a unit of work.
 * Every state transition produces a new instance with a higher {@code version}.
 */
public final class Job {
    private final String id;
    private final String name;
    private final String taskName;
    private final Map<String, Object> args;
    private final JobPriority priority;
    private final List<String> dependencies;
    private final List<String> tags;
    private final Map<String, Object> metadata;
    private final JobStatus status;
    private final RetryPolicy retryPolicy;
    private final int attempts;
    private final Duration timeout; // null = no time budget
    private final Object result;
    private final JobError error;
    private final String groupId;
    private final double progress;
    private final String progressMessage;
    private final Instant createdAt;
    private final Instant startedAt;
    private final Instant finishedAt;
    private final Instant nextAttemptAt; // backoff gate, null = immediately
    private final long sequence;
    private final long version;
    private final boolean pauseRequested;
    private final boolean cancelRequested;

    private Job(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.taskName = Objects.requireNonNull(builder.taskName, "taskName is required");
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.priority = Objects.requireNonNull(builder.priority, "priority is required");
        this.retryPolicy = Objects.requireNonNull(builder.retryPolicy, "retryPolicy is required");
        this.name = builder.name != null ? builder.name : builder.taskName;
        this.args = Collections.unmodifiableMap(new LinkedHashMap<>(builder.args));
        this.dependencies = List.copyOf(builder.dependencies);
        this.tags = List.copyOf(builder.tags);
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));
        this.attempts = builder.attempts;
        this.timeout = builder.timeout;
        this.result = builder.result;
        this.error = builder.error;
        this.groupId = builder.groupId;
        this.progress = builder.progress;
        this.progressMessage = builder.progressMessage;
        this.createdAt = builder.createdAt;
        this.startedAt = builder.startedAt;
        this.finishedAt = builder.finishedAt;
        this.nextAttemptAt = builder.nextAttemptAt;
        this.sequence = builder.sequence;
        this.version = builder.version;
        this.pauseRequested = builder.pauseRequested;
        this.cancelRequested = builder.cancelRequested;
    }

    public String id() {
        return id;
    }

    public String name() {
        return name;
    }

    public String taskName() {
        return taskName;
    }

    public Map<String, Object> args() {
        return args;
    }

    public JobPriority priority() {
        return priority;
    }

    public List<String> dependencies() {
        return dependencies;
    }

    public List<String> tags() {
        return tags;
    }

    /** Free-form caller data, not interpreted by the engine. */
    public Map<String, Object> metadata() {
        return metadata;
    }

    public JobStatus status() {
        return status;
    }

    public RetryPolicy retryPolicy() {
        return retryPolicy;
    }

    public int attempts() {
        return attempts;
    }

    public Duration timeout() {
        return timeout;
    }

    public Object result() {
        return result;
    }

    public JobError error() {
        return error;
    }

    public String groupId() {
        return groupId;
    }

    public double progress() {
        return progress;
    }

    public String progressMessage() {
        return progressMessage;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant finishedAt() {
        return finishedAt;
    }

    public Instant nextAttemptAt() {
        return nextAttemptAt;
    }

    public long sequence() {
        return sequence;
    }

    public long version() {
        return version;
    }

    public boolean pauseRequested() {
        return pauseRequested;
    }

    public boolean cancelRequested() {
        return cancelRequested;
    }

    /** Check if another attempt is allowed */
    public boolean canRetry() {
        return attempts < retryPolicy.maxAttempts();
    }

    /** Check if job is in terminal state */
    public boolean isTerminal() {
        return status.isTerminal();
    }

    /** Check if job is held by the scheduler (Queued or Waiting) */
    public boolean isPending() {
        return status.isPending();
    }

    /** Check if the backoff gate of this job has elapsed at {@code now} */
    public boolean isDue(Instant now) {
        return nextAttemptAt == null || !nextAttemptAt.isAfter(now);
    }

    /** Create a builder from this job (for transitions) */
    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .name(name)
                .taskName(taskName)
                .args(args)
                .priority(priority)
                .dependencies(dependencies)
                .tags(tags)
                .metadata(metadata)
                .status(status)
                .retryPolicy(retryPolicy)
                .attempts(attempts)
                .timeout(timeout)
                .result(result)
                .error(error)
                .groupId(groupId)
                .progress(progress)
                .progressMessage(progressMessage)
                .createdAt(createdAt)
                .startedAt(startedAt)
                .finishedAt(finishedAt)
                .nextAttemptAt(nextAttemptAt)
                .sequence(sequence)
                .version(version)
                .pauseRequested(pauseRequested)
                .cancelRequested(cancelRequested);
    }

    /** Builder for the next snapshot: same fields, version bumped. */
    public Builder next() {
        return toBuilder().version(version + 1);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String name;
        private String taskName;
        private Map<String, Object> args = Map.of();
        private JobPriority priority = JobPriority.NORMAL;
        private List<String> dependencies = List.of();
        private List<String> tags = List.of();
        private Map<String, Object> metadata = Map.of();
        private JobStatus status = JobStatus.CREATED;
        private RetryPolicy retryPolicy = RetryPolicy.defaults();
        private int attempts = 0;
        private Duration timeout;
        private Object result;
        private JobError error;
        private String groupId;
        private double progress;
        private String progressMessage;
        private Instant createdAt;
        private Instant startedAt;
        private Instant finishedAt;
        private Instant nextAttemptAt;
        private long sequence;
        private long version;
        private boolean pauseRequested;
        private boolean cancelRequested;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder taskName(String taskName) {
            this.taskName = taskName;
            return this;
        }

        public Builder args(Map<String, Object> args) {
            this.args = args != null ? args : Map.of();
            return this;
        }

        public Builder priority(JobPriority priority) {
            this.priority = priority;
            return this;
        }

        public Builder dependencies(List<String> dependencies) {
            this.dependencies = dependencies != null ? dependencies : List.of();
            return this;
        }

        public Builder tags(List<String> tags) {
            this.tags = tags != null ? tags : List.of();
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            this.metadata = metadata != null ? metadata : Map.of();
            return this;
        }

        public Builder status(JobStatus status) {
            this.status = status;
            return this;
        }

        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        public Builder attempts(int attempts) {
            this.attempts = attempts;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder result(Object result) {
            this.result = result;
            return this;
        }

        public Builder error(JobError error) {
            this.error = error;
            return this;
        }

        public Builder groupId(String groupId) {
            this.groupId = groupId;
            return this;
        }

        public Builder progress(double progress) {
            this.progress = progress;
            return this;
        }

        public Builder progressMessage(String progressMessage) {
            this.progressMessage = progressMessage;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder finishedAt(Instant finishedAt) {
            this.finishedAt = finishedAt;
            return this;
        }

        public Builder nextAttemptAt(Instant nextAttemptAt) {
            this.nextAttemptAt = nextAttemptAt;
            return this;
        }

        public Builder sequence(long sequence) {
            this.sequence = sequence;
            return this;
        }

        public Builder version(long version) {
            this.version = version;
            return this;
        }

        public Builder pauseRequested(boolean pauseRequested) {
            this.pauseRequested = pauseRequested;
            return this;
        }

        public Builder cancelRequested(boolean cancelRequested) {
            this.cancelRequested = cancelRequested;
            return this;
        }

        public Job build() {
            return new Job(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Job job))
            return false;
        return Objects.equals(id, job.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Job{id='" + id + "', task='" + taskName + "', status=" + status + ", attempts=" + attempts + "}";
    }
}
