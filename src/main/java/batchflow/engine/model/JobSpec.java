package batchflow.engine.model;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Creation options of a job. Only the task name is mandatory.
 */
public final class JobSpec {
    private final String taskName;
    private final String name;
    private final Map<String, Object> args;
    private final JobPriority priority;
    private final List<String> dependencies;
    private final List<String> tags;
    private final Map<String, Object> metadata;
    private final RetryPolicy retryPolicy; // null = engine default
    private final Duration timeout;
    private final String groupId;

    private JobSpec(Builder builder) {
        this.taskName = builder.taskName;
        this.name = builder.name;
        this.args = builder.args;
        this.priority = builder.priority;
        this.dependencies = List.copyOf(builder.dependencies);
        this.tags = List.copyOf(builder.tags);
        this.metadata = builder.metadata;
        this.retryPolicy = builder.retryPolicy;
        this.timeout = builder.timeout;
        this.groupId = builder.groupId;
    }

    public static Builder forTask(String taskName) {
        return new Builder(taskName);
    }

    public String taskName() {
        return taskName;
    }

    public String name() {
        return name;
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

    public Map<String, Object> metadata() {
        return metadata;
    }

    public RetryPolicy retryPolicy() {
        return retryPolicy;
    }

    public Duration timeout() {
        return timeout;
    }

    public String groupId() {
        return groupId;
    }

    public static final class Builder {
        private final String taskName;
        private String name;
        private final Map<String, Object> args = new LinkedHashMap<>();
        private JobPriority priority = JobPriority.NORMAL;
        private final List<String> dependencies = new ArrayList<>();
        private final List<String> tags = new ArrayList<>();
        private final Map<String, Object> metadata = new LinkedHashMap<>();
        private RetryPolicy retryPolicy;
        private Duration timeout;
        private String groupId;

        private Builder(String taskName) {
            this.taskName = taskName;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder arg(String key, Object value) {
            this.args.put(key, value);
            return this;
        }

        public Builder args(Map<String, Object> args) {
            if (args != null) {
                this.args.putAll(args);
            }
            return this;
        }

        public Builder priority(JobPriority priority) {
            this.priority = Objects.requireNonNull(priority, "priority is required");
            return this;
        }

        public Builder dependsOn(String... jobIds) {
            this.dependencies.addAll(List.of(jobIds));
            return this;
        }

        public Builder dependencies(List<String> jobIds) {
            if (jobIds != null) {
                this.dependencies.addAll(jobIds);
            }
            return this;
        }

        public Builder tag(String tag) {
            this.tags.add(tag);
            return this;
        }

        public Builder tags(List<String> tags) {
            if (tags != null) {
                this.tags.addAll(tags);
            }
            return this;
        }

        public Builder metadata(String key, Object value) {
            this.metadata.put(key, value);
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            if (metadata != null) {
                this.metadata.putAll(metadata);
            }
            return this;
        }

        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            RetryPolicy base = retryPolicy != null ? retryPolicy : RetryPolicy.defaults();
            this.retryPolicy = base.withMaxAttempts(maxAttempts);
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder groupId(String groupId) {
            this.groupId = groupId;
            return this;
        }

        public JobSpec build() {
            if (taskName == null || taskName.isBlank()) {
                throw new IllegalArgumentException("taskName is required");
            }
            if (timeout != null && (timeout.isZero() || timeout.isNegative())) {
                throw new IllegalArgumentException("timeout must be positive");
            }
            return new JobSpec(this);
        }
    }
}
