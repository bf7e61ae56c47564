package batchflow.engine.api.v1.dto;

import batchflow.engine.model.JobPriority;
import batchflow.engine.model.JobSpec;
import batchflow.engine.model.RetryPolicy;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Request DTO for creating a new job.
 * POST /api/v1/jobs
 */
public record CreateJobRequest(
        @JsonProperty("taskName") String taskName,
        @JsonProperty("name") String name,
        @JsonProperty("args") Map<String, Object> args,
        @JsonProperty("priority") String priority,
        @JsonProperty("dependencies") List<String> dependencies,
        @JsonProperty("tags") List<String> tags,
        @JsonProperty("metadata") Map<String, Object> metadata,
        @JsonProperty("maxAttempts") Integer maxAttempts,
        @JsonProperty("timeoutMs") Long timeoutMs,
        @JsonProperty("groupId") String groupId,
        @JsonProperty("submit") Boolean submit) {

    /** Validate the request */
    public void validate() {
        if (taskName == null || taskName.isBlank()) {
            throw new IllegalArgumentException("taskName is required");
        }
        JobPriority.parse(priority);
        if (maxAttempts != null && maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (timeoutMs != null && timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be positive");
        }
        if (dependencies != null && dependencies.stream().anyMatch(d -> d == null || d.isBlank())) {
            throw new IllegalArgumentException("dependencies must not contain blank ids");
        }
    }

    /** Submit right after creation; defaults to true. */
    public boolean submitNow() {
        return submit == null || submit;
    }

    /**
     * Build the job spec. {@code maxAttempts} overrides only the attempt count
     * of the engine's default retry policy.
     */
    public JobSpec toSpec(RetryPolicy defaultPolicy) {
        return JobSpec.forTask(taskName)
                .name(name)
                .args(args)
                .priority(JobPriority.parse(priority))
                .dependencies(dependencies)
                .tags(tags)
                .metadata(metadata)
                .retryPolicy(maxAttempts != null ? defaultPolicy.withMaxAttempts(maxAttempts) : null)
                .timeout(timeoutMs != null ? Duration.ofMillis(timeoutMs) : null)
                .groupId(groupId)
                .build();
    }
}
