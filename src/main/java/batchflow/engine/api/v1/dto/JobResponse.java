package batchflow.engine.api.v1.dto;

import batchflow.engine.model.Job;
import batchflow.engine.model.JobError;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Response DTO for job details.
 * GET /api/v1/jobs/{jobId}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobResponse(
        @JsonProperty("jobId") String jobId,
        @JsonProperty("name") String name,
        @JsonProperty("taskName") String taskName,
        @JsonProperty("status") String status,
        @JsonProperty("priority") String priority,
        @JsonProperty("attempts") int attempts,
        @JsonProperty("maxAttempts") int maxAttempts,
        @JsonProperty("dependencies") List<String> dependencies,
        @JsonProperty("tags") List<String> tags,
        @JsonProperty("metadata") Map<String, Object> metadata,
        @JsonProperty("groupId") String groupId,
        @JsonProperty("progress") double progress,
        @JsonProperty("progressMessage") String progressMessage,
        @JsonProperty("result") Object result,
        @JsonProperty("error") ErrorBody error,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("startedAt") Instant startedAt,
        @JsonProperty("finishedAt") Instant finishedAt,
        @JsonProperty("nextAttemptAt") Instant nextAttemptAt) {

    public record ErrorBody(
            @JsonProperty("kind") String kind,
            @JsonProperty("message") String message,
            @JsonProperty("exceptionType") String exceptionType) {

        static ErrorBody from(JobError error) {
            return error == null ? null
                    : new ErrorBody(error.kind().name(), error.message(), error.exceptionType());
        }
    }

    /** Create response from domain model */
    public static JobResponse from(Job job) {
        return new JobResponse(
                job.id(),
                job.name(),
                job.taskName(),
                job.status().name(),
                job.priority().name(),
                job.attempts(),
                job.retryPolicy().maxAttempts(),
                job.dependencies(),
                job.tags(),
                job.metadata().isEmpty() ? null : job.metadata(),
                job.groupId(),
                job.progress(),
                job.progressMessage(),
                job.result(),
                ErrorBody.from(job.error()),
                job.createdAt(),
                job.startedAt(),
                job.finishedAt(),
                job.nextAttemptAt());
    }

    /** Compact version for list responses */
    public JobResponse compact() {
        return new JobResponse(jobId, name, taskName, status, priority, attempts, maxAttempts,
                null, null, null, groupId, progress, null, null, error, createdAt, startedAt, finishedAt, null);
    }
}
