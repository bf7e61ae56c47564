package batchflow.engine.api.v1.dto;

import batchflow.engine.model.GroupStatus;
import batchflow.engine.model.JobGroup;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Response DTO for group details.
 * GET /api/v1/groups/{groupId}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GroupResponse(
        @JsonProperty("groupId") String groupId,
        @JsonProperty("name") String name,
        @JsonProperty("state") String state,
        @JsonProperty("sequential") boolean sequential,
        @JsonProperty("cancelOnFailure") boolean cancelOnFailure,
        @JsonProperty("members") List<String> members,
        @JsonProperty("metadata") Map<String, Object> metadata,
        @JsonProperty("total") int total,
        @JsonProperty("completed") int completed,
        @JsonProperty("failed") int failed,
        @JsonProperty("canceled") int canceled,
        @JsonProperty("running") int running,
        @JsonProperty("progress") double progress) {

    public static GroupResponse from(JobGroup group, GroupStatus status) {
        return new GroupResponse(
                group.id(),
                group.name(),
                status.state().name(),
                group.sequential(),
                group.cancelOnFailure(),
                group.memberIds(),
                group.metadata().isEmpty() ? null : group.metadata(),
                status.total(),
                status.completed(),
                status.failed(),
                status.canceled(),
                status.running(),
                status.progress());
    }
}
