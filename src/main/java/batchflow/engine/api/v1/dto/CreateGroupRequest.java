package batchflow.engine.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request DTO for creating a job group.
 * POST /api/v1/groups
 */
public record CreateGroupRequest(
        @JsonProperty("name") String name,
        @JsonProperty("sequential") boolean sequential,
        @JsonProperty("cancelOnFailure") boolean cancelOnFailure) {

    public void validate() {
        if (name != null && name.length() > 200) {
            throw new IllegalArgumentException("name must be at most 200 characters");
        }
    }
}
