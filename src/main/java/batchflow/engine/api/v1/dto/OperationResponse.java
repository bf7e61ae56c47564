package batchflow.engine.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Result of a control operation on a job or group.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OperationResponse(
        @JsonProperty("id") String id,
        @JsonProperty("operation") String operation,
        @JsonProperty("state") String state) {

    public static OperationResponse of(String id, String operation, Enum<?> state) {
        return new OperationResponse(id, operation, state != null ? state.name() : null);
    }
}
