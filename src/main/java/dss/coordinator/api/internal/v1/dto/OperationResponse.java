package dss.coordinator.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Generic response for internal API operations.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OperationResponse(
        @JsonProperty("ok") boolean ok,
        @JsonProperty("error") String error,
        @JsonProperty("priority") Integer priority) {

    public static OperationResponse success() {
        return new OperationResponse(true, null, null);
    }

    /** Success after a requeue, with the priority it was queued at */
    public static OperationResponse requeued(int priority) {
        return new OperationResponse(true, null, priority);
    }

    public static OperationResponse error(String error) {
        return new OperationResponse(false, error, null);
    }
}
