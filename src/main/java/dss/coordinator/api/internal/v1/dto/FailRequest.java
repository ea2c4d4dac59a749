package dss.coordinator.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request DTO for reporting a failed run.
 * POST /internal/v1/simulations/{simulationId}/fail
 *
 * Without {@code priority} the simulation is requeued with its claim
 * priority plus the configured failure boost.
 */
public record FailRequest(
        @JsonProperty("simulatorId") String simulatorId,
        @JsonProperty("error") String error,
        @JsonProperty("priority") Integer priority) {

    public void validate() {
        if (simulatorId == null || simulatorId.isBlank()) {
            throw new IllegalArgumentException("simulatorId is required");
        }
    }

    public static FailRequest of(String simulatorId, String error) {
        return new FailRequest(simulatorId, error, null);
    }
}
