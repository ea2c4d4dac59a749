package dss.coordinator.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Request DTO for reporting a finished simulation.
 * POST /internal/v1/simulations/{simulationId}/complete
 */
public record CompleteRequest(
        @JsonProperty("simulatorId") String simulatorId,
        @JsonProperty("finishedAt") Instant finishedAt // optional, defaults to receive time
) {
    public void validate() {
        if (simulatorId == null || simulatorId.isBlank()) {
            throw new IllegalArgumentException("simulatorId is required");
        }
    }
}
