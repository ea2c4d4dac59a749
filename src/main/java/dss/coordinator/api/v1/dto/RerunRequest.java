package dss.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request DTO for re-running a completed simulation.
 * POST /api/v1/simulations/{simulationId}/rerun
 */
public record RerunRequest(
        @JsonProperty("priority") Integer priority) {
}
