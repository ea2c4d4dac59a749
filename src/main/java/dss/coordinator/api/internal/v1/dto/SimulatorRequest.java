package dss.coordinator.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import dss.coordinator.model.Simulation;

/**
 * Request DTO carrying only the calling simulator's id.
 * POST /internal/v1/simulators/register
 * POST /internal/v1/simulators/heartbeat
 * POST /internal/v1/simulations/claim
 */
public record SimulatorRequest(
        @JsonProperty("simulatorId") String simulatorId) {

    public void validate() {
        if (simulatorId == null || simulatorId.isBlank()) {
            throw new IllegalArgumentException("simulatorId is required");
        }
        if (simulatorId.length() > Simulation.MAX_ID_LENGTH) {
            throw new IllegalArgumentException(
                    "simulatorId must be at most " + Simulation.MAX_ID_LENGTH + " characters");
        }
    }
}
