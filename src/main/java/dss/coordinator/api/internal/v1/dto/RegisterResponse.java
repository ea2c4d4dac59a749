package dss.coordinator.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response DTO for simulator registration.
 * POST /internal/v1/simulators/register
 */
public record RegisterResponse(
        @JsonProperty("simulatorId") String simulatorId,
        @JsonProperty("coordinatorVersion") String coordinatorVersion) {
    public static final String VERSION = "0.3.0";

    public static RegisterResponse create(String simulatorId) {
        return new RegisterResponse(simulatorId, VERSION);
    }
}
