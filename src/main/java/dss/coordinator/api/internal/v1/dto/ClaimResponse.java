package dss.coordinator.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import dss.coordinator.model.Simulation;

/**
 * Response DTO for a claim. {@code simulation} is null when nothing was queued.
 * POST /internal/v1/simulations/claim
 */
public record ClaimResponse(
        @JsonProperty("simulation") ClaimedSimulation simulation) {

    /**
     * Everything a simulator needs to run the claimed simulation.
     */
    public record ClaimedSimulation(
            @JsonProperty("id") String id,
            @JsonProperty("topology") String topology,
            @JsonProperty("destination") int destination,
            @JsonProperty("repetitions") int repetitions,
            @JsonProperty("minDelay") int minDelay,
            @JsonProperty("maxDelay") int maxDelay,
            @JsonProperty("threshold") int threshold,
            @JsonProperty("stubsFile") String stubsFile,
            @JsonProperty("seed") Integer seed,
            @JsonProperty("reportNodes") boolean reportNodes) {

        public static ClaimedSimulation from(Simulation simulation) {
            return new ClaimedSimulation(
                    simulation.id(),
                    simulation.topology(),
                    simulation.destination(),
                    simulation.repetitions(),
                    simulation.minDelay(),
                    simulation.maxDelay(),
                    simulation.threshold(),
                    simulation.stubsFile(),
                    simulation.seed(),
                    simulation.reportNodes());
        }
    }

    public static ClaimResponse from(Simulation simulation) {
        return new ClaimResponse(ClaimedSimulation.from(simulation));
    }

    /** Nothing to claim */
    public static ClaimResponse empty() {
        return new ClaimResponse(null);
    }

    public boolean hasSimulation() {
        return simulation != null;
    }
}
