package dss.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import dss.coordinator.model.CompleteEntry;
import dss.coordinator.model.Simulation;
import dss.coordinator.model.SimulationState;

import java.time.Instant;
import java.util.List;

/**
 * Response DTO for a simulation with its lifecycle state.
 * GET /api/v1/simulations/{simulationId}
 */
public record SimulationResponse(
        @JsonProperty("id") String id,
        @JsonProperty("topology") String topology,
        @JsonProperty("destination") int destination,
        @JsonProperty("repetitions") int repetitions,
        @JsonProperty("minDelay") int minDelay,
        @JsonProperty("maxDelay") int maxDelay,
        @JsonProperty("threshold") int threshold,
        @JsonProperty("stubsFile") String stubsFile,
        @JsonProperty("seed") Integer seed,
        @JsonProperty("reportNodes") boolean reportNodes,
        @JsonProperty("state") SimulationState state,
        @JsonProperty("completions") List<Completion> completions) {

    public record Completion(
            @JsonProperty("simulatorId") String simulatorId,
            @JsonProperty("finishedAt") Instant finishedAt) {

        public static Completion from(CompleteEntry entry) {
            return new Completion(entry.simulatorId(), entry.finishedAt());
        }
    }

    public static SimulationResponse from(Simulation simulation, SimulationState state,
            List<CompleteEntry> completions) {
        return new SimulationResponse(
                simulation.id(),
                simulation.topology(),
                simulation.destination(),
                simulation.repetitions(),
                simulation.minDelay(),
                simulation.maxDelay(),
                simulation.threshold(),
                simulation.stubsFile(),
                simulation.seed(),
                simulation.reportNodes(),
                state,
                completions.stream().map(Completion::from).toList());
    }
}
