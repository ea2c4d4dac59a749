package dss.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import dss.coordinator.model.Simulation;

/**
 * Request DTO for queueing one simulation.
 * POST /api/v1/simulations
 *
 * Omitted run parameters take the generator defaults; an omitted id gets a
 * random one; an omitted priority takes the configured default.
 */
public record EnqueueRequest(
        @JsonProperty("id") String id,
        @JsonProperty("topology") String topology,
        @JsonProperty("destination") Integer destination,
        @JsonProperty("repetitions") Integer repetitions,
        @JsonProperty("minDelay") Integer minDelay,
        @JsonProperty("maxDelay") Integer maxDelay,
        @JsonProperty("threshold") Integer threshold,
        @JsonProperty("stubsFile") String stubsFile,
        @JsonProperty("seed") Integer seed,
        @JsonProperty("reportNodes") Boolean reportNodes,
        @JsonProperty("priority") Integer priority) {

    public void validate() {
        if (topology == null || topology.isBlank()) {
            throw new IllegalArgumentException("topology is required");
        }
        if (stubsFile == null || stubsFile.isBlank()) {
            throw new IllegalArgumentException("stubsFile is required");
        }
        if (destination == null) {
            throw new IllegalArgumentException("destination is required");
        }
        if (destination < 0) {
            throw new IllegalArgumentException("destination must be non-negative");
        }
        if (threshold != null && threshold <= 0) {
            throw new IllegalArgumentException("threshold must be positive");
        }
        if (id != null && id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
        if (id != null && id.length() > Simulation.MAX_ID_LENGTH) {
            throw new IllegalArgumentException("id must be at most " + Simulation.MAX_ID_LENGTH + " characters");
        }
        if (topology.length() > Simulation.MAX_PATH_LENGTH || stubsFile.length() > Simulation.MAX_PATH_LENGTH) {
            throw new IllegalArgumentException(
                    "topology and stubsFile must be at most " + Simulation.MAX_PATH_LENGTH + " characters");
        }
    }

    /**
     * Build the descriptor. Repetition and delay checks happen in the builder.
     */
    public Simulation toSimulation() {
        Simulation.Builder builder = Simulation.builder()
                .id(id != null ? id : Simulation.newId())
                .topology(topology)
                .destination(destination)
                .stubsFile(stubsFile)
                .seed(seed)
                .reportNodes(reportNodes);
        if (repetitions != null)
            builder.repetitions(repetitions);
        if (minDelay != null)
            builder.minDelay(minDelay);
        if (maxDelay != null)
            builder.maxDelay(maxDelay);
        if (threshold != null)
            builder.threshold(threshold);
        return builder.build();
    }
}
