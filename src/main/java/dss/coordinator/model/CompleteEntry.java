package dss.coordinator.model;

import java.time.Instant;

/**
 * Record of a finished run: who ran the simulation and when it finished.
 */
public record CompleteEntry(String simulatorId, String simulationId, Instant finishedAt) {
}
