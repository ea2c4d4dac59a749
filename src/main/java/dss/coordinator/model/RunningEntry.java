package dss.coordinator.model;

import java.time.Instant;

/**
 * Binding of a claimed simulation to the simulator executing it.
 *
 * @param priority the queue priority the simulation had when it was claimed
 */
public record RunningEntry(String simulatorId, String simulationId, int priority, Instant startedAt) {
}
