package dss.coordinator.model;

/**
 * A simulation waiting to be claimed.
 *
 * @param simulationId the queued simulation
 * @param priority     higher is claimed first
 * @param seq          store-wide insertion order, breaks priority ties
 */
public record QueueEntry(String simulationId, int priority, long seq) {
}
