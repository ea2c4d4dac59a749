package dss.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import dss.coordinator.model.QueueEntry;

/**
 * One queued simulation, in claim order.
 * GET /api/v1/queue
 */
public record QueueEntryResponse(
        @JsonProperty("simulationId") String simulationId,
        @JsonProperty("priority") int priority,
        @JsonProperty("seq") long seq) {

    public static QueueEntryResponse from(QueueEntry entry) {
        return new QueueEntryResponse(entry.simulationId(), entry.priority(), entry.seq());
    }
}
