package dss.coordinator.model;

/**
 * Lifecycle state of a simulation, derived from which rows exist for it.
 */
public enum SimulationState {
    /** Waiting in the queue to be claimed */
    QUEUED,
    /** Claimed by a simulator and being executed */
    RUNNING,
    /** Finished by at least one simulator and not queued again */
    COMPLETE,
    /** Descriptor stored but neither queued, running nor complete */
    UNSCHEDULED
}
