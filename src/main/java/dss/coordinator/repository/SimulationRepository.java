package dss.coordinator.repository;

import dss.coordinator.model.CompleteEntry;
import dss.coordinator.model.QueueEntry;
import dss.coordinator.model.RunningEntry;
import dss.coordinator.model.Simulation;
import dss.coordinator.model.SimulationState;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for simulations and their lifecycle rows
 * (queue, running, complete).
 *
 * Every mutating method is atomic and durable when it returns.
 */
public interface SimulationRepository {

    /**
     * Store the descriptor if absent and queue it with the given priority.
     *
     * @param simulation the descriptor
     * @param priority   queue priority, higher is claimed first
     * @return true if a queue entry was inserted, false if the identical
     *         simulation was already queued
     * @throws dss.coordinator.exception.DuplicateIdException       if the id is
     *                                                               stored with
     *                                                               different content
     * @throws dss.coordinator.exception.InvalidTransitionException if the
     *                                                               simulation is
     *                                                               running
     */
    boolean enqueue(Simulation simulation, int priority);

    /**
     * Enqueue a batch in one transaction: either all are queued or none is.
     *
     * @return number of queue entries inserted
     */
    int enqueueAll(List<Simulation> simulations, int priority);

    /**
     * Atomically move the first queued simulation (queue-policy order) to running
     * under the given simulator.
     *
     * @param simulatorId a registered simulator
     * @return the claimed simulation, or empty if the queue is empty
     * @throws dss.coordinator.exception.ReferentialIntegrityException if the
     *                                                                  simulator is
     *                                                                  not registered
     */
    Optional<Simulation> claimNext(String simulatorId);

    /**
     * Replace the running entry for (simulator, simulation) with a complete entry.
     *
     * @throws dss.coordinator.exception.NotRunningException if no such running entry exists
     */
    void complete(String simulatorId, String simulationId, Instant finishedAt);

    /**
     * Replace the running entry for (simulator, simulation) with a queue entry.
     *
     * @return the running entry that was removed
     * @throws dss.coordinator.exception.NotRunningException if no such running entry exists
     */
    RunningEntry requeue(String simulatorId, String simulationId, int priority);

    /**
     * Queue a completed simulation again (explicit re-run request).
     *
     * @throws dss.coordinator.exception.SimulationNotFoundException if the id is unknown
     * @throws dss.coordinator.exception.InvalidTransitionException  if it is not COMPLETE
     */
    void rerun(String simulationId, int priority);

    /**
     * Delete the simulation; its queue, running and complete rows go with it.
     *
     * @return true if deleted, false if not found
     */
    boolean delete(String simulationId);

    Optional<Simulation> findById(String simulationId);

    /**
     * Current lifecycle state, empty if the simulation does not exist.
     */
    Optional<SimulationState> findState(String simulationId);

    /**
     * Queued entries in claim order.
     */
    List<QueueEntry> findQueued(int limit);

    List<RunningEntry> findRunning();

    List<RunningEntry> findRunningBySimulator(String simulatorId);

    List<CompleteEntry> findCompletions(String simulationId);

    int countQueued();

    int countRunning();

    /**
     * Number of complete rows (finished runs, not distinct simulations).
     */
    int countCompleted();
}
