package dss.coordinator.service;

import dss.coordinator.config.CoordinatorConfig;
import dss.coordinator.exception.NotRunningException;
import dss.coordinator.model.RunningEntry;
import dss.coordinator.model.Simulation;
import dss.coordinator.queue.QueuePolicy;
import dss.coordinator.repository.SimulationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Service layer for the assignment protocol.
 * Moves simulations Queued -> Running -> Complete, and back to Queued when a
 * run fails. The atomic part of each transition is done by the repository.
 */
public class AssignmentService {

    private static final Logger log = LoggerFactory.getLogger(AssignmentService.class);

    private final SimulationRepository simulationRepository;
    private final CoordinatorConfig config;

    public AssignmentService(SimulationRepository simulationRepository, CoordinatorConfig config) {
        this.simulationRepository = simulationRepository;
        this.config = config;
    }

    /**
     * Claim the next queued simulation for a simulator.
     *
     * @return the claimed simulation, or empty if nothing is queued
     */
    public Optional<Simulation> claimNext(String simulatorId) {
        requireId(simulatorId, "simulatorId");

        Optional<Simulation> claimed = simulationRepository.claimNext(simulatorId);
        claimed.ifPresentOrElse(
                s -> log.info("Simulation {} assigned to simulator {}", s.id(), simulatorId),
                () -> log.debug("No queued simulation for simulator {}", simulatorId));
        return claimed;
    }

    /**
     * Record that a simulator finished a simulation now.
     */
    public void complete(String simulatorId, String simulationId) {
        complete(simulatorId, simulationId, Instant.now());
    }

    /**
     * Record that a simulator finished a simulation at the given time.
     *
     * @throws NotRunningException if the simulation is not running under that simulator
     */
    public void complete(String simulatorId, String simulationId, Instant finishedAt) {
        requireId(simulatorId, "simulatorId");
        requireId(simulationId, "simulationId");

        try {
            simulationRepository.complete(simulatorId, simulationId, finishedAt != null ? finishedAt : Instant.now());
        } catch (NotRunningException e) {
            log.warn("Rejected completion of {} by {}: not running there", simulationId, simulatorId);
            throw e;
        }
        log.info("Simulation {} completed by simulator {}", simulationId, simulatorId);
    }

    /**
     * Report a failed run. The simulation goes back to the queue with its
     * claim priority raised by the configured failure boost.
     *
     * @return the priority it was requeued with
     */
    public int fail(String simulatorId, String simulationId, String error) {
        requireId(simulatorId, "simulatorId");
        requireId(simulationId, "simulationId");

        RunningEntry running = simulationRepository.findRunningBySimulator(simulatorId).stream()
                .filter(r -> r.simulationId().equals(simulationId))
                .findFirst()
                .orElseThrow(() -> {
                    log.warn("Rejected failure report for {} by {}: not running there", simulationId, simulatorId);
                    return new NotRunningException(simulatorId, simulationId);
                });

        int priority = QueuePolicy.boost(running.priority(), config.failureBoost());
        requeue(simulatorId, simulationId, priority);

        log.info("Simulation {} failed on simulator {} ({}), requeued with priority {}",
                simulationId, simulatorId, error != null ? error : "no reason given", priority);
        return priority;
    }

    /**
     * Put a running simulation back in the queue with an explicit priority.
     *
     * @return the running entry that was removed
     */
    public RunningEntry requeue(String simulatorId, String simulationId, int priority) {
        requireId(simulatorId, "simulatorId");
        requireId(simulationId, "simulationId");

        RunningEntry removed = simulationRepository.requeue(simulatorId, simulationId, priority);
        log.debug("Simulation {} requeued from simulator {} with priority {}", simulationId, simulatorId, priority);
        return removed;
    }

    /**
     * Simulations currently running on a simulator.
     */
    public List<RunningEntry> runningOn(String simulatorId) {
        requireId(simulatorId, "simulatorId");
        return simulationRepository.findRunningBySimulator(simulatorId);
    }

    public List<RunningEntry> running() {
        return simulationRepository.findRunning();
    }

    static void requireId(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " is required");
        }
        if (value.length() > Simulation.MAX_ID_LENGTH) {
            throw new IllegalArgumentException(name + " must be at most " + Simulation.MAX_ID_LENGTH + " characters");
        }
    }
}
