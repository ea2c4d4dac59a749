package dss.coordinator.service;

import dss.coordinator.config.CoordinatorConfig;
import dss.coordinator.exception.NotRunningException;
import dss.coordinator.model.RunningEntry;
import dss.coordinator.model.Simulator;
import dss.coordinator.queue.QueuePolicy;
import dss.coordinator.repository.SimulationRepository;
import dss.coordinator.repository.SimulatorRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static dss.coordinator.service.AssignmentService.requireId;

/**
 * Service layer for simulator operations.
 * Handles registration, heartbeats, and recovery of work held by simulators
 * that stopped sending heartbeats.
 */
public class SimulatorService {

    private static final Logger log = LoggerFactory.getLogger(SimulatorService.class);

    private final SimulatorRepository simulatorRepository;
    private final SimulationRepository simulationRepository;
    private final CoordinatorConfig config;

    public SimulatorService(SimulatorRepository simulatorRepository, SimulationRepository simulationRepository,
            CoordinatorConfig config) {
        this.simulatorRepository = simulatorRepository;
        this.simulationRepository = simulationRepository;
        this.config = config;
    }

    /**
     * Register a simulator. Calling again for a known id only refreshes its heartbeat.
     */
    public void register(String simulatorId) {
        requireId(simulatorId, "simulatorId");

        boolean known = simulatorRepository.findById(simulatorId).isPresent();
        simulatorRepository.upsert(simulatorId, Instant.now());

        if (known) {
            log.debug("Simulator {} registered again", simulatorId);
        } else {
            log.info("Registered simulator {}", simulatorId);
        }
    }

    /**
     * Process heartbeat from a simulator.
     */
    public void heartbeat(String simulatorId) {
        requireId(simulatorId, "simulatorId");
        simulatorRepository.upsert(simulatorId, Instant.now());
        log.debug("Heartbeat from simulator {}", simulatorId);
    }

    public Optional<Simulator> findById(String simulatorId) {
        requireId(simulatorId, "simulatorId");
        return simulatorRepository.findById(simulatorId);
    }

    public List<Simulator> findAll() {
        return simulatorRepository.findAll();
    }

    public int count() {
        return simulatorRepository.count();
    }

    /**
     * Delete a simulator.
     *
     * @throws dss.coordinator.exception.ReferentialIntegrityException while it
     *         still has running or completed simulations
     */
    public boolean delete(String simulatorId) {
        requireId(simulatorId, "simulatorId");

        boolean deleted = simulatorRepository.delete(simulatorId);
        if (deleted) {
            log.info("Deleted simulator {}", simulatorId);
        }
        return deleted;
    }

    /**
     * Requeue everything running on simulators whose heartbeat is older than
     * the configured timeout. Each simulation goes back with its claim
     * priority plus the failure boost.
     *
     * @return number of simulations requeued
     */
    public int reapStaleSimulators() {
        Instant cutoff = Instant.now().minus(config.heartbeatTimeout());
        List<Simulator> stale = simulatorRepository.findStale(cutoff);

        int requeued = 0;
        for (Simulator simulator : stale) {
            for (RunningEntry running : simulationRepository.findRunningBySimulator(simulator.id())) {
                int priority = QueuePolicy.boost(running.priority(), config.failureBoost());
                try {
                    simulationRepository.requeue(simulator.id(), running.simulationId(), priority);
                    requeued++;
                    log.info("Requeued simulation {} from silent simulator {} with priority {}",
                            running.simulationId(), simulator.id(), priority);
                } catch (NotRunningException e) {
                    // Finished or requeued between the lookup and the requeue
                    log.debug("Simulation {} left simulator {} before it could be reaped",
                            running.simulationId(), simulator.id());
                } catch (Exception e) {
                    log.error("Failed to requeue simulation {} from simulator {}",
                            running.simulationId(), simulator.id(), e);
                }
            }
        }

        if (requeued > 0) {
            log.info("Liveness check: {} stale simulators, {} simulations requeued", stale.size(), requeued);
        }
        return requeued;
    }
}
