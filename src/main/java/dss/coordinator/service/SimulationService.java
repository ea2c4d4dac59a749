package dss.coordinator.service;

import dss.coordinator.config.CoordinatorConfig;
import dss.coordinator.exception.InvalidTransitionException;
import dss.coordinator.model.CompleteEntry;
import dss.coordinator.model.QueueEntry;
import dss.coordinator.model.Simulation;
import dss.coordinator.model.SimulationState;
import dss.coordinator.repository.SimulationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

import static dss.coordinator.service.AssignmentService.requireId;

/**
 * Service layer for operator-side simulation management:
 * enqueueing descriptors, re-runs, deletion and inspection.
 */
public class SimulationService {

    private static final Logger log = LoggerFactory.getLogger(SimulationService.class);

    private static final int MAX_QUEUE_PAGE = 1000;

    private final SimulationRepository simulationRepository;
    private final CoordinatorConfig config;

    public SimulationService(SimulationRepository simulationRepository, CoordinatorConfig config) {
        this.simulationRepository = simulationRepository;
        this.config = config;
    }

    /**
     * Queue a simulation with the default priority.
     */
    public boolean enqueue(Simulation simulation) {
        return enqueue(simulation, config.defaultPriority());
    }

    /**
     * Queue a simulation.
     *
     * @return true if a queue entry was created, false if it was already queued
     */
    public boolean enqueue(Simulation simulation, int priority) {
        if (simulation == null) {
            throw new IllegalArgumentException("simulation is required");
        }

        boolean queued = simulationRepository.enqueue(simulation, priority);
        if (queued) {
            log.info("Queued simulation {} with priority {}", simulation.id(), priority);
        } else {
            log.debug("Simulation {} already queued", simulation.id());
        }
        return queued;
    }

    /**
     * Queue a batch of simulations in one transaction.
     *
     * @return number of queue entries created
     */
    public int enqueueAll(List<Simulation> simulations, int priority) {
        if (simulations == null) {
            throw new IllegalArgumentException("simulations is required");
        }

        int queued = simulationRepository.enqueueAll(simulations, priority);
        log.info("Queued {} simulations with priority {}", queued, priority);
        return queued;
    }

    public void rerun(String simulationId) {
        rerun(simulationId, config.defaultPriority());
    }

    /**
     * Queue a completed simulation again.
     */
    public void rerun(String simulationId, int priority) {
        requireId(simulationId, "simulationId");

        try {
            simulationRepository.rerun(simulationId, priority);
        } catch (InvalidTransitionException e) {
            log.warn("Rejected re-run of {}: {}", simulationId, e.getMessage());
            throw e;
        }
        log.info("Simulation {} queued for re-run with priority {}", simulationId, priority);
    }

    /**
     * Delete a simulation and everything recorded about it.
     */
    public boolean delete(String simulationId) {
        requireId(simulationId, "simulationId");

        boolean deleted = simulationRepository.delete(simulationId);
        if (deleted) {
            log.info("Deleted simulation {}", simulationId);
        }
        return deleted;
    }

    public Optional<Simulation> findById(String simulationId) {
        requireId(simulationId, "simulationId");
        return simulationRepository.findById(simulationId);
    }

    public Optional<SimulationState> findState(String simulationId) {
        requireId(simulationId, "simulationId");
        return simulationRepository.findState(simulationId);
    }

    /**
     * Queued entries in claim order.
     */
    public List<QueueEntry> queued(int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
        return simulationRepository.findQueued(Math.min(limit, MAX_QUEUE_PAGE));
    }

    public List<CompleteEntry> completions(String simulationId) {
        requireId(simulationId, "simulationId");
        return simulationRepository.findCompletions(simulationId);
    }

    public int countQueued() {
        return simulationRepository.countQueued();
    }

    public int countRunning() {
        return simulationRepository.countRunning();
    }

    public int countCompleted() {
        return simulationRepository.countCompleted();
    }
}
