package dss.coordinator.repository;

import dss.coordinator.model.Simulator;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for registered simulators.
 */
public interface SimulatorRepository {

    /**
     * Register a simulator or refresh its heartbeat if it already exists.
     * Keeps the original registration time.
     *
     * @param simulatorId the simulator ID
     * @param now         heartbeat timestamp
     */
    void upsert(String simulatorId, Instant now);

    Optional<Simulator> findById(String simulatorId);

    /**
     * Get all simulators, most recent heartbeat first.
     */
    List<Simulator> findAll();

    /**
     * Simulators whose last heartbeat is older than the cutoff.
     */
    List<Simulator> findStale(Instant heartbeatBefore);

    /**
     * Delete a simulator.
     *
     * @return true if deleted, false if not found
     * @throws dss.coordinator.exception.ReferentialIntegrityException if running
     *                                                                  or complete
     *                                                                  rows still
     *                                                                  reference it
     */
    boolean delete(String simulatorId);

    int count();
}
