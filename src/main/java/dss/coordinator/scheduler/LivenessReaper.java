package dss.coordinator.scheduler;

import dss.coordinator.service.SimulatorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Background task that recovers work held by silent simulators.
 *
 * A simulator can stop heartbeating if:
 * - its process crashed mid-simulation
 * - its host was shut down or preempted
 * - the network between it and the coordinator failed
 *
 * Every running simulation of such a simulator is put back in the queue
 * with a boosted priority so another simulator picks it up.
 */
public class LivenessReaper implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(LivenessReaper.class);

    private final SimulatorService simulatorService;

    public LivenessReaper(SimulatorService simulatorService) {
        this.simulatorService = simulatorService;
    }

    @Override
    public void run() {
        try {
            reap();
        } catch (Exception e) {
            log.error("Liveness reaper error", e);
        }
    }

    /**
     * @return number of simulations requeued
     */
    public int reap() {
        int requeued = simulatorService.reapStaleSimulators();
        if (requeued == 0) {
            log.debug("No work held by stale simulators");
        }
        return requeued;
    }
}
