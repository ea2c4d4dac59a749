package dss.coordinator.scheduler;

import dss.coordinator.config.CoordinatorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Runs background maintenance on a single daemon thread.
 * Currently only the liveness reaper.
 */
public class Scheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    private final ScheduledExecutorService executor;
    private final LivenessReaper livenessReaper;
    private final CoordinatorConfig config;

    private volatile boolean running = false;

    public Scheduler(LivenessReaper livenessReaper, CoordinatorConfig config) {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "dss-scheduler");
            t.setDaemon(true);
            return t;
        });
        this.livenessReaper = livenessReaper;
        this.config = config;
    }

    public synchronized void start() {
        if (running) {
            log.warn("Scheduler already running");
            return;
        }

        running = true;

        long intervalMs = config.reaperInterval().toMillis();
        executor.scheduleAtFixedRate(livenessReaper, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("Liveness reaper scheduled every {}ms (heartbeat timeout {})",
                intervalMs, config.heartbeatTimeout());
    }

    /**
     * Stop the scheduler, waiting briefly for a reaper pass in progress.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }

        running = false;
        executor.shutdown();

        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Scheduler forcefully stopped");
            } else {
                log.info("Scheduler stopped gracefully");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * The liveness reaper, for a manual pass.
     */
    public LivenessReaper livenessReaper() {
        return livenessReaper;
    }
}
