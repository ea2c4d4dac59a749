package dss.coordinator.config;

import dss.coordinator.api.internal.v1.SimulationController;
import dss.coordinator.api.internal.v1.SimulatorController;
import dss.coordinator.api.v1.HealthController;
import dss.coordinator.api.v1.SimulationAdminController;
import dss.coordinator.api.v1.SimulatorAdminController;
import dss.coordinator.repository.SimulationRepository;
import dss.coordinator.repository.SimulatorRepository;
import dss.coordinator.scheduler.LivenessReaper;
import dss.coordinator.scheduler.Scheduler;
import dss.coordinator.server.CoordinatorServer;
import dss.coordinator.server.RouterHandler;
import dss.coordinator.service.AssignmentService;
import dss.coordinator.service.SimulationService;
import dss.coordinator.service.SimulatorService;
import dss.coordinator.store.Database;
import dss.coordinator.store.JdbcSimulationRepository;
import dss.coordinator.store.JdbcSimulatorRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Manual dependency injection container.
 * Creates and wires all service dependencies.
 *
 * Usage:
 *
 * <pre>
 * try (Dependencies deps = Dependencies.create(CoordinatorConfig.fromEnv())) {
 *     deps.startScheduler();
 *     deps.server().start(deps.config().serverPort());
 *     deps.server().awaitTermination();
 * }
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final CoordinatorConfig config;
    private final Database database;
    private final SimulationRepository simulationRepository;
    private final SimulatorRepository simulatorRepository;
    private final SimulationService simulationService;
    private final AssignmentService assignmentService;
    private final SimulatorService simulatorService;

    // Lazily created: CLI commands that only touch the store never build these
    private RouterHandler routerHandler;
    private CoordinatorServer server;
    private Scheduler scheduler;

    private Dependencies(CoordinatorConfig config) {
        this.config = config;

        log.info("Initializing dependencies with config: {}", config);

        this.database = new Database(config);

        this.simulationRepository = new JdbcSimulationRepository(database, config.claimRetries());
        this.simulatorRepository = new JdbcSimulatorRepository(database);

        this.simulationService = new SimulationService(simulationRepository, config);
        this.assignmentService = new AssignmentService(simulationRepository, config);
        this.simulatorService = new SimulatorService(simulatorRepository, simulationRepository, config);

        log.info("Dependencies initialized successfully");
    }

    public static Dependencies create(CoordinatorConfig config) {
        return new Dependencies(config);
    }

    /**
     * Create dependencies with environment-based config.
     */
    public static Dependencies create() {
        return create(CoordinatorConfig.fromEnv());
    }

    public CoordinatorConfig config() {
        return config;
    }

    public Database database() {
        return database;
    }

    public SimulationRepository simulationRepository() {
        return simulationRepository;
    }

    public SimulatorRepository simulatorRepository() {
        return simulatorRepository;
    }

    public SimulationService simulationService() {
        return simulationService;
    }

    public AssignmentService assignmentService() {
        return assignmentService;
    }

    public SimulatorService simulatorService() {
        return simulatorService;
    }

    /**
     * Router with every controller registered.
     */
    public synchronized RouterHandler routerHandler() {
        if (routerHandler == null) {
            routerHandler = new RouterHandler(config)
                    .registerController(new HealthController(database, simulationService, simulatorService))
                    .registerController(new SimulationAdminController(simulationService))
                    .registerController(new SimulatorAdminController(simulatorService))
                    .registerController(new SimulatorController(simulatorService))
                    .registerController(new SimulationController(assignmentService));
            log.info("RouterHandler created with {} controllers", routerHandler.controllerCount());
        }
        return routerHandler;
    }

    public synchronized CoordinatorServer server() {
        if (server == null) {
            server = new CoordinatorServer(routerHandler(), config.serverHost());
        }
        return server;
    }

    public synchronized Scheduler scheduler() {
        if (scheduler == null) {
            scheduler = new Scheduler(new LivenessReaper(simulatorService), config);
        }
        return scheduler;
    }

    /**
     * Start the background liveness reaper.
     */
    public void startScheduler() {
        scheduler().start();
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        if (server != null) {
            try {
                server.stop();
            } catch (RuntimeException e) {
                log.warn("Error stopping server: {}", e.getMessage());
            }
        }

        if (scheduler != null) {
            try {
                scheduler.stop();
            } catch (RuntimeException e) {
                log.warn("Error stopping scheduler: {}", e.getMessage());
            }
        }

        try {
            database.close();
        } catch (RuntimeException e) {
            log.warn("Error closing database: {}", e.getMessage());
        }

        log.info("Dependencies closed");
    }
}
