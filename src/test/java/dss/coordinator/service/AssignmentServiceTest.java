package dss.coordinator.service;

import dss.coordinator.config.CoordinatorConfig;
import dss.coordinator.exception.NotRunningException;
import dss.coordinator.model.Simulation;
import dss.coordinator.model.SimulationState;
import dss.coordinator.store.Database;
import dss.coordinator.store.JdbcSimulationRepository;
import dss.coordinator.store.JdbcSimulatorRepository;
import org.junit.jupiter.api.*;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class AssignmentServiceTest {

    private static Database db;
    private static AssignmentService assignments;
    private static SimulationService simulations;
    private static SimulatorService simulators;

    @BeforeAll
    static void setup() {
        CoordinatorConfig config = CoordinatorConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-assignment;DB_CLOSE_DELAY=-1;DATABASE_TO_UPPER=FALSE")
                .withDefaultPriority(1)
                .withFailureBoost(2);
        db = new Database(config);
        JdbcSimulationRepository simulationRepository = new JdbcSimulationRepository(db);
        assignments = new AssignmentService(simulationRepository, config);
        simulations = new SimulationService(simulationRepository, config);
        simulators = new SimulatorService(new JdbcSimulatorRepository(db), simulationRepository, config);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void cleanTables() throws Exception {
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM queue");
            st.execute("DELETE FROM running");
            st.execute("DELETE FROM complete");
            st.execute("DELETE FROM simulation");
            st.execute("DELETE FROM simulator");
            conn.commit();
        }
        simulators.register("sim-1");
    }

    private static Simulation simulation(String id) {
        return Simulation.builder()
                .id(id)
                .topology("t.topo")
                .destination(1)
                .stubsFile("t.stubs")
                .build();
    }

    @Test
    void enqueueUsesDefaultPriority() {
        assertTrue(simulations.enqueue(simulation("s1")));
        assertEquals(1, simulations.queued(10).get(0).priority());
    }

    @Test
    void fullLifecycle() {
        simulations.enqueue(simulation("s1"), 0);

        Simulation claimed = assignments.claimNext("sim-1").orElseThrow();
        assertEquals("s1", claimed.id());
        assertEquals(1, assignments.runningOn("sim-1").size());

        assignments.complete("sim-1", "s1");

        assertEquals(Optional.of(SimulationState.COMPLETE), simulations.findState("s1"));
        assertEquals(1, simulations.countCompleted());
        assertNotNull(simulations.completions("s1").get(0).finishedAt());
        assertTrue(assignments.running().isEmpty());
    }

    @Test
    void completeWithoutTimestampUsesNow() {
        simulations.enqueue(simulation("s1"), 0);
        assignments.claimNext("sim-1");

        assignments.complete("sim-1", "s1", null);

        assertNotNull(simulations.completions("s1").get(0).finishedAt());
    }

    @Test
    void failRequeuesWithBoostedPriority() {
        simulations.enqueue(simulation("s1"), 3);
        simulations.enqueue(simulation("s2"), 4);
        assignments.claimNext("sim-1"); // s2

        int priority = assignments.fail("sim-1", "s2", "simulator crashed");

        assertEquals(6, priority);
        assertEquals(Optional.of(SimulationState.QUEUED), simulations.findState("s2"));
        assertEquals("s2", simulations.queued(10).get(0).simulationId());
        assertEquals(0, simulations.countRunning());
    }

    @Test
    void failOfSimulationNotRunningThereIsRejected() {
        simulations.enqueue(simulation("s1"), 0);

        assertThrows(NotRunningException.class, () -> assignments.fail("sim-1", "s1", "boom"));
        assertThrows(NotRunningException.class, () -> assignments.complete("sim-1", "s1"));
    }

    @Test
    void rerunWithDefaultPriority() {
        simulations.enqueue(simulation("s1"), 9);
        assignments.claimNext("sim-1");
        assignments.complete("sim-1", "s1");

        simulations.rerun("s1");

        assertEquals(1, simulations.queued(10).get(0).priority());
    }

    @Test
    void enqueueAllQueuesBatch() {
        int queued = simulations.enqueueAll(List.of(simulation("a"), simulation("b"), simulation("c")), 2);

        assertEquals(3, queued);
        assertEquals(3, simulations.countQueued());
    }

    @Test
    void blankIdsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> assignments.claimNext(" "));
        assertThrows(IllegalArgumentException.class, () -> assignments.complete("sim-1", null));
        assertThrows(IllegalArgumentException.class, () -> assignments.fail("", "s1", null));
        assertThrows(IllegalArgumentException.class, () -> simulations.rerun(""));
        assertThrows(IllegalArgumentException.class, () -> simulations.queued(0));
        assertThrows(IllegalArgumentException.class, () -> simulators.register(null));
    }

    @Test
    void overlongIdsAreRejectedBeforeReachingTheStore() {
        String longId = "x".repeat(Simulation.MAX_ID_LENGTH + 1);

        assertThrows(IllegalArgumentException.class, () -> simulators.register(longId));
        assertThrows(IllegalArgumentException.class, () -> assignments.claimNext(longId));
        assertThrows(IllegalArgumentException.class, () -> assignments.complete("sim-1", longId));
        assertThrows(IllegalArgumentException.class, () -> simulations.rerun(longId));
        assertEquals(1, simulators.count());
    }
}
