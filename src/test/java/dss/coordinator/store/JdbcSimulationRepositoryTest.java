package dss.coordinator.store;

import dss.coordinator.config.CoordinatorConfig;
import dss.coordinator.exception.DuplicateIdException;
import dss.coordinator.exception.InvalidTransitionException;
import dss.coordinator.exception.NotRunningException;
import dss.coordinator.exception.ReferentialIntegrityException;
import dss.coordinator.exception.SimulationNotFoundException;
import dss.coordinator.model.CompleteEntry;
import dss.coordinator.model.QueueEntry;
import dss.coordinator.model.RunningEntry;
import dss.coordinator.model.Simulation;
import dss.coordinator.model.SimulationState;
import org.junit.jupiter.api.*;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class JdbcSimulationRepositoryTest {

    private static Database db;
    private static JdbcSimulationRepository repo;
    private static JdbcSimulatorRepository simulators;

    @BeforeAll
    static void setup() {
        CoordinatorConfig config = CoordinatorConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-simulations;DB_CLOSE_DELAY=-1;DATABASE_TO_UPPER=FALSE");
        db = new Database(config);
        repo = new JdbcSimulationRepository(db);
        simulators = new JdbcSimulatorRepository(db);
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
        simulators.upsert("sim-1", Instant.now());
        simulators.upsert("sim-2", Instant.now());
    }

    static Simulation simulation(String id) {
        return Simulation.builder()
                .id(id)
                .topology("topo-" + id + ".topo")
                .destination(8)
                .stubsFile("stubs-" + id + ".stubs")
                .build();
    }

    @Test
    void enqueueAndFindById() {
        Simulation seeded = simulation("s1").toBuilder().seed(7).reportNodes(true).build();
        Simulation unseeded = simulation("s2");

        assertTrue(repo.enqueue(seeded, 0));
        assertTrue(repo.enqueue(unseeded, 0));

        Simulation found = repo.findById("s1").orElseThrow();
        assertEquals("topo-s1.topo", found.topology());
        assertEquals(8, found.destination());
        assertEquals(100, found.repetitions());
        assertEquals(10, found.minDelay());
        assertEquals(1000, found.maxDelay());
        assertEquals(2_000_000, found.threshold());
        assertEquals(7, found.seed());
        assertTrue(found.reportNodes());
        assertTrue(found.sameDescriptor(seeded));

        Simulation noSeed = repo.findById("s2").orElseThrow();
        assertFalse(noSeed.hasSeed());
        assertNull(noSeed.seed());
        assertFalse(noSeed.reportNodes());
        assertNull(noSeed.reportNodesOrNull());

        assertEquals(Optional.of(SimulationState.QUEUED), repo.findState("s1"));
        assertTrue(repo.findById("missing").isEmpty());
        assertTrue(repo.findState("missing").isEmpty());
    }

    @Test
    void claimsHighestPriorityFirstThenInsertionOrder() {
        repo.enqueue(simulation("a"), 5);
        repo.enqueue(simulation("b"), 1);
        repo.enqueue(simulation("c"), 5);
        repo.enqueue(simulation("d"), 3);

        List<String> queuedOrder = repo.findQueued(10).stream().map(QueueEntry::simulationId).toList();
        assertEquals(List.of("a", "c", "d", "b"), queuedOrder);

        assertEquals("a", repo.claimNext("sim-1").orElseThrow().id());
        assertEquals("c", repo.claimNext("sim-1").orElseThrow().id());
        assertEquals("d", repo.claimNext("sim-2").orElseThrow().id());
        assertEquals("b", repo.claimNext("sim-2").orElseThrow().id());
        assertTrue(repo.claimNext("sim-1").isEmpty());
    }

    @Test
    void claimMovesEntryFromQueueToRunning() {
        repo.enqueue(simulation("s1"), 4);

        Simulation claimed = repo.claimNext("sim-1").orElseThrow();
        assertEquals("s1", claimed.id());

        assertEquals(0, repo.countQueued());
        assertEquals(1, repo.countRunning());
        assertEquals(Optional.of(SimulationState.RUNNING), repo.findState("s1"));

        RunningEntry running = repo.findRunningBySimulator("sim-1").get(0);
        assertEquals("s1", running.simulationId());
        assertEquals(4, running.priority());
        assertNotNull(running.startedAt());
        assertTrue(repo.findRunningBySimulator("sim-2").isEmpty());
    }

    @Test
    void claimOnEmptyQueueReturnsEmpty() {
        assertTrue(repo.claimNext("sim-1").isEmpty());
        assertEquals(0, repo.countRunning());
    }

    @Test
    void claimByUnregisteredSimulatorIsRejected() {
        repo.enqueue(simulation("s1"), 0);

        assertThrows(ReferentialIntegrityException.class, () -> repo.claimNext("ghost"));

        // Rolled back: still queued
        assertEquals(1, repo.countQueued());
        assertEquals(0, repo.countRunning());
    }

    @Test
    void completeRequiresMatchingRunningEntry() {
        repo.enqueue(simulation("s1"), 0);

        assertThrows(NotRunningException.class, () -> repo.complete("sim-1", "s1", Instant.now()));

        repo.claimNext("sim-1");

        NotRunningException wrongSimulator = assertThrows(NotRunningException.class,
                () -> repo.complete("sim-2", "s1", Instant.now()));
        assertEquals("sim-2", wrongSimulator.simulatorId());
        assertEquals("s1", wrongSimulator.simulationId());

        assertDoesNotThrow(() -> repo.complete("sim-1", "s1", Instant.now()));

        assertThrows(NotRunningException.class, () -> repo.complete("sim-1", "s1", Instant.now()));
    }

    @Test
    void enqueueClaimCompleteLeavesOneCompleteRow() {
        Instant finishedAt = Instant.now().truncatedTo(ChronoUnit.MILLIS);

        repo.enqueue(simulation("s1"), 0);
        repo.claimNext("sim-1");
        repo.complete("sim-1", "s1", finishedAt);

        assertEquals(0, repo.countQueued());
        assertEquals(0, repo.countRunning());
        assertEquals(1, repo.countCompleted());

        List<CompleteEntry> completions = repo.findCompletions("s1");
        assertEquals(1, completions.size());
        assertEquals("sim-1", completions.get(0).simulatorId());
        assertEquals(finishedAt, completions.get(0).finishedAt());
        assertEquals(Optional.of(SimulationState.COMPLETE), repo.findState("s1"));
    }

    @Test
    void requeueAfterClaimAllowsClaimingAgain() {
        repo.enqueue(simulation("s1"), 2);
        repo.claimNext("sim-1");

        RunningEntry removed = repo.requeue("sim-1", "s1", 9);
        assertEquals(2, removed.priority());
        assertEquals("sim-1", removed.simulatorId());

        assertEquals(Optional.of(SimulationState.QUEUED), repo.findState("s1"));
        assertEquals(0, repo.countRunning());
        QueueEntry entry = repo.findQueued(1).get(0);
        assertEquals("s1", entry.simulationId());
        assertEquals(9, entry.priority());

        assertEquals("s1", repo.claimNext("sim-2").orElseThrow().id());
        assertEquals("sim-2", repo.findRunning().get(0).simulatorId());
    }

    @Test
    void requeueRequiresMatchingRunningEntry() {
        repo.enqueue(simulation("s1"), 0);

        assertThrows(NotRunningException.class, () -> repo.requeue("sim-1", "s1", 1));

        repo.claimNext("sim-1");
        assertThrows(NotRunningException.class, () -> repo.requeue("sim-2", "s1", 1));
        assertEquals(1, repo.countRunning());
    }

    @Test
    void requeuedEntryGoesBehindEqualPriorityEntries() {
        repo.enqueue(simulation("s1"), 1);
        repo.enqueue(simulation("s2"), 1);

        assertEquals("s1", repo.claimNext("sim-1").orElseThrow().id());
        repo.enqueue(simulation("s3"), 1);
        repo.requeue("sim-1", "s1", 1);

        List<String> order = repo.findQueued(10).stream().map(QueueEntry::simulationId).toList();
        assertEquals(List.of("s2", "s3", "s1"), order);
    }

    @Test
    void enqueueWithSameIdAndDifferentDescriptorFails() {
        repo.enqueue(simulation("s1"), 0);

        Simulation other = simulation("s1").toBuilder().destination(99).build();
        DuplicateIdException e = assertThrows(DuplicateIdException.class, () -> repo.enqueue(other, 0));
        assertEquals("s1", e.simulationId());

        assertEquals(8, repo.findById("s1").orElseThrow().destination());
        assertEquals(1, repo.countQueued());
    }

    @Test
    void enqueueOfIdenticalDescriptorDependsOnState() {
        Simulation s1 = simulation("s1");
        assertTrue(repo.enqueue(s1, 0));

        // Already queued: no-op
        assertFalse(repo.enqueue(s1, 5));
        assertEquals(0, repo.findQueued(1).get(0).priority());

        repo.claimNext("sim-1");
        InvalidTransitionException running = assertThrows(InvalidTransitionException.class,
                () -> repo.enqueue(s1, 0));
        assertEquals(SimulationState.RUNNING, running.currentState());

        repo.complete("sim-1", "s1", Instant.now());
        assertTrue(repo.enqueue(s1, 3));
        assertEquals(Optional.of(SimulationState.QUEUED), repo.findState("s1"));
    }

    @Test
    void enqueueAllIsAllOrNothing() {
        repo.enqueue(simulation("existing"), 0);

        List<Simulation> batch = List.of(
                simulation("b1"),
                simulation("b2"),
                simulation("existing").toBuilder().repetitions(5).build());

        assertThrows(DuplicateIdException.class, () -> repo.enqueueAll(batch, 2));

        assertTrue(repo.findById("b1").isEmpty());
        assertTrue(repo.findById("b2").isEmpty());
        assertEquals(1, repo.countQueued());

        assertEquals(2, repo.enqueueAll(List.of(simulation("b1"), simulation("b2")), 2));
        assertEquals(3, repo.countQueued());
        assertEquals(0, repo.enqueueAll(List.of(), 2));
    }

    @Test
    void rerunOnlyFromComplete() {
        assertThrows(SimulationNotFoundException.class, () -> repo.rerun("missing", 0));

        repo.enqueue(simulation("s1"), 0);
        assertThrows(InvalidTransitionException.class, () -> repo.rerun("s1", 0));

        repo.claimNext("sim-1");
        assertThrows(InvalidTransitionException.class, () -> repo.rerun("s1", 0));

        repo.complete("sim-1", "s1", Instant.now());
        repo.rerun("s1", 7);

        assertEquals(Optional.of(SimulationState.QUEUED), repo.findState("s1"));
        assertEquals(7, repo.findQueued(1).get(0).priority());
        // History is kept
        assertEquals(1, repo.findCompletions("s1").size());
    }

    @Test
    void sameSimulatorCompletingAgainUpdatesItsRow() {
        Instant first = Instant.now().minusSeconds(60).truncatedTo(ChronoUnit.MILLIS);
        Instant second = Instant.now().truncatedTo(ChronoUnit.MILLIS);

        repo.enqueue(simulation("s1"), 0);
        repo.claimNext("sim-1");
        repo.complete("sim-1", "s1", first);

        repo.rerun("s1", 0);
        repo.claimNext("sim-1");
        repo.complete("sim-1", "s1", second);

        List<CompleteEntry> completions = repo.findCompletions("s1");
        assertEquals(1, completions.size());
        assertEquals(second, completions.get(0).finishedAt());

        repo.rerun("s1", 0);
        repo.claimNext("sim-2");
        repo.complete("sim-2", "s1", Instant.now());
        assertEquals(2, repo.findCompletions("s1").size());
    }

    @Test
    void deleteSimulationCascadesToAllRows() {
        repo.enqueue(simulation("queued"), 0);
        repo.enqueue(simulation("running"), 5);
        repo.enqueue(simulation("done"), 9);
        repo.claimNext("sim-1"); // done
        repo.complete("sim-1", "done", Instant.now());
        repo.claimNext("sim-1"); // running

        assertTrue(repo.delete("queued"));
        assertTrue(repo.delete("running"));
        assertTrue(repo.delete("done"));
        assertFalse(repo.delete("done"));

        assertEquals(0, repo.countQueued());
        assertEquals(0, repo.countRunning());
        assertEquals(0, repo.countCompleted());
        assertTrue(repo.findCompletions("done").isEmpty());
    }

    @Test
    void descriptorWithoutRowsIsUnscheduled() throws Exception {
        repo.enqueue(simulation("s1"), 0);
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM queue");
            conn.commit();
        }

        assertEquals(Optional.of(SimulationState.UNSCHEDULED), repo.findState("s1"));
        assertThrows(InvalidTransitionException.class, () -> repo.rerun("s1", 0));
        // Identical enqueue schedules it again
        assertTrue(repo.enqueue(simulation("s1"), 0));
    }
}
