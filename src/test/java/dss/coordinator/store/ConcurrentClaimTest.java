package dss.coordinator.store;

import dss.coordinator.config.CoordinatorConfig;
import dss.coordinator.model.Simulation;
import org.junit.jupiter.api.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.*;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Many simulators claiming from one queue at the same time.
 */
class ConcurrentClaimTest {

    private static final int SIMULATIONS = 40;
    private static final int WORKERS = 8;

    private static Database db;
    private static JdbcSimulationRepository repo;
    private static JdbcSimulatorRepository simulators;

    @BeforeAll
    static void setup() {
        CoordinatorConfig config = CoordinatorConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-concurrent-claim;DB_CLOSE_DELAY=-1;DATABASE_TO_UPPER=FALSE")
                .withDatabasePoolSize(WORKERS + 2);
        db = new Database(config);
        repo = new JdbcSimulationRepository(db, config.claimRetries());
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
    }

    @Test
    void everyQueuedSimulationIsClaimedExactlyOnce() throws Exception {
        List<Simulation> batch = new ArrayList<>();
        for (int i = 0; i < SIMULATIONS; i++) {
            batch.add(JdbcSimulationRepositoryTest.simulation("s" + i));
        }
        repo.enqueueAll(batch, 0);
        for (int w = 0; w < WORKERS; w++) {
            simulators.upsert("sim-" + w, Instant.now());
        }

        ExecutorService executor = Executors.newFixedThreadPool(WORKERS);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<List<String>>> results = new ArrayList<>();

        for (int w = 0; w < WORKERS; w++) {
            String simulatorId = "sim-" + w;
            results.add(executor.submit(() -> {
                start.await();
                List<String> claimed = new ArrayList<>();
                Optional<Simulation> next;
                while ((next = repo.claimNext(simulatorId)).isPresent()) {
                    claimed.add(next.get().id());
                }
                return claimed;
            }));
        }

        start.countDown();

        List<String> all = new ArrayList<>();
        for (Future<List<String>> result : results) {
            all.addAll(result.get(60, TimeUnit.SECONDS));
        }
        executor.shutdown();

        Set<String> distinct = new HashSet<>(all);
        assertEquals(SIMULATIONS, all.size(), "every simulation claimed once");
        assertEquals(SIMULATIONS, distinct.size(), "no simulation claimed twice");
        assertEquals(0, repo.countQueued());
        assertEquals(SIMULATIONS, repo.countRunning());
    }

    @Test
    void concurrentIdenticalEnqueueQueuesOnce() throws Exception {
        int callers = 6;
        for (int round = 0; round < 5; round++) {
            Simulation simulation = JdbcSimulationRepositoryTest.simulation("same-" + round);

            ExecutorService executor = Executors.newFixedThreadPool(callers);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<Boolean>> results = new ArrayList<>();

            for (int i = 0; i < callers; i++) {
                results.add(executor.submit(() -> {
                    start.await();
                    return repo.enqueue(simulation, 0);
                }));
            }

            start.countDown();

            int queued = 0;
            for (Future<Boolean> result : results) {
                // An exception here fails the test through ExecutionException
                if (result.get(30, TimeUnit.SECONDS)) {
                    queued++;
                }
            }
            executor.shutdown();

            assertEquals(1, queued, "exactly one caller queues " + simulation.id());
        }
        assertEquals(5, repo.countQueued());
    }

    @Test
    void concurrentCompletionHasOneWinner() throws Exception {
        repo.enqueue(JdbcSimulationRepositoryTest.simulation("s1"), 0);
        simulators.upsert("sim-0", Instant.now());
        repo.claimNext("sim-0");

        ExecutorService executor = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();

        for (int i = 0; i < 4; i++) {
            results.add(executor.submit(() -> {
                start.await();
                try {
                    repo.complete("sim-0", "s1", Instant.now());
                    return true;
                } catch (dss.coordinator.exception.NotRunningException e) {
                    return false;
                }
            }));
        }

        start.countDown();

        int winners = 0;
        for (Future<Boolean> result : results) {
            if (result.get(30, TimeUnit.SECONDS)) {
                winners++;
            }
        }
        executor.shutdown();

        assertEquals(1, winners);
        assertEquals(1, repo.findCompletions("s1").size());
        assertEquals(0, repo.countRunning());
    }
}
