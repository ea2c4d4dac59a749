package dss.coordinator.store;

import dss.coordinator.exception.DuplicateIdException;
import dss.coordinator.exception.InvalidTransitionException;
import dss.coordinator.exception.NotRunningException;
import dss.coordinator.exception.ReferentialIntegrityException;
import dss.coordinator.exception.SimulationNotFoundException;
import dss.coordinator.exception.StoreException;
import dss.coordinator.model.CompleteEntry;
import dss.coordinator.model.QueueEntry;
import dss.coordinator.model.RunningEntry;
import dss.coordinator.model.Simulation;
import dss.coordinator.model.SimulationState;
import dss.coordinator.queue.QueuePolicy;
import dss.coordinator.repository.SimulationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * JDBC implementation of SimulationRepository.
 * Uses pessimistic locking (SELECT ... FOR UPDATE) plus a row-count check on
 * the queue delete so that exactly one caller claims any queued simulation.
 */
public class JdbcSimulationRepository implements SimulationRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcSimulationRepository.class);

    private final Database db;
    private final int claimRetries;

    public JdbcSimulationRepository(Database db) {
        this(db, 5);
    }

    public JdbcSimulationRepository(Database db, int claimRetries) {
        if (claimRetries <= 0) {
            throw new IllegalArgumentException("claimRetries must be positive");
        }
        this.db = db;
        this.claimRetries = claimRetries;
    }

    @Override
    public boolean enqueue(Simulation simulation, int priority) {
        return inTransaction("enqueue simulation: " + simulation.id(),
                conn -> enqueueInTransaction(conn, simulation, priority));
    }

    @Override
    public int enqueueAll(List<Simulation> simulations, int priority) {
        if (simulations.isEmpty())
            return 0;

        int inserted = inTransaction("enqueue " + simulations.size() + " simulations", conn -> {
            int count = 0;
            for (Simulation simulation : simulations) {
                if (enqueueInTransaction(conn, simulation, priority)) {
                    count++;
                }
            }
            return count;
        });

        log.debug("Enqueued {} of {} simulations with priority {}", inserted, simulations.size(), priority);
        return inserted;
    }

    private boolean enqueueInTransaction(Connection conn, Simulation simulation, int priority) throws SQLException {
        Optional<Simulation> existing = selectSimulation(conn, simulation.id(), true);

        if (existing.isEmpty()) {
            try {
                insertSimulation(conn, simulation);
                insertQueueEntry(conn, simulation.id(), priority);
                return true;
            } catch (SQLException e) {
                if (!SqlErrors.isDuplicateKey(e)) {
                    throw e;
                }
                // A concurrent enqueue inserted the same id first; judge against its row
                existing = selectSimulation(conn, simulation.id(), true);
                if (existing.isEmpty()) {
                    throw e;
                }
                log.debug("Simulation {} was inserted concurrently", simulation.id());
            }
        }

        if (!existing.get().sameDescriptor(simulation)) {
            throw new DuplicateIdException(simulation.id());
        }

        SimulationState state = stateOf(conn, simulation.id());
        if (state == SimulationState.QUEUED) {
            return false;
        }
        if (state == SimulationState.RUNNING) {
            throw new InvalidTransitionException(simulation.id(), state, "enqueue");
        }

        insertQueueEntry(conn, simulation.id(), priority);
        return true;
    }

    @Override
    public Optional<Simulation> claimNext(String simulatorId) {
        for (int attempt = 1; attempt <= claimRetries; attempt++) {
            try (Connection conn = db.getConnection()) {
                ClaimAttempt result;
                try {
                    result = claimOnce(conn, simulatorId);
                    if (result.raced()) {
                        conn.rollback();
                    } else {
                        conn.commit();
                    }
                } catch (SQLException | RuntimeException e) {
                    rollback(conn, e);
                    throw e;
                }

                if (!result.raced()) {
                    if (result.simulation() != null) {
                        log.debug("Simulation {} claimed by simulator {}", result.simulation().id(), simulatorId);
                    }
                    return Optional.ofNullable(result.simulation());
                }
                log.debug("Simulator {} lost a claim race (attempt {}/{})", simulatorId, attempt, claimRetries);
            } catch (SQLException e) {
                if (SqlErrors.isParentMissing(e)) {
                    throw new ReferentialIntegrityException("Simulator not registered: " + simulatorId, e);
                }
                if (!SqlErrors.isContention(e)) {
                    throw new StoreException("Failed to claim simulation for simulator: " + simulatorId, e);
                }
                log.debug("Claim contention for simulator {} (attempt {}/{}): {}",
                        simulatorId, attempt, claimRetries, e.getMessage());
            }
        }

        log.warn("Simulator {} gave up claiming after {} contended attempts", simulatorId, claimRetries);
        return Optional.empty();
    }

    /**
     * One select + delete + insert pass. Reports a race when the selected
     * queue row was taken by another transaction before our delete.
     */
    private ClaimAttempt claimOnce(Connection conn, String simulatorId) throws SQLException {
        if (!simulatorExists(conn, simulatorId)) {
            throw new ReferentialIntegrityException("Simulator not registered: " + simulatorId);
        }

        String selectSql = "SELECT id, priority FROM queue " + QueuePolicy.SQL_ORDER_BY + " LIMIT 1 FOR UPDATE";

        String id;
        int priority;
        try (PreparedStatement ps = conn.prepareStatement(selectSql);
                ResultSet rs = ps.executeQuery()) {
            if (!rs.next()) {
                // The locked read can come back empty after waiting on a row another claim deleted
                return queueHasEntries(conn) ? ClaimAttempt.RACED : ClaimAttempt.EMPTY;
            }
            id = rs.getString("id");
            priority = rs.getInt("priority");
        }

        try (PreparedStatement ps = conn.prepareStatement("DELETE FROM queue WHERE id = ?")) {
            ps.setString(1, id);
            if (ps.executeUpdate() != 1) {
                return ClaimAttempt.RACED;
            }
        }

        String insertSql = """
                    INSERT INTO running (simulator_id, id, priority, started_at)
                    VALUES (?, ?, ?, ?)
                """;
        try (PreparedStatement ps = conn.prepareStatement(insertSql)) {
            ps.setString(1, simulatorId);
            ps.setString(2, id);
            ps.setInt(3, priority);
            ps.setTimestamp(4, Timestamp.from(Instant.now()));
            ps.executeUpdate();
        }

        Simulation simulation = selectSimulation(conn, id, false)
                .orElseThrow(() -> new SQLException("Queued simulation has no descriptor: " + id));
        return new ClaimAttempt(simulation, false);
    }

    private record ClaimAttempt(Simulation simulation, boolean raced) {
        static final ClaimAttempt EMPTY = new ClaimAttempt(null, false);
        static final ClaimAttempt RACED = new ClaimAttempt(null, true);
    }

    @Override
    public void complete(String simulatorId, String simulationId, Instant finishedAt) {
        runningTransition(simulatorId, simulationId, "complete", conn -> {
            deleteRunning(conn, simulatorId, simulationId);

            // Same simulator finishing a re-run keeps one row with the latest time
            String updateSql = "UPDATE complete SET finish_datetime = ? WHERE simulator_id = ? AND id = ?";
            try (PreparedStatement ps = conn.prepareStatement(updateSql)) {
                ps.setTimestamp(1, Timestamp.from(finishedAt));
                ps.setString(2, simulatorId);
                ps.setString(3, simulationId);
                if (ps.executeUpdate() > 0) {
                    return null;
                }
            }

            String insertSql = "INSERT INTO complete (simulator_id, id, finish_datetime) VALUES (?, ?, ?)";
            try (PreparedStatement ps = conn.prepareStatement(insertSql)) {
                ps.setString(1, simulatorId);
                ps.setString(2, simulationId);
                ps.setTimestamp(3, Timestamp.from(finishedAt));
                ps.executeUpdate();
            }
            return null;
        });
    }

    @Override
    public RunningEntry requeue(String simulatorId, String simulationId, int priority) {
        return runningTransition(simulatorId, simulationId, "requeue", conn -> {
            RunningEntry entry = deleteRunning(conn, simulatorId, simulationId);
            insertQueueEntry(conn, simulationId, priority);
            return entry;
        });
    }

    /**
     * Lock and remove the running row, failing with NotRunning if it is absent.
     */
    private RunningEntry deleteRunning(Connection conn, String simulatorId, String simulationId)
            throws SQLException {
        String selectSql = "SELECT * FROM running WHERE simulator_id = ? AND id = ? FOR UPDATE";

        RunningEntry entry;
        try (PreparedStatement ps = conn.prepareStatement(selectSql)) {
            ps.setString(1, simulatorId);
            ps.setString(2, simulationId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    throw new NotRunningException(simulatorId, simulationId);
                }
                entry = mapRunning(rs);
            }
        }

        try (PreparedStatement ps = conn.prepareStatement("DELETE FROM running WHERE simulator_id = ? AND id = ?")) {
            ps.setString(1, simulatorId);
            ps.setString(2, simulationId);
            if (ps.executeUpdate() != 1) {
                throw new NotRunningException(simulatorId, simulationId);
            }
        }
        return entry;
    }

    @Override
    public void rerun(String simulationId, int priority) {
        inTransaction("re-run simulation: " + simulationId, conn -> {
            if (selectSimulation(conn, simulationId, true).isEmpty()) {
                throw new SimulationNotFoundException(simulationId);
            }

            SimulationState state = stateOf(conn, simulationId);
            if (state != SimulationState.COMPLETE) {
                throw new InvalidTransitionException(simulationId, state, "re-run");
            }

            insertQueueEntry(conn, simulationId, priority);
            return null;
        });
    }

    @Override
    public boolean delete(String simulationId) {
        return inTransaction("delete simulation: " + simulationId, conn -> {
            try (PreparedStatement ps = conn.prepareStatement("DELETE FROM simulation WHERE id = ?")) {
                ps.setString(1, simulationId);
                return ps.executeUpdate() > 0;
            }
        });
    }

    @Override
    public Optional<Simulation> findById(String simulationId) {
        try (Connection conn = db.getConnection()) {
            return selectSimulation(conn, simulationId, false);
        } catch (SQLException e) {
            throw new StoreException("Failed to find simulation: " + simulationId, e);
        }
    }

    @Override
    public Optional<SimulationState> findState(String simulationId) {
        try (Connection conn = db.getConnection()) {
            if (selectSimulation(conn, simulationId, false).isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(stateOf(conn, simulationId));
        } catch (SQLException e) {
            throw new StoreException("Failed to find state of simulation: " + simulationId, e);
        }
    }

    @Override
    public List<QueueEntry> findQueued(int limit) {
        String sql = "SELECT id, priority, seq FROM queue " + QueuePolicy.SQL_ORDER_BY + " LIMIT ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setInt(1, limit);
            List<QueueEntry> entries = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    entries.add(new QueueEntry(rs.getString("id"), rs.getInt("priority"), rs.getLong("seq")));
                }
            }
            return entries;
        } catch (SQLException e) {
            throw new StoreException("Failed to list queue", e);
        }
    }

    @Override
    public List<RunningEntry> findRunning() {
        String sql = "SELECT * FROM running ORDER BY started_at";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            return queryRunning(ps);
        } catch (SQLException e) {
            throw new StoreException("Failed to list running simulations", e);
        }
    }

    @Override
    public List<RunningEntry> findRunningBySimulator(String simulatorId) {
        String sql = "SELECT * FROM running WHERE simulator_id = ? ORDER BY started_at";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, simulatorId);
            return queryRunning(ps);
        } catch (SQLException e) {
            throw new StoreException("Failed to list simulations running on: " + simulatorId, e);
        }
    }

    @Override
    public List<CompleteEntry> findCompletions(String simulationId) {
        String sql = "SELECT * FROM complete WHERE id = ? ORDER BY finish_datetime";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, simulationId);
            List<CompleteEntry> entries = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    entries.add(new CompleteEntry(
                            rs.getString("simulator_id"),
                            rs.getString("id"),
                            toInstant(rs.getTimestamp("finish_datetime"))));
                }
            }
            return entries;
        } catch (SQLException e) {
            throw new StoreException("Failed to list completions of: " + simulationId, e);
        }
    }

    @Override
    public int countQueued() {
        return count("queue");
    }

    @Override
    public int countRunning() {
        return count("running");
    }

    @Override
    public int countCompleted() {
        return count("complete");
    }

    // Helper methods

    private int count(String table) {
        try (Connection conn = db.getConnection();
                Statement st = conn.createStatement();
                ResultSet rs = st.executeQuery("SELECT COUNT(*) FROM " + table)) {
            return rs.next() ? rs.getInt(1) : 0;
        } catch (SQLException e) {
            throw new StoreException("Failed to count " + table + " rows", e);
        }
    }

    @FunctionalInterface
    private interface SqlWork<T> {
        T run(Connection conn) throws SQLException;
    }

    private <T> T inTransaction(String what, SqlWork<T> work) {
        try (Connection conn = db.getConnection()) {
            try {
                T result = work.run(conn);
                conn.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                rollback(conn, e);
                throw e;
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to " + what, e);
        }
    }

    /**
     * Transaction over one running row. Losing a lock race on that row means
     * another caller already moved it, which the caller sees as NotRunning.
     */
    private <T> T runningTransition(String simulatorId, String simulationId, String what, SqlWork<T> work) {
        try (Connection conn = db.getConnection()) {
            try {
                T result = work.run(conn);
                conn.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                rollback(conn, e);
                throw e;
            }
        } catch (SQLException e) {
            if (SqlErrors.isContention(e)) {
                NotRunningException notRunning = new NotRunningException(simulatorId, simulationId);
                notRunning.initCause(e);
                throw notRunning;
            }
            throw new StoreException("Failed to " + what + " simulation: " + simulationId, e);
        }
    }

    private static void rollback(Connection conn, Exception cause) {
        try {
            conn.rollback();
        } catch (SQLException e) {
            cause.addSuppressed(e);
        }
    }

    private static boolean simulatorExists(Connection conn, String simulatorId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT 1 FROM simulator WHERE id = ?")) {
            ps.setString(1, simulatorId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    private static boolean queueHasEntries(Connection conn) throws SQLException {
        try (Statement st = conn.createStatement();
                ResultSet rs = st.executeQuery("SELECT 1 FROM queue LIMIT 1")) {
            return rs.next();
        }
    }

    private static Optional<Simulation> selectSimulation(Connection conn, String id, boolean forUpdate)
            throws SQLException {
        String sql = "SELECT * FROM simulation WHERE id = ?" + (forUpdate ? " FOR UPDATE" : "");

        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapSimulation(rs));
                }
            }
        }
        return Optional.empty();
    }

    private static SimulationState stateOf(Connection conn, String id) throws SQLException {
        String sql = """
                    SELECT
                        (SELECT COUNT(*) FROM queue WHERE id = ?)    AS queued,
                        (SELECT COUNT(*) FROM running WHERE id = ?)  AS running,
                        (SELECT COUNT(*) FROM complete WHERE id = ?) AS completed
                """;

        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, id);
            ps.setString(2, id);
            ps.setString(3, id);
            try (ResultSet rs = ps.executeQuery()) {
                rs.next();
                if (rs.getInt("queued") > 0) {
                    return SimulationState.QUEUED;
                }
                if (rs.getInt("running") > 0) {
                    return SimulationState.RUNNING;
                }
                if (rs.getInt("completed") > 0) {
                    return SimulationState.COMPLETE;
                }
                return SimulationState.UNSCHEDULED;
            }
        }
    }

    private static void insertSimulation(Connection conn, Simulation simulation) throws SQLException {
        String sql = """
                    INSERT INTO simulation (id, topology, destination, repetitions, min_delay, max_delay,
                                            threshold, stubs_file, seed, reportnodes)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, simulation.id());
            ps.setString(2, simulation.topology());
            ps.setInt(3, simulation.destination());
            ps.setInt(4, simulation.repetitions());
            ps.setInt(5, simulation.minDelay());
            ps.setInt(6, simulation.maxDelay());
            ps.setInt(7, simulation.threshold());
            ps.setString(8, simulation.stubsFile());
            setIntOrNull(ps, 9, simulation.seed());
            setBooleanOrNull(ps, 10, simulation.reportNodesOrNull());
            ps.executeUpdate();
        }
    }

    private static void insertQueueEntry(Connection conn, String simulationId, int priority) throws SQLException {
        String sql = "INSERT INTO queue (id, priority, seq) VALUES (?, ?, NEXT VALUE FOR queue_seq)";

        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, simulationId);
            ps.setInt(2, priority);
            ps.executeUpdate();
        }
    }

    private static List<RunningEntry> queryRunning(PreparedStatement ps) throws SQLException {
        List<RunningEntry> results = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                results.add(mapRunning(rs));
            }
        }
        return results;
    }

    private static RunningEntry mapRunning(ResultSet rs) throws SQLException {
        return new RunningEntry(
                rs.getString("simulator_id"),
                rs.getString("id"),
                rs.getInt("priority"),
                toInstant(rs.getTimestamp("started_at")));
    }

    private static Simulation mapSimulation(ResultSet rs) throws SQLException {
        return Simulation.builder()
                .id(rs.getString("id"))
                .topology(rs.getString("topology"))
                .destination(rs.getInt("destination"))
                .repetitions(rs.getInt("repetitions"))
                .minDelay(rs.getInt("min_delay"))
                .maxDelay(rs.getInt("max_delay"))
                .threshold(rs.getInt("threshold"))
                .stubsFile(rs.getString("stubs_file"))
                .seed(getIntOrNull(rs, "seed"))
                .reportNodes(getBooleanOrNull(rs, "reportnodes"))
                .build();
    }

    private static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }

    private static void setIntOrNull(PreparedStatement ps, int index, Integer value) throws SQLException {
        if (value != null) {
            ps.setInt(index, value);
        } else {
            ps.setNull(index, Types.INTEGER);
        }
    }

    private static void setBooleanOrNull(PreparedStatement ps, int index, Boolean value) throws SQLException {
        if (value != null) {
            ps.setBoolean(index, value);
        } else {
            ps.setNull(index, Types.BOOLEAN);
        }
    }

    private static Integer getIntOrNull(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }

    private static Boolean getBooleanOrNull(ResultSet rs, String column) throws SQLException {
        boolean value = rs.getBoolean(column);
        return rs.wasNull() ? null : value;
    }
}
