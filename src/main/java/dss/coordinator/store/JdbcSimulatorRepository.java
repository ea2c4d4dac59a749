package dss.coordinator.store;

import dss.coordinator.exception.ReferentialIntegrityException;
import dss.coordinator.exception.StoreException;
import dss.coordinator.model.Simulator;
import dss.coordinator.repository.SimulatorRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * JDBC implementation of SimulatorRepository.
 */
public class JdbcSimulatorRepository implements SimulatorRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcSimulatorRepository.class);

    private final Database db;

    public JdbcSimulatorRepository(Database db) {
        this.db = db;
    }

    @Override
    public void upsert(String simulatorId, Instant now) {
        String updateSql = "UPDATE simulator SET last_heartbeat = ? WHERE id = ?";
        String insertSql = "INSERT INTO simulator (id, registered_at, last_heartbeat) VALUES (?, ?, ?)";

        try (Connection conn = db.getConnection()) {
            Timestamp ts = Timestamp.from(now);

            try (PreparedStatement ps = conn.prepareStatement(updateSql)) {
                ps.setTimestamp(1, ts);
                ps.setString(2, simulatorId);

                if (ps.executeUpdate() == 0) {
                    try (PreparedStatement insertPs = conn.prepareStatement(insertSql)) {
                        insertPs.setString(1, simulatorId);
                        insertPs.setTimestamp(2, ts);
                        insertPs.setTimestamp(3, ts);
                        insertPs.executeUpdate();
                    }
                    log.debug("Inserted simulator row {}", simulatorId);
                }
            } catch (SQLException e) {
                conn.rollback();
                // Two registrations raced on insert; the other one created the row
                if (SqlErrors.isDuplicateKey(e)) {
                    log.debug("Simulator {} registered concurrently", simulatorId);
                    return;
                }
                throw e;
            }

            conn.commit();
        } catch (SQLException e) {
            throw new StoreException("Failed to upsert simulator: " + simulatorId, e);
        }
    }

    @Override
    public Optional<Simulator> findById(String simulatorId) {
        String sql = "SELECT * FROM simulator WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, simulatorId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new StoreException("Failed to find simulator: " + simulatorId, e);
        }
    }

    @Override
    public List<Simulator> findAll() {
        String sql = "SELECT * FROM simulator ORDER BY last_heartbeat DESC";

        try (Connection conn = db.getConnection();
                Statement st = conn.createStatement();
                ResultSet rs = st.executeQuery(sql)) {

            return mapRows(rs);
        } catch (SQLException e) {
            throw new StoreException("Failed to find all simulators", e);
        }
    }

    @Override
    public List<Simulator> findStale(Instant heartbeatBefore) {
        String sql = "SELECT * FROM simulator WHERE last_heartbeat < ? ORDER BY last_heartbeat";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, Timestamp.from(heartbeatBefore));
            try (ResultSet rs = ps.executeQuery()) {
                return mapRows(rs);
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to find stale simulators", e);
        }
    }

    @Override
    public boolean delete(String simulatorId) {
        String sql = "DELETE FROM simulator WHERE id = ?";

        try (Connection conn = db.getConnection()) {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setString(1, simulatorId);
                int deleted = ps.executeUpdate();
                conn.commit();
                return deleted > 0;
            } catch (SQLException e) {
                conn.rollback();
                if (SqlErrors.isChildExists(e)) {
                    throw new ReferentialIntegrityException(
                            "Simulator " + simulatorId + " still has running or completed simulations", e);
                }
                throw e;
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to delete simulator: " + simulatorId, e);
        }
    }

    @Override
    public int count() {
        String sql = "SELECT COUNT(*) FROM simulator";

        try (Connection conn = db.getConnection();
                Statement st = conn.createStatement();
                ResultSet rs = st.executeQuery(sql)) {

            if (rs.next()) {
                return rs.getInt(1);
            }
            return 0;
        } catch (SQLException e) {
            throw new StoreException("Failed to count simulators", e);
        }
    }

    // Helper methods

    private List<Simulator> mapRows(ResultSet rs) throws SQLException {
        List<Simulator> results = new ArrayList<>();
        while (rs.next()) {
            results.add(mapRow(rs));
        }
        return results;
    }

    private Simulator mapRow(ResultSet rs) throws SQLException {
        return Simulator.builder()
                .id(rs.getString("id"))
                .registeredAt(toInstant(rs.getTimestamp("registered_at")))
                .lastHeartbeat(toInstant(rs.getTimestamp("last_heartbeat")))
                .build();
    }

    private static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }
}
