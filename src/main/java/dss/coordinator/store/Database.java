package dss.coordinator.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import dss.coordinator.config.CoordinatorConfig;
import dss.coordinator.exception.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Database connection pool and schema management.
 * Uses HikariCP for connection pooling. Connections are handed out with
 * auto-commit disabled; every caller commits or rolls back explicitly.
 */
public final class Database implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private final HikariDataSource dataSource;

    public Database(CoordinatorConfig config) {
        this(config.databaseUrl(), config.databasePoolSize());
    }

    public Database(String jdbcUrl, int poolSize) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(Math.min(2, poolSize));
        hikariConfig.setConnectionTimeout(5000);
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName("dss-db-pool");
        hikariConfig.setAutoCommit(false);
        hikariConfig.setTransactionIsolation("TRANSACTION_READ_COMMITTED");

        this.dataSource = new HikariDataSource(hikariConfig);

        log.info("Database pool initialized: {}", jdbcUrl);

        initSchema();
    }

    /**
     * Get a connection from the pool.
     * Caller is responsible for closing the connection.
     */
    public Connection getConnection() throws SQLException {
        return dataSource.getConnection();
    }

    public DataSource getDataSource() {
        return dataSource;
    }

    /**
     * Check if database is healthy.
     */
    public boolean isHealthy() {
        try (Connection conn = getConnection()) {
            return conn.isValid(2);
        } catch (SQLException e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Create tables, the queue sequence and indexes if they do not exist.
     * Simulator rows are protected (NO ACTION) while running or complete rows
     * reference them; simulation rows cascade to their queue/running/complete rows.
     */
    private void initSchema() {
        try (Connection conn = getConnection();
                Statement st = conn.createStatement()) {

            // ---------- SIMULATION ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS simulation (
                            id          VARCHAR(64)   PRIMARY KEY,
                            topology    VARCHAR(1024) NOT NULL,
                            destination INT           NOT NULL,
                            repetitions INT           NOT NULL,
                            min_delay   INT           NOT NULL,
                            max_delay   INT           NOT NULL,
                            threshold   INT           NOT NULL,
                            stubs_file  VARCHAR(1024) NOT NULL,
                            seed        INT,
                            reportnodes BOOLEAN
                        );
                    """);

            // ---------- SIMULATOR ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS simulator (
                            id             VARCHAR(64) PRIMARY KEY,
                            registered_at  TIMESTAMP   DEFAULT CURRENT_TIMESTAMP,
                            last_heartbeat TIMESTAMP   DEFAULT CURRENT_TIMESTAMP
                        );
                    """);

            st.addBatch("CREATE SEQUENCE IF NOT EXISTS queue_seq START WITH 1;");

            // ---------- QUEUE ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS queue (
                            id       VARCHAR(64) PRIMARY KEY,
                            priority INT         NOT NULL,
                            seq      BIGINT      NOT NULL,
                            FOREIGN KEY (id) REFERENCES simulation (id) ON DELETE CASCADE
                        );
                    """);

            // ---------- RUNNING ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS running (
                            simulator_id VARCHAR(64) NOT NULL,
                            id           VARCHAR(64) NOT NULL,
                            priority     INT         NOT NULL,
                            started_at   TIMESTAMP   NOT NULL,
                            PRIMARY KEY (simulator_id, id),
                            FOREIGN KEY (simulator_id) REFERENCES simulator (id) ON DELETE NO ACTION,
                            FOREIGN KEY (id) REFERENCES simulation (id) ON DELETE CASCADE
                        );
                    """);

            // ---------- COMPLETE ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS complete (
                            simulator_id    VARCHAR(64) NOT NULL,
                            id              VARCHAR(64) NOT NULL,
                            finish_datetime TIMESTAMP   NOT NULL,
                            PRIMARY KEY (simulator_id, id),
                            FOREIGN KEY (simulator_id) REFERENCES simulator (id) ON DELETE NO ACTION,
                            FOREIGN KEY (id) REFERENCES simulation (id) ON DELETE CASCADE
                        );
                    """);

            // Indexes
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_queue_order ON queue(priority DESC, seq);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_running_simulation ON running(id);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_complete_simulation ON complete(id);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_simulator_heartbeat ON simulator(last_heartbeat);");

            st.executeBatch();
            conn.commit();

            log.info("Database schema initialized");
        } catch (SQLException e) {
            throw new StoreException("Failed to initialize database schema", e);
        }
    }

    @Override
    public void close() {
        if (dataSource != null && !dataSource.isClosed()) {
            dataSource.close();
            log.info("Database pool closed");
        }
    }
}
