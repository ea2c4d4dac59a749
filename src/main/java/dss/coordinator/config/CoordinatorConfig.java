package dss.coordinator.config;

import org.ini4j.Ini;
import org.ini4j.Profile;

import java.io.File;
import java.io.IOException;
import java.time.Duration;

/**
 * Configuration holder for coordinator settings.
 * All settings have sensible defaults; an INI file and then environment
 * variables override them.
 */
public final class CoordinatorConfig {

    // Database settings
    private String databaseUrl = "jdbc:h2:file:./data/simulations;AUTO_SERVER=TRUE;DATABASE_TO_UPPER=FALSE";
    private int databasePoolSize = 10;

    // Server settings
    private int serverPort = 8080;
    private String serverHost = "0.0.0.0";

    // Queue settings
    private int defaultPriority = 0;
    private int failureBoost = 1;
    private int claimRetries = 5;

    // Simulator liveness
    private Duration heartbeatTimeout = Duration.ofMinutes(2);
    private Duration reaperInterval = Duration.ofSeconds(30);

    // Auth settings (optional)
    private String agentKey = null; // If set, simulators must provide X-Dss-Key header

    private CoordinatorConfig() {
    }

    public static CoordinatorConfig defaults() {
        return new CoordinatorConfig();
    }

    public static CoordinatorConfig fromEnv() {
        return defaults().applyEnv();
    }

    /**
     * Load settings from an INI file, then apply environment overrides.
     *
     * <pre>
     * [database]
     * url = jdbc:h2:file:./data/simulations
     * pool_size = 10
     * [server]
     * host = 0.0.0.0
     * port = 8080
     * agent_key = secret
     * [queue]
     * default_priority = 0
     * failure_boost = 1
     * claim_retries = 5
     * [liveness]
     * heartbeat_timeout_seconds = 120
     * reaper_interval_seconds = 30
     * </pre>
     */
    public static CoordinatorConfig fromIni(File file) throws IOException {
        Ini ini = new Ini(file);
        CoordinatorConfig config = new CoordinatorConfig();

        Profile.Section database = ini.get("database");
        if (database != null) {
            config.databaseUrl = opt(database, "url", config.databaseUrl);
            config.databasePoolSize = optInt(database, "pool_size", config.databasePoolSize);
        }

        Profile.Section server = ini.get("server");
        if (server != null) {
            config.serverHost = opt(server, "host", config.serverHost);
            config.serverPort = optInt(server, "port", config.serverPort);
            config.agentKey = opt(server, "agent_key", config.agentKey);
        }

        Profile.Section queue = ini.get("queue");
        if (queue != null) {
            config.defaultPriority = optInt(queue, "default_priority", config.defaultPriority);
            config.failureBoost = optInt(queue, "failure_boost", config.failureBoost);
            config.claimRetries = optInt(queue, "claim_retries", config.claimRetries);
        }

        Profile.Section liveness = ini.get("liveness");
        if (liveness != null) {
            config.heartbeatTimeout = Duration.ofSeconds(
                    optInt(liveness, "heartbeat_timeout_seconds", (int) config.heartbeatTimeout.toSeconds()));
            config.reaperInterval = Duration.ofSeconds(
                    optInt(liveness, "reaper_interval_seconds", (int) config.reaperInterval.toSeconds()));
        }

        return config.applyEnv();
    }

    private CoordinatorConfig applyEnv() {
        String dbUrl = System.getenv("DSS_DB_URL");
        if (dbUrl != null && !dbUrl.isBlank()) {
            databaseUrl = dbUrl;
        }

        String port = System.getenv("DSS_PORT");
        if (port != null && !port.isBlank()) {
            serverPort = Integer.parseInt(port.trim());
        }

        String key = System.getenv("DSS_AGENT_KEY");
        if (key != null && !key.isBlank()) {
            agentKey = key;
        }

        String boost = System.getenv("DSS_FAILURE_BOOST");
        if (boost != null && !boost.isBlank()) {
            failureBoost = Integer.parseInt(boost.trim());
        }

        String timeout = System.getenv("DSS_HEARTBEAT_TIMEOUT_SECONDS");
        if (timeout != null && !timeout.isBlank()) {
            heartbeatTimeout = Duration.ofSeconds(Long.parseLong(timeout.trim()));
        }

        return this;
    }

    private static String opt(Profile.Section section, String key, String def) {
        String value = section.get(key);
        return (value == null || value.isBlank()) ? def : value.trim();
    }

    private static int optInt(Profile.Section section, String key, int def) {
        String value = section.get(key);
        if (value == null || value.isBlank()) {
            return def;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("[" + section.getName() + "] " + key + " is not a number: " + value, e);
        }
    }

    // Getters
    public String databaseUrl() {
        return databaseUrl;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public int serverPort() {
        return serverPort;
    }

    public String serverHost() {
        return serverHost;
    }

    public int defaultPriority() {
        return defaultPriority;
    }

    public int failureBoost() {
        return failureBoost;
    }

    public int claimRetries() {
        return claimRetries;
    }

    public Duration heartbeatTimeout() {
        return heartbeatTimeout;
    }

    public Duration reaperInterval() {
        return reaperInterval;
    }

    public String agentKey() {
        return agentKey;
    }

    public boolean hasAgentKey() {
        return agentKey != null && !agentKey.isBlank();
    }

    // Fluent setters for testing/customization
    public CoordinatorConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public CoordinatorConfig withDatabasePoolSize(int poolSize) {
        this.databasePoolSize = poolSize;
        return this;
    }

    public CoordinatorConfig withServerPort(int port) {
        this.serverPort = port;
        return this;
    }

    public CoordinatorConfig withServerHost(String host) {
        this.serverHost = host;
        return this;
    }

    public CoordinatorConfig withAgentKey(String key) {
        this.agentKey = key;
        return this;
    }

    public CoordinatorConfig withDefaultPriority(int priority) {
        this.defaultPriority = priority;
        return this;
    }

    public CoordinatorConfig withFailureBoost(int boost) {
        this.failureBoost = boost;
        return this;
    }

    public CoordinatorConfig withClaimRetries(int retries) {
        this.claimRetries = retries;
        return this;
    }

    public CoordinatorConfig withHeartbeatTimeout(Duration timeout) {
        this.heartbeatTimeout = timeout;
        return this;
    }

    public CoordinatorConfig withReaperInterval(Duration interval) {
        this.reaperInterval = interval;
        return this;
    }

    @Override
    public String toString() {
        return "CoordinatorConfig{" +
                "databaseUrl='" + databaseUrl + '\'' +
                ", serverPort=" + serverPort +
                ", failureBoost=" + failureBoost +
                ", heartbeatTimeout=" + heartbeatTimeout +
                ", agentKeySet=" + hasAgentKey() +
                '}';
    }
}
