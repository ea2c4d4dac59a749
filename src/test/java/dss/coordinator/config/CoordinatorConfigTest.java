package dss.coordinator.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class CoordinatorConfigTest {

    @TempDir
    Path dir;

    @Test
    void defaults() {
        CoordinatorConfig config = CoordinatorConfig.defaults();

        assertEquals(8080, config.serverPort());
        assertEquals(0, config.defaultPriority());
        assertEquals(1, config.failureBoost());
        assertEquals(5, config.claimRetries());
        assertEquals(Duration.ofMinutes(2), config.heartbeatTimeout());
        assertFalse(config.hasAgentKey());
    }

    @Test
    void iniSectionsOverrideDefaults() throws IOException {
        Path ini = dir.resolve("dss.ini");
        Files.writeString(ini, """
                [database]
                url = jdbc:h2:mem:ini-test
                pool_size = 3

                [server]
                port = 9090
                agent_key = s3cret

                [queue]
                default_priority = 2
                failure_boost = 5

                [liveness]
                heartbeat_timeout_seconds = 45
                """);

        CoordinatorConfig config = CoordinatorConfig.fromIni(ini.toFile());

        assertEquals("jdbc:h2:mem:ini-test", config.databaseUrl());
        assertEquals(3, config.databasePoolSize());
        assertEquals(9090, config.serverPort());
        assertEquals("0.0.0.0", config.serverHost());
        assertTrue(config.hasAgentKey());
        assertEquals(2, config.defaultPriority());
        assertEquals(5, config.failureBoost());
        assertEquals(5, config.claimRetries());
        assertEquals(Duration.ofSeconds(45), config.heartbeatTimeout());
        assertEquals(Duration.ofSeconds(30), config.reaperInterval());
    }

    @Test
    void nonNumericValueIsReported() throws IOException {
        Path ini = dir.resolve("bad.ini");
        Files.writeString(ini, "[server]\nport = eighty\n");

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> CoordinatorConfig.fromIni(ini.toFile()));
        assertTrue(e.getMessage().contains("port"));
    }

    @Test
    void withersReturnSameInstance() {
        CoordinatorConfig config = CoordinatorConfig.defaults();
        assertSame(config, config.withServerPort(1234));
        assertEquals(1234, config.serverPort());
    }
}
