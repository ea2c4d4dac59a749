package dss.coordinator.api.v1;

import com.fasterxml.jackson.core.JsonProcessingException;
import dss.coordinator.api.Controller;
import dss.coordinator.api.internal.v1.dto.RegisterResponse;
import dss.coordinator.api.v1.dto.HealthResponse;
import dss.coordinator.exception.JobStoreException;
import dss.coordinator.server.RouterHandler;
import dss.coordinator.service.SimulationService;
import dss.coordinator.service.SimulatorService;
import dss.coordinator.store.Database;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.management.ManagementFactory;
import java.time.Duration;

/**
 * Health check controller.
 * GET /api/v1/health
 */
public class HealthController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);

    private final Database database;
    private final SimulationService simulationService;
    private final SimulatorService simulatorService;

    public HealthController(Database database, SimulationService simulationService,
            SimulatorService simulatorService) {
        this.database = database;
        this.simulationService = simulationService;
        this.simulatorService = simulatorService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/health".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            if (!database.isHealthy()) {
                return unhealthy("connection failed");
            }

            HealthResponse response = HealthResponse.healthy(
                    formatUptime(),
                    RegisterResponse.VERSION,
                    simulatorService.count(),
                    simulationService.countQueued(),
                    simulationService.countRunning(),
                    simulationService.countCompleted());

            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));

        } catch (JobStoreException e) {
            log.error("Health check failed", e);
            return unhealthy(e.getMessage());
        } catch (JsonProcessingException e) {
            log.error("Health response serialization failed", e);
            return ControllerResponse.error("health check failed");
        }
    }

    private ControllerResponse unhealthy(String reason) {
        try {
            return ControllerResponse.json(HttpResponseStatus.SERVICE_UNAVAILABLE,
                    RouterHandler.mapper().writeValueAsString(HealthResponse.unhealthy(reason)));
        } catch (JsonProcessingException e) {
            return ControllerResponse.error("health check failed");
        }
    }

    private String formatUptime() {
        long uptimeMs = ManagementFactory.getRuntimeMXBean().getUptime();
        Duration duration = Duration.ofMillis(uptimeMs);
        return duration.toHours() + "h " + duration.toMinutesPart() + "m";
    }
}
