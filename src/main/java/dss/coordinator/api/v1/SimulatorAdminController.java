package dss.coordinator.api.v1;

import com.fasterxml.jackson.core.JsonProcessingException;
import dss.coordinator.api.Controller;
import dss.coordinator.exception.JobStoreException;
import dss.coordinator.server.RouterHandler;
import dss.coordinator.service.SimulatorService;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for simulator management (public API).
 * DELETE /api/v1/simulators/{simulatorId} - Remove a simulator with no recorded work
 */
public class SimulatorAdminController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(SimulatorAdminController.class);

    private static final Pattern SIMULATOR_BY_ID_PATTERN = Pattern.compile("^/api/v1/simulators/([^/]+)$");

    private final SimulatorService simulatorService;

    public SimulatorAdminController(SimulatorService simulatorService) {
        this.simulatorService = simulatorService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.DELETE) && SIMULATOR_BY_ID_PATTERN.matcher(path).matches();
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        Matcher matcher = SIMULATOR_BY_ID_PATTERN.matcher(path);
        if (!matcher.matches()) {
            return ControllerResponse.notFound("unknown simulator endpoint");
        }
        String simulatorId = matcher.group(1);

        try {
            if (!simulatorService.delete(simulatorId)) {
                return ControllerResponse.notFound("simulator not found");
            }
            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(
                    Map.of("simulatorId", simulatorId, "deleted", true)));

        } catch (JsonProcessingException e) {
            return ControllerResponse.error("failed to serialize response");
        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (JobStoreException e) {
            log.debug("Simulator delete rejected for {}: {}", simulatorId, e.getMessage());
            return ControllerResponse.rejected(e);
        }
    }
}
