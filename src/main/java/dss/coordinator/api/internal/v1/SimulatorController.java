package dss.coordinator.api.internal.v1;

import com.fasterxml.jackson.core.JsonProcessingException;
import dss.coordinator.api.Controller;
import dss.coordinator.api.internal.v1.dto.OperationResponse;
import dss.coordinator.api.internal.v1.dto.RegisterResponse;
import dss.coordinator.api.internal.v1.dto.SimulatorRequest;
import dss.coordinator.exception.JobStoreException;
import dss.coordinator.server.RouterHandler;
import dss.coordinator.service.SimulatorService;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;

/**
 * Controller for simulator registration and heartbeat (internal API).
 * POST /internal/v1/simulators/register - Register a simulator
 * POST /internal/v1/simulators/heartbeat - Simulator liveness signal
 */
public class SimulatorController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(SimulatorController.class);

    private static final String REGISTER_PATH = "/internal/v1/simulators/register";
    private static final String HEARTBEAT_PATH = "/internal/v1/simulators/heartbeat";

    private final SimulatorService simulatorService;

    public SimulatorController(SimulatorService simulatorService) {
        this.simulatorService = simulatorService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (!method.equals(HttpMethod.POST)) {
            return false;
        }
        return REGISTER_PATH.equals(path) || HEARTBEAT_PATH.equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            String body = req.content().toString(StandardCharsets.UTF_8);
            SimulatorRequest request = RouterHandler.mapper().readValue(body, SimulatorRequest.class);
            request.validate();

            if (REGISTER_PATH.equals(path)) {
                simulatorService.register(request.simulatorId());
                RegisterResponse response = RegisterResponse.create(request.simulatorId());
                return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
            }

            simulatorService.heartbeat(request.simulatorId());
            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(OperationResponse.success()));

        } catch (JsonProcessingException e) {
            return ControllerResponse.badRequest("invalid JSON body");
        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (JobStoreException e) {
            log.error("Simulator request failed: {}", path, e);
            return ControllerResponse.rejected(e);
        }
    }
}
