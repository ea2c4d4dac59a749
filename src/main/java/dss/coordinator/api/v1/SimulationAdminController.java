package dss.coordinator.api.v1;

import com.fasterxml.jackson.core.JsonProcessingException;
import dss.coordinator.api.Controller;
import dss.coordinator.api.v1.dto.EnqueueRequest;
import dss.coordinator.api.v1.dto.QueueEntryResponse;
import dss.coordinator.api.v1.dto.RerunRequest;
import dss.coordinator.api.v1.dto.SimulationResponse;
import dss.coordinator.exception.JobStoreException;
import dss.coordinator.model.Simulation;
import dss.coordinator.model.SimulationState;
import dss.coordinator.server.RouterHandler;
import dss.coordinator.service.SimulationService;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.QueryStringDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for simulation management (public API).
 *
 * POST /api/v1/simulations - Queue a simulation
 * GET /api/v1/simulations/{simulationId} - Descriptor and state
 * DELETE /api/v1/simulations/{simulationId} - Delete with all its history
 * POST /api/v1/simulations/{simulationId}/rerun - Queue a completed simulation again
 * GET /api/v1/queue?limit=n - Queued simulations in claim order
 */
public class SimulationAdminController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(SimulationAdminController.class);

    private static final int DEFAULT_QUEUE_LIMIT = 100;

    private static final Pattern SIMULATIONS_PATTERN = Pattern.compile("^/api/v1/simulations$");
    private static final Pattern SIMULATION_BY_ID_PATTERN = Pattern.compile("^/api/v1/simulations/([^/]+)$");
    private static final Pattern RERUN_PATTERN = Pattern.compile("^/api/v1/simulations/([^/]+)/rerun$");
    private static final Pattern QUEUE_PATTERN = Pattern.compile("^/api/v1/queue$");

    private final SimulationService simulationService;

    public SimulationAdminController(SimulationService simulationService) {
        this.simulationService = simulationService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.POST)) {
            return SIMULATIONS_PATTERN.matcher(path).matches() || RERUN_PATTERN.matcher(path).matches();
        }
        if (method.equals(HttpMethod.GET)) {
            return SIMULATION_BY_ID_PATTERN.matcher(path).matches() || QUEUE_PATTERN.matcher(path).matches();
        }
        if (method.equals(HttpMethod.DELETE)) {
            return SIMULATION_BY_ID_PATTERN.matcher(path).matches();
        }
        return false;
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            HttpMethod method = req.method();

            if (method.equals(HttpMethod.POST) && SIMULATIONS_PATTERN.matcher(path).matches()) {
                return handleEnqueue(req);
            }

            Matcher rerunMatcher = RERUN_PATTERN.matcher(path);
            if (method.equals(HttpMethod.POST) && rerunMatcher.matches()) {
                return handleRerun(req, rerunMatcher.group(1));
            }

            if (method.equals(HttpMethod.GET) && QUEUE_PATTERN.matcher(path).matches()) {
                return handleQueue(req);
            }

            Matcher idMatcher = SIMULATION_BY_ID_PATTERN.matcher(path);
            if (idMatcher.matches()) {
                String simulationId = idMatcher.group(1);
                if (method.equals(HttpMethod.GET)) {
                    return handleGet(simulationId);
                }
                if (method.equals(HttpMethod.DELETE)) {
                    return handleDelete(simulationId);
                }
            }

            return ControllerResponse.notFound("unknown simulation endpoint");

        } catch (JsonProcessingException e) {
            return ControllerResponse.badRequest("invalid JSON body");
        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (JobStoreException e) {
            log.debug("Simulation request rejected on {}: {}", path, e.getMessage());
            return ControllerResponse.rejected(e);
        }
    }

    /**
     * POST /api/v1/simulations
     */
    private ControllerResponse handleEnqueue(FullHttpRequest req) throws JsonProcessingException {
        String body = req.content().toString(StandardCharsets.UTF_8);
        EnqueueRequest request = RouterHandler.mapper().readValue(body, EnqueueRequest.class);
        request.validate();

        Simulation simulation = request.toSimulation();
        boolean queued = request.priority() != null
                ? simulationService.enqueue(simulation, request.priority())
                : simulationService.enqueue(simulation);

        Map<String, Object> response = Map.of(
                "simulationId", simulation.id(),
                "queued", queued);

        return ControllerResponse.json(
                queued ? HttpResponseStatus.CREATED : HttpResponseStatus.OK,
                RouterHandler.mapper().writeValueAsString(response));
    }

    /**
     * POST /api/v1/simulations/{simulationId}/rerun
     */
    private ControllerResponse handleRerun(FullHttpRequest req, String simulationId) throws JsonProcessingException {
        String body = req.content().toString(StandardCharsets.UTF_8);
        RerunRequest request = body.isBlank()
                ? new RerunRequest(null)
                : RouterHandler.mapper().readValue(body, RerunRequest.class);

        if (request.priority() != null) {
            simulationService.rerun(simulationId, request.priority());
        } else {
            simulationService.rerun(simulationId);
        }

        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(
                Map.of("simulationId", simulationId, "state", SimulationState.QUEUED)));
    }

    /**
     * GET /api/v1/simulations/{simulationId}
     */
    private ControllerResponse handleGet(String simulationId) throws JsonProcessingException {
        Optional<Simulation> simulation = simulationService.findById(simulationId);
        if (simulation.isEmpty()) {
            return ControllerResponse.notFound("simulation not found");
        }

        SimulationState state = simulationService.findState(simulationId).orElse(SimulationState.UNSCHEDULED);
        SimulationResponse response = SimulationResponse.from(
                simulation.get(), state, simulationService.completions(simulationId));
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
    }

    /**
     * DELETE /api/v1/simulations/{simulationId}
     */
    private ControllerResponse handleDelete(String simulationId) throws JsonProcessingException {
        if (!simulationService.delete(simulationId)) {
            return ControllerResponse.notFound("simulation not found");
        }
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(
                Map.of("simulationId", simulationId, "deleted", true)));
    }

    /**
     * GET /api/v1/queue?limit=n
     */
    private ControllerResponse handleQueue(FullHttpRequest req) throws JsonProcessingException {
        QueryStringDecoder decoder = new QueryStringDecoder(req.uri());
        List<String> limitParam = decoder.parameters().get("limit");

        int limit = DEFAULT_QUEUE_LIMIT;
        if (limitParam != null && !limitParam.isEmpty()) {
            try {
                limit = Integer.parseInt(limitParam.get(0));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("limit must be a number", e);
            }
        }

        List<QueueEntryResponse> entries = simulationService.queued(limit).stream()
                .map(QueueEntryResponse::from)
                .toList();
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(entries));
    }
}
