package dss.coordinator.api.internal.v1;

import com.fasterxml.jackson.core.JsonProcessingException;
import dss.coordinator.api.Controller;
import dss.coordinator.api.internal.v1.dto.*;
import dss.coordinator.exception.JobStoreException;
import dss.coordinator.exception.NotRunningException;
import dss.coordinator.exception.ReferentialIntegrityException;
import dss.coordinator.model.Simulation;
import dss.coordinator.server.RouterHandler;
import dss.coordinator.service.AssignmentService;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for the assignment protocol (internal API).
 * POST /internal/v1/simulations/claim - Claim the next queued simulation
 * POST /internal/v1/simulations/{simulationId}/complete - Report a finished run
 * POST /internal/v1/simulations/{simulationId}/fail - Report a failed run, requeues it
 */
public class SimulationController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(SimulationController.class);

    private static final Pattern CLAIM_PATTERN = Pattern.compile("^/internal/v1/simulations/claim$");
    private static final Pattern COMPLETE_PATTERN = Pattern.compile("^/internal/v1/simulations/([^/]+)/complete$");
    private static final Pattern FAIL_PATTERN = Pattern.compile("^/internal/v1/simulations/([^/]+)/fail$");

    private final AssignmentService assignmentService;

    public SimulationController(AssignmentService assignmentService) {
        this.assignmentService = assignmentService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (!method.equals(HttpMethod.POST)) {
            return false;
        }
        return CLAIM_PATTERN.matcher(path).matches()
                || COMPLETE_PATTERN.matcher(path).matches()
                || FAIL_PATTERN.matcher(path).matches();
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            if (CLAIM_PATTERN.matcher(path).matches()) {
                return handleClaim(req);
            }

            Matcher completeMatcher = COMPLETE_PATTERN.matcher(path);
            if (completeMatcher.matches()) {
                return handleComplete(req, completeMatcher.group(1));
            }

            Matcher failMatcher = FAIL_PATTERN.matcher(path);
            if (failMatcher.matches()) {
                return handleFail(req, failMatcher.group(1));
            }

            return ControllerResponse.notFound("unknown simulation endpoint");

        } catch (JsonProcessingException e) {
            return ControllerResponse.badRequest("invalid JSON body");
        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (NotRunningException | ReferentialIntegrityException e) {
            return ControllerResponse.conflict(e.getMessage());
        } catch (JobStoreException e) {
            log.error("Simulation controller error on {}", path, e);
            return ControllerResponse.rejected(e);
        }
    }

    /**
     * POST /internal/v1/simulations/claim
     */
    private ControllerResponse handleClaim(FullHttpRequest req) throws JsonProcessingException {
        SimulatorRequest request = readBody(req, SimulatorRequest.class);
        request.validate();

        Optional<Simulation> claimed = assignmentService.claimNext(request.simulatorId());

        ClaimResponse response = claimed.map(ClaimResponse::from).orElseGet(ClaimResponse::empty);
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
    }

    /**
     * POST /internal/v1/simulations/{simulationId}/complete
     */
    private ControllerResponse handleComplete(FullHttpRequest req, String simulationId)
            throws JsonProcessingException {
        CompleteRequest request = readBody(req, CompleteRequest.class);
        request.validate();

        assignmentService.complete(request.simulatorId(), simulationId, request.finishedAt());

        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(OperationResponse.success()));
    }

    /**
     * POST /internal/v1/simulations/{simulationId}/fail
     */
    private ControllerResponse handleFail(FullHttpRequest req, String simulationId) throws JsonProcessingException {
        FailRequest request = readBody(req, FailRequest.class);
        request.validate();

        int priority;
        if (request.priority() != null) {
            priority = request.priority();
            assignmentService.requeue(request.simulatorId(), simulationId, priority);
            log.info("Simulation {} failed on simulator {} ({}), requeued with requested priority {}",
                    simulationId, request.simulatorId(), request.error(), priority);
        } else {
            priority = assignmentService.fail(request.simulatorId(), simulationId, request.error());
        }

        return ControllerResponse.json(HttpResponseStatus.OK,
                RouterHandler.mapper().writeValueAsString(OperationResponse.requeued(priority)));
    }

    private static <T> T readBody(FullHttpRequest req, Class<T> type) throws JsonProcessingException {
        String body = req.content().toString(StandardCharsets.UTF_8);
        if (body.isBlank()) {
            throw new IllegalArgumentException("request body is required");
        }
        return RouterHandler.mapper().readValue(body, type);
    }
}
