package dss.coordinator.server;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import dss.coordinator.api.Controller;
import dss.coordinator.api.Controller.ControllerResponse;
import dss.coordinator.config.CoordinatorConfig;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandler.Sharable;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static io.netty.handler.codec.http.HttpHeaderNames.CONTENT_TYPE;
import static io.netty.handler.codec.http.HttpResponseStatus.*;
import static io.netty.handler.codec.http.HttpVersion.HTTP_1_1;

/**
 * Central router that dispatches HTTP requests to registered controllers.
 *
 * Only handles versioned API endpoints:
 * - /api/v1/* (operator API)
 * - /internal/v1/* (simulator API, guarded by X-Dss-Key when a key is configured)
 *
 * All other endpoints return 404.
 *
 * This handler is @Sharable because it has no per-channel state.
 */
@Sharable
public class RouterHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    public static final String KEY_HEADER = "X-Dss-Key";

    private static final Logger log = LoggerFactory.getLogger(RouterHandler.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .findAndRegisterModules();

    private final List<Controller> controllers = new ArrayList<>();
    private final CoordinatorConfig config;

    public RouterHandler(CoordinatorConfig config) {
        this.config = config;
    }

    /**
     * Register a controller to handle requests.
     * Controllers are checked in order of registration.
     */
    public RouterHandler registerController(Controller controller) {
        controllers.add(controller);
        log.debug("Registered controller: {}", controller.getClass().getSimpleName());
        return this;
    }

    public int controllerCount() {
        return controllers.size();
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest req) {
        String uri = req.uri();
        HttpMethod method = req.method();

        String path = uri.contains("?") ? uri.substring(0, uri.indexOf("?")) : uri;

        try {
            if (!checkAuth(req, path)) {
                log.warn("Auth failed for {} {}", method, path);
                write(ctx, req, FORBIDDEN, "application/json", "{\"error\":\"forbidden\"}");
                return;
            }

            for (Controller controller : controllers) {
                if (controller.matches(method, path)) {
                    ControllerResponse response = controller.handle(ctx, req, path);
                    write(ctx, req, response.status(), response.contentType(), response.body());
                    return;
                }
            }

            log.debug("No handler for: {} {}", method, path);
            write(ctx, req, NOT_FOUND, "application/json", "{\"error\":\"not found\"}");

        } catch (IllegalArgumentException e) {
            log.warn("Validation error: {}", e.getMessage());
            write(ctx, req, BAD_REQUEST, "application/json",
                    "{\"error\":\"" + escapeJson(e.getMessage()) + "\"}");
        } catch (RuntimeException e) {
            log.error("Handler error: {} {}", method, path, e);
            write(ctx, req, INTERNAL_SERVER_ERROR, "application/json", "{\"error\":\"internal error\"}");
        }
    }

    /**
     * Only internal endpoints require the key, and only when one is configured.
     */
    private boolean checkAuth(FullHttpRequest req, String path) {
        if (!config.hasAgentKey()) {
            return true;
        }
        if (!path.startsWith("/internal/")) {
            return true;
        }
        return config.agentKey().equals(req.headers().get(KEY_HEADER));
    }

    private void write(ChannelHandlerContext ctx, FullHttpRequest req, HttpResponseStatus status,
            String contentType, String body) {
        byte[] bytes = (body == null ? "" : body).getBytes(StandardCharsets.UTF_8);
        FullHttpResponse response = new DefaultFullHttpResponse(HTTP_1_1, status, Unpooled.wrappedBuffer(bytes));
        response.headers().set(CONTENT_TYPE, contentType + "; charset=utf-8");
        response.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, bytes.length);

        boolean keepAlive = HttpUtil.isKeepAlive(req);
        HttpUtil.setKeepAlive(response, keepAlive);
        if (keepAlive) {
            ctx.writeAndFlush(response);
        } else {
            ctx.writeAndFlush(response).addListener(ChannelFutureListener.CLOSE);
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("Unhandled exception in channel: {}", cause.getMessage(), cause);
        ctx.close();
    }

    private static String escapeJson(String s) {
        if (s == null)
            return "";
        return s.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n").replace("\r", "\\r");
    }

    /**
     * Get the shared ObjectMapper for JSON serialization.
     */
    public static ObjectMapper mapper() {
        return MAPPER;
    }
}
