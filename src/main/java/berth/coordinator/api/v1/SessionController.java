package berth.coordinator.api.v1;

import berth.coordinator.api.Controller;
import berth.coordinator.api.v1.dto.PendingSessionsRequest;
import berth.coordinator.api.v1.dto.PlacementResponse;
import berth.coordinator.api.v1.dto.SchedulingTickResponse;
import berth.coordinator.api.v1.dto.SessionRequest;
import berth.coordinator.model.SessionWorkload;
import berth.coordinator.selector.BatchSelectionResult;
import berth.coordinator.selector.SchedulingException;
import berth.coordinator.server.RouterHandler;
import berth.coordinator.service.SchedulingOutcome;
import berth.coordinator.service.SchedulingService;
import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for session placement (public API).
 *
 * POST /api/v1/scaling-groups/{name}/sessions - Place one session now
 * POST /api/v1/scaling-groups/{name}/pending - Run a scheduling tick over pending sessions
 * DELETE /api/v1/sessions/{sessionId} - Release a placed session
 */
public class SessionController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(SessionController.class);

    private static final Pattern SESSIONS_PATTERN = Pattern.compile("^/api/v1/scaling-groups/([^/]+)/sessions$");
    private static final Pattern PENDING_PATTERN = Pattern.compile("^/api/v1/scaling-groups/([^/]+)/pending$");
    private static final Pattern SESSION_BY_ID_PATTERN = Pattern.compile("^/api/v1/sessions/([^/]+)$");

    private final SchedulingService schedulingService;

    public SessionController(SchedulingService schedulingService) {
        this.schedulingService = schedulingService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.POST)) {
            return SESSIONS_PATTERN.matcher(path).matches() || PENDING_PATTERN.matcher(path).matches();
        }
        return method.equals(HttpMethod.DELETE) && SESSION_BY_ID_PATTERN.matcher(path).matches();
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            Matcher sessions = SESSIONS_PATTERN.matcher(path);
            if (sessions.matches()) {
                return handleSchedule(req, sessions.group(1));
            }
            Matcher pending = PENDING_PATTERN.matcher(path);
            if (pending.matches()) {
                return handlePending(req, pending.group(1));
            }
            Matcher release = SESSION_BY_ID_PATTERN.matcher(path);
            if (release.matches()) {
                return handleRelease(release.group(1));
            }
            return ControllerResponse.notFound("unknown session endpoint");
        } catch (JsonProcessingException e) {
            return ControllerResponse.badRequest("invalid JSON: " + e.getOriginalMessage());
        }
    }

    private ControllerResponse handleSchedule(FullHttpRequest req, String scalingGroup)
            throws JsonProcessingException {
        String body = req.content().toString(StandardCharsets.UTF_8);
        SessionRequest request = RouterHandler.mapper().readValue(body, SessionRequest.class);
        request.validate();

        SessionWorkload session = request.toWorkload(scalingGroup);
        BatchSelectionResult result;
        try {
            result = schedulingService.scheduleSession(session);
        } catch (SchedulingException e) {
            log.info("Session {} not placed: {}", session.id(), e.getMessage());
            return ControllerResponse.schedulingError(e);
        }

        PlacementResponse response = PlacementResponse.from(session.id(), result);
        return ControllerResponse.json(HttpResponseStatus.CREATED,
                RouterHandler.mapper().writeValueAsString(response));
    }

    private ControllerResponse handlePending(FullHttpRequest req, String scalingGroup)
            throws JsonProcessingException {
        String body = req.content().toString(StandardCharsets.UTF_8);
        PendingSessionsRequest request = RouterHandler.mapper().readValue(body, PendingSessionsRequest.class);
        request.validate();

        List<SessionWorkload> pending = request.sessions().stream()
                .map(s -> s.toWorkload(scalingGroup))
                .toList();
        List<SchedulingOutcome> outcomes = schedulingService.schedulePending(scalingGroup, pending);
        return ControllerResponse.json(
                RouterHandler.mapper().writeValueAsString(SchedulingTickResponse.from(outcomes)));
    }

    private ControllerResponse handleRelease(String sessionId) {
        int released = schedulingService.releaseSession(sessionId);
        if (released == 0) {
            return ControllerResponse.notFound("no allocations for session: " + sessionId);
        }
        return ControllerResponse.json("{\"ok\":true,\"releasedKernels\":" + released + "}");
    }
}
