package berth.coordinator.api.v1;

import berth.coordinator.api.Controller;
import berth.coordinator.api.v1.dto.AgentResponse;
import berth.coordinator.model.AgentInfo;
import berth.coordinator.server.RouterHandler;
import berth.coordinator.service.AgentService;
import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.QueryStringDecoder;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for agent listing (public API).
 *
 * GET /api/v1/agents[?scalingGroup=name] - List agents
 * GET /api/v1/agents/{agentId} - Get one agent
 * DELETE /api/v1/agents/{agentId} - Forget an agent
 *
 * Exceptions bubble to RouterHandler for proper error responses.
 */
public class AgentController implements Controller {

    private static final Pattern AGENT_BY_ID_PATTERN = Pattern.compile("^/api/v1/agents/([^/]+)$");

    private final AgentService agentService;

    public AgentController(AgentService agentService) {
        this.agentService = agentService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.GET)) {
            return "/api/v1/agents".equals(path) || AGENT_BY_ID_PATTERN.matcher(path).matches();
        }
        return method.equals(HttpMethod.DELETE) && AGENT_BY_ID_PATTERN.matcher(path).matches();
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            if ("/api/v1/agents".equals(path)) {
                return handleList(req);
            }
            Matcher matcher = AGENT_BY_ID_PATTERN.matcher(path);
            if (!matcher.matches()) {
                return ControllerResponse.notFound("unknown agent endpoint");
            }
            String agentId = matcher.group(1);
            if (req.method().equals(HttpMethod.DELETE)) {
                if (!agentService.delete(agentId)) {
                    return ControllerResponse.notFound("agent not found: " + agentId);
                }
                return ControllerResponse.json("{\"ok\":true}");
            }
            Optional<AgentInfo> agent = agentService.findById(agentId);
            if (agent.isEmpty()) {
                return ControllerResponse.notFound("agent not found: " + agentId);
            }
            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(AgentResponse.from(agent.get())));
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to serialize agents response", e);
        }
    }

    private ControllerResponse handleList(FullHttpRequest req) throws JsonProcessingException {
        QueryStringDecoder query = new QueryStringDecoder(req.uri());
        List<String> groups = query.parameters().get("scalingGroup");

        List<AgentInfo> agents = groups == null || groups.isEmpty()
                ? agentService.findAll()
                : agentService.findAll().stream()
                        .filter(a -> groups.get(0).equals(a.scalingGroup()))
                        .toList();

        List<AgentResponse> body = agents.stream().map(AgentResponse::from).toList();
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(Map.of("agents", body)));
    }
}
