package berth.coordinator.api.internal.v1;

import berth.coordinator.api.Controller;
import berth.coordinator.api.internal.v1.dto.AgentHeartbeatRequest;
import berth.coordinator.api.internal.v1.dto.OperationResponse;
import berth.coordinator.server.RouterHandler;
import berth.coordinator.service.AgentService;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;

/**
 * Controller for agent heartbeat and registration (internal API).
 * POST /internal/v1/agents/heartbeat - Register or refresh an agent
 */
public class AgentHeartbeatController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(AgentHeartbeatController.class);

    private final AgentService agentService;

    public AgentHeartbeatController(AgentService agentService) {
        this.agentService = agentService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.POST) && "/internal/v1/agents/heartbeat".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            String body = req.content().toString(StandardCharsets.UTF_8);
            AgentHeartbeatRequest request = RouterHandler.mapper().readValue(body, AgentHeartbeatRequest.class);
            request.validate();

            String address = request.address();
            if (address == null || address.isBlank()) {
                address = ((InetSocketAddress) ctx.channel().remoteAddress()).getAddress().getHostAddress();
            }

            agentService.heartbeat(request.agentId(), address, request.architecture(), request.scalingGroup(),
                    request.availableSlots());

            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(OperationResponse.success()));
        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (Exception e) {
            log.error("Heartbeat controller error", e);
            return ControllerResponse.error("internal error");
        }
    }
}
