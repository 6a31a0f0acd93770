package berth.coordinator.api.v1;

import berth.coordinator.api.Controller;
import berth.coordinator.api.v1.dto.ScalingGroupRequest;
import berth.coordinator.model.ScalingGroupOptions;
import berth.coordinator.repository.ScalingGroupRepository;
import berth.coordinator.server.RouterHandler;
import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for scaling group settings (public API).
 *
 * GET /api/v1/scaling-groups/{name} - Effective settings (defaults if never saved)
 * PUT /api/v1/scaling-groups/{name} - Replace settings
 */
public class ScalingGroupController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(ScalingGroupController.class);

    private static final Pattern GROUP_PATTERN = Pattern.compile("^/api/v1/scaling-groups/([^/]+)$");

    private final ScalingGroupRepository scalingGroupRepository;

    public ScalingGroupController(ScalingGroupRepository scalingGroupRepository) {
        this.scalingGroupRepository = scalingGroupRepository;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return (method.equals(HttpMethod.GET) || method.equals(HttpMethod.PUT))
                && GROUP_PATTERN.matcher(path).matches();
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        Matcher matcher = GROUP_PATTERN.matcher(path);
        if (!matcher.matches()) {
            return ControllerResponse.notFound("unknown scaling group endpoint");
        }
        String name = matcher.group(1);
        try {
            if (req.method().equals(HttpMethod.PUT)) {
                String body = req.content().toString(StandardCharsets.UTF_8);
                ScalingGroupRequest request = RouterHandler.mapper().readValue(body, ScalingGroupRequest.class);
                ScalingGroupOptions options = request.toOptions(name);
                scalingGroupRepository.save(options);
                log.info("Scaling group {} updated: {}", name, options);
                return ControllerResponse.json(
                        RouterHandler.mapper().writeValueAsString(ScalingGroupRequest.from(options)));
            }
            ScalingGroupOptions options = scalingGroupRepository.getOrDefault(name);
            return ControllerResponse.json(
                    RouterHandler.mapper().writeValueAsString(ScalingGroupRequest.from(options)));
        } catch (JsonProcessingException e) {
            return ControllerResponse.badRequest("invalid JSON: " + e.getOriginalMessage());
        }
    }
}
