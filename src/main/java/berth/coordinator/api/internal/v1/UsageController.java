package berth.coordinator.api.internal.v1;

import berth.coordinator.api.Controller;
import berth.coordinator.api.internal.v1.dto.OperationResponse;
import berth.coordinator.api.internal.v1.dto.UsageReportRequest;
import berth.coordinator.server.RouterHandler;
import berth.coordinator.service.FairShareService;
import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;

import java.nio.charset.StandardCharsets;

/**
 * Controller for kernel usage reports (internal API).
 * POST /internal/v1/usage - Add kernel usage to the daily buckets
 */
public class UsageController implements Controller {

    private final FairShareService fairShareService;

    public UsageController(FairShareService fairShareService) {
        this.fairShareService = fairShareService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.POST) && "/internal/v1/usage".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            String body = req.content().toString(StandardCharsets.UTF_8);
            UsageReportRequest request = RouterHandler.mapper().readValue(body, UsageReportRequest.class);
            request.validate();

            int buckets = fairShareService.recordUsage(request.toRecords());
            return ControllerResponse.json(
                    RouterHandler.mapper().writeValueAsString(OperationResponse.success(buckets)));
        } catch (JsonProcessingException e) {
            return ControllerResponse.badRequest("invalid JSON: " + e.getOriginalMessage());
        }
    }
}
