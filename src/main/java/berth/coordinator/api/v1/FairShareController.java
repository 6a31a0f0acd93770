package berth.coordinator.api.v1;

import berth.coordinator.api.Controller;
import berth.coordinator.api.v1.dto.FairShareResponse;
import berth.coordinator.api.v1.dto.SchedulingRankResponse;
import berth.coordinator.api.v1.dto.UsageBucketResponse;
import berth.coordinator.api.v1.dto.WeightUpdateRequest;
import berth.coordinator.fairshare.FairShareCalculationResult;
import berth.coordinator.fairshare.FairShareRecord;
import berth.coordinator.fairshare.FairShareScope;
import berth.coordinator.fairshare.ScopeLevel;
import berth.coordinator.server.RouterHandler;
import berth.coordinator.service.FairShareService;
import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.QueryStringDecoder;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for fair share state (public API).
 *
 * GET /api/v1/fair-shares/{rg}[?level=domain|project|user] - List rows
 * GET /api/v1/fair-shares/{rg}/ranks - Current user ranks
 * POST /api/v1/fair-shares/{rg}/recalculate - Recalculate now
 * GET /api/v1/fair-shares/{rg}/{level}/{scopeId} - One row
 * GET /api/v1/fair-shares/{rg}/{level}/{scopeId}/usage[?domainName=] - Usage buckets in the window
 * PUT /api/v1/fair-shares/{rg}/{level}/{scopeId}/weight - Set or clear the weight
 * DELETE /api/v1/fair-shares/{rg}/{level}/{scopeId} - Remove a row
 */
public class FairShareController implements Controller {

    private static final Pattern LIST_PATTERN = Pattern.compile("^/api/v1/fair-shares/([^/]+)$");
    private static final Pattern RANKS_PATTERN = Pattern.compile("^/api/v1/fair-shares/([^/]+)/ranks$");
    private static final Pattern RECALCULATE_PATTERN = Pattern.compile("^/api/v1/fair-shares/([^/]+)/recalculate$");
    private static final Pattern SCOPE_PATTERN = Pattern.compile("^/api/v1/fair-shares/([^/]+)/([^/]+)/([^/]+)$");
    private static final Pattern USAGE_PATTERN = Pattern.compile("^/api/v1/fair-shares/([^/]+)/([^/]+)/([^/]+)/usage$");
    private static final Pattern WEIGHT_PATTERN = Pattern.compile("^/api/v1/fair-shares/([^/]+)/([^/]+)/([^/]+)/weight$");

    private final FairShareService fairShareService;

    public FairShareController(FairShareService fairShareService) {
        this.fairShareService = fairShareService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (!path.startsWith("/api/v1/fair-shares/")) {
            return false;
        }
        if (method.equals(HttpMethod.GET)) {
            return LIST_PATTERN.matcher(path).matches()
                    || RANKS_PATTERN.matcher(path).matches()
                    || SCOPE_PATTERN.matcher(path).matches()
                    || USAGE_PATTERN.matcher(path).matches();
        }
        if (method.equals(HttpMethod.POST)) {
            return RECALCULATE_PATTERN.matcher(path).matches();
        }
        if (method.equals(HttpMethod.PUT)) {
            return WEIGHT_PATTERN.matcher(path).matches();
        }
        if (method.equals(HttpMethod.DELETE)) {
            return SCOPE_PATTERN.matcher(path).matches();
        }
        return false;
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            HttpMethod method = req.method();

            Matcher m = RANKS_PATTERN.matcher(path);
            if (m.matches()) {
                return handleRanks(m.group(1));
            }
            m = RECALCULATE_PATTERN.matcher(path);
            if (m.matches()) {
                return handleRecalculate(m.group(1));
            }
            m = USAGE_PATTERN.matcher(path);
            if (m.matches()) {
                return handleUsage(req, m.group(1), ScopeLevel.fromValue(m.group(2)), m.group(3));
            }
            m = WEIGHT_PATTERN.matcher(path);
            if (m.matches()) {
                return handleWeight(req, m.group(1), ScopeLevel.fromValue(m.group(2)), m.group(3));
            }
            m = SCOPE_PATTERN.matcher(path);
            if (m.matches()) {
                ScopeLevel level = ScopeLevel.fromValue(m.group(2));
                if (method.equals(HttpMethod.DELETE)) {
                    return handleDelete(m.group(1), level, m.group(3));
                }
                return handleGet(m.group(1), level, m.group(3));
            }
            m = LIST_PATTERN.matcher(path);
            if (m.matches()) {
                return handleList(req, m.group(1));
            }
            return ControllerResponse.notFound("unknown fair share endpoint");
        } catch (JsonProcessingException e) {
            return ControllerResponse.badRequest("invalid JSON: " + e.getOriginalMessage());
        }
    }

    private ControllerResponse handleList(FullHttpRequest req, String resourceGroup) throws JsonProcessingException {
        String levelParam = queryParam(req, "level");
        ScopeLevel level = levelParam != null ? ScopeLevel.fromValue(levelParam) : null;

        List<FairShareResponse> rows = fairShareService.list(resourceGroup, level).stream()
                .map(FairShareResponse::from)
                .toList();
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(Map.of("fairShares", rows)));
    }

    private ControllerResponse handleRanks(String resourceGroup) throws JsonProcessingException {
        List<SchedulingRankResponse> ranks = fairShareService.rankUsers(resourceGroup).stream()
                .map(SchedulingRankResponse::from)
                .toList();
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(Map.of("ranks", ranks)));
    }

    private ControllerResponse handleRecalculate(String resourceGroup) throws JsonProcessingException {
        FairShareCalculationResult result = fairShareService.recalculate(resourceGroup);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("resourceGroup", resourceGroup);
        body.put("domains", result.resultsAt(ScopeLevel.DOMAIN).size());
        body.put("projects", result.resultsAt(ScopeLevel.PROJECT).size());
        body.put("users", result.resultsAt(ScopeLevel.USER).size());
        body.put("skipped", result.skipped().stream().map(FairShareScope::toString).toList());
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(body));
    }

    private ControllerResponse handleGet(String resourceGroup, ScopeLevel level, String scopeId)
            throws JsonProcessingException {
        Optional<FairShareRecord> record = fairShareService.find(resourceGroup, level, scopeId);
        if (record.isEmpty()) {
            return ControllerResponse.notFound("fair share not found: " + level.value() + ":" + scopeId);
        }
        return ControllerResponse.json(
                RouterHandler.mapper().writeValueAsString(FairShareResponse.from(record.get())));
    }

    private ControllerResponse handleUsage(FullHttpRequest req, String resourceGroup, ScopeLevel level,
            String scopeId) throws JsonProcessingException {
        FairShareScope scope = resolveScope(resourceGroup, level, scopeId, queryParam(req, "domainName"));
        List<UsageBucketResponse> buckets = fairShareService.usageHistory(resourceGroup, scope).stream()
                .map(UsageBucketResponse::from)
                .toList();
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(Map.of("usage", buckets)));
    }

    private ControllerResponse handleWeight(FullHttpRequest req, String resourceGroup, ScopeLevel level,
            String scopeId) throws JsonProcessingException {
        String body = req.content().toString(StandardCharsets.UTF_8);
        WeightUpdateRequest request = RouterHandler.mapper().readValue(body, WeightUpdateRequest.class);
        request.validate();

        FairShareScope scope = resolveScope(resourceGroup, level, scopeId, request.domainName());
        FairShareRecord record = fairShareService.updateWeight(resourceGroup, scope, request.weight());
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(FairShareResponse.from(record)));
    }

    private ControllerResponse handleDelete(String resourceGroup, ScopeLevel level, String scopeId) {
        if (!fairShareService.deleteScope(resourceGroup, level, scopeId)) {
            return ControllerResponse.notFound("fair share not found: " + level.value() + ":" + scopeId);
        }
        return ControllerResponse.json("{\"ok\":true}");
    }

    /**
     * Stored scope if the row exists, otherwise one built from the request.
     */
    private FairShareScope resolveScope(String resourceGroup, ScopeLevel level, String scopeId, String domainName) {
        Optional<FairShareRecord> existing = fairShareService.find(resourceGroup, level, scopeId);
        if (existing.isPresent()) {
            return existing.get().scope();
        }
        if (level != ScopeLevel.DOMAIN && (domainName == null || domainName.isBlank())) {
            throw new IllegalArgumentException("domainName is required for a new " + level.value() + " scope");
        }
        return FairShareScope.of(level, scopeId, domainName);
    }

    private static String queryParam(FullHttpRequest req, String name) {
        List<String> values = new QueryStringDecoder(req.uri()).parameters().get(name);
        return values == null || values.isEmpty() ? null : values.get(0);
    }
}
