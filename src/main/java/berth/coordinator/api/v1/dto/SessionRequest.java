package berth.coordinator.api.v1.dto;

import berth.coordinator.model.ClusterMode;
import berth.coordinator.model.SessionType;
import berth.coordinator.model.SessionWorkload;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * Request DTO for a session to place.
 * POST /api/v1/scaling-groups/{name}/sessions
 */
public record SessionRequest(
        @JsonProperty("sessionId") String sessionId,
        @JsonProperty("accessKey") String accessKey,
        @JsonProperty("userId") String userId,
        @JsonProperty("projectId") String projectId,
        @JsonProperty("domainName") String domainName,
        @JsonProperty("priority") int priority,
        @JsonProperty("sessionType") String sessionType,
        @JsonProperty("clusterMode") String clusterMode,
        @JsonProperty("startsAfter") Instant startsAfter,
        @JsonProperty("endpointId") String endpointId,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("designatedAgentIds") List<String> designatedAgentIds,
        @JsonProperty("kernels") List<KernelRequest> kernels) {

    public void validate() {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId is required");
        }
        if (kernels == null || kernels.isEmpty()) {
            throw new IllegalArgumentException("at least one kernel is required");
        }
        kernels.forEach(KernelRequest::validate);
        parseSessionType();
        parseClusterMode();
    }

    public SessionWorkload toWorkload(String scalingGroup) {
        SessionWorkload.Builder builder = SessionWorkload.builder()
                .id(sessionId)
                .accessKey(accessKey)
                .userId(userId)
                .projectId(projectId)
                .scalingGroup(scalingGroup)
                .priority(priority)
                .sessionType(parseSessionType())
                .clusterMode(parseClusterMode())
                .startsAfter(startsAfter)
                .endpointId(endpointId)
                .createdAt(createdAt != null ? createdAt : Instant.now())
                .designatedAgentIds(designatedAgentIds);
        if (domainName != null) {
            builder.domainName(domainName);
        }
        for (KernelRequest kernel : kernels) {
            builder.addKernel(kernel.toWorkload());
        }
        return builder.build();
    }

    private SessionType parseSessionType() {
        if (sessionType == null) {
            return SessionType.INTERACTIVE;
        }
        try {
            return SessionType.valueOf(sessionType.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown sessionType: " + sessionType);
        }
    }

    private ClusterMode parseClusterMode() {
        if (clusterMode == null) {
            return ClusterMode.SINGLE_NODE;
        }
        try {
            return ClusterMode.valueOf(clusterMode.toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown clusterMode: " + clusterMode);
        }
    }
}
