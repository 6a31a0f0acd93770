package berth.coordinator.api.v1.dto;

import berth.coordinator.model.AgentInfo;
import berth.coordinator.model.ResourceSlot;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Response DTO for agent details.
 * GET /api/v1/agents
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AgentResponse(
        @JsonProperty("agentId") String agentId,
        @JsonProperty("address") String address,
        @JsonProperty("architecture") String architecture,
        @JsonProperty("scalingGroup") String scalingGroup,
        @JsonProperty("status") String status,
        @JsonProperty("availableSlots") ResourceSlot availableSlots,
        @JsonProperty("occupiedSlots") ResourceSlot occupiedSlots,
        @JsonProperty("containerCount") int containerCount,
        @JsonProperty("lastHeartbeat") Instant lastHeartbeat) {

    public static AgentResponse from(AgentInfo agent) {
        return new AgentResponse(
                agent.id(),
                agent.address(),
                agent.architecture(),
                agent.scalingGroup(),
                agent.status().name(),
                agent.availableSlots(),
                agent.occupiedSlots(),
                agent.containerCount(),
                agent.lastHeartbeat());
    }
}
