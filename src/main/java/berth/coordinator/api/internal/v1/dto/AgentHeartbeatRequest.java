package berth.coordinator.api.internal.v1.dto;

import berth.coordinator.model.ResourceSlot;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request DTO for agent heartbeat.
 * POST /internal/v1/agents/heartbeat
 */
public record AgentHeartbeatRequest(
        @JsonProperty("agentId") String agentId,
        @JsonProperty("address") String address,
        @JsonProperty("architecture") String architecture,
        @JsonProperty("scalingGroup") String scalingGroup,
        @JsonProperty("availableSlots") ResourceSlot availableSlots) {
    public void validate() {
        if (agentId == null || agentId.isBlank()) {
            throw new IllegalArgumentException("agentId is required");
        }
        if (architecture == null || architecture.isBlank()) {
            throw new IllegalArgumentException("architecture is required");
        }
        if (scalingGroup == null || scalingGroup.isBlank()) {
            throw new IllegalArgumentException("scalingGroup is required");
        }
        if (availableSlots == null || availableSlots.keys().isEmpty()) {
            throw new IllegalArgumentException("availableSlots must report at least one resource");
        }
        for (String name : availableSlots.keys()) {
            if (availableSlots.get(name).signum() < 0) {
                throw new IllegalArgumentException("availableSlots." + name + " must be non-negative");
            }
        }
    }
}
