package berth.coordinator.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A kernel placed on an agent.
 */
public record KernelAllocation(
        String kernelId,
        String sessionId,
        String agentId,
        String scalingGroup,
        String endpointId,
        ResourceSlot slots,
        Instant allocatedAt) {

    public KernelAllocation {
        Objects.requireNonNull(kernelId, "kernelId is required");
        Objects.requireNonNull(sessionId, "sessionId is required");
        Objects.requireNonNull(agentId, "agentId is required");
        slots = slots != null ? slots : ResourceSlot.empty();
    }
}
