package berth.coordinator.fairshare;

import berth.coordinator.model.ResourceSlot;

import java.time.Instant;
import java.util.Objects;

/**
 * Slots a kernel occupied over {@code [periodStart, periodEnd)}.
 */
public record KernelUsageRecord(
        String kernelId,
        String sessionId,
        String resourceGroup,
        String domainName,
        String projectId,
        String userId,
        ResourceSlot occupiedSlots,
        Instant periodStart,
        Instant periodEnd) {

    public KernelUsageRecord {
        Objects.requireNonNull(resourceGroup, "resourceGroup is required");
        Objects.requireNonNull(domainName, "domainName is required");
        Objects.requireNonNull(projectId, "projectId is required");
        Objects.requireNonNull(userId, "userId is required");
        Objects.requireNonNull(periodStart, "periodStart is required");
        Objects.requireNonNull(periodEnd, "periodEnd is required");
        occupiedSlots = occupiedSlots != null ? occupiedSlots : ResourceSlot.empty();
    }
}
