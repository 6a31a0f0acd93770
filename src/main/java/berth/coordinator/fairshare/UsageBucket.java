package berth.coordinator.fairshare;

import berth.coordinator.model.ResourceSlot;

import java.time.LocalDate;

/**
 * Resource-seconds consumed by one scope in one resource group on one UTC day.
 */
public record UsageBucket(
        String resourceGroup,
        FairShareScope scope,
        LocalDate date,
        ResourceSlot resourceUsage) {
}
