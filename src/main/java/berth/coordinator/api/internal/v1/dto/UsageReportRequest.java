package berth.coordinator.api.internal.v1.dto;

import berth.coordinator.fairshare.KernelUsageRecord;
import berth.coordinator.model.ResourceSlot;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Request DTO for kernel usage reports.
 * POST /internal/v1/usage
 */
public record UsageReportRequest(
        @JsonProperty("records") List<Entry> records) {

    public record Entry(
            @JsonProperty("kernelId") String kernelId,
            @JsonProperty("sessionId") String sessionId,
            @JsonProperty("resourceGroup") String resourceGroup,
            @JsonProperty("domainName") String domainName,
            @JsonProperty("projectId") String projectId,
            @JsonProperty("userId") String userId,
            @JsonProperty("occupiedSlots") ResourceSlot occupiedSlots,
            @JsonProperty("periodStart") Instant periodStart,
            @JsonProperty("periodEnd") Instant periodEnd) {

        void validate() {
            if (resourceGroup == null || domainName == null || projectId == null || userId == null) {
                throw new IllegalArgumentException("resourceGroup, domainName, projectId and userId are required");
            }
            if (periodStart == null || periodEnd == null) {
                throw new IllegalArgumentException("periodStart and periodEnd are required");
            }
            if (periodEnd.isBefore(periodStart)) {
                throw new IllegalArgumentException("periodEnd is before periodStart for kernel " + kernelId);
            }
            if (occupiedSlots != null) {
                for (String name : occupiedSlots.keys()) {
                    if (occupiedSlots.get(name).signum() < 0) {
                        throw new IllegalArgumentException("occupiedSlots." + name + " must be non-negative");
                    }
                }
            }
        }

        KernelUsageRecord toRecord() {
            return new KernelUsageRecord(kernelId, sessionId, resourceGroup, domainName, projectId, userId,
                    occupiedSlots, periodStart, periodEnd);
        }
    }

    public void validate() {
        if (records == null || records.isEmpty()) {
            throw new IllegalArgumentException("records must not be empty");
        }
        records.forEach(Entry::validate);
    }

    public List<KernelUsageRecord> toRecords() {
        return records.stream().map(Entry::toRecord).toList();
    }
}
