package berth.coordinator.api.v1.dto;

import berth.coordinator.fairshare.UsageBucket;
import berth.coordinator.model.ResourceSlot;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;

/**
 * One day of usage of a scope.
 */
public record UsageBucketResponse(
        @JsonProperty("date") LocalDate date,
        @JsonProperty("resourceUsage") ResourceSlot resourceUsage) {

    public static UsageBucketResponse from(UsageBucket bucket) {
        return new UsageBucketResponse(bucket.date(), bucket.resourceUsage());
    }
}
