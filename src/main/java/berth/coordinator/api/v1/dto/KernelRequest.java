package berth.coordinator.api.v1.dto;

import berth.coordinator.model.KernelWorkload;
import berth.coordinator.model.ResourceSlot;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One kernel of a session submission.
 */
public record KernelRequest(
        @JsonProperty("kernelId") String kernelId,
        @JsonProperty("image") String image,
        @JsonProperty("architecture") String architecture,
        @JsonProperty("requestedSlots") ResourceSlot requestedSlots) {

    public void validate() {
        if (kernelId == null || kernelId.isBlank()) {
            throw new IllegalArgumentException("kernelId is required");
        }
        if (requestedSlots != null) {
            for (String name : requestedSlots.keys()) {
                if (requestedSlots.get(name).signum() < 0) {
                    throw new IllegalArgumentException("requestedSlots." + name + " must be non-negative");
                }
            }
        }
    }

    public KernelWorkload toWorkload() {
        return new KernelWorkload(kernelId, image, architecture != null ? architecture : "x86_64", requestedSlots);
    }
}
