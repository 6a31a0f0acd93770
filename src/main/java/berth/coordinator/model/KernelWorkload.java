package berth.coordinator.model;

import java.util.Objects;

/**
 * One container-level unit of a session.
 */
public record KernelWorkload(
        String kernelId,
        String image,
        String architecture,
        ResourceSlot requestedSlots) {

    public KernelWorkload {
        Objects.requireNonNull(kernelId, "kernelId is required");
        Objects.requireNonNull(architecture, "architecture is required");
        requestedSlots = requestedSlots != null ? requestedSlots : ResourceSlot.empty();
    }
}
