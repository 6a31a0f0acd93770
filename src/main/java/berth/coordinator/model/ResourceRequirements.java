package berth.coordinator.model;

import java.util.List;
import java.util.Objects;

/**
 * A slice of a session's demand that must be placed on a single agent.
 *
 * @param requestedSlots       slots to reserve on the chosen agent
 * @param requiredArchitecture architecture the agent must report
 * @param kernelIds            kernels covered by this slice (all kernels for
 *                             single-node sessions, exactly one for multi-node)
 */
public record ResourceRequirements(
        ResourceSlot requestedSlots,
        String requiredArchitecture,
        List<String> kernelIds) {

    public ResourceRequirements {
        Objects.requireNonNull(requestedSlots, "requestedSlots is required");
        Objects.requireNonNull(requiredArchitecture, "requiredArchitecture is required");
        kernelIds = List.copyOf(kernelIds);
    }

    public int kernelCount() {
        return kernelIds.size();
    }

    /** Short description used in error messages and logs. */
    public String describe() {
        return "kernels=" + kernelIds + " arch=" + requiredArchitecture + " slots=" + requestedSlots;
    }
}
