package berth.coordinator.selector;

import berth.coordinator.model.ResourceSlot;

import java.util.Set;

/**
 * Per-agent rejection: the agent's headroom does not cover the request.
 */
public class InsufficientResourcesException extends SchedulingException {

    private final String agentId;

    public InsufficientResourcesException(String agentId, ResourceSlot requested, ResourceSlot headroom,
            Set<String> insufficient) {
        super(formatMessage(requested, headroom, insufficient), true);
        this.agentId = agentId;
    }

    public String agentId() {
        return agentId;
    }

    private static String formatMessage(ResourceSlot requested, ResourceSlot headroom,
            Set<String> insufficient) {
        StringBuilder sb = new StringBuilder("insufficient resources (");
        boolean first = true;
        for (String name : insufficient) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(name).append(": requested ").append(requested.get(name).toPlainString())
                    .append(", free ").append(headroom.get(name).toPlainString());
            first = false;
        }
        return sb.append(')').toString();
    }
}
