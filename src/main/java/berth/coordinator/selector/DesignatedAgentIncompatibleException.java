package berth.coordinator.selector;

import berth.coordinator.model.ResourceRequirements;

import java.util.List;

/**
 * A pinned agent exists but cannot host the requirement right now.
 */
public class DesignatedAgentIncompatibleException extends SchedulingException {

    public DesignatedAgentIncompatibleException(List<String> designatedAgentIds, ResourceRequirements requirements,
            String details) {
        super("Designated agent " + designatedAgentIds + " is not compatible with " + requirements.describe()
                + ". Details: " + details, true);
    }
}
