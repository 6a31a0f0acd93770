package berth.coordinator.selector;

import berth.coordinator.model.ResourceRequirements;

/**
 * No agent passes the architecture, capacity and container checks for a requirement.
 */
public class NoCompatibleAgentException extends SchedulingException {

    private final ResourceRequirements requirements;

    public NoCompatibleAgentException(ResourceRequirements requirements, String details) {
        super("No compatible agent for " + requirements.describe() + ". Details: " + details, true);
        this.requirements = requirements;
    }

    public ResourceRequirements requirements() {
        return requirements;
    }
}
