package berth.coordinator.model;

/**
 * One placement decision: a requirement and the agent chosen to host it.
 */
public record AgentSelection(ResourceRequirements requirements, AgentInfo selectedAgent) {
}
