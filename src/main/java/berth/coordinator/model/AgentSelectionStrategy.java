package berth.coordinator.model;

/**
 * Tie-break policy used to choose among compatible agents.
 */
public enum AgentSelectionStrategy {
    /** Prefer agents with more raw capacity in the configured resource order */
    LEGACY,
    /** Bin-packing: prefer the agent with the least headroom left */
    CONCENTRATED,
    /** Spread load: prefer the agent with the most headroom left */
    DISPERSED,
    /** Cycle through agents sorted by id */
    ROUNDROBIN
}
