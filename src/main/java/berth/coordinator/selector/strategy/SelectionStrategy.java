package berth.coordinator.selector.strategy;

import berth.coordinator.model.AgentSelectionStrategy;
import berth.coordinator.model.ResourceRequirements;
import berth.coordinator.selector.AgentSelectionConfig;
import berth.coordinator.selector.AgentSelectionCriteria;
import berth.coordinator.selector.AgentStateTracker;

import java.util.List;

/**
 * Picks one agent out of a set that already passed every compatibility check.
 * Implementations are stateless; anything they depend on arrives as an argument.
 */
public interface SelectionStrategy {

    /**
     * Strategy name used in logs.
     */
    String name();

    /**
     * Select one tracker for the requirement.
     *
     * @param trackers     compatible trackers, never empty
     * @param requirements the requirement being placed
     * @param criteria     session being placed
     * @param config       batch configuration (round-robin cursor included)
     * @return the chosen tracker, one of {@code trackers}
     */
    AgentStateTracker selectTracker(
            List<AgentStateTracker> trackers,
            ResourceRequirements requirements,
            AgentSelectionCriteria criteria,
            AgentSelectionConfig config);

    /**
     * True if each placement made by this strategy advances the round-robin cursor.
     */
    default boolean advancesRoundRobinIndex() {
        return false;
    }

    /**
     * Build the implementation for a configured strategy.
     *
     * @param strategy         configured strategy
     * @param resourcePriority resource names compared first, most important first
     */
    static SelectionStrategy create(AgentSelectionStrategy strategy, List<String> resourcePriority) {
        return switch (strategy) {
            case LEGACY -> new LegacySelectionStrategy(resourcePriority);
            case CONCENTRATED -> new ConcentratedSelectionStrategy(resourcePriority);
            case DISPERSED -> new DispersedSelectionStrategy(resourcePriority);
            case ROUNDROBIN -> new RoundRobinSelectionStrategy();
        };
    }
}
