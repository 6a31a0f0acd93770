package berth.coordinator.selector.strategy;

import berth.coordinator.model.ResourceRequirements;
import berth.coordinator.selector.AgentSelectionConfig;
import berth.coordinator.selector.AgentSelectionCriteria;
import berth.coordinator.selector.AgentStateTracker;

import java.util.Comparator;
import java.util.List;

/**
 * Spreading strategy: place on the agent with the most headroom left.
 * Order: fewer unused capabilities, more headroom in priority order, agent id.
 */
public class DispersedSelectionStrategy implements SelectionStrategy {

    private final List<String> resourcePriority;

    public DispersedSelectionStrategy(List<String> resourcePriority) {
        this.resourcePriority = List.copyOf(resourcePriority);
    }

    @Override
    public String name() {
        return "dispersed";
    }

    @Override
    public AgentStateTracker selectTracker(
            List<AgentStateTracker> trackers,
            ResourceRequirements requirements,
            AgentSelectionCriteria criteria,
            AgentSelectionConfig config) {
        List<String> keyOrder = SlotOrdering.keyOrder(resourcePriority, trackers, AgentStateTracker::headroom);

        Comparator<AgentStateTracker> order = Comparator.comparingInt(
                (AgentStateTracker t) -> SlotOrdering.unusedCapabilities(t.headroom(),
                        requirements.requestedSlots()))
                .thenComparing(AgentStateTracker::headroom, SlotOrdering.lexicographic(keyOrder).reversed())
                .thenComparing(AgentStateTracker::agentId);

        return trackers.stream().min(order).orElseThrow();
    }
}
