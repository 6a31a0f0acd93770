package berth.coordinator.selector.strategy;

import berth.coordinator.model.ResourceRequirements;
import berth.coordinator.selector.AgentSelectionConfig;
import berth.coordinator.selector.AgentSelectionCriteria;
import berth.coordinator.selector.AgentStateTracker;

import java.util.Comparator;
import java.util.List;

/**
 * Original placement rule, kept for scaling groups that depend on it.
 *
 * Order: fewer unused capabilities, then larger raw capacity in priority order
 * (occupancy is ignored once an agent fits), then agent id.
 */
public class LegacySelectionStrategy implements SelectionStrategy {

    private final List<String> resourcePriority;

    public LegacySelectionStrategy(List<String> resourcePriority) {
        this.resourcePriority = List.copyOf(resourcePriority);
    }

    @Override
    public String name() {
        return "legacy";
    }

    @Override
    public AgentStateTracker selectTracker(
            List<AgentStateTracker> trackers,
            ResourceRequirements requirements,
            AgentSelectionCriteria criteria,
            AgentSelectionConfig config) {
        List<String> keyOrder = SlotOrdering.keyOrder(resourcePriority, trackers,
                t -> t.agent().availableSlots());

        Comparator<AgentStateTracker> order = Comparator.comparingInt(
                (AgentStateTracker t) -> SlotOrdering.unusedCapabilities(t.headroom(),
                        requirements.requestedSlots()))
                .thenComparing(t -> t.agent().availableSlots(), SlotOrdering.lexicographic(keyOrder).reversed())
                .thenComparing(AgentStateTracker::agentId);

        return trackers.stream().min(order).orElseThrow();
    }
}
