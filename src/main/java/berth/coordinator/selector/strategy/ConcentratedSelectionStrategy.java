package berth.coordinator.selector.strategy;

import berth.coordinator.model.ResourceRequirements;
import berth.coordinator.model.SessionType;
import berth.coordinator.selector.AgentSelectionConfig;
import berth.coordinator.selector.AgentSelectionCriteria;
import berth.coordinator.selector.AgentStateTracker;

import java.util.Comparator;
import java.util.List;

/**
 * Bin-packing strategy: fill the busiest agent that still fits, keeping whole
 * agents free for large sessions.
 *
 * Order: fewer same-endpoint kernels (inference sessions with replica spreading
 * only), fewer unused capabilities, less headroom in priority order, agent id.
 */
public class ConcentratedSelectionStrategy implements SelectionStrategy {

    private final List<String> resourcePriority;

    public ConcentratedSelectionStrategy(List<String> resourcePriority) {
        this.resourcePriority = List.copyOf(resourcePriority);
    }

    @Override
    public String name() {
        return "concentrated";
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
                .thenComparing(AgentStateTracker::headroom, SlotOrdering.lexicographic(keyOrder))
                .thenComparing(AgentStateTracker::agentId);

        if (spreadsReplicas(criteria, config)) {
            order = Comparator.comparingInt((AgentStateTracker t) -> criteria.kernelCountAtEndpoint(t.agentId()))
                    .thenComparing(order);
        }

        return trackers.stream().min(order).orElseThrow();
    }

    private static boolean spreadsReplicas(AgentSelectionCriteria criteria, AgentSelectionConfig config) {
        return config.enforceSpreadingEndpointReplica()
                && criteria.session().sessionType() == SessionType.INFERENCE
                && !criteria.kernelCountsAtEndpoint().isEmpty();
    }
}
