package berth.coordinator.selector.strategy;

import berth.coordinator.model.ResourceRequirements;
import berth.coordinator.selector.AgentSelectionConfig;
import berth.coordinator.selector.AgentSelectionCriteria;
import berth.coordinator.selector.AgentStateTracker;

import java.util.Comparator;
import java.util.List;

/**
 * Cycles through compatible agents sorted by id, using the caller's cursor.
 * The cursor is advanced by the selector, never here.
 */
public class RoundRobinSelectionStrategy implements SelectionStrategy {

    @Override
    public String name() {
        return "roundrobin";
    }

    @Override
    public AgentStateTracker selectTracker(
            List<AgentStateTracker> trackers,
            ResourceRequirements requirements,
            AgentSelectionCriteria criteria,
            AgentSelectionConfig config) {
        List<AgentStateTracker> sorted = trackers.stream()
                .sorted(Comparator.comparing(AgentStateTracker::agentId))
                .toList();
        int index = (int) (config.roundRobinIndex() % sorted.size());
        return sorted.get(index);
    }

    @Override
    public boolean advancesRoundRobinIndex() {
        return true;
    }
}
