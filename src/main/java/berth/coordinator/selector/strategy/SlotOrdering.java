package berth.coordinator.selector.strategy;

import berth.coordinator.model.ResourceSlot;
import berth.coordinator.selector.AgentStateTracker;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;

/**
 * Ordering helpers shared by the resource-aware strategies.
 */
final class SlotOrdering {

    private SlotOrdering() {
    }

    /**
     * Count resources the agent still has free but the request does not ask for.
     * A resource missing from the request counts as requested-zero.
     */
    static int unusedCapabilities(ResourceSlot headroom, ResourceSlot requested) {
        int count = 0;
        for (String name : headroom.keys()) {
            if (headroom.get(name).signum() > 0 && requested.get(name).signum() == 0) {
                count++;
            }
        }
        return count;
    }

    /**
     * Resource comparison order: the configured priority first, then every other
     * resource seen on any candidate, alphabetically.
     */
    static List<String> keyOrder(List<String> resourcePriority, List<AgentStateTracker> trackers,
            Function<AgentStateTracker, ResourceSlot> slotsOf) {
        Set<String> ordered = new LinkedHashSet<>(resourcePriority);
        Set<String> rest = new TreeSet<>();
        for (AgentStateTracker tracker : trackers) {
            rest.addAll(slotsOf.apply(tracker).keys());
        }
        ordered.addAll(rest);
        return new ArrayList<>(ordered);
    }

    /**
     * Lexicographic comparison of two slot vectors along {@code keyOrder};
     * smaller vectors come first.
     */
    static Comparator<ResourceSlot> lexicographic(List<String> keyOrder) {
        return (left, right) -> {
            for (String key : keyOrder) {
                BigDecimal l = left.get(key);
                BigDecimal r = right.get(key);
                int cmp = l.compareTo(r);
                if (cmp != 0) {
                    return cmp;
                }
            }
            return 0;
        };
    }
}
