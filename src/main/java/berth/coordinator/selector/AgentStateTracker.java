package berth.coordinator.selector;

import berth.coordinator.model.AgentInfo;
import berth.coordinator.model.ResourceSlot;

/**
 * Per-batch overlay on one agent: the snapshot stays untouched while the batch
 * accumulates slot and container diffs, so a failed batch leaves nothing behind.
 */
public final class AgentStateTracker {

    private final AgentInfo agent;
    private ResourceSlot additionalSlots = ResourceSlot.empty();
    private int additionalContainers;

    public AgentStateTracker(AgentInfo agent) {
        this.agent = agent;
    }

    public AgentInfo agent() {
        return agent;
    }

    public String agentId() {
        return agent.id();
    }

    /** Occupied slots including this batch's allocations. */
    public ResourceSlot occupiedSlots() {
        return agent.occupiedSlots().add(additionalSlots);
    }

    /** Container count including this batch's allocations. */
    public int containerCount() {
        return agent.containerCount() + additionalContainers;
    }

    /** Capacity left after this batch's allocations. */
    public ResourceSlot headroom() {
        return agent.availableSlots().subtract(occupiedSlots());
    }

    public ResourceSlot additionalSlots() {
        return additionalSlots;
    }

    public int additionalContainers() {
        return additionalContainers;
    }

    public boolean hasDiff() {
        return additionalContainers > 0 || !additionalSlots.isZero();
    }

    public void applyDiff(ResourceSlot slots, int containers) {
        additionalSlots = additionalSlots.add(slots);
        additionalContainers += containers;
    }

    /** Write the effective state into the wrapped agent. */
    void commit() {
        if (hasDiff()) {
            agent.applyCommittedState(occupiedSlots(), containerCount());
        }
    }
}
