package berth.coordinator.selector;

import berth.coordinator.model.AgentInfo;
import berth.coordinator.model.ResourceSlot;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AgentStateTrackerTest {

    private static AgentInfo agent() {
        return AgentInfo.builder()
                .id("agent-1")
                .availableSlots(ResourceSlot.of("cpu", 8, "mem", 16384))
                .occupiedSlots(ResourceSlot.of("cpu", 2, "mem", 4096))
                .containerCount(1)
                .build();
    }

    @Test
    void diffsLayerOverSnapshot() {
        AgentInfo agent = agent();
        AgentStateTracker tracker = new AgentStateTracker(agent);
        assertFalse(tracker.hasDiff());

        tracker.applyDiff(ResourceSlot.of("cpu", 1, "mem", 1024), 1);
        tracker.applyDiff(ResourceSlot.of("cpu", 2), 2);

        assertTrue(tracker.hasDiff());
        assertEquals(ResourceSlot.of("cpu", 5, "mem", 5120), tracker.occupiedSlots());
        assertEquals(4, tracker.containerCount());
        assertEquals(ResourceSlot.of("cpu", 3, "mem", 11264), tracker.headroom());

        // Snapshot untouched until commit
        assertEquals(ResourceSlot.of("cpu", 2, "mem", 4096), agent.occupiedSlots());
        assertEquals(1, agent.containerCount());
    }

    @Test
    void commitWritesEffectiveState() {
        AgentInfo agent = agent();
        AgentStateTracker tracker = new AgentStateTracker(agent);
        tracker.applyDiff(ResourceSlot.of("cpu", 4), 2);

        tracker.commit();

        assertEquals(ResourceSlot.of("cpu", 6, "mem", 4096), agent.occupiedSlots());
        assertEquals(3, agent.containerCount());
    }

    @Test
    void commitWithoutDiffIsNoop() {
        AgentInfo agent = agent();
        new AgentStateTracker(agent).commit();

        assertEquals(ResourceSlot.of("cpu", 2, "mem", 4096), agent.occupiedSlots());
        assertEquals(1, agent.containerCount());
    }
}
