package berth.coordinator.selector;

import berth.coordinator.config.CoordinatorConfig;
import berth.coordinator.model.AgentInfo;
import berth.coordinator.model.AgentSelection;
import berth.coordinator.model.ClusterMode;
import berth.coordinator.model.KernelWorkload;
import berth.coordinator.model.ResourceSlot;
import berth.coordinator.model.SessionWorkload;
import berth.coordinator.selector.strategy.ConcentratedSelectionStrategy;
import berth.coordinator.selector.strategy.DispersedSelectionStrategy;
import berth.coordinator.selector.strategy.RoundRobinSelectionStrategy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AgentSelectorTest {

    private static final List<String> PRIORITY = CoordinatorConfig.DEFAULT_RESOURCE_PRIORITY;

    private AgentSelector concentrated;
    private AgentSelector dispersed;

    @BeforeEach
    void setUp() {
        concentrated = new AgentSelector(new ConcentratedSelectionStrategy(PRIORITY));
        dispersed = new AgentSelector(new DispersedSelectionStrategy(PRIORITY));
    }

    private static AgentInfo agent(String id, int cpu) {
        return AgentInfo.builder()
                .id(id)
                .availableSlots(ResourceSlot.of("cpu", cpu, "mem", 65536))
                .build();
    }

    private static SessionWorkload session(ClusterMode mode, int... cpus) {
        SessionWorkload.Builder builder = SessionWorkload.builder().id("sess-1").clusterMode(mode);
        for (int i = 0; i < cpus.length; i++) {
            builder.addKernel(new KernelWorkload("k" + (i + 1), "img", "x86_64",
                    ResourceSlot.of("cpu", cpus[i], "mem", 1024)));
        }
        return builder.build();
    }

    private static List<String> chosenAgents(BatchSelectionResult result) {
        return result.selections().stream().map(s -> s.selectedAgent().id()).toList();
    }

    @Test
    void singleNodeSessionLandsOnOneAgent() {
        AgentInfo a1 = agent("a1", 8);
        BatchSelectionResult result = concentrated.selectAgentsForBatch(List.of(a1),
                AgentSelectionCriteria.of(session(ClusterMode.SINGLE_NODE, 2, 2)),
                AgentSelectionConfig.unlimited(), List.of());

        assertEquals(1, result.selections().size());
        AgentSelection selection = result.selections().get(0);
        assertEquals(List.of("k1", "k2"), selection.requirements().kernelIds());
        assertEquals(ResourceSlot.of("cpu", 4, "mem", 2048), a1.occupiedSlots());
        assertEquals(2, a1.containerCount());
    }

    @Test
    @DisplayName("Later kernels see what earlier kernels of the same batch took")
    void batchAllocationsAccumulate() {
        AgentInfo a1 = agent("a1", 8);
        AgentInfo a2 = agent("a2", 8);
        List<AgentInfo> agents = List.of(a1, a2);
        SessionWorkload session = session(ClusterMode.MULTI_NODE, 2, 2);

        assertEquals(List.of("a1", "a1"), chosenAgents(concentrated.selectAgentsForBatch(agents,
                AgentSelectionCriteria.of(session), AgentSelectionConfig.unlimited(), List.of())));

        AgentInfo b1 = agent("a1", 8);
        AgentInfo b2 = agent("a2", 8);
        assertEquals(List.of("a1", "a2"), chosenAgents(dispersed.selectAgentsForBatch(List.of(b1, b2),
                AgentSelectionCriteria.of(session), AgentSelectionConfig.unlimited(), List.of())));
    }

    @Test
    void failedBatchLeavesAgentsUntouched() {
        AgentInfo a1 = agent("a1", 4);
        AgentInfo a2 = agent("a2", 2);

        assertThrows(NoCompatibleAgentException.class, () -> concentrated.selectAgentsForBatch(List.of(a1, a2),
                AgentSelectionCriteria.of(session(ClusterMode.MULTI_NODE, 4, 4)),
                AgentSelectionConfig.unlimited(), List.of()));

        assertTrue(a1.occupiedSlots().isZero());
        assertEquals(0, a1.containerCount());
        assertTrue(a2.occupiedSlots().isZero());
    }

    @Test
    void rejectionDetailsGroupAgentsByReason() {
        AgentInfo arm = AgentInfo.builder().id("arm-1").architecture("aarch64")
                .availableSlots(ResourceSlot.of("cpu", 64)).build();
        AgentInfo small1 = agent("small-1", 1);
        AgentInfo small2 = agent("small-2", 1);

        NoCompatibleAgentException e = assertThrows(NoCompatibleAgentException.class,
                () -> concentrated.selectAgentsForBatch(List.of(arm, small1, small2),
                        AgentSelectionCriteria.of(session(ClusterMode.SINGLE_NODE, 4)),
                        AgentSelectionConfig.unlimited(), List.of()));

        assertTrue(e.isRetriable());
        assertTrue(e.getMessage().contains("architecture mismatch"), e.getMessage());
        assertTrue(e.getMessage().contains("(agents: arm-1)"), e.getMessage());
        assertTrue(e.getMessage().contains("(agents: small-1, small-2)"), e.getMessage());
        assertTrue(e.getMessage().contains("cpu: requested 4, free 1"), e.getMessage());
    }

    @Test
    void containerLimitExcludesFullAgents() {
        AgentInfo busy = AgentInfo.builder().id("a1").availableSlots(ResourceSlot.of("cpu", 8))
                .containerCount(3).build();
        AgentInfo idle = agent("a2", 16);

        BatchSelectionResult result = concentrated.selectAgentsForBatch(List.of(busy, idle),
                AgentSelectionCriteria.of(session(ClusterMode.SINGLE_NODE, 1)),
                new AgentSelectionConfig(3, false, 0), List.of());
        assertEquals(List.of("a2"), chosenAgents(result));

        NoCompatibleAgentException e = assertThrows(NoCompatibleAgentException.class,
                () -> concentrated.selectAgentsForBatch(List.of(busy),
                        AgentSelectionCriteria.of(session(ClusterMode.SINGLE_NODE, 1)),
                        new AgentSelectionConfig(3, false, 0), List.of()));
        assertTrue(e.getMessage().contains("container limit reached (3/3)"), e.getMessage());
    }

    @Test
    void containerLimitCountsKernelsOfTheSameBatch() {
        AgentInfo a1 = agent("a1", 16);
        AgentInfo a2 = agent("a2", 16);

        BatchSelectionResult result = concentrated.selectAgentsForBatch(List.of(a1, a2),
                AgentSelectionCriteria.of(session(ClusterMode.MULTI_NODE, 1, 1, 1)),
                new AgentSelectionConfig(2, false, 0), List.of());

        assertEquals(List.of("a1", "a1", "a2"), chosenAgents(result));
        assertEquals(2, a1.containerCount());
        assertEquals(1, a2.containerCount());
    }

    @Test
    void designatedAgentOverridesStrategy() {
        AgentInfo a1 = agent("a1", 4);
        AgentInfo a2 = agent("a2", 32);

        BatchSelectionResult result = concentrated.selectAgentsForBatch(List.of(a1, a2),
                AgentSelectionCriteria.of(session(ClusterMode.SINGLE_NODE, 1)),
                AgentSelectionConfig.unlimited(), List.of("a2"));

        assertEquals(List.of("a2"), chosenAgents(result));
    }

    @Test
    void unknownDesignatedAgentIsNotRetriable() {
        DesignatedAgentNotFoundException e = assertThrows(DesignatedAgentNotFoundException.class,
                () -> concentrated.selectAgentsForBatch(List.of(agent("a1", 4)),
                        AgentSelectionCriteria.of(session(ClusterMode.SINGLE_NODE, 1)),
                        AgentSelectionConfig.unlimited(), List.of("ghost")));
        assertFalse(e.isRetriable());
    }

    @Test
    void designatedAgentWithoutCapacityFails() {
        AgentInfo a1 = agent("a1", 2);
        AgentInfo a2 = agent("a2", 32);

        DesignatedAgentIncompatibleException e = assertThrows(DesignatedAgentIncompatibleException.class,
                () -> concentrated.selectAgentsForBatch(List.of(a1, a2),
                        AgentSelectionCriteria.of(session(ClusterMode.SINGLE_NODE, 4)),
                        AgentSelectionConfig.unlimited(), List.of("a1")));
        assertTrue(e.isRetriable());
        assertTrue(e.getMessage().contains("a1"));
        assertFalse(e.getMessage().contains("a2"), e.getMessage());
        assertTrue(a2.occupiedSlots().isZero());
    }

    @Test
    void roundRobinAdvancesCursorPerPlacement() {
        AgentSelector selector = new AgentSelector(new RoundRobinSelectionStrategy());
        List<AgentInfo> agents = List.of(agent("c", 8), agent("a", 8), agent("b", 8));

        BatchSelectionResult result = selector.selectAgentsForBatch(agents,
                AgentSelectionCriteria.of(session(ClusterMode.MULTI_NODE, 1, 1)),
                new AgentSelectionConfig(null, false, 2), List.of());

        assertEquals(List.of("c", "a"), chosenAgents(result));
        assertEquals(4, result.nextRoundRobinIndex());
    }

    @Test
    void cursorUnchangedForOtherStrategiesAndDesignatedPlacements() {
        BatchSelectionResult packed = concentrated.selectAgentsForBatch(List.of(agent("a", 8)),
                AgentSelectionCriteria.of(session(ClusterMode.MULTI_NODE, 1, 1)),
                new AgentSelectionConfig(null, false, 7), List.of());
        assertEquals(7, packed.nextRoundRobinIndex());

        AgentSelector roundRobin = new AgentSelector(new RoundRobinSelectionStrategy());
        BatchSelectionResult pinned = roundRobin.selectAgentsForBatch(List.of(agent("a", 8), agent("b", 8)),
                AgentSelectionCriteria.of(session(ClusterMode.SINGLE_NODE, 1)),
                new AgentSelectionConfig(null, false, 3), List.of("b"));
        assertEquals(3, pinned.nextRoundRobinIndex());
    }

    @Test
    void emptySessionPlacesNothing() {
        BatchSelectionResult result = concentrated.selectAgentsForBatch(List.of(),
                AgentSelectionCriteria.of(SessionWorkload.builder().id("empty").build()),
                new AgentSelectionConfig(null, false, 5), List.of());

        assertTrue(result.isEmpty());
        assertEquals(5, result.nextRoundRobinIndex());
    }

    @Test
    void noAgentsIsRetriable() {
        NoAvailableAgentException e = assertThrows(NoAvailableAgentException.class,
                () -> concentrated.selectAgentsForBatch(List.of(),
                        AgentSelectionCriteria.of(session(ClusterMode.SINGLE_NODE, 1)),
                        AgentSelectionConfig.unlimited(), List.of()));
        assertTrue(e.isRetriable());
    }
}
