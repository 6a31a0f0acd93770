package berth.coordinator.selector;

import berth.coordinator.model.ScalingGroupOptions;

/**
 * How placement is constrained for one batch.
 *
 * @param maxContainerCount               per-agent container ceiling, null for unlimited
 * @param enforceSpreadingEndpointReplica spread inference replicas of one endpoint
 *                                        across agents before packing
 * @param roundRobinIndex                 cursor for the round-robin strategy; owned and
 *                                        persisted by the caller
 */
public record AgentSelectionConfig(
        Integer maxContainerCount,
        boolean enforceSpreadingEndpointReplica,
        long roundRobinIndex) {

    public AgentSelectionConfig {
        if (roundRobinIndex < 0) {
            throw new IllegalArgumentException("roundRobinIndex must be non-negative");
        }
    }

    public static AgentSelectionConfig unlimited() {
        return new AgentSelectionConfig(null, false, 0);
    }

    public static AgentSelectionConfig from(ScalingGroupOptions options, long roundRobinIndex) {
        return new AgentSelectionConfig(
                options.maxContainerCount(),
                options.enforceSpreadingEndpointReplica(),
                roundRobinIndex);
    }

    public AgentSelectionConfig withRoundRobinIndex(long index) {
        return new AgentSelectionConfig(maxContainerCount, enforceSpreadingEndpointReplica, index);
    }

    public AgentSelectionConfig withMaxContainerCount(Integer count) {
        return new AgentSelectionConfig(count, enforceSpreadingEndpointReplica, roundRobinIndex);
    }
}
