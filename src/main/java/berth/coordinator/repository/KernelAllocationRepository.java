package berth.coordinator.repository;

import berth.coordinator.model.AgentInfo;
import berth.coordinator.model.KernelAllocation;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Kernels placed on agents, kept until their session is released.
 */
public interface KernelAllocationRepository {

    /**
     * Store the occupancy of the given agents together with the new allocations,
     * in one transaction.
     */
    void savePlacement(Collection<AgentInfo> agents, List<KernelAllocation> allocations);

    List<KernelAllocation> findBySession(String sessionId);

    /**
     * Number of kernels serving the endpoint, per agent id.
     */
    Map<String, Integer> countByAgentForEndpoint(String endpointId);

    /**
     * Delete the session's allocations and give their slots and containers back
     * to the agents, in one transaction.
     *
     * @return the allocations removed by this call; empty if another release got them first
     */
    List<KernelAllocation> releaseSession(String sessionId);
}
