package berth.coordinator.repository;

import berth.coordinator.model.AgentInfo;
import berth.coordinator.model.AgentStatus;
import berth.coordinator.model.ResourceSlot;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for agent persistence.
 */
public interface AgentRepository {

    /**
     * Record a heartbeat. Registers the agent if unknown; otherwise refreshes its
     * address, architecture, scaling group and capacity and marks it ALIVE.
     * Occupancy is owned by the scheduler and left untouched.
     *
     * @param agentId        the agent ID
     * @param address        reachable address of the agent
     * @param architecture   CPU architecture, e.g. {@code x86_64}
     * @param scalingGroup   scaling group the agent serves
     * @param availableSlots total capacity of the agent
     */
    void heartbeat(String agentId, String address, String architecture, String scalingGroup,
            ResourceSlot availableSlots);

    Optional<AgentInfo> findById(String agentId);

    List<AgentInfo> findAll();

    /**
     * Agents of one scaling group with the given status, ordered by id.
     */
    List<AgentInfo> findByScalingGroup(String scalingGroup, AgentStatus status);

    /**
     * Mark ALIVE agents as LOST if they haven't sent a heartbeat recently.
     *
     * @param lastHeartbeatBefore agents with heartbeat before this are marked LOST
     * @return IDs of the agents that were marked LOST
     */
    List<String> markStaleAsLost(Instant lastHeartbeatBefore);

    boolean delete(String agentId);
}
