package berth.coordinator.service;

import berth.coordinator.config.CoordinatorConfig;
import berth.coordinator.model.AgentInfo;
import berth.coordinator.model.AgentStatus;
import berth.coordinator.model.ResourceSlot;
import berth.coordinator.repository.AgentRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Service layer for agent operations.
 * Handles heartbeats, lookups and staleness detection.
 */
public class AgentService {

    private static final Logger log = LoggerFactory.getLogger(AgentService.class);

    private final AgentRepository agentRepository;
    private final CoordinatorConfig config;

    public AgentService(AgentRepository agentRepository, CoordinatorConfig config) {
        this.agentRepository = agentRepository;
        this.config = config;
    }

    /**
     * Process heartbeat from an agent, registering it on first contact.
     */
    public void heartbeat(String agentId, String address, String architecture, String scalingGroup,
            ResourceSlot availableSlots) {
        agentRepository.heartbeat(agentId, address, architecture, scalingGroup, availableSlots);
        log.debug("Heartbeat from agent {} (group={}, arch={}, slots={})", agentId, scalingGroup, architecture,
                availableSlots);
    }

    public Optional<AgentInfo> findById(String agentId) {
        return agentRepository.findById(agentId);
    }

    public List<AgentInfo> findAll() {
        return agentRepository.findAll();
    }

    /**
     * ALIVE agents of a scaling group, ordered by id.
     */
    public List<AgentInfo> findSchedulable(String scalingGroup) {
        return agentRepository.findByScalingGroup(scalingGroup, AgentStatus.ALIVE);
    }

    /**
     * Summed capacity of the ALIVE agents of a scaling group.
     */
    public ResourceSlot clusterCapacity(String scalingGroup) {
        ResourceSlot total = ResourceSlot.empty();
        for (AgentInfo agent : findSchedulable(scalingGroup)) {
            total = total.add(agent.availableSlots());
        }
        return total;
    }

    /**
     * Mark agents without a recent heartbeat as LOST.
     *
     * @return number of agents marked LOST
     */
    public int reapStaleAgents() {
        Instant cutoff = Instant.now().minus(config.agentHeartbeatTimeout());
        List<String> staleIds = agentRepository.markStaleAsLost(cutoff);
        if (!staleIds.isEmpty()) {
            log.warn("Agents lost (no heartbeat since {}): {}", cutoff, staleIds);
        }
        return staleIds.size();
    }

    public boolean delete(String agentId) {
        return agentRepository.delete(agentId);
    }
}
