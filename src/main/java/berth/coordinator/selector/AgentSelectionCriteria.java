package berth.coordinator.selector;

import berth.coordinator.model.SessionWorkload;

import java.util.Map;
import java.util.Objects;

/**
 * What is being placed.
 *
 * @param session                the session whose kernels need agents
 * @param kernelCountsAtEndpoint per-agent count of running kernels that belong to
 *                               the session's serving endpoint; empty when replica
 *                               spreading does not apply
 */
public record AgentSelectionCriteria(
        SessionWorkload session,
        Map<String, Integer> kernelCountsAtEndpoint) {

    public AgentSelectionCriteria {
        Objects.requireNonNull(session, "session is required");
        kernelCountsAtEndpoint = kernelCountsAtEndpoint != null ? Map.copyOf(kernelCountsAtEndpoint) : Map.of();
    }

    public static AgentSelectionCriteria of(SessionWorkload session) {
        return new AgentSelectionCriteria(session, Map.of());
    }

    public int kernelCountAtEndpoint(String agentId) {
        return kernelCountsAtEndpoint.getOrDefault(agentId, 0);
    }
}
