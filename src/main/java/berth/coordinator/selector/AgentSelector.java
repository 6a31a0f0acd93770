package berth.coordinator.selector;

import berth.coordinator.model.AgentInfo;
import berth.coordinator.model.AgentSelection;
import berth.coordinator.model.ResourceRequirements;
import berth.coordinator.model.ResourceSlot;
import berth.coordinator.selector.strategy.SelectionStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Places every requirement of one session, all or nothing.
 *
 * The selector works on trackers layered over the given agents. Agents are only
 * written once every requirement has an agent; any failure leaves them exactly
 * as they were. Instances hold no mutable state and are safe to share, but the
 * agent list passed to one call must not be used by another call at the same time.
 */
public class AgentSelector {
    private static final Logger log = LoggerFactory.getLogger(AgentSelector.class);

    private final SelectionStrategy strategy;

    public AgentSelector(SelectionStrategy strategy) {
        this.strategy = Objects.requireNonNull(strategy, "strategy is required");
    }

    public SelectionStrategy strategy() {
        return strategy;
    }

    /**
     * Select agents for every requirement of {@code criteria.session()}.
     *
     * @param agents             candidate agents of the scaling group
     * @param criteria           the session being placed
     * @param config             placement limits and round-robin cursor
     * @param designatedAgentIds agents the session is pinned to; empty for none
     * @return selections in requirement order and the cursor to persist
     * @throws SchedulingException when any requirement cannot be placed
     */
    public BatchSelectionResult selectAgentsForBatch(
            List<AgentInfo> agents,
            AgentSelectionCriteria criteria,
            AgentSelectionConfig config,
            List<String> designatedAgentIds) {

        String sessionId = criteria.session().id();
        List<ResourceRequirements> requirements = ResourceRequirementDeriver.derive(criteria.session());
        if (requirements.isEmpty()) {
            log.debug("Session {} has no kernels, nothing to place", sessionId);
            return BatchSelectionResult.empty(config.roundRobinIndex());
        }

        if (agents.isEmpty()) {
            throw new NoAvailableAgentException(criteria.session().scalingGroup());
        }

        List<String> designated = designatedAgentIds != null ? designatedAgentIds : List.of();
        if (!designated.isEmpty()) {
            boolean anyPresent = agents.stream().anyMatch(a -> designated.contains(a.id()));
            if (!anyPresent) {
                throw new DesignatedAgentNotFoundException(designated, criteria.session().scalingGroup());
            }
        }

        List<AgentStateTracker> trackers = new ArrayList<>(agents.size());
        for (AgentInfo agent : agents) {
            trackers.add(new AgentStateTracker(agent));
        }

        long roundRobinIndex = config.roundRobinIndex();
        List<AgentSelection> selections = new ArrayList<>(requirements.size());

        for (ResourceRequirements requirement : requirements) {
            List<AgentStateTracker> compatible = filterCompatible(trackers, requirement, config);

            AgentStateTracker chosen;
            if (!designated.isEmpty()) {
                chosen = compatible.stream()
                        .filter(t -> designated.contains(t.agentId()))
                        .findFirst()
                        .orElseThrow(() -> new DesignatedAgentIncompatibleException(designated, requirement,
                                summarizeRejections(trackers, requirement, config, designated)));
                log.debug("Session {}: designated agent {} chosen for {}", sessionId, chosen.agentId(),
                        requirement.kernelIds());
            } else {
                chosen = strategy.selectTracker(compatible, requirement, criteria,
                        config.withRoundRobinIndex(roundRobinIndex));
                if (strategy.advancesRoundRobinIndex()) {
                    roundRobinIndex++;
                }
                log.debug("Session {}: {} strategy chose agent {} for {}", sessionId, strategy.name(),
                        chosen.agentId(), requirement.kernelIds());
            }

            chosen.applyDiff(requirement.requestedSlots(), requirement.kernelCount());
            selections.add(new AgentSelection(requirement, chosen.agent()));
        }

        for (AgentStateTracker tracker : trackers) {
            tracker.commit();
        }

        log.info("Session {} placed: {}", sessionId, selections.stream()
                .map(s -> s.requirements().kernelIds() + "->" + s.selectedAgent().id())
                .collect(Collectors.joining(", ")));
        return new BatchSelectionResult(selections, roundRobinIndex);
    }

    private List<AgentStateTracker> filterCompatible(List<AgentStateTracker> trackers,
            ResourceRequirements requirement, AgentSelectionConfig config) {
        List<AgentStateTracker> compatible = new ArrayList<>();
        for (AgentStateTracker tracker : trackers) {
            if (rejectionReason(tracker, requirement, config) == null) {
                compatible.add(tracker);
            }
        }
        if (compatible.isEmpty()) {
            throw new NoCompatibleAgentException(requirement,
                    summarizeRejections(trackers, requirement, config, List.of()));
        }
        return compatible;
    }

    /**
     * @return why the tracker cannot host the requirement, or null if it can
     */
    private static String rejectionReason(AgentStateTracker tracker, ResourceRequirements requirement,
            AgentSelectionConfig config) {
        if (!tracker.agent().architecture().equals(requirement.requiredArchitecture())) {
            return "architecture mismatch (agent " + tracker.agent().architecture() + ")";
        }
        ResourceSlot headroom = tracker.headroom();
        if (!requirement.requestedSlots().fitsWithin(headroom)) {
            Set<String> insufficient = headroom.shortfallAgainst(requirement.requestedSlots());
            return new InsufficientResourcesException(tracker.agentId(), requirement.requestedSlots(), headroom,
                    insufficient).getMessage();
        }
        Integer max = config.maxContainerCount();
        if (max != null && tracker.containerCount() >= max) {
            return new ContainerLimitExceededException(tracker.agentId(), tracker.containerCount(), max)
                    .getMessage();
        }
        return null;
    }

    /**
     * Group identical rejection reasons: {@code "reason (agents: a, b); other (agents: c)"}.
     * With a non-empty {@code only}, just those agents are described.
     */
    private static String summarizeRejections(List<AgentStateTracker> trackers, ResourceRequirements requirement,
            AgentSelectionConfig config, List<String> only) {
        Map<String, List<String>> byReason = new LinkedHashMap<>();
        for (AgentStateTracker tracker : trackers) {
            if (!only.isEmpty() && !only.contains(tracker.agentId())) {
                continue;
            }
            String reason = rejectionReason(tracker, requirement, config);
            if (reason != null) {
                byReason.computeIfAbsent(reason, k -> new ArrayList<>()).add(tracker.agentId());
            }
        }
        if (byReason.isEmpty()) {
            return "not in the compatible set";
        }
        return byReason.entrySet().stream()
                .map(e -> e.getKey() + " (agents: " + String.join(", ", e.getValue()) + ")")
                .collect(Collectors.joining("; "));
    }
}
