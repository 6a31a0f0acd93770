package berth.coordinator.service;

import berth.coordinator.config.CoordinatorConfig;
import berth.coordinator.fairshare.FairShareSequencer;
import berth.coordinator.model.AgentInfo;
import berth.coordinator.model.AgentSelection;
import berth.coordinator.model.AgentSelectionStrategy;
import berth.coordinator.model.AgentStatus;
import berth.coordinator.model.KernelAllocation;
import berth.coordinator.model.KernelWorkload;
import berth.coordinator.model.ResourceSlot;
import berth.coordinator.model.RoundRobinState;
import berth.coordinator.model.ScalingGroupOptions;
import berth.coordinator.model.SessionType;
import berth.coordinator.model.SessionWorkload;
import berth.coordinator.repository.AgentRepository;
import berth.coordinator.repository.KernelAllocationRepository;
import berth.coordinator.repository.RoundRobinStateRepository;
import berth.coordinator.repository.ScalingGroupRepository;
import berth.coordinator.selector.AgentSelectionConfig;
import berth.coordinator.selector.AgentSelectionCriteria;
import berth.coordinator.selector.AgentSelector;
import berth.coordinator.selector.BatchSelectionResult;
import berth.coordinator.selector.SchedulingException;
import berth.coordinator.selector.strategy.SelectionStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Service layer for placing sessions on agents.
 *
 * Batches of one scaling group are serialised by a per-group lock; different
 * groups schedule concurrently. Agent occupancy, kernel allocations and the
 * round-robin cursor are persisted only after a batch succeeded.
 */
public class SchedulingService {

    private static final Logger log = LoggerFactory.getLogger(SchedulingService.class);

    private final AgentRepository agentRepository;
    private final ScalingGroupRepository scalingGroupRepository;
    private final RoundRobinStateRepository roundRobinStateRepository;
    private final KernelAllocationRepository kernelAllocationRepository;
    private final FairShareService fairShareService;
    private final CoordinatorConfig config;
    private final Clock clock;
    private final FairShareSequencer sequencer = new FairShareSequencer();
    private final Map<String, ReentrantLock> groupLocks = new ConcurrentHashMap<>();

    public SchedulingService(AgentRepository agentRepository,
            ScalingGroupRepository scalingGroupRepository,
            RoundRobinStateRepository roundRobinStateRepository,
            KernelAllocationRepository kernelAllocationRepository,
            FairShareService fairShareService,
            CoordinatorConfig config,
            Clock clock) {
        this.agentRepository = agentRepository;
        this.scalingGroupRepository = scalingGroupRepository;
        this.roundRobinStateRepository = roundRobinStateRepository;
        this.kernelAllocationRepository = kernelAllocationRepository;
        this.fairShareService = fairShareService;
        this.config = config;
        this.clock = clock;
    }

    /**
     * Place one session against the current agents of its scaling group.
     *
     * @throws SchedulingException if the session cannot be placed; nothing is persisted then
     */
    public BatchSelectionResult scheduleSession(SessionWorkload session) {
        ReentrantLock lock = lockFor(session.scalingGroup());
        lock.lock();
        try {
            ScalingGroupOptions options = scalingGroupRepository.getOrDefault(session.scalingGroup());
            List<AgentInfo> agents = agentRepository.findByScalingGroup(session.scalingGroup(),
                    AgentStatus.ALIVE);
            return place(session, agents, options);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Run one scheduling tick for a scaling group: order the pending sessions by
     * priority and fair share rank, then place them one by one against the same
     * agent snapshot. A failed session is recorded and the tick continues.
     *
     * @return one outcome per session that was eligible this tick, in scheduling order
     */
    public List<SchedulingOutcome> schedulePending(String scalingGroup, List<SessionWorkload> pending) {
        ReentrantLock lock = lockFor(scalingGroup);
        lock.lock();
        try {
            ScalingGroupOptions options = scalingGroupRepository.getOrDefault(scalingGroup);
            Map<String, Integer> ranks = fairShareService.schedulingRanks(scalingGroup);
            List<SessionWorkload> ordered = sequencer.sequence(pending, ranks, clock.instant());
            List<AgentInfo> agents = agentRepository.findByScalingGroup(scalingGroup,
                    AgentStatus.ALIVE);

            List<SchedulingOutcome> outcomes = new ArrayList<>(ordered.size());
            for (SessionWorkload session : ordered) {
                if (!scalingGroup.equals(session.scalingGroup())) {
                    log.warn("Session {} belongs to {}, not {}; skipped", session.id(), session.scalingGroup(),
                            scalingGroup);
                    continue;
                }
                try {
                    outcomes.add(SchedulingOutcome.placed(session.id(), place(session, agents, options)));
                } catch (SchedulingException e) {
                    log.info("Session {} stays pending ({}): {}", session.id(),
                            e.isRetriable() ? "retriable" : "not retriable", e.getMessage());
                    outcomes.add(SchedulingOutcome.failed(session.id(), e));
                } catch (RuntimeException e) {
                    log.error("Failed to store placement of session {}", session.id(), e);
                    outcomes.add(SchedulingOutcome.failed(session.id(),
                            new SchedulingException("placement could not be stored: " + e.getMessage(), true)));
                    // the in-memory snapshot may hold the failed placement
                    agents = agentRepository.findByScalingGroup(scalingGroup, AgentStatus.ALIVE);
                }
            }

            long placed = outcomes.stream().filter(SchedulingOutcome::isPlaced).count();
            log.info("Scheduling tick for {}: {} of {} pending sessions placed ({} deferred)", scalingGroup,
                    placed, pending.size(), pending.size() - ordered.size());
            return outcomes;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Free the slots and containers held by a session's kernels.
     *
     * @return number of kernels released
     */
    public int releaseSession(String sessionId) {
        List<KernelAllocation> allocations = kernelAllocationRepository.findBySession(sessionId);
        if (allocations.isEmpty()) {
            return 0;
        }
        ReentrantLock lock = lockFor(allocations.get(0).scalingGroup());
        lock.lock();
        try {
            List<KernelAllocation> released = kernelAllocationRepository.releaseSession(sessionId);
            if (released.isEmpty()) {
                log.debug("Session {} was already released", sessionId);
                return 0;
            }
            log.info("Released session {}: {} kernels on {}", sessionId, released.size(),
                    released.stream().map(KernelAllocation::agentId).distinct().collect(Collectors.toList()));
            return released.size();
        } finally {
            lock.unlock();
        }
    }

    private BatchSelectionResult place(SessionWorkload session, List<AgentInfo> agents, ScalingGroupOptions options) {
        AgentSelector selector = new AgentSelector(
                SelectionStrategy.create(options.selectionStrategy(), config.resourcePriority()));

        boolean roundRobin = options.selectionStrategy() == AgentSelectionStrategy.ROUNDROBIN;
        String architecture = primaryArchitecture(session);
        String schedulableGroupId = null;
        long startIndex = 0;
        if (roundRobin && architecture != null) {
            schedulableGroupId = schedulableGroupId(agents, architecture);
            RoundRobinState state = roundRobinStateRepository.find(session.scalingGroup(), architecture).orElse(null);
            if (state != null && state.schedulableGroupId().equals(schedulableGroupId)) {
                startIndex = state.nextIndex();
            } else if (state != null) {
                log.debug("Agent set of {}/{} changed, round-robin cursor restarts", session.scalingGroup(),
                        architecture);
            }
        }

        BatchSelectionResult result = selector.selectAgentsForBatch(
                agents,
                criteriaFor(session, options),
                AgentSelectionConfig.from(options, startIndex),
                session.designatedAgentIds());

        if (result.isEmpty()) {
            return result;
        }

        persistPlacement(session, result);
        if (roundRobin && schedulableGroupId != null) {
            roundRobinStateRepository.save(session.scalingGroup(), architecture,
                    new RoundRobinState(schedulableGroupId, result.nextRoundRobinIndex()));
        }
        return result;
    }

    private AgentSelectionCriteria criteriaFor(SessionWorkload session, ScalingGroupOptions options) {
        if (options.enforceSpreadingEndpointReplica()
                && session.sessionType() == SessionType.INFERENCE
                && session.endpointId() != null) {
            return new AgentSelectionCriteria(session,
                    kernelAllocationRepository.countByAgentForEndpoint(session.endpointId()));
        }
        return AgentSelectionCriteria.of(session);
    }

    private void persistPlacement(SessionWorkload session, BatchSelectionResult result) {
        Map<String, KernelWorkload> kernels = session.kernels().stream()
                .collect(Collectors.toMap(KernelWorkload::kernelId, k -> k, (a, b) -> a, LinkedHashMap::new));
        Map<String, AgentInfo> agents = new LinkedHashMap<>();
        List<KernelAllocation> allocations = new ArrayList<>();
        Instant now = clock.instant();

        for (AgentSelection selection : result.selections()) {
            AgentInfo agent = selection.selectedAgent();
            agents.put(agent.id(), agent);
            for (String kernelId : selection.requirements().kernelIds()) {
                KernelWorkload kernel = kernels.get(kernelId);
                allocations.add(new KernelAllocation(kernelId, session.id(), agent.id(), session.scalingGroup(),
                        session.endpointId(), kernel != null ? kernel.requestedSlots() : ResourceSlot.empty(), now));
            }
        }

        kernelAllocationRepository.savePlacement(agents.values(), allocations);
    }

    private static String primaryArchitecture(SessionWorkload session) {
        return session.kernels().isEmpty() ? null : session.kernels().get(0).architecture();
    }

    /**
     * Stable id of the set of agents a round-robin cursor walks over.
     */
    static String schedulableGroupId(List<AgentInfo> agents, String architecture) {
        String joined = agents.stream()
                .filter(a -> a.architecture().equals(architecture))
                .map(AgentInfo::id)
                .sorted()
                .collect(Collectors.joining(","));
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(joined.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private ReentrantLock lockFor(String scalingGroup) {
        return groupLocks.computeIfAbsent(scalingGroup, k -> new ReentrantLock());
    }
}
