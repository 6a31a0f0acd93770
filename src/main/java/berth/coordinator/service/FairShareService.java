package berth.coordinator.service;

import berth.coordinator.fairshare.FairShareAggregator;
import berth.coordinator.fairshare.FairShareCalculationContext;
import berth.coordinator.fairshare.FairShareCalculationResult;
import berth.coordinator.fairshare.FairShareCalculationSnapshot;
import berth.coordinator.fairshare.FairShareCalculator;
import berth.coordinator.fairshare.FairShareRecord;
import berth.coordinator.fairshare.FairShareResult;
import berth.coordinator.fairshare.FairShareScope;
import berth.coordinator.fairshare.FairShareSpec;
import berth.coordinator.fairshare.KernelUsageRecord;
import berth.coordinator.fairshare.ScopeLevel;
import berth.coordinator.fairshare.SchedulingRank;
import berth.coordinator.fairshare.UsageBucket;
import berth.coordinator.model.AgentInfo;
import berth.coordinator.model.ResourceSlot;
import berth.coordinator.model.ScalingGroupOptions;
import berth.coordinator.repository.FairShareRepository;
import berth.coordinator.repository.ScalingGroupRepository;
import berth.coordinator.repository.UsageBucketRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Service layer for fair share bookkeeping: usage intake, periodic
 * recalculation, weights and scheduling ranks.
 */
public class FairShareService {

    private static final Logger log = LoggerFactory.getLogger(FairShareService.class);

    /** Scale of the stored normalized usage column. */
    private static final int NORMALIZED_SCALE = 16;

    private final FairShareRepository fairShareRepository;
    private final UsageBucketRepository usageBucketRepository;
    private final ScalingGroupRepository scalingGroupRepository;
    private final AgentService agentService;
    private final FairShareAggregator aggregator = new FairShareAggregator();
    private final FairShareCalculator calculator = new FairShareCalculator();
    private final Clock clock;

    public FairShareService(FairShareRepository fairShareRepository,
            UsageBucketRepository usageBucketRepository,
            ScalingGroupRepository scalingGroupRepository,
            AgentService agentService,
            Clock clock) {
        this.fairShareRepository = fairShareRepository;
        this.usageBucketRepository = usageBucketRepository;
        this.scalingGroupRepository = scalingGroupRepository;
        this.agentService = agentService;
        this.clock = clock;
    }

    /**
     * Aggregate kernel usage into daily buckets and add them to the store.
     *
     * @return number of buckets touched
     */
    public int recordUsage(List<KernelUsageRecord> records) {
        List<UsageBucket> buckets = aggregator.aggregate(records);
        usageBucketRepository.addUsage(buckets);
        log.debug("Recorded {} usage records into {} buckets", records.size(), buckets.size());
        return buckets.size();
    }

    /**
     * Recalculate every scope of one resource group and upsert the results.
     * Each scope is written on its own; a scope that fails to persist is logged
     * and the rest are still written.
     */
    public FairShareCalculationResult recalculate(String resourceGroup) {
        ScalingGroupOptions options = scalingGroupRepository.getOrDefault(resourceGroup);
        LocalDate today = LocalDate.now(clock.withZone(ZoneOffset.UTC));
        Instant now = clock.instant();

        List<FairShareRecord> records = fairShareRepository.findByResourceGroup(resourceGroup);
        List<UsageBucket> buckets = usageBucketRepository.findByResourceGroup(
                resourceGroup, today.minusDays(options.lookbackDays()), today);
        ResourceSlot capacity = agentService.clusterCapacity(resourceGroup);

        FairShareCalculationContext context = FairShareCalculationContext.of(options, records, buckets, capacity,
                today);
        FairShareCalculationResult result = calculator.calculateFactors(context);

        Map<FairShareScope, FairShareRecord> existing = new HashMap<>();
        for (FairShareRecord record : records) {
            existing.put(record.scope(), record);
        }

        int written = 0;
        for (FairShareResult scopeResult : result.results().values()) {
            FairShareRecord previous = existing.get(scopeResult.scope());
            FairShareSpec spec = previous != null
                    ? previous.spec().withGroupDecay(options)
                    : FairShareSpec.inherit(options);
            FairShareCalculationSnapshot snapshot = new FairShareCalculationSnapshot(
                    scopeResult.fairShareFactor(),
                    scopeResult.totalDecayedUsage(),
                    scopeResult.normalizedUsage().setScale(NORMALIZED_SCALE, RoundingMode.HALF_UP),
                    context.lookbackStart(),
                    today,
                    now);
            try {
                fairShareRepository.saveCalculation(new FairShareRecord(resourceGroup, scopeResult.scope(), spec,
                        snapshot, previous != null ? previous.createdAt() : now, now));
                written++;
            } catch (RuntimeException e) {
                log.warn("Failed to store fair share of {} in {}: {}", scopeResult.scope(), resourceGroup,
                        e.getMessage(), e);
            }
        }

        log.info("Fair share recalculated for {}: {} scopes written, {} skipped, {} users ranked",
                resourceGroup, written, result.skipped().size(), result.ranks().size());
        return result;
    }

    /**
     * Recalculate every known resource group (configured or served by an agent),
     * then drop usage buckets older than the longest lookback window.
     * One failing group does not stop the others.
     */
    public void recalculateAll() {
        Set<String> groups = new TreeSet<>();
        scalingGroupRepository.findAll().forEach(o -> groups.add(o.name()));
        for (AgentInfo agent : agentService.findAll()) {
            groups.add(agent.scalingGroup());
        }
        int longestLookback = ScalingGroupOptions.DEFAULT_LOOKBACK_DAYS;
        for (String group : groups) {
            try {
                longestLookback = Math.max(longestLookback,
                        scalingGroupRepository.getOrDefault(group).lookbackDays());
                recalculate(group);
            } catch (RuntimeException e) {
                log.error("Fair share recalculation failed for resource group {}", group, e);
            }
        }
        pruneUsage(longestLookback);
    }

    /**
     * Remove usage buckets that fall before every lookback window.
     *
     * @return number of buckets removed
     */
    public int pruneUsage(int lookbackDays) {
        LocalDate cutoff = LocalDate.now(clock.withZone(ZoneOffset.UTC)).minusDays(lookbackDays);
        int removed = usageBucketRepository.deleteBefore(cutoff);
        if (removed > 0) {
            log.info("Pruned {} usage buckets before {}", removed, cutoff);
        }
        return removed;
    }

    /**
     * Current rank per (user, project) from the stored factors.
     *
     * @return rank keyed by {@link SchedulingRank#key()}
     */
    public Map<String, Integer> schedulingRanks(String resourceGroup) {
        Map<String, Integer> ranks = new HashMap<>();
        for (SchedulingRank rank : rankUsers(resourceGroup)) {
            ranks.put(rank.key(), rank.rank());
        }
        return ranks;
    }

    /**
     * Ranked (user, project) pairs of a resource group, rank 1 first.
     */
    public List<SchedulingRank> rankUsers(String resourceGroup) {
        Map<FairShareScope, BigDecimal> factors = new LinkedHashMap<>();
        for (FairShareRecord record : fairShareRepository.findByResourceGroup(resourceGroup)) {
            factors.put(record.scope(), record.snapshot().fairShareFactor());
        }
        return FairShareCalculator.rankUsers(factors);
    }

    public Optional<FairShareRecord> find(String resourceGroup, ScopeLevel level, String scopeId) {
        return fairShareRepository.find(resourceGroup, level, scopeId);
    }

    /**
     * Rows of a resource group, optionally restricted to one level.
     */
    public List<FairShareRecord> list(String resourceGroup, ScopeLevel level) {
        if (level == null) {
            return fairShareRepository.findByResourceGroup(resourceGroup);
        }
        return fairShareRepository.findByResourceGroupAndLevel(resourceGroup, level);
    }

    /**
     * Set or clear the weight of a scope, creating its row if needed.
     *
     * @param weight new weight, or null to fall back to the group default
     * @return the stored row
     * @throws IllegalArgumentException if the weight is not positive
     */
    public FairShareRecord updateWeight(String resourceGroup, FairShareScope scope, BigDecimal weight) {
        if (weight != null && weight.signum() <= 0) {
            throw new IllegalArgumentException("weight must be positive");
        }
        Instant now = clock.instant();
        ScalingGroupOptions options = scalingGroupRepository.getOrDefault(resourceGroup);

        FairShareRecord record = new FairShareRecord(
                resourceGroup,
                scope,
                FairShareSpec.inherit(options).withWeight(weight),
                FairShareCalculationSnapshot.initial(LocalDate.now(clock.withZone(ZoneOffset.UTC)),
                        options.lookbackDays()),
                now,
                now);

        fairShareRepository.saveWeight(record);
        log.info("Fair share weight of {} in {} set to {}", scope, resourceGroup,
                weight != null ? weight.toPlainString() : "default");
        return fairShareRepository.find(resourceGroup, scope.level(), scope.scopeId()).orElse(record);
    }

    /**
     * Remove the row of a scope, e.g. when the user or project is deleted.
     *
     * @return true if a row was removed
     */
    public boolean deleteScope(String resourceGroup, ScopeLevel level, String scopeId) {
        boolean deleted = fairShareRepository.delete(resourceGroup, level, scopeId);
        if (deleted) {
            log.info("Fair share scope {}:{} removed from {}", level.value(), scopeId, resourceGroup);
        }
        return deleted;
    }

    /**
     * Usage buckets of one scope within the group's current window.
     */
    public List<UsageBucket> usageHistory(String resourceGroup, FairShareScope scope) {
        ScalingGroupOptions options = scalingGroupRepository.getOrDefault(resourceGroup);
        LocalDate today = LocalDate.now(clock.withZone(ZoneOffset.UTC));
        return usageBucketRepository.findByScope(resourceGroup, scope, today.minusDays(options.lookbackDays()),
                today);
    }
}
