package berth.coordinator.fairshare;

import berth.coordinator.model.ResourceSlot;
import berth.coordinator.model.ScalingGroupOptions;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Everything one recalculation of a resource group needs.
 *
 * @param specs           stored specs per scope; scopes without a row use group defaults
 * @param usage           raw (undecayed) resource-seconds per scope and day
 * @param halfLifeDays    group half-life
 * @param lookbackDays    group lookback window
 * @param decayUnitDays   bucket age granularity
 * @param defaultWeight   group default weight
 * @param resourceWeights group per-resource weights
 * @param clusterCapacity summed capacity of the group's agents
 * @param today           last day of the window (UTC)
 */
public record FairShareCalculationContext(
        Map<FairShareScope, FairShareSpec> specs,
        Map<FairShareScope, Map<LocalDate, ResourceSlot>> usage,
        int halfLifeDays,
        int lookbackDays,
        int decayUnitDays,
        BigDecimal defaultWeight,
        ResourceSlot resourceWeights,
        ResourceSlot clusterCapacity,
        LocalDate today) {

    public FairShareCalculationContext {
        specs = Map.copyOf(specs);
        usage = Map.copyOf(usage);
        resourceWeights = resourceWeights != null ? resourceWeights : ResourceSlot.empty();
        clusterCapacity = clusterCapacity != null ? clusterCapacity : ResourceSlot.empty();
    }

    /**
     * Build a context from a group's options, its stored rows and its usage buckets.
     */
    public static FairShareCalculationContext of(
            ScalingGroupOptions options,
            List<FairShareRecord> records,
            List<UsageBucket> buckets,
            ResourceSlot clusterCapacity,
            LocalDate today) {
        Map<FairShareScope, FairShareSpec> specs = new HashMap<>();
        for (FairShareRecord record : records) {
            specs.put(record.scope(), record.spec());
        }
        Map<FairShareScope, Map<LocalDate, ResourceSlot>> usage = new HashMap<>();
        for (UsageBucket bucket : buckets) {
            usage.computeIfAbsent(bucket.scope(), k -> new TreeMap<>())
                    .merge(bucket.date(), bucket.resourceUsage(), ResourceSlot::add);
        }
        return new FairShareCalculationContext(
                specs,
                usage,
                options.halfLifeDays(),
                options.lookbackDays(),
                options.decayUnitDays(),
                options.defaultWeight(),
                options.resourceWeights(),
                clusterCapacity,
                today);
    }

    public LocalDate lookbackStart() {
        return today.minusDays(lookbackDays);
    }
}
