package berth.coordinator.fairshare;

import berth.coordinator.model.ResourceSlot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Computes fair share factors from decayed usage.
 *
 * <pre>
 * decayed[r]    = sum over buckets in window of usage[r] * 0.5^(age / halfLife)
 * ratio[r]      = decayed[r] / (capacity[r] * lookbackDays * 86400)
 * normalized    = sum(w[r] * ratio[r]) / sum(w[r])
 * factor        = 2^(-normalized / weight), clamped to [0, 1]
 * </pre>
 *
 * Pure computation; persisting the results is up to the caller.
 */
public class FairShareCalculator {
    private static final Logger log = LoggerFactory.getLogger(FairShareCalculator.class);

    public static final int FACTOR_SCALE = 6;
    static final long SECONDS_PER_DAY = 86_400L;

    private static final MathContext MC = MathContext.DECIMAL64;

    public FairShareCalculationResult calculateFactors(FairShareCalculationContext context) {
        Set<FairShareScope> scopes = new TreeSet<>(Comparator
                .comparing(FairShareScope::level)
                .thenComparing(FairShareScope::scopeId));
        scopes.addAll(context.specs().keySet());
        scopes.addAll(context.usage().keySet());

        Map<FairShareScope, FairShareResult> results = new LinkedHashMap<>();
        List<FairShareScope> skipped = new ArrayList<>();

        for (FairShareScope scope : scopes) {
            FairShareSpec spec = context.specs().get(scope);
            BigDecimal weight = spec != null ? spec.effectiveWeight(context.defaultWeight()) : context.defaultWeight();
            boolean usedDefault = spec == null || spec.usesDefaultWeight();

            if (weight == null || weight.signum() <= 0) {
                log.warn("Skipping fair share scope {}: non-positive weight {}", scope, weight);
                skipped.add(scope);
                continue;
            }

            ResourceSlot decayed = decayedUsage(context.usage().getOrDefault(scope, Map.of()), context);
            ResourceSlot weights = resolveResourceWeights(decayed, spec, context);
            BigDecimal normalized = normalizedUsage(decayed, context.clusterCapacity(), context.lookbackDays(),
                    weights);
            BigDecimal factor = factor(normalized, weight);

            results.put(scope, new FairShareResult(scope, weight, usedDefault, decayed, normalized, factor));
        }

        Map<FairShareScope, BigDecimal> factors = new LinkedHashMap<>();
        results.forEach((scope, result) -> factors.put(scope, result.fairShareFactor()));
        List<SchedulingRank> ranks = rankUsers(factors);

        log.debug("Calculated {} fair share scopes ({} skipped), {} ranked users",
                results.size(), skipped.size(), ranks.size());
        return new FairShareCalculationResult(results, ranks, skipped);
    }

    /**
     * Rank every user scope in {@code factors}: domain factor desc, project factor
     * desc, user factor desc, then user id and project id. Missing parent scopes
     * count as factor 1 (no usage).
     */
    public static List<SchedulingRank> rankUsers(Map<FairShareScope, BigDecimal> factors) {
        List<SchedulingRank> unranked = new ArrayList<>();
        for (Map.Entry<FairShareScope, BigDecimal> entry : factors.entrySet()) {
            FairShareScope scope = entry.getKey();
            if (scope.level() != ScopeLevel.USER) {
                continue;
            }
            BigDecimal domainFactor = factors.getOrDefault(FairShareScope.domain(scope.domainName()), BigDecimal.ONE);
            BigDecimal projectFactor = factors.getOrDefault(
                    FairShareScope.project(scope.domainName(), scope.projectId()), BigDecimal.ONE);
            unranked.add(new SchedulingRank(scope.domainName(), scope.projectId(), scope.userId(), 0,
                    domainFactor, projectFactor, entry.getValue()));
        }

        unranked.sort(Comparator.comparing(SchedulingRank::domainFactor).reversed()
                .thenComparing(Comparator.comparing(SchedulingRank::projectFactor).reversed())
                .thenComparing(Comparator.comparing(SchedulingRank::userFactor).reversed())
                .thenComparing(SchedulingRank::userId)
                .thenComparing(SchedulingRank::projectId));

        List<SchedulingRank> ranks = new ArrayList<>(unranked.size());
        for (int i = 0; i < unranked.size(); i++) {
            SchedulingRank r = unranked.get(i);
            ranks.add(new SchedulingRank(r.domainName(), r.projectId(), r.userId(), i + 1,
                    r.domainFactor(), r.projectFactor(), r.userFactor()));
        }
        return ranks;
    }

    /**
     * Sum the buckets inside {@code [today - lookbackDays, today]}, each halved once
     * per half-life of its age. Ages are floored to a multiple of the decay unit.
     */
    ResourceSlot decayedUsage(Map<LocalDate, ResourceSlot> buckets, FairShareCalculationContext context) {
        LocalDate today = context.today();
        LocalDate windowStart = context.lookbackStart();
        ResourceSlot total = ResourceSlot.empty();

        for (Map.Entry<LocalDate, ResourceSlot> entry : buckets.entrySet()) {
            LocalDate date = entry.getKey();
            if (date.isBefore(windowStart) || date.isAfter(today)) {
                continue;
            }
            long age = ChronoUnit.DAYS.between(date, today);
            age -= age % context.decayUnitDays();
            if (age == 0) {
                total = total.add(entry.getValue());
            } else {
                double multiplier = Math.pow(0.5, (double) age / context.halfLifeDays());
                total = total.add(entry.getValue().multiply(BigDecimal.valueOf(multiplier)));
            }
        }
        return total;
    }

    /**
     * Weight of every used resource: scope per-resource weight, else scope weight,
     * else group per-resource weight, else group default weight.
     */
    static ResourceSlot resolveResourceWeights(ResourceSlot usage, FairShareSpec spec,
            FairShareCalculationContext context) {
        Map<String, BigDecimal> weights = new LinkedHashMap<>();
        for (String name : usage.keys()) {
            BigDecimal w;
            if (spec != null && spec.resourceWeights().keys().contains(name)) {
                w = spec.resourceWeights().get(name);
            } else if (spec != null && spec.weight() != null) {
                w = spec.weight();
            } else if (context.resourceWeights().keys().contains(name)) {
                w = context.resourceWeights().get(name);
            } else {
                w = context.defaultWeight();
            }
            weights.put(name, w);
        }
        return ResourceSlot.of(weights);
    }

    /**
     * Weighted average of per-resource capacity ratios. Resources without cluster
     * capacity are ignored; no usage yields zero.
     */
    static BigDecimal normalizedUsage(ResourceSlot usage, ResourceSlot capacity, int lookbackDays,
            ResourceSlot weights) {
        BigDecimal weightedSum = BigDecimal.ZERO;
        BigDecimal weightTotal = BigDecimal.ZERO;
        BigDecimal windowSeconds = BigDecimal.valueOf(lookbackDays * SECONDS_PER_DAY);

        for (String name : usage.keys()) {
            BigDecimal cap = capacity.get(name);
            if (cap.signum() <= 0) {
                continue;
            }
            BigDecimal ratio = usage.get(name).divide(cap.multiply(windowSeconds), MC);
            BigDecimal w = weights.get(name);
            weightedSum = weightedSum.add(ratio.multiply(w, MC));
            weightTotal = weightTotal.add(w);
        }

        if (weightTotal.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        return weightedSum.divide(weightTotal, MC);
    }

    /**
     * {@code 2^(-normalized / weight)} clamped to [0, 1] at {@link #FACTOR_SCALE}.
     */
    static BigDecimal factor(BigDecimal normalized, BigDecimal weight) {
        double exponent = normalized.divide(weight, MC).doubleValue();
        double value = Math.pow(2.0, -exponent);
        if (Double.isNaN(value) || value < 0.0) {
            value = 0.0;
        } else if (value > 1.0) {
            value = 1.0;
        }
        return BigDecimal.valueOf(value).setScale(FACTOR_SCALE, RoundingMode.HALF_UP);
    }
}
