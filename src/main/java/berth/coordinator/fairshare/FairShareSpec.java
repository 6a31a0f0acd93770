package berth.coordinator.fairshare;

import berth.coordinator.model.ResourceSlot;
import berth.coordinator.model.ScalingGroupOptions;

import java.math.BigDecimal;

/**
 * Fair share parameters of one scope.
 *
 * @param weight          scope weight; null means the resource group's default weight
 * @param halfLifeDays    usage half-life in days
 * @param lookbackDays    usage window in days
 * @param decayUnitDays   granularity of bucket ages
 * @param resourceWeights per-resource weights; resources missing here fall back
 *                        to the scope weight, then to the group settings
 */
public record FairShareSpec(
        BigDecimal weight,
        int halfLifeDays,
        int lookbackDays,
        int decayUnitDays,
        ResourceSlot resourceWeights) {

    public FairShareSpec {
        resourceWeights = resourceWeights != null ? resourceWeights : ResourceSlot.empty();
    }

    /** Spec inheriting everything from the scaling group. */
    public static FairShareSpec inherit(ScalingGroupOptions options) {
        return new FairShareSpec(null, options.halfLifeDays(), options.lookbackDays(), options.decayUnitDays(),
                ResourceSlot.empty());
    }

    public boolean usesDefaultWeight() {
        return weight == null;
    }

    public BigDecimal effectiveWeight(BigDecimal defaultWeight) {
        return weight != null ? weight : defaultWeight;
    }

    public FairShareSpec withWeight(BigDecimal newWeight) {
        return new FairShareSpec(newWeight, halfLifeDays, lookbackDays, decayUnitDays, resourceWeights);
    }

    /** Same weights, decay parameters taken from the group. */
    public FairShareSpec withGroupDecay(ScalingGroupOptions options) {
        return new FairShareSpec(weight, options.halfLifeDays(), options.lookbackDays(), options.decayUnitDays(),
                resourceWeights);
    }
}
