package berth.coordinator.fairshare;

import berth.coordinator.model.ResourceSlot;

import java.math.BigDecimal;

/**
 * Calculated values for one scope.
 *
 * @param weight            weight the factor was computed with
 * @param usedDefaultWeight true if the scope had no weight of its own
 * @param totalDecayedUsage decayed resource-seconds within the window
 * @param normalizedUsage   weighted share of cluster capacity consumed
 * @param fairShareFactor   2^(-normalized/weight), in [0, 1], scale 6
 */
public record FairShareResult(
        FairShareScope scope,
        BigDecimal weight,
        boolean usedDefaultWeight,
        ResourceSlot totalDecayedUsage,
        BigDecimal normalizedUsage,
        BigDecimal fairShareFactor) {
}
