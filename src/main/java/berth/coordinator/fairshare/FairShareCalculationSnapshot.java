package berth.coordinator.fairshare;

import berth.coordinator.model.ResourceSlot;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Outcome of the latest calculation for one scope.
 */
public record FairShareCalculationSnapshot(
        BigDecimal fairShareFactor,
        ResourceSlot totalDecayedUsage,
        BigDecimal normalizedUsage,
        LocalDate lookbackStart,
        LocalDate lookbackEnd,
        Instant lastCalculatedAt) {

    /** Snapshot of a scope that was never calculated: full share, no usage. */
    public static FairShareCalculationSnapshot initial(LocalDate today, int lookbackDays) {
        return new FairShareCalculationSnapshot(
                BigDecimal.ONE.setScale(FairShareCalculator.FACTOR_SCALE),
                ResourceSlot.empty(),
                BigDecimal.ZERO,
                today.minusDays(lookbackDays),
                today,
                null);
    }
}
