package berth.coordinator.fairshare;

import java.time.Instant;
import java.util.Objects;

/**
 * Persisted fair share row: exactly one per (resource group, scope level, scope id).
 */
public record FairShareRecord(
        String resourceGroup,
        FairShareScope scope,
        FairShareSpec spec,
        FairShareCalculationSnapshot snapshot,
        Instant createdAt,
        Instant updatedAt) {

    public FairShareRecord {
        Objects.requireNonNull(resourceGroup, "resourceGroup is required");
        Objects.requireNonNull(scope, "scope is required");
        Objects.requireNonNull(spec, "spec is required");
        Objects.requireNonNull(snapshot, "snapshot is required");
    }

    public FairShareRecord withSpec(FairShareSpec newSpec) {
        return new FairShareRecord(resourceGroup, scope, newSpec, snapshot, createdAt, updatedAt);
    }

    public FairShareRecord withSnapshot(FairShareCalculationSnapshot newSnapshot) {
        return new FairShareRecord(resourceGroup, scope, spec, newSnapshot, createdAt, updatedAt);
    }
}
