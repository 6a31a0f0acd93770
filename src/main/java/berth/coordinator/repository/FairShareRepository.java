package berth.coordinator.repository;

import berth.coordinator.fairshare.FairShareRecord;
import berth.coordinator.fairshare.ScopeLevel;

import java.util.List;
import java.util.Optional;

/**
 * Fair share rows, unique per (resource group, scope level, scope id).
 */
public interface FairShareRepository {

    /**
     * Store a recalculation result. An existing row gets new decay settings and
     * calculation columns; its weight and creation time are kept. A missing row
     * is inserted from the whole record.
     */
    void saveCalculation(FairShareRecord record);

    /**
     * Store the weight of a scope. An existing row only gets the new weight; a
     * missing row is inserted from the whole record.
     */
    void saveWeight(FairShareRecord record);

    Optional<FairShareRecord> find(String resourceGroup, ScopeLevel level, String scopeId);

    List<FairShareRecord> findByResourceGroup(String resourceGroup);

    List<FairShareRecord> findByResourceGroupAndLevel(String resourceGroup, ScopeLevel level);

    boolean delete(String resourceGroup, ScopeLevel level, String scopeId);
}
