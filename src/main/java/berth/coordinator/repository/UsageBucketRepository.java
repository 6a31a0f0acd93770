package berth.coordinator.repository;

import berth.coordinator.fairshare.FairShareScope;
import berth.coordinator.fairshare.UsageBucket;

import java.time.LocalDate;
import java.util.List;

/**
 * Daily usage buckets per (resource group, scope).
 */
public interface UsageBucketRepository {

    /**
     * Add each bucket's usage to the stored bucket with the same key, creating it if needed.
     * All buckets are written in one transaction.
     */
    void addUsage(List<UsageBucket> buckets);

    /**
     * Buckets of a resource group with {@code from <= date <= to}.
     */
    List<UsageBucket> findByResourceGroup(String resourceGroup, LocalDate from, LocalDate to);

    /**
     * Buckets of one scope with {@code from <= date <= to}, ordered by date.
     */
    List<UsageBucket> findByScope(String resourceGroup, FairShareScope scope, LocalDate from, LocalDate to);

    /**
     * Remove buckets older than {@code date}.
     *
     * @return number of rows removed
     */
    int deleteBefore(LocalDate date);
}
