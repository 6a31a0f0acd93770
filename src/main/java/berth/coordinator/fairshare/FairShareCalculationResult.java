package berth.coordinator.fairshare;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Results of one recalculation.
 *
 * @param results scope results in level order (domains, projects, users)
 * @param ranks   user ranks, rank 1 first
 * @param skipped scopes left out because their settings are malformed
 */
public record FairShareCalculationResult(
        Map<FairShareScope, FairShareResult> results,
        List<SchedulingRank> ranks,
        List<FairShareScope> skipped) {

    public FairShareCalculationResult {
        results = Collections.unmodifiableMap(new LinkedHashMap<>(results));
        ranks = List.copyOf(ranks);
        skipped = List.copyOf(skipped);
    }

    public Optional<FairShareResult> result(FairShareScope scope) {
        return Optional.ofNullable(results.get(scope));
    }

    public List<FairShareResult> resultsAt(ScopeLevel level) {
        return results.values().stream()
                .filter(r -> r.scope().level() == level)
                .toList();
    }
}
