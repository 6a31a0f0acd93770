package berth.coordinator.fairshare;

import berth.coordinator.model.SessionWorkload;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Orders pending sessions for one scheduling tick.
 *
 * Sessions that may not start yet are dropped. The rest go by session priority
 * (higher first), then fair share rank of their user in their project (unranked
 * users last), then creation time.
 */
public class FairShareSequencer {

    private static final Instant NEVER = Instant.MAX;

    /**
     * @param pending pending sessions of one scaling group
     * @param ranks   rank per {@link SchedulingRank#key()}
     * @param now     current time
     * @return a new list in scheduling order
     */
    public List<SessionWorkload> sequence(List<SessionWorkload> pending, Map<String, Integer> ranks, Instant now) {
        Comparator<SessionWorkload> order = Comparator
                .comparingInt(SessionWorkload::priority).reversed()
                .thenComparingInt(s -> rankOf(s, ranks))
                .thenComparing(s -> s.createdAt() != null ? s.createdAt() : NEVER);

        return pending.stream()
                .filter(s -> !s.isDeferred(now))
                .sorted(order)
                .toList();
    }

    private static int rankOf(SessionWorkload session, Map<String, Integer> ranks) {
        if (session.userId() == null || session.projectId() == null) {
            return Integer.MAX_VALUE;
        }
        return ranks.getOrDefault(FairShareScope.userScopeId(session.userId(), session.projectId()),
                Integer.MAX_VALUE);
    }
}
