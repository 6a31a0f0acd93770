package berth.coordinator.fairshare;

import java.math.BigDecimal;

/**
 * Position of a (user, project) pair in the pending queue; 1 goes first.
 */
public record SchedulingRank(
        String domainName,
        String projectId,
        String userId,
        int rank,
        BigDecimal domainFactor,
        BigDecimal projectFactor,
        BigDecimal userFactor) {

    /** Key matching {@link FairShareScope#userScopeId(String, String)}. */
    public String key() {
        return FairShareScope.userScopeId(userId, projectId);
    }
}
