package berth.coordinator.fairshare;

import java.util.Objects;

/**
 * Who a fair share row or usage bucket belongs to.
 *
 * A user is tracked per project, so the user scope id combines both:
 * {@code <userId>@<projectId>}.
 *
 * @param level      hierarchy level
 * @param scopeId    unique id within the level
 * @param domainName owning domain (all levels)
 * @param projectId  owning project (project and user levels)
 * @param userId     user (user level only)
 */
public record FairShareScope(
        ScopeLevel level,
        String scopeId,
        String domainName,
        String projectId,
        String userId) {

    public FairShareScope {
        Objects.requireNonNull(level, "level is required");
        Objects.requireNonNull(scopeId, "scopeId is required");
        Objects.requireNonNull(domainName, "domainName is required");
    }

    public static FairShareScope domain(String domainName) {
        return new FairShareScope(ScopeLevel.DOMAIN, domainName, domainName, null, null);
    }

    public static FairShareScope project(String domainName, String projectId) {
        Objects.requireNonNull(projectId, "projectId is required");
        return new FairShareScope(ScopeLevel.PROJECT, projectId, domainName, projectId, null);
    }

    public static FairShareScope user(String domainName, String projectId, String userId) {
        Objects.requireNonNull(projectId, "projectId is required");
        Objects.requireNonNull(userId, "userId is required");
        return new FairShareScope(ScopeLevel.USER, userScopeId(userId, projectId), domainName, projectId, userId);
    }

    /**
     * Rebuild a scope from its level and id, as used in URLs.
     *
     * @param domainName owning domain; required for project and user scopes,
     *                   ignored for domain scopes
     * @throws IllegalArgumentException if a user scope id is not {@code <userId>@<projectId>}
     */
    public static FairShareScope of(ScopeLevel level, String scopeId, String domainName) {
        if (scopeId == null || scopeId.isBlank()) {
            throw new IllegalArgumentException("scopeId is required");
        }
        return switch (level) {
            case DOMAIN -> domain(scopeId);
            case PROJECT -> project(domainName, scopeId);
            case USER -> {
                int at = scopeId.lastIndexOf('@');
                if (at <= 0 || at == scopeId.length() - 1) {
                    throw new IllegalArgumentException("user scope id must be <userId>@<projectId>: " + scopeId);
                }
                yield user(domainName, scopeId.substring(at + 1), scopeId.substring(0, at));
            }
        };
    }

    public static String userScopeId(String userId, String projectId) {
        return userId + "@" + projectId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof FairShareScope other))
            return false;
        return level == other.level && scopeId.equals(other.scopeId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(level, scopeId);
    }

    @Override
    public String toString() {
        return level.value() + ":" + scopeId;
    }
}
