package berth.coordinator.model;

/**
 * Persisted round-robin cursor for one (scaling group, architecture) pair.
 *
 * @param schedulableGroupId digest of the agent ids the index refers to; a
 *                           different digest means the agent set changed
 * @param nextIndex          index to use for the next placement
 */
public record RoundRobinState(String schedulableGroupId, long nextIndex) {

    public RoundRobinState {
        if (nextIndex < 0) {
            throw new IllegalArgumentException("nextIndex must be non-negative");
        }
    }
}
