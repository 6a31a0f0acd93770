package berth.coordinator.service;

import berth.coordinator.selector.BatchSelectionResult;
import berth.coordinator.selector.SchedulingException;

/**
 * Result of one session within a scheduling tick: either a committed placement
 * or the failure that kept the session pending.
 */
public record SchedulingOutcome(String sessionId, BatchSelectionResult placement, SchedulingException failure) {

    public static SchedulingOutcome placed(String sessionId, BatchSelectionResult placement) {
        return new SchedulingOutcome(sessionId, placement, null);
    }

    public static SchedulingOutcome failed(String sessionId, SchedulingException failure) {
        return new SchedulingOutcome(sessionId, null, failure);
    }

    public boolean isPlaced() {
        return placement != null;
    }
}
