package berth.coordinator.model;

/**
 * Agent liveness as tracked by the registry.
 */
public enum AgentStatus {
    /** Heartbeating and schedulable */
    ALIVE,
    /** Missed heartbeats; excluded from scheduling */
    LOST,
    /** Drained by an operator */
    TERMINATED
}
