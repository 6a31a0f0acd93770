package berth.coordinator.model;

/**
 * Session kind.
 */
public enum SessionType {
    INTERACTIVE,
    BATCH,
    /** Model-serving replica belonging to an endpoint */
    INFERENCE,
    SYSTEM
}
