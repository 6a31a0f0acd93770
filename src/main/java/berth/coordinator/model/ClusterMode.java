package berth.coordinator.model;

/**
 * How the kernels of a session are placed.
 */
public enum ClusterMode {
    /** All kernels co-located on one agent */
    SINGLE_NODE,
    /** Each kernel placed independently */
    MULTI_NODE
}
