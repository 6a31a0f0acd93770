package berth.coordinator.selector;

/**
 * Base class of every placement failure. A failed batch never commits any
 * agent state, so callers may retry retriable failures on the next tick.
 */
public class SchedulingException extends RuntimeException {

    private final boolean retriable;

    public SchedulingException(String message, boolean retriable) {
        super(message);
        this.retriable = retriable;
    }

    /** True if the same session may succeed on a later tick without changes. */
    public boolean isRetriable() {
        return retriable;
    }
}
