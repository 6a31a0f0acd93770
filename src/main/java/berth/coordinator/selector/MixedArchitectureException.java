package berth.coordinator.selector;

import java.util.Set;

/**
 * A single-node session mixes kernel architectures. Retrying cannot help; the
 * submission itself must be fixed.
 */
public class MixedArchitectureException extends SchedulingException {

    public MixedArchitectureException(String sessionId, Set<String> architectures) {
        super("Single-node session " + sessionId + " has kernels with different architectures: " + architectures,
                false);
    }
}
