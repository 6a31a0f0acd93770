package berth.coordinator.selector;

/**
 * The scaling group has no agents at all.
 */
public class NoAvailableAgentException extends SchedulingException {

    public NoAvailableAgentException(String scalingGroup) {
        super("No agents available in scaling group '" + scalingGroup + "'", true);
    }
}
