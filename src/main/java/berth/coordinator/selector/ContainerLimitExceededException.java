package berth.coordinator.selector;

/**
 * Per-agent rejection: the agent already runs the maximum number of containers.
 */
public class ContainerLimitExceededException extends SchedulingException {

    private final String agentId;

    public ContainerLimitExceededException(String agentId, int currentCount, int maxCount) {
        super("container limit reached (" + currentCount + "/" + maxCount + ")", true);
        this.agentId = agentId;
    }

    public String agentId() {
        return agentId;
    }
}
