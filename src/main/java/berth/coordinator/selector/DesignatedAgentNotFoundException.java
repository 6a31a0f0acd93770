package berth.coordinator.selector;

import java.util.List;

/**
 * None of the pinned agents exists in the scaling group.
 */
public class DesignatedAgentNotFoundException extends SchedulingException {

    public DesignatedAgentNotFoundException(List<String> designatedAgentIds, String scalingGroup) {
        super("Designated agent " + designatedAgentIds + " not found in scaling group '" + scalingGroup + "'",
                false);
    }
}
