package berth.coordinator.selector;

import berth.coordinator.model.AgentSelection;

import java.util.List;

/**
 * Outcome of a committed batch.
 *
 * @param selections          one entry per requirement, in requirement order
 * @param nextRoundRobinIndex cursor to persist for the next batch; equal to the
 *                            input cursor unless the round-robin strategy placed
 *                            something
 */
public record BatchSelectionResult(List<AgentSelection> selections, long nextRoundRobinIndex) {

    public BatchSelectionResult {
        selections = List.copyOf(selections);
    }

    public static BatchSelectionResult empty(long roundRobinIndex) {
        return new BatchSelectionResult(List.of(), roundRobinIndex);
    }

    public boolean isEmpty() {
        return selections.isEmpty();
    }
}
