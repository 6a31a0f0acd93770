package berth.coordinator.api.v1.dto;

import berth.coordinator.model.AgentSelection;
import berth.coordinator.model.ResourceSlot;
import berth.coordinator.selector.BatchSelectionResult;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Response DTO for a placed session.
 */
public record PlacementResponse(
        @JsonProperty("sessionId") String sessionId,
        @JsonProperty("selections") List<Selection> selections,
        @JsonProperty("nextRoundRobinIndex") long nextRoundRobinIndex) {

    public record Selection(
            @JsonProperty("agentId") String agentId,
            @JsonProperty("kernelIds") List<String> kernelIds,
            @JsonProperty("requestedSlots") ResourceSlot requestedSlots) {

        static Selection from(AgentSelection selection) {
            return new Selection(
                    selection.selectedAgent().id(),
                    selection.requirements().kernelIds(),
                    selection.requirements().requestedSlots());
        }
    }

    public static PlacementResponse from(String sessionId, BatchSelectionResult result) {
        return new PlacementResponse(
                sessionId,
                result.selections().stream().map(Selection::from).toList(),
                result.nextRoundRobinIndex());
    }
}
