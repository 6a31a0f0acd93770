package berth.coordinator.api.v1.dto;

import berth.coordinator.service.SchedulingOutcome;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Response DTO for a scheduling tick.
 */
public record SchedulingTickResponse(
        @JsonProperty("placed") List<PlacementResponse> placed,
        @JsonProperty("failed") List<Failure> failed) {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Failure(
            @JsonProperty("sessionId") String sessionId,
            @JsonProperty("type") String type,
            @JsonProperty("error") String error,
            @JsonProperty("retriable") boolean retriable) {
    }

    public static SchedulingTickResponse from(List<SchedulingOutcome> outcomes) {
        List<PlacementResponse> placed = outcomes.stream()
                .filter(SchedulingOutcome::isPlaced)
                .map(o -> PlacementResponse.from(o.sessionId(), o.placement()))
                .toList();
        List<Failure> failed = outcomes.stream()
                .filter(o -> !o.isPlaced())
                .map(o -> new Failure(o.sessionId(), o.failure().getClass().getSimpleName(),
                        o.failure().getMessage(), o.failure().isRetriable()))
                .toList();
        return new SchedulingTickResponse(placed, failed);
    }
}
