package berth.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Request DTO for a scheduling tick over several pending sessions.
 * POST /api/v1/scaling-groups/{name}/pending
 */
public record PendingSessionsRequest(
        @JsonProperty("sessions") List<SessionRequest> sessions) {

    public void validate() {
        if (sessions == null || sessions.isEmpty()) {
            throw new IllegalArgumentException("sessions must not be empty");
        }
        sessions.forEach(SessionRequest::validate);
    }
}
