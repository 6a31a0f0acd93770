package berth.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/**
 * Request DTO for a scope weight change; a null weight restores the group default.
 * PUT /api/v1/fair-shares/{resourceGroup}/{level}/{scopeId}/weight
 */
public record WeightUpdateRequest(
        @JsonProperty("weight") BigDecimal weight,
        @JsonProperty("domainName") String domainName) {

    public void validate() {
        if (weight != null && weight.signum() <= 0) {
            throw new IllegalArgumentException("weight must be positive");
        }
    }
}
