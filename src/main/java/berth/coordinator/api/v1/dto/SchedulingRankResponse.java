package berth.coordinator.api.v1.dto;

import berth.coordinator.fairshare.SchedulingRank;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/**
 * One entry of GET /api/v1/fair-shares/{resourceGroup}/ranks
 */
public record SchedulingRankResponse(
        @JsonProperty("rank") int rank,
        @JsonProperty("domainName") String domainName,
        @JsonProperty("projectId") String projectId,
        @JsonProperty("userId") String userId,
        @JsonProperty("domainFactor") BigDecimal domainFactor,
        @JsonProperty("projectFactor") BigDecimal projectFactor,
        @JsonProperty("userFactor") BigDecimal userFactor) {

    public static SchedulingRankResponse from(SchedulingRank rank) {
        return new SchedulingRankResponse(rank.rank(), rank.domainName(), rank.projectId(), rank.userId(),
                rank.domainFactor(), rank.projectFactor(), rank.userFactor());
    }
}
