package berth.coordinator.api.v1.dto;

import berth.coordinator.fairshare.FairShareRecord;
import berth.coordinator.model.ResourceSlot;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Response DTO for one fair share row.
 * GET /api/v1/fair-shares/{resourceGroup}/{level}/{scopeId}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FairShareResponse(
        @JsonProperty("resourceGroup") String resourceGroup,
        @JsonProperty("level") String level,
        @JsonProperty("scopeId") String scopeId,
        @JsonProperty("domainName") String domainName,
        @JsonProperty("projectId") String projectId,
        @JsonProperty("userId") String userId,
        @JsonProperty("weight") BigDecimal weight,
        @JsonProperty("usesDefaultWeight") boolean usesDefaultWeight,
        @JsonProperty("halfLifeDays") int halfLifeDays,
        @JsonProperty("lookbackDays") int lookbackDays,
        @JsonProperty("decayUnitDays") int decayUnitDays,
        @JsonProperty("resourceWeights") ResourceSlot resourceWeights,
        @JsonProperty("fairShareFactor") BigDecimal fairShareFactor,
        @JsonProperty("totalDecayedUsage") ResourceSlot totalDecayedUsage,
        @JsonProperty("normalizedUsage") BigDecimal normalizedUsage,
        @JsonProperty("lookbackStart") LocalDate lookbackStart,
        @JsonProperty("lookbackEnd") LocalDate lookbackEnd,
        @JsonProperty("lastCalculatedAt") Instant lastCalculatedAt,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("updatedAt") Instant updatedAt) {

    public static FairShareResponse from(FairShareRecord record) {
        return new FairShareResponse(
                record.resourceGroup(),
                record.scope().level().value(),
                record.scope().scopeId(),
                record.scope().domainName(),
                record.scope().projectId(),
                record.scope().userId(),
                record.spec().weight(),
                record.spec().usesDefaultWeight(),
                record.spec().halfLifeDays(),
                record.spec().lookbackDays(),
                record.spec().decayUnitDays(),
                record.spec().resourceWeights(),
                record.snapshot().fairShareFactor(),
                record.snapshot().totalDecayedUsage(),
                record.snapshot().normalizedUsage(),
                record.snapshot().lookbackStart(),
                record.snapshot().lookbackEnd(),
                record.snapshot().lastCalculatedAt(),
                record.createdAt(),
                record.updatedAt());
    }
}
