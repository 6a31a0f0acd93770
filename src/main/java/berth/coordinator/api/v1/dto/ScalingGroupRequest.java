package berth.coordinator.api.v1.dto;

import berth.coordinator.model.AgentSelectionStrategy;
import berth.coordinator.model.ResourceSlot;
import berth.coordinator.model.ScalingGroupOptions;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.Locale;

/**
 * Request/response DTO for scaling group settings.
 * GET/PUT /api/v1/scaling-groups/{name}
 *
 * Fields left null on PUT keep their defaults.
 */
public record ScalingGroupRequest(
        @JsonProperty("selectionStrategy") String selectionStrategy,
        @JsonProperty("maxContainerCount") Integer maxContainerCount,
        @JsonProperty("enforceSpreadingEndpointReplica") Boolean enforceSpreadingEndpointReplica,
        @JsonProperty("defaultWeight") BigDecimal defaultWeight,
        @JsonProperty("halfLifeDays") Integer halfLifeDays,
        @JsonProperty("lookbackDays") Integer lookbackDays,
        @JsonProperty("decayUnitDays") Integer decayUnitDays,
        @JsonProperty("resourceWeights") ResourceSlot resourceWeights) {

    public ScalingGroupOptions toOptions(String name) {
        ScalingGroupOptions.Builder builder = ScalingGroupOptions.builder().name(name);
        if (selectionStrategy != null) {
            try {
                builder.selectionStrategy(AgentSelectionStrategy.valueOf(selectionStrategy.toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown selectionStrategy: " + selectionStrategy);
            }
        }
        builder.maxContainerCount(maxContainerCount);
        if (enforceSpreadingEndpointReplica != null) {
            builder.enforceSpreadingEndpointReplica(enforceSpreadingEndpointReplica);
        }
        if (defaultWeight != null) {
            if (defaultWeight.signum() <= 0) {
                throw new IllegalArgumentException("defaultWeight must be positive");
            }
            builder.defaultWeight(defaultWeight);
        }
        if (halfLifeDays != null) {
            builder.halfLifeDays(halfLifeDays);
        }
        if (lookbackDays != null) {
            builder.lookbackDays(lookbackDays);
        }
        if (decayUnitDays != null) {
            builder.decayUnitDays(decayUnitDays);
        }
        builder.resourceWeights(resourceWeights);
        return builder.build();
    }

    public static ScalingGroupRequest from(ScalingGroupOptions options) {
        return new ScalingGroupRequest(
                options.selectionStrategy().name(),
                options.maxContainerCount(),
                options.enforceSpreadingEndpointReplica(),
                options.defaultWeight(),
                options.halfLifeDays(),
                options.lookbackDays(),
                options.decayUnitDays(),
                options.resourceWeights());
    }
}
