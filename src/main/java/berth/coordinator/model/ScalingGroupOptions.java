package berth.coordinator.model;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Per-scaling-group scheduling and fair share settings.
 * A scaling group doubles as the resource group of its fair share rows.
 */
public final class ScalingGroupOptions {

    public static final int DEFAULT_HALF_LIFE_DAYS = 7;
    public static final int DEFAULT_LOOKBACK_DAYS = 28;
    public static final int DEFAULT_DECAY_UNIT_DAYS = 1;

    private final String name;
    private final AgentSelectionStrategy selectionStrategy;
    private final Integer maxContainerCount;
    private final boolean enforceSpreadingEndpointReplica;
    private final BigDecimal defaultWeight;
    private final int halfLifeDays;
    private final int lookbackDays;
    private final int decayUnitDays;
    private final ResourceSlot resourceWeights;

    private ScalingGroupOptions(Builder builder) {
        this.name = Objects.requireNonNull(builder.name, "name is required");
        this.selectionStrategy = Objects.requireNonNull(builder.selectionStrategy, "selectionStrategy is required");
        this.maxContainerCount = builder.maxContainerCount;
        this.enforceSpreadingEndpointReplica = builder.enforceSpreadingEndpointReplica;
        this.defaultWeight = Objects.requireNonNull(builder.defaultWeight, "defaultWeight is required");
        this.halfLifeDays = builder.halfLifeDays;
        this.lookbackDays = builder.lookbackDays;
        this.decayUnitDays = builder.decayUnitDays;
        this.resourceWeights = builder.resourceWeights != null ? builder.resourceWeights : ResourceSlot.empty();

        if (halfLifeDays <= 0) {
            throw new IllegalArgumentException("halfLifeDays must be positive");
        }
        if (lookbackDays <= 0) {
            throw new IllegalArgumentException("lookbackDays must be positive");
        }
        if (decayUnitDays <= 0) {
            throw new IllegalArgumentException("decayUnitDays must be positive");
        }
        if (maxContainerCount != null && maxContainerCount < 0) {
            throw new IllegalArgumentException("maxContainerCount must be non-negative");
        }
    }

    /** Options used for scaling groups without a stored row. */
    public static ScalingGroupOptions defaults(String name) {
        return builder().name(name).build();
    }

    public String name() {
        return name;
    }

    public AgentSelectionStrategy selectionStrategy() {
        return selectionStrategy;
    }

    /** Container ceiling per agent, or null for unlimited. */
    public Integer maxContainerCount() {
        return maxContainerCount;
    }

    public boolean enforceSpreadingEndpointReplica() {
        return enforceSpreadingEndpointReplica;
    }

    public BigDecimal defaultWeight() {
        return defaultWeight;
    }

    public int halfLifeDays() {
        return halfLifeDays;
    }

    public int lookbackDays() {
        return lookbackDays;
    }

    public int decayUnitDays() {
        return decayUnitDays;
    }

    /** Group-level per-resource weights; resources not listed fall back to the default weight. */
    public ResourceSlot resourceWeights() {
        return resourceWeights;
    }

    public Builder toBuilder() {
        return new Builder()
                .name(name)
                .selectionStrategy(selectionStrategy)
                .maxContainerCount(maxContainerCount)
                .enforceSpreadingEndpointReplica(enforceSpreadingEndpointReplica)
                .defaultWeight(defaultWeight)
                .halfLifeDays(halfLifeDays)
                .lookbackDays(lookbackDays)
                .decayUnitDays(decayUnitDays)
                .resourceWeights(resourceWeights);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String name;
        private AgentSelectionStrategy selectionStrategy = AgentSelectionStrategy.CONCENTRATED;
        private Integer maxContainerCount;
        private boolean enforceSpreadingEndpointReplica;
        private BigDecimal defaultWeight = BigDecimal.ONE;
        private int halfLifeDays = DEFAULT_HALF_LIFE_DAYS;
        private int lookbackDays = DEFAULT_LOOKBACK_DAYS;
        private int decayUnitDays = DEFAULT_DECAY_UNIT_DAYS;
        private ResourceSlot resourceWeights;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder selectionStrategy(AgentSelectionStrategy selectionStrategy) {
            this.selectionStrategy = selectionStrategy;
            return this;
        }

        public Builder maxContainerCount(Integer maxContainerCount) {
            this.maxContainerCount = maxContainerCount;
            return this;
        }

        public Builder enforceSpreadingEndpointReplica(boolean enforceSpreadingEndpointReplica) {
            this.enforceSpreadingEndpointReplica = enforceSpreadingEndpointReplica;
            return this;
        }

        public Builder defaultWeight(BigDecimal defaultWeight) {
            this.defaultWeight = defaultWeight;
            return this;
        }

        public Builder halfLifeDays(int halfLifeDays) {
            this.halfLifeDays = halfLifeDays;
            return this;
        }

        public Builder lookbackDays(int lookbackDays) {
            this.lookbackDays = lookbackDays;
            return this;
        }

        public Builder decayUnitDays(int decayUnitDays) {
            this.decayUnitDays = decayUnitDays;
            return this;
        }

        public Builder resourceWeights(ResourceSlot resourceWeights) {
            this.resourceWeights = resourceWeights;
            return this;
        }

        public ScalingGroupOptions build() {
            return new ScalingGroupOptions(this);
        }
    }

    @Override
    public String toString() {
        return "ScalingGroupOptions{name='" + name + "', strategy=" + selectionStrategy
                + ", maxContainers=" + maxContainerCount + "}";
    }
}
