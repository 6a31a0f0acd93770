package berth.coordinator.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Snapshot of one agent as seen by a scheduling tick.
 *
 * Identity, address, architecture and capacity are fixed for the lifetime of the
 * snapshot. Occupied slots and container count change only when the selector
 * commits a batch.
 */
public final class AgentInfo {
    private final String id;
    private final String address;
    private final String architecture;
    private final ResourceSlot availableSlots;
    private final String scalingGroup;
    private final AgentStatus status;
    private final Instant lastHeartbeat;

    private ResourceSlot occupiedSlots;
    private int containerCount;

    private AgentInfo(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.address = builder.address;
        this.architecture = Objects.requireNonNull(builder.architecture, "architecture is required");
        this.availableSlots = Objects.requireNonNull(builder.availableSlots, "availableSlots is required");
        this.occupiedSlots = Objects.requireNonNull(builder.occupiedSlots, "occupiedSlots is required");
        this.scalingGroup = Objects.requireNonNull(builder.scalingGroup, "scalingGroup is required");
        this.containerCount = builder.containerCount;
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.lastHeartbeat = builder.lastHeartbeat;
    }

    // Getters
    public String id() {
        return id;
    }

    public String address() {
        return address;
    }

    public String architecture() {
        return architecture;
    }

    /** Total slot capacity of the agent. */
    public ResourceSlot availableSlots() {
        return availableSlots;
    }

    public ResourceSlot occupiedSlots() {
        return occupiedSlots;
    }

    public String scalingGroup() {
        return scalingGroup;
    }

    public int containerCount() {
        return containerCount;
    }

    public AgentStatus status() {
        return status;
    }

    public Instant lastHeartbeat() {
        return lastHeartbeat;
    }

    /** Capacity minus occupied slots. */
    public ResourceSlot remainingSlots() {
        return availableSlots.subtract(occupiedSlots);
    }

    /**
     * Overwrite occupancy with the effective state of a committed batch.
     * Only the agent selector calls this.
     */
    public void applyCommittedState(ResourceSlot occupiedSlots, int containerCount) {
        this.occupiedSlots = Objects.requireNonNull(occupiedSlots);
        this.containerCount = containerCount;
    }

    /** Create a builder from this agent (for copies and updates) */
    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .address(address)
                .architecture(architecture)
                .availableSlots(availableSlots)
                .occupiedSlots(occupiedSlots)
                .scalingGroup(scalingGroup)
                .containerCount(containerCount)
                .status(status)
                .lastHeartbeat(lastHeartbeat);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String address;
        private String architecture = "x86_64";
        private ResourceSlot availableSlots = ResourceSlot.empty();
        private ResourceSlot occupiedSlots = ResourceSlot.empty();
        private String scalingGroup = "default";
        private int containerCount;
        private AgentStatus status = AgentStatus.ALIVE;
        private Instant lastHeartbeat;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder address(String address) {
            this.address = address;
            return this;
        }

        public Builder architecture(String architecture) {
            this.architecture = architecture;
            return this;
        }

        public Builder availableSlots(ResourceSlot availableSlots) {
            this.availableSlots = availableSlots;
            return this;
        }

        public Builder occupiedSlots(ResourceSlot occupiedSlots) {
            this.occupiedSlots = occupiedSlots;
            return this;
        }

        public Builder scalingGroup(String scalingGroup) {
            this.scalingGroup = scalingGroup;
            return this;
        }

        public Builder containerCount(int containerCount) {
            this.containerCount = containerCount;
            return this;
        }

        public Builder status(AgentStatus status) {
            this.status = status;
            return this;
        }

        public Builder lastHeartbeat(Instant lastHeartbeat) {
            this.lastHeartbeat = lastHeartbeat;
            return this;
        }

        public AgentInfo build() {
            return new AgentInfo(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AgentInfo agent))
            return false;
        return Objects.equals(id, agent.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "AgentInfo{id='" + id + "', arch=" + architecture + ", containers=" + containerCount + "}";
    }
}
