package berth.coordinator.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable domain model of a pending session waiting for placement.
 */
public final class SessionWorkload {
    private final String id;
    private final String accessKey;
    private final ResourceSlot requestedSlots;
    private final String userId;
    private final String projectId;
    private final String domainName;
    private final String scalingGroup;
    private final int priority;
    private final SessionType sessionType;
    private final ClusterMode clusterMode;
    private final Instant startsAfter;
    private final List<KernelWorkload> kernels;
    private final List<String> designatedAgentIds;
    private final String endpointId;
    private final Instant createdAt;

    private SessionWorkload(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.accessKey = builder.accessKey;
        this.userId = builder.userId;
        this.projectId = builder.projectId;
        this.domainName = builder.domainName;
        this.scalingGroup = Objects.requireNonNull(builder.scalingGroup, "scalingGroup is required");
        this.priority = builder.priority;
        this.sessionType = Objects.requireNonNull(builder.sessionType, "sessionType is required");
        this.clusterMode = Objects.requireNonNull(builder.clusterMode, "clusterMode is required");
        this.startsAfter = builder.startsAfter;
        this.kernels = List.copyOf(builder.kernels);
        this.designatedAgentIds = builder.designatedAgentIds != null ? List.copyOf(builder.designatedAgentIds)
                : List.of();
        this.endpointId = builder.endpointId;
        this.createdAt = builder.createdAt;
        this.requestedSlots = builder.requestedSlots != null ? builder.requestedSlots : sumKernelSlots(kernels);
    }

    private static ResourceSlot sumKernelSlots(List<KernelWorkload> kernels) {
        ResourceSlot total = ResourceSlot.empty();
        for (KernelWorkload kernel : kernels) {
            total = total.add(kernel.requestedSlots());
        }
        return total;
    }

    // Getters
    public String id() {
        return id;
    }

    public String accessKey() {
        return accessKey;
    }

    /** Aggregate demand of all kernels. */
    public ResourceSlot requestedSlots() {
        return requestedSlots;
    }

    public String userId() {
        return userId;
    }

    public String projectId() {
        return projectId;
    }

    public String domainName() {
        return domainName;
    }

    public String scalingGroup() {
        return scalingGroup;
    }

    public int priority() {
        return priority;
    }

    public SessionType sessionType() {
        return sessionType;
    }

    public ClusterMode clusterMode() {
        return clusterMode;
    }

    public Instant startsAfter() {
        return startsAfter;
    }

    public List<KernelWorkload> kernels() {
        return kernels;
    }

    public List<String> designatedAgentIds() {
        return designatedAgentIds;
    }

    public boolean hasDesignatedAgents() {
        return !designatedAgentIds.isEmpty();
    }

    public String endpointId() {
        return endpointId;
    }

    public Instant createdAt() {
        return createdAt;
    }

    /** True if the session may not start before a future instant. */
    public boolean isDeferred(Instant now) {
        return startsAfter != null && startsAfter.isAfter(now);
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .accessKey(accessKey)
                .requestedSlots(requestedSlots)
                .userId(userId)
                .projectId(projectId)
                .domainName(domainName)
                .scalingGroup(scalingGroup)
                .priority(priority)
                .sessionType(sessionType)
                .clusterMode(clusterMode)
                .startsAfter(startsAfter)
                .kernels(kernels)
                .designatedAgentIds(designatedAgentIds)
                .endpointId(endpointId)
                .createdAt(createdAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String accessKey;
        private ResourceSlot requestedSlots;
        private String userId;
        private String projectId;
        private String domainName = "default";
        private String scalingGroup = "default";
        private int priority;
        private SessionType sessionType = SessionType.INTERACTIVE;
        private ClusterMode clusterMode = ClusterMode.SINGLE_NODE;
        private Instant startsAfter;
        private List<KernelWorkload> kernels = new ArrayList<>();
        private List<String> designatedAgentIds;
        private String endpointId;
        private Instant createdAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder accessKey(String accessKey) {
            this.accessKey = accessKey;
            return this;
        }

        public Builder requestedSlots(ResourceSlot requestedSlots) {
            this.requestedSlots = requestedSlots;
            return this;
        }

        public Builder userId(String userId) {
            this.userId = userId;
            return this;
        }

        public Builder projectId(String projectId) {
            this.projectId = projectId;
            return this;
        }

        public Builder domainName(String domainName) {
            this.domainName = domainName;
            return this;
        }

        public Builder scalingGroup(String scalingGroup) {
            this.scalingGroup = scalingGroup;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder sessionType(SessionType sessionType) {
            this.sessionType = sessionType;
            return this;
        }

        public Builder clusterMode(ClusterMode clusterMode) {
            this.clusterMode = clusterMode;
            return this;
        }

        public Builder startsAfter(Instant startsAfter) {
            this.startsAfter = startsAfter;
            return this;
        }

        public Builder kernels(List<KernelWorkload> kernels) {
            this.kernels = new ArrayList<>(kernels);
            return this;
        }

        public Builder addKernel(KernelWorkload kernel) {
            this.kernels.add(kernel);
            return this;
        }

        public Builder designatedAgentIds(List<String> designatedAgentIds) {
            this.designatedAgentIds = designatedAgentIds;
            return this;
        }

        public Builder endpointId(String endpointId) {
            this.endpointId = endpointId;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public SessionWorkload build() {
            return new SessionWorkload(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SessionWorkload session))
            return false;
        return Objects.equals(id, session.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "SessionWorkload{id='" + id + "', mode=" + clusterMode + ", kernels=" + kernels.size() + "}";
    }
}
