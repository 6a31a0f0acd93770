package berth.coordinator.repository;

import berth.coordinator.model.ScalingGroupOptions;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for per-scaling-group settings.
 */
public interface ScalingGroupRepository {

    /** Insert or replace the options of a scaling group. */
    void save(ScalingGroupOptions options);

    Optional<ScalingGroupOptions> findByName(String name);

    List<ScalingGroupOptions> findAll();

    /** Stored options, or defaults for a group without a row. */
    default ScalingGroupOptions getOrDefault(String name) {
        return findByName(name).orElseGet(() -> ScalingGroupOptions.defaults(name));
    }
}
