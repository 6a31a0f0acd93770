package berth.coordinator.repository;

import berth.coordinator.model.RoundRobinState;

import java.util.Optional;

/**
 * Round-robin cursor per (scaling group, architecture).
 */
public interface RoundRobinStateRepository {

    Optional<RoundRobinState> find(String scalingGroup, String architecture);

    /** Insert or replace the cursor. */
    void save(String scalingGroup, String architecture, RoundRobinState state);
}
