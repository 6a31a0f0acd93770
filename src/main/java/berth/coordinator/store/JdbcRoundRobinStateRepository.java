package berth.coordinator.store;

import berth.coordinator.model.RoundRobinState;
import berth.coordinator.repository.RoundRobinStateRepository;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;

/**
 * JDBC implementation of RoundRobinStateRepository.
 */
public class JdbcRoundRobinStateRepository implements RoundRobinStateRepository {

    private final Database db;

    public JdbcRoundRobinStateRepository(Database db) {
        this.db = db;
    }

    @Override
    public Optional<RoundRobinState> find(String scalingGroup, String architecture) {
        String sql = """
                    SELECT schedulable_group_id, next_index FROM roundrobin_states
                    WHERE scaling_group = ? AND architecture = ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, scalingGroup);
            ps.setString(2, architecture);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(new RoundRobinState(
                            rs.getString("schedulable_group_id"),
                            rs.getLong("next_index")));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find round-robin state: " + scalingGroup + "/" + architecture, e);
        }
    }

    @Override
    public void save(String scalingGroup, String architecture, RoundRobinState state) {
        String sql = """
                    MERGE INTO roundrobin_states (scaling_group, architecture, schedulable_group_id, next_index)
                    KEY (scaling_group, architecture)
                    VALUES (?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, scalingGroup);
            ps.setString(2, architecture);
            ps.setString(3, state.schedulableGroupId());
            ps.setLong(4, state.nextIndex());
            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to save round-robin state: " + scalingGroup + "/" + architecture, e);
        }
    }
}
