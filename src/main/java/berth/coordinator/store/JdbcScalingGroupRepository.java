package berth.coordinator.store;

import berth.coordinator.model.AgentSelectionStrategy;
import berth.coordinator.model.ScalingGroupOptions;
import berth.coordinator.repository.ScalingGroupRepository;

import java.sql.*;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * JDBC implementation of ScalingGroupRepository.
 */
public class JdbcScalingGroupRepository implements ScalingGroupRepository {

    private final Database db;

    public JdbcScalingGroupRepository(Database db) {
        this.db = db;
    }

    @Override
    public void save(ScalingGroupOptions options) {
        String sql = """
                    MERGE INTO scaling_groups (name, selection_strategy, max_container_count, enforce_spreading,
                                               default_weight, half_life_days, lookback_days, decay_unit_days,
                                               resource_weights)
                    KEY (name)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, options.name());
            ps.setString(2, options.selectionStrategy().name());
            if (options.maxContainerCount() != null) {
                ps.setInt(3, options.maxContainerCount());
            } else {
                ps.setNull(3, Types.INTEGER);
            }
            ps.setBoolean(4, options.enforceSpreadingEndpointReplica());
            ps.setBigDecimal(5, options.defaultWeight());
            ps.setInt(6, options.halfLifeDays());
            ps.setInt(7, options.lookbackDays());
            ps.setInt(8, options.decayUnitDays());
            ps.setString(9, SlotColumns.write(options.resourceWeights()));

            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to save scaling group: " + options.name(), e);
        }
    }

    @Override
    public Optional<ScalingGroupOptions> findByName(String name) {
        String sql = "SELECT * FROM scaling_groups WHERE name = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, name);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find scaling group: " + name, e);
        }
    }

    @Override
    public List<ScalingGroupOptions> findAll() {
        String sql = "SELECT * FROM scaling_groups ORDER BY name";

        try (Connection conn = db.getConnection();
                Statement st = conn.createStatement();
                ResultSet rs = st.executeQuery(sql)) {

            List<ScalingGroupOptions> results = new ArrayList<>();
            while (rs.next()) {
                results.add(mapRow(rs));
            }
            return results;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find all scaling groups", e);
        }
    }

    private ScalingGroupOptions mapRow(ResultSet rs) throws SQLException {
        int maxContainers = rs.getInt("max_container_count");
        Integer maxContainerCount = rs.wasNull() ? null : maxContainers;

        return ScalingGroupOptions.builder()
                .name(rs.getString("name"))
                .selectionStrategy(AgentSelectionStrategy.valueOf(rs.getString("selection_strategy")))
                .maxContainerCount(maxContainerCount)
                .enforceSpreadingEndpointReplica(rs.getBoolean("enforce_spreading"))
                .defaultWeight(rs.getBigDecimal("default_weight"))
                .halfLifeDays(rs.getInt("half_life_days"))
                .lookbackDays(rs.getInt("lookback_days"))
                .decayUnitDays(rs.getInt("decay_unit_days"))
                .resourceWeights(SlotColumns.read(rs.getString("resource_weights")))
                .build();
    }
}
