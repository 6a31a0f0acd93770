package berth.coordinator.store;

import berth.coordinator.fairshare.FairShareCalculationSnapshot;
import berth.coordinator.fairshare.FairShareRecord;
import berth.coordinator.fairshare.FairShareScope;
import berth.coordinator.fairshare.FairShareSpec;
import berth.coordinator.fairshare.ScopeLevel;
import berth.coordinator.repository.FairShareRepository;

import java.math.BigDecimal;
import java.sql.*;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * JDBC implementation of FairShareRepository.
 */
public class JdbcFairShareRepository implements FairShareRepository {

    private final Database db;

    public JdbcFairShareRepository(Database db) {
        this.db = db;
    }

    @Override
    public void saveCalculation(FairShareRecord record) {
        String updateSql = """
                    UPDATE fair_shares
                    SET half_life_days = ?, lookback_days = ?, decay_unit_days = ?,
                        fair_share_factor = ?, total_decayed_usage = ?, normalized_usage = ?,
                        lookback_start = ?, lookback_end = ?, last_calculated_at = ?, updated_at = ?
                    WHERE resource_group = ? AND scope_level = ? AND scope_id = ?
                """;

        write(record, "calculation", conn -> {
            try (PreparedStatement ps = conn.prepareStatement(updateSql)) {
                FairShareSpec spec = record.spec();
                FairShareCalculationSnapshot snapshot = record.snapshot();
                ps.setInt(1, spec.halfLifeDays());
                ps.setInt(2, spec.lookbackDays());
                ps.setInt(3, spec.decayUnitDays());
                ps.setBigDecimal(4, snapshot.fairShareFactor());
                ps.setString(5, SlotColumns.write(snapshot.totalDecayedUsage()));
                ps.setBigDecimal(6, snapshot.normalizedUsage());
                setDate(ps, 7, snapshot.lookbackStart());
                setDate(ps, 8, snapshot.lookbackEnd());
                setTimestamp(ps, 9, snapshot.lastCalculatedAt());
                setTimestamp(ps, 10, updatedAt(record));
                bindKey(ps, 11, record);
                return ps.executeUpdate();
            }
        });
    }

    @Override
    public void saveWeight(FairShareRecord record) {
        String updateSql = """
                    UPDATE fair_shares
                    SET weight = ?, updated_at = ?
                    WHERE resource_group = ? AND scope_level = ? AND scope_id = ?
                """;

        write(record, "weight", conn -> {
            try (PreparedStatement ps = conn.prepareStatement(updateSql)) {
                setWeight(ps, 1, record.spec().weight());
                setTimestamp(ps, 2, updatedAt(record));
                bindKey(ps, 3, record);
                return ps.executeUpdate();
            }
        });
    }

    /**
     * Run the targeted UPDATE; when no row exists yet, insert the whole record.
     */
    private void write(FairShareRecord record, String what, Transactions.Work<Integer> update) {
        try {
            Transactions.retryingOnConflict(db, "fair share " + record.scope(), conn -> {
                if (update.run(conn) == 0) {
                    insert(conn, record);
                }
                return null;
            });
        } catch (SQLException e) {
            throw new RuntimeException("Failed to save fair share " + what + ": " + record.resourceGroup() + "/"
                    + record.scope(), e);
        }
    }

    private static void insert(Connection conn, FairShareRecord record) throws SQLException {
        String sql = """
                    INSERT INTO fair_shares (resource_group, scope_level, scope_id, domain_name, project_id, user_id,
                        weight, half_life_days, lookback_days, decay_unit_days, resource_weights,
                        fair_share_factor, total_decayed_usage, normalized_usage,
                        lookback_start, lookback_end, last_calculated_at, created_at, updated_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;
        FairShareScope scope = record.scope();
        FairShareSpec spec = record.spec();
        FairShareCalculationSnapshot snapshot = record.snapshot();

        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            bindKey(ps, 1, record);
            ps.setString(4, scope.domainName());
            ps.setString(5, scope.projectId());
            ps.setString(6, scope.userId());
            setWeight(ps, 7, spec.weight());
            ps.setInt(8, spec.halfLifeDays());
            ps.setInt(9, spec.lookbackDays());
            ps.setInt(10, spec.decayUnitDays());
            ps.setString(11, SlotColumns.write(spec.resourceWeights()));
            ps.setBigDecimal(12, snapshot.fairShareFactor());
            ps.setString(13, SlotColumns.write(snapshot.totalDecayedUsage()));
            ps.setBigDecimal(14, snapshot.normalizedUsage());
            setDate(ps, 15, snapshot.lookbackStart());
            setDate(ps, 16, snapshot.lookbackEnd());
            setTimestamp(ps, 17, snapshot.lastCalculatedAt());
            Instant updatedAt = updatedAt(record);
            setTimestamp(ps, 18, record.createdAt() != null ? record.createdAt() : updatedAt);
            setTimestamp(ps, 19, updatedAt);
            ps.executeUpdate();
        }
    }

    private static void bindKey(PreparedStatement ps, int first, FairShareRecord record) throws SQLException {
        ps.setString(first, record.resourceGroup());
        ps.setString(first + 1, record.scope().level().name());
        ps.setString(first + 2, record.scope().scopeId());
    }

    private static Instant updatedAt(FairShareRecord record) {
        return record.updatedAt() != null ? record.updatedAt() : Instant.now();
    }

    @Override
    public Optional<FairShareRecord> find(String resourceGroup, ScopeLevel level, String scopeId) {
        String sql = "SELECT * FROM fair_shares WHERE resource_group = ? AND scope_level = ? AND scope_id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, resourceGroup);
            ps.setString(2, level.name());
            ps.setString(3, scopeId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find fair share: " + resourceGroup + "/" + level + ":" + scopeId, e);
        }
    }

    @Override
    public List<FairShareRecord> findByResourceGroup(String resourceGroup) {
        String sql = "SELECT * FROM fair_shares WHERE resource_group = ? ORDER BY scope_level, scope_id";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, resourceGroup);
            try (ResultSet rs = ps.executeQuery()) {
                return mapRows(rs);
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find fair shares of resource group: " + resourceGroup, e);
        }
    }

    @Override
    public List<FairShareRecord> findByResourceGroupAndLevel(String resourceGroup, ScopeLevel level) {
        String sql = "SELECT * FROM fair_shares WHERE resource_group = ? AND scope_level = ? ORDER BY scope_id";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, resourceGroup);
            ps.setString(2, level.name());
            try (ResultSet rs = ps.executeQuery()) {
                return mapRows(rs);
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find " + level.value() + " fair shares of " + resourceGroup, e);
        }
    }

    @Override
    public boolean delete(String resourceGroup, ScopeLevel level, String scopeId) {
        String sql = "DELETE FROM fair_shares WHERE resource_group = ? AND scope_level = ? AND scope_id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, resourceGroup);
            ps.setString(2, level.name());
            ps.setString(3, scopeId);
            int deleted = ps.executeUpdate();
            conn.commit();
            return deleted > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to delete fair share: " + resourceGroup + "/" + level + ":" + scopeId,
                    e);
        }
    }

    // Helper methods

    private List<FairShareRecord> mapRows(ResultSet rs) throws SQLException {
        List<FairShareRecord> results = new ArrayList<>();
        while (rs.next()) {
            results.add(mapRow(rs));
        }
        return results;
    }

    private FairShareRecord mapRow(ResultSet rs) throws SQLException {
        FairShareSpec spec = new FairShareSpec(
                rs.getBigDecimal("weight"),
                rs.getInt("half_life_days"),
                rs.getInt("lookback_days"),
                rs.getInt("decay_unit_days"),
                SlotColumns.read(rs.getString("resource_weights")));

        FairShareCalculationSnapshot snapshot = new FairShareCalculationSnapshot(
                rs.getBigDecimal("fair_share_factor"),
                SlotColumns.read(rs.getString("total_decayed_usage")),
                rs.getBigDecimal("normalized_usage"),
                toLocalDate(rs.getDate("lookback_start")),
                toLocalDate(rs.getDate("lookback_end")),
                toInstant(rs.getTimestamp("last_calculated_at")));

        return new FairShareRecord(
                rs.getString("resource_group"),
                JdbcUsageBucketRepository.mapScope(rs),
                spec,
                snapshot,
                toInstant(rs.getTimestamp("created_at")),
                toInstant(rs.getTimestamp("updated_at")));
    }

    private static void setDate(PreparedStatement ps, int index, LocalDate date) throws SQLException {
        if (date != null) {
            ps.setDate(index, Date.valueOf(date));
        } else {
            ps.setNull(index, Types.DATE);
        }
    }

    private static void setTimestamp(PreparedStatement ps, int index, Instant instant) throws SQLException {
        if (instant != null) {
            ps.setTimestamp(index, Timestamp.from(instant));
        } else {
            ps.setNull(index, Types.TIMESTAMP);
        }
    }

    private static void setWeight(PreparedStatement ps, int index, BigDecimal weight) throws SQLException {
        if (weight != null) {
            ps.setBigDecimal(index, weight);
        } else {
            ps.setNull(index, Types.DECIMAL);
        }
    }

    private static LocalDate toLocalDate(Date date) {
        return date != null ? date.toLocalDate() : null;
    }

    private static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }
}
