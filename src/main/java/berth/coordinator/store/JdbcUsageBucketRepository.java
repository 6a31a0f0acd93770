package berth.coordinator.store;

import berth.coordinator.fairshare.FairShareScope;
import berth.coordinator.fairshare.ScopeLevel;
import berth.coordinator.fairshare.UsageBucket;
import berth.coordinator.model.ResourceSlot;
import berth.coordinator.repository.UsageBucketRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * JDBC implementation of UsageBucketRepository.
 */
public class JdbcUsageBucketRepository implements UsageBucketRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcUsageBucketRepository.class);

    private final Database db;

    public JdbcUsageBucketRepository(Database db) {
        this.db = db;
    }

    @Override
    public void addUsage(List<UsageBucket> buckets) {
        if (buckets.isEmpty()) {
            return;
        }
        String selectSql = """
                    SELECT resource_usage FROM usage_buckets
                    WHERE resource_group = ? AND scope_level = ? AND scope_id = ? AND bucket_date = ?
                    FOR UPDATE
                """;
        String updateSql = """
                    UPDATE usage_buckets SET resource_usage = ?
                    WHERE resource_group = ? AND scope_level = ? AND scope_id = ? AND bucket_date = ?
                """;
        String insertSql = """
                    INSERT INTO usage_buckets (resource_group, scope_level, scope_id, domain_name, project_id,
                                               user_id, bucket_date, resource_usage)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?)
                """;

        // a bucket missing from the SELECT is not locked; a racing insert fails and the whole batch retries
        try {
            Transactions.retryingOnConflict(db, "usage buckets", conn -> {
                try (PreparedStatement select = conn.prepareStatement(selectSql);
                        PreparedStatement update = conn.prepareStatement(updateSql);
                        PreparedStatement insert = conn.prepareStatement(insertSql)) {
                    for (UsageBucket bucket : buckets) {
                        addOne(select, update, insert, bucket);
                    }
                }
                return null;
            });
            log.debug("Added usage to {} buckets", buckets.size());
        } catch (SQLException e) {
            throw new RuntimeException("Failed to add usage to " + buckets.size() + " buckets", e);
        }
    }

    private static void addOne(PreparedStatement select, PreparedStatement update, PreparedStatement insert,
            UsageBucket bucket) throws SQLException {
        FairShareScope scope = bucket.scope();
        ResourceSlot existing = null;

        select.setString(1, bucket.resourceGroup());
        select.setString(2, scope.level().name());
        select.setString(3, scope.scopeId());
        select.setDate(4, Date.valueOf(bucket.date()));
        try (ResultSet rs = select.executeQuery()) {
            if (rs.next()) {
                existing = SlotColumns.read(rs.getString("resource_usage"));
            }
        }

        if (existing != null) {
            update.setString(1, SlotColumns.write(existing.add(bucket.resourceUsage())));
            update.setString(2, bucket.resourceGroup());
            update.setString(3, scope.level().name());
            update.setString(4, scope.scopeId());
            update.setDate(5, Date.valueOf(bucket.date()));
            update.executeUpdate();
        } else {
            insert.setString(1, bucket.resourceGroup());
            insert.setString(2, scope.level().name());
            insert.setString(3, scope.scopeId());
            insert.setString(4, scope.domainName());
            insert.setString(5, scope.projectId());
            insert.setString(6, scope.userId());
            insert.setDate(7, Date.valueOf(bucket.date()));
            insert.setString(8, SlotColumns.write(bucket.resourceUsage()));
            insert.executeUpdate();
        }
    }

    @Override
    public List<UsageBucket> findByResourceGroup(String resourceGroup, LocalDate from, LocalDate to) {
        String sql = """
                    SELECT * FROM usage_buckets
                    WHERE resource_group = ? AND bucket_date >= ? AND bucket_date <= ?
                    ORDER BY scope_level, scope_id, bucket_date
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, resourceGroup);
            ps.setDate(2, Date.valueOf(from));
            ps.setDate(3, Date.valueOf(to));
            try (ResultSet rs = ps.executeQuery()) {
                return mapRows(rs);
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find usage buckets of resource group: " + resourceGroup, e);
        }
    }

    @Override
    public List<UsageBucket> findByScope(String resourceGroup, FairShareScope scope, LocalDate from, LocalDate to) {
        String sql = """
                    SELECT * FROM usage_buckets
                    WHERE resource_group = ? AND scope_level = ? AND scope_id = ?
                      AND bucket_date >= ? AND bucket_date <= ?
                    ORDER BY bucket_date
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, resourceGroup);
            ps.setString(2, scope.level().name());
            ps.setString(3, scope.scopeId());
            ps.setDate(4, Date.valueOf(from));
            ps.setDate(5, Date.valueOf(to));
            try (ResultSet rs = ps.executeQuery()) {
                return mapRows(rs);
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find usage buckets of scope: " + scope, e);
        }
    }

    @Override
    public int deleteBefore(LocalDate date) {
        String sql = "DELETE FROM usage_buckets WHERE bucket_date < ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setDate(1, Date.valueOf(date));
            int deleted = ps.executeUpdate();
            conn.commit();
            return deleted;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to delete usage buckets before " + date, e);
        }
    }

    // Helper methods

    private List<UsageBucket> mapRows(ResultSet rs) throws SQLException {
        List<UsageBucket> results = new ArrayList<>();
        while (rs.next()) {
            results.add(new UsageBucket(
                    rs.getString("resource_group"),
                    mapScope(rs),
                    rs.getDate("bucket_date").toLocalDate(),
                    SlotColumns.read(rs.getString("resource_usage"))));
        }
        return results;
    }

    static FairShareScope mapScope(ResultSet rs) throws SQLException {
        return new FairShareScope(
                ScopeLevel.valueOf(rs.getString("scope_level")),
                rs.getString("scope_id"),
                rs.getString("domain_name"),
                rs.getString("project_id"),
                rs.getString("user_id"));
    }
}
