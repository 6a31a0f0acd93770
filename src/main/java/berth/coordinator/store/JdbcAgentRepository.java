package berth.coordinator.store;

import berth.coordinator.model.AgentInfo;
import berth.coordinator.model.AgentStatus;
import berth.coordinator.model.ResourceSlot;
import berth.coordinator.repository.AgentRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * JDBC implementation of AgentRepository.
 */
public class JdbcAgentRepository implements AgentRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcAgentRepository.class);

    private final Database db;

    public JdbcAgentRepository(Database db) {
        this.db = db;
    }

    @Override
    public void heartbeat(String agentId, String address, String architecture, String scalingGroup,
            ResourceSlot availableSlots) {
        // UPDATE + INSERT keeps occupancy columns of a known agent
        String updateSql = """
                    UPDATE agents
                    SET address = ?, architecture = ?, scaling_group = ?, available_slots = ?,
                        status = 'ALIVE', last_heartbeat = ?
                    WHERE id = ?
                """;

        String insertSql = """
                    INSERT INTO agents (id, address, architecture, scaling_group, available_slots,
                                        occupied_slots, container_count, status, last_heartbeat, registered_at)
                    VALUES (?, ?, ?, ?, ?, '{}', 0, 'ALIVE', ?, ?)
                """;

        Timestamp now = Timestamp.from(Instant.now());
        String slotsJson = SlotColumns.write(availableSlots);
        try {
            boolean registered = Transactions.retryingOnConflict(db, "agent " + agentId, conn -> {
                int updated;
                try (PreparedStatement ps = conn.prepareStatement(updateSql)) {
                    ps.setString(1, address);
                    ps.setString(2, architecture);
                    ps.setString(3, scalingGroup);
                    ps.setString(4, slotsJson);
                    ps.setTimestamp(5, now);
                    ps.setString(6, agentId);
                    updated = ps.executeUpdate();
                }
                if (updated > 0) {
                    return false;
                }
                try (PreparedStatement ps = conn.prepareStatement(insertSql)) {
                    ps.setString(1, agentId);
                    ps.setString(2, address);
                    ps.setString(3, architecture);
                    ps.setString(4, scalingGroup);
                    ps.setString(5, slotsJson);
                    ps.setTimestamp(6, now);
                    ps.setTimestamp(7, now);
                    ps.executeUpdate();
                }
                return true;
            });
            if (registered) {
                log.info("Registered agent {} in scaling group {} ({})", agentId, scalingGroup, architecture);
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to record heartbeat for agent: " + agentId, e);
        }
    }

    @Override
    public Optional<AgentInfo> findById(String agentId) {
        String sql = "SELECT * FROM agents WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, agentId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find agent: " + agentId, e);
        }
    }

    @Override
    public List<AgentInfo> findAll() {
        String sql = "SELECT * FROM agents ORDER BY id";

        try (Connection conn = db.getConnection();
                Statement st = conn.createStatement();
                ResultSet rs = st.executeQuery(sql)) {

            return mapRows(rs);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find all agents", e);
        }
    }

    @Override
    public List<AgentInfo> findByScalingGroup(String scalingGroup, AgentStatus status) {
        String sql = "SELECT * FROM agents WHERE scaling_group = ? AND status = ? ORDER BY id";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, scalingGroup);
            ps.setString(2, status.name());
            try (ResultSet rs = ps.executeQuery()) {
                return mapRows(rs);
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find agents of scaling group: " + scalingGroup, e);
        }
    }

    /**
     * Write occupied slots and container counts of the given agents on the caller's connection.
     */
    static void writeOccupancy(Connection conn, Collection<AgentInfo> agents) throws SQLException {
        if (agents.isEmpty()) {
            return;
        }
        String sql = "UPDATE agents SET occupied_slots = ?, container_count = ? WHERE id = ?";

        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            for (AgentInfo agent : agents) {
                ps.setString(1, SlotColumns.write(agent.occupiedSlots()));
                ps.setInt(2, agent.containerCount());
                ps.setString(3, agent.id());
                ps.addBatch();
            }
            ps.executeBatch();
        }
    }

    @Override
    public List<String> markStaleAsLost(Instant lastHeartbeatBefore) {
        String selectSql = "SELECT id FROM agents WHERE last_heartbeat < ? AND status = 'ALIVE'";
        String updateSql = "UPDATE agents SET status = 'LOST' WHERE last_heartbeat < ? AND status = 'ALIVE'";

        List<String> staleIds = new ArrayList<>();

        try (Connection conn = db.getConnection()) {
            try (PreparedStatement ps = conn.prepareStatement(selectSql)) {
                ps.setTimestamp(1, Timestamp.from(lastHeartbeatBefore));
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        staleIds.add(rs.getString("id"));
                    }
                }
            }

            if (!staleIds.isEmpty()) {
                try (PreparedStatement ps = conn.prepareStatement(updateSql)) {
                    ps.setTimestamp(1, Timestamp.from(lastHeartbeatBefore));
                    ps.executeUpdate();
                }
                conn.commit();

                log.info("Marked {} agents as LOST", staleIds.size());
            }

            return staleIds;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to mark stale agents as lost", e);
        }
    }

    @Override
    public boolean delete(String agentId) {
        String sql = "DELETE FROM agents WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, agentId);
            int deleted = ps.executeUpdate();
            conn.commit();
            return deleted > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to delete agent: " + agentId, e);
        }
    }

    // Helper methods

    private List<AgentInfo> mapRows(ResultSet rs) throws SQLException {
        List<AgentInfo> results = new ArrayList<>();
        while (rs.next()) {
            results.add(mapRow(rs));
        }
        return results;
    }

    private AgentInfo mapRow(ResultSet rs) throws SQLException {
        return AgentInfo.builder()
                .id(rs.getString("id"))
                .address(rs.getString("address"))
                .architecture(rs.getString("architecture"))
                .scalingGroup(rs.getString("scaling_group"))
                .availableSlots(SlotColumns.read(rs.getString("available_slots")))
                .occupiedSlots(SlotColumns.read(rs.getString("occupied_slots")))
                .containerCount(rs.getInt("container_count"))
                .status(AgentStatus.valueOf(rs.getString("status")))
                .lastHeartbeat(toInstant(rs.getTimestamp("last_heartbeat")))
                .build();
    }

    private static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }
}
