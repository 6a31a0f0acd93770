package berth.coordinator.store;

import berth.coordinator.model.AgentInfo;
import berth.coordinator.model.KernelAllocation;
import berth.coordinator.model.ResourceSlot;
import berth.coordinator.repository.KernelAllocationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JDBC implementation of KernelAllocationRepository.
 */
public class JdbcKernelAllocationRepository implements KernelAllocationRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcKernelAllocationRepository.class);

    private final Database db;

    public JdbcKernelAllocationRepository(Database db) {
        this.db = db;
    }

    @Override
    public void savePlacement(Collection<AgentInfo> agents, List<KernelAllocation> allocations) {
        if (agents.isEmpty() && allocations.isEmpty()) {
            return;
        }
        String sql = """
                    MERGE INTO kernel_allocations (kernel_id, session_id, agent_id, scaling_group, endpoint_id,
                                                   slots, allocated_at)
                    KEY (kernel_id)
                    VALUES (?, ?, ?, ?, ?, ?, ?)
                """;

        try {
            Transactions.inTransaction(db, conn -> {
                JdbcAgentRepository.writeOccupancy(conn, agents);
                try (PreparedStatement ps = conn.prepareStatement(sql)) {
                    for (KernelAllocation allocation : allocations) {
                        ps.setString(1, allocation.kernelId());
                        ps.setString(2, allocation.sessionId());
                        ps.setString(3, allocation.agentId());
                        ps.setString(4, allocation.scalingGroup());
                        ps.setString(5, allocation.endpointId());
                        ps.setString(6, SlotColumns.write(allocation.slots()));
                        Instant at = allocation.allocatedAt() != null ? allocation.allocatedAt() : Instant.now();
                        ps.setTimestamp(7, Timestamp.from(at));
                        ps.addBatch();
                    }
                    ps.executeBatch();
                }
                return null;
            });
        } catch (SQLException e) {
            throw new RuntimeException("Failed to save placement of " + allocations.size() + " kernels", e);
        }
    }

    @Override
    public List<KernelAllocation> findBySession(String sessionId) {
        String sql = "SELECT * FROM kernel_allocations WHERE session_id = ? ORDER BY kernel_id";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, sessionId);
            try (ResultSet rs = ps.executeQuery()) {
                return mapRows(rs);
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find kernel allocations of session: " + sessionId, e);
        }
    }

    @Override
    public Map<String, Integer> countByAgentForEndpoint(String endpointId) {
        String sql = """
                    SELECT agent_id, COUNT(*) AS kernels FROM kernel_allocations
                    WHERE endpoint_id = ?
                    GROUP BY agent_id
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, endpointId);
            try (ResultSet rs = ps.executeQuery()) {
                Map<String, Integer> counts = new HashMap<>();
                while (rs.next()) {
                    counts.put(rs.getString("agent_id"), rs.getInt("kernels"));
                }
                return counts;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count kernels of endpoint: " + endpointId, e);
        }
    }

    @Override
    public List<KernelAllocation> releaseSession(String sessionId) {
        String selectSql = "SELECT * FROM kernel_allocations WHERE session_id = ? ORDER BY kernel_id";
        String deleteSql = "DELETE FROM kernel_allocations WHERE kernel_id = ? AND session_id = ?";
        String agentSql = "SELECT occupied_slots, container_count FROM agents WHERE id = ? FOR UPDATE";
        String updateSql = "UPDATE agents SET occupied_slots = ?, container_count = ? WHERE id = ?";

        try {
            return Transactions.retryingOnConflict(db, "session " + sessionId, conn -> {
                List<KernelAllocation> candidates;
                try (PreparedStatement ps = conn.prepareStatement(selectSql)) {
                    ps.setString(1, sessionId);
                    try (ResultSet rs = ps.executeQuery()) {
                        candidates = mapRows(rs);
                    }
                }

                // only rows this transaction deleted are subtracted; a concurrent release gets the rest
                List<KernelAllocation> released = new ArrayList<>();
                try (PreparedStatement ps = conn.prepareStatement(deleteSql)) {
                    for (KernelAllocation allocation : candidates) {
                        ps.setString(1, allocation.kernelId());
                        ps.setString(2, sessionId);
                        if (ps.executeUpdate() == 1) {
                            released.add(allocation);
                        }
                    }
                }

                Map<String, List<KernelAllocation>> byAgent = new LinkedHashMap<>();
                for (KernelAllocation allocation : released) {
                    byAgent.computeIfAbsent(allocation.agentId(), k -> new ArrayList<>()).add(allocation);
                }
                try (PreparedStatement select = conn.prepareStatement(agentSql);
                        PreparedStatement update = conn.prepareStatement(updateSql)) {
                    for (Map.Entry<String, List<KernelAllocation>> entry : byAgent.entrySet()) {
                        select.setString(1, entry.getKey());
                        ResourceSlot occupied;
                        int containers;
                        try (ResultSet rs = select.executeQuery()) {
                            if (!rs.next()) {
                                log.debug("Agent {} of session {} no longer exists", entry.getKey(), sessionId);
                                continue;
                            }
                            occupied = SlotColumns.read(rs.getString("occupied_slots"));
                            containers = rs.getInt("container_count");
                        }
                        for (KernelAllocation allocation : entry.getValue()) {
                            occupied = occupied.subtract(allocation.slots());
                        }
                        update.setString(1, SlotColumns.write(occupied));
                        update.setInt(2, Math.max(0, containers - entry.getValue().size()));
                        update.setString(3, entry.getKey());
                        update.executeUpdate();
                    }
                }
                return released;
            });
        } catch (SQLException e) {
            throw new RuntimeException("Failed to release kernel allocations of session: " + sessionId, e);
        }
    }

    // Helper methods

    private static List<KernelAllocation> mapRows(ResultSet rs) throws SQLException {
        List<KernelAllocation> results = new ArrayList<>();
        while (rs.next()) {
            Timestamp at = rs.getTimestamp("allocated_at");
            results.add(new KernelAllocation(
                    rs.getString("kernel_id"),
                    rs.getString("session_id"),
                    rs.getString("agent_id"),
                    rs.getString("scaling_group"),
                    rs.getString("endpoint_id"),
                    SlotColumns.read(rs.getString("slots")),
                    at != null ? at.toInstant() : null));
        }
        return results;
    }
}
