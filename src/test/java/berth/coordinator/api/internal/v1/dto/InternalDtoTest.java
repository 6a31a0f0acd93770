package berth.coordinator.api.internal.v1.dto;

import berth.coordinator.fairshare.KernelUsageRecord;
import berth.coordinator.model.ResourceSlot;
import berth.coordinator.server.RouterHandler;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InternalDtoTest {

    private final ObjectMapper mapper = RouterHandler.mapper();

    @Test
    void heartbeatRequestDeserialization() throws Exception {
        String json = """
                {
                  "agentId": "agent-1",
                  "address": "10.0.0.5:6001",
                  "architecture": "aarch64",
                  "scalingGroup": "gpu",
                  "availableSlots": {"cpu": 16, "mem": 68719476736, "cuda.shares": 2.5}
                }
                """;

        AgentHeartbeatRequest req = mapper.readValue(json, AgentHeartbeatRequest.class);

        assertEquals("agent-1", req.agentId());
        assertEquals("aarch64", req.architecture());
        assertEquals(0, new BigDecimal("2.5").compareTo(req.availableSlots().get("cuda.shares")));
        assertEquals(0, new BigDecimal("68719476736").compareTo(req.availableSlots().get("mem")));

        assertDoesNotThrow(req::validate);
    }

    @Test
    void heartbeatRequestValidation() {
        ResourceSlot slots = ResourceSlot.of("cpu", 4);

        assertThrows(IllegalArgumentException.class,
                () -> new AgentHeartbeatRequest("", null, "x86_64", "default", slots).validate());
        assertThrows(IllegalArgumentException.class,
                () -> new AgentHeartbeatRequest("a", null, null, "default", slots).validate());
        assertThrows(IllegalArgumentException.class,
                () -> new AgentHeartbeatRequest("a", null, "x86_64", "default", ResourceSlot.empty()).validate());
        assertThrows(IllegalArgumentException.class,
                () -> new AgentHeartbeatRequest("a", null, "x86_64", "default", ResourceSlot.of("cpu", -1))
                        .validate());
    }

    @Test
    void drainedAgentMayReportZeroSlots() {
        AgentHeartbeatRequest drained = new AgentHeartbeatRequest("a", null, "x86_64", "default",
                ResourceSlot.of("cpu", 0));
        assertDoesNotThrow(drained::validate);
    }

    @Test
    void usageReportConversion() throws Exception {
        String json = """
                {"records": [{
                  "kernelId": "k1", "sessionId": "s1", "resourceGroup": "default",
                  "domainName": "dom", "projectId": "proj", "userId": "alice",
                  "occupiedSlots": {"cpu": 2},
                  "periodStart": "2024-06-01T00:00:00Z", "periodEnd": "2024-06-01T01:00:00Z"
                }]}
                """;

        UsageReportRequest req = mapper.readValue(json, UsageReportRequest.class);
        req.validate();
        List<KernelUsageRecord> records = req.toRecords();

        assertEquals(1, records.size());
        assertEquals("alice", records.get(0).userId());
        assertEquals(Instant.parse("2024-06-01T01:00:00Z"), records.get(0).periodEnd());
        assertEquals(ResourceSlot.of("cpu", 2), records.get(0).occupiedSlots());
    }

    @Test
    void usageReportValidation() {
        assertThrows(IllegalArgumentException.class, () -> new UsageReportRequest(List.of()).validate());

        UsageReportRequest backwards = new UsageReportRequest(List.of(new UsageReportRequest.Entry(
                "k1", "s1", "default", "dom", "proj", "alice", ResourceSlot.of("cpu", 1),
                Instant.parse("2024-06-01T01:00:00Z"), Instant.parse("2024-06-01T00:00:00Z"))));
        assertThrows(IllegalArgumentException.class, backwards::validate);
    }

    @Test
    void usageReportRejectsNegativeSlots() {
        UsageReportRequest negative = new UsageReportRequest(List.of(new UsageReportRequest.Entry(
                "k1", "s1", "default", "dom", "proj", "alice", ResourceSlot.of("cpu", 2, "mem", -1),
                Instant.parse("2024-06-01T00:00:00Z"), Instant.parse("2024-06-01T01:00:00Z"))));

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, negative::validate);
        assertEquals("occupiedSlots.mem must be non-negative", e.getMessage());

        UsageReportRequest idle = new UsageReportRequest(List.of(new UsageReportRequest.Entry(
                "k1", "s1", "default", "dom", "proj", "alice", ResourceSlot.of("cpu", 0),
                Instant.parse("2024-06-01T00:00:00Z"), Instant.parse("2024-06-01T01:00:00Z"))));
        assertDoesNotThrow(idle::validate);
    }

    @Test
    void operationResponseSerialization() throws Exception {
        String json = mapper.writeValueAsString(OperationResponse.success());
        assertTrue(json.contains("\"ok\":true"));
        assertFalse(json.contains("error"));

        String withCount = mapper.writeValueAsString(OperationResponse.success(3));
        assertTrue(withCount.contains("\"count\":3"));
    }
}
