package berth.coordinator.api.v1.dto;

import berth.coordinator.model.ClusterMode;
import berth.coordinator.model.SessionType;
import berth.coordinator.model.SessionWorkload;
import berth.coordinator.server.RouterHandler;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SessionRequestTest {

    private final ObjectMapper mapper = RouterHandler.mapper();

    @Test
    void parsesFullRequest() throws Exception {
        String json = """
                {
                  "sessionId": "sess-1",
                  "userId": "alice",
                  "projectId": "proj",
                  "domainName": "dom",
                  "priority": 3,
                  "sessionType": "inference",
                  "clusterMode": "multi-node",
                  "endpointId": "ep-1",
                  "createdAt": "2024-06-30T10:00:00Z",
                  "designatedAgentIds": ["agent-1"],
                  "kernels": [
                    {"kernelId": "k1", "image": "img", "requestedSlots": {"cpu": 1}},
                    {"kernelId": "k2", "image": "img", "architecture": "aarch64", "requestedSlots": {"cpu": 2}}
                  ]
                }
                """;

        SessionRequest req = mapper.readValue(json, SessionRequest.class);
        req.validate();
        SessionWorkload workload = req.toWorkload("gpu");

        assertEquals("sess-1", workload.id());
        assertEquals("gpu", workload.scalingGroup());
        assertEquals(3, workload.priority());
        assertEquals(SessionType.INFERENCE, workload.sessionType());
        assertEquals(ClusterMode.MULTI_NODE, workload.clusterMode());
        assertEquals(Instant.parse("2024-06-30T10:00:00Z"), workload.createdAt());
        assertEquals(List.of("agent-1"), workload.designatedAgentIds());
        assertEquals("x86_64", workload.kernels().get(0).architecture());
        assertEquals("aarch64", workload.kernels().get(1).architecture());
    }

    @Test
    void defaultsForOptionalFields() throws Exception {
        SessionRequest req = mapper.readValue("""
                {"sessionId": "s", "kernels": [{"kernelId": "k1"}]}
                """, SessionRequest.class);
        req.validate();
        SessionWorkload workload = req.toWorkload("default");

        assertEquals(SessionType.INTERACTIVE, workload.sessionType());
        assertEquals(ClusterMode.SINGLE_NODE, workload.clusterMode());
        assertEquals("default", workload.domainName());
        assertNotNull(workload.createdAt());
    }

    @Test
    void rejectsInvalidRequests() throws Exception {
        assertThrows(IllegalArgumentException.class,
                () -> mapper.readValue("{\"kernels\": [{\"kernelId\": \"k\"}]}", SessionRequest.class).validate());
        assertThrows(IllegalArgumentException.class,
                () -> mapper.readValue("{\"sessionId\": \"s\"}", SessionRequest.class).validate());
        assertThrows(IllegalArgumentException.class,
                () -> mapper.readValue("{\"sessionId\": \"s\", \"clusterMode\": \"sideways\","
                        + " \"kernels\": [{\"kernelId\": \"k\"}]}", SessionRequest.class).validate());
        assertThrows(IllegalArgumentException.class,
                () -> mapper.readValue("{\"sessionId\": \"s\","
                        + " \"kernels\": [{\"kernelId\": \"k\", \"requestedSlots\": {\"cpu\": -1}}]}",
                        SessionRequest.class).validate());
    }
}
