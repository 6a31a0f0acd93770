package berth.coordinator.integration;

import berth.coordinator.config.CoordinatorConfig;
import berth.coordinator.config.Dependencies;
import berth.coordinator.server.CoordinatorNettyServer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.*;

import java.math.BigDecimal;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration test that hits the HTTP endpoints through the Netty server.
 */
class HttpEndpointIntegrationTest {

        private static final ObjectMapper MAPPER = new ObjectMapper();
        private static final String AGENT_KEY = "test-key";

        private Dependencies deps;
        private CoordinatorNettyServer server;
        private HttpClient httpClient;
        private String baseUrl;

        @BeforeEach
        void setUp() {
                CoordinatorConfig config = CoordinatorConfig.defaults()
                                .withDatabaseUrl("jdbc:h2:mem:test-http-" + System.nanoTime()
                                                + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE")
                                .withServerPort(0)
                                .withAgentKey(AGENT_KEY);

                deps = Dependencies.create(config);
                server = new CoordinatorNettyServer(deps);
                server.start();
                baseUrl = "http://localhost:" + server.port();

                httpClient = HttpClient.newBuilder()
                                .connectTimeout(Duration.ofSeconds(5))
                                .build();
        }

        @AfterEach
        void tearDown() {
                server.stop();
                deps.close();
        }

        @Test
        @DisplayName("Heartbeat, place, inspect and release a session")
        void placementFlow() throws Exception {
                heartbeat("agent-a", 8);
                heartbeat("agent-b", 4);

                HttpResponse<String> placed = post("/api/v1/scaling-groups/default/sessions", """
                                {
                                    "sessionId": "sess-1",
                                    "userId": "alice",
                                    "projectId": "proj",
                                    "domainName": "dom",
                                    "kernels": [
                                        {"kernelId": "k1", "image": "python:3", "requestedSlots": {"cpu": 2, "mem": 1024}}
                                    ]
                                }
                                """, false);

                assertEquals(201, placed.statusCode(), "Placement should return 201. Body: " + placed.body());
                JsonNode placement = MAPPER.readTree(placed.body());
                assertEquals("sess-1", placement.get("sessionId").asText());
                assertEquals(1, placement.get("selections").size());
                String agentId = placement.get("selections").get(0).get("agentId").asText();
                assertEquals("agent-b", agentId, "concentrated strategy packs the smaller agent first");

                JsonNode agent = MAPPER.readTree(get("/api/v1/agents/" + agentId).body());
                assertEquals(2, agent.get("occupiedSlots").get("cpu").asInt());
                assertEquals(1, agent.get("containerCount").asInt());

                JsonNode agents = MAPPER.readTree(get("/api/v1/agents?scalingGroup=default").body());
                assertEquals(2, agents.get("agents").size());

                HttpResponse<String> released = delete("/api/v1/sessions/sess-1");
                assertEquals(200, released.statusCode());
                assertEquals(1, MAPPER.readTree(released.body()).get("releasedKernels").asInt());

                agent = MAPPER.readTree(get("/api/v1/agents/" + agentId).body());
                assertEquals(0, agent.get("containerCount").asInt());
                assertEquals(404, delete("/api/v1/sessions/sess-1").statusCode());
        }

        @Test
        @DisplayName("Placement failures map to 409, 404 and 422")
        void placementErrors() throws Exception {
                heartbeat("agent-a", 2);

                HttpResponse<String> tooBig = post("/api/v1/scaling-groups/default/sessions", """
                                {"sessionId": "big", "kernels": [{"kernelId": "k1", "requestedSlots": {"cpu": 16}}]}
                                """, false);
                assertEquals(409, tooBig.statusCode());
                JsonNode error = MAPPER.readTree(tooBig.body());
                assertTrue(error.get("retriable").asBoolean());
                assertTrue(error.get("error").asText().contains("agent-a"));

                HttpResponse<String> pinned = post("/api/v1/scaling-groups/default/sessions", """
                                {"sessionId": "pinned", "designatedAgentIds": ["ghost"],
                                 "kernels": [{"kernelId": "k1", "requestedSlots": {"cpu": 1}}]}
                                """, false);
                assertEquals(404, pinned.statusCode());

                HttpResponse<String> mixed = post("/api/v1/scaling-groups/default/sessions", """
                                {"sessionId": "mixed", "kernels": [
                                    {"kernelId": "k1", "architecture": "x86_64", "requestedSlots": {"cpu": 1}},
                                    {"kernelId": "k2", "architecture": "aarch64", "requestedSlots": {"cpu": 1}}
                                ]}
                                """, false);
                assertEquals(422, mixed.statusCode());
                assertFalse(MAPPER.readTree(mixed.body()).get("retriable").asBoolean());

                JsonNode agent = MAPPER.readTree(get("/api/v1/agents/agent-a").body());
                assertEquals(0, agent.get("containerCount").asInt());
        }

        @Test
        void invalidRequestsReturn400() throws Exception {
                assertEquals(400, post("/api/v1/scaling-groups/default/sessions", "{not json", false).statusCode());
                assertEquals(400, post("/api/v1/scaling-groups/default/sessions",
                                "{\"sessionId\": \"s\", \"kernels\": []}", false).statusCode());
                assertEquals(400, post("/api/v1/scaling-groups/default/sessions", """
                                {"sessionId": "s", "sessionType": "weird", "kernels": [{"kernelId": "k1"}]}
                                """, false).statusCode());
                assertEquals(404, get("/api/v1/nothing-here").statusCode());
        }

        @Test
        void pendingTickReportsPlacedAndFailed() throws Exception {
                heartbeat("agent-a", 4);

                HttpResponse<String> response = post("/api/v1/scaling-groups/default/pending", """
                                {"sessions": [
                                    {"sessionId": "low", "priority": 1, "kernels": [{"kernelId": "l1", "requestedSlots": {"cpu": 3}}]},
                                    {"sessionId": "high", "priority": 5, "kernels": [{"kernelId": "h1", "requestedSlots": {"cpu": 3}}]}
                                ]}
                                """, false);

                assertEquals(200, response.statusCode(), "Body: " + response.body());
                JsonNode tick = MAPPER.readTree(response.body());
                assertEquals(1, tick.get("placed").size());
                assertEquals("high", tick.get("placed").get(0).get("sessionId").asText());
                assertEquals(1, tick.get("failed").size());
                assertEquals("low", tick.get("failed").get(0).get("sessionId").asText());
                assertTrue(tick.get("failed").get(0).get("retriable").asBoolean());
        }

        @Test
        @DisplayName("Usage reports feed fair share factors and ranks")
        void fairShareFlow() throws Exception {
                heartbeat("agent-a", 4);
                Instant end = Instant.now();
                Instant start = end.minusSeconds(3600);

                HttpResponse<String> usage = post("/internal/v1/usage", String.format("""
                                {"records": [
                                    {"kernelId": "k1", "sessionId": "s1", "resourceGroup": "default", "domainName": "dom",
                                     "projectId": "proj", "userId": "alice", "occupiedSlots": {"cpu": 4},
                                     "periodStart": "%s", "periodEnd": "%s"}
                                ]}
                                """, start, end), true);
                assertEquals(200, usage.statusCode(), "Body: " + usage.body());

                HttpResponse<String> weight = put("/api/v1/fair-shares/default/user/bob@proj/weight",
                                "{\"weight\": 2, \"domainName\": \"dom\"}");
                assertEquals(200, weight.statusCode(), "Body: " + weight.body());

                JsonNode recalculated = MAPPER.readTree(post("/api/v1/fair-shares/default/recalculate", "", false).body());
                assertEquals(2, recalculated.get("users").asInt());

                JsonNode alice = MAPPER.readTree(get("/api/v1/fair-shares/default/user/alice@proj").body());
                assertTrue(alice.get("fairShareFactor").decimalValue().compareTo(BigDecimal.ONE) < 0);

                JsonNode ranks = MAPPER.readTree(get("/api/v1/fair-shares/default/ranks").body()).get("ranks");
                assertEquals(2, ranks.size());
                assertEquals("bob", ranks.get(0).get("userId").asText());
                assertEquals(1, ranks.get(0).get("rank").asInt());

                JsonNode history = MAPPER.readTree(get("/api/v1/fair-shares/default/user/alice@proj/usage?domainName=dom")
                                .body());
                assertFalse(history.get("usage").isEmpty());

                assertEquals(2, MAPPER.readTree(get("/api/v1/fair-shares/default?level=user").body())
                                .get("fairShares").size());
                assertEquals(200, delete("/api/v1/fair-shares/default/user/bob@proj").statusCode());
                assertEquals(404, get("/api/v1/fair-shares/default/user/bob@proj").statusCode());
        }

        @Test
        void scalingGroupSettingsRoundTrip() throws Exception {
                HttpResponse<String> saved = put("/api/v1/scaling-groups/gpu", """
                                {"selectionStrategy": "dispersed", "maxContainerCount": 4, "halfLifeDays": 3}
                                """);
                assertEquals(200, saved.statusCode(), "Body: " + saved.body());

                JsonNode group = MAPPER.readTree(get("/api/v1/scaling-groups/gpu").body());
                assertEquals("DISPERSED", group.get("selectionStrategy").asText());
                assertEquals(4, group.get("maxContainerCount").asInt());
                assertEquals(3, group.get("halfLifeDays").asInt());
        }

        @Test
        void internalEndpointsRequireAgentKey() throws Exception {
                HttpResponse<String> response = post("/internal/v1/agents/heartbeat", """
                                {"agentId": "sneaky", "availableSlots": {"cpu": 4}}
                                """, false);

                assertEquals(403, response.statusCode());
                assertEquals(404, get("/api/v1/agents/sneaky").statusCode());
        }

        @Test
        void healthReportsAgents() throws Exception {
                heartbeat("agent-a", 4);

                HttpResponse<String> response = get("/api/v1/health");

                assertEquals(200, response.statusCode());
                JsonNode health = MAPPER.readTree(response.body());
                assertEquals(1, health.get("aliveAgents").asInt());
        }

        private void heartbeat(String agentId, int cpu) throws Exception {
                HttpResponse<String> response = post("/internal/v1/agents/heartbeat", String.format("""
                                {
                                    "agentId": "%s",
                                    "architecture": "x86_64",
                                    "scalingGroup": "default",
                                    "availableSlots": {"cpu": %d, "mem": 65536}
                                }
                                """, agentId, cpu), true);
                assertEquals(200, response.statusCode(), "Heartbeat should succeed. Body: " + response.body());
        }

        private HttpResponse<String> get(String path) throws Exception {
                return httpClient.send(HttpRequest.newBuilder().uri(URI.create(baseUrl + path)).GET().build(),
                                HttpResponse.BodyHandlers.ofString());
        }

        private HttpResponse<String> delete(String path) throws Exception {
                return httpClient.send(HttpRequest.newBuilder().uri(URI.create(baseUrl + path)).DELETE().build(),
                                HttpResponse.BodyHandlers.ofString());
        }

        private HttpResponse<String> put(String path, String body) throws Exception {
                return httpClient.send(HttpRequest.newBuilder()
                                .uri(URI.create(baseUrl + path))
                                .header("Content-Type", "application/json")
                                .PUT(HttpRequest.BodyPublishers.ofString(body))
                                .build(), HttpResponse.BodyHandlers.ofString());
        }

        private HttpResponse<String> post(String path, String body, boolean withKey) throws Exception {
                HttpRequest.Builder builder = HttpRequest.newBuilder()
                                .uri(URI.create(baseUrl + path))
                                .header("Content-Type", "application/json")
                                .POST(HttpRequest.BodyPublishers.ofString(body));
                if (withKey) {
                        builder.header("X-Berth-Key", AGENT_KEY);
                }
                return httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        }
}
