package berth.coordinator.scheduler;

import berth.coordinator.config.CoordinatorConfig;
import berth.coordinator.model.AgentStatus;
import berth.coordinator.model.ResourceSlot;
import berth.coordinator.service.AgentService;
import berth.coordinator.store.Database;
import berth.coordinator.store.JdbcAgentRepository;
import org.junit.jupiter.api.*;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for reaping agents that stopped sending heartbeats.
 */
class AgentReaperTest {

    private static Database db;
    private static JdbcAgentRepository repo;
    private static AgentService agentService;

    @BeforeAll
    static void setup() {
        // Short timeout for fast tests
        CoordinatorConfig config = CoordinatorConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-reaper;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE")
                .withAgentHeartbeatTimeout(Duration.ofMillis(100));

        db = new Database(config);
        repo = new JdbcAgentRepository(db);
        agentService = new AgentService(repo, config);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void cleanAgents() throws Exception {
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM agents");
            conn.commit();
        }
    }

    @Test
    void freshAgentIsKept() {
        agentService.heartbeat("fresh", null, "x86_64", "default", ResourceSlot.of("cpu", 4));

        assertEquals(0, agentService.reapStaleAgents());
        assertEquals(AgentStatus.ALIVE, repo.findById("fresh").orElseThrow().status());
    }

    @Test
    void silentAgentIsMarkedLost() throws InterruptedException {
        agentService.heartbeat("silent", null, "x86_64", "default", ResourceSlot.of("cpu", 4));

        Thread.sleep(250);

        assertEquals(1, agentService.reapStaleAgents());
        assertEquals(AgentStatus.LOST, repo.findById("silent").orElseThrow().status());
        assertTrue(agentService.findSchedulable("default").isEmpty());
        assertTrue(agentService.clusterCapacity("default").isEmpty());

        // Second pass finds nothing new
        assertEquals(0, agentService.reapStaleAgents());
    }

    @Test
    void heartbeatRevivesLostAgent() throws InterruptedException {
        agentService.heartbeat("flaky", null, "x86_64", "default", ResourceSlot.of("cpu", 4));
        Thread.sleep(250);
        agentService.reapStaleAgents();

        agentService.heartbeat("flaky", null, "x86_64", "default", ResourceSlot.of("cpu", 4));

        assertEquals(AgentStatus.ALIVE, repo.findById("flaky").orElseThrow().status());
        assertEquals(1, agentService.findSchedulable("default").size());
    }

    @Test
    void updaterSurvivesFailures() {
        FairShareUpdater updater = new FairShareUpdater(null);

        // NPE inside the run is logged, not thrown
        assertDoesNotThrow(updater::run);
    }
}
