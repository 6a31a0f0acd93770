package berth.coordinator.store;

import berth.coordinator.config.CoordinatorConfig;
import berth.coordinator.fairshare.FairShareCalculationSnapshot;
import berth.coordinator.fairshare.FairShareRecord;
import berth.coordinator.fairshare.FairShareScope;
import berth.coordinator.fairshare.FairShareSpec;
import berth.coordinator.fairshare.ScopeLevel;
import berth.coordinator.model.ResourceSlot;
import berth.coordinator.model.ScalingGroupOptions;
import org.junit.jupiter.api.*;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class JdbcFairShareRepositoryTest {

    private static final LocalDate TODAY = LocalDate.of(2024, 6, 30);

    private static Database db;
    private static JdbcFairShareRepository repo;

    @BeforeAll
    static void setup() {
        CoordinatorConfig config = CoordinatorConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-fairshare;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE");
        db = new Database(config);
        repo = new JdbcFairShareRepository(db);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void cleanRows() throws Exception {
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM fair_shares");
            conn.commit();
        }
    }

    private static FairShareRecord record(FairShareScope scope, BigDecimal weight, Instant createdAt) {
        return new FairShareRecord("default", scope,
                FairShareSpec.inherit(ScalingGroupOptions.defaults("default")).withWeight(weight),
                FairShareCalculationSnapshot.initial(TODAY, 28),
                createdAt, createdAt);
    }

    @Test
    void insertAndFindUserScope() {
        FairShareScope user = FairShareScope.user("dom", "proj", "alice");
        repo.saveWeight(record(user, null, Instant.parse("2024-06-01T00:00:00Z")));

        FairShareRecord found = repo.find("default", ScopeLevel.USER, "alice@proj").orElseThrow();

        assertEquals(user, found.scope());
        assertEquals("alice", found.scope().userId());
        assertTrue(found.spec().usesDefaultWeight());
        assertEquals(28, found.spec().lookbackDays());
        assertEquals(0, BigDecimal.ONE.compareTo(found.snapshot().fairShareFactor()));
        assertEquals(TODAY.minusDays(28), found.snapshot().lookbackStart());
        assertNull(found.snapshot().lastCalculatedAt());
        assertEquals(Instant.parse("2024-06-01T00:00:00Z"), found.updatedAt());
    }

    @Test
    void calculationKeepsWeightAndCreationTime() {
        FairShareScope project = FairShareScope.project("dom", "proj");
        Instant created = Instant.parse("2024-06-01T00:00:00Z");
        repo.saveWeight(record(project, new BigDecimal("2.5"), created));

        Instant calculatedAt = Instant.parse("2024-06-30T12:00:00Z");
        FairShareRecord calculated = record(project, null, calculatedAt)
                .withSnapshot(new FairShareCalculationSnapshot(new BigDecimal("0.250000"),
                        ResourceSlot.of("cpu", 1234), new BigDecimal("0.125"), TODAY.minusDays(28), TODAY,
                        calculatedAt));
        repo.saveCalculation(calculated);

        FairShareRecord found = repo.find("default", ScopeLevel.PROJECT, "proj").orElseThrow();
        assertEquals(created, found.createdAt());
        assertEquals(calculatedAt, found.updatedAt());
        assertEquals(0, new BigDecimal("2.5").compareTo(found.spec().weight()));
        assertEquals(0, new BigDecimal("0.25").compareTo(found.snapshot().fairShareFactor()));
        assertEquals(0, new BigDecimal("0.125").compareTo(found.snapshot().normalizedUsage()));
        assertEquals(ResourceSlot.of("cpu", 1234), found.snapshot().totalDecayedUsage());
        assertEquals(calculatedAt, found.snapshot().lastCalculatedAt());
    }

    @Test
    void weightKeepsCalculation() {
        FairShareScope user = FairShareScope.user("dom", "proj", "bob");
        Instant calculatedAt = Instant.parse("2024-06-30T12:00:00Z");
        repo.saveCalculation(record(user, null, calculatedAt)
                .withSnapshot(new FairShareCalculationSnapshot(new BigDecimal("0.5"), ResourceSlot.of("cpu", 10),
                        BigDecimal.ONE, TODAY.minusDays(28), TODAY, calculatedAt)));

        repo.saveWeight(record(user, new BigDecimal("3"), calculatedAt.plusSeconds(60)));

        FairShareRecord found = repo.find("default", ScopeLevel.USER, "bob@proj").orElseThrow();
        assertEquals(0, new BigDecimal("3").compareTo(found.spec().weight()));
        assertEquals(0, new BigDecimal("0.5").compareTo(found.snapshot().fairShareFactor()));
        assertEquals(calculatedAt, found.snapshot().lastCalculatedAt());
        assertEquals(calculatedAt, found.createdAt());
    }

    @Test
    @DisplayName("Concurrent writers of a new scope all succeed and leave one row")
    void concurrentWritersOfNewScope() throws Exception {
        int writers = 8;
        for (int round = 0; round < 20; round++) {
            FairShareScope user = FairShareScope.user("dom", "proj", "u" + round);
            CyclicBarrier start = new CyclicBarrier(writers);
            ExecutorService pool = Executors.newFixedThreadPool(writers);
            try {
                List<Future<?>> futures = new ArrayList<>();
                for (int i = 0; i < writers; i++) {
                    boolean weightWriter = i % 2 == 0;
                    futures.add(pool.submit(() -> {
                        start.await();
                        if (weightWriter) {
                            repo.saveWeight(record(user, new BigDecimal("2"), Instant.now()));
                        } else {
                            repo.saveCalculation(record(user, null, Instant.now()));
                        }
                        return null;
                    }));
                }
                for (Future<?> future : futures) {
                    future.get(30, TimeUnit.SECONDS);
                }
            } finally {
                pool.shutdownNow();
            }

            FairShareRecord found = repo.find("default", ScopeLevel.USER, user.scopeId()).orElseThrow();
            assertEquals(0, new BigDecimal("2").compareTo(found.spec().weight()), "weight lost in round " + round);
        }
        assertEquals(20, repo.findByResourceGroupAndLevel("default", ScopeLevel.USER).size());
    }

    @Test
    void listByLevelAndDelete() {
        repo.saveWeight(record(FairShareScope.domain("dom"), null, Instant.now()));
        repo.saveWeight(record(FairShareScope.project("dom", "p1"), null, Instant.now()));
        repo.saveWeight(record(FairShareScope.user("dom", "p1", "u1"), null, Instant.now()));
        repo.saveWeight(record(FairShareScope.user("dom", "p1", "u2"), null, Instant.now()));

        assertEquals(4, repo.findByResourceGroup("default").size());
        assertEquals(2, repo.findByResourceGroupAndLevel("default", ScopeLevel.USER).size());
        assertTrue(repo.findByResourceGroup("other").isEmpty());

        assertTrue(repo.delete("default", ScopeLevel.USER, "u1@p1"));
        assertFalse(repo.delete("default", ScopeLevel.USER, "u1@p1"));
        assertEquals(1, repo.findByResourceGroupAndLevel("default", ScopeLevel.USER).size());
    }
}
