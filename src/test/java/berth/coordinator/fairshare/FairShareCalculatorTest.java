package berth.coordinator.fairshare;

import berth.coordinator.model.ResourceSlot;
import berth.coordinator.model.ScalingGroupOptions;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FairShareCalculatorTest {

    private static final LocalDate TODAY = LocalDate.of(2024, 6, 30);
    private static final BigDecimal DAY_SECONDS = BigDecimal.valueOf(86_400);

    private final FairShareCalculator calculator = new FairShareCalculator();

    private static FairShareCalculationContext context(Map<FairShareScope, FairShareSpec> specs,
            Map<FairShareScope, Map<LocalDate, ResourceSlot>> usage, int lookbackDays, ResourceSlot capacity) {
        return new FairShareCalculationContext(specs, usage, 7, lookbackDays, 1, BigDecimal.ONE,
                ResourceSlot.empty(), capacity, TODAY);
    }

    private static void assertDecimal(String expected, BigDecimal actual) {
        assertEquals(0, new BigDecimal(expected).compareTo(actual), "expected " + expected + " but was " + actual);
    }

    @Test
    void usageHalvesEveryHalfLife() {
        FairShareCalculationContext ctx = context(Map.of(), Map.of(), 28, ResourceSlot.empty());
        Map<LocalDate, ResourceSlot> buckets = Map.of(
                TODAY, ResourceSlot.of("cpu", 1000),
                TODAY.minusDays(7), ResourceSlot.of("cpu", 1000),
                TODAY.minusDays(14), ResourceSlot.of("cpu", 1000));

        ResourceSlot decayed = calculator.decayedUsage(buckets, ctx);

        assertDecimal("1750", decayed.get("cpu"));
    }

    @Test
    void bucketsOutsideWindowAreIgnored() {
        FairShareCalculationContext ctx = context(Map.of(), Map.of(), 7, ResourceSlot.empty());
        Map<LocalDate, ResourceSlot> buckets = Map.of(
                TODAY.minusDays(7), ResourceSlot.of("cpu", 1000),
                TODAY.minusDays(8), ResourceSlot.of("cpu", 1000),
                TODAY.plusDays(1), ResourceSlot.of("cpu", 1000));

        assertDecimal("500", calculator.decayedUsage(buckets, ctx).get("cpu"));
    }

    @Test
    void decayUnitFloorsAge() {
        FairShareCalculationContext ctx = new FairShareCalculationContext(Map.of(), Map.of(), 7, 28, 7,
                BigDecimal.ONE, ResourceSlot.empty(), ResourceSlot.empty(), TODAY);

        // 13 days old floors to 7 days
        assertDecimal("500", calculator.decayedUsage(Map.of(TODAY.minusDays(13), ResourceSlot.of("cpu", 1000)), ctx)
                .get("cpu"));
        // 6 days old floors to 0
        assertDecimal("1000", calculator.decayedUsage(Map.of(TODAY.minusDays(6), ResourceSlot.of("cpu", 1000)), ctx)
                .get("cpu"));
    }

    @Test
    void fullCapacityForTheWholeWindowGivesHalfFactor() {
        FairShareScope user = FairShareScope.user("dom", "proj", "alice");
        FairShareCalculationContext ctx = context(Map.of(),
                Map.of(user, Map.of(TODAY, ResourceSlot.of("cpu", DAY_SECONDS))), 1, ResourceSlot.of("cpu", 1));

        FairShareResult result = calculator.calculateFactors(ctx).result(user).orElseThrow();

        assertDecimal("1", result.normalizedUsage());
        assertDecimal("0.5", result.fairShareFactor());
        assertEquals(FairShareCalculator.FACTOR_SCALE, result.fairShareFactor().scale());
        assertTrue(result.usedDefaultWeight());
    }

    @Test
    void higherWeightSoftensTheFactor() {
        FairShareScope user = FairShareScope.user("dom", "proj", "alice");
        FairShareCalculationContext ctx = context(
                Map.of(user, new FairShareSpec(new BigDecimal("2"), 7, 1, 1, null)),
                Map.of(user, Map.of(TODAY, ResourceSlot.of("cpu", DAY_SECONDS))), 1, ResourceSlot.of("cpu", 1));

        FairShareResult result = calculator.calculateFactors(ctx).result(user).orElseThrow();

        assertDecimal("0.707107", result.fairShareFactor());
        assertFalse(result.usedDefaultWeight());
    }

    @Test
    void noUsageGivesFullFactor() {
        FairShareScope project = FairShareScope.project("dom", "proj");
        FairShareCalculationContext ctx = context(
                Map.of(project, FairShareSpec.inherit(ScalingGroupOptions.defaults("default"))),
                Map.of(), 28, ResourceSlot.of("cpu", 8));

        FairShareResult result = calculator.calculateFactors(ctx).result(project).orElseThrow();

        assertDecimal("0", result.normalizedUsage());
        assertDecimal("1", result.fairShareFactor());
    }

    @Test
    void resourcesWithoutCapacityAreIgnored() {
        ResourceSlot usage = ResourceSlot.of("cpu", DAY_SECONDS, "cuda.device", DAY_SECONDS);
        BigDecimal normalized = FairShareCalculator.normalizedUsage(usage, ResourceSlot.of("cpu", 2), 1,
                ResourceSlot.of("cpu", 1, "cuda.device", 1));

        assertDecimal("0.5", normalized);
    }

    @Test
    void normalizationIsWeightedAverage() {
        ResourceSlot usage = ResourceSlot.of("cpu", DAY_SECONDS, "mem", 0);
        BigDecimal normalized = FairShareCalculator.normalizedUsage(usage, ResourceSlot.of("cpu", 1, "mem", 1), 1,
                ResourceSlot.of("cpu", 3, "mem", 1));

        // (3 * 1 + 1 * 0) / 4
        assertDecimal("0.75", normalized);
    }

    @Test
    void resourceWeightFallbackOrder() {
        ResourceSlot usage = ResourceSlot.of("cpu", 1, "mem", 1, "cuda.shares", 1);
        FairShareCalculationContext ctx = new FairShareCalculationContext(Map.of(), Map.of(), 7, 28, 1,
                new BigDecimal("5"), ResourceSlot.of("mem", 2), ResourceSlot.empty(), TODAY);

        ResourceSlot groupOnly = FairShareCalculator.resolveResourceWeights(usage, null, ctx);
        assertDecimal("5", groupOnly.get("cpu"));
        assertDecimal("2", groupOnly.get("mem"));

        FairShareSpec scoped = new FairShareSpec(new BigDecimal("3"), 7, 28, 1, ResourceSlot.of("cuda.shares", 9));
        ResourceSlot withSpec = FairShareCalculator.resolveResourceWeights(usage, scoped, ctx);
        assertDecimal("3", withSpec.get("cpu"));
        assertDecimal("3", withSpec.get("mem"));
        assertDecimal("9", withSpec.get("cuda.shares"));
    }

    @Test
    void factorIsClamped() {
        assertDecimal("1", FairShareCalculator.factor(new BigDecimal("-3"), BigDecimal.ONE));
        assertDecimal("0", FairShareCalculator.factor(new BigDecimal("1000000"), BigDecimal.ONE));
    }

    @Test
    void nonPositiveWeightSkipsScope() {
        FairShareScope broken = FairShareScope.user("dom", "proj", "mallory");
        FairShareScope fine = FairShareScope.user("dom", "proj", "alice");
        FairShareCalculationContext ctx = context(
                Map.of(broken, new FairShareSpec(BigDecimal.ZERO, 7, 28, 1, null)),
                Map.of(fine, Map.of(TODAY, ResourceSlot.of("cpu", 1))), 28, ResourceSlot.of("cpu", 1));

        FairShareCalculationResult result = calculator.calculateFactors(ctx);

        assertEquals(List.of(broken), result.skipped());
        assertTrue(result.result(broken).isEmpty());
        assertTrue(result.result(fine).isPresent());
    }

    @Test
    void resultsAreGroupedByLevel() {
        FairShareScope domain = FairShareScope.domain("dom");
        FairShareScope project = FairShareScope.project("dom", "proj");
        FairShareScope user = FairShareScope.user("dom", "proj", "alice");
        Map<LocalDate, ResourceSlot> usage = Map.of(TODAY, ResourceSlot.of("cpu", 100));
        FairShareCalculationContext ctx = context(Map.of(),
                Map.of(user, usage, project, usage, domain, usage), 28, ResourceSlot.of("cpu", 4));

        FairShareCalculationResult result = calculator.calculateFactors(ctx);

        assertEquals(List.of(domain, project, user), List.copyOf(result.results().keySet()));
        assertEquals(1, result.resultsAt(ScopeLevel.USER).size());
        assertEquals(1, result.ranks().size());
    }

    @Test
    void ranksFollowDomainThenProjectThenUser() {
        Map<FairShareScope, BigDecimal> factors = new LinkedHashMap<>();
        factors.put(FairShareScope.domain("busy"), new BigDecimal("0.2"));
        factors.put(FairShareScope.domain("idle"), new BigDecimal("0.9"));
        factors.put(FairShareScope.project("idle", "p1"), new BigDecimal("0.5"));
        factors.put(FairShareScope.project("idle", "p2"), new BigDecimal("0.8"));
        factors.put(FairShareScope.user("busy", "p9", "zed"), BigDecimal.ONE);
        factors.put(FairShareScope.user("idle", "p1", "amy"), BigDecimal.ONE);
        factors.put(FairShareScope.user("idle", "p2", "bob"), new BigDecimal("0.1"));
        factors.put(FairShareScope.user("idle", "p2", "cat"), new BigDecimal("0.1"));

        List<SchedulingRank> ranks = FairShareCalculator.rankUsers(factors);

        assertEquals(List.of("bob@p2", "cat@p2", "amy@p1", "zed@p9"),
                ranks.stream().map(SchedulingRank::key).toList());
        assertEquals(1, ranks.get(0).rank());
        assertEquals(4, ranks.get(3).rank());
    }

    @Test
    void missingParentsCountAsUnused() {
        Map<FairShareScope, BigDecimal> factors = new LinkedHashMap<>();
        factors.put(FairShareScope.domain("a"), new BigDecimal("0.5"));
        factors.put(FairShareScope.user("a", "p", "u1"), BigDecimal.ONE);
        factors.put(FairShareScope.user("b", "p", "u2"), new BigDecimal("0.3"));

        List<SchedulingRank> ranks = FairShareCalculator.rankUsers(factors);

        assertEquals("u2", ranks.get(0).userId());
        assertDecimal("1", ranks.get(0).domainFactor());
        assertDecimal("1", ranks.get(0).projectFactor());
    }

    @Test
    void factorNeverRisesWithUsage() {
        for (String weight : List.of("0.5", "1", "3")) {
            BigDecimal previous = FairShareCalculator.factor(BigDecimal.ZERO, new BigDecimal(weight));
            assertDecimal("1", previous);
            for (int step = 1; step <= 200; step++) {
                BigDecimal normalized = BigDecimal.valueOf(step).multiply(new BigDecimal("0.05"));
                BigDecimal current = FairShareCalculator.factor(normalized, new BigDecimal(weight));
                assertTrue(current.compareTo(previous) <= 0,
                        "factor rose from " + previous + " to " + current + " at usage " + normalized);
                previous = current;
            }
            assertTrue(previous.compareTo(BigDecimal.ONE) < 0);
        }
    }
}
