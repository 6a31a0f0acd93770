package berth.coordinator.fairshare;

import berth.coordinator.model.ResourceSlot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns kernel usage records into per-day usage buckets for the domain, project
 * and user of each record. Records spanning midnight (UTC) are split so every
 * day receives only the seconds that fell on it.
 */
public class FairShareAggregator {
    private static final Logger log = LoggerFactory.getLogger(FairShareAggregator.class);

    private record BucketKey(String resourceGroup, FairShareScope scope, LocalDate date) {
    }

    /**
     * @return buckets merged per (resource group, scope, date), in first-seen order
     */
    public List<UsageBucket> aggregate(List<KernelUsageRecord> records) {
        Map<BucketKey, ResourceSlot> totals = new LinkedHashMap<>();

        for (KernelUsageRecord record : records) {
            if (!record.periodEnd().isAfter(record.periodStart())) {
                log.debug("Skipping usage record of kernel {} with empty period", record.kernelId());
                continue;
            }

            List<FairShareScope> scopes = List.of(
                    FairShareScope.domain(record.domainName()),
                    FairShareScope.project(record.domainName(), record.projectId()),
                    FairShareScope.user(record.domainName(), record.projectId(), record.userId()));

            for (DaySegment segment : splitByDay(record.periodStart(), record.periodEnd())) {
                ResourceSlot usage = record.occupiedSlots().multiply(BigDecimal.valueOf(segment.seconds()));
                for (FairShareScope scope : scopes) {
                    totals.merge(new BucketKey(record.resourceGroup(), scope, segment.date()), usage,
                            ResourceSlot::add);
                }
            }
        }

        List<UsageBucket> buckets = new ArrayList<>(totals.size());
        totals.forEach((key, usage) -> buckets.add(
                new UsageBucket(key.resourceGroup(), key.scope(), key.date(), usage)));
        return buckets;
    }

    record DaySegment(LocalDate date, long seconds) {
    }

    static List<DaySegment> splitByDay(Instant start, Instant end) {
        List<DaySegment> segments = new ArrayList<>();
        Instant cursor = start;
        while (cursor.isBefore(end)) {
            LocalDate day = cursor.atZone(ZoneOffset.UTC).toLocalDate();
            Instant nextMidnight = day.plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant();
            Instant segmentEnd = nextMidnight.isBefore(end) ? nextMidnight : end;
            long seconds = Duration.between(cursor, segmentEnd).getSeconds();
            if (seconds > 0) {
                segments.add(new DaySegment(day, seconds));
            }
            cursor = segmentEnd;
        }
        return segments;
    }
}
