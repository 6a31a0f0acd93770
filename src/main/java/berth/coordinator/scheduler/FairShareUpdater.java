package berth.coordinator.scheduler;

import berth.coordinator.service.FairShareService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Background task that refreshes fair share factors of every resource group.
 *
 * Runs are idempotent: a run recomputes every scope from the stored usage
 * buckets, so a missed or interrupted run is repaired by the next one.
 */
public class FairShareUpdater implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(FairShareUpdater.class);

    private final FairShareService fairShareService;

    public FairShareUpdater(FairShareService fairShareService) {
        this.fairShareService = fairShareService;
    }

    @Override
    public void run() {
        try {
            long started = System.currentTimeMillis();
            fairShareService.recalculateAll();
            log.debug("Fair share update took {}ms", System.currentTimeMillis() - started);
        } catch (Exception e) {
            log.error("Fair share updater error", e);
        }
    }
}
