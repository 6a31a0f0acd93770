package berth.coordinator.scheduler;

import berth.coordinator.config.CoordinatorConfig;
import berth.coordinator.service.FairShareService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Coordinates background scheduled tasks:
 * - FairShareUpdater: recalculates fair share factors
 * - AgentReaper: marks agents without heartbeat as LOST (handled by
 * AgentService.reapStaleAgents)
 *
 * Uses a single-threaded executor to avoid concurrency issues.
 */
public class Scheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    private final ScheduledExecutorService executor;
    private final FairShareUpdater fairShareUpdater;
    private final Runnable agentReaper;
    private final CoordinatorConfig config;

    private volatile boolean running = false;

    /**
     * @param fairShareService for periodic recalculation
     * @param agentReaper      runnable to reap stale agents (typically
     *                         AgentService::reapStaleAgents)
     * @param config           configuration
     */
    public Scheduler(FairShareService fairShareService, Runnable agentReaper, CoordinatorConfig config) {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "berth-scheduler");
            t.setDaemon(true);
            return t;
        });
        this.fairShareUpdater = new FairShareUpdater(fairShareService);
        this.agentReaper = agentReaper;
        this.config = config;
    }

    public void start() {
        if (running) {
            log.warn("Scheduler already running");
            return;
        }

        running = true;

        long fairShareIntervalMs = config.fairShareInterval().toMillis();
        executor.scheduleAtFixedRate(
                fairShareUpdater,
                0, // first run right away
                fairShareIntervalMs,
                TimeUnit.MILLISECONDS);
        log.info("Fair share updater scheduled every {}ms", fairShareIntervalMs);

        long agentReapIntervalMs = config.agentReapInterval().toMillis();
        executor.scheduleAtFixedRate(
                wrapRunnable("agent-reaper", agentReaper),
                agentReapIntervalMs,
                agentReapIntervalMs,
                TimeUnit.MILLISECONDS);
        log.info("Agent reaper scheduled every {}ms", agentReapIntervalMs);

        log.info("Scheduler started");
    }

    /**
     * Stop the scheduler gracefully.
     */
    public void stop() {
        if (!running) {
            return;
        }

        running = false;
        executor.shutdown();

        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Scheduler forcefully stopped");
            } else {
                log.info("Scheduler stopped gracefully");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    private Runnable wrapRunnable(String name, Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (Exception e) {
                log.error("{} error", name, e);
            }
        };
    }
}
