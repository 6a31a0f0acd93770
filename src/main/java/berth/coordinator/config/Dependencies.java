package berth.coordinator.config;

import berth.coordinator.api.internal.v1.AgentHeartbeatController;
import berth.coordinator.api.internal.v1.UsageController;
import berth.coordinator.api.v1.AgentController;
import berth.coordinator.api.v1.FairShareController;
import berth.coordinator.api.v1.HealthController;
import berth.coordinator.api.v1.ScalingGroupController;
import berth.coordinator.api.v1.SessionController;
import berth.coordinator.repository.AgentRepository;
import berth.coordinator.repository.FairShareRepository;
import berth.coordinator.repository.KernelAllocationRepository;
import berth.coordinator.repository.RoundRobinStateRepository;
import berth.coordinator.repository.ScalingGroupRepository;
import berth.coordinator.repository.UsageBucketRepository;
import berth.coordinator.scheduler.Scheduler;
import berth.coordinator.server.RouterHandler;
import berth.coordinator.service.AgentService;
import berth.coordinator.service.FairShareService;
import berth.coordinator.service.SchedulingService;
import berth.coordinator.store.Database;
import berth.coordinator.store.JdbcAgentRepository;
import berth.coordinator.store.JdbcFairShareRepository;
import berth.coordinator.store.JdbcKernelAllocationRepository;
import berth.coordinator.store.JdbcRoundRobinStateRepository;
import berth.coordinator.store.JdbcScalingGroupRepository;
import berth.coordinator.store.JdbcUsageBucketRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Manual dependency injection container.
 * Creates and wires all service dependencies.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(CoordinatorConfig.fromEnv());
 * deps.startScheduler(); // fair share recalculation and agent reaping
 * SchedulingService scheduling = deps.schedulingService();
 * // ... use services ...
 * deps.close(); // cleanup
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final CoordinatorConfig config;
    private final Database database;
    private final AgentRepository agentRepository;
    private final ScalingGroupRepository scalingGroupRepository;
    private final RoundRobinStateRepository roundRobinStateRepository;
    private final KernelAllocationRepository kernelAllocationRepository;
    private final UsageBucketRepository usageBucketRepository;
    private final FairShareRepository fairShareRepository;
    private final AgentService agentService;
    private final FairShareService fairShareService;
    private final SchedulingService schedulingService;

    // Controllers
    private final HealthController healthController;
    private final AgentController agentController;
    private final ScalingGroupController scalingGroupController;
    private final SessionController sessionController;
    private final FairShareController fairShareController;
    private final AgentHeartbeatController agentHeartbeatController;
    private final UsageController usageController;

    // Router (lazy-initialized)
    private RouterHandler routerHandler;

    // Scheduler (lazy-initialized)
    private Scheduler scheduler;

    private Dependencies(CoordinatorConfig config, Clock clock) {
        this.config = config;

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        this.database = new Database(config);

        // Repositories
        this.agentRepository = new JdbcAgentRepository(database);
        this.scalingGroupRepository = new JdbcScalingGroupRepository(database);
        this.roundRobinStateRepository = new JdbcRoundRobinStateRepository(database);
        this.kernelAllocationRepository = new JdbcKernelAllocationRepository(database);
        this.usageBucketRepository = new JdbcUsageBucketRepository(database);
        this.fairShareRepository = new JdbcFairShareRepository(database);

        // Services
        this.agentService = new AgentService(agentRepository, config);
        this.fairShareService = new FairShareService(fairShareRepository, usageBucketRepository,
                scalingGroupRepository, agentService, clock);
        this.schedulingService = new SchedulingService(agentRepository, scalingGroupRepository,
                roundRobinStateRepository, kernelAllocationRepository, fairShareService, config, clock);

        // Controllers (public API)
        this.healthController = new HealthController(database, agentService);
        this.agentController = new AgentController(agentService);
        this.scalingGroupController = new ScalingGroupController(scalingGroupRepository);
        this.sessionController = new SessionController(schedulingService);
        this.fairShareController = new FairShareController(fairShareService);

        // Controllers (internal API)
        this.agentHeartbeatController = new AgentHeartbeatController(agentService);
        this.usageController = new UsageController(fairShareService);

        log.info("Dependencies initialized successfully");
    }

    /**
     * Create dependencies with the given config.
     */
    public static Dependencies create(CoordinatorConfig config) {
        return new Dependencies(config, Clock.systemUTC());
    }

    /**
     * Create dependencies with a fixed clock, for tests.
     */
    public static Dependencies create(CoordinatorConfig config, Clock clock) {
        return new Dependencies(config, clock);
    }

    /**
     * Create dependencies with environment-based config.
     */
    public static Dependencies create() {
        return create(CoordinatorConfig.fromEnv());
    }

    // Getters
    public CoordinatorConfig config() {
        return config;
    }

    public Database database() {
        return database;
    }

    public AgentRepository agentRepository() {
        return agentRepository;
    }

    public ScalingGroupRepository scalingGroupRepository() {
        return scalingGroupRepository;
    }

    public RoundRobinStateRepository roundRobinStateRepository() {
        return roundRobinStateRepository;
    }

    public KernelAllocationRepository kernelAllocationRepository() {
        return kernelAllocationRepository;
    }

    public UsageBucketRepository usageBucketRepository() {
        return usageBucketRepository;
    }

    public FairShareRepository fairShareRepository() {
        return fairShareRepository;
    }

    public AgentService agentService() {
        return agentService;
    }

    public FairShareService fairShareService() {
        return fairShareService;
    }

    public SchedulingService schedulingService() {
        return schedulingService;
    }

    /**
     * Get a fully configured RouterHandler with all controllers registered.
     * This is the main entry point for serving HTTP requests.
     */
    public RouterHandler routerHandler() {
        if (routerHandler == null) {
            routerHandler = new RouterHandler(config)
                    .registerController(healthController)
                    .registerController(agentController)
                    .registerController(scalingGroupController)
                    .registerController(sessionController)
                    .registerController(fairShareController)
                    .registerController(agentHeartbeatController)
                    .registerController(usageController);
            log.info("RouterHandler created with {} controllers", routerHandler.controllerCount());
        }
        return routerHandler;
    }

    /**
     * Get the scheduler (creates it if not yet created).
     */
    public Scheduler scheduler() {
        if (scheduler == null) {
            scheduler = new Scheduler(fairShareService, agentService::reapStaleAgents, config);
        }
        return scheduler;
    }

    /**
     * Start fair share recalculation and stale agent reaping.
     * Should be called after server startup.
     */
    public void startScheduler() {
        scheduler().start();
    }

    public void stopScheduler() {
        if (scheduler != null) {
            scheduler.stop();
        }
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        if (scheduler != null) {
            try {
                scheduler.stop();
            } catch (Exception e) {
                log.warn("Error stopping scheduler: {}", e.getMessage());
            }
        }

        try {
            database.close();
        } catch (Exception e) {
            log.warn("Error closing database: {}", e.getMessage());
        }

        log.info("Dependencies closed");
    }
}
