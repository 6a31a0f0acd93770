package berth;

import berth.coordinator.config.CoordinatorConfig;
import berth.coordinator.config.Dependencies;
import berth.coordinator.server.CoordinatorNettyServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Coordinator entry point.
 *
 * Starts the HTTP server, then the background scheduler, and blocks until the
 * JVM is asked to shut down.
 */
public final class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    private App() {
    }

    public static void main(String[] args) throws InterruptedException {
        CoordinatorConfig config = CoordinatorConfig.fromEnv();
        Dependencies deps = Dependencies.create(config);
        CoordinatorNettyServer server = new CoordinatorNettyServer(deps);
        CountDownLatch stopped = new CountDownLatch(1);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown requested, stopping coordinator...");
            try {
                server.stop();
            } finally {
                deps.close();
                stopped.countDown();
            }
        }, "berth-shutdown"));

        try {
            server.start();
        } catch (RuntimeException e) {
            log.error("Coordinator failed to start", e);
            deps.close();
            System.exit(1);
        }
        deps.startScheduler();

        stopped.await();
    }
}
