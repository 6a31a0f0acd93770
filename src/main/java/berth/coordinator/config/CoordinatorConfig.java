package berth.coordinator.config;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;

/**
 * Configuration holder for Coordinator settings.
 * All settings have sensible defaults.
 */
public final class CoordinatorConfig {

    public static final List<String> DEFAULT_RESOURCE_PRIORITY = List.of(
            "cuda.device", "cuda.shares", "rocm.device", "cpu", "mem");

    // Database settings
    private String databaseUrl = "jdbc:h2:file:./data/berth;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    private int databasePoolSize = 10;

    // Server settings
    private int serverPort = 8080;
    private String serverHost = "0.0.0.0";

    // Scheduling settings
    private List<String> resourcePriority = DEFAULT_RESOURCE_PRIORITY;

    // Fair share settings
    private Duration fairShareInterval = Duration.ofMinutes(5);

    // Agent settings
    private Duration agentHeartbeatTimeout = Duration.ofSeconds(30);
    private Duration agentReapInterval = Duration.ofSeconds(10);

    // Auth settings (optional)
    private String agentKey = null; // If set, agents must provide X-Berth-Key header

    private CoordinatorConfig() {
    }

    public static CoordinatorConfig defaults() {
        return new CoordinatorConfig();
    }

    public static CoordinatorConfig fromEnv() {
        CoordinatorConfig config = new CoordinatorConfig();

        // Override from environment variables
        String dbUrl = System.getenv("BERTH_DB_URL");
        if (dbUrl != null && !dbUrl.isBlank()) {
            config.databaseUrl = dbUrl;
        }

        String port = System.getenv("BERTH_PORT");
        if (port != null && !port.isBlank()) {
            config.serverPort = Integer.parseInt(port);
        }

        String agentKey = System.getenv("BERTH_AGENT_KEY");
        if (agentKey != null && !agentKey.isBlank()) {
            config.agentKey = agentKey;
        }

        String priority = System.getenv("BERTH_RESOURCE_PRIORITY");
        if (priority != null && !priority.isBlank()) {
            config.resourcePriority = parseList(priority);
        }

        String interval = System.getenv("BERTH_FAIR_SHARE_INTERVAL_SECONDS");
        if (interval != null && !interval.isBlank()) {
            config.fairShareInterval = Duration.ofSeconds(Long.parseLong(interval));
        }

        return config;
    }

    static List<String> parseList(String value) {
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    // Getters
    public String databaseUrl() {
        return databaseUrl;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public int serverPort() {
        return serverPort;
    }

    public String serverHost() {
        return serverHost;
    }

    /** Resource names compared first by the slot-ordering strategies. */
    public List<String> resourcePriority() {
        return resourcePriority;
    }

    public Duration fairShareInterval() {
        return fairShareInterval;
    }

    public Duration agentHeartbeatTimeout() {
        return agentHeartbeatTimeout;
    }

    public Duration agentReapInterval() {
        return agentReapInterval;
    }

    public String agentKey() {
        return agentKey;
    }

    public boolean hasAgentKey() {
        return agentKey != null && !agentKey.isBlank();
    }

    // Fluent setters for testing/customization
    public CoordinatorConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public CoordinatorConfig withServerPort(int port) {
        this.serverPort = port;
        return this;
    }

    public CoordinatorConfig withAgentKey(String key) {
        this.agentKey = key;
        return this;
    }

    public CoordinatorConfig withResourcePriority(List<String> priority) {
        this.resourcePriority = List.copyOf(priority);
        return this;
    }

    public CoordinatorConfig withFairShareInterval(Duration interval) {
        this.fairShareInterval = interval;
        return this;
    }

    public CoordinatorConfig withAgentHeartbeatTimeout(Duration timeout) {
        this.agentHeartbeatTimeout = timeout;
        return this;
    }

    @Override
    public String toString() {
        return "CoordinatorConfig{" +
                "databaseUrl='" + databaseUrl + '\'' +
                ", serverPort=" + serverPort +
                ", resourcePriority=" + resourcePriority +
                ", fairShareInterval=" + fairShareInterval +
                ", agentKeySet=" + hasAgentKey() +
                '}';
    }
}
