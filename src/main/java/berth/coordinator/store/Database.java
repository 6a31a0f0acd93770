package berth.coordinator.store;

import berth.coordinator.config.CoordinatorConfig;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Database connection pool and schema management.
 * Uses HikariCP for connection pooling.
 */
public final class Database implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private final HikariDataSource dataSource;

    public Database(CoordinatorConfig config) {
        this(config.databaseUrl(), config.databasePoolSize());
    }

    public Database(String jdbcUrl, int poolSize) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(2);
        hikariConfig.setConnectionTimeout(5000);
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName("berth-db-pool");
        hikariConfig.setAutoCommit(false);

        // H2 specific settings
        if (jdbcUrl.contains("h2:")) {
            hikariConfig.addDataSourceProperty("MODE", "PostgreSQL");
        }

        this.dataSource = new HikariDataSource(hikariConfig);

        log.info("Database pool initialized: {}", jdbcUrl);

        initSchema();
    }

    /**
     * Get a connection from the pool.
     * Caller is responsible for closing the connection.
     */
    public Connection getConnection() throws SQLException {
        return dataSource.getConnection();
    }

    public DataSource getDataSource() {
        return dataSource;
    }

    /**
     * Check if database is healthy.
     */
    public boolean isHealthy() {
        try (Connection conn = getConnection()) {
            return conn.isValid(2);
        } catch (SQLException e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }

    private void initSchema() {
        try (Connection conn = getConnection();
                Statement st = conn.createStatement()) {

            // ---------- AGENTS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS agents (
                            id              VARCHAR(64) PRIMARY KEY,
                            address         VARCHAR(256),
                            architecture    VARCHAR(32) NOT NULL,
                            scaling_group   VARCHAR(64) NOT NULL,
                            available_slots CLOB NOT NULL,
                            occupied_slots  CLOB NOT NULL,
                            container_count INT DEFAULT 0,
                            status          VARCHAR(20) DEFAULT 'ALIVE',
                            last_heartbeat  TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            registered_at   TIMESTAMP DEFAULT CURRENT_TIMESTAMP
                        );
                    """);

            // ---------- SCALING GROUPS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS scaling_groups (
                            name                     VARCHAR(64) PRIMARY KEY,
                            selection_strategy       VARCHAR(20) NOT NULL,
                            max_container_count      INT,
                            enforce_spreading        BOOLEAN DEFAULT FALSE,
                            default_weight           DECIMAL(18, 6) NOT NULL,
                            half_life_days           INT NOT NULL,
                            lookback_days            INT NOT NULL,
                            decay_unit_days          INT NOT NULL,
                            resource_weights         CLOB
                        );
                    """);

            // ---------- ROUND-ROBIN STATES ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS roundrobin_states (
                            scaling_group        VARCHAR(64) NOT NULL,
                            architecture         VARCHAR(32) NOT NULL,
                            schedulable_group_id VARCHAR(64) NOT NULL,
                            next_index           BIGINT NOT NULL,
                            PRIMARY KEY (scaling_group, architecture)
                        );
                    """);

            // ---------- KERNEL ALLOCATIONS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS kernel_allocations (
                            kernel_id       VARCHAR(64) PRIMARY KEY,
                            session_id      VARCHAR(64) NOT NULL,
                            agent_id        VARCHAR(64) NOT NULL,
                            scaling_group   VARCHAR(64) NOT NULL,
                            endpoint_id     VARCHAR(64),
                            slots           CLOB NOT NULL,
                            allocated_at    TIMESTAMP DEFAULT CURRENT_TIMESTAMP
                        );
                    """);

            // ---------- USAGE BUCKETS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS usage_buckets (
                            resource_group  VARCHAR(64) NOT NULL,
                            scope_level     VARCHAR(16) NOT NULL,
                            scope_id        VARCHAR(256) NOT NULL,
                            domain_name     VARCHAR(64) NOT NULL,
                            project_id      VARCHAR(64),
                            user_id         VARCHAR(64),
                            bucket_date     DATE NOT NULL,
                            resource_usage  CLOB NOT NULL,
                            PRIMARY KEY (resource_group, scope_level, scope_id, bucket_date)
                        );
                    """);

            // ---------- FAIR SHARES ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS fair_shares (
                            resource_group      VARCHAR(64) NOT NULL,
                            scope_level         VARCHAR(16) NOT NULL,
                            scope_id            VARCHAR(256) NOT NULL,
                            domain_name         VARCHAR(64) NOT NULL,
                            project_id          VARCHAR(64),
                            user_id             VARCHAR(64),
                            weight              DECIMAL(18, 6),
                            half_life_days      INT NOT NULL,
                            lookback_days       INT NOT NULL,
                            decay_unit_days     INT NOT NULL,
                            resource_weights    CLOB,
                            fair_share_factor   DECIMAL(18, 6) NOT NULL,
                            total_decayed_usage CLOB NOT NULL,
                            normalized_usage    DECIMAL(38, 16) NOT NULL,
                            lookback_start      DATE,
                            lookback_end        DATE,
                            last_calculated_at  TIMESTAMP,
                            created_at          TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            updated_at          TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            PRIMARY KEY (resource_group, scope_level, scope_id)
                        );
                    """);

            // Indexes
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_agents_group_status ON agents(scaling_group, status);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_agents_heartbeat ON agents(last_heartbeat);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_allocations_session ON kernel_allocations(session_id);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_allocations_endpoint ON kernel_allocations(endpoint_id);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_usage_group_date ON usage_buckets(resource_group, bucket_date);");

            st.executeBatch();
            conn.commit();

            log.info("Database schema initialized");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize database schema", e);
        }
    }

    @Override
    public void close() {
        if (dataSource != null && !dataSource.isClosed()) {
            dataSource.close();
            log.info("Database pool closed");
        }
    }
}
