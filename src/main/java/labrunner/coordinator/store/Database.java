package labrunner.coordinator.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import labrunner.coordinator.config.RunnerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

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

    public Database(RunnerConfig config) {
        this(config.databaseUrl(), config.databasePoolSize());
    }

    public Database(String jdbcUrl, int poolSize) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(1);
        hikariConfig.setConnectionTimeout(5000);
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName("labrunner-db-pool");
        hikariConfig.setAutoCommit(false);

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

            // ---------- CHILD TASKS (task queue) ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS child_tasks (
                            seq                     BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                            id                      VARCHAR(64) NOT NULL UNIQUE,
                            name                    VARCHAR(512) NOT NULL,
                            parent_id               VARCHAR(64),
                            state                   VARCHAR(20) DEFAULT 'PENDING',
                            failure                 BOOLEAN DEFAULT FALSE,
                            bot_id                  VARCHAR(128),
                            tags                    CLOB,
                            slices                  CLOB NOT NULL,
                            task_user               VARCHAR(128),
                            priority                INT DEFAULT 0,
                            execution_timeout_secs  BIGINT DEFAULT 0,
                            io_timeout_secs         BIGINT DEFAULT 0,
                            grace_period_secs       BIGINT DEFAULT 0,
                            created_at              TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            finished_at             TIMESTAMP
                        );
                    """);

            // ---------- HOSTS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS hosts (
                            id          VARCHAR(64) PRIMARY KEY,
                            hostname    VARCHAR(255) NOT NULL,
                            labels      CLOB,
                            status      VARCHAR(20) DEFAULT 'READY',
                            leased      BOOLEAN DEFAULT FALSE,
                            locked      BOOLEAN DEFAULT FALSE
                        );
                    """);

            // ---------- JOBS (host queue entries) ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS jobs (
                            id            VARCHAR(64) PRIMARY KEY,
                            name          VARCHAR(512),
                            dependencies  CLOB,
                            host_id       VARCHAR(64),
                            active        BOOLEAN DEFAULT FALSE,
                            complete      BOOLEAN DEFAULT FALSE,
                            priority      INT DEFAULT 0,
                            created_at    TIMESTAMP DEFAULT CURRENT_TIMESTAMP
                        );
                    """);

            // ---------- SPECIAL TASKS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS special_tasks (
                            seq         BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                            id          VARCHAR(64) NOT NULL UNIQUE,
                            host_id     VARCHAR(64) NOT NULL,
                            job_id      VARCHAR(64),
                            task_type   VARCHAR(20) NOT NULL,
                            active      BOOLEAN DEFAULT FALSE,
                            complete    BOOLEAN DEFAULT FALSE,
                            created_at  TIMESTAMP DEFAULT CURRENT_TIMESTAMP
                        );
                    """);

            // Indexes
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_child_tasks_parent ON child_tasks(parent_id, seq);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_hosts_leased ON hosts(leased, status);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_jobs_host_active ON jobs(host_id, active, complete);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_special_tasks_host ON special_tasks(host_id, complete);");

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
