package eryxon.qrm.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import eryxon.qrm.config.QrmConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Connection pool over the MES database.
 * Uses HikariCP for connection pooling. The tables are owned by the platform;
 * {@code CREATE TABLE IF NOT EXISTS} only bootstraps local and test databases.
 */
public final class Database implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private final HikariDataSource dataSource;

    public Database(QrmConfig config) {
        this(config.databaseUrl(), config.databasePoolSize());
    }

    public Database(String jdbcUrl, int poolSize) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(1);
        hikariConfig.setConnectionTimeout(5000);
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName("eryxon-qrm-pool");
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

            // ---------- CELLS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS cells (
                            id                     VARCHAR(64) PRIMARY KEY,
                            tenant_id              VARCHAR(64) NOT NULL,
                            name                   VARCHAR(256) NOT NULL,
                            color                  VARCHAR(32),
                            sequence               INT NOT NULL DEFAULT 0,
                            active                 BOOLEAN NOT NULL DEFAULT TRUE,
                            wip_limit              INT,
                            wip_warning_threshold  INT,
                            enforce_wip_limit      BOOLEAN NOT NULL DEFAULT FALSE,
                            show_capacity_warning  BOOLEAN NOT NULL DEFAULT TRUE
                        );
                    """);

            // ---------- JOBS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS jobs (
                            id              VARCHAR(64) PRIMARY KEY,
                            tenant_id       VARCHAR(64) NOT NULL,
                            job_number      VARCHAR(128) NOT NULL,
                            status          VARCHAR(20) DEFAULT 'not_started'
                        );
                    """);

            // ---------- PARTS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS parts (
                            id              VARCHAR(64) PRIMARY KEY,
                            tenant_id       VARCHAR(64) NOT NULL,
                            job_id          VARCHAR(64) NOT NULL,
                            part_number     VARCHAR(128) NOT NULL
                        );
                    """);

            // ---------- OPERATIONS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS operations (
                            id              VARCHAR(64) PRIMARY KEY,
                            tenant_id       VARCHAR(64) NOT NULL,
                            part_id         VARCHAR(64) NOT NULL,
                            cell_id         VARCHAR(64),
                            operation_name  VARCHAR(256),
                            sequence        INT NOT NULL DEFAULT 0,
                            status          VARCHAR(20) NOT NULL DEFAULT 'not_started',
                            estimated_time  INT,
                            actual_time     INT
                        );
                    """);

            // Indexes
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_operations_cell_status ON operations(cell_id, status);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_operations_part ON operations(part_id);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_parts_job ON parts(job_id);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_cells_tenant_sequence ON cells(tenant_id, sequence);");

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
