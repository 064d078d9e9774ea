package sqlrunner.service;

import com.zaxxer.hikari.HikariDataSource;
import jakarta.annotation.PostConstruct;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;

/**
 * Hands out pooled connections in the session state the pool started with.
 *
 * <p>User statements may change session settings (current schema, H2 {@code SET} options).
 * Every acquired connection is reset to the startup schema, and a connection that ran a
 * statement able to change other settings is evicted from the pool when released.
 */
@Singleton
public class SessionConnections {

    private static final Logger LOG = LoggerFactory.getLogger(SessionConnections.class);

    private final DataSource dataSource;
    private volatile String defaultSchema;

    public SessionConnections(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @PostConstruct
    void captureDefaultSchema() {
        try (Connection connection = dataSource.getConnection()) {
            defaultSchema = connection.getSchema();
            LOG.info("Default schema for runner connections: {}", defaultSchema);
        } catch (SQLException e) {
            LOG.warn("Could not read default schema, session schema will not be reset: {}", e.getMessage());
        }
    }

    /**
     * Borrows a connection and restores the default schema on it.
     */
    public Connection acquire() throws SQLException {
        Connection connection = dataSource.getConnection();
        if (defaultSchema != null) {
            try {
                connection.setSchema(defaultSchema);
            } catch (SQLException e) {
                connection.close();
                throw e;
            }
        }
        return connection;
    }

    /**
     * Returns the connection to the pool. When {@code evict} is set the pooled connection is
     * retired so its session settings never reach another caller.
     */
    public void release(Connection connection, boolean evict) throws SQLException {
        try {
            if (evict) {
                // evicting while still borrowed closes the physical connection right away
                evict(connection);
            }
        } finally {
            connection.close();
        }
    }

    private void evict(Connection connection) throws SQLException {
        if (dataSource.isWrapperFor(HikariDataSource.class)) {
            dataSource.unwrap(HikariDataSource.class).evictConnection(connection);
            LOG.debug("Evicted connection after session-level statement");
        } else {
            LOG.debug("Data source is not pooled by Hikari, nothing to evict");
        }
    }
}
