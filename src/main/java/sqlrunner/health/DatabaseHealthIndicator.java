package sqlrunner.health;

import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.HikariPoolMXBean;
import io.micronaut.health.HealthStatus;
import io.micronaut.management.health.indicator.HealthIndicator;
import io.micronaut.management.health.indicator.HealthResult;
import jakarta.inject.Singleton;
import org.reactivestreams.Publisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health indicator that checks the statement store is reachable.
 */
@Singleton
public class DatabaseHealthIndicator implements HealthIndicator {

    private static final Logger LOG = LoggerFactory.getLogger(DatabaseHealthIndicator.class);
    private static final String NAME = "database";
    private static final int VALIDATION_TIMEOUT_SECONDS = 5;

    private final DataSource dataSource;
    private final HikariDataSource hikariDataSource;

    public DatabaseHealthIndicator(DataSource dataSource) {
        this.dataSource = dataSource;
        this.hikariDataSource = unwrapHikari(dataSource);
    }

    @Override
    public Publisher<HealthResult> getResult() {
        return Mono.fromCallable(this::checkDatabaseHealth);
    }

    private HealthResult checkDatabaseHealth() {
        Map<String, Object> details = new LinkedHashMap<>();

        try (Connection connection = dataSource.getConnection()) {
            if (!connection.isValid(VALIDATION_TIMEOUT_SECONDS)) {
                details.put("reason", "Connection validation failed");
                addPoolMetrics(details);
                LOG.warn("Database health check failed: connection not valid");
                return HealthResult.builder(NAME, HealthStatus.DOWN).details(details).build();
            }

            DatabaseMetaData metaData = connection.getMetaData();
            details.put("database", metaData.getDatabaseProductName());
            details.put("version", metaData.getDatabaseProductVersion());
            details.put("url", sanitizeUrl(metaData.getURL()));
            addPoolMetrics(details);

            LOG.debug("Database health check passed");
            return HealthResult.builder(NAME, HealthStatus.UP).details(details).build();
        } catch (Exception e) {
            details.put("error", e.getClass().getSimpleName());
            details.put("message", e.getMessage());
            LOG.error("Database health check failed", e);
            return HealthResult.builder(NAME, HealthStatus.DOWN).details(details).build();
        }
    }

    static String sanitizeUrl(String url) {
        if (url == null) {
            return "unknown";
        }
        return url.replaceAll("(?i)password=[^;&]*", "password=***");
    }

    private void addPoolMetrics(Map<String, Object> details) {
        if (hikariDataSource == null) {
            return;
        }
        HikariPoolMXBean pool = hikariDataSource.getHikariPoolMXBean();
        if (pool != null) {
            details.put("pool.active", pool.getActiveConnections());
            details.put("pool.idle", pool.getIdleConnections());
            details.put("pool.total", pool.getTotalConnections());
            details.put("pool.waiting", pool.getThreadsAwaitingConnection());
        }
    }

    private static HikariDataSource unwrapHikari(DataSource dataSource) {
        if (dataSource instanceof HikariDataSource hikari) {
            return hikari;
        }
        try {
            return dataSource.isWrapperFor(HikariDataSource.class) ? dataSource.unwrap(HikariDataSource.class) : null;
        } catch (Exception e) {
            LOG.debug("Data source is not a Hikari pool: {}", e.getMessage());
            return null;
        }
    }
}
