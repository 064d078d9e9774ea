package sqlrunner.health;

import io.micronaut.health.HealthStatus;
import io.micronaut.management.health.indicator.HealthIndicator;
import io.micronaut.management.health.indicator.HealthResult;
import jakarta.inject.Singleton;
import org.reactivestreams.Publisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import sqlrunner.config.RunnerProperties;
import sqlrunner.history.HistoryLedger;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reports which history store is active and whether it answers.
 */
@Singleton
public class HistoryLedgerHealthIndicator implements HealthIndicator {

    private static final Logger LOG = LoggerFactory.getLogger(HistoryLedgerHealthIndicator.class);
    private static final String NAME = "historyLedger";

    private final HistoryLedger ledger;
    private final int capacity;

    public HistoryLedgerHealthIndicator(HistoryLedger ledger, RunnerProperties properties) {
        this.ledger = ledger;
        this.capacity = properties.getHistory().getCapacity();
    }

    @Override
    public Publisher<HealthResult> getResult() {
        return Mono.fromCallable(this::checkLedgerHealth);
    }

    private HealthResult checkLedgerHealth() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("store", ledger.storeName());
        details.put("capacity", capacity);

        try {
            details.put("users", ledger.userCount());
            return HealthResult.builder(NAME, HealthStatus.UP).details(details).build();
        } catch (Exception e) {
            details.put("error", e.getClass().getSimpleName());
            details.put("message", e.getMessage());
            LOG.error("History ledger health check failed", e);
            return HealthResult.builder(NAME, HealthStatus.DOWN).details(details).build();
        }
    }
}
