package sqlrunner.history;

import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sqlrunner.config.RunnerProperties;
import sqlrunner.model.HistoryRecord;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local ledger. Each user owns a bounded deque guarded by its own monitor.
 * Appends and clears go through the map's per-key atomic operations, so a cleared
 * user leaves no entry behind.
 */
@Singleton
@Requires(property = "runner.history.store", value = "memory", defaultValue = "memory")
public class InMemoryHistoryLedger implements HistoryLedger {

    private static final Logger LOG = LoggerFactory.getLogger(InMemoryHistoryLedger.class);

    private final Map<String, UserHistory> histories = new ConcurrentHashMap<>();
    private final int capacity;

    public InMemoryHistoryLedger(RunnerProperties properties) {
        this.capacity = properties.getHistory().getCapacity();
        LOG.info("In-memory history ledger initialized with capacity {}", capacity);
    }

    @Override
    public void record(String user, HistoryRecord record) {
        Objects.requireNonNull(user, "user");
        Objects.requireNonNull(record, "record");
        histories.compute(user, (u, history) -> {
            UserHistory target = history != null ? history : new UserHistory(capacity);
            target.add(record);
            return target;
        });
    }

    @Override
    public List<HistoryRecord> list(String user) {
        UserHistory history = histories.get(user);
        return history != null ? history.snapshot() : List.of();
    }

    @Override
    public void clear(String user) {
        histories.remove(user);
        LOG.debug("Cleared history for user {}", user);
    }

    @Override
    public int userCount() {
        return histories.size();
    }

    @Override
    public String storeName() {
        return "memory";
    }

    private static final class UserHistory {

        private final Deque<HistoryRecord> entries = new ArrayDeque<>();
        private final int capacity;

        UserHistory(int capacity) {
            this.capacity = capacity;
        }

        synchronized void add(HistoryRecord record) {
            entries.addFirst(record);
            while (entries.size() > capacity) {
                entries.removeLast();
            }
        }

        synchronized List<HistoryRecord> snapshot() {
            return List.copyOf(new ArrayList<>(entries));
        }
    }
}
