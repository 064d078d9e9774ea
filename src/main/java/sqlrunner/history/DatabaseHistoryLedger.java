package sqlrunner.history;

import io.micronaut.context.annotation.Requires;
import jakarta.annotation.PostConstruct;
import jakarta.inject.Singleton;
import org.apache.ibatis.session.SqlSession;
import org.apache.ibatis.session.SqlSessionFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sqlrunner.config.RunnerProperties;
import sqlrunner.exception.SqlExecutionException;
import sqlrunner.model.HistoryRecord;

import java.util.List;
import java.util.Objects;

/**
 * Ledger persisted in the query_history table through {@link HistoryMapper}.
 * Survives restarts when the data source does.
 */
@Singleton
@Requires(property = "runner.history.store", value = "database")
public class DatabaseHistoryLedger implements HistoryLedger {

    private static final Logger LOG = LoggerFactory.getLogger(DatabaseHistoryLedger.class);
    private static final int LOCK_STRIPES = 64;

    private final SqlSessionFactory sqlSessionFactory;
    private final int capacity;
    private final Object[] userLocks = new Object[LOCK_STRIPES];

    public DatabaseHistoryLedger(SqlSessionFactory sqlSessionFactory, RunnerProperties properties) {
        this.sqlSessionFactory = sqlSessionFactory;
        this.capacity = properties.getHistory().getCapacity();
        for (int i = 0; i < userLocks.length; i++) {
            userLocks[i] = new Object();
        }
    }

    @PostConstruct
    void ensureSchema() {
        try (SqlSession session = sqlSessionFactory.openSession(true)) {
            HistoryMapper mapper = session.getMapper(HistoryMapper.class);
            mapper.createTable();
            mapper.createIndex();
            LOG.info("Database history ledger ready (capacity {})", capacity);
        } catch (RuntimeException e) {
            throw new SqlExecutionException("history.init", "Failed to prepare query_history table", e);
        }
    }

    @Override
    public void record(String user, HistoryRecord record) {
        Objects.requireNonNull(user, "user");
        Objects.requireNonNull(record, "record");
        synchronized (lockFor(user)) {
            try (SqlSession session = sqlSessionFactory.openSession()) {
                HistoryMapper mapper = session.getMapper(HistoryMapper.class);
                mapper.insert(HistoryRow.from(user, record));
                Long overflowId = mapper.findOverflowId(user, capacity);
                if (overflowId != null) {
                    int pruned = mapper.deleteUpTo(user, overflowId);
                    LOG.debug("Pruned {} history rows for user {}", pruned, user);
                }
                session.commit();
            } catch (RuntimeException e) {
                throw new SqlExecutionException("history.record", "Failed to record history", e);
            }
        }
    }

    @Override
    public List<HistoryRecord> list(String user) {
        try (SqlSession session = sqlSessionFactory.openSession(true)) {
            return session.getMapper(HistoryMapper.class).findRecent(user, capacity).stream()
                    .map(HistoryRow::toRecord)
                    .toList();
        } catch (RuntimeException e) {
            throw new SqlExecutionException("history.list", "Failed to read history", e);
        }
    }

    @Override
    public void clear(String user) {
        synchronized (lockFor(user)) {
            try (SqlSession session = sqlSessionFactory.openSession()) {
                int deleted = session.getMapper(HistoryMapper.class).deleteByUser(user);
                session.commit();
                LOG.debug("Cleared {} history rows for user {}", deleted, user);
            } catch (RuntimeException e) {
                throw new SqlExecutionException("history.clear", "Failed to clear history", e);
            }
        }
    }

    @Override
    public int userCount() {
        try (SqlSession session = sqlSessionFactory.openSession(true)) {
            return session.getMapper(HistoryMapper.class).countUsers();
        }
    }

    @Override
    public String storeName() {
        return "database";
    }

    // fixed stripes: users sharing a stripe only serialize with each other
    private Object lockFor(String user) {
        return userLocks[stripeOf(user)];
    }

    static int stripeOf(String user) {
        return Math.floorMod(user.hashCode(), LOCK_STRIPES);
    }
}
