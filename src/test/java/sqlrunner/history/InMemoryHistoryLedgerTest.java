package sqlrunner.history;

import org.junit.jupiter.api.Test;
import sqlrunner.config.RunnerProperties;
import sqlrunner.model.HistoryRecord;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

class InMemoryHistoryLedgerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:15:30Z");

    private InMemoryHistoryLedger ledger(int capacity) {
        RunnerProperties properties = new RunnerProperties();
        properties.getHistory().setCapacity(capacity);
        return new InMemoryHistoryLedger(properties);
    }

    private static HistoryRecord record(String query) {
        return new HistoryRecord(query, NOW, true, null, 0);
    }

    @Test
    void testListReturnsNewestFirst() {
        InMemoryHistoryLedger ledger = ledger(10);
        ledger.record("alice", record("q1"));
        ledger.record("alice", record("q2"));

        assertThat(ledger.list("alice")).extracting(HistoryRecord::query).containsExactly("q2", "q1");
    }

    @Test
    void testOldestEntriesAreEvictedBeyondCapacity() {
        InMemoryHistoryLedger ledger = ledger(3);
        for (int i = 1; i <= 5; i++) {
            ledger.record("alice", record("q" + i));
        }

        assertThat(ledger.list("alice")).extracting(HistoryRecord::query).containsExactly("q5", "q4", "q3");
    }

    @Test
    void testUnknownUserHasEmptyHistory() {
        assertThat(ledger(3).list("nobody")).isEmpty();
    }

    @Test
    void testClearOnlyAffectsThatUser() {
        InMemoryHistoryLedger ledger = ledger(3);
        ledger.record("alice", record("a"));
        ledger.record("bob", record("b"));

        ledger.clear("alice");

        assertThat(ledger.list("alice")).isEmpty();
        assertThat(ledger.list("bob")).hasSize(1);
        assertThat(ledger.userCount()).isEqualTo(1);
    }

    @Test
    void testClearReleasesTheUserEntry() {
        InMemoryHistoryLedger ledger = ledger(3);
        for (int i = 0; i < 100; i++) {
            String user = "transient-" + i;
            ledger.record(user, record("q"));
            ledger.clear(user);
        }

        assertThat(ledger.userCount()).isZero();

        ledger.record("transient-0", record("again"));
        assertThat(ledger.list("transient-0")).extracting(HistoryRecord::query).containsExactly("again");
        assertThat(ledger.userCount()).isEqualTo(1);
    }

    @Test
    void testConcurrentRecordAndClearNeverExceedCap() throws Exception {
        InMemoryHistoryLedger ledger = ledger(5);
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < 4; t++) {
                int thread = t;
                futures.add(executor.submit(() -> {
                    for (int i = 0; i < 500; i++) {
                        if (thread == 0 && i % 10 == 0) {
                            ledger.clear("churn");
                        } else {
                            ledger.record("churn", record("q" + i));
                        }
                        assertThat(ledger.list("churn").size()).isLessThanOrEqualTo(5);
                    }
                }));
            }
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void testListReturnsSnapshot() {
        InMemoryHistoryLedger ledger = ledger(3);
        ledger.record("alice", record("a"));

        List<HistoryRecord> snapshot = ledger.list("alice");
        ledger.record("alice", record("b"));

        assertThat(snapshot).hasSize(1);
        assertThatThrownBy(() -> snapshot.add(record("c"))).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void testConcurrentAppendsKeepCapAndLoseNothingWithinCap() throws Exception {
        int threads = 8;
        int perThread = 200;
        InMemoryHistoryLedger ledger = ledger(threads * perThread);
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();

        try {
            for (int t = 0; t < threads; t++) {
                int thread = t;
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        ledger.record("shared", record("t" + thread + "-" + i));
                        ledger.list("shared");
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(ledger.list("shared")).hasSize(threads * perThread).doesNotHaveDuplicates();
    }

    @Test
    void testConcurrentAppendsNeverExceedCap() throws Exception {
        InMemoryHistoryLedger ledger = ledger(5);
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < 4; t++) {
                futures.add(executor.submit(() -> {
                    for (int i = 0; i < 500; i++) {
                        ledger.record("busy", record("q" + i));
                        assertThat(ledger.list("busy").size()).isLessThanOrEqualTo(5);
                    }
                }));
            }
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(ledger.list("busy")).hasSize(5);
    }
}
