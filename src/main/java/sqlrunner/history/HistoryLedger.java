package sqlrunner.history;

import sqlrunner.model.HistoryRecord;

import java.util.List;

/**
 * Per-user bounded log of execution attempts, newest first.
 *
 * <p>Implementations serialize mutations per user and return snapshot copies from
 * {@link #list(String)}, so a concurrent append never corrupts a read.
 */
public interface HistoryLedger {

    /**
     * Appends a record for the user, evicting the oldest entries beyond capacity.
     */
    void record(String user, HistoryRecord record);

    /**
     * @return the user's records, newest first, at most capacity entries
     */
    List<HistoryRecord> list(String user);

    /**
     * Removes every record of the user.
     */
    void clear(String user);

    /**
     * Number of users with at least one stored record.
     */
    int userCount();

    /**
     * Short name of the backing store, reported by the health endpoint.
     */
    String storeName();
}
