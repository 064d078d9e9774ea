package sqlrunner.model;

import io.micronaut.core.annotation.Nullable;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One entry of a user's execution history. Immutable once created.
 *
 * @param query        statement text as submitted
 * @param timestamp    when the attempt was recorded
 * @param success      whether the outcome was a success variant
 * @param error        failure text, null on success
 * @param rowsAffected affected rows for writes, returned rows for reads, null on failure
 */
public record HistoryRecord(
        String query,
        Instant timestamp,
        boolean success,
        @Nullable String error,
        @Nullable Integer rowsAffected
) {

    public HistoryRecord {
        Objects.requireNonNull(query, "query");
        Objects.requireNonNull(timestamp, "timestamp");
    }

    /**
     * Derives a history entry from an execution outcome.
     */
    public static HistoryRecord of(String query, ExecutionOutcome outcome, Clock clock) {
        Instant now = clock.instant();
        if (outcome instanceof ExecutionOutcome.Failure failure) {
            return new HistoryRecord(query, now, false, failure.message(), null);
        }
        if (outcome instanceof ExecutionOutcome.StatusResult status) {
            return new HistoryRecord(query, now, true, null, status.affectedRows());
        }
        ExecutionOutcome.RowSet rowSet = (ExecutionOutcome.RowSet) outcome;
        return new HistoryRecord(query, now, true, null, rowSet.rows().size());
    }

    public Map<String, Object> toMap() {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("query", query);
        result.put("timestamp", timestamp.toString());
        result.put("success", success);
        result.put("error", error);
        result.put("rows_affected", rowsAffected);
        return result;
    }
}
