package sqlrunner.model;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Result of one statement execution. Exactly one variant is produced per call.
 */
public sealed interface ExecutionOutcome
        permits ExecutionOutcome.RowSet, ExecutionOutcome.StatusResult, ExecutionOutcome.Failure {

    boolean isSuccess();

    /**
     * Rows returned by a read query.
     *
     * @param columns   column labels in result order
     * @param rows      one ordered map per row, keyed by column label
     * @param truncated true when the row cap cut the result short
     */
    record RowSet(List<String> columns, List<Map<String, Object>> rows, boolean truncated)
            implements ExecutionOutcome {

        public RowSet {
            columns = List.copyOf(columns);
            rows = List.copyOf(rows);
        }

        @Override
        public boolean isSuccess() {
            return true;
        }
    }

    /**
     * Outcome of a write or DDL statement.
     */
    record StatusResult(StatementCategory category, String message, int affectedRows)
            implements ExecutionOutcome {

        public StatusResult {
            Objects.requireNonNull(category, "category");
            Objects.requireNonNull(message, "message");
            if (affectedRows < 0) {
                throw new IllegalArgumentException("affectedRows must be >= 0: " + affectedRows);
            }
        }

        @Override
        public boolean isSuccess() {
            return true;
        }
    }

    /**
     * Any failed execution. The message is the underlying error text.
     */
    record Failure(String message) implements ExecutionOutcome {

        public Failure {
            Objects.requireNonNull(message, "message");
        }

        @Override
        public boolean isSuccess() {
            return false;
        }
    }
}
