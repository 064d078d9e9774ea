package sqlrunner.service;

import jakarta.inject.Singleton;
import sqlrunner.model.ExecutionOutcome;
import sqlrunner.model.QueryResponse;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Maps execution outcomes to response bodies.
 */
@Singleton
public class ResultFormatter {

    /**
     * Formats an outcome. Never fails.
     *
     * @param outcome       engine outcome
     * @param executionTime seconds spent classifying and executing
     * @return response for the caller
     */
    public QueryResponse format(ExecutionOutcome outcome, double executionTime) {
        if (outcome instanceof ExecutionOutcome.RowSet rowSet) {
            return QueryResponse.forRows(columnsOf(rowSet), rowSet.rows(), rowSet.truncated(), executionTime);
        }
        if (outcome instanceof ExecutionOutcome.StatusResult status) {
            return QueryResponse.forStatus(status.category(), status.message(), status.affectedRows(), executionTime);
        }
        ExecutionOutcome.Failure failure = (ExecutionOutcome.Failure) outcome;
        return QueryResponse.forError(failure.message(), executionTime);
    }

    // column order follows the first row; an empty result has no columns
    private static List<String> columnsOf(ExecutionOutcome.RowSet rowSet) {
        if (rowSet.rows().isEmpty()) {
            return List.of();
        }
        Map<String, Object> first = rowSet.rows().get(0);
        return new ArrayList<>(first.keySet());
    }
}
