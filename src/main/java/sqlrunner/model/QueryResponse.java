package sqlrunner.model;

import io.micronaut.core.annotation.Nullable;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Response body for a single statement execution.
 * Provides a consistent shape regardless of statement category.
 */
public class QueryResponse {

    private final boolean success;
    private final List<String> columns;
    private final List<Map<String, Object>> rows;
    private final boolean truncated;
    private final StatementCategory category;
    private final String message;
    private final Integer affectedRows;
    private final String error;
    private final double executionTime;

    private QueryResponse(
            boolean success,
            @Nullable List<String> columns,
            @Nullable List<Map<String, Object>> rows,
            boolean truncated,
            @Nullable StatementCategory category,
            @Nullable String message,
            @Nullable Integer affectedRows,
            @Nullable String error,
            double executionTime) {
        this.success = success;
        this.columns = columns;
        this.rows = rows;
        this.truncated = truncated;
        this.category = category;
        this.message = message;
        this.affectedRows = affectedRows;
        this.error = error;
        this.executionTime = executionTime;
    }

    /**
     * Creates a response carrying rows of a read query.
     *
     * @param columns       column names
     * @param rows          result rows
     * @param truncated     whether the row cap was hit
     * @param executionTime seconds spent classifying and executing
     * @return QueryResponse for a row set
     */
    public static QueryResponse forRows(List<String> columns, List<Map<String, Object>> rows,
                                        boolean truncated, double executionTime) {
        return new QueryResponse(true, columns, rows, truncated, null, null, null, null, executionTime);
    }

    /**
     * Creates a response for write and DDL statements.
     *
     * @param category      statement category
     * @param message       human readable status
     * @param affectedRows  engine reported row count
     * @param executionTime seconds spent classifying and executing
     * @return QueryResponse for a status result
     */
    public static QueryResponse forStatus(StatementCategory category, String message,
                                          int affectedRows, double executionTime) {
        return new QueryResponse(true, null, null, false, category, message, affectedRows, null, executionTime);
    }

    /**
     * Creates an error response.
     *
     * @param error         error text
     * @param executionTime seconds spent classifying and executing
     * @return QueryResponse indicating failure
     */
    public static QueryResponse forError(String error, double executionTime) {
        return new QueryResponse(false, null, null, false, null, null, null, error, executionTime);
    }

    public boolean isSuccess() {
        return success;
    }

    public List<String> getColumns() {
        return columns;
    }

    public List<Map<String, Object>> getRows() {
        return rows;
    }

    public boolean isTruncated() {
        return truncated;
    }

    public StatementCategory getCategory() {
        return category;
    }

    public String getMessage() {
        return message;
    }

    public Integer getAffectedRows() {
        return affectedRows;
    }

    public String getError() {
        return error;
    }

    public double getExecutionTime() {
        return executionTime;
    }

    /**
     * Converts this response to a Map for JSON serialization.
     *
     * @return Map representation of this response
     */
    public Map<String, Object> toMap() {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("success", success);

        if (rows != null) {
            result.put("columns", columns);
            result.put("rows", rows);
            if (truncated) {
                result.put("truncated", true);
            }
        }

        if (category != null) {
            result.put("category", category.name());
        }

        if (message != null) {
            result.put("message", message);
        }

        if (affectedRows != null) {
            result.put("affected_rows", affectedRows);
        }

        if (error != null) {
            result.put("error", error);
        }

        result.put("execution_time", executionTime);
        return result;
    }

    @Override
    public String toString() {
        return "QueryResponse{" +
                "success=" + success +
                ", category=" + category +
                ", affectedRows=" + affectedRows +
                ", rowCount=" + (rows != null ? rows.size() : 0) +
                '}';
    }
}
