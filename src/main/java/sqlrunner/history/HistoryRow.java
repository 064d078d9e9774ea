package sqlrunner.history;

import sqlrunner.model.HistoryRecord;

import java.time.Instant;

/**
 * Row model for the query_history table; columns are mapped in {@link HistoryMapper}.
 */
public class HistoryRow {
    private Long id;
    private String username;
    private String queryText;
    private boolean success;
    private String errorMessage;
    private Integer rowsAffected;
    private Instant executedAt;

    public HistoryRow() {}

    static HistoryRow from(String username, HistoryRecord record) {
        HistoryRow row = new HistoryRow();
        row.setUsername(username);
        row.setQueryText(record.query());
        row.setSuccess(record.success());
        row.setErrorMessage(record.error());
        row.setRowsAffected(record.rowsAffected());
        row.setExecutedAt(record.timestamp());
        return row;
    }

    HistoryRecord toRecord() {
        return new HistoryRecord(queryText, executedAt, success, errorMessage, rowsAffected);
    }

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public String getUsername() {
        return username;
    }

    public void setUsername(String username) {
        this.username = username;
    }

    public String getQueryText() {
        return queryText;
    }

    public void setQueryText(String queryText) {
        this.queryText = queryText;
    }

    public boolean isSuccess() {
        return success;
    }

    public void setSuccess(boolean success) {
        this.success = success;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public void setErrorMessage(String errorMessage) {
        this.errorMessage = errorMessage;
    }

    public Integer getRowsAffected() {
        return rowsAffected;
    }

    public void setRowsAffected(Integer rowsAffected) {
        this.rowsAffected = rowsAffected;
    }

    public Instant getExecutedAt() {
        return executedAt;
    }

    public void setExecutedAt(Instant executedAt) {
        this.executedAt = executedAt;
    }
}
