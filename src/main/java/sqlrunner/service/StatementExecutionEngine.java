package sqlrunner.service;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sqlrunner.config.RunnerProperties;
import sqlrunner.model.ClassifiedStatement;
import sqlrunner.model.ExecutionOutcome;
import sqlrunner.model.StatementCategory;
import sqlrunner.util.JdbcValues;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.Map;

/**
 * Executes one classified statement per call against the configured data source.
 *
 * <p>Each call owns exactly one connection: open, execute, commit or roll back, close.
 * The connection is closed on every path. Errors never escape; they come back as
 * {@link ExecutionOutcome.Failure}.
 */
@Singleton
public class StatementExecutionEngine {

    private static final Logger LOG = LoggerFactory.getLogger(StatementExecutionEngine.class);

    private final SessionConnections connections;
    private final MeterRegistry meterRegistry;
    private final RunnerProperties.ExecutionConfig executionConfig;
    private final long slowQueryThresholdMs;

    public StatementExecutionEngine(
            SessionConnections connections,
            MeterRegistry meterRegistry,
            RunnerProperties properties) {
        this.connections = connections;
        this.meterRegistry = meterRegistry;
        this.executionConfig = properties.getExecution();
        this.slowQueryThresholdMs = properties.getSqlLogging().getSlowQueryThresholdMs();
    }

    /**
     * Executes the statement and converts the driver result into an outcome.
     *
     * @param statement classified statement
     * @return outcome, never null
     */
    public ExecutionOutcome execute(ClassifiedStatement statement) {
        Timer.Sample sample = Timer.start(meterRegistry);
        long startNanos = System.nanoTime();

        ExecutionOutcome outcome;
        try {
            outcome = executeInTransaction(statement);
        } catch (SQLException e) {
            LOG.warn("Statement failed [{}]: {}", statement.category(), e.getMessage());
            outcome = new ExecutionOutcome.Failure(messageOf(e));
        } catch (Exception e) {
            LOG.error("Unexpected error executing {} statement", statement.category(), e);
            outcome = new ExecutionOutcome.Failure(messageOf(e));
        }

        long durationMs = (System.nanoTime() - startNanos) / 1_000_000;
        if (durationMs >= slowQueryThresholdMs) {
            LOG.warn("Slow statement [{}] took {} ms", statement.category(), durationMs);
        } else {
            LOG.debug("Statement [{}] completed in {} ms", statement.category(), durationMs);
        }

        sample.stop(Timer.builder("runner.sql.execution")
                .tag("category", statement.category().name())
                .tag("status", outcome.isSuccess() ? "success" : "error")
                .register(meterRegistry));

        return outcome;
    }

    private ExecutionOutcome executeInTransaction(ClassifiedStatement statement) throws SQLException {
        Connection connection = connections.acquire();
        try {
            connection.setAutoCommit(false);
            try {
                ExecutionOutcome outcome = executeOnce(connection, statement);
                if (statement.category().isQuery()) {
                    // nothing to keep from a read
                    connection.rollback();
                } else {
                    connection.commit();
                }
                return outcome;
            } catch (SQLException | RuntimeException e) {
                rollbackQuietly(connection, e);
                throw e;
            }
        } finally {
            // OTHER covers SET and similar statements that can change session settings
            connections.release(connection, statement.category() == StatementCategory.OTHER);
        }
    }

    private ExecutionOutcome executeOnce(Connection connection, ClassifiedStatement statement) throws SQLException {
        try (Statement jdbcStatement = connection.createStatement()) {
            if (executionConfig.getQueryTimeoutSeconds() > 0) {
                jdbcStatement.setQueryTimeout(executionConfig.getQueryTimeoutSeconds());
            }

            LOG.debug("Executing {}: {}", statement.category(), statement.text());
            boolean hasResultSet = jdbcStatement.execute(statement.text());

            if (statement.category().isQuery()) {
                return hasResultSet
                        ? readRowSet(jdbcStatement.getResultSet())
                        : new ExecutionOutcome.RowSet(List.of(), List.of(), false);
            }

            int affected = Math.max(0, jdbcStatement.getUpdateCount());
            return new ExecutionOutcome.StatusResult(
                    statement.category(), statusMessage(statement, affected), affected);
        }
    }

    private ExecutionOutcome.RowSet readRowSet(ResultSet resultSet) throws SQLException {
        try (ResultSet rs = resultSet) {
            List<String> columns = JdbcValues.columnLabels(rs.getMetaData());
            int cap = executionConfig.getMaxResultRows();
            if (cap <= 0) {
                return new ExecutionOutcome.RowSet(columns, JdbcValues.readRows(rs, columns, 0), false);
            }

            List<Map<String, Object>> rows = JdbcValues.readRows(rs, columns, probeLimit(cap));
            boolean truncated = rows.size() > cap;
            if (truncated) {
                LOG.warn("Result truncated to {} rows", cap);
                rows = rows.subList(0, cap);
            }
            return new ExecutionOutcome.RowSet(columns, rows, truncated);
        }
    }

    /**
     * Rows to read for a positive cap: one past it, so a cut-off result can be detected.
     */
    static int probeLimit(int cap) {
        return cap == Integer.MAX_VALUE ? cap : cap + 1;
    }

    /**
     * Builds the category specific status message for a successful write or DDL statement.
     */
    static String statusMessage(ClassifiedStatement statement, int affected) {
        return switch (statement.category()) {
            case CREATE_TABLE -> "Table '" + statement.tableNameOrPlaceholder() + "' created successfully!";
            case CREATE_INDEX -> "Index created successfully!";
            case DROP_TABLE -> "Table '" + statement.tableNameOrPlaceholder() + "' dropped successfully!";
            case ALTER_TABLE -> "Table altered successfully!";
            case INSERT -> "Successfully inserted " + affected + " row(s)!";
            case UPDATE -> "Successfully updated " + affected + " row(s)!";
            case DELETE -> "Successfully deleted " + affected + " row(s)!";
            case OTHER, SELECT -> "Query executed successfully. " + affected + " row(s) affected.";
        };
    }

    private void rollbackQuietly(Connection connection, Exception cause) {
        try {
            connection.rollback();
        } catch (SQLException rollbackError) {
            LOG.warn("Rollback failed: {}", rollbackError.getMessage());
            cause.addSuppressed(rollbackError);
        }
    }

    private static String messageOf(Exception e) {
        String message = e.getMessage();
        return message != null && !message.isBlank() ? message : e.getClass().getSimpleName();
    }
}
