package sqlrunner.service;

import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sqlrunner.classifier.StatementClassifier;
import sqlrunner.history.HistoryLedger;
import sqlrunner.model.ClassifiedStatement;
import sqlrunner.model.ExecutionOutcome;
import sqlrunner.model.HistoryRecord;
import sqlrunner.model.QueryResponse;
import sqlrunner.model.TableSchema;

import java.time.Clock;
import java.util.List;

/**
 * Entry point for running statements and browsing history and schema.
 *
 * <p>Every accepted statement produces exactly one response and exactly one history
 * record, whatever the outcome. History write failures are logged and do not
 * affect the response.
 */
@Singleton
public class QueryRunnerService {

    private static final Logger LOG = LoggerFactory.getLogger(QueryRunnerService.class);

    private final StatementClassifier classifier;
    private final StatementExecutionEngine engine;
    private final ResultFormatter formatter;
    private final HistoryLedger ledger;
    private final SchemaIntrospector introspector;
    private final Clock clock = Clock.systemUTC();

    public QueryRunnerService(
            StatementClassifier classifier,
            StatementExecutionEngine engine,
            ResultFormatter formatter,
            HistoryLedger ledger,
            SchemaIntrospector introspector) {
        this.classifier = classifier;
        this.engine = engine;
        this.formatter = formatter;
        this.ledger = ledger;
        this.introspector = introspector;
    }

    /**
     * Classifies, executes and records one statement on behalf of a user.
     *
     * @param user identity owning the history entry
     * @param text raw SQL text
     * @return formatted response; failures are reported in the body, not thrown
     * @throws IllegalArgumentException if the text is null or blank
     */
    public QueryResponse executeStatement(String user, String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Query cannot be empty");
        }

        long start = System.nanoTime();
        ClassifiedStatement statement = classifier.classify(text);
        ExecutionOutcome outcome = engine.execute(statement);
        double executionTime = (System.nanoTime() - start) / 1_000_000_000.0;

        QueryResponse response = formatter.format(outcome, executionTime);
        LOG.info("User {} ran {} statement: success={} ({} s)",
                user, statement.category(), outcome.isSuccess(), executionTime);

        try {
            ledger.record(user, HistoryRecord.of(statement.text(), outcome, clock));
        } catch (RuntimeException e) {
            LOG.warn("Failed to record history for user {}: {}", user, e.getMessage());
        }
        return response;
    }

    public List<HistoryRecord> getHistory(String user) {
        return ledger.list(user);
    }

    public void clearHistory(String user) {
        ledger.clear(user);
        LOG.info("History cleared for user {}", user);
    }

    public List<String> listTables() {
        return introspector.listTables();
    }

    /**
     * @throws sqlrunner.exception.TableNotFoundException if the table does not exist
     */
    public TableSchema describeTable(String name) {
        return introspector.describeTable(name);
    }
}
